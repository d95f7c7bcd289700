package io.querybridge.core.error;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import io.querybridge.core.model.RawResult;
import java.io.IOException;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("ErrorMapper")
class ErrorMapperTest {

    private static final ErrorContext SQL_QUERY = ErrorContext.of("sql", "query");

    private ErrorMapper mapper;

    @BeforeEach
    void setUp() {
        mapper = new ErrorMapper();
    }

    @Nested
    @DisplayName("built-in rules")
    class BuiltIn {

        @Test
        @DisplayName("refused connections are retryable network errors")
        void network() {
            TransformedError error = mapper.map(new IOException("connect ECONNREFUSED 127.0.0.1:5432"), SQL_QUERY);

            assertThat(error.category()).isEqualTo(ErrorCategory.NETWORK);
            assertThat(error.code()).isEqualTo("NETWORK_ERROR");
            assertThat(error.message())
                    .isEqualTo("Unable to connect to the data source. Please check your network connection.");
            assertThat(error.technical()).isEqualTo("connect ECONNREFUSED 127.0.0.1:5432");
            assertThat(error.isRetryable()).isTrue();
            assertThat(error.retryInfo().maxAttempts()).isEqualTo(3);
            assertThat(error.retryInfo().backoffMs()).isEqualTo(2_000);
            assertThat(error.suggestions()).contains("Check your internet connection");
        }

        @Test
        @DisplayName("messages deep in the cause chain are matched case-insensitively")
        void causeChain() {
            RuntimeException wrapped =
                    new RuntimeException("request failed", new IllegalStateException("HTTP 401 UNAUTHORIZED"));

            TransformedError error = mapper.map(wrapped, ErrorContext.of("api", "query"));

            assertThat(error.code()).isEqualTo("AUTH_ERROR");
            assertThat(error.recoverable()).isFalse();
            assertThat(error.retryInfo()).isNull();
        }

        @Test
        @DisplayName("forbidden responses are authorization errors")
        void authorization() {
            assertThat(mapper.map(new RuntimeException("403 Forbidden"), SQL_QUERY).code())
                    .isEqualTo("ACCESS_DENIED");
        }

        @Test
        @DisplayName("timeouts are warnings with their own retry policy")
        void timeout() {
            TransformedError error = mapper.map(new RuntimeException("Read timed out"), SQL_QUERY);

            assertThat(error.category()).isEqualTo(ErrorCategory.TIMEOUT);
            assertThat(error.severity()).isEqualTo(ErrorSeverity.WARNING);
            assertThat(error.retryInfo().maxAttempts()).isEqualTo(2);
            assertThat(error.retryInfo().backoffMs()).isEqualTo(5_000);
        }

        @Test
        @DisplayName("validation messages echo the raw problem")
        void validation() {
            TransformedError error = mapper.map(new IllegalArgumentException("Invalid page size"), SQL_QUERY);

            assertThat(error.code()).isEqualTo("VALIDATION_ERROR");
            assertThat(error.message()).isEqualTo("Validation error: Invalid page size");
        }

        @Test
        @DisplayName("typed configuration errors name the offending field")
        void configValidation() {
            TransformedError error =
                    mapper.map(new ConfigValidationException("must be positive", "pageSize"), SQL_QUERY);

            assertThat(error.code()).isEqualTo(ConfigValidationException.CODE);
            assertThat(error.message()).isEqualTo("Invalid value for field 'pageSize': must be positive");
        }

        @Test
        @DisplayName("typed errors keep their code and their own retryability")
        void typedError() {
            TransformedError error = mapper.map(
                    new QueryExecutionException("relation \"items\" does not exist", "SQL_QUERY_FAILED", null),
                    SQL_QUERY);

            assertThat(error.category()).isEqualTo(ErrorCategory.DATA);
            assertThat(error.code()).isEqualTo("SQL_QUERY_FAILED");
            assertThat(error.recoverable()).isFalse();
            assertThat(error.isRetryable()).isFalse();
        }

        @Test
        @DisplayName("typed connection errors stay retryable")
        void typedConnection() {
            TransformedError error = mapper.map(
                    new ConnectionFailedException("refused", "SQL_CONNECTION_FAILED", null), SQL_QUERY);

            assertThat(error.category()).isEqualTo(ErrorCategory.CONNECTION);
            assertThat(error.isRetryable()).isTrue();
        }

        @Test
        @DisplayName("unmatched errors become UNKNOWN_ERROR")
        void unknown() {
            TransformedError error = mapper.map(new IllegalStateException("kaboom"), SQL_QUERY);

            assertThat(error.category()).isEqualTo(ErrorCategory.UNKNOWN);
            assertThat(error.code()).isEqualTo("UNKNOWN_ERROR");
            assertThat(error.message()).isEqualTo("An unexpected error occurred");
            assertThat(error.technical()).isEqualTo("kaboom");
        }

        @Test
        @DisplayName("errors without a message are described by their type")
        void noMessage() {
            assertThat(mapper.map(new NullPointerException(), SQL_QUERY).technical())
                    .isEqualTo("NullPointerException");
        }

        @Test
        @DisplayName("classified failures pass through unchanged")
        void alreadyClassified() {
            TransformedError original = TransformedError.builder(ErrorCategory.SECURITY, "SQL_INJECTION")
                    .message("blocked")
                    .build();
            DataSourceFailureException failure = new DataSourceFailureException(original, null);

            assertThat(mapper.map(failure, SQL_QUERY)).isSameAs(original);
            assertThat(mapper.toFailure(failure, SQL_QUERY)).isSameAs(failure);
        }

        @Test
        @DisplayName("toFailure wraps the classified error and keeps the cause")
        void toFailure() {
            IOException cause = new IOException("network unreachable");

            DataSourceFailureException failure = mapper.toFailure(cause, SQL_QUERY);

            assertThat(failure.error().code()).isEqualTo("NETWORK_ERROR");
            assertThat(failure).hasCause(cause);
            assertThat(failure.retryable()).isTrue();
        }
    }

    @Nested
    @DisplayName("recovery")
    class Recovery {

        private final RawResult salvaged =
                new RawResult("1", JsonNodeFactory.instance.objectNode().put("name", "pen"), 1.0, List.of(), null);

        @Test
        @DisplayName("transformation failures recover with the partial results of the context")
        void partialResults() {
            ErrorContext context = ErrorContext.of("transformation", "map").withPartialResults(List.of(salvaged));

            TransformedError error = mapper.map(new IllegalStateException("kaboom"), context);

            assertThat(error.code()).isEqualTo("TRANSFORM_ERROR");
            assertThat(error.partialResults()).containsExactly(salvaged);
            assertThat(error.message()).isEqualTo("Some results may be incomplete due to processing errors");
            assertThat(mapper.stats().successfulRecoveries()).isEqualTo(1);
        }

        @Test
        @DisplayName("network retry never recovers by itself")
        void networkRetry() {
            TransformedError error = mapper.map(new RuntimeException("network down"), SQL_QUERY);

            assertThat(error.partialResults()).isEmpty();
            assertThat(mapper.stats().recoveryAttempts()).isEqualTo(1);
            assertThat(mapper.stats().successfulRecoveries()).isZero();
        }

        @Test
        @DisplayName("a throwing strategy is skipped")
        void throwingStrategy() {
            ErrorMapper custom = new ErrorMapper(BuiltInErrorRules.all(), List.of());
            custom.addRecoveryStrategy(new RecoveryStrategy() {
                @Override
                public String name() {
                    return "broken";
                }

                @Override
                public Set<ErrorCategory> applicableCategories() {
                    return Set.of(ErrorCategory.DATA);
                }

                @Override
                public RecoveryResult recover(TransformedError error, ErrorContext context) {
                    throw new IllegalStateException("strategy bug");
                }
            });
            custom.addRecoveryStrategy(DefaultRecoveryStrategies.partialResults());

            TransformedError error = custom.map(
                    new RuntimeException("database is locked"), SQL_QUERY.withPartialResults(List.of(salvaged)));

            assertThat(error.code()).isEqualTo("DATA_SOURCE_ERROR");
            assertThat(error.partialResults()).containsExactly(salvaged);
        }
    }

    @Nested
    @DisplayName("custom rules")
    class CustomRules {

        @Test
        @DisplayName("a higher-priority rule wins over the built-ins")
        void priority() {
            mapper.addRule(ErrorRule.builder()
                    .name("quota")
                    .priority(150)
                    .matchMessage("quota")
                    .transform((error, context) -> TransformedError.builder(ErrorCategory.SECURITY, "QUOTA")
                            .message("Quota exhausted")
                            .build()));

            assertThat(mapper.map(new RuntimeException("network quota exceeded"), SQL_QUERY).code())
                    .isEqualTo("QUOTA");
        }

        @Test
        @DisplayName("equal priorities keep insertion order")
        void insertionOrder() {
            ErrorMapper custom = new ErrorMapper(List.of(), List.of());
            custom.addRule(ErrorRule.builder().name("first").matchType(IllegalStateException.class)
                    .transform((e, c) -> TransformedError.builder(ErrorCategory.DATA, "FIRST").build()));
            custom.addRule(ErrorRule.builder().name("second").matchType(RuntimeException.class)
                    .transform((e, c) -> TransformedError.builder(ErrorCategory.DATA, "SECOND").build()));

            assertThat(custom.map(new IllegalStateException("x"), SQL_QUERY).code()).isEqualTo("FIRST");
            assertThat(custom.rules()).extracting(ErrorRule::name).containsExactly("first", "second");
        }

        @Test
        @DisplayName("a throwing matcher is skipped")
        void throwingMatcher() {
            ErrorMapper custom = new ErrorMapper(List.of(), List.of());
            custom.addRule(ErrorRule.builder().name("broken").priority(10)
                    .match((e, c) -> {
                        throw new IllegalStateException("matcher bug");
                    })
                    .transform((e, c) -> TransformedError.builder(ErrorCategory.DATA, "BROKEN").build()));
            custom.addRule(ErrorRule.builder().name("fallback").priority(1).matchMessage("x")
                    .transform((e, c) -> TransformedError.builder(ErrorCategory.DATA, "FALLBACK").build()));

            assertThat(custom.map(new RuntimeException("x"), SQL_QUERY).code()).isEqualTo("FALLBACK");
        }

        @Test
        @DisplayName("a rule needs a matcher")
        void needsMatcher() {
            assertThatThrownBy(() -> ErrorRule.builder().name("empty")
                            .transform((e, c) -> TransformedError.builder(ErrorCategory.DATA, "X").build()))
                    .isInstanceOf(IllegalStateException.class);
        }
    }

    @Nested
    @DisplayName("statistics")
    class Statistics {

        @Test
        @DisplayName("counts by category and severity")
        void counts() {
            mapper.map(new RuntimeException("network down"), SQL_QUERY);
            mapper.map(new RuntimeException("network flapping"), SQL_QUERY);
            mapper.map(new RuntimeException("timed out"), SQL_QUERY);

            ErrorStats stats = mapper.stats();

            assertThat(stats.totalErrors()).isEqualTo(3);
            assertThat(stats.byCategory())
                    .containsEntry(ErrorCategory.NETWORK, 2L)
                    .containsEntry(ErrorCategory.TIMEOUT, 1L)
                    .doesNotContainKey(ErrorCategory.DATA);
            assertThat(stats.bySeverity())
                    .containsEntry(ErrorSeverity.ERROR, 2L)
                    .containsEntry(ErrorSeverity.WARNING, 1L);
            assertThat(stats.mostCommonCategory()).contains(ErrorCategory.NETWORK);
            assertThat(stats.recoveryRate()).isZero();
        }

        @Test
        @DisplayName("reset clears every counter")
        void reset() {
            mapper.map(new RuntimeException("network down"), SQL_QUERY);

            mapper.resetStats();

            ErrorStats stats = mapper.stats();
            assertThat(stats.totalErrors()).isZero();
            assertThat(stats.byCategory()).isEmpty();
            assertThat(stats.mostCommonCategory()).isEmpty();
        }
    }

    @Nested
    @DisplayName("TransformedErrors")
    class Helpers {

        private final TransformedError network =
                TransformedError.builder(ErrorCategory.NETWORK, "N").message("net").build();
        private final TransformedError timeout = TransformedError.builder(ErrorCategory.TIMEOUT, "T")
                .message("slow")
                .severity(ErrorSeverity.WARNING)
                .build();

        @Test
        @DisplayName("summaries count errors per category in first-seen order")
        void summarize() {
            assertThat(TransformedErrors.summarize(List.of())).isEqualTo("No errors");
            assertThat(TransformedErrors.summarize(List.of(network))).isEqualTo("net");
            assertThat(TransformedErrors.summarize(List.of(network, timeout, network)))
                    .isEqualTo("Multiple errors occurred: 2 network errors, 1 timeout error");
        }

        @Test
        @DisplayName("highest severity defaults to INFO")
        void highestSeverity() {
            assertThat(TransformedErrors.highestSeverity(List.of())).isEqualTo(ErrorSeverity.INFO);
            assertThat(TransformedErrors.highestSeverity(List.of(timeout, network))).isEqualTo(ErrorSeverity.ERROR);
        }
    }
}

package io.querybridge.core.security;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.querybridge.core.error.ErrorCategory;
import io.querybridge.core.error.SecurityViolationException;
import io.querybridge.core.sql.DatabaseDialect;
import io.querybridge.core.sql.DatabaseDialectFactory;
import io.querybridge.core.sql.DatabaseType;
import io.querybridge.core.sql.ParameterType;
import io.querybridge.core.sql.ParameterizedQuery;
import io.querybridge.core.sql.QueryType;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("SecurityValidator")
class SecurityValidatorTest {

    private final SecurityValidator validator = new SecurityValidator();
    private final DatabaseDialect postgres = new DatabaseDialectFactory().dialect(DatabaseType.POSTGRESQL);

    @Nested
    @DisplayName("query screening")
    class QueryScreening {

        @Test
        @DisplayName("generated parameterized search query passes with low risk")
        void generatedQueryPasses() {
            SqlValidationResult result = validator.validateQuery(
                    "SELECT \"name\" FROM \"products\" WHERE LOWER(\"name\") LIKE LOWER($1) LIMIT 10",
                    List.of("%laptop%"));

            assertThat(result.valid()).isTrue();
            assertThat(result.errors()).isEmpty();
            assertThat(result.riskLevel()).isEqualTo(RiskLevel.LOW);
            assertThat(result.sanitizedParameters()).containsExactly("%laptop%");
        }

        @ParameterizedTest
        @ValueSource(strings = {
            "SELECT * FROM users WHERE id = 1 OR 1=1",
            "SELECT name FROM users UNION SELECT password FROM admins",
            "SELECT * FROM users -- comment",
            "SELECT * FROM users /* hidden */",
            "SELECT * FROM users; DROP TABLE users",
            "SELECT * FROM information_schema.tables",
            "SELECT SLEEP(5)"
        })
        @DisplayName("injection patterns are rejected as high risk")
        void injectionPatternsRejected(String sql) {
            SqlValidationResult result = validator.validateQuery(sql, List.of());

            assertThat(result.valid()).isFalse();
            assertThat(result.riskLevel()).isEqualTo(RiskLevel.HIGH);
        }

        @Test
        @DisplayName("blank SQL is rejected")
        void blankSqlRejected() {
            SqlValidationResult result = validator.validateQuery("  ", List.of());

            assertThat(result.valid()).isFalse();
            assertThat(result.errors()).containsExactly("Query must be a non-empty string");
        }

        @Test
        @DisplayName("operations outside the policy are rejected")
        void disallowedOperationRejected() {
            SqlValidationResult result = validator.validateQuery("DELETE FROM users WHERE id = $1", List.of(7));

            assertThat(result.valid()).isFalse();
            assertThat(result.errors()).contains("Operation DELETE is not allowed");
            assertThat(result.warnings()).contains("Query contains risky keyword: DELETE FROM");
        }

        @Test
        @DisplayName("a policy allowing writes accepts the same statement")
        void policyAllowsWrites() {
            SecurityValidator writer = new SecurityValidator(SecurityPolicy.allowing(Set.of("select", "delete")));

            SqlValidationResult result = writer.validateQuery("DELETE FROM users WHERE id = $1", List.of(7));

            assertThat(result.valid()).isTrue();
            assertThat(result.riskLevel()).isEqualTo(RiskLevel.MEDIUM);
        }

        @Test
        @DisplayName("script content in a parameter is an error")
        void maliciousParameterRejected() {
            SqlValidationResult result = validator.validateQuery(
                    "SELECT * FROM t WHERE a = $1 AND b = $2", List.of("fine", "<script>alert(1)</script>"));

            assertThat(result.valid()).isFalse();
            assertThat(result.errors()).containsExactly("Parameter 2: potentially malicious content");
            assertThat(result.riskLevel()).isEqualTo(RiskLevel.MEDIUM);
        }

        @Test
        @DisplayName("oversized parameters are rejected")
        void oversizedParameterRejected() {
            String big = String.join("", Collections.nCopies(10_001, "a"));

            SqlValidationResult result = validator.validateQuery("SELECT * FROM t WHERE a = $1", List.of(big));

            assertThat(result.valid()).isFalse();
            assertThat(result.errors()).containsExactly("Parameter 1: value exceeds 10000 characters");
        }

        @Test
        @DisplayName("too many joins only warns")
        void complexityWarns() {
            StringBuilder sql = new StringBuilder("SELECT a.id FROM a");
            for (int i = 0; i < 6; i++) {
                sql.append(" JOIN t").append(i).append(" ON a.id = t").append(i).append(".id");
            }

            SqlValidationResult result = validator.validateQuery(sql.toString(), List.of());

            assertThat(result.valid()).isTrue();
            assertThat(result.warnings()).containsExactly("Query has 6 joins, more than 5");
            assertThat(result.riskLevel()).isEqualTo(RiskLevel.MEDIUM);
        }

        @Test
        @DisplayName("requireSafe throws a security violation for rejected queries")
        void requireSafeThrows() {
            ParameterizedQuery query = new ParameterizedQuery(
                    "SELECT * FROM t WHERE a = $1 OR 1=1", List.of("x"), List.of(ParameterType.VARCHAR), QueryType.SELECT, null);

            assertThatThrownBy(() -> validator.requireSafe(query))
                    .isInstanceOf(SecurityViolationException.class)
                    .satisfies(e -> {
                        SecurityViolationException violation = (SecurityViolationException) e;
                        assertThat(violation.code()).isEqualTo("SQL_SECURITY_VIOLATION");
                        assertThat(violation.category()).isEqualTo(ErrorCategory.SECURITY);
                    });
        }
    }

    @Nested
    @DisplayName("parameter sanitizing")
    class Sanitizing {

        @Test
        @DisplayName("control characters are stripped and non-finite numbers become null")
        void sanitizes() {
            List<Object> sanitized = validator.sanitizeParameters(
                    Arrays.asList("ab\u0000c ", Double.NaN, 42, null, Float.POSITIVE_INFINITY));

            assertThat(sanitized).containsExactly("abc", null, 42, null, null);
        }
    }

    @Nested
    @DisplayName("connection strings")
    class ConnectionStrings {

        @Test
        @DisplayName("well-formed PostgreSQL URL is valid and redacted")
        void validUrlRedacted() {
            ConnectionStringValidation result =
                    validator.validateConnectionString("postgresql://app:secret@db:5432/catalog", postgres);

            assertThat(result.valid()).isTrue();
            assertThat(result.sanitized()).isEqualTo("postgresql://***:***@db:5432/catalog");
        }

        @Test
        @DisplayName("URL of another database is rejected")
        void wrongSchemeRejected() {
            ConnectionStringValidation result = validator.validateConnectionString("mysql://db/catalog", postgres);

            assertThat(result.valid()).isFalse();
            assertThat(result.errors()).containsExactly("Invalid postgresql connection string format");
        }

        @Test
        @DisplayName("SQL fragments and unsafe options are rejected")
        void maliciousContentRejected() {
            ConnectionStringValidation result = validator.validateConnectionString(
                    "postgresql://db/catalog;drop table users?allowLoadLocalInfile=true", postgres);

            assertThat(result.valid()).isFalse();
            assertThat(result.errors())
                    .contains(
                            "Connection string contains potentially malicious SQL patterns",
                            "Connection string enables unsafe option: allowloadlocalinfile=true");
        }

        @Test
        @DisplayName("long embedded credentials are rejected")
        void embeddedCredentialsRejected() {
            ConnectionStringValidation result = validator.validateConnectionString(
                    "postgresql://reporting_user:a-very-long-password@db/catalog", postgres);

            assertThat(result.valid()).isFalse();
            assertThat(result.errors())
                    .containsExactly("Connection string embeds credentials; supply them through configuration instead");
        }

        @Test
        @DisplayName("empty connection string is rejected")
        void emptyRejected() {
            ConnectionStringValidation result = validator.validateConnectionString("", postgres);

            assertThat(result.valid()).isFalse();
            assertThat(result.sanitized()).isEmpty();
        }
    }
}

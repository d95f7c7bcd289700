package io.querybridge.core.error;

import java.util.List;
import java.util.Map;

/**
 * The default classification rules. Each category has a template (message,
 * severity, suggestions and retry policy); message-pattern rules apply a
 * template to untyped errors and the typed rule applies it to
 * {@link DataSourceException}s, keeping their own code.
 */
public final class BuiltInErrorRules {

    /** Priority of the rule that classifies typed {@link DataSourceException}s. */
    public static final int TYPED_PRIORITY = 200;

    private record Template(
            String message, ErrorSeverity severity, boolean recoverable, RetryInfo retry, List<String> suggestions) {}

    private static final Map<ErrorCategory, Template> TEMPLATES = Map.ofEntries(
            Map.entry(ErrorCategory.NETWORK, new Template(
                    "Unable to connect to the data source. Please check your network connection.",
                    ErrorSeverity.ERROR, true, RetryInfo.of(3, 2_000),
                    List.of("Check your internet connection",
                            "Verify the data source is accessible",
                            "Try again in a few moments"))),
            Map.entry(ErrorCategory.CONNECTION, new Template(
                    "Unable to connect to the data source.",
                    ErrorSeverity.ERROR, true, RetryInfo.of(3, 1_000),
                    List.of("Verify the connection settings",
                            "Check that the data source is running",
                            "Try again in a few moments"))),
            Map.entry(ErrorCategory.AUTHENTICATION, new Template(
                    "Authentication failed. Please check your credentials.",
                    ErrorSeverity.ERROR, false, null,
                    List.of("Verify your username and password",
                            "Check if your account is active",
                            "Contact your administrator if the issue persists"))),
            Map.entry(ErrorCategory.AUTHORIZATION, new Template(
                    "You do not have permission to access this resource.",
                    ErrorSeverity.ERROR, false, null,
                    List.of("Contact your administrator to request access",
                            "Check if you have the required permissions",
                            "Try accessing a different resource"))),
            Map.entry(ErrorCategory.VALIDATION, new Template(
                    null,
                    ErrorSeverity.WARNING, true, null,
                    List.of("Check your input data format",
                            "Ensure all required fields are provided",
                            "Verify data types match expectations"))),
            Map.entry(ErrorCategory.TIMEOUT, new Template(
                    "The operation timed out. This might indicate a slow connection or server issue.",
                    ErrorSeverity.WARNING, true, RetryInfo.of(2, 5_000),
                    List.of("Try again with a longer timeout",
                            "Check if the server is responding slowly",
                            "Consider reducing the scope of your request"))),
            Map.entry(ErrorCategory.DATA, new Template(
                    "There was an issue with the data source.",
                    ErrorSeverity.ERROR, true, RetryInfo.of(2, 1_000),
                    List.of("Check if the data source is available",
                            "Verify your query syntax",
                            "Try a simpler query if possible"))),
            Map.entry(ErrorCategory.CONFIGURATION, new Template(
                    "Configuration error detected. Please check your settings.",
                    ErrorSeverity.ERROR, false, null,
                    List.of("Review your configuration settings",
                            "Ensure all required parameters are provided",
                            "Check the documentation for correct format"))),
            Map.entry(ErrorCategory.TRANSFORMATION, new Template(
                    "Error occurred while processing the results.",
                    ErrorSeverity.WARNING, true, null,
                    List.of("Check your field mapping configuration",
                            "Verify the data format matches expectations",
                            "Try with a smaller result set"))),
            Map.entry(ErrorCategory.SECURITY, new Template(
                    null,
                    ErrorSeverity.ERROR, false, null,
                    List.of("Review the query for unsupported characters or keywords",
                            "Reduce the request rate if the limit was exceeded"))));

    private BuiltInErrorRules() {
        // utility class
    }

    /** All default rules, typed rule first. */
    public static List<ErrorRule> all() {
        return List.of(
                typed(),
                messageRule("network_error", 100, ErrorCategory.NETWORK, "NETWORK_ERROR",
                        "econnrefused", "enotfound", "etimedout", "network"),
                messageRule("authentication_error", 95, ErrorCategory.AUTHENTICATION, "AUTH_ERROR",
                        "401", "unauthorized", "authentication", "invalid credentials"),
                messageRule("authorization_error", 90, ErrorCategory.AUTHORIZATION, "ACCESS_DENIED",
                        "403", "forbidden", "access denied", "insufficient permissions"),
                messageRule("validation_error", 85, ErrorCategory.VALIDATION, "VALIDATION_ERROR",
                        "validation", "invalid", "required field"),
                messageRule("timeout_error", 80, ErrorCategory.TIMEOUT, "TIMEOUT_ERROR",
                        "timeout", "timed out"),
                messageRule("data_source_error", 75, ErrorCategory.DATA, "DATA_SOURCE_ERROR",
                        "database", "query", "syntax error", "connection pool"),
                messageRule("configuration_error", 70, ErrorCategory.CONFIGURATION, "CONFIG_ERROR",
                        "configuration", "config", "missing required", "invalid settings"),
                ErrorRule.builder()
                        .name("transformation_error")
                        .priority(65)
                        .match((error, context) -> "transformation".equals(context.sourceType()))
                        .matchMessage("transform", "mapping")
                        .transform((error, context) -> fromTemplate(ErrorCategory.TRANSFORMATION, "TRANSFORM_ERROR", error)));
    }

    /**
     * Builds the classified form of {@code error} from the template of
     * {@code category}.
     *
     * @param code code to report
     */
    public static TransformedError fromTemplate(ErrorCategory category, String code, Throwable error) {
        Template template = TEMPLATES.get(category);
        String raw = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        if (template == null) {
            return TransformedError.builder(category, code).message(raw).technical(raw).build();
        }
        TransformedError.Builder builder = TransformedError.builder(category, code)
                .message(template.message() != null ? template.message() : messageFor(category, error, raw))
                .severity(template.severity())
                .technical(raw)
                .suggestions(template.suggestions())
                .recoverable(template.recoverable());
        if (template.retry() != null) {
            builder.retry(template.retry().maxAttempts(), template.retry().backoffMs());
        }
        return builder.build();
    }

    private static String messageFor(ErrorCategory category, Throwable error, String raw) {
        if (category == ErrorCategory.VALIDATION) {
            if (error instanceof ConfigValidationException cve && cve.field() != null) {
                return "Invalid value for field '" + cve.field() + "': " + raw;
            }
            return "Validation error: " + raw;
        }
        return raw;
    }

    private static ErrorRule typed() {
        return new ErrorRule(
                "typed_error",
                TYPED_PRIORITY,
                (error, context) -> error instanceof DataSourceException,
                (error, context) -> {
                    DataSourceException dse = (DataSourceException) error;
                    TransformedError base = fromTemplate(dse.category(), dse.code(), dse);
                    if (dse.retryable() || !base.isRetryable()) {
                        return base;
                    }
                    // the exception knows better than the category template
                    return new TransformedError(
                            base.message(), base.severity(), base.category(), base.code(), base.technical(),
                            base.suggestions(), false, null, List.of());
                });
    }

    private static ErrorRule messageRule(
            String name, int priority, ErrorCategory category, String code, String... fragments) {
        return ErrorRule.builder()
                .name(name)
                .priority(priority)
                .matchMessage(fragments)
                .transform((error, context) -> fromTemplate(category, code, error));
    }
}

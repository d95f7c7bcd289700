package io.querybridge.core.security;

import io.querybridge.core.error.SecurityViolationException;
import io.querybridge.core.sql.DatabaseDialect;
import io.querybridge.core.sql.ParameterizedQuery;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Screens compiled SQL, bound parameters and connection strings before anything
 * reaches a database. This is a second line of defense behind parameter
 * binding: a query that trips a high-risk pattern is rejected, never rewritten.
 *
 * <p>
 * Stateless apart from its {@link SecurityPolicy}; thread-safe.
 */
public final class SecurityValidator {

    private static final Logger LOG = LoggerFactory.getLogger(SecurityValidator.class);

    private static final List<Pattern> INJECTION_PATTERNS = List.of(
            Pattern.compile("\\bunion\\s+(all\\s+)?select\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("(^|\\s)(or|and)\\s+\\d+\\s*=\\s*\\d+", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bwaitfor\\s+delay\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bbenchmark\\s*\\(", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bsleep\\s*\\(", Pattern.CASE_INSENSITIVE),
            Pattern.compile("--"),
            Pattern.compile("/\\*.*?\\*/", Pattern.DOTALL),
            Pattern.compile(";\\s*(drop|delete|update|insert)\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\binformation_schema\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bsys\\.", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bxp_cmdshell\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bsp_execute", Pattern.CASE_INSENSITIVE));

    private static final List<Pattern> SUSPICIOUS_VALUES = List.of(
            Pattern.compile("'\\s*or\\s+'[^']*'\\s*=\\s*'", Pattern.CASE_INSENSITIVE),
            Pattern.compile("'\\s*union\\s+select", Pattern.CASE_INSENSITIVE),
            Pattern.compile(";\\s*drop\\s+", Pattern.CASE_INSENSITIVE),
            Pattern.compile(";\\s*delete\\s+from", Pattern.CASE_INSENSITIVE),
            Pattern.compile(";\\s*update\\s+.*set", Pattern.CASE_INSENSITIVE));

    private static final Pattern RISKY_KEYWORDS = Pattern.compile(
            "\\b(drop\\s+table|drop\\s+database|delete\\s+from|truncate|alter\\s+table|create\\s+user"
                    + "|grant|revoke|exec|execute|load_file|into\\s+outfile|into\\s+dumpfile)\\b",
            Pattern.CASE_INSENSITIVE);

    private static final List<Pattern> MALICIOUS_PARAMETERS = List.of(
            Pattern.compile("<script", Pattern.CASE_INSENSITIVE),
            Pattern.compile("javascript:", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bon\\w+\\s*=", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bexec\\s*\\(", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\beval\\s*\\(", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bunion\\b.*\\bselect\\b", Pattern.CASE_INSENSITIVE | Pattern.DOTALL));

    private static final Pattern JOIN = Pattern.compile("\\bjoin\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern SUBQUERY = Pattern.compile("\\(\\s*select\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern UNION = Pattern.compile("\\bunion\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]");

    private static final Pattern EMBEDDED_CREDENTIALS = Pattern.compile("://([^@/]+)@");
    private static final List<String> SUSPICIOUS_CONNECTION_PARAMS =
            List.of("allowloadlocalinfile=true", "autoreconnect=true");

    private final SecurityPolicy policy;

    public SecurityValidator() {
        this(SecurityPolicy.DEFAULT);
    }

    public SecurityValidator(SecurityPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy must not be null");
    }

    public SecurityPolicy policy() {
        return policy;
    }

    /** Validates a compiled query together with its bound parameters. */
    public SqlValidationResult validate(ParameterizedQuery query) {
        return validateQuery(query.sql(), query.parameters());
    }

    /**
     * Validates SQL text and parameters.
     *
     * @param sql        compiled SQL with placeholders
     * @param parameters values bound to the placeholders, may contain {@code null}
     */
    public SqlValidationResult validateQuery(String sql, List<?> parameters) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        RiskLevel risk = RiskLevel.LOW;

        if (sql == null || sql.isBlank()) {
            errors.add("Query must be a non-empty string");
            return new SqlValidationResult(false, errors, warnings, RiskLevel.HIGH, List.of());
        }

        for (Pattern pattern : INJECTION_PATTERNS) {
            if (pattern.matcher(sql).find()) {
                errors.add("Potential SQL injection detected: pattern " + pattern.pattern());
                risk = RiskLevel.HIGH;
            }
        }
        for (Pattern pattern : SUSPICIOUS_VALUES) {
            if (pattern.matcher(sql).find()) {
                errors.add("Suspicious literal detected: pattern " + pattern.pattern());
                risk = RiskLevel.HIGH;
            }
        }

        String operation = leadingKeyword(sql);
        if (!policy.allowedOperations().contains(operation)) {
            errors.add("Operation " + operation + " is not allowed");
            risk = RiskLevel.HIGH;
        }

        Matcher risky = RISKY_KEYWORDS.matcher(sql);
        while (risky.find()) {
            warnings.add("Query contains risky keyword: " + risky.group(1).toUpperCase(Locale.ROOT));
            risk = risk.atLeast(RiskLevel.MEDIUM);
        }

        List<Object> params = parameters == null ? List.of() : new ArrayList<>(parameters);
        for (int i = 0; i < params.size(); i++) {
            String problem = checkParameter(params.get(i));
            if (problem != null) {
                errors.add("Parameter " + (i + 1) + ": " + problem);
                risk = risk.atLeast(RiskLevel.MEDIUM);
            }
        }

        List<String> complexity = checkComplexity(sql);
        if (!complexity.isEmpty()) {
            warnings.addAll(complexity);
            risk = risk.atLeast(RiskLevel.MEDIUM);
        }

        boolean valid = errors.isEmpty();
        if (!valid) {
            LOG.warn("Query rejected by security validation: risk={}, errors={}", risk.id(), errors.size());
        } else if (!warnings.isEmpty()) {
            LOG.debug("Query accepted with warnings: {}", warnings);
        }
        return new SqlValidationResult(valid, errors, warnings, risk, sanitizeParameters(params));
    }

    /**
     * Validates the query and throws when it is rejected.
     *
     * @throws SecurityViolationException with code {@code SQL_SECURITY_VIOLATION}
     */
    public SqlValidationResult requireSafe(ParameterizedQuery query) {
        SqlValidationResult result = validate(query);
        if (!result.valid()) {
            throw new SecurityViolationException(
                    "Query failed security validation",
                    "SQL_SECURITY_VIOLATION",
                    result.errors(),
                    Map.of("riskLevel", result.riskLevel().id()));
        }
        return result;
    }

    /**
     * Strips NUL and other control characters from string values and replaces
     * non-finite numbers with {@code null}. Other values pass through
     * unchanged.
     */
    public List<Object> sanitizeParameters(List<?> parameters) {
        List<Object> sanitized = new ArrayList<>(parameters.size());
        for (Object value : parameters) {
            if (value instanceof String s) {
                sanitized.add(CONTROL_CHARS.matcher(s).replaceAll("").trim());
            } else if (value instanceof Double d && (d.isNaN() || d.isInfinite())) {
                sanitized.add(null);
            } else if (value instanceof Float f && (f.isNaN() || f.isInfinite())) {
                sanitized.add(null);
            } else {
                sanitized.add(value);
            }
        }
        return sanitized;
    }

    /**
     * Checks a connection string for the dialect's expected shape and for
     * dangerous content. The result always carries a redacted copy of the
     * input.
     */
    public ConnectionStringValidation validateConnectionString(String connectionString, DatabaseDialect dialect) {
        List<String> errors = new ArrayList<>();
        if (connectionString == null || connectionString.isBlank()) {
            errors.add("Connection string must be a non-empty string");
            return new ConnectionStringValidation(false, errors, "");
        }
        String lower = connectionString.trim().toLowerCase(Locale.ROOT);

        if (!dialect.isValidConnectionString(lower)) {
            errors.add("Invalid " + dialect.type().id() + " connection string format");
        }
        if (lower.contains(";") || lower.contains("--") || lower.contains("drop table")) {
            errors.add("Connection string contains potentially malicious SQL patterns");
        }
        Matcher credentials = EMBEDDED_CREDENTIALS.matcher(connectionString);
        if (credentials.find()) {
            String userInfo = credentials.group(1);
            if (userInfo.contains(":") && userInfo.length() > 20) {
                errors.add("Connection string embeds credentials; supply them through configuration instead");
            }
        }
        for (String param : SUSPICIOUS_CONNECTION_PARAMS) {
            if (lower.contains(param)) {
                errors.add("Connection string enables unsafe option: " + param);
            }
        }
        return new ConnectionStringValidation(
                errors.isEmpty(), errors, DatabaseDialect.redactConnectionString(connectionString));
    }

    private String checkParameter(Object value) {
        if (!(value instanceof CharSequence text)) {
            return null;
        }
        String s = text.toString();
        if (s.length() > policy.maxParameterLength()) {
            return "value exceeds " + policy.maxParameterLength() + " characters";
        }
        for (Pattern pattern : MALICIOUS_PARAMETERS) {
            if (pattern.matcher(s).find()) {
                return "potentially malicious content";
            }
        }
        return null;
    }

    private List<String> checkComplexity(String sql) {
        List<String> warnings = new ArrayList<>();
        int joins = count(JOIN, sql);
        if (joins > policy.maxJoins()) {
            warnings.add("Query has " + joins + " joins, more than " + policy.maxJoins());
        }
        int subqueries = count(SUBQUERY, sql);
        if (subqueries > policy.maxSubqueries()) {
            warnings.add("Query has " + subqueries + " subqueries, more than " + policy.maxSubqueries());
        }
        if (UNION.matcher(sql).find()) {
            warnings.add("Query uses UNION");
        }
        if (sql.length() > policy.maxQueryLength()) {
            warnings.add("Query is longer than " + policy.maxQueryLength() + " characters");
        }
        return warnings;
    }

    private static int count(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        int count = 0;
        while (matcher.find()) {
            count++;
        }
        return count;
    }

    private static String leadingKeyword(String sql) {
        String trimmed = sql.trim();
        int end = 0;
        while (end < trimmed.length() && Character.isLetter(trimmed.charAt(end))) {
            end++;
        }
        return trimmed.substring(0, end).toUpperCase(Locale.ROOT);
    }
}

package io.querybridge.core.sql;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Per-database SQL syntax rules: identifier quoting, parameter placeholders,
 * LIMIT/OFFSET, JOIN syntax, literal escaping, full-text predicates and
 * connection-string handling.
 *
 * <p>
 * Instances are immutable and thread-safe; obtain them from
 * {@link DatabaseDialectFactory}.
 */
public abstract class DatabaseDialect {

    /** Simple or {@code table.column} identifier. */
    static final Pattern IDENTIFIER = Pattern.compile("^[a-zA-Z_][a-zA-Z0-9_]*(\\.[a-zA-Z_][a-zA-Z0-9_]*)?$");

    private static final Set<String> JOIN_TYPES = Set.of("INNER", "LEFT", "RIGHT", "FULL");

    private static final Pattern URL_CREDENTIALS = Pattern.compile("://[^@/]*@");
    private static final Pattern PASSWORD_PARAM =
            Pattern.compile("(?i)(password|pwd)=[^&;\\s]*");

    /** Marker that replaces credentials in redacted connection strings. */
    public static final String REDACTED = "***";

    private final DatabaseType type;
    private final String version;
    private final DialectFeatures features;
    private final char quote;

    protected DatabaseDialect(DatabaseType type, String version, DialectFeatures features, char quote) {
        this.type = type;
        this.version = version;
        this.features = features;
        this.quote = quote;
    }

    public DatabaseType type() {
        return type;
    }

    /** Server version this dialect was created for, or {@code null} for the default. */
    public String version() {
        return version;
    }

    public DialectFeatures features() {
        return features;
    }

    /**
     * Returns the placeholder for the parameter at the given zero-based index.
     *
     * @param index position of the parameter in the parameter list
     */
    public abstract String placeholder(int index);

    /** Pattern a connection string must match for this database. */
    protected abstract Pattern connectionStringPattern();

    /**
     * Full-text predicate for one column.
     *
     * @param quotedColumn already quoted column reference
     * @param placeholder  placeholder bound to the search term
     */
    protected abstract String fullTextPredicate(String quotedColumn, String placeholder);

    /** Returns {@code true} if {@code name} is a valid simple or dotted identifier. */
    public boolean isValidIdentifier(String name) {
        return name != null && IDENTIFIER.matcher(name).matches();
    }

    /**
     * Quotes an identifier, quoting each part of a dotted name separately and
     * doubling embedded quote characters.
     *
     * @throws IllegalArgumentException if the identifier does not match the identifier grammar
     */
    public String quoteIdentifier(String name) {
        if (!isValidIdentifier(name)) {
            throw new IllegalArgumentException("Invalid identifier: " + name);
        }
        String[] parts = name.split("\\.");
        List<String> quoted = new ArrayList<>(parts.length);
        for (String part : parts) {
            String escaped = part.replace(String.valueOf(quote), String.valueOf(quote) + quote);
            quoted.add(quote + escaped + quote);
        }
        return String.join(".", quoted);
    }

    /**
     * Renders a string literal with dialect-specific escaping. Generated
     * queries never use this for user data; it exists for static DDL and
     * diagnostics.
     */
    public String quoteLiteral(String value) {
        return "'" + value.replace("'", "''") + "'";
    }

    /**
     * Builds {@code LIMIT n [OFFSET m]}.
     *
     * @param limit  row count, must be positive
     * @param offset rows to skip, must not be negative; {@code 0} omits the OFFSET
     */
    public String limitClause(int limit, int offset) {
        if (limit <= 0) {
            throw new IllegalArgumentException("LIMIT must be positive, got: " + limit);
        }
        if (offset < 0) {
            throw new IllegalArgumentException("OFFSET must not be negative, got: " + offset);
        }
        return offset > 0 ? "LIMIT " + limit + " OFFSET " + offset : "LIMIT " + limit;
    }

    /** Returns {@code true} for INNER, LEFT, RIGHT and FULL (case-insensitive). */
    public boolean isValidJoinType(String joinType) {
        return joinType != null && JOIN_TYPES.contains(joinType.trim().toUpperCase(Locale.ROOT));
    }

    /**
     * Builds a JOIN clause.
     *
     * @param joinType    INNER, LEFT, RIGHT or FULL
     * @param quotedTable already quoted table name
     * @param onCondition already rendered ON condition
     */
    public String joinClause(String joinType, String quotedTable, String onCondition) {
        if (!isValidJoinType(joinType)) {
            throw new IllegalArgumentException("Invalid JOIN type: " + joinType);
        }
        return joinType.trim().toUpperCase(Locale.ROOT) + " JOIN " + quotedTable + " ON " + onCondition;
    }

    /** Case-insensitive LIKE predicate for one column. */
    public String likePredicate(String quotedColumn, String placeholder) {
        return "LOWER(" + quotedColumn + ") LIKE LOWER(" + placeholder + ")";
    }

    /**
     * Search predicate for one column: full-text when the dialect supports it
     * and {@code useFullText} is requested, otherwise case-insensitive LIKE.
     */
    public String searchPredicate(String quotedColumn, String placeholder, boolean useFullText) {
        if (useFullText && features.fullText()) {
            return fullTextPredicate(quotedColumn, placeholder);
        }
        return likePredicate(quotedColumn, placeholder);
    }

    /** Returns {@code true} if the string has the shape expected for this database. */
    public boolean isValidConnectionString(String connectionString) {
        return connectionString != null
                && connectionStringPattern().matcher(connectionString.trim()).find();
    }

    /**
     * Replaces URL credentials and password parameters with {@value #REDACTED}.
     * The result is safe to log or echo.
     */
    public static String redactConnectionString(String connectionString) {
        if (connectionString == null) {
            return null;
        }
        String redacted = URL_CREDENTIALS.matcher(connectionString).replaceAll("://***:***@");
        Matcher matcher = PASSWORD_PARAM.matcher(redacted);
        return matcher.replaceAll("$1=" + Matcher.quoteReplacement(REDACTED));
    }

    @Override
    public String toString() {
        return type.id() + (version != null ? "-" + version : "");
    }
}

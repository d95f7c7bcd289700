package io.querybridge.core.sql;

import java.util.regex.Pattern;

/**
 * MySQL: {@code ?} placeholders, backtick identifiers,
 * {@code MATCH ... AGAINST} full-text search. Versions before 8 lack window
 * functions and CTEs; versions before 5 also lack JSON.
 */
final class MySqlDialect extends DatabaseDialect {

    private static final Pattern CONNECTION_STRING = Pattern.compile("^mysql://");

    MySqlDialect(String version) {
        super(DatabaseType.MYSQL, version, featuresFor(version), '`');
    }

    @Override
    public String placeholder(int index) {
        return "?";
    }

    @Override
    public String quoteLiteral(String value) {
        return "'" + value.replace("\\", "\\\\").replace("'", "''") + "'";
    }

    @Override
    protected Pattern connectionStringPattern() {
        return CONNECTION_STRING;
    }

    @Override
    protected String fullTextPredicate(String quotedColumn, String placeholder) {
        return "MATCH(" + quotedColumn + ") AGAINST(" + placeholder + " IN NATURAL LANGUAGE MODE)";
    }

    static DialectFeatures featuresFor(String version) {
        int major = majorVersion(version);
        boolean modern = major < 0 || major >= 8;
        boolean json = major < 0 || major >= 5;
        return new DialectFeatures(true, modern, modern, json, true);
    }

    /** Leading integer of a version string, or {@code -1} if absent or unparseable. */
    private static int majorVersion(String version) {
        if (version == null || version.isBlank()) {
            return -1;
        }
        String head = version.trim().split("\\.")[0];
        try {
            return Integer.parseInt(head);
        } catch (NumberFormatException e) {
            return -1;
        }
    }
}

package io.querybridge.core.sql;

import java.util.regex.Pattern;

/** SQLite: {@code ?} placeholders, double-quoted identifiers, FTS {@code MATCH} predicates. */
final class SqliteDialect extends DatabaseDialect {

    private static final Pattern CONNECTION_STRING = Pattern.compile("^sqlite:|\\.db$|\\.sqlite3?$");

    SqliteDialect(String version) {
        super(DatabaseType.SQLITE, version, new DialectFeatures(true, true, true, true, true), '"');
    }

    @Override
    public String placeholder(int index) {
        return "?";
    }

    @Override
    protected Pattern connectionStringPattern() {
        return CONNECTION_STRING;
    }

    @Override
    protected String fullTextPredicate(String quotedColumn, String placeholder) {
        return quotedColumn + " MATCH " + placeholder;
    }
}

package io.querybridge.core.sql;

import java.util.regex.Pattern;

/** PostgreSQL: {@code $n} placeholders, double-quoted identifiers, tsvector full-text search. */
final class PostgreSqlDialect extends DatabaseDialect {

    private static final Pattern CONNECTION_STRING = Pattern.compile("^(postgresql|postgres)://");

    PostgreSqlDialect(String version) {
        super(DatabaseType.POSTGRESQL, version, new DialectFeatures(true, true, true, true, true), '"');
    }

    @Override
    public String placeholder(int index) {
        return "$" + (index + 1);
    }

    @Override
    protected Pattern connectionStringPattern() {
        return CONNECTION_STRING;
    }

    @Override
    protected String fullTextPredicate(String quotedColumn, String placeholder) {
        return "to_tsvector(" + quotedColumn + ") @@ plainto_tsquery(" + placeholder + ")";
    }
}

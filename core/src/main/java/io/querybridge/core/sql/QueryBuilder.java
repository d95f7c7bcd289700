package io.querybridge.core.sql;

import io.querybridge.core.error.ConfigValidationException;
import io.querybridge.core.model.ProcessedQuery;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Compiles a {@link SqlQueryConfig} and a {@link ProcessedQuery} into
 * parameterized SQL for one {@link DatabaseDialect}.
 *
 * <p>
 * Every value supplied at run time is appended to the parameter list and
 * referenced through a placeholder. Identifiers are validated against the
 * identifier grammar and quoted; a small set of SQL functions is recognized
 * syntactically and passed through. Configuration errors are raised before any
 * SQL is produced.
 *
 * <p>
 * Stateless and thread-safe: each call collects its own parameters.
 */
public final class QueryBuilder {

    /** Functions allowed unquoted in select, group and order expressions. */
    static final Set<String> SQL_FUNCTIONS = Set.of(
            "COUNT", "SUM", "AVG", "MAX", "MIN", "UPPER", "LOWER", "TRIM", "LENGTH", "SUBSTRING", "CONCAT",
            "COALESCE", "CAST", "CONVERT", "NOW", "CURRENT_TIMESTAMP");

    private static final Pattern FUNCTION_CALL = Pattern.compile("^([A-Za-z_]+)\\s*\\((.*)\\)$");
    private static final Pattern FUNCTION_ARG = Pattern.compile(
            "^(\\*|\\d+(\\.\\d+)?|[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)?)$");
    private static final Pattern ALIAS = Pattern.compile("^(.+?)\\s+(?i:AS)\\s+(\\S+)$");
    private static final Pattern JOIN_CONDITION = Pattern.compile("^\\s*(\\S+)\\s*=\\s*(\\S+)\\s*$");
    private static final Pattern UNSAFE_FRAGMENT = Pattern.compile(";|--|/\\*|\\*/");

    private final DatabaseDialect dialect;

    public QueryBuilder(DatabaseDialect dialect) {
        this.dialect = Objects.requireNonNull(dialect, "dialect must not be null");
    }

    public DatabaseDialect dialect() {
        return dialect;
    }

    /**
     * Validates a query configuration without producing SQL.
     *
     * @throws ConfigValidationException on a missing table, empty search columns, invalid column
     *     references, JOIN types or conditions, order directions, or unsafe static fragments
     */
    public void validateConfig(SqlQueryConfig config) {
        if (config == null) {
            throw new ConfigValidationException("SQL query configuration is required", "query");
        }
        if (config.tableName() == null || config.tableName().isBlank()) {
            throw new ConfigValidationException("Table name is required", "query.tableName");
        }
        if (!dialect.isValidIdentifier(config.tableName())) {
            throw new ConfigValidationException("Invalid table name: " + config.tableName(), "query.tableName");
        }
        if (config.searchColumns().isEmpty()) {
            throw new ConfigValidationException("At least one search column is required", "query.searchColumns");
        }
        for (String column : config.searchColumns()) {
            requireIdentifier(column, "query.searchColumns");
        }
        for (String column : config.selectColumns()) {
            requireColumnExpression(column, "query.selectColumns");
        }
        for (String column : config.groupBy()) {
            requireColumnExpression(column, "query.groupBy");
        }
        for (SqlQueryConfig.Join join : config.joins()) {
            if (!dialect.isValidJoinType(join.type())) {
                throw new ConfigValidationException("Invalid JOIN type: " + join.type(), "query.joins.type");
            }
            requireIdentifier(join.table(), "query.joins.table");
            if (join.condition() == null || join.condition().isBlank()) {
                throw new ConfigValidationException("JOIN condition is required", "query.joins.condition");
            }
            parseJoinCondition(join.condition());
        }
        for (SqlQueryConfig.Order order : config.orderBy()) {
            requireColumnExpression(order.column(), "query.orderBy.column");
            parseDirection(order.direction());
        }
        requireSafeFragment(config.whereClause(), "query.whereClause");
        requireSafeFragment(config.having(), "query.having");
    }

    /**
     * Builds the search SELECT.
     *
     * @param config query configuration
     * @param query  processed user query; an empty normalized text adds no search predicate
     * @param page   pagination window, or {@code null} for no LIMIT
     */
    public ParameterizedQuery buildSearchQuery(SqlQueryConfig config, ProcessedQuery query, PageRequest page) {
        validateConfig(config);
        Parameters params = new Parameters();
        List<String> parts = new ArrayList<>();
        parts.add(selectClause(config));
        parts.add("FROM " + dialect.quoteIdentifier(config.tableName()));
        addIfPresent(parts, joinClauses(config));
        addIfPresent(parts, whereClause(config, query, params));
        addIfPresent(parts, groupByClause(config));
        if (config.having() != null && !config.having().isBlank()) {
            parts.add("HAVING " + config.having().trim());
        }
        addIfPresent(parts, orderByClause(config));
        if (page != null) {
            parts.add(dialect.limitClause(page.limit(), page.offset()));
        }
        return params.toQuery(String.join(" ", parts), QueryType.SELECT, page != null ? page.limit() : null);
    }

    /** Builds {@code SELECT COUNT(*)} over the same FROM/JOIN/WHERE as the search query. */
    public ParameterizedQuery buildCountQuery(SqlQueryConfig config, ProcessedQuery query) {
        validateConfig(config);
        Parameters params = new Parameters();
        List<String> parts = new ArrayList<>();
        parts.add("SELECT COUNT(*)");
        parts.add("FROM " + dialect.quoteIdentifier(config.tableName()));
        addIfPresent(parts, joinClauses(config));
        addIfPresent(parts, whereClause(config, query, params));
        return params.toQuery(String.join(" ", parts), QueryType.COUNT, 1);
    }

    /**
     * Builds a keyset page: rows strictly after (forward) or before (backward)
     * {@code cursorValue} on {@code cursorColumn}, ordered by that column.
     */
    public ParameterizedQuery buildCursorQuery(
            SqlQueryConfig config,
            ProcessedQuery query,
            String cursorColumn,
            Object cursorValue,
            boolean forward,
            int pageSize) {
        validateConfig(config);
        requireIdentifier(cursorColumn, "pagination.cursorColumn");
        Parameters params = new Parameters();
        String quotedCursor = dialect.quoteIdentifier(cursorColumn);
        List<String> parts = new ArrayList<>();
        parts.add(selectClause(config));
        parts.add("FROM " + dialect.quoteIdentifier(config.tableName()));
        addIfPresent(parts, joinClauses(config));
        String where = whereClause(config, query, params);
        String cursorCondition = quotedCursor + (forward ? " > " : " < ") + params.add(cursorValue);
        parts.add(where.isEmpty() ? "WHERE " + cursorCondition : where + " AND " + cursorCondition);
        parts.add("ORDER BY " + quotedCursor + (forward ? " ASC" : " DESC"));
        parts.add(dialect.limitClause(pageSize, 0));
        return params.toQuery(String.join(" ", parts), QueryType.CURSOR, pageSize);
    }

    /** Builds {@code INSERT INTO t (cols) VALUES (placeholders)} in map iteration order. */
    public ParameterizedQuery buildInsertQuery(String tableName, Map<String, ?> values) {
        requireIdentifier(tableName, "tableName");
        requireNonEmpty(values, "values");
        Parameters params = new Parameters();
        List<String> columns = new ArrayList<>();
        List<String> placeholders = new ArrayList<>();
        for (Map.Entry<String, ?> entry : values.entrySet()) {
            requireIdentifier(entry.getKey(), "values");
            columns.add(dialect.quoteIdentifier(entry.getKey()));
            placeholders.add(params.add(entry.getValue()));
        }
        String sql = "INSERT INTO " + dialect.quoteIdentifier(tableName)
                + " (" + String.join(", ", columns) + ") VALUES (" + String.join(", ", placeholders) + ")";
        return params.toQuery(sql, QueryType.INSERT, 1);
    }

    /**
     * Builds {@code UPDATE t SET ... WHERE ...}. Conditions are equality tests
     * joined with AND and must not be empty.
     */
    public ParameterizedQuery buildUpdateQuery(String tableName, Map<String, ?> values, Map<String, ?> conditions) {
        requireIdentifier(tableName, "tableName");
        requireNonEmpty(values, "values");
        requireNonEmpty(conditions, "conditions");
        Parameters params = new Parameters();
        List<String> assignments = new ArrayList<>();
        for (Map.Entry<String, ?> entry : values.entrySet()) {
            requireIdentifier(entry.getKey(), "values");
            assignments.add(dialect.quoteIdentifier(entry.getKey()) + " = " + params.add(entry.getValue()));
        }
        String sql = "UPDATE " + dialect.quoteIdentifier(tableName) + " SET " + String.join(", ", assignments)
                + " WHERE " + equalityConditions(conditions, params);
        return params.toQuery(sql, QueryType.UPDATE, null);
    }

    /** Builds {@code DELETE FROM t WHERE ...}; conditions must not be empty. */
    public ParameterizedQuery buildDeleteQuery(String tableName, Map<String, ?> conditions) {
        requireIdentifier(tableName, "tableName");
        requireNonEmpty(conditions, "conditions");
        Parameters params = new Parameters();
        String sql = "DELETE FROM " + dialect.quoteIdentifier(tableName) + " WHERE "
                + equalityConditions(conditions, params);
        return params.toQuery(sql, QueryType.DELETE, null);
    }

    /** Returns {@code true} if the expression is a recognized function call with plain arguments. */
    public static boolean isSqlFunction(String expression) {
        if (expression == null) {
            return false;
        }
        Matcher m = FUNCTION_CALL.matcher(expression.trim());
        return m.matches()
                && SQL_FUNCTIONS.contains(m.group(1).toUpperCase(Locale.ROOT))
                && plainArguments(m.group(2));
    }

    // each argument is *, a number or a possibly qualified column name
    private static boolean plainArguments(String arguments) {
        if (arguments.isBlank()) {
            return true;
        }
        for (String argument : arguments.split(",", -1)) {
            if (!FUNCTION_ARG.matcher(argument.trim()).matches()) {
                return false;
            }
        }
        return true;
    }

    // --- clauses ---

    private String selectClause(SqlQueryConfig config) {
        List<String> source = config.selectColumns().isEmpty() ? config.searchColumns() : config.selectColumns();
        List<String> rendered = new ArrayList<>(source.size());
        for (String column : source) {
            rendered.add(renderColumnExpression(column));
        }
        return "SELECT " + String.join(", ", rendered);
    }

    private String joinClauses(SqlQueryConfig config) {
        List<String> clauses = new ArrayList<>();
        for (SqlQueryConfig.Join join : config.joins()) {
            String[] sides = parseJoinCondition(join.condition());
            String on = dialect.quoteIdentifier(sides[0]) + " = " + dialect.quoteIdentifier(sides[1]);
            clauses.add(dialect.joinClause(join.type(), dialect.quoteIdentifier(join.table()), on));
        }
        return String.join(" ", clauses);
    }

    private String whereClause(SqlQueryConfig config, ProcessedQuery query, Parameters params) {
        List<String> conditions = new ArrayList<>();
        if (config.whereClause() != null && !config.whereClause().isBlank()) {
            conditions.add("(" + config.whereClause().trim() + ")");
        }
        String term = query == null ? "" : query.normalized().trim();
        if (!term.isEmpty()) {
            boolean fullText = dialect.features().fullText() && term.split("\\s+").length > 1;
            List<String> predicates = new ArrayList<>();
            for (String column : config.searchColumns()) {
                String placeholder = params.add(fullText ? term : "%" + term + "%");
                predicates.add(dialect.searchPredicate(dialect.quoteIdentifier(column), placeholder, fullText));
            }
            String joined = String.join(" OR ", predicates);
            boolean wrap = predicates.size() > 1 || !conditions.isEmpty();
            conditions.add(wrap ? "(" + joined + ")" : joined);
        }
        return conditions.isEmpty() ? "" : "WHERE " + String.join(" AND ", conditions);
    }

    private String groupByClause(SqlQueryConfig config) {
        if (config.groupBy().isEmpty()) {
            return "";
        }
        List<String> rendered = new ArrayList<>();
        for (String column : config.groupBy()) {
            rendered.add(renderColumnExpression(column));
        }
        return "GROUP BY " + String.join(", ", rendered);
    }

    private String orderByClause(SqlQueryConfig config) {
        if (config.orderBy().isEmpty()) {
            return "";
        }
        List<String> rendered = new ArrayList<>();
        for (SqlQueryConfig.Order order : config.orderBy()) {
            rendered.add(renderColumnExpression(order.column()) + " " + parseDirection(order.direction()));
        }
        return "ORDER BY " + String.join(", ", rendered);
    }

    private String equalityConditions(Map<String, ?> conditions, Parameters params) {
        List<String> rendered = new ArrayList<>();
        for (Map.Entry<String, ?> entry : conditions.entrySet()) {
            requireIdentifier(entry.getKey(), "conditions");
            rendered.add(dialect.quoteIdentifier(entry.getKey()) + " = " + params.add(entry.getValue()));
        }
        return String.join(" AND ", rendered);
    }

    // --- expressions and validation ---

    private String renderColumnExpression(String expression) {
        String trimmed = expression.trim();
        Matcher alias = ALIAS.matcher(trimmed);
        if (alias.matches()) {
            return renderColumnExpression(alias.group(1)) + " AS " + dialect.quoteIdentifier(alias.group(2));
        }
        if (isSqlFunction(trimmed)) {
            return trimmed;
        }
        return dialect.quoteIdentifier(trimmed);
    }

    private void requireColumnExpression(String expression, String field) {
        if (expression == null || expression.isBlank()) {
            throw new ConfigValidationException("Column names must be non-empty", field);
        }
        String trimmed = expression.trim();
        Matcher alias = ALIAS.matcher(trimmed);
        if (alias.matches()) {
            requireColumnExpression(alias.group(1), field);
            requireIdentifier(alias.group(2), field);
            return;
        }
        if (!isSqlFunction(trimmed) && !dialect.isValidIdentifier(trimmed)) {
            throw new ConfigValidationException("Invalid column name: " + expression, field);
        }
    }

    private void requireIdentifier(String name, String field) {
        if (!dialect.isValidIdentifier(name)) {
            throw new ConfigValidationException("Invalid identifier: " + name, field);
        }
    }

    private String[] parseJoinCondition(String condition) {
        Matcher m = JOIN_CONDITION.matcher(condition == null ? "" : condition);
        if (!m.matches() || !dialect.isValidIdentifier(m.group(1)) || !dialect.isValidIdentifier(m.group(2))) {
            throw new ConfigValidationException(
                    "JOIN condition must compare two column references: " + condition, "query.joins.condition");
        }
        return new String[] {m.group(1), m.group(2)};
    }

    private static String parseDirection(String direction) {
        String normalized = direction == null ? "ASC" : direction.trim().toUpperCase(Locale.ROOT);
        if (!"ASC".equals(normalized) && !"DESC".equals(normalized)) {
            throw new ConfigValidationException("Invalid order direction: " + direction, "query.orderBy.direction");
        }
        return normalized;
    }

    private static void requireSafeFragment(String fragment, String field) {
        if (fragment != null && UNSAFE_FRAGMENT.matcher(fragment).find()) {
            throw new ConfigValidationException("Statement separators and comments are not allowed", field);
        }
    }

    private static void requireNonEmpty(Map<String, ?> values, String field) {
        if (values == null || values.isEmpty()) {
            throw new ConfigValidationException("At least one column is required", field);
        }
    }

    private static void addIfPresent(List<String> parts, String clause) {
        if (!clause.isEmpty()) {
            parts.add(clause);
        }
    }

    /** Collects bound values for one statement. */
    private final class Parameters {

        private final List<Object> values = new ArrayList<>();

        String add(Object value) {
            String placeholder = dialect.placeholder(values.size());
            values.add(value);
            return placeholder;
        }

        ParameterizedQuery toQuery(String sql, QueryType type, Integer estimatedRows) {
            List<ParameterType> types = new ArrayList<>(values.size());
            for (Object value : values) {
                types.add(ParameterType.infer(value));
            }
            return new ParameterizedQuery(sql, values, types, type, estimatedRows);
        }
    }
}

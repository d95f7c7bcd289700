package io.querybridge.core.sql;

import java.util.ArrayList;
import java.util.List;

/**
 * Declarative description of a search query. Column names are validated and
 * quoted by {@link QueryBuilder}; {@code whereClause} and {@code having} are
 * trusted fragments written by the application developer, never by end users.
 *
 * @param tableName     primary table
 * @param searchColumns columns matched against the search term
 * @param selectColumns columns to return; defaults to the search columns
 * @param joins         additional joined tables
 * @param whereClause   static filter AND-ed with the search predicate
 * @param orderBy       ordering
 * @param groupBy       grouping columns
 * @param having        filter on groups
 */
public record SqlQueryConfig(
        String tableName,
        List<String> searchColumns,
        List<String> selectColumns,
        List<Join> joins,
        String whereClause,
        List<Order> orderBy,
        List<String> groupBy,
        String having) {

    public SqlQueryConfig {
        searchColumns = searchColumns == null ? List.of() : List.copyOf(searchColumns);
        selectColumns = selectColumns == null ? List.of() : List.copyOf(selectColumns);
        joins = joins == null ? List.of() : List.copyOf(joins);
        orderBy = orderBy == null ? List.of() : List.copyOf(orderBy);
        groupBy = groupBy == null ? List.of() : List.copyOf(groupBy);
    }

    /**
     * A joined table.
     *
     * @param table     joined table name
     * @param type      INNER, LEFT, RIGHT or FULL
     * @param condition equality between two column references, e.g. {@code products.id = stock.product_id}
     */
    public record Join(String table, String type, String condition) {}

    /**
     * One ORDER BY term.
     *
     * @param column    column reference
     * @param direction ASC or DESC
     */
    public record Order(String column, String direction) {}

    public static Builder builder(String tableName) {
        return new Builder(tableName);
    }

    /** Builder for {@link SqlQueryConfig}. */
    public static final class Builder {

        private final String tableName;
        private final List<String> searchColumns = new ArrayList<>();
        private final List<String> selectColumns = new ArrayList<>();
        private final List<Join> joins = new ArrayList<>();
        private String whereClause;
        private final List<Order> orderBy = new ArrayList<>();
        private final List<String> groupBy = new ArrayList<>();
        private String having;

        private Builder(String tableName) {
            this.tableName = tableName;
        }

        public Builder searchColumns(String... columns) {
            searchColumns.addAll(List.of(columns));
            return this;
        }

        public Builder selectColumns(String... columns) {
            selectColumns.addAll(List.of(columns));
            return this;
        }

        public Builder join(String table, String type, String condition) {
            joins.add(new Join(table, type, condition));
            return this;
        }

        public Builder where(String clause) {
            this.whereClause = clause;
            return this;
        }

        public Builder orderBy(String column, String direction) {
            orderBy.add(new Order(column, direction));
            return this;
        }

        public Builder groupBy(String... columns) {
            groupBy.addAll(List.of(columns));
            return this;
        }

        public Builder having(String clause) {
            this.having = clause;
            return this;
        }

        public SqlQueryConfig build() {
            return new SqlQueryConfig(
                    tableName, searchColumns, selectColumns, joins, whereClause, orderBy, groupBy, having);
        }
    }
}

package io.querybridge.proxy.search;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Body of {@code POST /search}.
 *
 * @param searchTerm   text to look for, 1 to 200 characters
 * @param tableName    table to search
 * @param searchFields columns to match, 1 to 10
 * @param limit        page size, 1 to 100
 * @param offset       rows to skip
 * @param orderBy      {@code column [ASC|DESC]}, or {@code null}
 */
public record SearchRequest(
        String searchTerm, String tableName, List<String> searchFields, int limit, int offset, String orderBy) {

    static final int DEFAULT_LIMIT = 20;
    static final int MAX_TERM_LENGTH = 200;
    static final int MAX_FIELDS = 10;
    static final int MAX_LIMIT = 100;

    private static final Pattern IDENTIFIER = Pattern.compile("^[a-zA-Z][a-zA-Z0-9_]*$");
    private static final Pattern ORDER_BY = Pattern.compile("^[a-zA-Z][a-zA-Z0-9_]*( ASC| DESC)?$");

    public SearchRequest {
        searchFields = List.copyOf(searchFields);
    }

    /**
     * Validates and reads a request body.
     *
     * @throws RequestValidationException listing every violated rule
     */
    public static SearchRequest parse(JsonNode body) {
        List<String> errors = new ArrayList<>();
        if (body == null || !body.isObject()) {
            throw new RequestValidationException(List.of("Request body must be a JSON object"));
        }

        String term = body.path("searchTerm").isTextual() ? body.get("searchTerm").asText().trim() : null;
        if (term == null || term.isEmpty() || term.length() > MAX_TERM_LENGTH) {
            errors.add("Search term must be between 1 and " + MAX_TERM_LENGTH + " characters");
        }

        String table = body.path("tableName").isTextual() ? body.get("tableName").asText().trim() : null;
        if (table == null || !IDENTIFIER.matcher(table).matches()) {
            errors.add("Invalid table name format");
        }

        List<String> fields = new ArrayList<>();
        JsonNode fieldsNode = body.path("searchFields");
        if (!fieldsNode.isArray() || fieldsNode.size() < 1 || fieldsNode.size() > MAX_FIELDS) {
            errors.add("Search fields must be an array with 1-" + MAX_FIELDS + " items");
        } else {
            for (JsonNode field : fieldsNode) {
                String name = field.isTextual() ? field.asText().trim() : "";
                if (!IDENTIFIER.matcher(name).matches()) {
                    errors.add("Invalid search field format: " + field.asText());
                } else {
                    fields.add(name);
                }
            }
        }

        int limit = DEFAULT_LIMIT;
        JsonNode limitNode = body.path("limit");
        if (!limitNode.isMissingNode() && !limitNode.isNull()) {
            if (!limitNode.canConvertToInt() || !limitNode.isIntegralNumber()
                    || limitNode.asInt() < 1 || limitNode.asInt() > MAX_LIMIT) {
                errors.add("Limit must be between 1 and " + MAX_LIMIT);
            } else {
                limit = limitNode.asInt();
            }
        }

        int offset = 0;
        JsonNode offsetNode = body.path("offset");
        if (!offsetNode.isMissingNode() && !offsetNode.isNull()) {
            if (!offsetNode.isIntegralNumber() || !offsetNode.canConvertToInt() || offsetNode.asInt() < 0) {
                errors.add("Offset must be a non-negative integer");
            } else {
                offset = offsetNode.asInt();
            }
        }

        String orderBy = null;
        JsonNode orderNode = body.path("orderBy");
        if (!orderNode.isMissingNode() && !orderNode.isNull()) {
            if (!orderNode.isTextual() || !ORDER_BY.matcher(orderNode.asText()).matches()) {
                errors.add("Invalid order by format");
            } else {
                orderBy = orderNode.asText();
            }
        }

        if (!errors.isEmpty()) {
            throw new RequestValidationException(errors);
        }
        return new SearchRequest(term, table, fields, limit, offset, orderBy);
    }

    /** Column part of {@link #orderBy}, or {@code null}. */
    public String orderColumn() {
        return orderBy == null ? null : orderBy.split(" ")[0];
    }

    /** Direction part of {@link #orderBy}, {@code ASC} when omitted. */
    public String orderDirection() {
        return orderBy == null || !orderBy.endsWith(" DESC") ? "ASC" : "DESC";
    }
}

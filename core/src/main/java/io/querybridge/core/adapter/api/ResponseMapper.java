package io.querybridge.core.adapter.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import com.schibsted.spt.data.jslt.Expression;
import com.schibsted.spt.data.jslt.JsltException;
import com.schibsted.spt.data.jslt.Parser;
import io.querybridge.core.adapter.JsonPaths;
import io.querybridge.core.config.ResponseConfig;
import io.querybridge.core.error.ConfigValidationException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Compiled response handling for one API data source: JSLT transform, schema
 * check, then item extraction at {@code dataPath} with field renames. Immutable
 * and thread-safe once built.
 */
final class ResponseMapper {

    private static final JsonSchemaFactory SCHEMA_FACTORY =
            JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);

    private final ResponseConfig config;
    private final Expression transform;
    private final JsonSchema schema;

    /** @throws ConfigValidationException if the JSLT expression or the schema does not compile */
    ResponseMapper(ResponseConfig config) {
        this.config = config;
        this.transform = compileTransform(config.transform());
        this.schema = compileSchema(config.schema());
    }

    /**
     * Applies the transform and the schema check to a whole response body.
     *
     * @throws ResponseMappingException when the transform fails or the result violates the schema
     */
    JsonNode transform(JsonNode body) {
        JsonNode out = body;
        if (transform != null) {
            try {
                out = transform.apply(body);
            } catch (JsltException e) {
                throw new ResponseMappingException(false, "Response transform failed: " + e.getMessage(), e);
            }
        }
        if (schema != null) {
            Set<ValidationMessage> errors = schema.validate(out);
            if (!errors.isEmpty()) {
                String detail = errors.stream()
                        .map(ValidationMessage::getMessage)
                        .sorted()
                        .collect(Collectors.joining("; "));
                throw new ResponseMappingException(true, "Response does not match schema: " + detail, null);
            }
        }
        return out;
    }

    /** Items at {@code dataPath}; a single object becomes a one-item list, a missing path none. */
    List<JsonNode> items(JsonNode body) {
        JsonNode data = config.dataPath() == null ? body : JsonPaths.at(body, config.dataPath());
        List<JsonNode> items = new ArrayList<>();
        if (JsonPaths.isAbsent(data)) {
            return items;
        }
        if (data.isArray()) {
            data.forEach(items::add);
        } else {
            items.add(data);
        }
        return items;
    }

    /** Copies {@code item} and sets each mapped target field from its source path. */
    JsonNode mapFields(JsonNode item) {
        if (config.fieldMappings().isEmpty() || !item.isObject()) {
            return item;
        }
        ObjectNode copy = ((ObjectNode) item).deepCopy();
        for (Map.Entry<String, String> mapping : config.fieldMappings().entrySet()) {
            JsonNode source = JsonPaths.at(item, mapping.getValue());
            if (!JsonPaths.isAbsent(source)) {
                copy.set(mapping.getKey(), source);
            }
        }
        return copy;
    }

    private static Expression compileTransform(String expression) {
        if (expression == null || expression.isBlank()) {
            return null;
        }
        try {
            return Parser.compileString(expression);
        } catch (JsltException e) {
            throw new ConfigValidationException(
                    "Failed to compile response transform: " + e.getMessage(), "response.transform");
        }
    }

    private static JsonSchema compileSchema(JsonNode schemaNode) {
        if (schemaNode == null || schemaNode.isNull() || schemaNode.isMissingNode()) {
            return null;
        }
        if (!schemaNode.isObject()) {
            throw new ConfigValidationException("Response schema must be an object", "response.schema");
        }
        try {
            return SCHEMA_FACTORY.getSchema(schemaNode);
        } catch (RuntimeException e) {
            throw new ConfigValidationException("Invalid response schema: " + e.getMessage(), "response.schema");
        }
    }

    /** The body could not be transformed or failed the schema. */
    static final class ResponseMappingException extends RuntimeException {

        private static final long serialVersionUID = 1L;

        private final boolean schemaViolation;

        ResponseMappingException(boolean schemaViolation, String message, Throwable cause) {
            super(message, cause);
            this.schemaViolation = schemaViolation;
        }

        boolean schemaViolation() {
            return schemaViolation;
        }
    }
}

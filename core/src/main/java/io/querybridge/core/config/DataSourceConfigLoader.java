package io.querybridge.core.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import io.querybridge.core.cors.CorsConfig;
import io.querybridge.core.error.ConfigValidationException;
import io.querybridge.core.ratelimit.BackoffStrategy;
import io.querybridge.core.ratelimit.RateLimitConfig;
import io.querybridge.core.sql.DatabaseType;
import io.querybridge.core.sql.SqlQueryConfig;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Loads a {@link DataSourceConfig} from YAML.
 *
 * <p>
 * The document is validated against
 * {@code schemas/datasource-config.schema.json} before it is mapped; its
 * {@code type} key selects the memory, sql or api variant. String values may
 * reference environment variables as {@code ${NAME}} or
 * {@code ${NAME:-default}}. A variable whose value is blank counts as unset.
 */
public final class DataSourceConfigLoader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final JsonSchemaFactory SCHEMA_FACTORY =
            JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);
    private static final String SCHEMA_RESOURCE = "/schemas/datasource-config.schema.json";
    private static final Pattern PLACEHOLDER =
            Pattern.compile("\\$\\{([A-Za-z_][A-Za-z0-9_]*)(?::-([^}]*))?}");

    private static final JsonSchema SCHEMA = loadSchema();

    private DataSourceConfigLoader() {
        // utility class
    }

    /** Loads {@code configPath}, resolving placeholders from {@link System#getenv}. */
    public static DataSourceConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads {@code configPath}, resolving placeholders through
     * {@code envLookup}. A relative {@code dataFile} of a memory source is
     * resolved against the directory of the file.
     *
     * @throws ConfigLoadException if the file is missing, unreadable, invalid or references an unset
     *     variable
     */
    public static DataSourceConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException("Configuration file not found: " + configPath);
        }
        JsonNode root;
        try (InputStream in = Files.newInputStream(configPath)) {
            root = YAML_MAPPER.readTree(in);
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        }
        Path baseDir = configPath.toAbsolutePath().getParent();
        return fromTree(root, envLookup, baseDir);
    }

    /** Parses a YAML document, resolving placeholders from {@link System#getenv}. */
    public static DataSourceConfig fromYaml(String yaml) {
        return fromYaml(yaml, System::getenv);
    }

    public static DataSourceConfig fromYaml(String yaml, Function<String, String> envLookup) {
        JsonNode root;
        try {
            root = YAML_MAPPER.readTree(yaml);
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration", e);
        }
        return fromTree(root, envLookup, null);
    }

    private static DataSourceConfig fromTree(JsonNode root, Function<String, String> envLookup, Path baseDir) {
        if (root == null || !root.isObject()) {
            throw new ConfigLoadException("Configuration must be a YAML mapping");
        }
        JsonNode resolved = resolvePlaceholders(root, envLookup);
        Set<ValidationMessage> errors = SCHEMA.validate(resolved);
        if (!errors.isEmpty()) {
            String detail = errors.stream().map(ValidationMessage::getMessage).sorted().collect(Collectors.joining("; "));
            throw new ConfigLoadException("Invalid data source configuration: " + detail);
        }
        try {
            return switch (DataSourceType.fromId(resolved.get("type").asText())) {
                case MEMORY -> memory(resolved, baseDir);
                case SQL -> sql(resolved);
                case API -> api(resolved);
            };
        } catch (ConfigValidationException | IllegalArgumentException e) {
            throw new ConfigLoadException("Invalid data source configuration: " + e.getMessage(), e);
        }
    }

    // --- placeholders ---

    static JsonNode resolvePlaceholders(JsonNode node, Function<String, String> envLookup) {
        if (node.isTextual()) {
            return new TextNode(substitute(node.asText(), envLookup));
        }
        if (node.isObject()) {
            ObjectNode copy = YAML_MAPPER.createObjectNode();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                copy.set(field.getKey(), resolvePlaceholders(field.getValue(), envLookup));
            }
            return copy;
        }
        if (node.isArray()) {
            ArrayNode copy = YAML_MAPPER.createArrayNode();
            node.forEach(item -> copy.add(resolvePlaceholders(item, envLookup)));
            return copy;
        }
        return node;
    }

    private static String substitute(String text, Function<String, String> envLookup) {
        Matcher matcher = PLACEHOLDER.matcher(text);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            String name = matcher.group(1);
            String value = envLookup.apply(name);
            if (value == null || value.isBlank()) {
                value = matcher.group(2);
            }
            if (value == null) {
                throw new ConfigLoadException("Environment variable " + name + " is not set");
            }
            matcher.appendReplacement(out, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    // --- variants ---

    private static MemoryDataSourceConfig memory(JsonNode root, Path baseDir) {
        List<JsonNode> records = new ArrayList<>();
        if (root.has("data")) {
            root.get("data").forEach(records::add);
        } else {
            Path file = Path.of(root.get("dataFile").asText());
            if (!file.isAbsolute() && baseDir != null) {
                file = baseDir.resolve(file);
            }
            records.addAll(readRecords(file));
        }
        List<JsonNode> data = List.copyOf(records);
        return new MemoryDataSourceConfig(
                () -> data,
                stringList(root.get("searchFields")),
                root.path("caseSensitive").asBoolean(false),
                options(root.get("options")));
    }

    private static List<JsonNode> readRecords(Path file) {
        if (!Files.exists(file)) {
            throw new ConfigLoadException("Data file not found: " + file);
        }
        try (InputStream in = Files.newInputStream(file)) {
            JsonNode tree = YAML_MAPPER.readTree(in);
            if (tree == null || !tree.isArray()) {
                throw new ConfigLoadException("Data file must contain a list of records: " + file);
            }
            List<JsonNode> records = new ArrayList<>();
            tree.forEach(records::add);
            return records;
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to read data file: " + file, e);
        }
    }

    private static SqlDataSourceConfig sql(JsonNode root) {
        JsonNode conn = root.get("connection");
        SqlDataSourceConfig.SqlConnection connection = new SqlDataSourceConfig.SqlConnection(
                optionalString(conn, "connectionString"),
                optionalString(conn, "proxyEndpoint"),
                DatabaseType.fromId(requireString(conn, "databaseType", "connection")),
                optionalString(conn, "databaseVersion"),
                conn.path("validationTimeoutMs").asLong(5_000),
                conn.path("ssl").asBoolean(false));

        JsonNode q = root.get("query");
        SqlQueryConfig.Builder query = SqlQueryConfig.builder(requireString(q, "tableName", "query"))
                .searchColumns(stringList(q.get("searchColumns")).toArray(String[]::new))
                .selectColumns(stringList(q.get("selectColumns")).toArray(String[]::new))
                .groupBy(stringList(q.get("groupBy")).toArray(String[]::new))
                .where(optionalString(q, "whereClause"))
                .having(optionalString(q, "having"));
        q.path("joins").forEach(j -> query.join(
                j.get("table").asText(), j.path("type").asText("INNER"), j.get("condition").asText()));
        q.path("orderBy").forEach(o -> query.orderBy(o.get("column").asText(), o.path("direction").asText("ASC")));

        SqlDataSourceConfig.Pagination pagination = SqlDataSourceConfig.Pagination.DEFAULT;
        if (root.has("pagination")) {
            JsonNode p = root.get("pagination");
            SqlDataSourceConfig.Pagination d = SqlDataSourceConfig.Pagination.DEFAULT;
            pagination = new SqlDataSourceConfig.Pagination(
                    p.path("maxResults").asInt(d.maxResults()),
                    p.path("pageSize").asInt(d.pageSize()),
                    p.path("enablePagination").asBoolean(d.enablePagination()),
                    SqlDataSourceConfig.PaginationType.fromId(optionalString(p, "type")),
                    optionalString(p, "cursorColumn"));
        }

        SqlDataSourceConfig.SqlSecurity security = SqlDataSourceConfig.SqlSecurity.DEFAULT;
        if (root.has("security")) {
            JsonNode s = root.get("security");
            security = new SqlDataSourceConfig.SqlSecurity(
                    s.path("preventSqlInjection").asBoolean(true),
                    s.path("validateConnectionString").asBoolean(true),
                    new LinkedHashSet<>(stringList(s.get("allowedOperations"))),
                    s.path("logQueries").asBoolean(false));
        }
        return new SqlDataSourceConfig(connection, query.build(), pagination, security, options(root.get("options")));
    }

    private static ApiDataSourceConfig api(JsonNode root) {
        ApiDataSourceConfig.Builder builder = ApiDataSourceConfig.builder(requireString(root, "url", null))
                .method(optionalString(root, "method"))
                .queryParam(optionalString(root, "queryParam"))
                .auth(auth(root.get("auth")))
                .requestTransform(requestTransform(root.get("requestTransform")))
                .cors(cors(root.get("cors")))
                .rateLimit(rateLimit(root.get("rateLimit")))
                .response(response(root.get("response")))
                .options(options(root.get("options")));
        stringMap(root.get("headers")).forEach(builder::header);
        return builder.build();
    }

    private static ApiAuth auth(JsonNode node) {
        if (node == null) {
            return ApiAuth.NONE;
        }
        return switch (node.get("type").asText()) {
            case "apikey" -> new ApiAuth.ApiKey(
                    requireString(node, "key", "auth"), optionalString(node, "header"), optionalString(node, "queryParam"));
            case "bearer" -> new ApiAuth.Bearer(requireString(node, "token", "auth"));
            case "basic" -> new ApiAuth.Basic(
                    requireString(node, "username", "auth"), requireString(node, "password", "auth"));
            case "oauth2" -> new ApiAuth.OAuth2(
                    requireString(node, "clientId", "auth"),
                    requireString(node, "clientSecret", "auth"),
                    optionalString(node, "authUrl"),
                    requireString(node, "tokenUrl", "auth"),
                    stringList(node.get("scopes")),
                    optionalString(node, "grantType"));
            default -> ApiAuth.NONE;
        };
    }

    private static RequestTransform requestTransform(JsonNode node) {
        if (node == null) {
            return RequestTransform.NONE;
        }
        RequestTransform.QueryMapping mapping = null;
        if (node.has("queryMapping")) {
            JsonNode m = node.get("queryMapping");
            mapping = new RequestTransform.QueryMapping(
                    m.get("field").asText(),
                    RequestTransform.QueryTextTransform.fromId(optionalString(m, "transform")));
        }
        RequestTransform.GraphQl graphql = null;
        if (node.has("graphql")) {
            JsonNode g = node.get("graphql");
            graphql = new RequestTransform.GraphQl(
                    g.get("query").asText(), objectMap(g.get("variables")), optionalString(g, "operationName"));
        }
        return new RequestTransform(
                mapping, objectMap(node.get("additionalParams")), stringMap(node.get("dynamicHeaders")), graphql);
    }

    private static CorsConfig cors(JsonNode node) {
        if (node == null) {
            return CorsConfig.DISABLED;
        }
        return new CorsConfig(
                node.path("enabled").asBoolean(true),
                new LinkedHashSet<>(stringList(node.get("allowedMethods"))),
                stringList(node.get("allowedHeaders")),
                optionalString(node, "jsonpCallback"),
                optionalString(node, "proxyUrl"),
                node.path("autoFallback").asBoolean(true),
                optionalString(node, "origin"));
    }

    private static RateLimitConfig rateLimit(JsonNode node) {
        if (node == null) {
            return null;
        }
        return new RateLimitConfig(
                node.get("requestsPerMinute").asInt(),
                node.path("requestsPerSecond").asDouble(0),
                node.path("burstLimit").asInt(0),
                node.path("queueSize").asInt(RateLimitConfig.DEFAULT_QUEUE_SIZE),
                BackoffStrategy.fromId(optionalString(node, "backoffStrategy")),
                node.path("initialBackoffMs").asLong(1_000),
                node.path("maxBackoffMs").asLong(30_000));
    }

    private static ResponseConfig response(JsonNode node) {
        if (node == null) {
            return ResponseConfig.DEFAULT;
        }
        ResponseConfig.Cache cache = ResponseConfig.Cache.DEFAULT;
        if (node.has("cache")) {
            JsonNode c = node.get("cache");
            cache = new ResponseConfig.Cache(
                    c.path("enabled").asBoolean(true),
                    c.path("ttlMs").asLong(ResponseConfig.Cache.DEFAULT.ttlMs()),
                    c.path("maxSize").asInt(ResponseConfig.Cache.DEFAULT.maxSize()));
        }
        return new ResponseConfig(
                optionalString(node, "dataPath"),
                stringMap(node.get("fieldMappings")),
                optionalString(node, "transform"),
                node.get("schema"),
                cache);
    }

    private static ConnectionOptions options(JsonNode node) {
        if (node == null) {
            return ConnectionOptions.DEFAULT;
        }
        ConnectionOptions.Retry retry = ConnectionOptions.Retry.DEFAULT;
        if (node.has("retry")) {
            JsonNode r = node.get("retry");
            retry = new ConnectionOptions.Retry(
                    r.path("attempts").asInt(retry.attempts()),
                    r.path("backoffMs").asLong(retry.backoffMs()),
                    r.path("maxBackoffMs").asLong(retry.maxBackoffMs()));
        }
        ConnectionOptions.Pooling pooling = ConnectionOptions.Pooling.DEFAULT;
        if (node.has("pooling")) {
            JsonNode p = node.get("pooling");
            pooling = new ConnectionOptions.Pooling(
                    p.path("enabled").asBoolean(true),
                    p.path("maxConnections").asInt(pooling.maxConnections()),
                    p.path("idleTimeoutMs").asLong(pooling.idleTimeoutMs()));
        }
        ConnectionOptions.Security security = ConnectionOptions.Security.DEFAULT;
        if (node.has("security")) {
            JsonNode s = node.get("security");
            security = new ConnectionOptions.Security(
                    s.path("validateInput").asBoolean(security.validateInput()),
                    s.path("sanitizeQueries").asBoolean(security.sanitizeQueries()),
                    s.path("rateLimitRpm").asInt(security.rateLimitRpm()));
        }
        return new ConnectionOptions(
                node.path("timeoutMs").asLong(ConnectionOptions.DEFAULT.timeoutMs()), retry, pooling, security);
    }

    // --- helpers ---

    private static String requireString(JsonNode node, String field, String parent) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual() || value.asText().isBlank()) {
            String path = parent == null ? field : parent + "." + field;
            throw new ConfigLoadException("Missing required field '" + path + "'");
        }
        return value.asText();
    }

    private static String optionalString(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static List<String> stringList(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node != null) {
            node.forEach(item -> values.add(item.asText()));
        }
        return values;
    }

    private static Map<String, String> stringMap(JsonNode node) {
        Map<String, String> values = new LinkedHashMap<>();
        if (node != null) {
            node.fields().forEachRemaining(f -> values.put(f.getKey(), f.getValue().asText()));
        }
        return values;
    }

    private static Map<String, Object> objectMap(JsonNode node) {
        if (node == null || !node.isObject()) {
            return Map.of();
        }
        return YAML_MAPPER.convertValue(node, new TypeReference<LinkedHashMap<String, Object>>() {});
    }

    private static JsonSchema loadSchema() {
        try (InputStream in = DataSourceConfigLoader.class.getResourceAsStream(SCHEMA_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing classpath resource " + SCHEMA_RESOURCE);
            }
            return SCHEMA_FACTORY.getSchema(new ObjectMapper().readTree(in));
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load " + SCHEMA_RESOURCE, e);
        }
    }
}

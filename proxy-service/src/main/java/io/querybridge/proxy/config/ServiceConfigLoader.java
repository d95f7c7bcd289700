package io.querybridge.proxy.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.querybridge.core.config.ConfigLoadException;
import io.querybridge.core.error.ConfigValidationException;
import io.querybridge.core.sql.DatabaseType;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.IntConsumer;
import java.util.stream.Collectors;

/**
 * Loads {@link ServiceConfig} from YAML with an environment-variable overlay.
 *
 * <p>
 * Every scalar key can be overridden by an environment variable, which takes
 * precedence over the file. A variable counts as set only when it is defined
 * and non-blank after trimming. List-valued variables ({@code API_KEYS},
 * {@code RELAY_ALLOWED_HOSTS}) are comma separated.
 */
public final class ServiceConfigLoader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    static final String DEFAULT_CONFIG_FILE = "querybridge-proxy.yaml";

    private ServiceConfigLoader() {
        // utility class
    }

    public static ServiceConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * @param envLookup environment lookup; {@code null} means the variable is not defined
     * @throws ConfigLoadException if the file is missing, not YAML, or describes an invalid config
     */
    public static ServiceConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException(
                    "Configuration file not found: " + configPath + ". Use --config <path> to specify a config file.");
        }
        try (InputStream in = Files.newInputStream(configPath)) {
            JsonNode root = YAML_MAPPER.readTree(in);
            return mapToConfig(root == null ? YAML_MAPPER.createObjectNode() : root, envLookup);
        } catch (ConfigLoadException e) {
            throw e;
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        } catch (IllegalArgumentException | ConfigValidationException e) {
            throw new ConfigLoadException("Invalid configuration in " + configPath + ": " + e.getMessage(), e);
        }
    }

    /** The path after {@code --config}, or {@value #DEFAULT_CONFIG_FILE} in the working directory. */
    public static Path resolveConfigPath(String[] args) {
        for (int i = 0; i < args.length; i++) {
            if ("--config".equals(args[i])) {
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("--config requires a file path argument");
                }
                return Path.of(args[i + 1]);
            }
        }
        return Path.of(DEFAULT_CONFIG_FILE);
    }

    private static ServiceConfig mapToConfig(JsonNode root, Function<String, String> env) {
        ServiceConfig.Builder builder = ServiceConfig.builder();

        JsonNode server = root.path("server");
        if (server.has("host")) builder.host(server.get("host").asText());
        if (server.has("port")) builder.port(server.get("port").asInt());

        JsonNode database = root.path("database");
        if (database.has("connection-string")) builder.connectionString(database.get("connection-string").asText());
        if (database.has("type")) builder.databaseType(DatabaseType.fromId(database.get("type").asText()));
        if (database.has("ssl")) builder.ssl(database.get("ssl").asBoolean());
        if (database.has("validation-timeout-ms"))
            builder.validationTimeoutMs(database.get("validation-timeout-ms").asLong());
        if (database.has("max-connections")) builder.maxConnections(database.get("max-connections").asInt());
        if (database.has("validate-connection-string"))
            builder.validateConnectionString(database.get("validate-connection-string").asBoolean());

        JsonNode tables = root.path("search").path("tables");
        tables.fields().forEachRemaining(entry -> builder.table(entry.getKey(), textList(entry.getValue())));

        JsonNode auth = root.path("auth");
        if (auth.has("enabled")) builder.authEnabled(auth.get("enabled").asBoolean());
        if (auth.has("api-keys")) builder.apiKeys(new LinkedHashSet<>(textList(auth.get("api-keys"))));

        JsonNode rateLimit = root.path("rate-limit");
        if (rateLimit.has("requests-per-minute"))
            builder.rateLimitPerMinute(rateLimit.get("requests-per-minute").asInt());

        JsonNode relay = root.path("relay");
        if (relay.has("enabled")) builder.relayEnabled(relay.get("enabled").asBoolean());
        if (relay.has("allowed-hosts"))
            builder.relayAllowedHosts(new LinkedHashSet<>(textList(relay.get("allowed-hosts"))));
        if (relay.has("timeout-ms")) builder.relayTimeoutMs(relay.get("timeout-ms").asLong());

        JsonNode logging = root.path("logging");
        if (logging.has("format")) builder.loggingFormat(logging.get("format").asText());
        if (logging.has("level")) builder.loggingLevel(logging.get("level").asText());

        applyEnvOverrides(builder, env);
        return builder.build();
    }

    private static void applyEnvOverrides(ServiceConfig.Builder builder, Function<String, String> env) {
        envString(env, "SERVER_HOST", builder::host);
        envInt(env, "SERVER_PORT", builder::port);
        envString(env, "DATABASE_URL", builder::connectionString);
        envString(env, "DATABASE_TYPE", value -> builder.databaseType(DatabaseType.fromId(value)));
        envBool(env, "DATABASE_SSL", builder::ssl);
        envInt(env, "DATABASE_MAX_CONNECTIONS", builder::maxConnections);
        envBool(env, "AUTH_ENABLED", builder::authEnabled);
        envString(env, "API_KEYS", value -> builder.apiKeys(commaSeparated(value)));
        envInt(env, "RATE_LIMIT_RPM", builder::rateLimitPerMinute);
        envBool(env, "RELAY_ENABLED", builder::relayEnabled);
        envString(env, "RELAY_ALLOWED_HOSTS", value -> builder.relayAllowedHosts(commaSeparated(value)));
        envString(env, "LOG_FORMAT", builder::loggingFormat);
        envString(env, "LOG_LEVEL", builder::loggingLevel);
    }

    // --- env helpers ---

    private static boolean isSet(Function<String, String> env, String name) {
        String value = env.apply(name);
        return value != null && !value.trim().isEmpty();
    }

    private static void envString(Function<String, String> env, String name, Consumer<String> setter) {
        if (isSet(env, name)) {
            setter.accept(env.apply(name).trim());
        }
    }

    private static void envInt(Function<String, String> env, String name, IntConsumer setter) {
        if (isSet(env, name)) {
            String value = env.apply(name).trim();
            try {
                setter.accept(Integer.parseInt(value));
            } catch (NumberFormatException e) {
                throw new ConfigLoadException("Environment variable " + name + " is not an integer: " + value, e);
            }
        }
    }

    private static void envBool(Function<String, String> env, String name, Consumer<Boolean> setter) {
        if (isSet(env, name)) {
            setter.accept(Boolean.parseBoolean(env.apply(name).trim()));
        }
    }

    private static Set<String> commaSeparated(String value) {
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    private static List<String> textList(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node.isArray()) {
            node.forEach(item -> values.add(item.asText()));
        } else if (node.isTextual()) {
            values.addAll(commaSeparated(node.asText()));
        }
        return values;
    }
}

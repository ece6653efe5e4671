package io.routedoc.standalone.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Loads {@link RouteDocConfig} from a YAML file with an environment variable overlay.
 *
 * <pre>
 * input: api.yaml
 * output: openapi.json
 * pretty: true
 * info: { title: Users API, version: "2.0" }
 * servers: [ https://api.example.com ]
 * logging: { format: json, level: DEBUG }
 * </pre>
 *
 * <p>
 * Environment variables ({@code ROUTEDOC_INPUT}, {@code ROUTEDOC_OUTPUT},
 * {@code ROUTEDOC_PRETTY}, {@code ROUTEDOC_INFO_TITLE}, {@code ROUTEDOC_INFO_VERSION},
 * {@code ROUTEDOC_LOGGING_FORMAT}, {@code ROUTEDOC_LOGGING_LEVEL}) take precedence over YAML
 * values. A variable counts as set only when it is defined and its trimmed value is non-empty.
 */
public final class ConfigLoader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final String DEFAULT_CONFIG_FILE = "routedoc.yaml";
    private static final Set<String> ROOT_KEYS = Set.of("input", "output", "pretty", "info", "servers", "logging");

    private ConfigLoader() {
        // utility class
    }

    /**
     * Loads the configuration, applying overrides from {@link System#getenv}.
     *
     * @throws ConfigLoadException if the file is missing, invalid, or lacks {@code input}
     */
    public static RouteDocConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads the configuration, applying overrides from the supplied lookup. The lookup returns
     * {@code null} for undefined variables.
     */
    public static RouteDocConfig load(Path configPath, Function<String, String> envLookup) {
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
        } catch (RuntimeException e) {
            throw new ConfigLoadException("Failed to load configuration from: " + configPath, e);
        }
    }

    /**
     * Resolves the config file path from command-line arguments: {@code --config <path>}, or
     * {@code routedoc.yaml} in the working directory.
     */
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

    private static RouteDocConfig mapToConfig(JsonNode root, Function<String, String> envLookup) {
        if (!root.isObject()) {
            throw new ConfigLoadException("Configuration root must be a mapping");
        }
        List<String> unknown = new ArrayList<>();
        root.fieldNames().forEachRemaining(name -> {
            if (!ROOT_KEYS.contains(name)) {
                unknown.add(name);
            }
        });
        if (!unknown.isEmpty()) {
            throw new ConfigLoadException("Unknown configuration keys: " + unknown);
        }

        RouteDocConfig.Builder builder = RouteDocConfig.builder();

        if (root.has("input")) builder.input(root.get("input").asText());
        if (root.has("output")) builder.output(root.get("output").asText());
        if (root.has("pretty")) {
            JsonNode pretty = root.get("pretty");
            if (!pretty.isBoolean()) {
                throw new ConfigLoadException("'pretty' must be true or false, got '" + pretty.asText() + "'");
            }
            builder.pretty(pretty.booleanValue());
        }

        JsonNode info = root.path("info");
        if (info.has("title")) builder.infoTitle(info.get("title").asText());
        if (info.has("version")) builder.infoVersion(info.get("version").asText());
        if (info.has("description")) builder.infoDescription(info.get("description").asText());
        if (info.has("license")) builder.infoLicense(info.get("license").asText());

        JsonNode servers = root.path("servers");
        if (servers.isArray()) {
            List<String> urls = new ArrayList<>();
            servers.forEach(url -> urls.add(url.asText()));
            builder.servers(urls);
        } else if (!servers.isMissingNode()) {
            throw new ConfigLoadException("'servers' must be a list of URLs");
        }

        JsonNode logging = root.path("logging");
        if (logging.has("format")) builder.loggingFormat(logging.get("format").asText());
        if (logging.has("level")) builder.loggingLevel(logging.get("level").asText());

        // --- Environment variable overlay ---
        envString(envLookup, "ROUTEDOC_INPUT", builder::input);
        envString(envLookup, "ROUTEDOC_OUTPUT", builder::output);
        envString(envLookup, "ROUTEDOC_INFO_TITLE", builder::infoTitle);
        envString(envLookup, "ROUTEDOC_INFO_VERSION", builder::infoVersion);
        envString(envLookup, "ROUTEDOC_LOGGING_FORMAT", builder::loggingFormat);
        envString(envLookup, "ROUTEDOC_LOGGING_LEVEL", builder::loggingLevel);
        envString(envLookup, "ROUTEDOC_PRETTY", value -> builder.pretty(parseBoolean("ROUTEDOC_PRETTY", value)));

        return builder.build();
    }

    private static boolean parseBoolean(String envVar, String value) {
        if ("true".equalsIgnoreCase(value)) {
            return true;
        }
        if ("false".equalsIgnoreCase(value)) {
            return false;
        }
        throw new ConfigLoadException(envVar + " must be 'true' or 'false', got '" + value + "'");
    }

    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    private static void envString(Function<String, String> envLookup, String envVar, Consumer<String> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(envLookup.apply(envVar).trim());
        }
    }
}

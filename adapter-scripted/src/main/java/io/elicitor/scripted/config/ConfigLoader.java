package io.elicitor.scripted.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.IntConsumer;

/**
 * Loads {@link ScriptedConfig} from a YAML file with an environment variable overlay.
 *
 * <pre>{@code
 * script: answers.yaml        # ELICITOR_SCRIPT
 * max-attempts: 3             # ELICITOR_MAX_ATTEMPTS
 * accept-suggestions: true    # ELICITOR_ACCEPT_SUGGESTIONS
 * output: json                # ELICITOR_OUTPUT (json | yaml)
 * responses-out: answers.json # ELICITOR_RESPONSES_OUT
 * logging:
 *   format: text              # ELICITOR_LOG_FORMAT (text | json)
 *   level: INFO               # ELICITOR_LOG_LEVEL
 * }</pre>
 *
 * <p>
 * Env vars take precedence over YAML values. An env var counts as set only if it is defined and
 * its trimmed value is non-empty. A relative {@code script} or {@code responses-out} path from the
 * YAML file is resolved against the file's directory.
 */
public final class ConfigLoader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final String DEFAULT_CONFIG_FILE = "elicitor-scripted.yaml";

    private ConfigLoader() {
        // utility class
    }

    /**
     * Loads configuration from {@code configPath}, overlaid with {@link System#getenv}.
     *
     * @throws ConfigLoadException if the file is missing, is not valid YAML or lacks a script
     */
    public static ScriptedConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads configuration from {@code configPath}, overlaid with variables from {@code envLookup}
     * ({@code null} means undefined).
     *
     * @throws ConfigLoadException if the file is missing, is not valid YAML or lacks a script
     */
    public static ScriptedConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException(
                    "Configuration file not found: " + configPath + ". Use --config <path> to specify a config file.");
        }
        try (InputStream in = Files.newInputStream(configPath)) {
            JsonNode root = YAML_MAPPER.readTree(in);
            Path baseDir = configPath.toAbsolutePath().getParent();
            return mapToConfig(root != null ? root : YAML_MAPPER.createObjectNode(), baseDir, envLookup);
        } catch (ConfigLoadException e) {
            throw e;
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        } catch (RuntimeException e) {
            throw new ConfigLoadException("Failed to load configuration from: " + configPath, e);
        }
    }

    /**
     * Loads configuration from environment variables only; used when no config file is given and
     * the default one does not exist.
     */
    public static ScriptedConfig fromEnvironment(Function<String, String> envLookup) {
        return mapToConfig(YAML_MAPPER.createObjectNode(), null, envLookup);
    }

    /** Resolves the config file path from {@code --config <path>}, or the default file name. */
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

    private static ScriptedConfig mapToConfig(JsonNode root, Path baseDir, Function<String, String> envLookup) {
        ScriptedConfig.Builder builder = ScriptedConfig.builder();

        // --- YAML mapping ---
        if (root.hasNonNull("script")) builder.script(resolve(baseDir, root.get("script").asText()));
        if (root.has("max-attempts")) builder.maxAttempts(intValue(root.get("max-attempts"), "max-attempts"));
        if (root.has("accept-suggestions")) builder.acceptSuggestions(root.get("accept-suggestions").asBoolean());
        if (root.hasNonNull("output")) builder.output(root.get("output").asText());
        if (root.hasNonNull("responses-out"))
            builder.responsesOut(resolve(baseDir, root.get("responses-out").asText()).toString());
        JsonNode logging = root.path("logging");
        if (logging.hasNonNull("format")) builder.loggingFormat(logging.get("format").asText());
        if (logging.hasNonNull("level")) builder.loggingLevel(logging.get("level").asText());

        // --- Env var overlay ---
        envString(envLookup, "ELICITOR_SCRIPT", builder::script);
        envInt(envLookup, "ELICITOR_MAX_ATTEMPTS", builder::maxAttempts);
        envBool(envLookup, "ELICITOR_ACCEPT_SUGGESTIONS", builder::acceptSuggestions);
        envString(envLookup, "ELICITOR_OUTPUT", builder::output);
        envString(envLookup, "ELICITOR_RESPONSES_OUT", builder::responsesOut);
        envString(envLookup, "ELICITOR_LOG_FORMAT", builder::loggingFormat);
        envString(envLookup, "ELICITOR_LOG_LEVEL", builder::loggingLevel);

        return builder.build();
    }

    private static Path resolve(Path baseDir, String value) {
        Path path = Path.of(value);
        return baseDir == null || path.isAbsolute() ? path : baseDir.resolve(path);
    }

    private static int intValue(JsonNode node, String key) {
        if (node.isIntegralNumber() && node.canConvertToInt()) {
            return node.intValue();
        }
        if (node.isTextual()) {
            return parseInt(node.asText(), key);
        }
        throw new ConfigLoadException("Invalid integer for " + key + ": " + node);
    }

    private static int parseInt(String value, String name) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigLoadException("Invalid integer for " + name + ": '" + value + "'", e);
        }
    }

    /** Returns {@code true} if the env var is defined and non-blank after trimming. */
    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    private static void envString(Function<String, String> envLookup, String envVar, Consumer<String> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(envLookup.apply(envVar).trim());
        }
    }

    private static void envInt(Function<String, String> envLookup, String envVar, IntConsumer setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(parseInt(envLookup.apply(envVar), envVar));
        }
    }

    private static void envBool(Function<String, String> envLookup, String envVar, Consumer<Boolean> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(Boolean.parseBoolean(envLookup.apply(envVar).trim()));
        }
    }
}

package io.markupxform.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.markupxform.core.error.ConfigLoadException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.IntConsumer;

/**
 * Loads {@link ExpanderConfig} from a YAML file with an optional environment variable overlay.
 *
 * <p>Example:
 *
 * <pre>{@code
 * expander:
 *   max-depth: 64
 * csv:
 *   default-separator: ","
 *   table-class: "moin-csv-table moin-sortable"
 * highlight:
 *   fallback-lexer: text
 * messages:
 *   locale: de
 * }</pre>
 *
 * <p>Every key can be overridden via an environment variable ({@code MARKUPXFORM_MAX_DEPTH}, {@code
 * MARKUPXFORM_CSV_SEPARATOR}, {@code MARKUPXFORM_CSV_TABLE_CLASS}, {@code
 * MARKUPXFORM_FALLBACK_LEXER}, {@code MARKUPXFORM_LOCALE}). Env vars take precedence over YAML
 * values. An env var is considered "set" if and only if it is defined AND its trimmed value is
 * non-empty.
 */
public final class ConfigLoader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    static final String ENV_MAX_DEPTH = "MARKUPXFORM_MAX_DEPTH";
    static final String ENV_CSV_SEPARATOR = "MARKUPXFORM_CSV_SEPARATOR";
    static final String ENV_CSV_TABLE_CLASS = "MARKUPXFORM_CSV_TABLE_CLASS";
    static final String ENV_FALLBACK_LEXER = "MARKUPXFORM_FALLBACK_LEXER";
    static final String ENV_LOCALE = "MARKUPXFORM_LOCALE";

    private ConfigLoader() {
        // utility class
    }

    /**
     * Loads configuration from the given YAML file, applying environment variable overrides from
     * {@link System#getenv}.
     *
     * @param configPath path to the YAML configuration file
     * @return the configuration with defaults applied
     * @throws ConfigLoadException if the file is missing, contains invalid YAML or invalid values
     */
    public static ExpanderConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads configuration from the given YAML file, applying environment variable overrides from the
     * supplied lookup function. Returning {@code null} from {@code envLookup} means the variable is
     * not defined.
     *
     * @throws ConfigLoadException if the file is missing, contains invalid YAML or invalid values
     */
    public static ExpanderConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException("Configuration file not found: " + configPath);
        }
        try (InputStream in = Files.newInputStream(configPath)) {
            JsonNode root = YAML_MAPPER.readTree(in);
            return mapToConfig(root == null ? YAML_MAPPER.createObjectNode() : root, envLookup);
        } catch (ConfigLoadException e) {
            throw e;
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        }
    }

    /**
     * Builds configuration from defaults and environment variables only.
     *
     * @throws ConfigLoadException if an environment variable holds an invalid value
     */
    public static ExpanderConfig fromEnvironment(Function<String, String> envLookup) {
        return mapToConfig(YAML_MAPPER.createObjectNode(), envLookup);
    }

    private static ExpanderConfig mapToConfig(JsonNode root, Function<String, String> envLookup) {
        ExpanderConfig.Builder builder = ExpanderConfig.builder();

        // --- YAML mapping ---
        JsonNode expander = root.path("expander");
        if (expander.has("max-depth")) builder.maxDepth(requireInt(expander, "max-depth"));

        JsonNode csv = root.path("csv");
        if (csv.has("default-separator"))
            builder.csvSeparator(csv.get("default-separator").asText());
        if (csv.has("table-class")) builder.csvTableClass(csv.get("table-class").asText());

        JsonNode highlight = root.path("highlight");
        if (highlight.has("fallback-lexer"))
            builder.fallbackLexer(highlight.get("fallback-lexer").asText());

        JsonNode messages = root.path("messages");
        if (messages.has("locale")) builder.locale(Locale.forLanguageTag(messages.get("locale").asText()));

        // --- Environment variable overlay ---
        try {
            envInt(envLookup, ENV_MAX_DEPTH, builder::maxDepth);
        } catch (NumberFormatException e) {
            throw new ConfigLoadException(ENV_MAX_DEPTH + " must be an integer: " + envLookup.apply(ENV_MAX_DEPTH), e);
        }
        envString(envLookup, ENV_CSV_SEPARATOR, builder::csvSeparator);
        envString(envLookup, ENV_CSV_TABLE_CLASS, builder::csvTableClass);
        envString(envLookup, ENV_FALLBACK_LEXER, builder::fallbackLexer);
        envString(envLookup, ENV_LOCALE, tag -> builder.locale(Locale.forLanguageTag(tag)));

        try {
            return builder.build();
        } catch (IllegalArgumentException e) {
            throw new ConfigLoadException("Invalid expander configuration: " + e.getMessage(), e);
        }
    }

    // --- Env var helpers ---

    /** Returns {@code true} if the env var is "set": defined AND non-blank after trimming. */
    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    /** Applies a string env var override if set. */
    private static void envString(Function<String, String> envLookup, String envVar, Consumer<String> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(envLookup.apply(envVar).trim());
        }
    }

    /** Applies an integer env var override if set. */
    private static void envInt(Function<String, String> envLookup, String envVar, IntConsumer setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(Integer.parseInt(envLookup.apply(envVar).trim()));
        }
    }

    // --- YAML helpers ---

    private static int requireInt(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (!value.canConvertToInt()) {
            throw new ConfigLoadException("'" + field + "' must be an integer, got: " + value);
        }
        return value.asInt();
    }
}

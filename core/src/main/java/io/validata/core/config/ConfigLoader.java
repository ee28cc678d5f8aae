package io.validata.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.validata.core.engine.locale.YamlMessageStore;
import io.validata.core.error.ConfigLoadException;
import io.validata.core.error.ValidationException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.IntConsumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads a {@link ValidatorConfig} from a YAML file with optional environment variable overlay.
 *
 * <pre>
 * validator:
 *   locale: fr
 *   parallelism: 4
 *   max-depth: 16
 *   messages: /etc/validata/messages   # optional directory of &lt;locale&gt;.yaml files
 * </pre>
 *
 * <p>
 * Missing keys receive the defaults of {@link ValidatorConfig.Builder}. Environment variables
 * {@code VALIDATA_LOCALE}, {@code VALIDATA_PARALLELISM} and {@code VALIDATA_MAX_DEPTH} take
 * precedence over YAML values. A variable is "set" if and only if it is defined AND its trimmed
 * value is non-empty.
 *
 * <p>
 * The uniqueness checker and listener are runtime collaborators; attach them with
 * {@link ValidatorConfig#toBuilder()} after loading.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    static final String ENV_LOCALE = "VALIDATA_LOCALE";
    static final String ENV_PARALLELISM = "VALIDATA_PARALLELISM";
    static final String ENV_MAX_DEPTH = "VALIDATA_MAX_DEPTH";

    private ConfigLoader() {
        // utility class
    }

    /**
     * Loads a configuration, applying overrides from {@link System#getenv}.
     *
     * @throws ConfigLoadException if the file is missing, malformed or holds invalid values
     */
    public static ValidatorConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads a configuration, applying overrides from {@code envLookup}. Returning {@code null}
     * from the lookup means the variable is not defined.
     *
     * @throws ConfigLoadException if the file is missing, malformed or holds invalid values
     */
    public static ValidatorConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException("Configuration file not found: " + configPath);
        }

        try (InputStream in = Files.newInputStream(configPath)) {
            JsonNode root = YAML_MAPPER.readTree(in);
            ValidatorConfig config = mapToConfig(root == null ? YAML_MAPPER.createObjectNode() : root, envLookup);
            LOG.info(
                    "config.loaded source={} locale={} parallelism={} max_depth={}",
                    configPath,
                    config.locale(),
                    config.parallelism(),
                    config.maxDepth());
            return config;
        } catch (ConfigLoadException e) {
            throw e;
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        } catch (ValidationException | IllegalArgumentException e) {
            throw new ConfigLoadException("Invalid configuration in " + configPath + ": " + e.getMessage(), e);
        }
    }

    private static ValidatorConfig mapToConfig(JsonNode root, Function<String, String> envLookup) {
        ValidatorConfig.Builder builder = ValidatorConfig.builder();

        // --- YAML mapping ---

        JsonNode validator = root.path("validator");
        if (validator.has("locale")) builder.locale(validator.get("locale").asText());
        if (validator.has("parallelism")) builder.parallelism(requireInt(validator, "parallelism"));
        if (validator.has("max-depth")) builder.maxDepth(requireInt(validator, "max-depth"));
        if (validator.has("messages")) {
            builder.messageStore(YamlMessageStore.fromDirectory(Path.of(validator.get("messages").asText())));
        }

        // --- Environment variable overlay ---

        envString(envLookup, ENV_LOCALE, builder::locale);
        envInt(envLookup, ENV_PARALLELISM, builder::parallelism);
        envInt(envLookup, ENV_MAX_DEPTH, builder::maxDepth);

        return builder.build();
    }

    private static int requireInt(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (!value.canConvertToInt() || !value.isIntegralNumber()) {
            throw new ConfigLoadException("validator." + field + " must be an integer, got: " + value);
        }
        return value.asInt();
    }

    // --- Env var helpers ---

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
            String raw = envLookup.apply(envVar).trim();
            try {
                setter.accept(Integer.parseInt(raw));
            } catch (NumberFormatException e) {
                throw new ConfigLoadException(envVar + " must be an integer, got: " + raw, e);
            }
        }
    }
}

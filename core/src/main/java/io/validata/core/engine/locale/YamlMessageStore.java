package io.validata.core.engine.locale;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.validata.core.error.MessageStoreException;
import io.validata.core.spi.MessageStore;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link MessageStore} backed by one YAML document per locale.
 *
 * <p>
 * A document maps rule keys to templates. Compound keys such as {@code min.string} are written
 * as one level of nesting under their category:
 *
 * <pre>
 * email: "The %s field must be a valid email address"
 * min:
 *   string: "The %s field must be at least %s characters"
 * </pre>
 *
 * <p>
 * The bundled locales ({@code en}, {@code fr}) live on the classpath under
 * {@code validata/messages/}. A directory of {@code <locale>.yaml} files can add locales or
 * replace bundled ones. Tables are read once at construction and never change afterwards, so one
 * instance can be shared by any number of validators.
 */
public final class YamlMessageStore implements MessageStore {

    private static final Logger LOG = LoggerFactory.getLogger(YamlMessageStore.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    /** Locale used when the requested locale has no table. */
    public static final String FALLBACK_LOCALE = "en";

    static final String RESOURCE_PREFIX = "validata/messages/";
    static final List<String> BUNDLED_LOCALES = List.of("en", "fr");

    private static volatile YamlMessageStore bundled;

    private final Map<String, Map<String, String>> tables;

    private YamlMessageStore(Map<String, Map<String, String>> tables) {
        this.tables = Map.copyOf(tables);
    }

    /** The store holding the bundled locales. Loaded on first use and shared afterwards. */
    public static YamlMessageStore bundled() {
        YamlMessageStore store = bundled;
        if (store == null) {
            synchronized (YamlMessageStore.class) {
                store = bundled;
                if (store == null) {
                    store = new YamlMessageStore(loadBundled());
                    bundled = store;
                }
            }
        }
        return store;
    }

    /**
     * Loads the bundled locales, then every {@code *.yaml} file in {@code directory}. A file
     * named after a bundled locale replaces that locale's table.
     *
     * @throws MessageStoreException if the directory cannot be listed or a file is malformed
     */
    public static YamlMessageStore fromDirectory(Path directory) {
        Map<String, Map<String, String>> tables = new HashMap<>(loadBundled());
        if (!Files.isDirectory(directory)) {
            throw new MessageStoreException("Message directory not found: " + directory, directory.toString());
        }
        try (Stream<Path> files = Files.list(directory)) {
            for (Path file : files.filter(p -> p.getFileName().toString().endsWith(".yaml"))
                    .sorted()
                    .toList()) {
                String name = file.getFileName().toString();
                String locale = normalize(name.substring(0, name.length() - ".yaml".length()));
                try (InputStream in = Files.newInputStream(file)) {
                    tables.put(locale, parse(in, file.toString()));
                }
                LOG.info("messages.loaded locale={} source={}", locale, file);
            }
        } catch (IOException e) {
            throw new MessageStoreException(
                    "Failed to read message directory: " + directory, e, directory.toString());
        }
        return new YamlMessageStore(tables);
    }

    /** Builds a store from in-memory tables, keyed by locale then by flat message key. */
    public static YamlMessageStore of(Map<String, Map<String, String>> tables) {
        Map<String, Map<String, String>> copy = new HashMap<>();
        tables.forEach((locale, table) -> copy.put(normalize(locale), Map.copyOf(table)));
        return new YamlMessageStore(copy);
    }

    @Override
    public Optional<String> lookup(String locale, String key) {
        Map<String, String> table = tables.get(normalize(locale));
        if (table == null) {
            table = tables.getOrDefault(FALLBACK_LOCALE, Map.of());
        }
        return Optional.ofNullable(table.get(key));
    }

    /** Whether a table exists for {@code locale} (no fallback). */
    public boolean supports(String locale) {
        return tables.containsKey(normalize(locale));
    }

    // --- Loading ---

    private static Map<String, Map<String, String>> loadBundled() {
        Map<String, Map<String, String>> tables = new HashMap<>();
        ClassLoader loader = YamlMessageStore.class.getClassLoader();
        for (String locale : BUNDLED_LOCALES) {
            String resource = RESOURCE_PREFIX + locale + ".yaml";
            try (InputStream in = loader.getResourceAsStream(resource)) {
                if (in == null) {
                    throw new MessageStoreException("Bundled message resource missing: " + resource, resource);
                }
                tables.put(locale, parse(in, resource));
            } catch (IOException e) {
                throw new MessageStoreException("Failed to read bundled messages: " + resource, e, resource);
            }
        }
        LOG.debug("messages.bundled locales={}", BUNDLED_LOCALES);
        return tables;
    }

    /** Flattens one document into {@code key -> template}, nesting one level as {@code a.b}. */
    static Map<String, String> parse(InputStream in, String source) {
        JsonNode root;
        try {
            root = YAML_MAPPER.readTree(in);
        } catch (IOException e) {
            throw new MessageStoreException("Failed to parse messages: " + source, e, source);
        }
        if (root == null || root.isMissingNode() || root.isNull()) {
            return Map.of();
        }
        if (!root.isObject()) {
            throw new MessageStoreException("Messages must be a YAML mapping: " + source, source);
        }
        Map<String, String> table = new HashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            JsonNode value = entry.getValue();
            if (value.isObject()) {
                Iterator<Map.Entry<String, JsonNode>> nested = value.fields();
                while (nested.hasNext()) {
                    Map.Entry<String, JsonNode> sub = nested.next();
                    table.put(entry.getKey() + "." + sub.getKey(), template(sub.getValue(), source, sub.getKey()));
                }
            } else {
                table.put(entry.getKey(), template(value, source, entry.getKey()));
            }
        }
        return table;
    }

    private static String template(JsonNode node, String source, String key) {
        if (!node.isValueNode() || node.isNull()) {
            throw new MessageStoreException(
                    "Message '" + key + "' must be a string template in " + source, source);
        }
        return node.asText();
    }

    private static String normalize(String locale) {
        return locale == null ? FALLBACK_LOCALE : locale.trim().toLowerCase(Locale.ROOT);
    }
}

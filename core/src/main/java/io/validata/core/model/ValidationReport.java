package io.validata.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Aggregated result of one validation call: wire-label to rendered message, nested report or
 * element list. Empty if and only if the record is fully valid. A lookup structure: entry order
 * carries no meaning and is ignored by {@link #equals(Object)}.
 *
 * <p>
 * Immutable and thread-safe.
 */
public final class ValidationReport {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final ValidationReport EMPTY = new ValidationReport(Map.of());

    private final Map<String, Object> entries;

    private ValidationReport(Map<String, Object> entries) {
        this.entries = entries;
    }

    public static ValidationReport empty() {
        return EMPTY;
    }

    /**
     * Builds a report from field outcomes. PASSED outcomes contribute nothing.
     */
    public static ValidationReport of(Collection<FieldOutcome> outcomes) {
        Map<String, Object> entries = new LinkedHashMap<>();
        for (FieldOutcome outcome : outcomes) {
            if (!outcome.isPassed()) {
                entries.put(outcome.label(), outcome.message());
            }
        }
        return entries.isEmpty() ? EMPTY : new ValidationReport(Collections.unmodifiableMap(entries));
    }

    public boolean isValid() {
        return entries.isEmpty();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public int size() {
        return entries.size();
    }

    public boolean containsKey(String label) {
        return entries.containsKey(label);
    }

    public Set<String> labels() {
        return entries.keySet();
    }

    /** Raw entry: {@code String}, {@link ValidationReport} or {@code List<Object>}; may be null. */
    public Object get(String label) {
        return entries.get(label);
    }

    /** The message for {@code label}, or {@code null} if absent or not a plain message. */
    public String message(String label) {
        return entries.get(label) instanceof String s ? s : null;
    }

    /** The nested report for {@code label}, or {@code null} if absent or not nested. */
    public ValidationReport nested(String label) {
        return entries.get(label) instanceof ValidationReport r ? r : null;
    }

    /** The element list for {@code label}, or an empty list if absent or not a list. */
    public List<Object> elements(String label) {
        if (entries.get(label) instanceof List<?> list) {
            return Collections.unmodifiableList(list);
        }
        return List.of();
    }

    /** Renders the report as a JSON object, nested reports as objects and element lists as arrays. */
    public ObjectNode toJson() {
        ObjectNode node = MAPPER.createObjectNode();
        entries.forEach((label, value) -> node.set(label, toJsonValue(value)));
        return node;
    }

    private static JsonNode toJsonValue(Object value) {
        if (value instanceof ValidationReport report) {
            return report.toJson();
        }
        if (value instanceof List<?> list) {
            ArrayNode array = MAPPER.createArrayNode();
            list.forEach(item -> array.add(toJsonValue(item)));
            return array;
        }
        return value == null ? MAPPER.nullNode() : MAPPER.getNodeFactory().textNode(value.toString());
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof ValidationReport other && entries.equals(other.entries));
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(entries);
    }

    @Override
    public String toString() {
        return "ValidationReport" + entries;
    }
}

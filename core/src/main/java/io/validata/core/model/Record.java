package io.validata.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Fixed-shape record handed to the validator: an ordered list of {@link Field}s. Immutable; the
 * engine reads it and recurses into nested records but never mutates or retains it.
 */
public final class Record {

    private final String name;
    private final List<Field> fields;

    private Record(String name, List<Field> fields) {
        this.name = name;
        this.fields = Collections.unmodifiableList(new ArrayList<>(fields));
    }

    public static Builder builder() {
        return new Builder("record");
    }

    /**
     * @param name type name used in logs (e.g. the bound class's simple name)
     */
    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String name() {
        return name;
    }

    public List<Field> fields() {
        return fields;
    }

    /** Fields carrying both a wire-label and a rule chain, in declaration order. */
    public List<Field> eligibleFields() {
        return fields.stream().filter(Field::isEligible).toList();
    }

    /** Finds a field by wire-label (first match), eligible or not. */
    public Optional<Field> findByLabel(String label) {
        if (label == null) {
            return Optional.empty();
        }
        for (Field field : fields) {
            if (label.equals(field.label())) {
                return Optional.of(field);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return "Record[" + name + ", fields=" + fields.size() + "]";
    }

    /** Builder for {@link Record}. Not thread-safe. */
    public static final class Builder {

        private final String name;
        private final List<Field> fields = new ArrayList<>();

        private Builder(String name) {
            this.name = Objects.requireNonNull(name, "name must not be null");
        }

        /** Adds a field whose source name equals its wire-label. */
        public Builder field(String label, Value value, String rules) {
            return field(new Field(label, label, value, rules));
        }

        public Builder field(Field field) {
            fields.add(Objects.requireNonNull(field, "field must not be null"));
            return this;
        }

        public Record build() {
            return new Record(name, fields);
        }
    }
}

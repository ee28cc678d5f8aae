package io.validata.core.model;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Runtime value of a record field, as a closed set of kinds. The dispatcher routes rules by
 * {@link #kind()}; predicates never inspect Java types.
 *
 * <p>
 * Implementations are immutable and thread-safe (a {@link Sequence} copies its element list).
 */
public sealed interface Value {

    /** Value kinds known to the dispatcher. */
    enum Kind {
        TEXT,
        SIGNED_INT,
        UNSIGNED_INT,
        FLOAT,
        BOOL,
        SEQUENCE,
        REFERENCE,
        NESTED,
        FILE,
        OPAQUE
    }

    Kind kind();

    /**
     * Presence test used by {@code required}: zero length for text and sequences, {@code false}
     * for booleans, zero for numbers, unset for references, all-empty fields for inline records.
     */
    boolean isEmpty();

    /** Text rendering used by enumeration and cross-field comparisons. */
    String asText();

    // ── Factories ──

    static Value text(String value) {
        return new Text(value == null ? "" : value);
    }

    static Value signed(long value) {
        return new SignedInt(value);
    }

    /** An unsigned 64-bit value; {@code bits} is interpreted with unsigned arithmetic. */
    static Value unsigned(long bits) {
        return new UnsignedInt(bits);
    }

    static Value floating(double value) {
        return new FloatingPoint(value);
    }

    static Value bool(boolean value) {
        return new Bool(value);
    }

    static Value sequence(List<? extends Value> elements) {
        return new Sequence(List.copyOf(elements));
    }

    static Value sequence(Value... elements) {
        return new Sequence(List.of(elements));
    }

    /** A reference to a sub-record; {@code null} yields an unset reference. */
    static Value record(Record record) {
        return new Reference(record == null ? null : new Nested(record));
    }

    /** An inline sub-record (not behind a reference). */
    static Value inline(Record record) {
        return new Nested(Objects.requireNonNull(record, "record must not be null"));
    }

    /** A reference to an uploaded file; {@code null} yields an unset reference. */
    static Value file(UploadedFile file) {
        return new Reference(file == null ? null : new File(file));
    }

    static Value unset() {
        return new Reference(null);
    }

    static Value opaque(Object value) {
        return new Opaque(value);
    }

    // ── Implementations ──

    record Text(String value) implements Value {
        public Text {
            Objects.requireNonNull(value, "value must not be null");
        }

        @Override
        public Kind kind() {
            return Kind.TEXT;
        }

        @Override
        public boolean isEmpty() {
            return value.isEmpty();
        }

        @Override
        public String asText() {
            return value;
        }
    }

    record SignedInt(long value) implements Value {
        @Override
        public Kind kind() {
            return Kind.SIGNED_INT;
        }

        @Override
        public boolean isEmpty() {
            return value == 0;
        }

        @Override
        public String asText() {
            return Long.toString(value);
        }
    }

    record UnsignedInt(long bits) implements Value {
        @Override
        public Kind kind() {
            return Kind.UNSIGNED_INT;
        }

        @Override
        public boolean isEmpty() {
            return bits == 0;
        }

        @Override
        public String asText() {
            return Long.toUnsignedString(bits);
        }
    }

    record FloatingPoint(double value) implements Value {
        @Override
        public Kind kind() {
            return Kind.FLOAT;
        }

        @Override
        public boolean isEmpty() {
            return value == 0;
        }

        @Override
        public String asText() {
            if (Double.isNaN(value) || Double.isInfinite(value)) {
                return Double.toString(value);
            }
            return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
        }
    }

    record Bool(boolean value) implements Value {
        @Override
        public Kind kind() {
            return Kind.BOOL;
        }

        @Override
        public boolean isEmpty() {
            return !value;
        }

        @Override
        public String asText() {
            return Boolean.toString(value);
        }
    }

    record Sequence(List<Value> elements) implements Value {
        public Sequence {
            elements = List.copyOf(elements);
        }

        @Override
        public Kind kind() {
            return Kind.SEQUENCE;
        }

        @Override
        public boolean isEmpty() {
            return elements.isEmpty();
        }

        @Override
        public String asText() {
            return elements.toString();
        }

        public int size() {
            return elements.size();
        }
    }

    /**
     * Optional pointer to a sub-record or a file. {@code target} is {@code null} when unset and
     * otherwise a {@link Nested} or a {@link File}.
     */
    record Reference(Value target) implements Value {
        public Reference {
            if (target != null && !(target instanceof Nested) && !(target instanceof File)) {
                throw new IllegalArgumentException(
                        "reference target must be a record or a file, got: " + target.kind());
            }
        }

        @Override
        public Kind kind() {
            return Kind.REFERENCE;
        }

        @Override
        public boolean isEmpty() {
            return target == null;
        }

        @Override
        public String asText() {
            return target == null ? "" : target.asText();
        }
    }

    record Nested(Record record) implements Value {
        public Nested {
            Objects.requireNonNull(record, "record must not be null");
        }

        @Override
        public Kind kind() {
            return Kind.NESTED;
        }

        @Override
        public boolean isEmpty() {
            return record.fields().stream().allMatch(f -> f.value().isEmpty());
        }

        @Override
        public String asText() {
            return record.toString();
        }
    }

    record File(UploadedFile file) implements Value {
        public File {
            Objects.requireNonNull(file, "file must not be null");
        }

        @Override
        public Kind kind() {
            return Kind.FILE;
        }

        @Override
        public boolean isEmpty() {
            return false;
        }

        @Override
        public String asText() {
            return file.name();
        }
    }

    /** Any other shape (maps, arbitrary objects). Only presence is ever checked. */
    record Opaque(Object value) implements Value {
        @Override
        public Kind kind() {
            return Kind.OPAQUE;
        }

        @Override
        public boolean isEmpty() {
            if (value == null) {
                return true;
            }
            if (value instanceof Map<?, ?> map) {
                return map.isEmpty();
            }
            if (value instanceof Collection<?> collection) {
                return collection.isEmpty();
            }
            return false;
        }

        @Override
        public String asText() {
            return String.valueOf(value);
        }
    }
}

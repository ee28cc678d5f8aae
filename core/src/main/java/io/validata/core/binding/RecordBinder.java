package io.validata.core.binding;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.validata.core.error.RecordStructureException;
import io.validata.core.model.Field;
import io.validata.core.model.Record;
import io.validata.core.model.UploadedFile;
import io.validata.core.model.Value;
import java.lang.reflect.Array;
import java.lang.reflect.InaccessibleObjectException;
import java.lang.reflect.Modifier;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Maps an annotated Java object to a {@link Record}.
 *
 * <p>
 * A field takes part when it carries {@link Rules} or Jackson's {@link JsonProperty}; the
 * property name is the wire-label (the Java name when the annotation leaves it empty). Fields are
 * read through the whole superclass chain, superclass fields first. Value mapping:
 *
 * <ul>
 * <li>{@code CharSequence}, {@code Character}, enums → text</li>
 * <li>{@code byte}, {@code short}, {@code int}, {@code long}, {@code BigInteger} → signed, or
 * unsigned with {@link Unsigned}</li>
 * <li>{@code float}, {@code double}, {@code BigDecimal} → floating point</li>
 * <li>{@code boolean} → bool</li>
 * <li>{@link UploadedFile} → file reference</li>
 * <li>collections and arrays → sequence of mapped elements</li>
 * <li>maps → opaque</li>
 * <li>anything else → record reference, bound recursively</li>
 * </ul>
 *
 * <p>
 * Nulls map to the empty value of the declared type. Cyclic object graphs are rejected.
 * Reflection is confined to this class.
 */
public final class RecordBinder {

    private RecordBinder() {}

    /**
     * @throws RecordStructureException if {@code object} is null, not a record-shaped object,
     *                                  cyclic, or has an unreadable field
     */
    public static Record bind(Object object) {
        if (object == null) {
            throw new RecordStructureException("cannot validate null: expected a record object");
        }
        if (!isRecordShaped(object.getClass())) {
            throw new RecordStructureException(
                    "expected a record object, got " + object.getClass().getName());
        }
        return bind(object, Collections.newSetFromMap(new IdentityHashMap<>()));
    }

    private static Record bind(Object object, Set<Object> ancestors) {
        if (!ancestors.add(object)) {
            throw new RecordStructureException(
                    "cyclic object graph: " + object.getClass().getName() + " refers back to itself");
        }
        Record.Builder builder = Record.builder(object.getClass().getSimpleName());
        for (java.lang.reflect.Field member : boundMembers(object.getClass())) {
            String label = wireLabel(member);
            Rules rules = member.getAnnotation(Rules.class);
            Object raw = read(member, object, label);
            boolean unsigned = member.isAnnotationPresent(Unsigned.class);
            // Label-only fields are read by same/match and never recursed into.
            Value value = rules != null
                    ? toValue(raw, member.getType(), unsigned, ancestors, label)
                    : toShallowValue(raw, member.getType(), unsigned);
            builder.field(new Field(member.getName(), label, value, rules != null ? rules.value() : null));
        }
        ancestors.remove(object);
        return builder.build();
    }

    // --- Value mapping ---

    private static Value toValue(Object raw, Class<?> type, boolean unsigned, Set<Object> ancestors, String label) {
        if (raw == null) {
            return emptyOf(type, unsigned);
        }
        Class<?> effective = raw.getClass();
        if (raw instanceof Collection<?> collection) {
            List<Value> elements = new ArrayList<>(collection.size());
            for (Object element : collection) {
                elements.add(element == null
                        ? Value.unset()
                        : toValue(element, element.getClass(), unsigned, ancestors, label));
            }
            return Value.sequence(elements);
        }
        if (effective.isArray()) {
            int length = Array.getLength(raw);
            Class<?> componentType = effective.getComponentType();
            List<Value> elements = new ArrayList<>(length);
            for (int i = 0; i < length; i++) {
                Object element = Array.get(raw, i);
                elements.add(element == null
                        ? emptyOf(componentType, unsigned)
                        : toValue(element, element.getClass(), unsigned, ancestors, label));
            }
            return Value.sequence(elements);
        }
        Value scalar = toScalar(raw, unsigned);
        if (scalar != null) {
            return scalar;
        }
        if (raw instanceof Map<?, ?>) {
            return Value.opaque(raw);
        }
        if (raw instanceof UploadedFile file) {
            return Value.file(file);
        }
        try {
            return Value.record(bind(raw, ancestors));
        } catch (RecordStructureException e) {
            if (e.fieldLabel() != null) {
                throw e;
            }
            throw new RecordStructureException(e.getMessage(), e, label);
        }
    }

    private static Value toShallowValue(Object raw, Class<?> type, boolean unsigned) {
        if (raw == null) {
            return emptyOf(type, unsigned);
        }
        Value scalar = toScalar(raw, unsigned);
        return scalar != null ? scalar : Value.opaque(raw);
    }

    /** Text, numeric and boolean mappings; {@code null} for anything else. */
    private static Value toScalar(Object raw, boolean unsigned) {
        if (raw instanceof CharSequence || raw instanceof Character) {
            return Value.text(raw.toString());
        }
        if (raw instanceof Enum<?> constant) {
            return Value.text(constant.name());
        }
        if (raw instanceof Boolean b) {
            return Value.bool(b);
        }
        if (raw instanceof Byte b) {
            return unsigned ? Value.unsigned(Byte.toUnsignedLong(b)) : Value.signed(b);
        }
        if (raw instanceof Short s) {
            return unsigned ? Value.unsigned(Short.toUnsignedLong(s)) : Value.signed(s);
        }
        if (raw instanceof Integer i) {
            return unsigned ? Value.unsigned(Integer.toUnsignedLong(i)) : Value.signed(i);
        }
        if (raw instanceof Long l) {
            return unsigned ? Value.unsigned(l) : Value.signed(l);
        }
        if (raw instanceof BigInteger big) {
            if (unsigned) {
                return Value.unsigned(big.longValue());
            }
            return big.bitLength() < Long.SIZE ? Value.signed(big.longValue()) : Value.opaque(big);
        }
        if (raw instanceof Float || raw instanceof Double || raw instanceof BigDecimal) {
            return Value.floating(((Number) raw).doubleValue());
        }
        return null;
    }

    /** The empty value of a declared type, used for nulls. */
    private static Value emptyOf(Class<?> type, boolean unsigned) {
        if (CharSequence.class.isAssignableFrom(type) || type == Character.class || Enum.class.isAssignableFrom(type)) {
            return Value.text("");
        }
        if (type == Boolean.class || type == boolean.class) {
            return Value.bool(false);
        }
        if (type == Byte.class || type == Short.class || type == Integer.class || type == Long.class
                || type == BigInteger.class) {
            return unsigned ? Value.unsigned(0) : Value.signed(0);
        }
        if (type == Float.class || type == Double.class || type == BigDecimal.class) {
            return Value.floating(0);
        }
        if (Collection.class.isAssignableFrom(type) || type.isArray()) {
            return Value.sequence(List.of());
        }
        if (Map.class.isAssignableFrom(type)) {
            return Value.opaque(null);
        }
        return Value.unset();
    }

    // --- Reflection ---

    private static List<java.lang.reflect.Field> boundMembers(Class<?> type) {
        List<Class<?>> hierarchy = new ArrayList<>();
        for (Class<?> c = type; c != null && c != Object.class; c = c.getSuperclass()) {
            hierarchy.add(0, c);
        }
        List<java.lang.reflect.Field> members = new ArrayList<>();
        for (Class<?> c : hierarchy) {
            for (java.lang.reflect.Field member : c.getDeclaredFields()) {
                if (Modifier.isStatic(member.getModifiers()) || member.isSynthetic()) {
                    continue;
                }
                if (member.isAnnotationPresent(Rules.class) || member.isAnnotationPresent(JsonProperty.class)) {
                    members.add(member);
                }
            }
        }
        return members;
    }

    private static String wireLabel(java.lang.reflect.Field member) {
        JsonProperty property = member.getAnnotation(JsonProperty.class);
        if (property == null) {
            return null;
        }
        return property.value().isEmpty() ? member.getName() : property.value();
    }

    private static Object read(java.lang.reflect.Field member, Object target, String label) {
        try {
            member.setAccessible(true);
            return member.get(target);
        } catch (IllegalAccessException | InaccessibleObjectException | SecurityException e) {
            throw new RecordStructureException(
                    "cannot read field '" + member.getName() + "' of " + target.getClass().getName(), e, label);
        }
    }

    private static boolean isRecordShaped(Class<?> type) {
        return !(type.isPrimitive()
                || type.isArray()
                || Enum.class.isAssignableFrom(type)
                || CharSequence.class.isAssignableFrom(type)
                || Number.class.isAssignableFrom(type)
                || type == Boolean.class
                || type == Character.class
                || Collection.class.isAssignableFrom(type)
                || Map.class.isAssignableFrom(type)
                || UploadedFile.class.isAssignableFrom(type));
    }
}

package com.requirement.sync.core.model;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Collection;
import java.util.Date;
import java.util.List;

/**
 * Kinds of attribute definitions a requirement type can declare.
 *
 * Each kind knows the runtime shapes a snapshot value may take, the key under
 * which a validated value is stored, its canonical form and the default used
 * when invalid values are substituted instead of rejected.
 */
public enum AttributeKind {
    STRING("String", "value", ""),
    ENUM("Enum", "values", List.of()),
    DATE("Date", "value", null),
    INTEGER("Integer", "value", 0L),
    FLOAT("Float", "value", 0.0d),
    BOOLEAN("Boolean", "value", false);

    private final String label;
    private final String valueKey;
    private final Object defaultValue;

    AttributeKind(String label, String valueKey, Object defaultValue) {
        this.label = label;
        this.valueKey = valueKey;
        this.defaultValue = defaultValue;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Key of the stored value: {@code "values"} for enumerations, {@code "value"} otherwise.
     */
    public String getValueKey() {
        return valueKey;
    }

    /**
     * Tag used for attribute value creation payloads, e.g. {@code "enum"}.
     */
    public String getTypeTag() {
        return label.toLowerCase();
    }

    public Object getDefaultValue() {
        return defaultValue;
    }

    /**
     * Checks whether the given raw value has the runtime shape this kind expects.
     */
    public boolean accepts(Object value) {
        if (value == null) {
            return false;
        }
        return switch (this) {
            case STRING -> value instanceof String;
            case ENUM -> value instanceof Collection<?> values
                    && values.stream().allMatch(String.class::isInstance);
            case DATE -> value instanceof Instant
                    || value instanceof OffsetDateTime
                    || value instanceof ZonedDateTime
                    || value instanceof LocalDateTime
                    || value instanceof Date;
            case INTEGER -> value instanceof Integer
                    || value instanceof Long
                    || value instanceof Short
                    || value instanceof Byte
                    || (value instanceof BigInteger big && big.bitLength() < Long.SIZE);
            case FLOAT -> value instanceof Double
                    || value instanceof Float
                    || value instanceof BigDecimal;
            case BOOLEAN -> value instanceof Boolean;
        };
    }

    /**
     * Converts an accepted value into its canonical form: enumerations become an
     * immutable list of literal names, dates an {@link Instant}, whole numbers a
     * {@link Long} and real numbers a {@link Double}.
     *
     * @throws IllegalArgumentException if the value is not accepted by this kind
     */
    public Object canonicalize(Object value) {
        if (value == null) {
            return null;
        }
        if (!accepts(value)) {
            throw new IllegalArgumentException(
                    "Value of type " + value.getClass().getSimpleName() + " is not a valid " + label);
        }
        return switch (this) {
            case STRING, BOOLEAN -> value;
            case ENUM -> List.copyOf((Collection<?>) value).stream()
                    .map(String.class::cast)
                    .toList();
            case DATE -> toInstant(value);
            case INTEGER -> ((Number) value).longValue();
            case FLOAT -> ((Number) value).doubleValue();
        };
    }

    private static Instant toInstant(Object value) {
        if (value instanceof Instant instant) {
            return instant;
        }
        if (value instanceof OffsetDateTime offset) {
            return offset.toInstant();
        }
        if (value instanceof ZonedDateTime zoned) {
            return zoned.toInstant();
        }
        if (value instanceof LocalDateTime local) {
            return local.toInstant(ZoneOffset.UTC);
        }
        return ((Date) value).toInstant();
    }

    /**
     * Looks up a kind by its label, e.g. {@code "Enum"}.
     *
     * @throws IllegalArgumentException for unknown labels
     */
    public static AttributeKind fromLabel(String label) {
        for (AttributeKind kind : values()) {
            if (kind.label.equals(label)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown attribute kind: " + label);
    }
}

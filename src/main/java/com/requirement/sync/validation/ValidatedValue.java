package com.requirement.sync.validation;

import com.requirement.sync.core.model.AttributeKind;

import java.util.List;

/**
 * Outcome of validating one attribute value: its kind, the key it is stored
 * under and its canonical value.
 */
public record ValidatedValue(AttributeKind kind, String key, Object value) {

    public static ValidatedValue of(AttributeKind kind, Object value) {
        return new ValidatedValue(kind, kind.getValueKey(), value);
    }

    /**
     * Literal names of an enumeration value.
     *
     * @throws IllegalStateException if this is not an enumeration value
     */
    @SuppressWarnings("unchecked")
    public List<String> literals() {
        if (kind != AttributeKind.ENUM) {
            throw new IllegalStateException("Not an enumeration value: " + kind);
        }
        return (List<String>) value;
    }
}

package com.requirement.sync.validation;

import com.requirement.sync.api.ReconciliationException;

/**
 * Thrown when a snapshot attribute value does not match its declared kind,
 * or names no declared option of its enumeration.
 */
public class InvalidFieldValueException extends ReconciliationException {
    private final String attributeName;
    private final transient Object value;

    public InvalidFieldValueException(String attributeName, Object value, String message) {
        super(message);
        this.attributeName = attributeName;
        this.value = value;
    }

    public String getAttributeName() {
        return attributeName;
    }

    public Object getValue() {
        return value;
    }
}

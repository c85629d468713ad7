package com.requirement.sync.action;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Payload describing a model element to create.
 *
 * <p>Fields are kept in insertion order. Nested creations (the values of a data
 * type, the children of a folder) are lists of payloads or references stored
 * under their slot name. A payload may declare a promise id that other
 * references in the same change set use to point at the created element, and an
 * element type tag where the slot alone does not determine the element class.</p>
 */
public final class CreatePayload {
    private final String elementType;
    private String promiseId;
    private final Map<String, Object> fields = new LinkedHashMap<>();

    private CreatePayload(String elementType) {
        this.elementType = elementType;
    }

    public static CreatePayload create() {
        return new CreatePayload(null);
    }

    public static CreatePayload ofType(String elementType) {
        return new CreatePayload(Objects.requireNonNull(elementType, "elementType is required"));
    }

    public CreatePayload put(String field, Object value) {
        fields.put(field, value);
        return this;
    }

    /**
     * Appends to the list stored under {@code slot}, creating it when absent.
     */
    public CreatePayload append(String slot, Object item) {
        listFor(slot).add(item);
        return this;
    }

    public CreatePayload promiseId(String promiseId) {
        this.promiseId = promiseId;
        return this;
    }

    public String getElementType() {
        return elementType;
    }

    public String getPromiseId() {
        return promiseId;
    }

    public Object get(String field) {
        return fields.get(field);
    }

    public boolean has(String field) {
        return fields.containsKey(field);
    }

    /**
     * Returns the list stored under {@code slot}, or an empty list.
     */
    @SuppressWarnings("unchecked")
    public List<Object> getList(String slot) {
        Object value = fields.get(slot);
        return value instanceof List<?> ? Collections.unmodifiableList((List<Object>) value) : List.of();
    }

    public Map<String, Object> getFields() {
        return Collections.unmodifiableMap(fields);
    }

    @SuppressWarnings("unchecked")
    private List<Object> listFor(String slot) {
        Object value = fields.get(slot);
        if (value instanceof List<?> list) {
            return (List<Object>) list;
        }
        List<Object> list = new ArrayList<>();
        fields.put(slot, list);
        return list;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CreatePayload that = (CreatePayload) o;
        return Objects.equals(elementType, that.elementType)
                && Objects.equals(promiseId, that.promiseId)
                && fields.equals(that.fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(elementType, promiseId, fields);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("CreatePayload{");
        if (elementType != null) {
            sb.append("_type=").append(elementType).append(", ");
        }
        if (promiseId != null) {
            sb.append("promise_id='").append(promiseId).append("', ");
        }
        return sb.append(fields).append('}').toString();
    }
}

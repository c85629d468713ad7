package com.requirement.sync.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Value of an attribute on a work item.
 * Holds a scalar for non-enumeration kinds and a list of literals for enumerations.
 */
public class AttributeValue {
    private final String id;
    private final AttributeDefinition definition;
    private Object value;
    private final List<EnumValue> values = new ArrayList<>();

    public AttributeValue(AttributeDefinition definition) {
        this(null, definition);
    }

    public AttributeValue(String id, AttributeDefinition definition) {
        this.id = id != null ? id : UUID.randomUUID().toString();
        this.definition = Objects.requireNonNull(definition, "definition is required");
    }

    public static AttributeValue scalar(AttributeDefinition definition, Object value) {
        AttributeValue attribute = new AttributeValue(definition);
        attribute.setValue(value);
        return attribute;
    }

    public static AttributeValue enumeration(AttributeDefinition definition, List<EnumValue> values) {
        AttributeValue attribute = new AttributeValue(definition);
        attribute.setValues(values);
        return attribute;
    }

    public String getId() {
        return id;
    }

    public AttributeDefinition getDefinition() {
        return definition;
    }

    public AttributeKind getKind() {
        return definition.getKind();
    }

    public Object getValue() {
        return value;
    }

    public void setValue(Object value) {
        this.value = value;
    }

    public List<EnumValue> getValues() {
        return Collections.unmodifiableList(values);
    }

    public void setValues(List<EnumValue> values) {
        this.values.clear();
        this.values.addAll(values);
    }

    /**
     * Names of the referenced literals, in order.
     */
    public List<String> getValueNames() {
        return values.stream().map(EnumValue::getLongName).toList();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        AttributeValue that = (AttributeValue) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "AttributeValue{definition=" + definition.getLongName() +
                (definition.getKind() == AttributeKind.ENUM ? ", values=" + values : ", value=" + value) + "}";
    }
}

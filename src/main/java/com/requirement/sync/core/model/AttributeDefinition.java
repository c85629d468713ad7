package com.requirement.sync.core.model;

import java.util.Objects;
import java.util.UUID;

/**
 * Declares an attribute on a {@link RequirementType}.
 * Enumeration definitions reference the {@link DataTypeDefinition} holding their options.
 */
public class AttributeDefinition {
    private final String id;
    private String identifier;
    private String longName;
    private final AttributeKind kind;
    private DataTypeDefinition dataType;
    private boolean multiValued;

    public AttributeDefinition(String identifier, String longName, AttributeKind kind) {
        this(null, identifier, longName, kind);
    }

    public AttributeDefinition(String id, String identifier, String longName, AttributeKind kind) {
        this.id = id != null ? id : UUID.randomUUID().toString();
        this.identifier = identifier;
        this.longName = Objects.requireNonNull(longName, "longName is required");
        this.kind = Objects.requireNonNull(kind, "kind is required");
    }

    public String getId() {
        return id;
    }

    public String getIdentifier() {
        return identifier;
    }

    public void setIdentifier(String identifier) {
        this.identifier = identifier;
    }

    public String getLongName() {
        return longName;
    }

    public void setLongName(String longName) {
        this.longName = longName;
    }

    public AttributeKind getKind() {
        return kind;
    }

    public DataTypeDefinition getDataType() {
        return dataType;
    }

    public void setDataType(DataTypeDefinition dataType) {
        this.dataType = dataType;
    }

    public boolean isMultiValued() {
        return multiValued;
    }

    public void setMultiValued(boolean multiValued) {
        this.multiValued = multiValued;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        AttributeDefinition that = (AttributeDefinition) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "AttributeDefinition{id='" + id + "', identifier='" + identifier +
                "', longName='" + longName + "', kind=" + kind + "}";
    }
}

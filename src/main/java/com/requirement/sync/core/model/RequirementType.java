package com.requirement.sync.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Type of a folder or requirement; owns the attribute definitions its items may carry.
 */
public class RequirementType {
    private final String id;
    private final String identifier;
    private String longName;
    private final List<AttributeDefinition> attributeDefinitions = new ArrayList<>();

    public RequirementType(String identifier, String longName) {
        this(null, identifier, longName);
    }

    public RequirementType(String id, String identifier, String longName) {
        this.id = id != null ? id : UUID.randomUUID().toString();
        this.identifier = Objects.requireNonNull(identifier, "identifier is required");
        this.longName = longName;
    }

    public String getId() {
        return id;
    }

    public String getIdentifier() {
        return identifier;
    }

    public String getLongName() {
        return longName;
    }

    public void setLongName(String longName) {
        this.longName = longName;
    }

    public List<AttributeDefinition> getAttributeDefinitions() {
        return Collections.unmodifiableList(attributeDefinitions);
    }

    public AttributeDefinition addAttributeDefinition(AttributeDefinition definition) {
        attributeDefinitions.add(Objects.requireNonNull(definition, "definition is required"));
        return definition;
    }

    public boolean removeAttributeDefinition(AttributeDefinition definition) {
        return attributeDefinitions.remove(definition);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RequirementType that = (RequirementType) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "RequirementType{id='" + id + "', identifier='" + identifier + "', longName='" + longName + "'}";
    }
}

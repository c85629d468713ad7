package com.requirement.sync.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Container of a module's data type definitions and requirement types.
 */
public class RequirementTypeFolder {
    private final String id;
    private final String identifier;
    private String longName;
    private final List<DataTypeDefinition> dataTypeDefinitions = new ArrayList<>();
    private final List<RequirementType> requirementTypes = new ArrayList<>();

    public RequirementTypeFolder(String identifier, String longName) {
        this(null, identifier, longName);
    }

    public RequirementTypeFolder(String id, String identifier, String longName) {
        this.id = id != null ? id : UUID.randomUUID().toString();
        this.identifier = identifier;
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

    public List<DataTypeDefinition> getDataTypeDefinitions() {
        return Collections.unmodifiableList(dataTypeDefinitions);
    }

    public void addDataTypeDefinition(DataTypeDefinition definition) {
        dataTypeDefinitions.add(Objects.requireNonNull(definition, "definition is required"));
    }

    public boolean removeDataTypeDefinition(DataTypeDefinition definition) {
        return dataTypeDefinitions.remove(definition);
    }

    public List<RequirementType> getRequirementTypes() {
        return Collections.unmodifiableList(requirementTypes);
    }

    public void addRequirementType(RequirementType requirementType) {
        requirementTypes.add(Objects.requireNonNull(requirementType, "requirementType is required"));
    }

    public boolean removeRequirementType(RequirementType requirementType) {
        return requirementTypes.remove(requirementType);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RequirementTypeFolder that = (RequirementTypeFolder) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }
}

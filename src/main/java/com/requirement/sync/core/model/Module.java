package com.requirement.sync.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Root container of a synchronized requirements module.
 * Owns the top-level folders and requirements and at most one
 * {@link RequirementTypeFolder}.
 */
public class Module implements WorkItemContainer {
    private final String id;
    private final String identifier;
    private String longName;
    private final List<Folder> folders = new ArrayList<>();
    private final List<Requirement> requirements = new ArrayList<>();
    private RequirementTypeFolder typeFolder;

    public Module(String identifier, String longName) {
        this(null, identifier, longName);
    }

    public Module(String id, String identifier, String longName) {
        this.id = id != null ? id : UUID.randomUUID().toString();
        this.identifier = identifier;
        this.longName = longName;
    }

    @Override
    public String getId() {
        return id;
    }

    /**
     * External identifier of the tracker module, may be null.
     */
    public String getIdentifier() {
        return identifier;
    }

    public String getLongName() {
        return longName;
    }

    public void setLongName(String longName) {
        this.longName = longName;
    }

    public RequirementTypeFolder getTypeFolder() {
        return typeFolder;
    }

    public void setTypeFolder(RequirementTypeFolder typeFolder) {
        this.typeFolder = typeFolder;
    }

    @Override
    public List<Folder> getFolders() {
        return Collections.unmodifiableList(folders);
    }

    @Override
    public List<Requirement> getRequirements() {
        return Collections.unmodifiableList(requirements);
    }

    @Override
    public void addFolder(Folder folder) {
        Containers.detach(folder);
        folders.add(folder);
        folder.setParent(this);
    }

    @Override
    public void addRequirement(Requirement requirement) {
        Containers.detach(requirement);
        requirements.add(requirement);
        requirement.setParent(this);
    }

    @Override
    public boolean removeChild(WorkItem child) {
        boolean removed = child.isFolder() ? folders.remove(child) : requirements.remove(child);
        if (removed) {
            child.setParent(null);
        }
        return removed;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Module module = (Module) o;
        return Objects.equals(id, module.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Module{id='" + id + "', identifier='" + identifier + "', longName='" + longName + "'}";
    }
}

package com.requirement.sync.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * A folder or requirement in the live graph.
 * Identity is the persistent {@link #getId()}; {@link #getIdentifier()} is the
 * external tracker identifier, stable across synchronization runs.
 */
public abstract class WorkItem {
    private final String id;
    private final String identifier;
    private String longName;
    private String text;
    private RequirementType type;
    private final List<AttributeValue> attributes = new ArrayList<>();
    private WorkItemContainer parent;

    protected WorkItem(String id, String identifier, String longName) {
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

    public String getText() {
        return text;
    }

    public void setText(String text) {
        this.text = text;
    }

    public RequirementType getType() {
        return type;
    }

    public void setType(RequirementType type) {
        this.type = type;
    }

    public List<AttributeValue> getAttributes() {
        return Collections.unmodifiableList(attributes);
    }

    public void addAttribute(AttributeValue attribute) {
        attributes.add(Objects.requireNonNull(attribute, "attribute is required"));
    }

    public boolean removeAttribute(AttributeValue attribute) {
        return attributes.remove(attribute);
    }

    /**
     * Finds the attribute value whose definition carries the given long name,
     * exactly or else ignoring case.
     */
    public Optional<AttributeValue> findAttribute(String definitionName) {
        Optional<AttributeValue> exact = attributes.stream()
                .filter(a -> a.getDefinition() != null
                        && definitionName.equals(a.getDefinition().getLongName()))
                .findFirst();
        if (exact.isPresent()) {
            return exact;
        }
        return attributes.stream()
                .filter(a -> a.getDefinition() != null
                        && definitionName.equalsIgnoreCase(a.getDefinition().getLongName()))
                .findFirst();
    }

    public WorkItemContainer getParent() {
        return parent;
    }

    void setParent(WorkItemContainer parent) {
        this.parent = parent;
    }

    public abstract boolean isFolder();

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WorkItem other = (WorkItem) o;
        return Objects.equals(id, other.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" +
                "id='" + id + '\'' +
                ", identifier='" + identifier + '\'' +
                ", longName='" + longName + '\'' +
                '}';
    }
}

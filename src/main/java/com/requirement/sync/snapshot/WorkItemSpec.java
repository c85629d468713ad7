package com.requirement.sync.snapshot;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A work item of a tracker snapshot.
 *
 * <p>Whether the item is a folder is decided once, at construction: it is a folder
 * if it has children, if it was explicitly declared as one, or if it carries the
 * reserved {@code Type: Folder} marker attribute. The marker is a hint only and is
 * never stored as an attribute value.</p>
 */
public final class WorkItemSpec {

    public static final String FOLDER_MARKER_ATTRIBUTE = "Type";
    public static final String FOLDER_MARKER_VALUE = "Folder";

    private final String identifier;
    private final String longName;
    private final String text;
    private final String typeId;
    private final Map<String, Object> attributes;
    private final List<WorkItemSpec> children;
    private final WorkItemKind kind;

    private WorkItemSpec(Builder builder) {
        this.identifier = builder.identifier;
        this.longName = builder.longName;
        this.text = builder.text;
        this.typeId = builder.typeId;
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(builder.attributes));
        this.children = List.copyOf(builder.children);
        boolean folder = builder.folder
                || !children.isEmpty()
                || attributes.entrySet().stream().anyMatch(e -> isFolderMarker(e.getKey(), e.getValue()));
        this.kind = folder ? WorkItemKind.FOLDER : WorkItemKind.REQUIREMENT;
    }

    public String getIdentifier() {
        return identifier;
    }

    public String getLongName() {
        return longName;
    }

    /**
     * Free text, or null when the snapshot does not supply any.
     */
    public String getText() {
        return text;
    }

    /**
     * Identifier of the item's requirement type, or null.
     */
    public String getTypeId() {
        return typeId;
    }

    /**
     * Raw attribute values keyed by attribute name. Values may be null.
     */
    public Map<String, Object> getAttributes() {
        return attributes;
    }

    public List<WorkItemSpec> getChildren() {
        return children;
    }

    public WorkItemKind getKind() {
        return kind;
    }

    public boolean isFolder() {
        return kind == WorkItemKind.FOLDER;
    }

    /**
     * Checks whether a name/value pair is the reserved folder marker. A list value
     * is a marker if it is non-empty and every element is the marker value.
     */
    public static boolean isFolderMarker(String name, Object value) {
        if (!FOLDER_MARKER_ATTRIBUTE.equals(name) || value == null) {
            return false;
        }
        if (value instanceof Collection<?> values) {
            return !values.isEmpty() && values.stream().allMatch(FOLDER_MARKER_VALUE::equals);
        }
        return FOLDER_MARKER_VALUE.equals(value);
    }

    @Override
    public String toString() {
        return "WorkItemSpec{" +
                "identifier='" + identifier + '\'' +
                ", longName='" + longName + '\'' +
                ", typeId='" + typeId + '\'' +
                ", kind=" + kind +
                ", children=" + children.size() +
                '}';
    }

    public static Builder builder(String identifier) {
        return new Builder().identifier(identifier);
    }

    public static class Builder {
        private String identifier;
        private String longName;
        private String text;
        private String typeId;
        private final Map<String, Object> attributes = new LinkedHashMap<>();
        private final List<WorkItemSpec> children = new ArrayList<>();
        private boolean folder;

        public Builder identifier(String identifier) {
            this.identifier = identifier;
            return this;
        }

        public Builder longName(String longName) {
            this.longName = longName;
            return this;
        }

        public Builder text(String text) {
            this.text = text;
            return this;
        }

        public Builder type(String typeId) {
            this.typeId = typeId;
            return this;
        }

        public Builder attribute(String name, Object value) {
            this.attributes.put(name, value);
            return this;
        }

        public Builder attributes(Map<String, ?> attributes) {
            this.attributes.putAll(attributes);
            return this;
        }

        public Builder child(WorkItemSpec child) {
            this.children.add(Objects.requireNonNull(child, "child is required"));
            return this;
        }

        public Builder children(List<WorkItemSpec> children) {
            children.forEach(this::child);
            return this;
        }

        /**
         * Marks the item as a folder even when it has no children.
         */
        public Builder folder() {
            this.folder = true;
            return this;
        }

        public WorkItemSpec build() {
            Objects.requireNonNull(identifier, "identifier is required");
            Objects.requireNonNull(longName, "longName is required");
            return new WorkItemSpec(this);
        }
    }
}

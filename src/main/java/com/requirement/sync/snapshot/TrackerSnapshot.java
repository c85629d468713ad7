package com.requirement.sync.snapshot;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Desired state of one tracker module: its enumeration data types, its
 * requirement types and its tree of work items.
 */
public final class TrackerSnapshot {
    private final String moduleId;
    private final Map<String, Set<String>> dataTypes;
    private final Map<String, RequirementTypeSpec> requirementTypes;
    private final List<WorkItemSpec> items;

    private TrackerSnapshot(Builder builder) {
        this.moduleId = builder.moduleId;
        Map<String, Set<String>> types = new LinkedHashMap<>();
        builder.dataTypes.forEach((name, options) ->
                types.put(name, Collections.unmodifiableSet(new LinkedHashSet<>(options))));
        this.dataTypes = Collections.unmodifiableMap(types);
        this.requirementTypes = Collections.unmodifiableMap(new LinkedHashMap<>(builder.requirementTypes));
        this.items = List.copyOf(builder.items);
    }

    public String getModuleId() {
        return moduleId;
    }

    /**
     * Enumeration options keyed by data type definition name, both in snapshot order.
     */
    public Map<String, Set<String>> getDataTypes() {
        return dataTypes;
    }

    public Set<String> getOptions(String dataTypeName) {
        return dataTypes.getOrDefault(dataTypeName, Set.of());
    }

    public Map<String, RequirementTypeSpec> getRequirementTypes() {
        return requirementTypes;
    }

    public RequirementTypeSpec getRequirementType(String identifier) {
        return identifier != null ? requirementTypes.get(identifier) : null;
    }

    public List<WorkItemSpec> getItems() {
        return items;
    }

    public static Builder builder(String moduleId) {
        return new Builder().moduleId(moduleId);
    }

    public static class Builder {
        private String moduleId;
        private final Map<String, List<String>> dataTypes = new LinkedHashMap<>();
        private final Map<String, RequirementTypeSpec> requirementTypes = new LinkedHashMap<>();
        private final List<WorkItemSpec> items = new ArrayList<>();

        public Builder moduleId(String moduleId) {
            this.moduleId = moduleId;
            return this;
        }

        public Builder dataType(String name, List<String> options) {
            this.dataTypes.put(name, List.copyOf(options));
            return this;
        }

        public Builder requirementType(String identifier, RequirementTypeSpec requirementType) {
            this.requirementTypes.put(identifier, requirementType);
            return this;
        }

        public Builder item(WorkItemSpec item) {
            this.items.add(Objects.requireNonNull(item, "item is required"));
            return this;
        }

        public Builder items(List<WorkItemSpec> items) {
            items.forEach(this::item);
            return this;
        }

        public TrackerSnapshot build() {
            Objects.requireNonNull(moduleId, "moduleId is required");
            return new TrackerSnapshot(this);
        }
    }
}

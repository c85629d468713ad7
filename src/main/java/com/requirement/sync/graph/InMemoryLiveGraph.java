package com.requirement.sync.graph;

import com.requirement.sync.core.model.AttributeDefinition;
import com.requirement.sync.core.model.DataTypeDefinition;
import com.requirement.sync.core.model.EnumValue;
import com.requirement.sync.core.model.Folder;
import com.requirement.sync.core.model.Module;
import com.requirement.sync.core.model.RequirementType;
import com.requirement.sync.core.model.RequirementTypeFolder;
import com.requirement.sync.core.model.WorkItem;
import com.requirement.sync.core.model.WorkItemContainer;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * {@link LiveGraph} over modules held in memory.
 * Lookups walk the current tree, so changes made to the registered modules are
 * visible immediately.
 */
public class InMemoryLiveGraph implements LiveGraph {

    private final Map<String, Module> modules = new LinkedHashMap<>();

    public InMemoryLiveGraph(Module... modules) {
        for (Module module : modules) {
            register(module);
        }
    }

    public InMemoryLiveGraph register(Module module) {
        modules.put(module.getId(), module);
        return this;
    }

    public Collection<Module> getModules() {
        return Collections.unmodifiableCollection(modules.values());
    }

    @Override
    public Optional<Module> findModule(String moduleId) {
        return Optional.ofNullable(moduleId != null ? modules.get(moduleId) : null);
    }

    @Override
    public Optional<Module> findModuleByIdentifier(String identifier) {
        return modules.values().stream()
                .filter(m -> identifier != null && identifier.equals(m.getIdentifier()))
                .findFirst();
    }

    @Override
    public Optional<WorkItem> findWorkItemByIdentifier(Module module, String identifier) {
        return allWorkItems(module).stream()
                .filter(item -> item.getIdentifier().equals(identifier))
                .findFirst();
    }

    /**
     * Lists every folder and requirement below {@code module}, depth first.
     */
    public List<WorkItem> allWorkItems(Module module) {
        List<WorkItem> items = new ArrayList<>();
        collect(module, items);
        return items;
    }

    private void collect(WorkItemContainer container, List<WorkItem> items) {
        items.addAll(container.getRequirements());
        for (Folder folder : container.getFolders()) {
            items.add(folder);
            collect(folder, items);
        }
    }

    @Override
    public Optional<RequirementTypeFolder> findTypeFolder(Module module) {
        return Optional.ofNullable(module.getTypeFolder());
    }

    @Override
    public Optional<DataTypeDefinition> findDataTypeDefinition(RequirementTypeFolder typeFolder, String name) {
        return byName(typeFolder.getDataTypeDefinitions(), DataTypeDefinition::getLongName, name);
    }

    @Override
    public Optional<EnumValue> findEnumValue(DataTypeDefinition definition, String name) {
        return definition.findValue(name);
    }

    @Override
    public Optional<RequirementType> findRequirementType(RequirementTypeFolder typeFolder, String identifier) {
        return typeFolder.getRequirementTypes().stream()
                .filter(t -> t.getIdentifier().equals(identifier))
                .findFirst();
    }

    @Override
    public Optional<AttributeDefinition> findAttributeDefinition(RequirementTypeFolder typeFolder, String identifier) {
        return typeFolder.getRequirementTypes().stream()
                .flatMap(t -> t.getAttributeDefinitions().stream())
                .filter(d -> identifier.equals(d.getIdentifier()))
                .findFirst();
    }

    @Override
    public Optional<AttributeDefinition> findAttributeDefinitionByName(RequirementType type, String name) {
        return byName(type.getAttributeDefinitions(), AttributeDefinition::getLongName, name);
    }

    private static <T> Optional<T> byName(List<T> candidates, Function<T, String> nameOf, String name) {
        Optional<T> exact = candidates.stream()
                .filter(c -> name.equals(nameOf.apply(c)))
                .findFirst();
        if (exact.isPresent()) {
            return exact;
        }
        return candidates.stream()
                .filter(c -> name.equalsIgnoreCase(nameOf.apply(c)))
                .findFirst();
    }
}

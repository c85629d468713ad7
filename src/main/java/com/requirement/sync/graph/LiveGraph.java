package com.requirement.sync.graph;

import com.requirement.sync.core.model.AttributeDefinition;
import com.requirement.sync.core.model.DataTypeDefinition;
import com.requirement.sync.core.model.EnumValue;
import com.requirement.sync.core.model.Module;
import com.requirement.sync.core.model.RequirementType;
import com.requirement.sync.core.model.RequirementTypeFolder;
import com.requirement.sync.core.model.WorkItem;

import java.util.Optional;

/**
 * Read-only view of the persisted requirements graph.
 * Implementations are supplied by the model access layer; reconciliation never
 * mutates the graph through this interface.
 */
public interface LiveGraph {

    /**
     * Finds a module by its persistent identity.
     */
    Optional<Module> findModule(String moduleId);

    /**
     * Finds a module by its external tracker identifier.
     */
    Optional<Module> findModuleByIdentifier(String identifier);

    /**
     * Finds a folder or requirement anywhere below {@code module} by external identifier.
     */
    Optional<WorkItem> findWorkItemByIdentifier(Module module, String identifier);

    Optional<RequirementTypeFolder> findTypeFolder(Module module);

    /**
     * Finds a data type definition by name, falling back to a case-insensitive match.
     */
    Optional<DataTypeDefinition> findDataTypeDefinition(RequirementTypeFolder typeFolder, String name);

    Optional<EnumValue> findEnumValue(DataTypeDefinition definition, String name);

    Optional<RequirementType> findRequirementType(RequirementTypeFolder typeFolder, String identifier);

    /**
     * Finds an attribute definition by identifier among all requirement types of the folder.
     */
    Optional<AttributeDefinition> findAttributeDefinition(RequirementTypeFolder typeFolder, String identifier);

    /**
     * Finds an attribute definition of {@code type} by name, falling back to a case-insensitive match.
     */
    Optional<AttributeDefinition> findAttributeDefinitionByName(RequirementType type, String name);
}

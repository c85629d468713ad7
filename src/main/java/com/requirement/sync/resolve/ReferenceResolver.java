package com.requirement.sync.resolve;

import com.requirement.sync.action.PromiseLabels;
import com.requirement.sync.action.Reference;
import com.requirement.sync.core.model.AttributeKind;
import com.requirement.sync.core.model.DataTypeDefinition;
import com.requirement.sync.core.model.Module;
import com.requirement.sync.core.model.RequirementTypeFolder;
import com.requirement.sync.graph.LiveGraph;

import java.util.Optional;

/**
 * Resolves name-scoped lookups against the live graph of one module.
 *
 * <p>An element that exists yields a {@link Reference.Concrete}; one that does not
 * yields a {@link Reference.Promise} whose label is exactly the promise id the
 * creation payload for that element declares (see {@link PromiseLabels}).
 * Resolution is read-only; it never creates or reserves anything.</p>
 */
public class ReferenceResolver {

    private final LiveGraph graph;
    private final RequirementTypeFolder typeFolder;

    public ReferenceResolver(LiveGraph graph, Module module) {
        this.graph = graph;
        this.typeFolder = graph.findTypeFolder(module).orElse(null);
    }

    /**
     * The module's type folder, or null if it has none yet.
     */
    public RequirementTypeFolder getTypeFolder() {
        return typeFolder;
    }

    public Reference dataTypeDefinition(String name) {
        return findDataTypeDefinition(name)
                .<Reference>map(d -> Reference.concrete(d.getId()))
                .orElseGet(() -> Reference.promise(PromiseLabels.dataTypeDefinition(name)));
    }

    /**
     * Resolves the literal {@code literal} of the data type named {@code dataTypeName}.
     */
    public Reference enumValue(String dataTypeName, String literal) {
        return findDataTypeDefinition(dataTypeName)
                .flatMap(d -> graph.findEnumValue(d, literal))
                .<Reference>map(v -> Reference.concrete(v.getId()))
                .orElseGet(() -> Reference.promise(PromiseLabels.enumValue(dataTypeName, literal)));
    }

    public Reference requirementType(String identifier) {
        return Optional.ofNullable(typeFolder)
                .flatMap(f -> graph.findRequirementType(f, identifier))
                .<Reference>map(t -> Reference.concrete(t.getId()))
                .orElseGet(() -> Reference.promise(PromiseLabels.requirementType(identifier)));
    }

    /**
     * Resolves the definition of attribute {@code attributeName} on requirement type
     * {@code requirementTypeId}, by identifier first and then by name under the type,
     * the way the type system reconciler matches it. A live definition of a different
     * kind does not match.
     */
    public Reference attributeDefinition(AttributeKind kind, String attributeName, String requirementTypeId) {
        String identifier = PromiseLabels.attributeDefinitionIdentifier(attributeName, requirementTypeId);
        return Optional.ofNullable(typeFolder)
                .flatMap(f -> graph.findAttributeDefinition(f, identifier)
                        .or(() -> graph.findRequirementType(f, requirementTypeId)
                                .flatMap(t -> graph.findAttributeDefinitionByName(t, attributeName))))
                .filter(d -> d.getKind() == kind)
                .<Reference>map(d -> Reference.concrete(d.getId()))
                .orElseGet(() -> Reference.promise(
                        PromiseLabels.attributeDefinition(kind, attributeName, requirementTypeId)));
    }

    private Optional<DataTypeDefinition> findDataTypeDefinition(String name) {
        return Optional.ofNullable(typeFolder).flatMap(f -> graph.findDataTypeDefinition(f, name));
    }
}

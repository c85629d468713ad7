package com.requirement.sync.reconcile;

import com.requirement.sync.action.ActionAssembler;
import com.requirement.sync.action.ActionFields;
import com.requirement.sync.action.ActionSlots;
import com.requirement.sync.action.ChangeAction;
import com.requirement.sync.action.CreatePayload;
import com.requirement.sync.action.PromiseLabels;
import com.requirement.sync.action.Reference;
import com.requirement.sync.core.model.AttributeDefinition;
import com.requirement.sync.core.model.AttributeKind;
import com.requirement.sync.core.model.DataTypeDefinition;
import com.requirement.sync.core.model.EnumValue;
import com.requirement.sync.core.model.RequirementType;
import com.requirement.sync.core.model.RequirementTypeFolder;
import com.requirement.sync.graph.LiveGraph;
import com.requirement.sync.resolve.ReferenceResolver;
import com.requirement.sync.snapshot.AttributeDefinitionSpec;
import com.requirement.sync.snapshot.RequirementTypeSpec;
import com.requirement.sync.snapshot.TrackerSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Diffs the snapshot's data types and requirement types against the module's
 * live {@link RequirementTypeFolder}.
 *
 * <p>Actions on data type definitions come before actions on requirement types,
 * so enumeration attribute definitions can reference data types created in the
 * same change set. Every creation payload declares the promise label the
 * {@link ReferenceResolver} derives for the element.</p>
 */
public class TypeSystemReconciler {
    private static final Logger log = LoggerFactory.getLogger(TypeSystemReconciler.class);

    public static final String TYPES_FOLDER_NAME = "Types";
    public static final String TYPES_FOLDER_IDENTIFIER = "-2";

    private final TrackerSnapshot snapshot;
    private final LiveGraph graph;
    private final ReferenceResolver resolver;
    private final RequirementTypeFolder typeFolder;

    public TypeSystemReconciler(TrackerSnapshot snapshot, LiveGraph graph, ReferenceResolver resolver) {
        this.snapshot = snapshot;
        this.graph = graph;
        this.resolver = resolver;
        this.typeFolder = resolver.getTypeFolder();
    }

    /**
     * Payload creating the whole type folder with every data type and requirement type
     * of the snapshot nested inside.
     */
    public CreatePayload typeFolderCreatePayload() {
        CreatePayload folder = CreatePayload.create()
                .put(ActionFields.LONG_NAME, TYPES_FOLDER_NAME)
                .put(ActionFields.IDENTIFIER, TYPES_FOLDER_IDENTIFIER);
        List<CreatePayload> dataTypes = new ArrayList<>();
        snapshot.getDataTypes().forEach((name, options) -> dataTypes.add(dataTypeCreatePayload(name, options)));
        List<CreatePayload> requirementTypes = new ArrayList<>();
        snapshot.getRequirementTypes().forEach((identifier, spec) ->
                requirementTypes.add(requirementTypeCreatePayload(identifier, spec)));
        folder.put(ActionSlots.DATA_TYPE_DEFINITIONS, dataTypes);
        folder.put(ActionSlots.REQUIREMENT_TYPES, requirementTypes);
        return folder;
    }

    public CreatePayload dataTypeCreatePayload(String name, Collection<String> options) {
        CreatePayload payload = CreatePayload.ofType(PromiseLabels.DATA_TYPE_DEFINITION)
                .promiseId(PromiseLabels.dataTypeDefinition(name))
                .put(ActionFields.LONG_NAME, name);
        for (String option : options) {
            payload.append(ActionSlots.VALUES, enumValueCreatePayload(name, option));
        }
        return payload;
    }

    private static CreatePayload enumValueCreatePayload(String dataTypeName, String literal) {
        return CreatePayload.create()
                .promiseId(PromiseLabels.enumValue(dataTypeName, literal))
                .put(ActionFields.LONG_NAME, literal);
    }

    public CreatePayload requirementTypeCreatePayload(String identifier, RequirementTypeSpec spec) {
        CreatePayload payload = CreatePayload.create()
                .promiseId(PromiseLabels.requirementType(identifier))
                .put(ActionFields.IDENTIFIER, identifier)
                .put(ActionFields.LONG_NAME, spec.longName());
        spec.attributes().forEach((name, definition) ->
                payload.append(ActionSlots.ATTRIBUTE_DEFINITIONS,
                        attributeDefinitionCreatePayload(name, definition, identifier)));
        return payload;
    }

    public CreatePayload attributeDefinitionCreatePayload(String name, AttributeDefinitionSpec spec,
                                                          String requirementTypeId) {
        AttributeKind kind = spec.kind();
        CreatePayload payload = CreatePayload.ofType(PromiseLabels.attributeDefinitionClass(kind))
                .promiseId(PromiseLabels.attributeDefinition(kind, name, requirementTypeId))
                .put(ActionFields.LONG_NAME, name)
                .put(ActionFields.IDENTIFIER, PromiseLabels.attributeDefinitionIdentifier(name, requirementTypeId))
                .put(ActionFields.KIND, kind.getLabel());
        if (kind == AttributeKind.ENUM) {
            Reference dataType = dataTypeReference(name);
            if (dataType != null) {
                payload.put(ActionFields.DATA_TYPE, dataType);
            }
            payload.put(ActionFields.MULTI_VALUED, spec.multiValued());
        }
        return payload;
    }

    /**
     * Computes the actions aligning an existing type folder with the snapshot.
     *
     * @throws IllegalStateException if the module has no type folder yet
     */
    public List<ChangeAction> reconcile() {
        if (typeFolder == null) {
            throw new IllegalStateException("Module has no requirement types folder; create it instead");
        }
        List<ChangeAction> actions = new ArrayList<>();
        actions.addAll(dataTypeActions());
        actions.addAll(requirementTypeActions());
        return ActionAssembler.prune(actions);
    }

    private List<ChangeAction> dataTypeActions() {
        ChangeAction folderAction = ChangeAction.on(typeFolder.getId());
        List<ChangeAction> modifications = new ArrayList<>();
        Set<String> matched = new HashSet<>();

        for (Map.Entry<String, Set<String>> entry : snapshot.getDataTypes().entrySet()) {
            String name = entry.getKey();
            Optional<DataTypeDefinition> live = graph.findDataTypeDefinition(typeFolder, name);
            if (live.isEmpty()) {
                folderAction.extend(ActionSlots.DATA_TYPE_DEFINITIONS, dataTypeCreatePayload(name, entry.getValue()));
                continue;
            }
            DataTypeDefinition definition = live.get();
            matched.add(definition.getId());
            ActionAssembler.appendIfChanged(modifications, dataTypeModification(definition, name, entry.getValue()));
        }

        for (DataTypeDefinition definition : typeFolder.getDataTypeDefinitions()) {
            if (!matched.contains(definition.getId())) {
                folderAction.delete(ActionSlots.DATA_TYPE_DEFINITIONS, Reference.concrete(definition.getId()));
            }
        }

        List<ChangeAction> actions = new ArrayList<>();
        ActionAssembler.appendIfChanged(actions, folderAction);
        actions.addAll(modifications);
        return actions;
    }

    private ChangeAction dataTypeModification(DataTypeDefinition definition, String name, Set<String> options) {
        ChangeAction action = ChangeAction.on(definition.getId());
        if (!definition.getLongName().equals(name)) {
            action.modify(ActionFields.LONG_NAME, name);
        }
        for (String option : options) {
            if (graph.findEnumValue(definition, option).isEmpty()) {
                action.extend(ActionSlots.VALUES, enumValueCreatePayload(name, option));
            }
        }
        for (EnumValue value : definition.getValues()) {
            if (!options.contains(value.getLongName())) {
                action.delete(ActionSlots.VALUES, Reference.concrete(value.getId()));
            }
        }
        return action;
    }

    private List<ChangeAction> requirementTypeActions() {
        ChangeAction folderAction = ChangeAction.on(typeFolder.getId());
        List<ChangeAction> modifications = new ArrayList<>();

        snapshot.getRequirementTypes().forEach((identifier, spec) -> {
            Optional<RequirementType> live = graph.findRequirementType(typeFolder, identifier);
            if (live.isEmpty()) {
                folderAction.extend(ActionSlots.REQUIREMENT_TYPES, requirementTypeCreatePayload(identifier, spec));
            } else {
                modifications.addAll(requirementTypeModifications(live.get(), spec));
            }
        });

        ChangeAction deletions = ChangeAction.on(typeFolder.getId());
        for (RequirementType type : typeFolder.getRequirementTypes()) {
            if (!snapshot.getRequirementTypes().containsKey(type.getIdentifier())) {
                deletions.delete(ActionSlots.REQUIREMENT_TYPES, Reference.concrete(type.getId()));
            }
        }

        List<ChangeAction> actions = new ArrayList<>();
        ActionAssembler.appendIfChanged(actions, folderAction);
        actions.addAll(modifications);
        ActionAssembler.appendIfChanged(actions, deletions);
        return actions;
    }

    private List<ChangeAction> requirementTypeModifications(RequirementType type, RequirementTypeSpec spec) {
        ChangeAction action = ChangeAction.on(type.getId());
        List<ChangeAction> definitionModifications = new ArrayList<>();
        if (spec.longName() != null && !spec.longName().equals(type.getLongName())) {
            action.modify(ActionFields.LONG_NAME, spec.longName());
        }

        Set<String> matched = new HashSet<>();
        spec.attributes().forEach((name, definitionSpec) -> {
            Optional<AttributeDefinition> live = graph.findAttributeDefinitionByName(type, name);
            if (live.isPresent() && live.get().getKind() == definitionSpec.kind()) {
                matched.add(live.get().getId());
                ActionAssembler.appendIfChanged(definitionModifications,
                        attributeDefinitionModification(live.get(), name, definitionSpec, type.getIdentifier()));
                return;
            }
            if (live.isPresent()) {
                log.info("Attribute definition '{}' of '{}' changes kind {} -> {}, recreating",
                        name, type.getIdentifier(), live.get().getKind(), definitionSpec.kind());
            }
            action.extend(ActionSlots.ATTRIBUTE_DEFINITIONS,
                    attributeDefinitionCreatePayload(name, definitionSpec, type.getIdentifier()));
        });

        for (AttributeDefinition definition : type.getAttributeDefinitions()) {
            if (!matched.contains(definition.getId())) {
                action.delete(ActionSlots.ATTRIBUTE_DEFINITIONS, Reference.concrete(definition.getId()));
            }
        }

        List<ChangeAction> actions = new ArrayList<>();
        ActionAssembler.appendIfChanged(actions, action);
        actions.addAll(definitionModifications);
        return actions;
    }

    private ChangeAction attributeDefinitionModification(AttributeDefinition definition, String name,
                                                         AttributeDefinitionSpec spec, String requirementTypeId) {
        ChangeAction action = ChangeAction.on(definition.getId());
        if (!definition.getLongName().equals(name)) {
            action.modify(ActionFields.LONG_NAME, name);
        }
        String identifier = PromiseLabels.attributeDefinitionIdentifier(name, requirementTypeId);
        if (!identifier.equals(definition.getIdentifier())) {
            action.modify(ActionFields.IDENTIFIER, identifier);
        }
        if (spec.kind() == AttributeKind.ENUM) {
            Reference reference = dataTypeReference(name);
            if (reference != null && !reference.equals(currentDataType(definition))) {
                action.modify(ActionFields.DATA_TYPE, reference);
            }
            if (definition.isMultiValued() != spec.multiValued()) {
                action.modify(ActionFields.MULTI_VALUED, spec.multiValued());
            }
        }
        return action;
    }

    private static Reference currentDataType(AttributeDefinition definition) {
        DataTypeDefinition dataType = definition.getDataType();
        return dataType != null ? Reference.concrete(dataType.getId()) : null;
    }

    /**
     * Reference to the data type an enumeration attribute named {@code name} draws its
     * options from, or null if neither the live graph nor the snapshot provides it.
     */
    private Reference dataTypeReference(String name) {
        Reference reference = resolver.dataTypeDefinition(name);
        if (reference instanceof Reference.Promise && !snapshot.getDataTypes().containsKey(name)) {
            log.warn("Enumeration attribute '{}' has no data type definition of the same name", name);
            return null;
        }
        return reference;
    }
}

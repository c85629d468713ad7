package com.requirement.sync.reconcile;

import com.requirement.sync.action.ActionAssembler;
import com.requirement.sync.action.ActionFields;
import com.requirement.sync.action.ActionSlots;
import com.requirement.sync.action.ChangeAction;
import com.requirement.sync.action.CreatePayload;
import com.requirement.sync.action.Reference;
import com.requirement.sync.core.model.AttributeKind;
import com.requirement.sync.core.model.AttributeValue;
import com.requirement.sync.core.model.Folder;
import com.requirement.sync.core.model.Module;
import com.requirement.sync.core.model.RequirementType;
import com.requirement.sync.core.model.WorkItem;
import com.requirement.sync.core.model.WorkItemContainer;
import com.requirement.sync.graph.LiveGraph;
import com.requirement.sync.resolve.ReferenceResolver;
import com.requirement.sync.snapshot.RequirementTypeSpec;
import com.requirement.sync.snapshot.TrackerSnapshot;
import com.requirement.sync.snapshot.WorkItemSpec;
import com.requirement.sync.validation.InvalidFieldValueException;
import com.requirement.sync.validation.ValidatedValue;
import com.requirement.sync.validation.ValueValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Diffs snapshot work items against the live folder and requirement tree.
 *
 * <p>Items are matched by external identifier anywhere in the module, not by
 * position. A matched item whose live parent differs from the parent driving
 * the recursion is relocated: the new parent extends it by reference and any
 * deletion already proposed for it is retracted through the {@link DeletionLedger}.</p>
 *
 * <p>One instance serves one reconciliation run; it accumulates the identifiers
 * of visited and relocated items.</p>
 */
public class WorkItemReconciler {
    private static final Logger log = LoggerFactory.getLogger(WorkItemReconciler.class);

    private final TrackerSnapshot snapshot;
    private final LiveGraph graph;
    private final Module module;
    private final ReferenceResolver resolver;
    private final ValueValidator validator;
    private final DeletionLedger ledger;
    private final Set<String> visited = new LinkedHashSet<>();
    private final Set<String> relocated = new LinkedHashSet<>();

    public WorkItemReconciler(TrackerSnapshot snapshot, LiveGraph graph, Module module,
                              ReferenceResolver resolver, ValueValidator validator, DeletionLedger ledger) {
        this.snapshot = snapshot;
        this.graph = graph;
        this.module = module;
        this.resolver = resolver;
        this.validator = validator;
        this.ledger = ledger;
    }

    /**
     * Creation payload for an item absent from the live graph, plus the actions
     * for live items the snapshot places below it.
     */
    public record Creation(CreatePayload payload, List<ChangeAction> followUps) {
        public Creation {
            followUps = List.copyOf(followUps);
        }
    }

    /**
     * Builds the creation of {@code spec} and, recursively, of its children.
     * Children that already exist are modified and moved under the new item.
     *
     * @throws InvalidFieldValueException if an attribute value is invalid
     */
    public Creation createItem(WorkItemSpec spec) {
        warnIfUnknownType(spec);
        CreatePayload payload = CreatePayload.create()
                .put(ActionFields.LONG_NAME, spec.getLongName())
                .put(ActionFields.IDENTIFIER, spec.getIdentifier());
        if (spec.getText() != null && !spec.getText().isEmpty()) {
            payload.put(ActionFields.TEXT, spec.getText());
        }

        RequirementTypeSpec typeSpec = attributeTypeOf(spec);
        if (typeSpec != null) {
            List<CreatePayload> attributes = new ArrayList<>();
            forEachDeclaredAttribute(spec, typeSpec, (name, value) ->
                    attributes.add(attributeValueCreatePayload(name, value, spec.getTypeId())));
            if (!attributes.isEmpty()) {
                payload.put(ActionFields.ATTRIBUTES, attributes);
            }
        }
        if (spec.getTypeId() != null && isKnownType(spec)) {
            payload.put(ActionFields.TYPE, resolver.requirementType(spec.getTypeId()));
        }

        List<ChangeAction> followUps = new ArrayList<>();
        if (spec.isFolder()) {
            for (WorkItemSpec child : spec.getChildren()) {
                Optional<WorkItem> existing = graph.findWorkItemByIdentifier(module, child.getIdentifier());
                if (existing.isEmpty()) {
                    Creation creation = createItem(child);
                    payload.append(child.getKind().getSlot(), creation.payload());
                    followUps.addAll(creation.followUps());
                } else {
                    WorkItem live = existing.get();
                    followUps.addAll(modifyItem(live, child, null));
                    payload.append(slotOf(live), Reference.concrete(live.getId()));
                }
            }
        }
        return new Creation(payload, followUps);
    }

    /**
     * Diffs {@code live} against {@code spec}. Returns the action on the item
     * itself, if it carries a change, followed by the actions of its descendants.
     *
     * @param expectedParent the container the snapshot places the item in, or null
     *                       if that container is yet to be created
     * @throws InvalidFieldValueException if an attribute value is invalid
     */
    public List<ChangeAction> modifyItem(WorkItem live, WorkItemSpec spec, WorkItemContainer expectedParent) {
        visited.add(live.getIdentifier());
        warnIfUnknownType(spec);
        ChangeAction action = ChangeAction.on(live.getId());

        if (!Objects.equals(live.getLongName(), spec.getLongName())) {
            action.modify(ActionFields.LONG_NAME, spec.getLongName());
        }
        if (spec.getText() != null && !spec.getText().equals(nullToEmpty(live.getText()))) {
            action.modify(ActionFields.TEXT, spec.getText());
        }
        diffType(live, spec, action);
        diffAttributes(live, spec, action);

        WorkItemContainer parent = live.getParent();
        if (expectedParent == null || parent == null || !expectedParent.getId().equals(parent.getId())) {
            relocated.add(live.getIdentifier());
            ledger.retract(live);
        }

        List<ChangeAction> followUps = new ArrayList<>();
        if (live instanceof Folder folder) {
            followUps.addAll(diffChildren(folder, spec, action));
        } else if (!spec.getChildren().isEmpty()) {
            log.warn("Requirement '{}' has children in the snapshot; they are ignored", live.getIdentifier());
        }

        List<ChangeAction> actions = new ArrayList<>();
        ActionAssembler.appendIfChanged(actions, action);
        actions.addAll(followUps);
        return actions;
    }

    public Set<String> getVisited() {
        return Collections.unmodifiableSet(visited);
    }

    public Set<String> getRelocated() {
        return Collections.unmodifiableSet(relocated);
    }

    /**
     * Name of the container slot a live item is held in.
     */
    public static String slotOf(WorkItem item) {
        return item.isFolder() ? ActionSlots.FOLDERS : ActionSlots.REQUIREMENTS;
    }

    private void diffType(WorkItem live, WorkItemSpec spec, ChangeAction action) {
        RequirementType liveType = live.getType();
        String liveTypeId = liveType != null ? liveType.getIdentifier() : null;
        if (Objects.equals(spec.getTypeId(), liveTypeId) || !isKnownType(spec)) {
            return;
        }
        Reference type = spec.getTypeId() != null ? resolver.requirementType(spec.getTypeId()) : null;
        action.modify(ActionFields.TYPE, type);
    }

    private void diffAttributes(WorkItem live, WorkItemSpec spec, ChangeAction action) {
        if (hasAttributes(spec) && spec.getTypeId() == null) {
            logUntypedAttributes(spec);
            return;
        }
        if (!isKnownType(spec)) {
            return;
        }
        RequirementTypeSpec typeSpec = snapshot.getRequirementType(spec.getTypeId());
        Set<String> retained = new HashSet<>();
        if (typeSpec != null) {
            forEachDeclaredAttribute(spec, typeSpec, (name, value) -> {
                Optional<AttributeValue> current = live.findAttribute(name);
                Reference definition = resolver.attributeDefinition(value.kind(), name, spec.getTypeId());
                if (current.isPresent() && isDefinedBy(current.get(), definition)) {
                    retained.add(current.get().getId());
                    if (differs(current.get(), value)) {
                        action.modifyAttribute(name, storedValue(name, value));
                    }
                } else {
                    action.extend(ActionSlots.ATTRIBUTES, attributeValueCreatePayload(name, value, spec.getTypeId()));
                }
            });
        }
        for (AttributeValue attribute : live.getAttributes()) {
            if (!retained.contains(attribute.getId())) {
                action.delete(ActionSlots.ATTRIBUTES, Reference.concrete(attribute.getId()));
            }
        }
    }

    private List<ChangeAction> diffChildren(Folder folder, WorkItemSpec spec, ChangeAction action) {
        ChangeAction fragment = ChangeAction.on(folder.getId());
        List<ChangeAction> followUps = new ArrayList<>();
        Set<String> childIds = new HashSet<>();

        for (WorkItemSpec child : spec.getChildren()) {
            childIds.add(child.getIdentifier());
            Optional<WorkItem> existing = graph.findWorkItemByIdentifier(module, child.getIdentifier());
            if (existing.isEmpty()) {
                Creation creation = createItem(child);
                fragment.extend(child.getKind().getSlot(), creation.payload());
                followUps.addAll(creation.followUps());
                continue;
            }
            WorkItem live = existing.get();
            followUps.addAll(modifyItem(live, child, folder));
            if (!folder.equals(live.getParent())) {
                fragment.extend(slotOf(live), Reference.concrete(live.getId()));
            }
        }

        List<WorkItem> doomed = new ArrayList<>();
        for (WorkItem child : folder.getFolders()) {
            if (!childIds.contains(child.getIdentifier()) && !relocated.contains(child.getIdentifier())) {
                fragment.delete(ActionSlots.FOLDERS, Reference.concrete(child.getId()));
                doomed.add(child);
            }
        }
        for (WorkItem child : folder.getRequirements()) {
            if (!childIds.contains(child.getIdentifier()) && !relocated.contains(child.getIdentifier())) {
                fragment.delete(ActionSlots.REQUIREMENTS, Reference.concrete(child.getId()));
                doomed.add(child);
            }
        }

        ActionAssembler.merge(action, fragment);
        for (WorkItem item : doomed) {
            ledger.propose(item, action, slotOf(item));
        }
        return followUps;
    }

    private CreatePayload attributeValueCreatePayload(String name, ValidatedValue value, String typeId) {
        return CreatePayload.ofType(value.kind().getTypeTag())
                .put(ActionFields.DEFINITION, resolver.attributeDefinition(value.kind(), name, typeId))
                .put(value.key(), storedValue(name, value));
    }

    /**
     * Value as carried by an action: literal references for enumerations, the
     * canonical value otherwise.
     */
    private Object storedValue(String name, ValidatedValue value) {
        if (value.kind() != AttributeKind.ENUM) {
            return value.value();
        }
        List<Reference> references = new ArrayList<>();
        for (String literal : value.literals()) {
            references.add(resolver.enumValue(name, literal));
        }
        return references;
    }

    private static boolean isDefinedBy(AttributeValue attribute, Reference definition) {
        return definition instanceof Reference.Concrete concrete
                && concrete.id().equals(attribute.getDefinition().getId());
    }

    private static boolean differs(AttributeValue attribute, ValidatedValue value) {
        AttributeKind kind = value.kind();
        if (kind == AttributeKind.ENUM) {
            return !new HashSet<>(attribute.getValueNames()).equals(new HashSet<>(value.literals()));
        }
        Object current = attribute.getValue();
        if (kind.accepts(current)) {
            current = kind.canonicalize(current);
        }
        return !Objects.equals(current, value.value());
    }

    /**
     * The snapshot type attribute values of {@code spec} are validated against,
     * or null if attribute processing is skipped for it.
     */
    private RequirementTypeSpec attributeTypeOf(WorkItemSpec spec) {
        if (!hasAttributes(spec)) {
            return null;
        }
        if (spec.getTypeId() == null) {
            logUntypedAttributes(spec);
            return null;
        }
        return isKnownType(spec) ? snapshot.getRequirementType(spec.getTypeId()) : null;
    }

    private boolean isKnownType(WorkItemSpec spec) {
        return spec.getTypeId() == null || snapshot.getRequirementType(spec.getTypeId()) != null;
    }

    private void warnIfUnknownType(WorkItemSpec spec) {
        if (!isKnownType(spec)) {
            log.warn("Faulty work item '{}' in snapshot: unknown requirement type '{}'",
                    spec.getIdentifier(), spec.getTypeId());
        }
    }

    private static boolean hasAttributes(WorkItemSpec spec) {
        return spec.getAttributes().entrySet().stream()
                .anyMatch(e -> !WorkItemSpec.isFolderMarker(e.getKey(), e.getValue()));
    }

    private static void logUntypedAttributes(WorkItemSpec spec) {
        log.error("Broken snapshot: work item '{}' has attributes but no requirement type", spec.getIdentifier());
    }

    /**
     * Validates every attribute of {@code spec} that {@code typeSpec} declares and
     * hands it to {@code consumer}. Folder markers, null values and undeclared
     * attributes are treated as absent.
     */
    private void forEachDeclaredAttribute(WorkItemSpec spec, RequirementTypeSpec typeSpec,
                                          AttributeConsumer consumer) {
        for (Map.Entry<String, Object> entry : spec.getAttributes().entrySet()) {
            String name = entry.getKey();
            Object raw = entry.getValue();
            if (WorkItemSpec.isFolderMarker(name, raw)) {
                continue;
            }
            if (raw == null || !typeSpec.declares(name)) {
                log.debug("Skipping attribute '{}' of '{}'", name, spec.getIdentifier());
                continue;
            }
            consumer.accept(name, validator.validate(name, raw, typeSpec));
        }
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }

    @FunctionalInterface
    private interface AttributeConsumer {
        void accept(String name, ValidatedValue value);
    }
}

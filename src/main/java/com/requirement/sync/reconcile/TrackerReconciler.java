package com.requirement.sync.reconcile;

import com.requirement.sync.action.ActionAssembler;
import com.requirement.sync.action.ActionSlots;
import com.requirement.sync.action.ChangeAction;
import com.requirement.sync.action.PromiseLabels;
import com.requirement.sync.action.Reference;
import com.requirement.sync.api.AmbiguousLabelException;
import com.requirement.sync.api.MissingTargetModuleException;
import com.requirement.sync.api.ReconciliationOptions;
import com.requirement.sync.api.TrackerConfig;
import com.requirement.sync.core.model.Module;
import com.requirement.sync.core.model.WorkItem;
import com.requirement.sync.graph.LiveGraph;
import com.requirement.sync.resolve.ReferenceResolver;
import com.requirement.sync.snapshot.TrackerSnapshot;
import com.requirement.sync.snapshot.WorkItemSpec;
import com.requirement.sync.validation.ValueValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Computes the change set aligning one live module with a tracker snapshot.
 *
 * <p>The type system is handled first: a missing type folder is created as a
 * whole inside the module action, an existing one is diffed. The snapshot's
 * top-level items are then walked once. The module action comes last and carries
 * the new and moved top-level items and the deletion of live top-level items
 * the walk neither visited nor relocated.</p>
 *
 * <p>The computation reads the live graph only. An instance is single use.</p>
 */
public class TrackerReconciler {
    private static final Logger log = LoggerFactory.getLogger(TrackerReconciler.class);

    private final TrackerSnapshot snapshot;
    private final LiveGraph graph;
    private final TrackerConfig config;
    private final ReconciliationOptions options;

    public TrackerReconciler(TrackerSnapshot snapshot, LiveGraph graph, TrackerConfig config) {
        this(snapshot, graph, config, ReconciliationOptions.defaults());
    }

    public TrackerReconciler(TrackerSnapshot snapshot, LiveGraph graph, TrackerConfig config,
                             ReconciliationOptions options) {
        this.snapshot = Objects.requireNonNull(snapshot, "snapshot is required");
        this.graph = Objects.requireNonNull(graph, "graph is required");
        this.config = Objects.requireNonNull(config, "config is required");
        this.options = options != null ? options : ReconciliationOptions.defaults();
    }

    /**
     * Returns the ordered, non-void change actions for the module.
     *
     * @throws com.requirement.sync.api.InvalidTrackerConfigException if the config lacks the module identity
     * @throws AmbiguousLabelException if two snapshot elements derive the same label
     * @throws MissingTargetModuleException if the module is not in the live graph
     * @throws com.requirement.sync.validation.InvalidFieldValueException if an attribute value is invalid
     */
    public List<ChangeAction> reconcile() {
        config.validate();
        checkLabels();
        Module module = resolveModule();

        ReferenceResolver resolver = new ReferenceResolver(graph, module);
        TypeSystemReconciler types = new TypeSystemReconciler(snapshot, graph, resolver);
        DeletionLedger ledger = new DeletionLedger(options.getMetricsService());
        WorkItemReconciler items = new WorkItemReconciler(snapshot, graph, module, resolver,
                new ValueValidator(snapshot, options.isSubstituteDefaults()), ledger);

        List<ChangeAction> actions = new ArrayList<>();
        ChangeAction base = ChangeAction.on(module.getId());
        if (resolver.getTypeFolder() == null) {
            log.debug("Module {} has no requirement types folder, creating it", module.getId());
            base.extend(ActionSlots.REQUIREMENT_TYPES_FOLDERS, types.typeFolderCreatePayload());
        } else {
            actions.addAll(types.reconcile());
        }

        for (WorkItemSpec spec : snapshot.getItems()) {
            Optional<WorkItem> existing = graph.findWorkItemByIdentifier(module, spec.getIdentifier());
            if (existing.isEmpty()) {
                WorkItemReconciler.Creation creation = items.createItem(spec);
                base.extend(spec.getKind().getSlot(), creation.payload());
                actions.addAll(creation.followUps());
                continue;
            }
            WorkItem live = existing.get();
            actions.addAll(items.modifyItem(live, spec, module));
            if (live.getParent() == null || !module.getId().equals(live.getParent().getId())) {
                base.extend(WorkItemReconciler.slotOf(live), Reference.concrete(live.getId()));
            }
        }

        Set<String> kept = new HashSet<>(items.getVisited());
        kept.addAll(items.getRelocated());
        ChangeAction deletions = ChangeAction.on(module.getId());
        for (WorkItem folder : module.getFolders()) {
            if (!kept.contains(folder.getIdentifier())) {
                deletions.delete(ActionSlots.FOLDERS, Reference.concrete(folder.getId()));
            }
        }
        for (WorkItem requirement : module.getRequirements()) {
            if (!kept.contains(requirement.getIdentifier())) {
                deletions.delete(ActionSlots.REQUIREMENTS, Reference.concrete(requirement.getId()));
            }
        }
        ActionAssembler.merge(base, deletions);
        actions.add(base);

        List<ChangeAction> result = ActionAssembler.prune(actions);
        log.debug("Module {}: {} actions, {} visited, {} relocated, {} deletions pending, {} retracted",
                module.getId(), result.size(), items.getVisited().size(), items.getRelocated().size(),
                ledger.size(), ledger.getRetractions());
        return result;
    }

    /**
     * Labels join names with spaces, so {@code EnumValue A B C} can stand for option
     * {@code B C} of {@code A} or option {@code C} of {@code A B}. Such snapshots are refused.
     */
    private void checkLabels() {
        Map<String, List<String>> enumValues = new HashMap<>();
        snapshot.getDataTypes().forEach((dataType, options) -> options.forEach(option ->
                claim(enumValues, PromiseLabels.enumValue(dataType, option), List.of(dataType, option))));
        Map<String, List<String>> identifiers = new HashMap<>();
        snapshot.getRequirementTypes().forEach((typeId, spec) -> spec.attributes().keySet().forEach(name ->
                claim(identifiers, PromiseLabels.attributeDefinitionIdentifier(name, typeId), List.of(name, typeId))));
    }

    private static void claim(Map<String, List<String>> claimed, String label, List<String> owner) {
        List<String> previous = claimed.putIfAbsent(label, owner);
        if (previous != null && !previous.equals(owner)) {
            log.error("Skipping tracker: label '{}' is ambiguous", label);
            throw new AmbiguousLabelException(label, previous, owner);
        }
    }

    private Module resolveModule() {
        Optional<Module> module = graph.findModule(config.moduleId());
        if (module.isEmpty() && config.externalId() != null) {
            module = graph.findModuleByIdentifier(config.externalId());
        }
        return module.orElseThrow(() -> {
            log.error("Skipping tracker: module {} not found", config.moduleId());
            return new MissingTargetModuleException(config.moduleId());
        });
    }
}

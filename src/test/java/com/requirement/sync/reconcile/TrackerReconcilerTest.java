package com.requirement.sync.reconcile;

import com.requirement.sync.action.ActionFields;
import com.requirement.sync.action.ActionSlots;
import com.requirement.sync.action.ChangeAction;
import com.requirement.sync.action.CreatePayload;
import com.requirement.sync.action.Reference;
import com.requirement.sync.api.AmbiguousLabelException;
import com.requirement.sync.api.InvalidTrackerConfigException;
import com.requirement.sync.api.MissingTargetModuleException;
import com.requirement.sync.api.ReconciliationOptions;
import com.requirement.sync.api.TrackerConfig;
import com.requirement.sync.core.model.AttributeKind;
import com.requirement.sync.core.model.Folder;
import com.requirement.sync.core.model.Module;
import com.requirement.sync.core.model.Requirement;
import com.requirement.sync.core.model.RequirementType;
import com.requirement.sync.graph.InMemoryLiveGraph;
import com.requirement.sync.snapshot.AttributeDefinitionSpec;
import com.requirement.sync.snapshot.RequirementTypeSpec;
import com.requirement.sync.snapshot.TrackerSnapshot;
import com.requirement.sync.snapshot.WorkItemSpec;
import com.requirement.sync.support.InMemoryChangeSetApplier;
import com.requirement.sync.validation.InvalidFieldValueException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.requirement.sync.support.LiveGraphFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TrackerReconciler Tests")
class TrackerReconcilerTest {

    private static List<ChangeAction> reconcile(TrackerSnapshot snapshot, Module module) {
        return reconcile(snapshot, module, ReconciliationOptions.defaults());
    }

    private static List<ChangeAction> reconcile(TrackerSnapshot snapshot, Module module,
                                                ReconciliationOptions options) {
        return new TrackerReconciler(snapshot, new InMemoryLiveGraph(module),
                TrackerConfig.of(module.getId()), options).reconcile();
    }

    /**
     * Applies the actions to {@code module} and returns what a second run emits.
     */
    private static List<ChangeAction> reconcileAfterApply(TrackerSnapshot snapshot, Module module,
                                                          List<ChangeAction> actions) {
        new InMemoryChangeSetApplier(module).apply(actions);
        return reconcile(snapshot, module);
    }

    /**
     * Live module with folders F1 holding R1 and an empty F2.
     */
    private static Module twoFolderModule() {
        Module module = emptyModule();
        TypeSystem types = typeSystem(module);
        Folder f1 = new Folder("F1", "Folder 1");
        Folder f2 = new Folder("F2", "Folder 2");
        module.addFolder(f1);
        module.addFolder(f2);
        f1.addRequirement(requirement(types, "R1", "Requirement 1", types.open()));
        return module;
    }

    private static WorkItemSpec emptyFolder(String identifier, String longName) {
        return WorkItemSpec.builder(identifier).longName(longName).folder().build();
    }

    @Nested
    @DisplayName("Scenarios")
    class Scenarios {

        @Test
        @DisplayName("Empty live graph should yield a single nested creation on the module")
        void createsEverythingInOneAction() {
            List<ChangeAction> actions = reconcile(statusSnapshot(), emptyModule());

            assertEquals(1, actions.size());
            ChangeAction action = actions.get(0);
            assertEquals(Reference.concrete(MODULE_ID), action.getParent());
            assertEquals(Set.of(ActionSlots.REQUIREMENT_TYPES_FOLDERS, ActionSlots.FOLDERS),
                    action.getExtend().keySet());
            assertFalse(action.hasModify());
            assertFalse(action.hasDelete());

            CreatePayload folder = (CreatePayload) action.getExtended(ActionSlots.FOLDERS).get(0);
            assertEquals("F1", folder.get(ActionFields.IDENTIFIER));
            CreatePayload requirement = (CreatePayload) folder.getList(ActionSlots.REQUIREMENTS).get(0);
            assertEquals(Reference.promise("RequirementType REQ"), requirement.get(ActionFields.TYPE));
            CreatePayload status = (CreatePayload) requirement.getList(ActionFields.ATTRIBUTES).get(0);
            assertEquals(Reference.promise("AttributeDefinitionEnumeration Status REQ"),
                    status.get(ActionFields.DEFINITION));
            assertEquals(List.of(Reference.promise("EnumValue Status Open")), status.get(ActionFields.VALUES));

            assertPromisesResolvable(actions);
        }

        @Test
        @DisplayName("A renamed requirement should yield exactly one modification")
        void renamesRequirement() {
            Module module = syncedModule();
            Requirement live = module.getFolders().get(0).getRequirements().get(0);
            TrackerSnapshot snapshot = statusSnapshotBuilder()
                    .item(WorkItemSpec.builder("F1").longName("Folder 1")
                            .child(requirement("R1", "Requirement One", "Open"))
                            .build())
                    .build();

            List<ChangeAction> actions = reconcile(snapshot, module);

            assertEquals(List.of(ChangeAction.on(live.getId()).modify(ActionFields.LONG_NAME, "Requirement One")),
                    actions);
        }

        @Test
        @DisplayName("A requirement missing from the snapshot should be deleted from its folder")
        void deletesRequirement() {
            Module module = syncedModule();
            Folder folder = module.getFolders().get(0);
            Requirement extra = new Requirement("R2", "Requirement 2");
            folder.addRequirement(extra);

            List<ChangeAction> actions = reconcile(statusSnapshot(), module);

            assertEquals(List.of(ChangeAction.on(folder.getId())
                    .delete(ActionSlots.REQUIREMENTS, Reference.concrete(extra.getId()))), actions);
        }

        @Test
        @DisplayName("A requirement moved between folders should be extended, not deleted")
        void relocatesRequirement() {
            Module module = twoFolderModule();
            Folder f2 = module.getFolders().get(1);
            Requirement r1 = module.getFolders().get(0).getRequirements().get(0);
            TrackerSnapshot snapshot = statusSnapshotBuilder()
                    .item(emptyFolder("F1", "Folder 1"))
                    .item(WorkItemSpec.builder("F2").longName("Folder 2")
                            .child(requirement("R1", "Requirement 1", "Open"))
                            .build())
                    .build();

            List<ChangeAction> actions = reconcile(snapshot, module);

            assertEquals(List.of(ChangeAction.on(f2.getId())
                    .extend(ActionSlots.REQUIREMENTS, Reference.concrete(r1.getId()))), actions);
            assertDeletionsExclusive(actions);
        }

        @Test
        @DisplayName("Relocation should not depend on the order folders are visited")
        void relocatesRequirementInEitherOrder() {
            Module module = twoFolderModule();
            Folder f2 = module.getFolders().get(1);
            Requirement r1 = module.getFolders().get(0).getRequirements().get(0);
            TrackerSnapshot snapshot = statusSnapshotBuilder()
                    .item(WorkItemSpec.builder("F2").longName("Folder 2")
                            .child(requirement("R1", "Requirement 1", "Open"))
                            .build())
                    .item(emptyFolder("F1", "Folder 1"))
                    .build();

            List<ChangeAction> actions = reconcile(snapshot, module);

            assertEquals(List.of(ChangeAction.on(f2.getId())
                    .extend(ActionSlots.REQUIREMENTS, Reference.concrete(r1.getId()))), actions);
        }
    }

    @Nested
    @DisplayName("Top-level items")
    class TopLevel {

        @Test
        @DisplayName("Should delete top-level items the snapshot drops")
        void deletesTopLevelFolder() {
            Module module = syncedModule();
            Folder folder = module.getFolders().get(0);

            List<ChangeAction> actions = reconcile(statusSnapshotBuilder().build(), module);

            assertEquals(List.of(ChangeAction.on(MODULE_ID)
                    .delete(ActionSlots.FOLDERS, Reference.concrete(folder.getId()))), actions);
        }

        @Test
        @DisplayName("Should move a nested requirement to the module root")
        void movesToRoot() {
            Module module = syncedModule();
            Requirement r1 = module.getFolders().get(0).getRequirements().get(0);
            TrackerSnapshot snapshot = statusSnapshotBuilder()
                    .item(emptyFolder("F1", "Folder 1"))
                    .item(requirement("R1", "Requirement 1", "Open"))
                    .build();

            List<ChangeAction> actions = reconcile(snapshot, module);

            assertEquals(List.of(ChangeAction.on(MODULE_ID)
                    .extend(ActionSlots.REQUIREMENTS, Reference.concrete(r1.getId()))), actions);
        }

        @Test
        @DisplayName("Should continue past items with an unknown type")
        void unknownTypeIsNotFatal() {
            TrackerSnapshot snapshot = statusSnapshotBuilder()
                    .item(WorkItemSpec.builder("X1").longName("Odd").type("NOPE")
                            .attribute("Status", List.of("Open")).build())
                    .item(requirement("R2", "Requirement 2", "Closed"))
                    .build();

            List<ChangeAction> actions = reconcile(snapshot, syncedModule());

            ChangeAction base = actions.get(actions.size() - 1);
            List<Object> created = base.getExtended(ActionSlots.REQUIREMENTS);
            assertEquals(2, created.size());
            CreatePayload odd = (CreatePayload) created.get(0);
            assertFalse(odd.has(ActionFields.TYPE));
            assertFalse(odd.has(ActionFields.ATTRIBUTES));
            assertTrue(((CreatePayload) created.get(1)).has(ActionFields.ATTRIBUTES));
        }
    }

    @Nested
    @DisplayName("Errors")
    class Errors {

        @Test
        @DisplayName("Should fail when the config lacks the module id")
        void invalidConfig() {
            TrackerReconciler reconciler = new TrackerReconciler(statusSnapshot(),
                    new InMemoryLiveGraph(emptyModule()), TrackerConfig.of(" "));

            assertThrows(InvalidTrackerConfigException.class, reconciler::reconcile);
        }

        @Test
        @DisplayName("Should fail when the module is not in the live graph")
        void missingModule() {
            TrackerReconciler reconciler = new TrackerReconciler(statusSnapshot(),
                    new InMemoryLiveGraph(emptyModule()), TrackerConfig.of("elsewhere"));

            MissingTargetModuleException e = assertThrows(MissingTargetModuleException.class, reconciler::reconcile);
            assertEquals("elsewhere", e.getModuleId());
        }

        @Test
        @DisplayName("Should fall back to the external id to find the module")
        void findsModuleByExternalId() {
            TrackerConfig config = TrackerConfig.builder().moduleId("stale").externalId(TRACKER_ID).build();

            List<ChangeAction> actions = new TrackerReconciler(statusSnapshot(),
                    new InMemoryLiveGraph(syncedModule()), config).reconcile();

            assertTrue(actions.isEmpty());
        }

        @Test
        @DisplayName("Should refuse options whose labels collide across data types")
        void ambiguousEnumValueLabel() {
            TrackerSnapshot snapshot = TrackerSnapshot.builder(TRACKER_ID)
                    .dataType("A", List.of("B C"))
                    .dataType("A B", List.of("C"))
                    .build();

            AmbiguousLabelException e = assertThrows(AmbiguousLabelException.class,
                    () -> reconcile(snapshot, emptyModule()));
            assertEquals("EnumValue A B C", e.getLabel());
        }

        @Test
        @DisplayName("Should refuse attribute definitions whose identifiers collide across types")
        void ambiguousAttributeIdentifier() {
            TrackerSnapshot snapshot = TrackerSnapshot.builder(TRACKER_ID)
                    .requirementType("B C", new RequirementTypeSpec("First",
                            Map.of("A", AttributeDefinitionSpec.of(AttributeKind.STRING))))
                    .requirementType("C", new RequirementTypeSpec("Second",
                            Map.of("A B", AttributeDefinitionSpec.of(AttributeKind.INTEGER))))
                    .build();

            AmbiguousLabelException e = assertThrows(AmbiguousLabelException.class,
                    () -> reconcile(snapshot, syncedModule()));
            assertEquals("A B C", e.getLabel());
        }

        @Test
        @DisplayName("Names with spaces that derive distinct labels should be accepted")
        void spacedNamesWithoutCollision() {
            TrackerSnapshot snapshot = TrackerSnapshot.builder(TRACKER_ID)
                    .dataType("Review State", List.of("In Review", "Done"))
                    .build();

            assertFalse(reconcile(snapshot, emptyModule()).isEmpty());
        }

        @Test
        @DisplayName("Should abort on invalid attribute values")
        void invalidValueAborts() {
            TrackerSnapshot snapshot = statusSnapshotBuilder()
                    .item(requirement("R1", "Requirement 1", "Blocked"))
                    .build();

            assertThrows(InvalidFieldValueException.class, () -> reconcile(snapshot, syncedModule()));
        }

        @Test
        @DisplayName("Should substitute defaults for invalid values when enabled")
        void substitutesDefaults() {
            Module module = syncedModule();
            Requirement r1 = module.getFolders().get(0).getRequirements().get(0);
            TrackerSnapshot snapshot = statusSnapshotBuilder()
                    .item(WorkItemSpec.builder("F1").longName("Folder 1")
                            .child(requirement("R1", "Requirement 1", "Blocked"))
                            .build())
                    .build();

            List<ChangeAction> actions = reconcile(snapshot, module,
                    ReconciliationOptions.builder().substituteDefaults(true).build());

            assertEquals(List.of(ChangeAction.on(r1.getId()).modifyAttribute("Status", List.of())), actions);
        }
    }

    @Nested
    @DisplayName("Idempotence")
    class Idempotence {

        @Test
        @DisplayName("A synchronized module should yield no actions")
        void syncedModuleIsUnchanged() {
            assertTrue(reconcile(statusSnapshot(), syncedModule()).isEmpty());
        }

        @Test
        @DisplayName("Applying the creation of an empty module should converge")
        void convergesFromEmpty() {
            Module module = emptyModule();
            List<ChangeAction> actions = reconcile(statusSnapshot(), module);

            assertTrue(reconcileAfterApply(statusSnapshot(), module, actions).isEmpty());
            assertEquals("R1", module.getFolders().get(0).getRequirements().get(0).getIdentifier());
        }

        @Test
        @DisplayName("Applying a relocation should converge")
        void convergesAfterRelocation() {
            Module module = twoFolderModule();
            TrackerSnapshot snapshot = statusSnapshotBuilder()
                    .item(emptyFolder("F1", "Folder 1"))
                    .item(WorkItemSpec.builder("F2").longName("Folder 2")
                            .child(requirement("R1", "Requirement 1", "Closed"))
                            .build())
                    .build();
            List<ChangeAction> actions = reconcile(snapshot, module);

            assertTrue(reconcileAfterApply(snapshot, module, actions).isEmpty());
            assertTrue(module.getFolders().get(0).getRequirements().isEmpty());
            assertEquals(1, module.getFolders().get(1).getRequirements().size());
        }

        @Test
        @DisplayName("Applying type system changes should converge")
        void convergesAfterTypeChanges() {
            Module module = syncedModule();
            TrackerSnapshot snapshot = TrackerSnapshot.builder(TRACKER_ID)
                    .dataType("Status", List.of("Open", "Closed", "Blocked"))
                    .dataType("Severity", List.of("Minor", "Major"))
                    .requirementType(REQ_TYPE, new RequirementTypeSpec("Req", Map.of(
                            "Status", AttributeDefinitionSpec.enumeration(true),
                            "Severity", AttributeDefinitionSpec.enumeration(false))))
                    .item(WorkItemSpec.builder("F1").longName("Folder 1")
                            .child(WorkItemSpec.builder("R1").longName("Requirement 1").type(REQ_TYPE)
                                    .attribute("Status", List.of("Open", "Blocked"))
                                    .attribute("Severity", List.of("Major"))
                                    .build())
                            .build())
                    .build();
            List<ChangeAction> actions = reconcile(snapshot, module);
            assertPromisesResolvable(actions);

            assertTrue(reconcileAfterApply(snapshot, module, actions).isEmpty());
        }

        @Test
        @DisplayName("A case-only rename of a data type and its attribute should converge in one run")
        void convergesAfterCaseOnlyRename() {
            Module module = syncedModule();
            TrackerSnapshot snapshot = TrackerSnapshot.builder(TRACKER_ID)
                    .dataType("status", List.of("Open", "Closed"))
                    .requirementType(REQ_TYPE, new RequirementTypeSpec("Req",
                            Map.of("status", AttributeDefinitionSpec.enumeration(false))))
                    .item(WorkItemSpec.builder("F1").longName("Folder 1")
                            .child(WorkItemSpec.builder("R1").longName("Requirement 1").type(REQ_TYPE)
                                    .attribute("status", List.of("Open"))
                                    .build())
                            .build())
                    .build();
            List<ChangeAction> actions = reconcile(snapshot, module);
            assertPromisesResolvable(actions);

            List<Reference> references = new ArrayList<>();
            for (ChangeAction action : actions) {
                collect(action.getExtend(), new ArrayList<>(), references);
                collect(action.getModify(), new ArrayList<>(), references);
            }
            assertTrue(references.stream().noneMatch(Reference.Promise.class::isInstance),
                    "Nothing should be promised: " + references);
            assertEquals(2, actions.size());

            assertTrue(reconcileAfterApply(snapshot, module, actions).isEmpty());
            RequirementType reqType = module.getTypeFolder().getRequirementTypes().get(0);
            assertEquals("status REQ", reqType.getAttributeDefinitions().get(0).getIdentifier());
        }

        @Test
        @DisplayName("Applying a nested new folder that adopts a live requirement should converge")
        void convergesAfterAdoption() {
            Module module = syncedModule();
            TrackerSnapshot snapshot = statusSnapshotBuilder()
                    .item(WorkItemSpec.builder("F1").longName("Folder 1")
                            .child(WorkItemSpec.builder("F3").longName("Folder 3")
                                    .child(requirement("R1", "Requirement 1", "Open"))
                                    .build())
                            .build())
                    .build();
            List<ChangeAction> actions = reconcile(snapshot, module);
            assertDeletionsExclusive(actions);

            assertTrue(reconcileAfterApply(snapshot, module, actions).isEmpty());
        }
    }

    private static void assertPromisesResolvable(List<ChangeAction> actions) {
        List<String> declared = new ArrayList<>();
        List<Reference> references = new ArrayList<>();
        for (ChangeAction action : actions) {
            collect(action.getExtend(), declared, references);
            collect(action.getModify(), declared, references);
        }
        Map<String, Integer> counts = new HashMap<>();
        declared.forEach(label -> counts.merge(label, 1, Integer::sum));
        for (Reference reference : references) {
            if (reference instanceof Reference.Promise promise) {
                assertEquals(1, counts.getOrDefault(promise.label(), 0),
                        "Promise should be declared exactly once: " + promise.label());
            }
        }
    }

    private static void assertDeletionsExclusive(List<ChangeAction> actions) {
        Set<Reference> deleted = new HashSet<>();
        List<Reference> extended = new ArrayList<>();
        for (ChangeAction action : actions) {
            action.getDelete().values().forEach(deleted::addAll);
            collect(action.getExtend(), new ArrayList<>(), extended);
        }
        for (Reference reference : extended) {
            assertFalse(deleted.contains(reference), "Deleted and extended: " + reference);
        }
    }

    private static void collect(Object value, List<String> declared, List<Reference> references) {
        if (value instanceof Reference reference) {
            references.add(reference);
        } else if (value instanceof CreatePayload payload) {
            if (payload.getPromiseId() != null) {
                declared.add(payload.getPromiseId());
            }
            collect(payload.getFields(), declared, references);
        } else if (value instanceof Map<?, ?> map) {
            map.values().forEach(item -> collect(item, declared, references));
        } else if (value instanceof Collection<?> items) {
            items.forEach(item -> collect(item, declared, references));
        }
    }
}

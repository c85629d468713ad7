package com.requirement.sync.action;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ActionAssembler Tests")
class ActionAssemblerTest {

    @Test
    @DisplayName("Should merge fragments into the target in place")
    void mergesFragment() {
        ChangeAction target = ChangeAction.on("folder")
                .modify(ActionFields.LONG_NAME, "Renamed")
                .modifyAttribute("Status", "a");
        ChangeAction fragment = ChangeAction.on("folder")
                .modifyAttribute("Priority", 1L)
                .extend(ActionSlots.FOLDERS, CreatePayload.create())
                .delete(ActionSlots.REQUIREMENTS, Reference.concrete("r1"));

        ChangeAction merged = ActionAssembler.merge(target, fragment);

        assertSame(target, merged);
        assertEquals("Renamed", target.getModify().get(ActionFields.LONG_NAME));
        assertEquals(Map.of("Status", "a", "Priority", 1L), target.getModify().get(ActionFields.ATTRIBUTES));
        assertEquals(1, target.getExtended(ActionSlots.FOLDERS).size());
        assertEquals(List.of(Reference.concrete("r1")), target.getDeleted(ActionSlots.REQUIREMENTS));
    }

    @Test
    @DisplayName("Merging the same fragment twice should be idempotent")
    void mergeIsIdempotent() {
        ChangeAction fragment = ChangeAction.on("folder")
                .extend(ActionSlots.REQUIREMENTS, Reference.concrete("moved"))
                .modifyAttribute("Status", "a")
                .delete(ActionSlots.FOLDERS, Reference.concrete("gone"));
        ChangeAction once = ActionAssembler.merge(ChangeAction.on("folder"), fragment);
        ChangeAction twice = ActionAssembler.merge(
                ActionAssembler.merge(ChangeAction.on("folder"), fragment), fragment);

        assertEquals(once, twice);
    }

    @Test
    @DisplayName("Should refuse to merge actions on different parents")
    void refusesForeignFragment() {
        assertThrows(IllegalArgumentException.class,
                () -> ActionAssembler.merge(ChangeAction.on("a"), ChangeAction.on("b")));
    }

    @Test
    @DisplayName("Deep merge should merge nested maps and overwrite other values")
    void deepMerge() {
        Map<String, Object> source = new LinkedHashMap<>();
        source.put("attributes", new LinkedHashMap<>(Map.of("A", 1)));
        source.put("long_name", "old");

        ActionAssembler.deepMerge(source, Map.of("attributes", Map.of("B", 2), "long_name", "new"));

        assertEquals(Map.of("A", 1, "B", 2), source.get("attributes"));
        assertEquals("new", source.get("long_name"));
    }

    @Test
    @DisplayName("Deep merge should overwrite with empty maps rather than merge them")
    void deepMergeEmptyMap() {
        Map<String, Object> source = new LinkedHashMap<>();
        source.put("attributes", new LinkedHashMap<>(Map.of("A", 1)));

        ActionAssembler.deepMerge(source, Map.of("attributes", Map.of()));

        assertEquals(Map.of(), source.get("attributes"));
    }

    @Test
    @DisplayName("Pruning should drop void actions and keep order")
    void prunesVoidActions() {
        ChangeAction first = ChangeAction.on("1").modify(ActionFields.TEXT, "x");
        ChangeAction retracted = ChangeAction.on("2").delete(ActionSlots.REQUIREMENTS, Reference.concrete("r"));
        ChangeAction last = ChangeAction.on("3").delete(ActionSlots.FOLDERS, Reference.concrete("f"));
        List<ChangeAction> actions = new ArrayList<>(List.of(first, ChangeAction.on("empty"), retracted, last));
        retracted.retractDeletion(ActionSlots.REQUIREMENTS, Reference.concrete("r"));

        assertEquals(List.of(first, last), ActionAssembler.prune(actions));
    }

    @Test
    @DisplayName("appendIfChanged should skip void actions")
    void appendIfChanged() {
        List<ChangeAction> actions = new ArrayList<>();
        ActionAssembler.appendIfChanged(actions, ChangeAction.on("void"));
        ActionAssembler.appendIfChanged(actions, ChangeAction.on("real").modify(ActionFields.TEXT, "x"));

        assertEquals(1, actions.size());
    }
}

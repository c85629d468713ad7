package com.requirement.sync.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Work item tree Tests")
class WorkItemTreeTest {

    @Test
    @DisplayName("Adding a child to a new parent should detach it from the old one")
    void addingDetachesFromOldParent() {
        Module module = new Module("tracker", "Module");
        Folder first = new Folder("F1", "First");
        Folder second = new Folder("F2", "Second");
        module.addFolder(first);
        module.addFolder(second);
        Requirement requirement = new Requirement("R1", "Requirement");
        first.addRequirement(requirement);

        second.addRequirement(requirement);

        assertTrue(first.getRequirements().isEmpty());
        assertEquals(List.of(requirement), second.getRequirements());
        assertSame(second, requirement.getParent());
    }

    @Test
    @DisplayName("Removing a child should clear its parent")
    void removingClearsParent() {
        Module module = new Module("tracker", "Module");
        Requirement requirement = new Requirement("R1", "Requirement");
        module.addRequirement(requirement);

        assertTrue(module.removeChild(requirement));

        assertNull(requirement.getParent());
        assertFalse(module.removeChild(requirement));
    }

    @Test
    @DisplayName("Should find attribute values by definition name")
    void findsAttributeByDefinitionName() {
        AttributeDefinition priority = new AttributeDefinition("Priority REQ", "Priority", AttributeKind.INTEGER);
        Requirement requirement = new Requirement("R1", "Requirement");
        AttributeValue value = AttributeValue.scalar(priority, 3L);
        requirement.addAttribute(value);

        assertEquals(value, requirement.findAttribute("Priority").orElseThrow());
        assertTrue(requirement.findAttribute("Status").isEmpty());
    }

    @Test
    @DisplayName("Should prefer an exact definition name and fall back to ignoring case")
    void findsAttributeIgnoringCase() {
        Requirement requirement = new Requirement("R1", "Requirement");
        AttributeValue lower = AttributeValue.scalar(
                new AttributeDefinition("size REQ", "size", AttributeKind.INTEGER), 1L);
        AttributeValue upper = AttributeValue.scalar(
                new AttributeDefinition("Size REQ", "Size", AttributeKind.INTEGER), 2L);
        requirement.addAttribute(lower);
        requirement.addAttribute(upper);

        assertEquals(upper, requirement.findAttribute("Size").orElseThrow());
        assertEquals(lower, requirement.findAttribute("SIZE").orElseThrow());
    }

    @Test
    @DisplayName("Work items should be equal by id")
    void equalById() {
        Requirement a = new Requirement("id-1", "R1", "One");
        Requirement b = new Requirement("id-1", "R1", "Renamed");

        assertEquals(a, b);
        assertNotEquals(a, new Requirement("R1", "One"));
    }
}

package com.requirement.sync.snapshot;

/**
 * Shape of a snapshot work item, decided once when the item is built.
 */
public enum WorkItemKind {
    FOLDER("folders"),
    REQUIREMENT("requirements");

    private final String slot;

    WorkItemKind(String slot) {
        this.slot = slot;
    }

    /**
     * Name of the container slot items of this kind live in.
     */
    public String getSlot() {
        return slot;
    }
}

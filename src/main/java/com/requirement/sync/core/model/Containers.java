package com.requirement.sync.core.model;

/**
 * Keeps the single-owner invariant of the work item tree.
 */
final class Containers {

    private Containers() {
    }

    static void detach(WorkItem item) {
        WorkItemContainer current = item.getParent();
        if (current != null) {
            current.removeChild(item);
        }
    }
}

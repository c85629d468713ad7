package com.requirement.sync.api;

import com.requirement.sync.action.ChangeAction;

import java.util.List;

/**
 * Result of reconciling one module: its actions, or the error that aborted it.
 * A failed result never carries a partial action list.
 */
public record ModuleChangeSet(
        String moduleId,
        boolean success,
        List<ChangeAction> actions,
        ReconciliationException error
) {
    public ModuleChangeSet {
        actions = actions != null ? List.copyOf(actions) : List.of();
    }

    public static ModuleChangeSet success(String moduleId, List<ChangeAction> actions) {
        return new ModuleChangeSet(moduleId, true, actions, null);
    }

    public static ModuleChangeSet failure(String moduleId, ReconciliationException error) {
        return new ModuleChangeSet(moduleId, false, List.of(), error);
    }

    public boolean isSuccess() {
        return success;
    }

    public boolean isFailure() {
        return !success;
    }

    public String errorMessage() {
        return error != null ? error.getMessage() : null;
    }

    /**
     * True if the module reconciled and nothing needs to change.
     */
    public boolean isUnchanged() {
        return success && actions.isEmpty();
    }
}

package com.requirement.sync.api;

/**
 * Thrown when the configured module cannot be found in the live graph.
 */
public class MissingTargetModuleException extends ReconciliationException {
    private final String moduleId;

    public MissingTargetModuleException(String moduleId) {
        super("Requirements module not found: " + moduleId);
        this.moduleId = moduleId;
    }

    public String getModuleId() {
        return moduleId;
    }
}

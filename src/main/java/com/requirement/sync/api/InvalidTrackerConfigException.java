package com.requirement.sync.api;

/**
 * Thrown when a tracker configuration lacks a required field, such as the
 * identity of the target module.
 */
public class InvalidTrackerConfigException extends ReconciliationException {

    public InvalidTrackerConfigException(String message) {
        super(message);
    }
}

package com.requirement.sync.api;

import java.util.List;

/**
 * Thrown when two distinct snapshot elements derive the same promise label or
 * attribute definition identifier, which happens when names contain spaces.
 */
public class AmbiguousLabelException extends ReconciliationException {
    private final String label;

    public AmbiguousLabelException(String label, List<String> first, List<String> second) {
        super("Label '" + label + "' is derived by both " + first + " and " + second);
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}

package com.requirement.sync.action;

import java.util.Objects;

/**
 * Reference from a change action to a model element.
 *
 * <p>A {@link Concrete} reference points at an element that exists in the live
 * graph. A {@link Promise} points at an element created elsewhere in the same
 * change set; the applier resolves it by matching the label against the
 * {@code promise_id} of a creation payload.</p>
 */
public interface Reference {

    static Concrete concrete(String id) {
        return new Concrete(id);
    }

    static Promise promise(String label) {
        return new Promise(label);
    }

    record Concrete(String id) implements Reference {
        public Concrete {
            Objects.requireNonNull(id, "id is required");
        }

        @Override
        public String toString() {
            return "!uuid " + id;
        }
    }

    record Promise(String label) implements Reference {
        public Promise {
            Objects.requireNonNull(label, "label is required");
        }

        @Override
        public String toString() {
            return "!promise " + label;
        }
    }
}

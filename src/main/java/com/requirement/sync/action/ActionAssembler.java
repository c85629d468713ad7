package com.requirement.sync.action;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Merges partial change actions and drops void ones.
 *
 * <p>Merging is a deep update: non-empty nested maps are merged key by key, any
 * other value overwrites. Merging the same fragment twice leaves the target
 * unchanged after the first merge.</p>
 */
public final class ActionAssembler {

    private ActionAssembler() {
    }

    /**
     * Merges {@code fragment} into {@code target} in place.
     *
     * @throws IllegalArgumentException if the two actions have different parents
     */
    public static ChangeAction merge(ChangeAction target, ChangeAction fragment) {
        if (!target.getParent().equals(fragment.getParent())) {
            throw new IllegalArgumentException("Cannot merge actions on different parents: "
                    + target.getParent() + " and " + fragment.getParent());
        }
        fragment.extendMap().forEach((slot, items) -> {
            if (!items.isEmpty()) {
                target.extendMap().put(slot, new ArrayList<>(items));
            }
        });
        deepMerge(target.modifyMap(), fragment.modifyMap());
        fragment.deleteMap().forEach((slot, references) -> {
            if (!references.isEmpty()) {
                target.deleteMap().put(slot, new ArrayList<>(references));
            }
        });
        return target;
    }

    /**
     * Updates a nested map in place.
     */
    @SuppressWarnings("unchecked")
    public static void deepMerge(Map<String, Object> source, Map<String, ?> overrides) {
        for (Map.Entry<String, ?> entry : overrides.entrySet()) {
            Object value = entry.getValue();
            if (value instanceof Map<?, ?> nested && !nested.isEmpty()) {
                Object current = source.get(entry.getKey());
                Map<String, Object> update = current instanceof Map<?, ?>
                        ? (Map<String, Object>) current
                        : new LinkedHashMap<>();
                deepMerge(update, (Map<String, ?>) nested);
                source.put(entry.getKey(), update);
            } else {
                source.put(entry.getKey(), value);
            }
        }
    }

    /**
     * Appends {@code action} unless it is void.
     */
    public static void appendIfChanged(List<ChangeAction> actions, ChangeAction action) {
        if (!action.isVoid()) {
            actions.add(action);
        }
    }

    /**
     * Returns the actions that still carry a change, in order.
     */
    public static List<ChangeAction> prune(List<ChangeAction> actions) {
        List<ChangeAction> result = new ArrayList<>(actions.size());
        for (ChangeAction action : actions) {
            appendIfChanged(result, action);
        }
        return result;
    }
}

package com.requirement.sync.action;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A declarative change on one model element, the {@code parent}.
 *
 * <ul>
 *   <li>{@code extend}: slot name to new children, each a {@link CreatePayload}
 *       or a {@link Reference} to an existing element being moved here</li>
 *   <li>{@code modify}: field name to new value; {@code attributes} holds a
 *       nested map of attribute name to value</li>
 *   <li>{@code delete}: slot name to references of children to remove</li>
 * </ul>
 *
 * An action with none of the three populated is void and is never emitted.
 * Empty slots and maps are removed eagerly, so "populated" means non-empty.
 */
public final class ChangeAction {
    private final Reference parent;
    private final Map<String, List<Object>> extend = new LinkedHashMap<>();
    private final Map<String, Object> modify = new LinkedHashMap<>();
    private final Map<String, List<Reference>> delete = new LinkedHashMap<>();

    private ChangeAction(Reference parent) {
        this.parent = Objects.requireNonNull(parent, "parent is required");
    }

    public static ChangeAction on(Reference parent) {
        return new ChangeAction(parent);
    }

    public static ChangeAction on(String parentId) {
        return new ChangeAction(Reference.concrete(parentId));
    }

    public Reference getParent() {
        return parent;
    }

    public ChangeAction extend(String slot, Object item) {
        Objects.requireNonNull(item, "item is required");
        if (!(item instanceof CreatePayload) && !(item instanceof Reference)) {
            throw new IllegalArgumentException("Cannot extend with " + item.getClass().getSimpleName());
        }
        extend.computeIfAbsent(slot, k -> new ArrayList<>()).add(item);
        return this;
    }

    public ChangeAction modify(String field, Object value) {
        modify.put(field, value);
        return this;
    }

    @SuppressWarnings("unchecked")
    public ChangeAction modifyAttribute(String attributeName, Object value) {
        Object current = modify.get(ActionFields.ATTRIBUTES);
        Map<String, Object> attributes;
        if (current instanceof Map<?, ?> map) {
            attributes = (Map<String, Object>) map;
        } else {
            attributes = new LinkedHashMap<>();
            modify.put(ActionFields.ATTRIBUTES, attributes);
        }
        attributes.put(attributeName, value);
        return this;
    }

    public ChangeAction delete(String slot, Reference reference) {
        delete.computeIfAbsent(slot, k -> new ArrayList<>())
                .add(Objects.requireNonNull(reference, "reference is required"));
        return this;
    }

    /**
     * Removes a queued deletion. Drops the slot once it is empty.
     *
     * @return true if the reference was queued for deletion in that slot
     */
    public boolean retractDeletion(String slot, Reference reference) {
        List<Reference> references = delete.get(slot);
        if (references == null || !references.remove(reference)) {
            return false;
        }
        if (references.isEmpty()) {
            delete.remove(slot);
        }
        return true;
    }

    public Map<String, List<Object>> getExtend() {
        return Collections.unmodifiableMap(extend);
    }

    public List<Object> getExtended(String slot) {
        List<Object> items = extend.get(slot);
        return items != null ? Collections.unmodifiableList(items) : List.of();
    }

    public Map<String, Object> getModify() {
        return Collections.unmodifiableMap(modify);
    }

    public Map<String, List<Reference>> getDelete() {
        return Collections.unmodifiableMap(delete);
    }

    public List<Reference> getDeleted(String slot) {
        List<Reference> references = delete.get(slot);
        return references != null ? Collections.unmodifiableList(references) : List.of();
    }

    public boolean hasExtend() {
        return !extend.isEmpty();
    }

    public boolean hasModify() {
        return !modify.isEmpty();
    }

    public boolean hasDelete() {
        return !delete.isEmpty();
    }

    /**
     * True if this action carries no change besides its parent.
     */
    public boolean isVoid() {
        return extend.isEmpty() && modify.isEmpty() && delete.isEmpty();
    }

    Map<String, List<Object>> extendMap() {
        return extend;
    }

    Map<String, Object> modifyMap() {
        return modify;
    }

    Map<String, List<Reference>> deleteMap() {
        return delete;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ChangeAction that = (ChangeAction) o;
        return parent.equals(that.parent)
                && extend.equals(that.extend)
                && modify.equals(that.modify)
                && delete.equals(that.delete);
    }

    @Override
    public int hashCode() {
        return Objects.hash(parent, extend, modify, delete);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("ChangeAction{parent=").append(parent);
        if (!extend.isEmpty()) {
            sb.append(", extend=").append(extend);
        }
        if (!modify.isEmpty()) {
            sb.append(", modify=").append(modify);
        }
        if (!delete.isEmpty()) {
            sb.append(", delete=").append(delete);
        }
        return sb.append('}').toString();
    }
}

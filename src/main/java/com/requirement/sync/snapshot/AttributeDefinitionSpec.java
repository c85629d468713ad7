package com.requirement.sync.snapshot;

import com.requirement.sync.core.model.AttributeKind;

import java.util.Objects;

/**
 * Snapshot declaration of an attribute on a requirement type.
 * {@code multiValued} is only meaningful for {@link AttributeKind#ENUM}.
 */
public record AttributeDefinitionSpec(AttributeKind kind, boolean multiValued) {

    public AttributeDefinitionSpec {
        Objects.requireNonNull(kind, "kind is required");
        if (multiValued && kind != AttributeKind.ENUM) {
            throw new IllegalArgumentException("Only Enum attributes can be multi-valued, got " + kind);
        }
    }

    public static AttributeDefinitionSpec of(AttributeKind kind) {
        return new AttributeDefinitionSpec(kind, false);
    }

    public static AttributeDefinitionSpec enumeration(boolean multiValued) {
        return new AttributeDefinitionSpec(AttributeKind.ENUM, multiValued);
    }
}

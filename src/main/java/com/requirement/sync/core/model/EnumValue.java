package com.requirement.sync.core.model;

import java.util.Objects;
import java.util.UUID;

/**
 * A literal of a {@link DataTypeDefinition}.
 */
public class EnumValue {
    private final String id;
    private final String longName;

    public EnumValue(String longName) {
        this(null, longName);
    }

    public EnumValue(String id, String longName) {
        this.id = id != null ? id : UUID.randomUUID().toString();
        this.longName = Objects.requireNonNull(longName, "longName is required");
    }

    public String getId() {
        return id;
    }

    public String getLongName() {
        return longName;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        EnumValue that = (EnumValue) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return longName;
    }
}

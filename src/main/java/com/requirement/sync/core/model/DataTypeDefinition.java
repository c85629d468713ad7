package com.requirement.sync.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * An enumeration data type: a named, ordered set of {@link EnumValue} literals.
 */
public class DataTypeDefinition {
    private final String id;
    private String longName;
    private final List<EnumValue> values = new ArrayList<>();

    public DataTypeDefinition(String longName) {
        this(null, longName);
    }

    public DataTypeDefinition(String id, String longName) {
        this.id = id != null ? id : UUID.randomUUID().toString();
        this.longName = Objects.requireNonNull(longName, "longName is required");
    }

    public String getId() {
        return id;
    }

    public String getLongName() {
        return longName;
    }

    public void setLongName(String longName) {
        this.longName = longName;
    }

    public List<EnumValue> getValues() {
        return Collections.unmodifiableList(values);
    }

    public EnumValue addValue(EnumValue value) {
        values.add(Objects.requireNonNull(value, "value is required"));
        return value;
    }

    public boolean removeValue(EnumValue value) {
        return values.remove(value);
    }

    public Optional<EnumValue> findValue(String longName) {
        return values.stream()
                .filter(v -> v.getLongName().equals(longName))
                .findFirst();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DataTypeDefinition that = (DataTypeDefinition) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "DataTypeDefinition{id='" + id + "', longName='" + longName + "', values=" + values + "}";
    }
}

package com.requirement.sync.snapshot;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Snapshot declaration of a requirement type: its long name and its attribute
 * definitions keyed by attribute name, in declaration order.
 */
public record RequirementTypeSpec(String longName, Map<String, AttributeDefinitionSpec> attributes) {

    public RequirementTypeSpec {
        attributes = attributes != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(attributes))
                : Map.of();
    }

    public boolean declares(String attributeName) {
        return attributes.containsKey(attributeName);
    }

    public AttributeDefinitionSpec attribute(String attributeName) {
        return attributes.get(attributeName);
    }
}

package com.requirement.sync.action;

import com.requirement.sync.core.model.AttributeKind;

/**
 * Derivation rules for promise labels.
 *
 * <p>Any two components computing a label for the same not-yet-created element
 * must agree, so every label is a pure function of the element's kind and the
 * names that scope it.</p>
 */
public final class PromiseLabels {

    public static final String DATA_TYPE_DEFINITION = "EnumerationDataTypeDefinition";
    public static final String ENUM_VALUE = "EnumValue";
    public static final String REQUIREMENT_TYPE = "RequirementType";
    public static final String ATTRIBUTE_DEFINITION = "AttributeDefinition";
    public static final String ATTRIBUTE_DEFINITION_ENUMERATION = "AttributeDefinitionEnumeration";

    private PromiseLabels() {
    }

    public static String dataTypeDefinition(String name) {
        return DATA_TYPE_DEFINITION + " " + name;
    }

    public static String enumValue(String dataTypeName, String literal) {
        return ENUM_VALUE + " " + dataTypeName + " " + literal;
    }

    public static String requirementType(String identifier) {
        return REQUIREMENT_TYPE + " " + identifier;
    }

    public static String attributeDefinition(AttributeKind kind, String attributeName, String requirementTypeId) {
        return attributeDefinitionClass(kind) + " " + attributeDefinitionIdentifier(attributeName, requirementTypeId);
    }

    /**
     * Identifier of an attribute definition: attribute name and owning type identifier.
     */
    public static String attributeDefinitionIdentifier(String attributeName, String requirementTypeId) {
        return attributeName + " " + requirementTypeId;
    }

    /**
     * Element class of an attribute definition of the given kind.
     */
    public static String attributeDefinitionClass(AttributeKind kind) {
        return kind == AttributeKind.ENUM ? ATTRIBUTE_DEFINITION_ENUMERATION : ATTRIBUTE_DEFINITION;
    }
}

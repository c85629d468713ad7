package com.requirement.sync.action;

/**
 * Names of the container slots change actions extend and delete from.
 */
public final class ActionSlots {

    public static final String REQUIREMENT_TYPES_FOLDERS = "requirement_types_folders";
    public static final String DATA_TYPE_DEFINITIONS = "data_type_definitions";
    public static final String VALUES = "values";
    public static final String REQUIREMENT_TYPES = "requirement_types";
    public static final String ATTRIBUTE_DEFINITIONS = "attribute_definitions";
    public static final String ATTRIBUTES = "attributes";
    public static final String FOLDERS = "folders";
    public static final String REQUIREMENTS = "requirements";

    private ActionSlots() {
    }
}

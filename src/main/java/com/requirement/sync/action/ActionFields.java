package com.requirement.sync.action;

/**
 * Names of the scalar and reference fields of creation payloads and modifications.
 */
public final class ActionFields {

    public static final String LONG_NAME = "long_name";
    public static final String IDENTIFIER = "identifier";
    public static final String TEXT = "text";
    public static final String TYPE = "type";
    public static final String DATA_TYPE = "data_type";
    public static final String MULTI_VALUED = "multi_valued";
    public static final String KIND = "kind";
    public static final String DEFINITION = "definition";
    public static final String VALUE = "value";
    public static final String VALUES = "values";
    public static final String ATTRIBUTES = "attributes";

    private ActionFields() {
    }
}

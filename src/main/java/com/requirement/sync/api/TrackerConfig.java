package com.requirement.sync.api;

import java.util.Map;

/**
 * Configuration of one synchronized tracker.
 *
 * @param moduleId   persistent identity of the target module in the live graph
 * @param externalId identifier of the tracker in the external system, may be null
 * @param name       display name, may be null
 */
public record TrackerConfig(String moduleId, String externalId, String name) {

    public static final String KEY_MODULE_ID = "uuid";
    public static final String KEY_EXTERNAL_ID = "external-id";
    public static final String KEY_NAME = "name";

    public static TrackerConfig of(String moduleId) {
        return new TrackerConfig(moduleId, null, null);
    }

    /**
     * Reads a config from loosely typed key/value pairs ({@code uuid},
     * {@code external-id}, {@code name}). Values are converted with {@code toString()}.
     */
    public static TrackerConfig fromMap(Map<String, ?> values) {
        return new TrackerConfig(string(values.get(KEY_MODULE_ID)),
                string(values.get(KEY_EXTERNAL_ID)),
                string(values.get(KEY_NAME)));
    }

    private static String string(Object value) {
        return value != null ? value.toString() : null;
    }

    /**
     * Checks that the target module identity is present.
     *
     * @throws InvalidTrackerConfigException if it is missing or blank
     */
    public TrackerConfig validate() {
        if (moduleId == null || moduleId.isBlank()) {
            throw new InvalidTrackerConfigException(
                    "The given tracker configuration is missing '" + KEY_MODULE_ID + "' of the target module");
        }
        return this;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String moduleId;
        private String externalId;
        private String name;

        public Builder moduleId(String moduleId) {
            this.moduleId = moduleId;
            return this;
        }

        public Builder externalId(String externalId) {
            this.externalId = externalId;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public TrackerConfig build() {
            return new TrackerConfig(moduleId, externalId, name);
        }
    }
}

package com.foreman.core.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Partial metadata update; null fields are left untouched.
 */
public record MetadataUpdate(String projectGoal, JsonNode languageConfig) {

    public static MetadataUpdate projectGoal(String goal) {
        return new MetadataUpdate(goal, null);
    }

    public static MetadataUpdate languageConfig(JsonNode config) {
        return new MetadataUpdate(null, config);
    }
}

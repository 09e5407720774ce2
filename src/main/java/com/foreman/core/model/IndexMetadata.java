package com.foreman.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Index-wide metadata.
 *
 * @param projectGoal    the session goal, empty when unset
 * @param languageConfig detected language/build settings, owned by the detection collaborator
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record IndexMetadata(String projectGoal, JsonNode languageConfig) {

    public static IndexMetadata empty() {
        return new IndexMetadata("", null);
    }

    /** Shallow merge: fields present in the update win, absent ones are kept. */
    public IndexMetadata merge(MetadataUpdate update) {
        return new IndexMetadata(
                update.projectGoal() != null ? update.projectGoal() : projectGoal,
                update.languageConfig() != null ? update.languageConfig() : languageConfig);
    }
}

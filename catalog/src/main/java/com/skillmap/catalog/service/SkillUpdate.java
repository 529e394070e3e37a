package com.skillmap.catalog.service;

import java.util.UUID;

/**
 * Partial update of a skill. Omitted fields keep their current value.
 */
public record SkillUpdate(FieldUpdate<String> name,
                          FieldUpdate<UUID>   topicId,
                          FieldUpdate<String> difficulty) {

    public SkillUpdate {
        if (name == null)       name       = FieldUpdate.unchanged();
        if (topicId == null)    topicId    = FieldUpdate.unchanged();
        if (difficulty == null) difficulty = FieldUpdate.unchanged();
    }
}

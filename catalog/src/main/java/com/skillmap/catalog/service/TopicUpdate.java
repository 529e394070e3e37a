package com.skillmap.catalog.service;

import java.util.UUID;

/**
 * Partial update of a topic. Omitted fields keep their current value.
 */
public record TopicUpdate(FieldUpdate<String> name,
                          FieldUpdate<String> description,
                          FieldUpdate<UUID>   parentTopicId) {

    public TopicUpdate {
        if (name == null)          name          = FieldUpdate.unchanged();
        if (description == null)   description   = FieldUpdate.unchanged();
        if (parentTopicId == null) parentTopicId = FieldUpdate.unchanged();
    }
}

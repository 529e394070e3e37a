package com.skillmap.catalog.api.dto;

import com.skillmap.catalog.model.Topic;

import java.time.Instant;
import java.util.UUID;

/**
 * Response body for the /topics endpoints.
 */
public record TopicResponse(
        UUID    id,
        String  name,
        String  description,
        UUID    parentTopicID,
        Instant createdAt,
        Instant updatedAt
) {
    public static TopicResponse from(Topic topic) {
        return new TopicResponse(
                topic.getId(),
                topic.getName(),
                topic.getDescription(),
                topic.getParentTopicId(),
                topic.getCreatedAt(),
                topic.getUpdatedAt()
        );
    }
}

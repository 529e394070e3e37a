package com.skillmap.catalog.api.dto;

import com.skillmap.catalog.model.Skill;

import java.time.Instant;
import java.util.UUID;

/**
 * Response body for the /skills endpoints.
 */
public record SkillResponse(
        UUID    id,
        String  name,
        UUID    topicID,
        String  difficulty,
        Instant createdAt,
        Instant updatedAt
) {
    public static SkillResponse from(Skill skill) {
        return new SkillResponse(
                skill.getId(),
                skill.getName(),
                skill.getTopicId(),
                skill.getDifficulty(),
                skill.getCreatedAt(),
                skill.getUpdatedAt()
        );
    }
}

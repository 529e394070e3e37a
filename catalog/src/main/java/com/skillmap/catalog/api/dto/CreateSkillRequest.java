package com.skillmap.catalog.api.dto;

/**
 * Request body for POST /skills.
 *
 * Required: name, topicID (older clients send it as topicId, which is still accepted)
 * Optional: difficulty, defaults to "beginner"
 */
public record CreateSkillRequest(String name, String topicID, String topicId, String difficulty) {

    /** topicID wins when both spellings are present and non-empty. */
    public String resolvedTopicId() {
        return topicID != null && !topicID.isEmpty() ? topicID : topicId;
    }
}

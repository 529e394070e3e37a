package com.skillmap.catalog.store;

import java.util.UUID;

/**
 * Skill listing filter. Null components do not filter.
 *
 * @param namePattern case-insensitive substring of the name
 * @param topicId     exact owning topic id
 */
public record SkillFilter(String namePattern, UUID topicId) {}

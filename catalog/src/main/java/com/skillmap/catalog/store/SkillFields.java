package com.skillmap.catalog.store;

import java.util.UUID;

/** Full set of writable skill columns, already validated by the caller. */
public record SkillFields(String name, UUID topicId, String difficulty) {}

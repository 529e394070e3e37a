package com.skillmap.catalog.store;

import java.util.UUID;

/** Full set of writable topic columns, already validated by the caller. */
public record TopicFields(String name, String description, UUID parentTopicId) {}

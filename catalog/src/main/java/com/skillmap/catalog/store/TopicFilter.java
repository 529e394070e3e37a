package com.skillmap.catalog.store;

import java.util.UUID;

/**
 * Topic listing filter. Null components do not filter.
 *
 * @param namePattern case-insensitive substring of the name
 * @param parentId    exact parent topic id
 */
public record TopicFilter(String namePattern, UUID parentId) {}

package com.skillmap.catalog.service;

import java.util.UUID;

/**
 * Listing request as received from a client: all components optional.
 *
 * @param search   case-insensitive name substring; blank means no search
 * @param ownerId  parent topic (for topics) or owning topic (for skills)
 * @param limit    requested page size, defaulted and clamped by {@link PagingPolicy}
 * @param offset   requested offset, clamped to zero or more
 */
public record ListQuery(String search, UUID ownerId, Integer limit, Integer offset) {}

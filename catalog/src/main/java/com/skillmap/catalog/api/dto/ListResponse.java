package com.skillmap.catalog.api.dto;

import com.skillmap.catalog.service.CatalogPage;

import java.util.List;
import java.util.function.Function;

/**
 * Envelope for list endpoints: {@code {"data": [...], "meta": {total, limit, offset}}}.
 *
 * meta.limit and meta.offset echo the values actually applied, after defaults
 * and clamping, not the raw query parameters.
 */
public record ListResponse<T>(List<T> data, Meta meta) {

    public record Meta(long total, int limit, int offset) {}

    public static <E, T> ListResponse<T> from(CatalogPage<E> page, Function<E, T> mapper) {
        return new ListResponse<>(
                page.items().stream().map(mapper).toList(),
                new Meta(page.total(), page.limit(), page.offset()));
    }
}

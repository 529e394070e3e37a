package com.skillmap.catalog.service;

import java.util.List;

/**
 * Result of a listing: the items in the window, the number of matches
 * ignoring the window, and the effective limit/offset after clamping.
 */
public record CatalogPage<T>(List<T> items, long total, int limit, int offset) {}

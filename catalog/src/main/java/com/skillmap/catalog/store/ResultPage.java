package com.skillmap.catalog.store;

import java.util.List;

/**
 * One window of a listing plus the number of rows matching the filter.
 */
public record ResultPage<T>(List<T> items, long total) {

    public ResultPage {
        items = List.copyOf(items);
    }
}

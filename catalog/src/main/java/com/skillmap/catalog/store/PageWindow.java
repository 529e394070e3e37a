package com.skillmap.catalog.store;

/**
 * Offset/limit window over an ordered listing.
 *
 * A non-positive limit is legal and selects nothing; offsets are expected
 * to be clamped to zero by the caller.
 */
public record PageWindow(int limit, int offset) {

    public boolean isEmpty() {
        return limit <= 0;
    }
}

package com.skillmap.catalog.store;

import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;

/**
 * {@link Pageable} addressed by row offset instead of page number.
 *
 * Spring Data's PageRequest can only express offsets that are multiples of
 * the page size; listings here accept any offset.
 */
final class OffsetWindowRequest implements Pageable {

    private final int  limit;
    private final long offset;
    private final Sort sort;

    OffsetWindowRequest(PageWindow window, Sort sort) {
        if (window.limit() < 1) {
            throw new IllegalArgumentException("limit must be positive: " + window.limit());
        }
        this.limit  = window.limit();
        this.offset = Math.max(window.offset(), 0);
        this.sort   = sort;
    }

    private OffsetWindowRequest(int limit, long offset, Sort sort) {
        this.limit  = limit;
        this.offset = offset;
        this.sort   = sort;
    }

    @Override public int  getPageNumber() { return (int) (offset / limit); }
    @Override public int  getPageSize()   { return limit; }
    @Override public long getOffset()     { return offset; }
    @Override public Sort getSort()       { return sort; }

    @Override
    public Pageable next() {
        return new OffsetWindowRequest(limit, offset + limit, sort);
    }

    @Override
    public Pageable previousOrFirst() {
        return hasPrevious() ? new OffsetWindowRequest(limit, Math.max(offset - limit, 0), sort) : first();
    }

    @Override
    public Pageable first() {
        return new OffsetWindowRequest(limit, 0, sort);
    }

    @Override
    public Pageable withPage(int pageNumber) {
        return new OffsetWindowRequest(limit, (long) pageNumber * limit, sort);
    }

    @Override
    public boolean hasPrevious() {
        return offset > 0;
    }
}

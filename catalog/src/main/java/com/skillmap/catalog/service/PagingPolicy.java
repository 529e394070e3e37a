package com.skillmap.catalog.service;

import com.skillmap.catalog.store.PageWindow;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Defaults and bounds for listing windows.
 *
 * The limit is capped at {@code max-limit} but has no lower bound: zero or
 * negative limits reach the store unchanged and select nothing.
 */
@Component
public class PagingPolicy {

    private final int defaultLimit;
    private final int maxLimit;

    public PagingPolicy(@Value("${catalog.paging.default-limit:50}") int defaultLimit,
                        @Value("${catalog.paging.max-limit:200}") int maxLimit) {
        this.defaultLimit = defaultLimit;
        this.maxLimit     = maxLimit;
    }

    public PageWindow window(Integer limit, Integer offset) {
        int effectiveLimit  = Math.min(limit  == null ? defaultLimit : limit, maxLimit);
        int effectiveOffset = Math.max(offset == null ? 0 : offset, 0);
        return new PageWindow(effectiveLimit, effectiveOffset);
    }
}

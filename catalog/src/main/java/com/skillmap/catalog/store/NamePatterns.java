package com.skillmap.catalog.store;

import java.util.Locale;

/**
 * Case-insensitive substring matching shared by the store implementations.
 *
 * Blank search text does not filter. Other text is matched literally: LIKE wildcards typed by the caller are
 * escaped with {@link #ESCAPE}.
 */
final class NamePatterns {

    static final char ESCAPE = '\\';

    private NamePatterns() {}

    static boolean isActive(String pattern) {
        return pattern != null && !pattern.isBlank();
    }

    /** Lower-cased {@code %text%} LIKE pattern with wildcards escaped. */
    static String likeContains(String pattern) {
        StringBuilder sb = new StringBuilder(pattern.length() + 2).append('%');
        for (char c : pattern.toLowerCase(Locale.ROOT).toCharArray()) {
            if (c == '%' || c == '_' || c == ESCAPE) sb.append(ESCAPE);
            sb.append(c);
        }
        return sb.append('%').toString();
    }

    static boolean matches(String name, String pattern) {
        if (!isActive(pattern)) return true;
        return name.toLowerCase(Locale.ROOT).contains(pattern.toLowerCase(Locale.ROOT));
    }
}

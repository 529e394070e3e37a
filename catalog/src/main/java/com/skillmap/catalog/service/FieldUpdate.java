package com.skillmap.catalog.service;

import java.util.Objects;

/**
 * One field of a partial update: either left unchanged or explicitly set.
 *
 * Unlike {@link java.util.Optional}, a set value may be {@code null}, which
 * is how a client clears an optional field.
 */
public final class FieldUpdate<T> {

    private final boolean set;
    private final T       value;

    private FieldUpdate(boolean set, T value) {
        this.set   = set;
        this.value = value;
    }

    public static <T> FieldUpdate<T> unchanged() {
        return new FieldUpdate<>(false, null);
    }

    public static <T> FieldUpdate<T> set(T value) {
        return new FieldUpdate<>(true, value);
    }

    /** The supplied value, or {@code current} when the field was omitted. */
    public T orElse(T current) {
        return set ? value : current;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FieldUpdate<?> other)) return false;
        return set == other.set && Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(set, value);
    }

    @Override
    public String toString() {
        return set ? "set(" + value + ")" : "unchanged";
    }
}

package com.example.payments.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Objects;

/**
 * A filter on list endpoints that matches a field either exactly or within bounds.
 *
 * <p>Encodes as {@code created=1700000000} or {@code created[gte]=1700000000}.
 *
 * @param <T> the type of the filtered value, typically an epoch-seconds timestamp
 */
public final class RangeQuery<T> {

    private final T exact;
    private final RangeBounds<T> bounds;

    private RangeQuery(T exact, RangeBounds<T> bounds) {
        this.exact = exact;
        this.bounds = bounds;
    }

    /** Filter results to exactly match a given value. */
    public static <T> RangeQuery<T> eq(T value) {
        return new RangeQuery<>(Objects.requireNonNull(value, "value must not be null"), null);
    }

    /** Filter results to be after a given value. */
    public static <T> RangeQuery<T> gt(T value) {
        return new RangeQuery<>(null, new RangeBounds<>(value, null, null, null));
    }

    /** Filter results to be after or equal to a given value. */
    public static <T> RangeQuery<T> gte(T value) {
        return new RangeQuery<>(null, new RangeBounds<>(null, value, null, null));
    }

    /** Filter results to be before a given value. */
    public static <T> RangeQuery<T> lt(T value) {
        return new RangeQuery<>(null, new RangeBounds<>(null, null, value, null));
    }

    /** Filter results to be before or equal to a given value. */
    public static <T> RangeQuery<T> lte(T value) {
        return new RangeQuery<>(null, new RangeBounds<>(null, null, null, value));
    }

    /**
     * Filter results to fall within arbitrary bounds.
     */
    public static <T> RangeQuery<T> between(RangeBounds<T> bounds) {
        return new RangeQuery<>(null, Objects.requireNonNull(bounds, "bounds must not be null"));
    }

    public boolean isExact() {
        return bounds == null;
    }

    @JsonValue
    Object toJson() {
        return bounds != null ? bounds : exact;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RangeQuery<?> other)) {
            return false;
        }
        return Objects.equals(exact, other.exact) && Objects.equals(bounds, other.bounds);
    }

    @Override
    public int hashCode() {
        return Objects.hash(exact, bounds);
    }

    @Override
    public String toString() {
        return "RangeQuery{" + toJson() + "}";
    }
}

package com.example.payments.model;

import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

import java.util.Objects;
import java.util.Optional;

/**
 * A reference that is either a bare id or, when requested through the
 * {@code expand} parameter, the full object.
 *
 * <pre>{@code
 * "customer": "cus_123"
 * "customer": {"id": "cus_123", "object": "customer", "email": "jenny@example.com"}
 * }</pre>
 *
 * @param <T> the type of the referenced object
 */
@JsonDeserialize(using = ExpandableDeserializer.class)
public final class Expandable<T extends ApiResource> {

    private final String id;
    private final T object;

    private Expandable(String id, T object) {
        this.id = id;
        this.object = object;
    }

    public static <T extends ApiResource> Expandable<T> ofId(String id) {
        return new Expandable<>(Objects.requireNonNull(id, "id must not be null"), null);
    }

    public static <T extends ApiResource> Expandable<T> ofObject(T object) {
        Objects.requireNonNull(object, "object must not be null");
        return new Expandable<>(object.id(), object);
    }

    /**
     * Returns the id, whether or not the object was expanded.
     */
    public String id() {
        return id;
    }

    public boolean isObject() {
        return object != null;
    }

    public Optional<T> asObject() {
        return Optional.ofNullable(object);
    }

    @JsonValue
    Object toJson() {
        return object != null ? object : id;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Expandable<?> other)) {
            return false;
        }
        return id.equals(other.id) && Objects.equals(object, other.object);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, object);
    }

    @Override
    public String toString() {
        return isObject() ? "Expandable{" + object + "}" : "Expandable{" + id + "}";
    }
}

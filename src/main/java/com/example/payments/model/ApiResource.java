package com.example.payments.model;

/**
 * A top-level API object with a unique id.
 *
 * <p>Resources paginate by id: the cursor of a resource is its id.
 */
public interface ApiResource extends HasCursor {

    /**
     * Unique identifier for the object.
     */
    String id();

    /**
     * The object's type, represented on the wire as the {@code object} property.
     */
    String object();

    @Override
    default String cursor() {
        return id();
    }
}

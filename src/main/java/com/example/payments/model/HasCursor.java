package com.example.payments.model;

/**
 * Implemented by types that can be fetched through a cursor-paginated list.
 *
 * <p>The cursor of the last item of a page is sent as {@code starting_after}
 * to request the following page, so it must be unique and follow the
 * server's ordering of the collection.
 */
public interface HasCursor {

    /**
     * Returns the continuation key for this item. Must not perform I/O.
     */
    String cursor();
}

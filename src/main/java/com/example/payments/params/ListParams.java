package com.example.payments.params;

/**
 * Parameters of a list endpoint.
 *
 * <p>Continuation requests append their own {@code starting_after}, so the
 * parameters repeated on them must not carry the caller's cursor fields.
 */
public interface ListParams {

    /**
     * Returns a copy with {@code starting_after} and {@code ending_before} cleared.
     */
    ListParams withoutCursors();
}

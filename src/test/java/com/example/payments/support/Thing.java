package com.example.payments.support;

import com.example.payments.model.ApiResource;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Minimal list item used by the pagination tests.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Thing(String id, String object) implements ApiResource {

    public static Thing of(String id) {
        return new Thing(id, "thing");
    }
}

package com.example.payments.error;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * The {@code error} object returned by the API alongside a 4xx/5xx status.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ApiError(
        String type,
        String message,
        String code,
        String param
) {
}

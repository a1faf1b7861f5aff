package com.example.payments.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * How a new usage record combines with usage already reported for the same timestamp.
 */
public enum UsageRecordAction {
    /** Adds the quantity to existing usage. The default. */
    @JsonProperty("increment")
    INCREMENT,
    /** Overwrites existing usage. Not allowed with billing thresholds. */
    @JsonProperty("set")
    SET
}

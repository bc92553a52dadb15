package com.codemeter.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Execution backend requested by configuration.
 */
public enum BackendKind {
    /** Worker pool when more than one worker is configured, synchronous otherwise */
    @JsonProperty("auto")
    AUTO,
    /** Revise files inline on the walking thread */
    @JsonProperty("sync")
    SYNC,
    /** Revise files on a bounded-queue worker pool */
    @JsonProperty("pool")
    POOL
}

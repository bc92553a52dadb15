package com.codemeter.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Settings of one revision run.
 *
 * <p>Every field is optional; {@code null} (and {@code 0} for the numeric fields) selects the
 * default. Use the {@code effective*} accessors to read resolved values.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * revision:
 *   recurse: true
 *   backend: pool
 *   workerThreadCount: 8
 *   maxQueueLength: 256
 * }</pre>
 *
 * @param recurse descend into subdirectories (default true)
 * @param backend execution backend (default {@link BackendKind#AUTO})
 * @param workerThreadCount pool worker count, 0 for one per available processor
 * @param maxQueueLength pool queue capacity, 0 for {@code max(64, 8 * workers)}
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RevisionConfig(
    @JsonProperty("recurse") Boolean recurse,
    @JsonProperty("backend") BackendKind backend,
    @JsonProperty("workerThreadCount") Integer workerThreadCount,
    @JsonProperty("maxQueueLength") Integer maxQueueLength
) {
    /**
     * Returns a configuration with every value defaulted.
     *
     * @return default configuration
     */
    public static RevisionConfig defaults() {
        return new RevisionConfig(null, null, null, null);
    }

    public boolean effectiveRecurse() {
        return recurse == null || recurse;
    }

    public BackendKind effectiveBackend() {
        return backend != null ? backend : BackendKind.AUTO;
    }

    /**
     * Returns the configured worker count, or {@code defaultCount} when unset or zero.
     *
     * @param defaultCount count to use when none is configured
     * @return worker count
     */
    public int effectiveWorkerThreadCount(int defaultCount) {
        return workerThreadCount == null || workerThreadCount == 0 ? defaultCount : workerThreadCount;
    }

    /**
     * Returns the configured queue capacity, or {@code defaultLength} when unset or zero.
     *
     * @param defaultLength capacity to use when none is configured
     * @return queue capacity
     */
    public int effectiveMaxQueueLength(int defaultLength) {
        return maxQueueLength == null || maxQueueLength == 0 ? defaultLength : maxQueueLength;
    }

    /**
     * Returns a copy with non-null values of {@code overrides} replacing this configuration's.
     *
     * @param overrides values to apply, typically from the command line
     * @return merged configuration
     */
    public RevisionConfig mergedWith(RevisionConfig overrides) {
        if (overrides == null) {
            return this;
        }
        return new RevisionConfig(
            overrides.recurse != null ? overrides.recurse : recurse,
            overrides.backend != null ? overrides.backend : backend,
            overrides.workerThreadCount != null ? overrides.workerThreadCount : workerThreadCount,
            overrides.maxQueueLength != null ? overrides.maxQueueLength : maxQueueLength
        );
    }

    /**
     * Checks value ranges.
     *
     * @return problems found, empty when the configuration is usable
     */
    public List<String> validate() {
        List<String> problems = new ArrayList<>();
        if (workerThreadCount != null && workerThreadCount < 0) {
            problems.add("workerThreadCount must not be negative: " + workerThreadCount);
        }
        if (maxQueueLength != null && maxQueueLength < 0) {
            problems.add("maxQueueLength must not be negative: " + maxQueueLength);
        }
        return problems;
    }
}

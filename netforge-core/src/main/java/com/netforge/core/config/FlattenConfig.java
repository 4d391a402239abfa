package com.netforge.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Chip flattening settings.
 *
 * @param enabled expand chip instances into their internal components
 * @param recursive also expand chips nested inside expanded chips
 * @param maxDepth deepest nesting level expanded, top-level chips being level 1
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FlattenConfig(
    @JsonProperty("enabled") Boolean enabled,
    @JsonProperty("recursive") Boolean recursive,
    @JsonProperty("maxDepth") Integer maxDepth
) {
    /** Nesting limit applied when none is configured. */
    public static final int DEFAULT_MAX_DEPTH = 8;

    public static FlattenConfig defaults() {
        return new FlattenConfig(true, true, DEFAULT_MAX_DEPTH);
    }

    /**
     * Settings that expand top-level chips only, dropping chips nested inside them.
     *
     * @return single-level settings
     */
    public static FlattenConfig singleLevel() {
        return new FlattenConfig(true, false, 1);
    }

    public static FlattenConfig disabled() {
        return new FlattenConfig(false, false, 0);
    }

    public boolean isEnabled() {
        return enabled == null || enabled;
    }

    public boolean isRecursive() {
        return recursive == null || recursive;
    }

    /**
     * Returns the effective depth limit: 1 when not recursive, the configured
     * limit otherwise.
     *
     * @return depth limit
     */
    public int effectiveMaxDepth() {
        if (!isRecursive()) {
            return 1;
        }
        return maxDepth == null || maxDepth < 1 ? DEFAULT_MAX_DEPTH : maxDepth;
    }
}

package com.taskpilot.core.resource;

/**
 * Limits the resource guard enforces. A sample exactly at a limit is still acceptable.
 */
public record ResourceThresholds(double maxLoadRatio, long minFreeMemBytes, double minFreeMemRatio) {

    public static final double DEFAULT_MAX_LOAD_RATIO = 0.9;
    public static final long DEFAULT_MIN_FREE_MEM_MB = 1024;
    public static final double DEFAULT_MIN_FREE_MEM_RATIO = 0.05;

    public static ResourceThresholds defaults() {
        return new ResourceThresholds(DEFAULT_MAX_LOAD_RATIO, DEFAULT_MIN_FREE_MEM_MB * 1024 * 1024,
                DEFAULT_MIN_FREE_MEM_RATIO);
    }
}

package com.taskpilot.core.resource;

/**
 * Point-in-time host resource reading.
 *
 * @param cpuCount      available processors
 * @param load1         one-minute load average, negative when the platform has none
 * @param freeMemBytes  free physical memory
 * @param totalMemBytes total physical memory
 */
public record ResourceSample(int cpuCount, double load1, long freeMemBytes, long totalMemBytes) {

    public double loadRatio() {
        if (load1 < 0) {
            return 0.0;
        }
        return load1 / Math.max(1, cpuCount);
    }

    public double freeMemRatio() {
        if (totalMemBytes <= 0) {
            return 1.0;
        }
        return (double) freeMemBytes / totalMemBytes;
    }
}

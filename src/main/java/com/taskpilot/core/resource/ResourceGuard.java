package com.taskpilot.core.resource;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Decides whether the host has headroom for another worker process.
 * <p>
 * Evaluation is a pure function of a {@link ResourceSample}; sampling itself lives in
 * {@link HostMetricsSampler} so the rules can be exercised with synthetic readings.
 */
public final class ResourceGuard {

    private static final long MB = 1024L * 1024L;

    private ResourceGuard() {}

    public static ThrottleDecision evaluate(ResourceSample sample, ResourceThresholds thresholds) {
        List<String> reasons = new ArrayList<>();
        double loadRatio = sample.loadRatio();
        double freeMemRatio = sample.freeMemRatio();

        if (sample.load1() >= 0 && loadRatio > thresholds.maxLoadRatio()) {
            reasons.add(String.format(Locale.ROOT, "load ratio %.2f exceeds max %.2f (load1 %.2f on %d cpus)",
                    loadRatio, thresholds.maxLoadRatio(), sample.load1(), sample.cpuCount()));
        }
        if (sample.totalMemBytes() > 0 && sample.freeMemBytes() < thresholds.minFreeMemBytes()) {
            reasons.add(String.format(Locale.ROOT, "free memory %d MB below min %d MB",
                    sample.freeMemBytes() / MB, thresholds.minFreeMemBytes() / MB));
        }
        if (sample.totalMemBytes() > 0 && freeMemRatio < thresholds.minFreeMemRatio()) {
            reasons.add(String.format(Locale.ROOT, "free memory ratio %.3f below min %.3f",
                    freeMemRatio, thresholds.minFreeMemRatio()));
        }
        return new ThrottleDecision(!reasons.isEmpty(), reasons, loadRatio, freeMemRatio);
    }
}

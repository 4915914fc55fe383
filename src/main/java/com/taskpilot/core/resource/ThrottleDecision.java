package com.taskpilot.core.resource;

import java.util.List;

/**
 * Outcome of a resource guard evaluation.
 *
 * @param throttle     true when no new workers should be spawned
 * @param reasons      one human readable line per violated threshold
 * @param loadRatio    observed load per CPU
 * @param freeMemRatio observed free memory fraction
 */
public record ThrottleDecision(boolean throttle, List<String> reasons, double loadRatio, double freeMemRatio) {

    public ThrottleDecision {
        reasons = reasons == null ? List.of() : List.copyOf(reasons);
    }

    public static ThrottleDecision clear() {
        return new ThrottleDecision(false, List.of(), 0.0, 1.0);
    }

    public String summary() {
        return throttle ? String.join("; ", reasons) : "ok";
    }
}

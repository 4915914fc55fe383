package com.taskpilot.core.rollup;

/**
 * Receives rollup changes. Throwing leaves the change unacknowledged, so it is offered
 * again on the next transition of any member task.
 */
@FunctionalInterface
public interface RollupSink {

    void propagate(RollupChange change);
}

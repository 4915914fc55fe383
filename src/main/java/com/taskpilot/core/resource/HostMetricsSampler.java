package com.taskpilot.core.resource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;

/**
 * Reads host load and memory through the platform {@link OperatingSystemMXBean}.
 * <p>
 * Physical memory figures come from the {@code com.sun.management} extension when the
 * JVM provides it; otherwise memory is reported as unknown (zero total) and only the
 * load threshold applies.
 */
@Component
public class HostMetricsSampler {

    private static final Logger log = LoggerFactory.getLogger(HostMetricsSampler.class);

    private final OperatingSystemMXBean os;

    public HostMetricsSampler() {
        this(ManagementFactory.getOperatingSystemMXBean());
    }

    HostMetricsSampler(OperatingSystemMXBean os) {
        this.os = os;
    }

    public ResourceSample sample() {
        int cpus = Math.max(1, os.getAvailableProcessors());
        double load1 = os.getSystemLoadAverage();
        long free = 0;
        long total = 0;
        if (os instanceof com.sun.management.OperatingSystemMXBean extended) {
            try {
                free = extended.getFreeMemorySize();
                total = extended.getTotalMemorySize();
            } catch (UnsupportedOperationException e) {
                log.debug("Physical memory figures unavailable: {}", e.getMessage());
            }
        }
        return new ResourceSample(cpus, load1, free, total);
    }
}

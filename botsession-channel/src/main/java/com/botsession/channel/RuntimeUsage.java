package com.botsession.channel;

import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;

/**
 * Host CPU and memory usage, both in percent.
 */
public record RuntimeUsage(double cpuPercent, double memoryPercent) {

    /**
     * Sample the operating system bean.
     *
     * @return the current usage, or null when the JVM does not expose host
     *         load figures
     */
    public static RuntimeUsage sample() {
        OperatingSystemMXBean bean = ManagementFactory.getOperatingSystemMXBean();
        if (!(bean instanceof com.sun.management.OperatingSystemMXBean os)) {
            return null;
        }
        double cpu = os.getCpuLoad();
        long total = os.getTotalMemorySize();
        long free = os.getFreeMemorySize();
        double memory = total > 0 ? (total - free) * 100.0 / total : 0.0;
        return new RuntimeUsage(cpu < 0 ? 0.0 : round(cpu * 100.0), round(memory));
    }

    private static double round(double value) {
        return Math.round(value * 10.0) / 10.0;
    }
}

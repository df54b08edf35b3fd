package com.myorg.docinsight.metrics;

import com.sun.management.OperatingSystemMXBean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.management.ManagementFactory;

/**
 * Step timer for the "performance" logger: time since the previous mark, throughput, process CPU
 * and used heap.
 */
public class PerfProbe {
    private static final Logger PERF = LoggerFactory.getLogger("performance");
    private static final java.lang.management.OperatingSystemMXBean OS = ManagementFactory.getOperatingSystemMXBean();

    private final long t0 = System.nanoTime();
    private long last = t0;
    private final String label;

    public PerfProbe(String label) { this.label = label; }

    public void mark(String stepName, long unitsProcessed) {
        long now = System.nanoTime();
        double ms = (now - last) / 1_000_000.0;
        double sec = ms / 1000.0;
        last = now;

        double rate = (sec > 0) ? (unitsProcessed / sec) : 0.0;

        PERF.info("{} - {}: {} item(s) in {} ms (rate: {}/s), CPU: {}%, Memory: {} MB",
                label,
                stepName,
                unitsProcessed,
                String.format("%.2f", ms),
                String.format("%.2f", rate),
                String.format("%.1f", cpuPercent()),
                String.format("%.2f", usedMb()));
    }

    /** @return total elapsed milliseconds since the probe was created */
    public long done(String stepName) {
        long totalMs = (System.nanoTime() - t0) / 1_000_000L;
        PERF.info("{} - {} total {} ms", label, stepName, totalMs);
        return totalMs;
    }

    private static double cpuPercent() {
        if (OS instanceof OperatingSystemMXBean) {
            double load = ((OperatingSystemMXBean) OS).getProcessCpuLoad();
            return load >= 0 ? load * 100.0 : 0.0;
        }
        return 0.0;
    }

    private static double usedMb() {
        Runtime rt = Runtime.getRuntime();
        return (rt.totalMemory() - rt.freeMemory()) / (1024.0 * 1024.0);
    }
}

package com.myorg.choirsplit.metrics;

import com.sun.management.OperatingSystemMXBean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.management.ManagementFactory;

/**
 * Times the passes of one run on the "performance" logger: time since the previous mark,
 * staves handled per second, process CPU and used heap.
 */
public class PerfProbe {
    private static final Logger PERF = LoggerFactory.getLogger("performance");
    private static final OperatingSystemMXBean OS =
            (OperatingSystemMXBean) ManagementFactory.getOperatingSystemMXBean();

    private final long t0 = System.nanoTime();
    private long last = t0;
    private final String label;

    public PerfProbe(String label) { this.label = label; }

    public void mark(String pass, long staves) {
        long now = System.nanoTime();
        double ms = (now - last) / 1_000_000.0;
        last = now;

        double rate = ms > 0 ? staves / (ms / 1000.0) : 0.0;
        double cpuPct = OS.getProcessCpuLoad();
        cpuPct = cpuPct >= 0 ? cpuPct * 100.0 : 0.0;

        Runtime rt = Runtime.getRuntime();
        double usedMB = (rt.totalMemory() - rt.freeMemory()) / (1024.0 * 1024.0);

        PERF.info("{} - {} in {} ms ({} staves/s), CPU: {}%, Memory: {} MB",
                label,
                pass,
                String.format("%.2f", ms),
                String.format("%.1f", rate),
                String.format("%.1f", cpuPct),
                String.format("%.2f", usedMB));
    }

    public long done(String step) {
        long totalMs = (System.nanoTime() - t0) / 1_000_000;
        PERF.info("{} - {} total {} ms", label, step, totalMs);
        return totalMs;
    }
}

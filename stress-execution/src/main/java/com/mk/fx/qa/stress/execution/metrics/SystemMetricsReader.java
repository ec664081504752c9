package com.mk.fx.qa.stress.execution.metrics;

import com.google.common.annotations.VisibleForTesting;
import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;
import java.time.Instant;
import java.util.function.DoubleSupplier;
import java.util.function.LongSupplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Reads host CPU, memory, load and process counters from the platform MXBean.
 *
 * <p>Every counter is read independently and falls back to {@code 0} when the platform does not
 * expose it or the read throws, so {@link #read()} never fails. None of the reads sample over an
 * interval; a call costs well under a few milliseconds.
 */
@Slf4j
@Component
public class SystemMetricsReader {

  private final OperatingSystemMXBean osBean;

  public SystemMetricsReader() {
    this(ManagementFactory.getOperatingSystemMXBean());
  }

  @VisibleForTesting
  SystemMetricsReader(OperatingSystemMXBean osBean) {
    this.osBean = osBean;
  }

  public SystemMetrics read() {
    double cpuPercent = readDouble("cpu_percent", this::cpuPercent);
    long total = readLong("memory_total_bytes", this::totalMemory);
    long free = readLong("memory_free_bytes", this::freeMemory);
    long used = total > 0 ? Math.max(0, total - free) : 0;
    double memoryPercent = total > 0 ? round(used * 100.0 / total) : 0.0;
    double loadAverage = readDouble("load_average", this::loadAverage);
    long processCount = readLong("process_count", () -> ProcessHandle.allProcesses().count());
    int processors = (int) readLong("available_processors", osBean::getAvailableProcessors);

    return new SystemMetrics(
        cpuPercent,
        used,
        total,
        memoryPercent,
        loadAverage,
        processCount,
        processors,
        Instant.now());
  }

  private double cpuPercent() {
    if (osBean instanceof com.sun.management.OperatingSystemMXBean sunBean) {
      return round(sunBean.getCpuLoad() * 100.0);
    }
    return 0.0;
  }

  private long totalMemory() {
    if (osBean instanceof com.sun.management.OperatingSystemMXBean sunBean) {
      return sunBean.getTotalMemorySize();
    }
    return 0L;
  }

  private long freeMemory() {
    if (osBean instanceof com.sun.management.OperatingSystemMXBean sunBean) {
      return sunBean.getFreeMemorySize();
    }
    return 0L;
  }

  private double loadAverage() {
    return round(osBean.getSystemLoadAverage());
  }

  // negative values are the MXBean's "not available" marker
  private static double readDouble(String name, DoubleSupplier source) {
    try {
      double value = source.getAsDouble();
      return Double.isNaN(value) || value < 0 ? 0.0 : value;
    } catch (RuntimeException ex) {
      log.debug("Metric {} unavailable: {}", name, ex.toString());
      return 0.0;
    }
  }

  private static long readLong(String name, LongSupplier source) {
    try {
      return Math.max(0L, source.getAsLong());
    } catch (RuntimeException ex) {
      log.debug("Metric {} unavailable: {}", name, ex.toString());
      return 0L;
    }
  }

  private static double round(double value) {
    return Math.round(value * 100.0) / 100.0;
  }
}

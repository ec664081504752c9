package com.mk.fx.qa.stress.execution.metrics;

import java.time.Instant;

/**
 * Host metrics sampled at request time. Fields whose source is unavailable are {@code 0}.
 *
 * @param cpuPercent whole-system CPU usage, 0-100
 * @param loadAverage one minute system load average
 */
public record SystemMetrics(
    double cpuPercent,
    long memoryUsedBytes,
    long memoryTotalBytes,
    double memoryPercent,
    double loadAverage,
    long processCount,
    int availableProcessors,
    Instant sampledAt) {}

package com.mk.fx.qa.stress.execution.dto.controllerresponse;

/**
 * Counters of this service instance, independent of host metrics.
 *
 * @param lastDurationSeconds duration requested by the most recent start, {@code null} before
 *     the first one
 */
public record StressMetricsResponse(
    long totalStarted,
    long totalCompleted,
    long totalFailed,
    boolean running,
    Integer lastDurationSeconds) {}

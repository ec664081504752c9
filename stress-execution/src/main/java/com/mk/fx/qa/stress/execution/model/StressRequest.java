package com.mk.fx.qa.stress.execution.model;

/**
 * Parameters of one stress run.
 *
 * @param cpuWorkers number of CPU stressors, {@code 0} for none
 * @param memoryWorkers number of memory stressors, {@code 0} for none
 * @param duration run time in seconds, passed to the tool as its own timeout
 * @param memorySize bytes allocated per memory stressor, e.g. {@code "512M"}
 */
public record StressRequest(int cpuWorkers, int memoryWorkers, int duration, String memorySize) {}

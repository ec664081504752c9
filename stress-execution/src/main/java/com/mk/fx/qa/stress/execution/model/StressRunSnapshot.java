package com.mk.fx.qa.stress.execution.model;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/** Consistent, immutable view of a {@link StressRun} taken under its lock. */
public record StressRunSnapshot(
    UUID id,
    StressRequest request,
    List<String> command,
    RunState state,
    Instant startedAt,
    Instant finishedAt,
    Integer exitCode,
    String diagnostic) {}

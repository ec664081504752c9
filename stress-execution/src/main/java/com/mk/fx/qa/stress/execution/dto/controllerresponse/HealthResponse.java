package com.mk.fx.qa.stress.execution.dto.controllerresponse;

import java.time.Instant;

/** Liveness answer. {@code status} is always {@code "ok"} when the endpoint responds at all. */
public record HealthResponse(String status, Instant timestamp, String version, String host) {}

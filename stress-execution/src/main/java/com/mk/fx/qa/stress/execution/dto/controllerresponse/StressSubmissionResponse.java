package com.mk.fx.qa.stress.execution.dto.controllerresponse;

import com.mk.fx.qa.stress.execution.model.RunState;
import java.util.UUID;

/** Response of {@code POST /stress}. */
public record StressSubmissionResponse(UUID runId, RunState state, String message) {}

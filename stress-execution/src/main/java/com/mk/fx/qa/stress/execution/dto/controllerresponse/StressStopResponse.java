package com.mk.fx.qa.stress.execution.dto.controllerresponse;

import com.mk.fx.qa.stress.execution.model.RunState;
import java.util.UUID;

public record StressStopResponse(UUID runId, RunState state, String message) {}

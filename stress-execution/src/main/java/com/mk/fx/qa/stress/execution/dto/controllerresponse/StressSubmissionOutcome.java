package com.mk.fx.qa.stress.execution.dto.controllerresponse;

import com.mk.fx.qa.stress.execution.model.RunState;
import java.util.UUID;

/** Result of a successful start: the id of the new run and its state right after launch. */
public record StressSubmissionOutcome(UUID runId, RunState state, String message) {}

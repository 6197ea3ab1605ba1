package com.taskrelay.orchestrator.step;

import com.taskrelay.orchestrator.model.ExecutionMode;
import com.taskrelay.orchestrator.model.StepName;

/** One entry of a resolved plan. */
public record PlannedStep(StepName name, ExecutionMode mode) {}

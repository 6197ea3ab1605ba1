package com.taskrelay.orchestrator.model;

/**
 * Where a step actually runs.
 *
 * LOCAL:     the step handler runs on an orchestrator worker thread and calls
 *             the capability provider synchronously.
 *
 * DELEGATED: the step is handed to a counterparty agent as a subtask; the
 *             task is suspended until the counterparty reports back.
 */
public enum ExecutionMode {
    LOCAL,
    DELEGATED
}

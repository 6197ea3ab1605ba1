package com.taskrelay.orchestrator.model;

/**
 * Why a task ended in FAILED. Reported verbatim by the status API.
 */
public enum FailureReason {
    UNKNOWN_STEP,              // intent could not be resolved to registered steps
    HANDLER_FAILURE,           // a step handler (local or remote) reported an error
    COUNTERPARTY_UNREACHABLE,  // the subtask could not be handed off
    TIMED_OUT,                 // the delegated subtask missed its deadline
    PUBLISH_ERROR,             // an artifact could not be stored
    CANCELLED                  // cancelled by the caller
}

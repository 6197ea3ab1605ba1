package com.taskrelay.orchestrator.delegation.dto;

/**
 * Response from POST /agent/tasks: the id the counterparty assigned.
 */
public record CreateSubtaskResponse(String remote_id) {}

package com.taskrelay.orchestrator.model;

/**
 * Identifies a delegated step's subtask on the counterparty side.
 *
 * @param counterpartyId the agent the subtask was sent to
 * @param remoteId       the id that agent assigned to the subtask
 */
public record DelegateRef(String counterpartyId, String remoteId) {}

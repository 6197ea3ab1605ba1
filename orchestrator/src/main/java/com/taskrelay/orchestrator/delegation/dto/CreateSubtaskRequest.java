package com.taskrelay.orchestrator.delegation.dto;

/**
 * Request body for POST /agent/tasks on a counterparty.
 *
 * callback_url is a prefix: the counterparty reports to
 * {@code {callback_url}/{remote_id}/result}.
 */
public record CreateSubtaskRequest(
        String step_name,
        String input,
        String caller_identity,
        String callback_url
) {}

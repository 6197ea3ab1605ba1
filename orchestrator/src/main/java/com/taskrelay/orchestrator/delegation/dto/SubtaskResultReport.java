package com.taskrelay.orchestrator.delegation.dto;

import com.taskrelay.orchestrator.model.FailureReason;
import com.taskrelay.orchestrator.model.StepOutcome;

import java.util.Map;

/**
 * Body of POST {callback_url}/{remote_id}/result.
 *
 * Sent by a counterparty when its subtask changes status, and by us when a
 * task another agent delegated to us finishes.
 *
 * @param status    one of {@link SubtaskStatus}'s wire values
 * @param output    step output; present when Completed
 * @param artifacts published artifacts, name → locator
 * @param message   human-readable progress or failure detail
 */
public record SubtaskResultReport(
        String              status,
        String              output,
        Map<String, String> artifacts,
        String              message
) {
    public static SubtaskResultReport completed(String output, Map<String, String> artifacts) {
        return new SubtaskResultReport(SubtaskStatus.COMPLETED.wire(), output, artifacts, null);
    }

    public static SubtaskResultReport failed(String message) {
        return new SubtaskResultReport(SubtaskStatus.FAILED.wire(), null, Map.of(), message);
    }

    /** Terminal reports only; a Failed report is a handler failure of the delegated step. */
    public StepOutcome toOutcome() {
        SubtaskStatus s = SubtaskStatus.fromWire(status).orElseThrow(() ->
                new IllegalArgumentException("Unknown subtask status: " + status));
        return switch (s) {
            case COMPLETED -> StepOutcome.success(output, artifacts);
            case FAILED    -> StepOutcome.failure(FailureReason.HANDLER_FAILURE,
                    message != null ? message : "Subtask failed on counterparty");
            case PENDING, IN_PROGRESS -> throw new IllegalArgumentException(
                    "Status " + status + " is not terminal");
        };
    }
}

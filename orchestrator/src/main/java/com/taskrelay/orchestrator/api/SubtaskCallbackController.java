package com.taskrelay.orchestrator.api;

import com.taskrelay.orchestrator.delegation.DelegationChannel;
import com.taskrelay.orchestrator.delegation.dto.SubtaskResultReport;
import com.taskrelay.orchestrator.delegation.dto.SubtaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.Map;

/**
 * Inbound half of the counterparty protocol.
 *
 * POST /subtasks/{remoteId}/result: a counterparty reports on a subtask we
 * created. Completed and Failed resolve the delegated step; Pending and
 * In_Progress only land in the task's audit trail.
 *
 * Always 202 for a well-formed report, even when it is discarded: a duplicate
 * or late delivery is not the sender's error.
 */
@RestController
@RequestMapping("/subtasks")
public class SubtaskCallbackController {

    private static final Logger log = LoggerFactory.getLogger(SubtaskCallbackController.class);

    private final DelegationChannel channel;

    public SubtaskCallbackController(DelegationChannel channel) {
        this.channel = channel;
    }

    @PostMapping("/{remoteId}/result")
    public ResponseEntity<Map<String, Object>> reportResult(@PathVariable String remoteId,
                                                            @RequestBody SubtaskResultReport report) {
        SubtaskStatus status = SubtaskStatus.fromWire(report.status()).orElseThrow(() ->
                new ResponseStatusException(HttpStatus.BAD_REQUEST,
                        "Unknown subtask status: " + report.status()));

        boolean accepted = status.isTerminal()
                ? channel.onSubtaskResult(remoteId, report.toOutcome())
                : channel.onSubtaskProgress(remoteId, status.wire(), report.message());
        log.debug("Report {} for subtask {} accepted={}", status.wire(), remoteId, accepted);
        return ResponseEntity.accepted().body(Map.of(
                "remote_id", remoteId,
                "accepted",  accepted));
    }
}

package com.taskrelay.orchestrator.api;

import com.taskrelay.orchestrator.delegation.dto.CreateSubtaskRequest;
import com.taskrelay.orchestrator.delegation.dto.CreateSubtaskResponse;
import com.taskrelay.orchestrator.model.Intent;
import com.taskrelay.orchestrator.model.StepName;
import com.taskrelay.orchestrator.model.Task;
import com.taskrelay.orchestrator.model.TaskInput;
import com.taskrelay.orchestrator.service.Orchestrator;
import com.taskrelay.orchestrator.service.TaskNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.UUID;

/**
 * Serving half of the counterparty protocol: other agents delegate steps to us.
 *
 * POST   /agent/tasks       run one step locally as a task; remote_id is our task id
 * DELETE /agent/tasks/{id}  the caller no longer needs the result
 *
 * The outcome is posted to {@code {callback_url}/{remote_id}/result} when the
 * task finishes.
 */
@RestController
@RequestMapping("/agent/tasks")
public class AgentInboxController {

    private static final Logger log = LoggerFactory.getLogger(AgentInboxController.class);

    private final Orchestrator orchestrator;

    public AgentInboxController(Orchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @PostMapping
    public ResponseEntity<CreateSubtaskResponse> createSubtask(@RequestBody CreateSubtaskRequest req) {
        StepName step = StepName.fromWire(req.step_name()).orElseThrow(() ->
                new ResponseStatusException(HttpStatus.BAD_REQUEST, "Unknown step: " + req.step_name()));
        if (req.callback_url() == null || req.callback_url().isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "callback_url is required");
        }

        Task task = orchestrator.acceptDelegated(
                TaskInput.of(req.input()),
                List.of(localIntentFor(step).token()),
                req.caller_identity(),
                req.callback_url());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(new CreateSubtaskResponse(task.getId().toString()));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> abandon(@PathVariable UUID id) {
        try {
            orchestrator.cancel(id, "Abandoned by the delegating agent");
        } catch (TaskNotFoundException e) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, e.getMessage());
        } catch (IllegalStateException e) {
            log.info("Ignoring abandon of task {}: {}", id, e.getMessage());
        }
        return ResponseEntity.noContent().build();
    }

    // Steps received from other agents always run here, never onward.
    private static Intent localIntentFor(StepName step) {
        return switch (step) {
            case TRANSLATE   -> Intent.TRANSLATE;
            case TEXT2SPEECH -> Intent.TEXT2SPEECH_LOCAL;
        };
    }
}

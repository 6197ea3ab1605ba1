package com.taskrelay.orchestrator.api;

import com.taskrelay.orchestrator.api.dto.CancelTaskRequest;
import com.taskrelay.orchestrator.api.dto.StepResponse;
import com.taskrelay.orchestrator.api.dto.SubmitTaskRequest;
import com.taskrelay.orchestrator.api.dto.TaskLogResponse;
import com.taskrelay.orchestrator.api.dto.TaskResponse;
import com.taskrelay.orchestrator.model.Task;
import com.taskrelay.orchestrator.service.Orchestrator;
import com.taskrelay.orchestrator.service.TaskLedger;
import com.taskrelay.orchestrator.service.TaskNotFoundException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.UUID;

/**
 * REST API for task lifecycle.
 *
 * POST /tasks              submit a task
 * GET  /tasks/{id}         state, failure reason, steps and artifacts
 * GET  /tasks/{id}/steps   step records in execution order
 * GET  /tasks/{id}/logs    audit trail
 * POST /tasks/{id}/cancel  fail a running or awaiting task with reason CANCELLED
 */
@RestController
@RequestMapping("/tasks")
public class TaskController {

    private final Orchestrator orchestrator;
    private final TaskLedger   ledger;

    public TaskController(Orchestrator orchestrator, TaskLedger ledger) {
        this.orchestrator = orchestrator;
        this.ledger       = ledger;
    }

    /**
     * Submit a new task.
     *
     * Example:
     *   curl -X POST http://localhost:8080/tasks \
     *     -H "Content-Type: application/json" \
     *     -d '{"text":"Hola mundo","intent":["translate","text2speech-local"]}'
     */
    @PostMapping
    public ResponseEntity<TaskResponse> submit(@RequestBody SubmitTaskRequest req) {
        if (req.text() == null || req.text().isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "text is required");
        }
        Task task = orchestrator.submit(req.toInput(), req.intent());
        return ResponseEntity.status(HttpStatus.CREATED).body(TaskResponse.from(task));
    }

    /** Returns 404 if the task ID is not found. */
    @GetMapping("/{id}")
    public TaskResponse getTask(@PathVariable UUID id) {
        return ledger.find(id)
                .map(TaskResponse::from)
                .orElseThrow(() -> notFound(id));
    }

    @GetMapping("/{id}/steps")
    public List<StepResponse> getSteps(@PathVariable UUID id) {
        Task task = ledger.find(id).orElseThrow(() -> notFound(id));
        return task.getSteps().stream()
                .map(StepResponse::from)
                .toList();
    }

    @GetMapping("/{id}/logs")
    public List<TaskLogResponse> getLogs(@PathVariable UUID id) {
        try {
            return ledger.logs(id).stream()
                    .map(TaskLogResponse::from)
                    .toList();
        } catch (TaskNotFoundException e) {
            throw notFound(id);
        }
    }

    /**
     * HTTP 200 with the failed task, 404 if unknown, 409 if it already finished.
     */
    @PostMapping("/{id}/cancel")
    public TaskResponse cancel(@PathVariable UUID id,
                               @RequestBody(required = false) CancelTaskRequest req) {
        String reason = req == null ? new CancelTaskRequest(null).reasonOrDefault() : req.reasonOrDefault();
        try {
            return TaskResponse.from(orchestrator.cancel(id, reason));
        } catch (TaskNotFoundException e) {
            throw notFound(id);
        } catch (IllegalStateException e) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, e.getMessage());
        }
    }

    private static ResponseStatusException notFound(UUID id) {
        return new ResponseStatusException(HttpStatus.NOT_FOUND, "Task not found: " + id);
    }
}

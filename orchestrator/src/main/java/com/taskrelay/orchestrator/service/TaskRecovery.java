package com.taskrelay.orchestrator.service;

import com.taskrelay.orchestrator.model.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Picks up tasks that were being driven when the process stopped.
 *
 * PENDING and RUNNING tasks are dispatched again; a step left IN_PROGRESS is
 * re-executed. AWAITING_DELEGATE tasks need nothing: their correlation
 * entries survive in the database and the timeout sweep still covers them.
 */
@Component
public class TaskRecovery {

    private static final Logger log = LoggerFactory.getLogger(TaskRecovery.class);

    private final TaskLedger   ledger;
    private final Orchestrator orchestrator;

    public TaskRecovery(TaskLedger ledger, Orchestrator orchestrator) {
        this.ledger       = ledger;
        this.orchestrator = orchestrator;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void recoverInterruptedTasks() {
        List<Task> interrupted = ledger.findInterrupted();
        if (interrupted.isEmpty()) return;

        log.warn("Resuming {} task(s) interrupted by the last shutdown", interrupted.size());
        for (Task task : interrupted) {
            log.info("Resuming task {} from {}", task.getId(), task.getState());
            orchestrator.resume(task.getId());
        }
    }
}

package com.taskrelay.orchestrator.service;

import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Runs task drive loops on a fixed worker pool, at most one per task.
 *
 * A dispatch for a task that is already being driven does not start a second
 * loop. It marks the running one for another pass instead, so an event that
 * lands while a step executes is never lost and never runs concurrently with
 * that step.
 *
 * Different tasks run fully in parallel, bounded only by the pool size.
 */
@Component
public class TaskDispatcher {

    private static final Logger log = LoggerFactory.getLogger(TaskDispatcher.class);

    private enum Pass { RUNNING, RERUN }

    private final ConcurrentHashMap<UUID, Pass> active = new ConcurrentHashMap<>();
    private final Executor        workers;
    private final ExecutorService ownedPool;

    @Autowired
    public TaskDispatcher(@Value("${taskrelay.orchestrator.workers:4}") int workerCount) {
        this.ownedPool = Executors.newFixedThreadPool(workerCount);
        this.workers   = ownedPool;
        log.info("Task dispatcher started with {} workers", workerCount);
    }

    /** For tests: run loops on the given executor (e.g. {@code Runnable::run}). */
    public TaskDispatcher(Executor workers) {
        this.workers   = workers;
        this.ownedPool = null;
    }

    /**
     * Drive {@code taskId} with {@code driveLoop} on a worker thread.
     *
     * @return true if a new loop was started, false if the dispatch was folded
     *         into a loop already running for this task
     */
    public boolean dispatch(UUID taskId, Consumer<UUID> driveLoop) {
        Pass pass = active.compute(taskId, (id, current) -> current == null ? Pass.RUNNING : Pass.RERUN);
        if (pass == Pass.RERUN) {
            log.debug("Task {} is already being driven; scheduling another pass", taskId);
            return false;
        }
        try {
            workers.execute(() -> runLoop(taskId, driveLoop));
            return true;
        } catch (RejectedExecutionException e) {
            active.remove(taskId);
            log.error("Worker pool rejected task {}: {}", taskId, e.getMessage());
            throw e;
        }
    }

    /** Whether a loop for {@code taskId} is running or queued. */
    public boolean isActive(UUID taskId) {
        return active.containsKey(taskId);
    }

    private void runLoop(UUID taskId, Consumer<UUID> driveLoop) {
        Pass next;
        do {
            try {
                driveLoop.accept(taskId);
            } catch (Exception e) {
                log.error("Unhandled error driving task {}: {}", taskId, e.getMessage(), e);
            }
            next = active.compute(taskId, (id, current) -> current == Pass.RERUN ? Pass.RUNNING : null);
        } while (next != null);
    }

    @PreDestroy
    public void shutdown() throws InterruptedException {
        if (ownedPool == null) return;
        ownedPool.shutdown();
        if (!ownedPool.awaitTermination(30, TimeUnit.SECONDS)) {
            log.warn("Worker pool did not stop within 30 s; interrupting");
            ownedPool.shutdownNow();
        }
    }
}

package com.taskrelay.orchestrator.delegation;

import com.taskrelay.orchestrator.model.DelegateRef;
import com.taskrelay.orchestrator.model.FailureReason;
import com.taskrelay.orchestrator.model.StepName;
import com.taskrelay.orchestrator.model.StepOutcome;
import com.taskrelay.orchestrator.model.Subtask;
import com.taskrelay.orchestrator.repository.SubtaskRepository;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Turns "run this step elsewhere" into a subtask on a counterparty, and the
 * counterparty's answer back into a step outcome.
 *
 * The channel owns the correlation entries (subtasks table) and nothing else.
 * It never touches Task state: resolved outcomes leave as
 * {@link SubtaskResolvedEvent}s, which the orchestrator applies.
 *
 * Consuming an entry and applying its outcome share one transaction: if the
 * listener throws, the delete rolls back and a redelivery or the next sweep
 * finds the entry again.
 *
 * A counterparty may report before {@link #delegate} has saved the entry
 * (the report can race the createSubtask response). While a handoff is in
 * flight such reports are held in memory and replayed once the entry exists.
 *
 * <pre>
 *   taskrelay.delegation.subtasks{outcome="created|unreachable|completed|failed|timed_out|discarded|held|abandoned"}
 * </pre>
 */
@Service
public class DelegationChannel {

    private static final Logger log = LoggerFactory.getLogger(DelegationChannel.class);

    // Held reports older than this belong to no handoff and are dropped.
    private static final Duration EARLY_REPORT_RETENTION = Duration.ofMinutes(2);

    private record EarlyReport(StepOutcome outcome, Instant receivedAt) {}

    private final SubtaskRepository         subtaskRepo;
    private final CounterpartyClient        client;
    private final DelegationProperties      properties;
    private final ApplicationEventPublisher events;
    private final MeterRegistry             meterRegistry;
    private final TransactionTemplate       transactions;

    private final Map<String, EarlyReport> earlyReports     = new ConcurrentHashMap<>();
    private final AtomicInteger            handoffsInFlight = new AtomicInteger();

    public DelegationChannel(SubtaskRepository subtaskRepo,
                             CounterpartyClient client,
                             DelegationProperties properties,
                             ApplicationEventPublisher events,
                             MeterRegistry meterRegistry,
                             PlatformTransactionManager transactionManager) {
        this.subtaskRepo   = subtaskRepo;
        this.client        = client;
        this.properties    = properties;
        this.events        = events;
        this.meterRegistry = meterRegistry;
        this.transactions  = new TransactionTemplate(transactionManager);
    }

    // ------------------------------------------------------------------
    // Handoff
    // ------------------------------------------------------------------

    /**
     * Create a subtask on {@code counterparty} and start tracking it.
     *
     * Returns as soon as the counterparty has accepted the subtask; the result
     * arrives later through {@link #onSubtaskResult}. A result that arrived
     * before the entry was saved is forwarded here, before returning.
     *
     * @throws CounterpartyUnreachableException if the counterparty did not accept
     */
    public DelegateRef delegate(UUID taskId, StepName stepName, String input, Counterparty counterparty) {
        handoffsInFlight.incrementAndGet();
        try {
            String remoteId;
            try {
                remoteId = client.createSubtask(counterparty, stepName, input,
                        properties.callerIdentity(), properties.callbackUrl());
            } catch (CounterpartyException e) {
                count("unreachable");
                throw new CounterpartyUnreachableException(counterparty.agentId(), e);
            }

            Instant deadline = Instant.now().plus(properties.timeout());
            subtaskRepo.save(new Subtask(remoteId, counterparty.agentId(), counterparty.baseUrl(),
                    taskId, stepName, deadline));
            count("created");
            log.info("Task {} step '{}' delegated to {} as subtask {} (deadline {})",
                    taskId, stepName.wireName(), counterparty.agentId(), remoteId, deadline);

            EarlyReport early = earlyReports.remove(remoteId);
            if (early != null) {
                log.info("Replaying result for subtask {} received during handoff", remoteId);
                resolve(remoteId, early.outcome());
            }
            return new DelegateRef(counterparty.agentId(), remoteId);
        } finally {
            handoffsInFlight.decrementAndGet();
        }
    }

    // ------------------------------------------------------------------
    // Result delivery
    // ------------------------------------------------------------------

    /**
     * Consume the correlation entry for {@code remoteId} and forward the outcome.
     *
     * Duplicate or late deliveries (after a timeout or a cancellation) find no
     * entry and are discarded. If applying the outcome fails, the entry is
     * kept and the exception propagates.
     *
     * @return true if this call forwarded the outcome
     */
    public boolean onSubtaskResult(String remoteId, StepOutcome outcome) {
        if (handoffsInFlight.get() > 0 && subtaskRepo.findByRemoteId(remoteId).isEmpty()) {
            earlyReports.put(remoteId, new EarlyReport(outcome, Instant.now()));
            // The handoff may have saved its entry meanwhile; whoever removes the report forwards it.
            if (subtaskRepo.findByRemoteId(remoteId).isEmpty() || earlyReports.remove(remoteId) == null) {
                count("held");
                log.info("Holding result for subtask {} until its handoff completes", remoteId);
                return false;
            }
        }
        return resolve(remoteId, outcome);
    }

    /**
     * Record a non-terminal status report. The parent task's state is not
     * affected; the report only lands in its audit trail.
     *
     * @return false if the subtask is no longer tracked
     */
    public boolean onSubtaskProgress(String remoteId, String status, String message) {
        Optional<Subtask> entry = subtaskRepo.findByRemoteId(remoteId);
        if (entry.isEmpty()) {
            log.debug("Ignoring progress for untracked subtask {}", remoteId);
            return false;
        }
        Subtask subtask = entry.get();
        subtask.setStatus(status);
        subtaskRepo.save(subtask);
        events.publishEvent(new SubtaskProgressEvent(
                subtask.getParentTaskId(), remoteId, status, message));
        return true;
    }

    // ------------------------------------------------------------------
    // Timeouts and cancellation
    // ------------------------------------------------------------------

    /**
     * Fail every subtask whose deadline is before {@code now}.
     *
     * @return number of entries this sweep timed out
     */
    public int sweepExpired(Instant now) {
        earlyReports.values().removeIf(r -> r.receivedAt().plus(EARLY_REPORT_RETENTION).isBefore(now));

        List<Subtask> expired = subtaskRepo.findByDeadlineBefore(now);
        int timedOut = 0;
        for (Subtask subtask : expired) {
            log.warn("Subtask {} on {} passed its deadline {}",
                    subtask.getRemoteId(), subtask.getCounterpartyId(), subtask.getDeadline());
            try {
                boolean forwarded = resolve(subtask.getRemoteId(), StepOutcome.timedOut(
                        "Subtask " + subtask.getRemoteId() + " on " + subtask.getCounterpartyId()
                        + " did not report before " + subtask.getDeadline()));
                if (forwarded) timedOut++;
            } catch (RuntimeException e) {
                log.error("Could not time out subtask {}; retrying next sweep: {}",
                        subtask.getRemoteId(), e.getMessage(), e);
            }
        }
        return timedOut;
    }

    /**
     * Stop tracking every subtask of a task and tell the counterparties to
     * abandon them. Counterparty errors are logged, not raised: the task is
     * already failed locally and any late result will be discarded.
     *
     * @return number of subtasks abandoned
     */
    public int abandon(UUID taskId) {
        int abandoned = 0;
        for (Subtask subtask : subtaskRepo.findByParentTaskId(taskId)) {
            if (subtaskRepo.deleteByRemoteId(subtask.getRemoteId()) == 0) {
                continue;
            }
            abandoned++;
            count("abandoned");
            try {
                client.cancelSubtask(subtask.getCounterpartyUrl(), subtask.getRemoteId());
            } catch (CounterpartyException e) {
                log.warn("Could not tell {} to abandon subtask {}: {}",
                        subtask.getCounterpartyId(), subtask.getRemoteId(), e.getMessage());
            }
        }
        return abandoned;
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    /** Delete the entry and publish its outcome in one transaction. */
    private boolean resolve(String remoteId, StepOutcome outcome) {
        Boolean forwarded = transactions.execute(status -> {
            Optional<Subtask> entry = subtaskRepo.findByRemoteId(remoteId);
            if (entry.isEmpty() || subtaskRepo.deleteByRemoteId(remoteId) == 0) {
                count("discarded");
                log.info("Discarding result for subtask {}: no pending correlation entry", remoteId);
                return false;
            }

            Subtask subtask = entry.get();
            log.info("Subtask {} resolved for task {} step '{}': {}",
                    remoteId, subtask.getParentTaskId(), subtask.getParentStepName().wireName(),
                    outcome.success() ? "success" : outcome.failureReason());
            events.publishEvent(new SubtaskResolvedEvent(
                    subtask.getParentTaskId(), subtask.getParentStepName(), remoteId, outcome));
            count(outcomeTag(outcome));
            return true;
        });
        return Boolean.TRUE.equals(forwarded);
    }

    private void count(String outcome) {
        meterRegistry.counter("taskrelay.delegation.subtasks", "outcome", outcome).increment();
    }

    private static String outcomeTag(StepOutcome outcome) {
        if (outcome.success()) return "completed";
        return outcome.failureReason() == FailureReason.TIMED_OUT
                ? "timed_out" : "failed";
    }
}

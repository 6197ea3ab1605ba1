package com.taskrelay.orchestrator.delegation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Background tick that times out delegated steps whose counterparty never
 * answered.
 *
 * The deadlines live in the subtasks table, so a restart does not lose them:
 * the first tick after startup fails whatever expired while we were down.
 */
@Component
@EnableScheduling
public class DelegationTimeoutSweeper {

    private static final Logger log = LoggerFactory.getLogger(DelegationTimeoutSweeper.class);

    private final DelegationChannel channel;

    public DelegationTimeoutSweeper(DelegationChannel channel) {
        this.channel = channel;
    }

    @Scheduled(fixedDelayString = "${taskrelay.delegation.sweep-interval-ms:5000}")
    public void tick() {
        try {
            int timedOut = channel.sweepExpired(Instant.now());
            if (timedOut > 0) {
                log.info("Timed out {} delegated subtask(s)", timedOut);
            }
        } catch (Exception e) {
            // Next tick retries; expired entries stay in the table until consumed.
            log.error("Delegation timeout sweep failed: {}", e.getMessage(), e);
        }
    }
}

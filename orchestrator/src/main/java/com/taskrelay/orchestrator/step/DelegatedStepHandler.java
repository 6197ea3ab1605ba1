package com.taskrelay.orchestrator.step;

import com.taskrelay.orchestrator.delegation.Counterparty;

/**
 * A step that runs on another agent.
 *
 * The orchestrator hands these to the delegation channel instead of calling
 * {@link #execute}; the handler only names the counterparty to use.
 */
public interface DelegatedStepHandler extends StepHandler {

    Counterparty counterparty();

    @Override
    default StepResult execute(StepExecutionContext ctx) {
        throw new UnsupportedOperationException(
                manifest().name().wireName() + " is delegated to " + counterparty().agentId()
                + " and cannot run locally");
    }
}

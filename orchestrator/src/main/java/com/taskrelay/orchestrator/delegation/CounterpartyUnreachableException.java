package com.taskrelay.orchestrator.delegation;

/**
 * A step could not be handed off: no subtask exists on the counterparty.
 */
public class CounterpartyUnreachableException extends RuntimeException {

    private final String counterpartyId;

    public CounterpartyUnreachableException(String counterpartyId, Throwable cause) {
        super("Could not delegate to " + counterpartyId + ": " + cause.getMessage(), cause);
        this.counterpartyId = counterpartyId;
    }

    public String getCounterpartyId() { return counterpartyId; }
}

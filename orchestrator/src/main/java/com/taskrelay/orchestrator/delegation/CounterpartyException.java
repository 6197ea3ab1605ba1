package com.taskrelay.orchestrator.delegation;

/**
 * Thrown when a counterparty returns an error or is unreachable.
 */
public class CounterpartyException extends RuntimeException {

    public CounterpartyException(String message) {
        super(message);
    }

    public CounterpartyException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.taskrelay.orchestrator.delegation.dto;

import java.util.Arrays;
import java.util.Optional;

/**
 * Status values exchanged with counterparties, in their wire spelling.
 */
public enum SubtaskStatus {
    PENDING("Pending"),
    IN_PROGRESS("In_Progress"),
    COMPLETED("Completed"),
    FAILED("Failed");

    private final String wire;

    SubtaskStatus(String wire) {
        this.wire = wire;
    }

    public String wire() {
        return wire;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /** Lenient on case and underscores: "In_Progress", "IN_PROGRESS" and "InProgress" all match. */
    public static Optional<SubtaskStatus> fromWire(String value) {
        if (value == null) return Optional.empty();
        String v = value.replace("_", "");
        return Arrays.stream(values())
                .filter(s -> s.wire.replace("_", "").equalsIgnoreCase(v))
                .findFirst();
    }
}

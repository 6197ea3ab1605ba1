package com.taskrelay.orchestrator.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * The closed set of steps a task plan can contain.
 *
 * Declaration order is execution order: a plan containing both steps always
 * translates first and synthesizes speech from the translation.
 */
public enum StepName {
    TRANSLATE("translate"),
    TEXT2SPEECH("text2speech");

    private final String wireName;

    StepName(String wireName) {
        this.wireName = wireName;
    }

    /** Name used on the counterparty protocol and in API responses. */
    public String wireName() {
        return wireName;
    }

    public static Optional<StepName> fromWire(String name) {
        return Arrays.stream(values())
                .filter(s -> s.wireName.equalsIgnoreCase(name))
                .findFirst();
    }
}

package com.taskrelay.orchestrator.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * What a caller can ask for when submitting a task.
 *
 * Each intent maps to exactly one planned step; the step registry turns a set
 * of intents into the ordered plan.
 */
public enum Intent {
    TRANSLATE("translate", StepName.TRANSLATE, ExecutionMode.LOCAL),
    TEXT2SPEECH_LOCAL("text2speech-local", StepName.TEXT2SPEECH, ExecutionMode.LOCAL),
    TEXT2SPEECH_DELEGATED("text2speech-delegated", StepName.TEXT2SPEECH, ExecutionMode.DELEGATED);

    private final String     token;
    private final StepName   step;
    private final ExecutionMode mode;

    Intent(String token, StepName step, ExecutionMode mode) {
        this.token = token;
        this.step  = step;
        this.mode  = mode;
    }

    public String        token() { return token; }
    public StepName      step()  { return step; }
    public ExecutionMode mode()  { return mode; }

    public static Optional<Intent> fromToken(String token) {
        if (token == null) return Optional.empty();
        String t = token.trim();
        return Arrays.stream(values())
                .filter(i -> i.token.equalsIgnoreCase(t))
                .findFirst();
    }
}

package com.taskrelay.orchestrator.step;

/**
 * Executes one named step of a task plan.
 *
 * Every handler is a Spring {@code @Component}; the {@link StepRegistry}
 * collects them at startup and routes by {@link StepManifest#name()} and
 * {@link StepManifest#mode()}.
 *
 * <p>LOCAL handlers do their work in {@link #execute}. DELEGATED handlers
 * implement {@link DelegatedStepHandler} instead and are never executed in
 * this JVM.
 */
public interface StepHandler {

    StepManifest manifest();

    /**
     * Run the step synchronously on the calling worker thread.
     *
     * Must be safe to call more than once for the same task and step: after
     * a restart an interrupted step is executed again.
     *
     * @throws StepException on a failure that should fail the task
     */
    StepResult execute(StepExecutionContext ctx) throws StepException;
}

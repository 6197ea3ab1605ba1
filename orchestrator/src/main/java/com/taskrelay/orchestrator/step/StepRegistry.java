package com.taskrelay.orchestrator.step;

import com.taskrelay.orchestrator.model.ExecutionMode;
import com.taskrelay.orchestrator.model.Intent;
import com.taskrelay.orchestrator.model.StepName;
import com.taskrelay.orchestrator.model.Task;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps step names to the handlers that run them.
 *
 * All {@link StepHandler} beans are collected once at startup into an
 * immutable table keyed by (name, mode); nothing registers or removes a
 * handler afterwards.
 *
 * <p>Key responsibilities:
 * <ol>
 *   <li>Plan resolution ({@link #resolve}): declared intent to ordered steps.</li>
 *   <li>Lookup ({@link #lookup}): which handler runs a planned step.</li>
 *   <li>Metrics-instrumented local execution ({@link #execute}).</li>
 * </ol>
 */
@Component
public class StepRegistry {

    private static final Logger log = LoggerFactory.getLogger(StepRegistry.class);

    private record StepKey(StepName name, ExecutionMode mode) {}

    private final Map<StepKey, StepHandler> handlers;
    private final MeterRegistry meterRegistry;

    public StepRegistry(List<StepHandler> allHandlers, MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        Map<StepKey, StepHandler> table = new HashMap<>();
        for (StepHandler handler : allHandlers) {
            StepManifest m = handler.manifest();
            StepHandler previous = table.put(new StepKey(m.name(), m.mode()), handler);
            if (previous != null) {
                throw new IllegalStateException("Two handlers registered for "
                        + m.name().wireName() + " [" + m.mode() + "]: "
                        + previous.getClass().getSimpleName() + ", "
                        + handler.getClass().getSimpleName());
            }
            log.info("Registered step '{}' v{} [{}]", m.name().wireName(), m.version(), m.mode());
        }
        this.handlers = Map.copyOf(table);
    }

    // ------------------------------------------------------------------
    // Resolution
    // ------------------------------------------------------------------

    public List<PlannedStep> resolve(Task task) {
        return resolve(task.getDeclaredIntent());
    }

    /**
     * Turn declared intent tokens into the minimal ordered plan.
     *
     * Steps come out in {@link StepName} order regardless of token order, and
     * repeated tokens collapse. No intent at all is a valid, empty plan.
     *
     * @throws UnknownStepException if a token is not a known intent, if one
     *         step is asked for in two execution modes, or if no handler is
     *         registered for a planned step
     */
    public List<PlannedStep> resolve(List<String> intentTokens) {
        Map<StepName, ExecutionMode> wanted = new EnumMap<>(StepName.class);
        for (String token : intentTokens) {
            Intent intent = Intent.fromToken(token).orElseThrow(() ->
                    new UnknownStepException("Unknown intent: '" + token + "'"));
            ExecutionMode existing = wanted.putIfAbsent(intent.step(), intent.mode());
            if (existing != null && existing != intent.mode()) {
                throw new UnknownStepException("Step '" + intent.step().wireName()
                        + "' requested both " + existing + " and " + intent.mode());
            }
        }

        // EnumMap iterates in declaration order, which is execution order.
        List<PlannedStep> plan = new ArrayList<>();
        wanted.forEach((name, mode) -> {
            lookup(name, mode);
            plan.add(new PlannedStep(name, mode));
        });
        return List.copyOf(plan);
    }

    // ------------------------------------------------------------------
    // Lookup
    // ------------------------------------------------------------------

    public StepHandler lookup(StepName name, ExecutionMode mode) {
        StepHandler handler = handlers.get(new StepKey(name, mode));
        if (handler == null) {
            throw new UnknownStepException(
                    "No handler registered for step '" + name.wireName() + "' [" + mode + "]");
        }
        return handler;
    }

    /** Manifests of every registered handler, sorted by step then mode. */
    public List<StepManifest> manifests() {
        return handlers.values().stream()
                .map(StepHandler::manifest)
                .sorted(Comparator.comparing(StepManifest::name).thenComparing(StepManifest::mode))
                .toList();
    }

    // ------------------------------------------------------------------
    // Metrics-instrumented execution
    // ------------------------------------------------------------------

    /**
     * Run a LOCAL handler with timing and call counting:
     * <pre>
     *   taskrelay.step.calls{step, status="success|handler_failure|publish_error"}
     *   taskrelay.step.duration{step, mode}
     * </pre>
     *
     * Anything other than a {@link StepException} escaping the handler is
     * wrapped as a HANDLER_FAILURE.
     */
    public StepResult execute(StepHandler handler, StepExecutionContext ctx) {
        String stepTag = handler.manifest().name().wireName();
        String modeTag = handler.manifest().mode().name().toLowerCase();

        Timer.Sample sample = Timer.start(meterRegistry);
        String status = "success";
        try {
            return handler.execute(ctx);
        } catch (StepException e) {
            status = e.getKind().name().toLowerCase();
            throw e;
        } catch (Exception e) {
            status = "handler_failure";
            throw new StepException(StepException.Kind.HANDLER_FAILURE,
                    "Unexpected error in step '" + stepTag + "': " + e.getMessage(), e);
        } finally {
            sample.stop(meterRegistry.timer("taskrelay.step.duration",
                    "step", stepTag, "mode", modeTag));
            meterRegistry.counter("taskrelay.step.calls",
                    "step", stepTag, "status", status).increment();
        }
    }
}

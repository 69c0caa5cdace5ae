package com.ryuqq.probe.testkit.contract;

import com.ryuqq.probe.core.model.ProbeResponse;
import com.ryuqq.probe.core.model.ProbeTarget;
import com.ryuqq.probe.core.spi.ProbeOperation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Scripted implementation of ProbeOperation for testing purposes.
 *
 * <p>Each invocation consumes the next step of a script: either a status code or an
 * exception to throw. Once the script runs out, the last step repeats, so
 * {@code respond(503)} means "always 503".</p>
 *
 * <p><strong>Features:</strong></p>
 * <ul>
 *   <li>Default script shared by all targets</li>
 *   <li>Per-target scripts that take precedence over the default script</li>
 *   <li>Invocation log (targets and per-attempt timeouts)</li>
 * </ul>
 *
 * <p>All methods are synchronized; one instance may back several sessions.</p>
 *
 * @author Probe Team
 * @since 1.0.0
 */
public class ScriptedProbeOperation implements ProbeOperation {

    private final List<Step> defaultScript = new ArrayList<>();
    private final Map<ProbeTarget, List<Step>> targetScripts = new HashMap<>();
    private final Map<ProbeTarget, Integer> cursors = new HashMap<>();
    private final List<ProbeTarget> invocations = new ArrayList<>();
    private long lastTimeoutMs = -1;

    /**
     * Appends status responses to the default script.
     *
     * @param statuses status codes returned in order
     * @return this operation
     */
    public synchronized ScriptedProbeOperation respond(int... statuses) {
        for (int status : statuses) {
            defaultScript.add(Step.status(status));
        }
        return this;
    }

    /**
     * Appends a thrown error to the default script.
     *
     * @param error the exception to throw
     * @return this operation
     */
    public synchronized ScriptedProbeOperation fail(Exception error) {
        defaultScript.add(Step.error(error));
        return this;
    }

    /**
     * Appends status responses to the script of one target.
     *
     * @param target target value (e.g., "/about")
     * @param statuses status codes returned in order
     * @return this operation
     */
    public synchronized ScriptedProbeOperation respondFor(String target, int... statuses) {
        List<Step> script = targetScripts.computeIfAbsent(ProbeTarget.of(target), key -> new ArrayList<>());
        for (int status : statuses) {
            script.add(Step.status(status));
        }
        return this;
    }

    /**
     * Appends a thrown error to the script of one target.
     *
     * @param target target value
     * @param error the exception to throw
     * @return this operation
     */
    public synchronized ScriptedProbeOperation failFor(String target, Exception error) {
        targetScripts.computeIfAbsent(ProbeTarget.of(target), key -> new ArrayList<>()).add(Step.error(error));
        return this;
    }

    @Override
    public synchronized ProbeResponse invoke(ProbeTarget target, long perAttemptTimeoutMs) throws Exception {
        if (target == null) {
            throw new IllegalArgumentException("target cannot be null");
        }
        invocations.add(target);
        lastTimeoutMs = perAttemptTimeoutMs;

        List<Step> script = targetScripts.getOrDefault(target, defaultScript);
        if (script.isEmpty()) {
            throw new IllegalStateException("No script for target: " + target);
        }
        int cursor = cursors.getOrDefault(target, 0);
        cursors.put(target, cursor + 1);

        Step step = script.get(Math.min(cursor, script.size() - 1));
        if (step.error != null) {
            throw step.error;
        }
        return ProbeResponse.of(step.status);
    }

    public synchronized int invocationCount() {
        return invocations.size();
    }

    public synchronized int invocationCount(String target) {
        ProbeTarget probeTarget = ProbeTarget.of(target);
        return (int) invocations.stream().filter(probeTarget::equals).count();
    }

    public synchronized List<ProbeTarget> invokedTargets() {
        return Collections.unmodifiableList(new ArrayList<>(invocations));
    }

    /**
     * @return the per-attempt timeout passed to the latest invocation, or -1 if never invoked
     */
    public synchronized long lastTimeoutMs() {
        return lastTimeoutMs;
    }

    private static final class Step {
        private final int status;
        private final Exception error;

        private Step(int status, Exception error) {
            this.status = status;
            this.error = error;
        }

        static Step status(int status) {
            return new Step(status, null);
        }

        static Step error(Exception error) {
            if (error == null) {
                throw new IllegalArgumentException("error cannot be null");
            }
            return new Step(0, error);
        }
    }
}

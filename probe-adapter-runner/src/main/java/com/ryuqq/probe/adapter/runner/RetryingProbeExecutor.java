package com.ryuqq.probe.adapter.runner;

import com.ryuqq.probe.core.backoff.LinearBackoffScheduler;
import com.ryuqq.probe.core.executor.ProbeExecutor;
import com.ryuqq.probe.core.model.ProbeResponse;
import com.ryuqq.probe.core.model.ProbeResult;
import com.ryuqq.probe.core.model.ProbeTarget;
import com.ryuqq.probe.core.model.RetryPolicy;
import com.ryuqq.probe.core.outcome.Aborted;
import com.ryuqq.probe.core.outcome.AttemptResult;
import com.ryuqq.probe.core.outcome.OutcomeClassifier;
import com.ryuqq.probe.core.outcome.ProbeOutcome;
import com.ryuqq.probe.core.outcome.Success;
import com.ryuqq.probe.core.outcome.TerminalFailure;
import com.ryuqq.probe.core.spi.ProbeOperation;
import com.ryuqq.probe.core.spi.Sleeper;
import com.ryuqq.probe.core.spi.WaitAbortedException;
import com.ryuqq.probe.core.statemachine.ExecutionPhase;
import com.ryuqq.probe.core.statemachine.ExecutionState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 시간 예산 기반 재시도 실행자.
 *
 * <p>Operation을 최대 maxAttempts번 호출하며, 시도 사이에는 선형 백오프로 대기합니다.
 * 대기 시간의 총합은 maxTotalWaitMs를 넘지 않습니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * for attemptIndex in 0..maxAttempts-1:
 *   1. (재시도인 경우) 대기 예산 소진 시 → EXHAUSTED
 *   2. ATTEMPTING: operation.invoke(target, perAttemptTimeoutMs), attemptsMade++
 *   3. classify(attemptResult)
 *      - Success → SUCCESS
 *      - TerminalFailure → TERMINAL_FAILURE ("Received status N")
 *      - TransientFailure:
 *          a. 마지막 시도였거나 delay ≤ 0 → EXHAUSTED
 *          b. WAITING: sleeper.pause(delay)
 *             - WaitAbortedException → ABORTED (더 이상 시도하지 않음)
 *             - 완료 → totalWaitedMs += delay
 * </pre>
 *
 * <p><strong>예외 정책:</strong> Operation이 던진 예외는 모두 재시도 가능한 실패로 분류되며,
 * 어떤 종료 경로에서도 예외를 던지지 않고 {@link ProbeResult}를 반환합니다.</p>
 *
 * <p><strong>동시성:</strong> 인스턴스는 상태를 갖지 않습니다. 호출별 상태는
 * {@link ExecutionState}로 호출 안에서만 존재합니다. 다만 Operation과 Sleeper를
 * 동시에 사용해도 안전한지는 구현체에 달려 있습니다.</p>
 *
 * @author Probe Team
 * @since 1.0.0
 */
public final class RetryingProbeExecutor implements ProbeExecutor {

    private static final Logger log = LoggerFactory.getLogger(RetryingProbeExecutor.class);

    static final String EXHAUSTED_MESSAGE = "Navigation failed after all attempts";

    private final ProbeOperation operation;
    private final Sleeper sleeper;
    private final OutcomeClassifier classifier;
    private final LinearBackoffScheduler scheduler;

    /**
     * 생성자 (기본 분류기와 스케줄러).
     *
     * @param operation 프로브 Operation
     * @param sleeper 대기 프리미티브
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public RetryingProbeExecutor(ProbeOperation operation, Sleeper sleeper) {
        this(operation, sleeper, new OutcomeClassifier(), new LinearBackoffScheduler());
    }

    /**
     * 생성자.
     *
     * @param operation 프로브 Operation
     * @param sleeper 대기 프리미티브
     * @param classifier Outcome 분류기
     * @param scheduler 백오프 스케줄러
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public RetryingProbeExecutor(ProbeOperation operation, Sleeper sleeper,
                                 OutcomeClassifier classifier, LinearBackoffScheduler scheduler) {
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        if (sleeper == null) {
            throw new IllegalArgumentException("sleeper cannot be null");
        }
        if (classifier == null) {
            throw new IllegalArgumentException("classifier cannot be null");
        }
        if (scheduler == null) {
            throw new IllegalArgumentException("scheduler cannot be null");
        }
        this.operation = operation;
        this.sleeper = sleeper;
        this.classifier = classifier;
        this.scheduler = scheduler;
    }

    @Override
    public ProbeResult execute(ProbeTarget target, RetryPolicy policy) {
        if (target == null) {
            throw new IllegalArgumentException("target cannot be null");
        }
        if (policy == null) {
            throw new IllegalArgumentException("policy cannot be null");
        }

        ExecutionState state = new ExecutionState(policy.maxAttempts(), policy.maxTotalWaitMs());

        for (int attemptIndex = 0; attemptIndex < policy.maxAttempts(); attemptIndex++) {
            if (attemptIndex > 0 && !state.hasWaitBudget()) {
                state.moveTo(ExecutionPhase.EXHAUSTED);
                return exhausted(target, state);
            }

            state.beginAttempt();
            ProbeOutcome outcome = classifier.classify(attempt(target, policy));
            state.record(outcome);
            log.debug("Probe {} attempt {}/{} → {}", target, state.attemptsMade(), policy.maxAttempts(), outcome);

            if (outcome.isTerminal()) {
                return settle(outcome, state);
            }

            // TransientFailure
            long delay = scheduler.computeDelay(attemptIndex, policy, state.totalWaitedMs());
            if (!state.hasAttemptsLeft() || delay <= 0) {
                state.moveTo(ExecutionPhase.EXHAUSTED);
                return exhausted(target, state);
            }

            state.moveTo(ExecutionPhase.WAITING);
            log.debug("Probe {} waiting {}ms before retry (waited so far: {}ms)", target, delay, state.totalWaitedMs());
            try {
                sleeper.pause(delay);
            } catch (WaitAbortedException e) {
                state.moveTo(ExecutionPhase.ABORTED);
                Aborted aborted = new Aborted("Retry wait aborted: " + describe(e));
                state.record(aborted);
                log.warn("Probe {} aborted after {} attempt(s): {}", target, state.attemptsMade(), e.getMessage());
                return ProbeResult.failure(state.lastStatus(), state.attemptsMade(), aborted.errorMessage());
            }
            state.addWaited(delay);
        }

        // maxAttempts 루프 종료는 위의 hasAttemptsLeft 검사로 처리되므로 도달하지 않음
        state.moveTo(ExecutionPhase.EXHAUSTED);
        return exhausted(target, state);
    }

    /**
     * Operation 한 번 호출.
     *
     * <p>InterruptedException은 인터럽트 플래그를 복원한 뒤 실패로 기록합니다.
     * 다음 대기에서 Sleeper가 인터럽트를 감지해 중단하게 됩니다.</p>
     */
    private AttemptResult attempt(ProbeTarget target, RetryPolicy policy) {
        try {
            ProbeResponse response = operation.invoke(target, policy.perAttemptTimeoutMs());
            if (response == null) {
                return AttemptResult.threw(new IllegalStateException("Operation returned no response"));
            }
            return AttemptResult.responded(response);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return AttemptResult.threw(e);
        } catch (Exception e) {
            return AttemptResult.threw(e);
        }
    }

    private static ProbeResult settle(ProbeOutcome outcome, ExecutionState state) {
        if (outcome.isSuccess()) {
            state.moveTo(ExecutionPhase.SUCCESS);
            return ProbeResult.success(((Success) outcome).status(), state.attemptsMade());
        }
        TerminalFailure terminal = (TerminalFailure) outcome;
        state.moveTo(ExecutionPhase.TERMINAL_FAILURE);
        return ProbeResult.failure(terminal.status(), state.attemptsMade(), terminal.errorMessage());
    }

    private ProbeResult exhausted(ProbeTarget target, ExecutionState state) {
        String error = state.lastErrorMessage() != null ? state.lastErrorMessage() : EXHAUSTED_MESSAGE;
        log.debug("Probe {} exhausted after {} attempt(s), waited {}ms", target, state.attemptsMade(), state.totalWaitedMs());
        return ProbeResult.failure(state.lastStatus(), state.attemptsMade(), error);
    }

    private static String describe(WaitAbortedException e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}

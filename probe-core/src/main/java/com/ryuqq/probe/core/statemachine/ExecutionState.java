package com.ryuqq.probe.core.statemachine;

import com.ryuqq.probe.core.outcome.ProbeOutcome;
import com.ryuqq.probe.core.outcome.Success;
import com.ryuqq.probe.core.outcome.TerminalFailure;
import com.ryuqq.probe.core.outcome.TransientFailure;

/**
 * 한 번의 execute 호출 동안만 존재하는 실행 상태.
 *
 * <p>호출 시작 시 생성되고 호출이 반환되면 버려집니다.
 * 동시 호출 간에 공유되지 않으므로 동기화하지 않습니다 (thread-safe 아님).</p>
 *
 * @author Probe Team
 * @since 1.0.0
 */
public final class ExecutionState {

    private final int maxAttempts;
    private final long maxTotalWaitMs;

    private ExecutionPhase phase = ExecutionPhase.READY;
    private int attemptsMade;
    private long totalWaitedMs;
    private ProbeOutcome lastOutcome;
    private Integer lastStatus;
    private String lastErrorMessage;

    /**
     * 생성자.
     *
     * @param maxAttempts 최대 시도 횟수
     * @param maxTotalWaitMs 총 대기 예산 (밀리초)
     */
    public ExecutionState(int maxAttempts, long maxTotalWaitMs) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be positive (current: " + maxAttempts + ")");
        }
        if (maxTotalWaitMs < 0) {
            throw new IllegalArgumentException("maxTotalWaitMs must be non-negative (current: " + maxTotalWaitMs + ")");
        }
        this.maxAttempts = maxAttempts;
        this.maxTotalWaitMs = maxTotalWaitMs;
    }

    /**
     * 새 시도 시작 (ATTEMPTING 진입, attemptsMade 증가).
     *
     * @throws IllegalStateException 시도 횟수를 초과하거나 유효하지 않은 전이인 경우
     */
    public void beginAttempt() {
        if (attemptsMade >= maxAttempts) {
            throw new IllegalStateException(
                "attemptsMade cannot exceed maxAttempts (" + maxAttempts + ")"
            );
        }
        phase = PhaseTransition.transition(phase, ExecutionPhase.ATTEMPTING);
        attemptsMade++;
    }

    /**
     * 분류된 Outcome 기록.
     *
     * <p>상태 코드가 있는 Outcome이면 lastStatus를, 예외 기반 실패면 lastErrorMessage를 갱신합니다.</p>
     *
     * @param outcome 분류 결과
     */
    public void record(ProbeOutcome outcome) {
        if (outcome == null) {
            throw new IllegalArgumentException("outcome cannot be null");
        }
        lastOutcome = outcome;
        if (outcome instanceof Success success) {
            lastStatus = success.status();
        } else if (outcome instanceof TerminalFailure terminal) {
            lastStatus = terminal.status();
        } else if (outcome instanceof TransientFailure transientFailure) {
            if (transientFailure.isThrown()) {
                lastErrorMessage = transientFailure.errorMessage();
            } else {
                lastStatus = transientFailure.status();
            }
        }
    }

    /**
     * 대기 완료 기록.
     *
     * @param waitedMs 대기한 시간 (밀리초)
     * @throws IllegalStateException 총 대기 예산을 넘는 경우
     */
    public void addWaited(long waitedMs) {
        if (waitedMs < 0) {
            throw new IllegalArgumentException("waitedMs must be non-negative (current: " + waitedMs + ")");
        }
        if (totalWaitedMs + waitedMs > maxTotalWaitMs) {
            throw new IllegalStateException(
                "totalWaitedMs cannot exceed maxTotalWaitMs (" + maxTotalWaitMs + ")"
            );
        }
        totalWaitedMs += waitedMs;
    }

    /**
     * 다음 단계로 전이.
     *
     * @param next 다음 단계
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public void moveTo(ExecutionPhase next) {
        phase = PhaseTransition.transition(phase, next);
    }

    /**
     * 예산이 남아 있는지 확인.
     *
     * @return totalWaitedMs가 maxTotalWaitMs 미만이면 true
     */
    public boolean hasWaitBudget() {
        return totalWaitedMs < maxTotalWaitMs;
    }

    /**
     * 시도 횟수가 남아 있는지 확인.
     *
     * @return attemptsMade가 maxAttempts 미만이면 true
     */
    public boolean hasAttemptsLeft() {
        return attemptsMade < maxAttempts;
    }

    public ExecutionPhase phase() {
        return phase;
    }

    public int attemptsMade() {
        return attemptsMade;
    }

    public long totalWaitedMs() {
        return totalWaitedMs;
    }

    public ProbeOutcome lastOutcome() {
        return lastOutcome;
    }

    public Integer lastStatus() {
        return lastStatus;
    }

    public String lastErrorMessage() {
        return lastErrorMessage;
    }

    public boolean isAborted() {
        return phase == ExecutionPhase.ABORTED;
    }
}

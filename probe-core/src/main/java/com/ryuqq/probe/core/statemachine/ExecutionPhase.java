package com.ryuqq.probe.core.statemachine;

/**
 * 한 번의 execute 호출이 거치는 단계.
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * READY
 *    │
 *    ▼
 * ATTEMPTING ◄──────────┐
 *    │                  │
 *    ├─► SUCCESS        │
 *    ├─► TERMINAL_FAILURE
 *    ├─► EXHAUSTED      │
 *    └─► WAITING ───────┘
 *           │
 *           ├─► ABORTED
 *           └─► EXHAUSTED
 * </pre>
 *
 * <p>SUCCESS, TERMINAL_FAILURE, EXHAUSTED, ABORTED는 종료 상태입니다.</p>
 *
 * @author Probe Team
 * @since 1.0.0
 */
public enum ExecutionPhase {

    /**
     * 아직 첫 시도 전.
     */
    READY,

    /**
     * Operation 호출 중.
     */
    ATTEMPTING,

    /**
     * 다음 시도 전 대기 중.
     */
    WAITING,

    /**
     * 성공 (종료).
     */
    SUCCESS,

    /**
     * 확정적 거절 (종료).
     */
    TERMINAL_FAILURE,

    /**
     * 시도 횟수 또는 대기 예산 소진 (종료).
     */
    EXHAUSTED,

    /**
     * 대기 중 중단 (종료).
     */
    ABORTED;

    /**
     * 종료 상태인지 확인.
     *
     * @return SUCCESS, TERMINAL_FAILURE, EXHAUSTED, ABORTED인 경우 true
     */
    public boolean isTerminal() {
        return this == SUCCESS || this == TERMINAL_FAILURE || this == EXHAUSTED || this == ABORTED;
    }
}

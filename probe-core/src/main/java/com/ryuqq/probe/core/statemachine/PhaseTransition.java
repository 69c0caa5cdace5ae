package com.ryuqq.probe.core.statemachine;

/**
 * 단계 전이 검증 및 실행.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>READY → ATTEMPTING</li>
 *   <li>ATTEMPTING → SUCCESS, TERMINAL_FAILURE, EXHAUSTED, WAITING</li>
 *   <li>WAITING → ATTEMPTING, ABORTED, EXHAUSTED</li>
 * </ul>
 *
 * <p><strong>불변식:</strong> 종료 상태에서는 어떤 상태로도 전이 불가</p>
 *
 * @author Probe Team
 * @since 1.0.0
 */
public final class PhaseTransition {

    private PhaseTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 전이가 유효한지 검증.
     *
     * @param from 현재 단계
     * @param to 전이할 단계
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(ExecutionPhase from, ExecutionPhase to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("Phases cannot be null (from: " + from + ", to: " + to + ")");
        }

        if (from.isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot transition from terminal phase: %s → %s", from, to)
            );
        }

        boolean valid = switch (from) {
            case READY -> to == ExecutionPhase.ATTEMPTING;
            case ATTEMPTING -> to == ExecutionPhase.SUCCESS
                || to == ExecutionPhase.TERMINAL_FAILURE
                || to == ExecutionPhase.EXHAUSTED
                || to == ExecutionPhase.WAITING;
            case WAITING -> to == ExecutionPhase.ATTEMPTING
                || to == ExecutionPhase.ABORTED
                || to == ExecutionPhase.EXHAUSTED;
            case SUCCESS, TERMINAL_FAILURE, EXHAUSTED, ABORTED -> false;
        };

        if (!valid) {
            throw new IllegalStateException(
                String.format("Invalid phase transition: %s → %s", from, to)
            );
        }
    }

    /**
     * 전이 실행 (검증 후).
     *
     * @param current 현재 단계
     * @param next 다음 단계
     * @return 전이된 단계 (next)
     * @throws IllegalArgumentException current 또는 next가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static ExecutionPhase transition(ExecutionPhase current, ExecutionPhase next) {
        validate(current, next);
        return next;
    }
}

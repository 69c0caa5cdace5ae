package com.ryuqq.probe.core.outcome;

/**
 * 한 번의 시도(또는 대기)에 대한 분류 결과.
 *
 * <p>ProbeOutcome은 네 가지 가능한 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Success}: 지정된 성공 코드(200) 수신</li>
 *   <li>{@link TerminalFailure}: 확정적 거절 (3xx/4xx), 재시도 불가</li>
 *   <li>{@link TransientFailure}: 5xx 또는 예외, 재시도 가능</li>
 *   <li>{@link Aborted}: 재시도 대기 중 실행 컨텍스트가 해제됨</li>
 * </ul>
 *
 * <p>Sealed interface로 정의되어 모든 케이스가 컴파일 타임에 알려집니다.</p>
 *
 * @author Probe Team
 * @since 1.0.0
 */
public sealed interface ProbeOutcome permits Success, TerminalFailure, TransientFailure, Aborted {

    /**
     * 성공인지 확인.
     *
     * @return 성공 여부
     */
    default boolean isSuccess() {
        return this instanceof Success;
    }

    /**
     * 재시도 가능한 실패인지 확인.
     *
     * @return 재시도 가능 여부
     */
    default boolean isRetryable() {
        return this instanceof TransientFailure;
    }

    /**
     * 더 이상 시도하지 않아야 하는 결과인지 확인.
     *
     * <p>Success, TerminalFailure, Aborted는 루프를 즉시 종료시킵니다.</p>
     *
     * @return 종료 결과 여부
     */
    default boolean isTerminal() {
        return !isRetryable();
    }
}

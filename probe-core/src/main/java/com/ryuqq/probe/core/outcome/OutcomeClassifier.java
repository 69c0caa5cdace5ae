package com.ryuqq.probe.core.outcome;

/**
 * Outcome 분류기: 시도 결과를 {@link ProbeOutcome}으로 매핑합니다.
 *
 * <p><strong>분류 규칙:</strong></p>
 * <ul>
 *   <li>200 → {@link Success}</li>
 *   <li>500 이상 → {@link TransientFailure} (워밍업, 과부하는 일시적일 수 있음)</li>
 *   <li>그 외 상태 코드 (3xx, 4xx 등) → {@link TerminalFailure}</li>
 *   <li>예외 → {@link TransientFailure} (예외 종류는 구분하지 않음)</li>
 * </ul>
 *
 * <p>부수 효과 없는 순수 함수이므로 여러 스레드에서 공유해도 안전합니다.</p>
 *
 * @author Probe Team
 * @since 1.0.0
 */
public final class OutcomeClassifier {

    /**
     * 성공으로 간주하는 상태 코드.
     */
    public static final int SUCCESS_STATUS = 200;

    /**
     * 이 값 이상이면 서버 오류로 간주.
     */
    public static final int SERVER_ERROR_THRESHOLD = 500;

    /**
     * 시도 결과 분류.
     *
     * @param attemptResult 시도 결과
     * @return 분류된 Outcome (Success, TerminalFailure, TransientFailure)
     * @throws IllegalArgumentException attemptResult가 null인 경우
     */
    public ProbeOutcome classify(AttemptResult attemptResult) {
        if (attemptResult == null) {
            throw new IllegalArgumentException("attemptResult cannot be null");
        }
        if (!attemptResult.hasStatus()) {
            return new TransientFailure(null, describe(attemptResult.error()));
        }

        int status = attemptResult.statusCode();
        if (status == SUCCESS_STATUS) {
            return new Success(status);
        }
        if (status >= SERVER_ERROR_THRESHOLD) {
            return new TransientFailure(status, "Received status " + status);
        }
        return new TerminalFailure(status);
    }

    private static String describe(Exception error) {
        String message = error.getMessage();
        if (message == null || message.isBlank()) {
            return error.getClass().getSimpleName();
        }
        return message;
    }
}

package com.ryuqq.probe.core.outcome;

/**
 * 재시도 가능한 일시적 실패.
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>서버 워밍업 중 500/503 응답</li>
 *   <li>연결 거부, 타임아웃 등 응답 없이 발생한 예외</li>
 * </ul>
 *
 * @author Probe Team
 * @since 1.0.0
 * @param status 상태 코드 (예외로 실패한 경우 null)
 * @param errorMessage 오류 메시지
 */
public record TransientFailure(Integer status, String errorMessage) implements ProbeOutcome {

    public TransientFailure {
        if (errorMessage == null || errorMessage.isBlank()) {
            throw new IllegalArgumentException("errorMessage cannot be null or blank");
        }
    }

    /**
     * 응답 없이 예외로 실패했는지 확인.
     *
     * @return status가 null이면 true
     */
    public boolean isThrown() {
        return status == null;
    }
}

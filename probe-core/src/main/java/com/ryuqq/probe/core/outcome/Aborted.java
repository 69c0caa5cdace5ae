package com.ryuqq.probe.core.outcome;

/**
 * 재시도 대기 중 중단됨.
 *
 * <p>대기 도중 실행 컨텍스트가 외부에서 해제된 경우입니다 (예: 전체 실행 종료).
 * Operation은 다시 호출되지 않습니다.</p>
 *
 * @author Probe Team
 * @since 1.0.0
 * @param errorMessage 중단 사유
 */
public record Aborted(String errorMessage) implements ProbeOutcome {

    public Aborted {
        if (errorMessage == null || errorMessage.isBlank()) {
            throw new IllegalArgumentException("errorMessage cannot be null or blank");
        }
    }
}

package com.ryuqq.probe.core.outcome;

/**
 * 영구적 실패 (재시도 불가).
 *
 * <p>리다이렉트나 클라이언트 오류처럼 확정적인 응답을 받은 경우입니다.
 * 남은 시도 횟수나 예산과 무관하게 즉시 종료합니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>301/302 리다이렉트</li>
 *   <li>403 Forbidden</li>
 *   <li>404 Not Found</li>
 * </ul>
 *
 * @author Probe Team
 * @since 1.0.0
 * @param status 상태 코드
 */
public record TerminalFailure(int status) implements ProbeOutcome {

    /**
     * 사용자에게 보여줄 진단 메시지.
     *
     * @return "Received status &lt;status&gt;"
     */
    public String errorMessage() {
        return "Received status " + status;
    }
}

package com.ryuqq.probe.core.model;

/**
 * 한 번의 프로브 실행 결과 (불변).
 *
 * <p>Retry Executor의 모든 종료 경로(성공, 영구 실패, 재시도 소진, 중단)는
 * 예외 대신 이 값으로 변환됩니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>succeeded=true이면 error는 null</li>
 *   <li>succeeded=false이면 error는 null이 아님</li>
 *   <li>attempts는 0 이상</li>
 * </ul>
 *
 * @author Probe Team
 * @since 1.0.0
 * @param succeeded 성공 여부 (마지막 Outcome이 Success인 경우에만 true)
 * @param status 마지막으로 관측한 상태 코드 (응답이 없었으면 null)
 * @param attempts Operation 호출 횟수
 * @param error 진단 메시지 (성공 시 null)
 */
public record ProbeResult(
    boolean succeeded,
    Integer status,
    int attempts,
    String error
) {

    public ProbeResult {
        if (attempts < 0) {
            throw new IllegalArgumentException("attempts must be non-negative (current: " + attempts + ")");
        }
        if (succeeded && error != null) {
            throw new IllegalArgumentException("error must be null for a succeeded result");
        }
        if (!succeeded && (error == null || error.isBlank())) {
            throw new IllegalArgumentException("error cannot be null or blank for a failed result");
        }
    }

    /**
     * 성공 결과 생성.
     *
     * @param status 상태 코드
     * @param attempts 시도 횟수
     * @return 성공 ProbeResult
     */
    public static ProbeResult success(int status, int attempts) {
        return new ProbeResult(true, status, attempts, null);
    }

    /**
     * 실패 결과 생성.
     *
     * @param status 마지막 상태 코드 (null 가능)
     * @param attempts 시도 횟수
     * @param error 진단 메시지
     * @return 실패 ProbeResult
     */
    public static ProbeResult failure(Integer status, int attempts, String error) {
        return new ProbeResult(false, status, attempts, error);
    }
}

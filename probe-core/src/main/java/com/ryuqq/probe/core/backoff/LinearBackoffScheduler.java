package com.ryuqq.probe.core.backoff;

import com.ryuqq.probe.core.model.RetryPolicy;

/**
 * 시간 예산 기반 선형 백오프 계산기.
 *
 * <p>재시도 간격을 시도 순번에 비례해 선형으로 늘리되,
 * 남은 대기 예산을 넘지 않도록 제한합니다.</p>
 *
 * <p><strong>알고리즘:</strong></p>
 * <pre>
 * delay = min(initialDelayMs * (attemptIndex + 1), maxTotalWaitMs - totalWaitedSoFar)
 * </pre>
 *
 * <p><strong>예시 (initialDelayMs=1000, maxTotalWaitMs=2500):</strong></p>
 * <ul>
 *   <li>attemptIndex=0, waited=0: 1000ms</li>
 *   <li>attemptIndex=1, waited=1000: 1500ms (2000ms가 남은 예산 1500ms로 제한됨)</li>
 *   <li>attemptIndex=2, waited=2500: 0ms (예산 소진)</li>
 * </ul>
 *
 * <p>결과가 0 이하이면 호출자는 대기 없이 재시도를 중단해야 합니다.</p>
 *
 * @author Probe Team
 * @since 1.0.0
 */
public final class LinearBackoffScheduler {

    /**
     * 다음 대기 시간 계산.
     *
     * @param attemptIndex 방금 끝난 시도의 순번 (0부터 시작)
     * @param policy 재시도 정책
     * @param totalWaitedSoFar 지금까지 대기한 총 시간 (밀리초)
     * @return 대기 시간 (밀리초), 0 이하이면 남은 예산 없음
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public long computeDelay(int attemptIndex, RetryPolicy policy, long totalWaitedSoFar) {
        if (attemptIndex < 0) {
            throw new IllegalArgumentException(
                "attemptIndex must be non-negative (current: " + attemptIndex + ")"
            );
        }
        if (policy == null) {
            throw new IllegalArgumentException("policy cannot be null");
        }
        if (totalWaitedSoFar < 0) {
            throw new IllegalArgumentException(
                "totalWaitedSoFar must be non-negative (current: " + totalWaitedSoFar + ")"
            );
        }

        long linear = linearDelay(policy.initialDelayMs(), attemptIndex);
        long remaining = policy.maxTotalWaitMs() - totalWaitedSoFar;
        return Math.min(linear, remaining);
    }

    // 오버플로 시 Long.MAX_VALUE로 포화
    private static long linearDelay(long initialDelayMs, int attemptIndex) {
        try {
            return Math.multiplyExact(initialDelayMs, attemptIndex + 1L);
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }
}

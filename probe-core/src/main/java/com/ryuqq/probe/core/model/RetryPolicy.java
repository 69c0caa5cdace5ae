package com.ryuqq.probe.core.model;

/**
 * 재시도 정책 (불변 record).
 *
 * <p>하나의 정책 인스턴스는 여러 호출에서 읽기 전용으로 공유됩니다.</p>
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>maxAttempts: 최대 시도 횟수 (기본 3)</li>
 *   <li>initialDelayMs: 선형 백오프의 기본 지연 (기본 1000ms)</li>
 *   <li>maxTotalWaitMs: 시도 사이 대기 시간의 총합 상한 (기본 30000ms)</li>
 *   <li>perAttemptTimeoutMs: 시도당 타임아웃 (기본 15000ms, 0은 타임아웃 없음)</li>
 * </ul>
 *
 * <p><strong>프리셋:</strong></p>
 * <ul>
 *   <li>{@link #ci()}: 3회, 2000ms, 25000ms, 15000ms (CI 환경의 느린 워밍업)</li>
 *   <li>{@link #local()}: 2회, 500ms, 10000ms, 10000ms (로컬 개발 환경)</li>
 * </ul>
 *
 * <p>maxTotalWaitMs는 시도 사이의 대기만 제한하며 시도 자체의 실행 시간은 포함하지 않습니다.
 * 두 예산은 서로 독립적입니다.</p>
 *
 * @author Probe Team
 * @since 1.0.0
 * @param maxAttempts 최대 시도 횟수 (1 이상)
 * @param initialDelayMs 기본 지연 시간 (밀리초, 0 이상)
 * @param maxTotalWaitMs 총 대기 예산 (밀리초, 0 이상)
 * @param perAttemptTimeoutMs 시도당 타임아웃 (밀리초, 0 이상)
 */
public record RetryPolicy(
    int maxAttempts,
    long initialDelayMs,
    long maxTotalWaitMs,
    long perAttemptTimeoutMs
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: maxAttempts=3, initialDelayMs=1000ms, maxTotalWaitMs=30000ms,
     * perAttemptTimeoutMs=15000ms</p>
     */
    public RetryPolicy() {
        this(3, 1000, 30000, 15000);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException(
                "maxAttempts must be positive (current: " + maxAttempts + ")"
            );
        }
        if (initialDelayMs < 0) {
            throw new IllegalArgumentException(
                "initialDelayMs must be non-negative (current: " + initialDelayMs + ")"
            );
        }
        if (maxTotalWaitMs < 0) {
            throw new IllegalArgumentException(
                "maxTotalWaitMs must be non-negative (current: " + maxTotalWaitMs + ")"
            );
        }
        if (perAttemptTimeoutMs < 0) {
            throw new IllegalArgumentException(
                "perAttemptTimeoutMs must be non-negative (current: " + perAttemptTimeoutMs + ")"
            );
        }
    }

    /**
     * 기본 정책.
     *
     * @return maxAttempts=3, initialDelayMs=1000, maxTotalWaitMs=30000, perAttemptTimeoutMs=15000
     */
    public static RetryPolicy defaults() {
        return new RetryPolicy();
    }

    /**
     * CI 프로파일.
     *
     * @return maxAttempts=3, initialDelayMs=2000, maxTotalWaitMs=25000, perAttemptTimeoutMs=15000
     */
    public static RetryPolicy ci() {
        return new RetryPolicy(3, 2000, 25000, 15000);
    }

    /**
     * 로컬 프로파일.
     *
     * @return maxAttempts=2, initialDelayMs=500, maxTotalWaitMs=10000, perAttemptTimeoutMs=10000
     */
    public static RetryPolicy local() {
        return new RetryPolicy(2, 500, 10000, 10000);
    }


    /**
     * maxAttempts만 변경한 새 인스턴스 생성.
     */
    public RetryPolicy withMaxAttempts(int maxAttempts) {
        return new RetryPolicy(maxAttempts, initialDelayMs, maxTotalWaitMs, perAttemptTimeoutMs);
    }

    /**
     * initialDelayMs만 변경한 새 인스턴스 생성.
     */
    public RetryPolicy withInitialDelayMs(long initialDelayMs) {
        return new RetryPolicy(maxAttempts, initialDelayMs, maxTotalWaitMs, perAttemptTimeoutMs);
    }

    /**
     * maxTotalWaitMs만 변경한 새 인스턴스 생성.
     */
    public RetryPolicy withMaxTotalWaitMs(long maxTotalWaitMs) {
        return new RetryPolicy(maxAttempts, initialDelayMs, maxTotalWaitMs, perAttemptTimeoutMs);
    }

    /**
     * perAttemptTimeoutMs만 변경한 새 인스턴스 생성.
     */
    public RetryPolicy withPerAttemptTimeoutMs(long perAttemptTimeoutMs) {
        return new RetryPolicy(maxAttempts, initialDelayMs, maxTotalWaitMs, perAttemptTimeoutMs);
    }
}

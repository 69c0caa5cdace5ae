package com.ryuqq.probe.core.model;

import java.util.Map;

/**
 * 프로브 실행 환경.
 *
 * <p>환경에 따라 {@link RetryPolicy} 프리셋을 선택합니다.
 * 환경 변수는 호출자가 명시적으로 전달하며, 이 클래스는 전역 상태를 직접 읽지 않습니다.</p>
 *
 * <pre>{@code
 * RetryPolicy policy = ProbeEnvironment.detect(System.getenv()).policy();
 * }</pre>
 *
 * @author Probe Team
 * @since 1.0.0
 */
public enum ProbeEnvironment {

    /**
     * CI 환경 (느린 콜드 컴파일, 넉넉한 예산).
     */
    CI,

    /**
     * 로컬 개발 환경.
     */
    LOCAL;

    /**
     * CI 여부를 판단하는 환경 변수 이름.
     */
    public static final String CI_VARIABLE = "CI";

    /**
     * 환경 변수 맵으로부터 실행 환경 판단.
     *
     * <p>{@value #CI_VARIABLE} 값이 비어 있지 않으면 CI로 판단합니다.</p>
     *
     * @param environment 환경 변수 맵
     * @return CI 또는 LOCAL
     * @throws IllegalArgumentException environment가 null인 경우
     */
    public static ProbeEnvironment detect(Map<String, String> environment) {
        if (environment == null) {
            throw new IllegalArgumentException("environment cannot be null");
        }
        String value = environment.get(CI_VARIABLE);
        return value != null && !value.isEmpty() ? CI : LOCAL;
    }

    /**
     * 환경에 맞는 재시도 정책 프리셋.
     *
     * @return CI면 {@link RetryPolicy#ci()}, LOCAL이면 {@link RetryPolicy#local()}
     */
    public RetryPolicy policy() {
        return this == CI ? RetryPolicy.ci() : RetryPolicy.local();
    }
}

package com.ryuqq.probe.application.scope;

import com.ryuqq.probe.core.model.ProbeResult;
import com.ryuqq.probe.core.model.ProbeTarget;
import com.ryuqq.probe.core.model.RetryPolicy;
import com.ryuqq.probe.core.spi.ProbeSessionFactory;

/**
 * 격리된 세션 안에서 대상 하나를 프로브.
 *
 * <p>호출마다 새 세션을 획득하고, 어떤 경로로 끝나든 세션을 해제합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * ProbeResult result = scopedProbe.checkScoped(sessionFactory, ProbeTarget.of("/about"), RetryPolicy.ci());
 * if (!result.succeeded()) {
 *     // 호출자가 실패 처리
 * }
 * </pre>
 *
 * @author Probe Team
 * @since 1.0.0
 */
public interface ScopedProbe {

    /**
     * 새 세션에서 대상 프로브.
     *
     * <p><strong>동작 방식:</strong></p>
     * <ol>
     *   <li>sessionFactory에서 새 세션 획득</li>
     *   <li>세션의 Operation/Sleeper로 재시도 실행</li>
     *   <li>세션 해제 (성공, 실패, 중단 모두)</li>
     * </ol>
     *
     * @param sessionFactory 세션 팩토리
     * @param target 프로브 대상
     * @param policy 재시도 정책
     * @return 실행 결과
     * @throws IllegalArgumentException 인자가 null인 경우
     * @throws com.ryuqq.probe.core.spi.ProbeSessionException 세션 획득 또는 해제에 실패한 경우 (재시도하지 않음)
     */
    ProbeResult checkScoped(ProbeSessionFactory sessionFactory, ProbeTarget target, RetryPolicy policy);

    /**
     * 기본 정책으로 새 세션에서 대상 프로브.
     *
     * @param sessionFactory 세션 팩토리
     * @param target 프로브 대상
     * @return 실행 결과
     */
    default ProbeResult checkScoped(ProbeSessionFactory sessionFactory, ProbeTarget target) {
        return checkScoped(sessionFactory, target, RetryPolicy.defaults());
    }
}

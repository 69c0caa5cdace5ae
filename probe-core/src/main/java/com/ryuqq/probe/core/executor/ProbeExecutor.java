package com.ryuqq.probe.core.executor;

import com.ryuqq.probe.core.model.ProbeResult;
import com.ryuqq.probe.core.model.ProbeTarget;
import com.ryuqq.probe.core.model.RetryPolicy;

/**
 * 재시도 실행자.
 *
 * <p>대상 하나를 정책에 따라 반복 프로브하고 종료 결과를 반환합니다.</p>
 *
 * <p><strong>책임:</strong></p>
 * <ul>
 *   <li>Operation 호출과 시도 횟수 관리</li>
 *   <li>Outcome 분류와 백오프 계산 위임</li>
 *   <li>누적 대기 시간 관리</li>
 * </ul>
 *
 * <p><strong>예외:</strong> 구현체는 Operation 실패를 예외로 던지지 않고
 * 항상 채워진 {@link ProbeResult}를 반환해야 합니다.</p>
 *
 * @author Probe Team
 * @since 1.0.0
 */
public interface ProbeExecutor {

    /**
     * 정책에 따라 대상 프로브.
     *
     * @param target 프로브 대상
     * @param policy 재시도 정책
     * @return 실행 결과 (non-null)
     * @throws IllegalArgumentException target 또는 policy가 null인 경우
     */
    ProbeResult execute(ProbeTarget target, RetryPolicy policy);

    /**
     * 기본 정책({@link RetryPolicy#defaults()})으로 대상 프로브.
     *
     * @param target 프로브 대상
     * @return 실행 결과 (non-null)
     */
    default ProbeResult execute(ProbeTarget target) {
        return execute(target, RetryPolicy.defaults());
    }
}

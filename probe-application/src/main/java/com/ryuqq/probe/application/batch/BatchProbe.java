package com.ryuqq.probe.application.batch;

import com.ryuqq.probe.core.model.ProbeTarget;
import com.ryuqq.probe.core.model.RetryPolicy;

import java.util.List;

/**
 * 여러 대상의 도달성을 한 번에 확인.
 *
 * <p>앞선 대상이 실패해도 모든 대상을 확인하므로, 한 번의 실행으로
 * 실패한 대상 전체를 드러낼 수 있습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * BatchReport report = batchProbe.runBatch(List.of(ProbeTarget.of("/"), ProbeTarget.of("/about")), RetryPolicy.ci());
 * assertThat(report.failedTargets()).isEmpty();
 * </pre>
 *
 * @author Probe Team
 * @since 1.0.0
 */
public interface BatchProbe {

    /**
     * 대상 목록을 순차적으로 프로브.
     *
     * @param targets 대상 목록 (순서 유지, 중복 허용)
     * @param policy 재시도 정책 (모든 대상에 동일하게 적용)
     * @return 입력 순서대로의 결과
     * @throws IllegalArgumentException targets, policy가 null이거나 null 대상을 포함한 경우
     * @throws com.ryuqq.probe.core.spi.ProbeSessionException 세션 획득 또는 해제에 실패한 경우
     */
    BatchReport runBatch(List<ProbeTarget> targets, RetryPolicy policy);

    /**
     * 기본 정책으로 대상 목록 프로브.
     *
     * @param targets 대상 목록
     * @return 입력 순서대로의 결과
     */
    default BatchReport runBatch(List<ProbeTarget> targets) {
        return runBatch(targets, RetryPolicy.defaults());
    }
}

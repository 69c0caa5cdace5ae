package com.ryuqq.probe.application.warmup;

import com.ryuqq.probe.application.batch.BatchReport;
import com.ryuqq.probe.core.model.ProbeTarget;

import java.util.List;

/**
 * 라우트 사전 워밍업.
 *
 * <p>on-demand 컴파일이 느린 라우트를 실제 검사 전에 한 번씩 호출합니다 (예: beforeAll 훅).
 * 개별 실패는 무시하며 실제 검사가 처리합니다.</p>
 *
 * @author Probe Team
 * @since 1.0.0
 */
public interface Warmup {

    /**
     * 워밍업이 자주 필요한 라우트.
     */
    List<ProbeTarget> DEFAULT_ROUTES = List.of(
        ProbeTarget.of("/"),
        ProbeTarget.of("/about"),
        ProbeTarget.of("/domains"),
        ProbeTarget.of("/auth")
    );

    /**
     * 라우트 목록 워밍업.
     *
     * @param routes 워밍업할 라우트
     * @return 라우트별 결과 (참고용, 실패해도 예외 없음)
     * @throws IllegalArgumentException routes가 null인 경우
     */
    BatchReport warm(List<ProbeTarget> routes);

    /**
     * {@link #DEFAULT_ROUTES} 워밍업.
     *
     * @return 라우트별 결과
     */
    default BatchReport warmDefaults() {
        return warm(DEFAULT_ROUTES);
    }
}

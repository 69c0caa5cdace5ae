package com.ryuqq.probe.adapter.runner;

import com.ryuqq.probe.application.batch.BatchProbe;
import com.ryuqq.probe.application.batch.BatchReport;
import com.ryuqq.probe.application.batch.TargetResult;
import com.ryuqq.probe.application.scope.ScopedProbe;
import com.ryuqq.probe.core.model.ProbeResult;
import com.ryuqq.probe.core.model.ProbeTarget;
import com.ryuqq.probe.core.model.RetryPolicy;
import com.ryuqq.probe.core.spi.ProbeSessionFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * 순차 배치 실행자.
 *
 * <p>대상마다 {@link ScopedProbe}를 한 번씩, 입력 순서대로 호출합니다.
 * 실패한 대상이 있어도 멈추지 않으며 검증(assert)도 하지 않습니다.</p>
 *
 * <p><strong>자원 사용:</strong> 한 번에 하나의 추가 세션만 살아 있습니다.</p>
 *
 * @author Probe Team
 * @since 1.0.0
 */
public final class SequentialBatchRunner implements BatchProbe {

    private static final Logger log = LoggerFactory.getLogger(SequentialBatchRunner.class);

    private final ProbeSessionFactory sessionFactory;
    private final ScopedProbe scopedProbe;

    /**
     * 기본 {@link ScopedProbeRunner}로 생성.
     *
     * @param sessionFactory 세션 팩토리
     * @throws IllegalArgumentException sessionFactory가 null인 경우
     */
    public SequentialBatchRunner(ProbeSessionFactory sessionFactory) {
        this(sessionFactory, new ScopedProbeRunner());
    }

    /**
     * 생성자.
     *
     * @param sessionFactory 세션 팩토리
     * @param scopedProbe 대상별 Scoped 실행자
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public SequentialBatchRunner(ProbeSessionFactory sessionFactory, ScopedProbe scopedProbe) {
        if (sessionFactory == null) {
            throw new IllegalArgumentException("sessionFactory cannot be null");
        }
        if (scopedProbe == null) {
            throw new IllegalArgumentException("scopedProbe cannot be null");
        }
        this.sessionFactory = sessionFactory;
        this.scopedProbe = scopedProbe;
    }

    @Override
    public BatchReport runBatch(List<ProbeTarget> targets, RetryPolicy policy) {
        if (targets == null) {
            throw new IllegalArgumentException("targets cannot be null");
        }
        if (policy == null) {
            throw new IllegalArgumentException("policy cannot be null");
        }
        if (targets.stream().anyMatch(target -> target == null)) {
            throw new IllegalArgumentException("targets cannot contain null");
        }

        log.info("Batch probe started: {} target(s)", targets.size());
        List<TargetResult> entries = new ArrayList<>(targets.size());
        for (ProbeTarget target : targets) {
            ProbeResult result = scopedProbe.checkScoped(sessionFactory, target, policy);
            entries.add(new TargetResult(target, result));
            if (!result.succeeded()) {
                log.info("Probe {} failed after {} attempt(s): {}", target, result.attempts(), result.error());
            }
        }

        BatchReport report = BatchReport.of(entries);
        log.info("Batch probe completed: {}", report.summary());
        return report;
    }
}

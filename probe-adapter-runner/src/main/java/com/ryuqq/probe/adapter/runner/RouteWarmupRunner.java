package com.ryuqq.probe.adapter.runner;

import com.ryuqq.probe.application.batch.BatchReport;
import com.ryuqq.probe.application.batch.TargetResult;
import com.ryuqq.probe.application.warmup.Warmup;
import com.ryuqq.probe.core.model.ProbeResult;
import com.ryuqq.probe.core.model.ProbeTarget;
import com.ryuqq.probe.core.model.RetryPolicy;
import com.ryuqq.probe.core.spi.ProbeSession;
import com.ryuqq.probe.core.spi.ProbeSessionException;
import com.ryuqq.probe.core.spi.ProbeSessionFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * 라우트 워밍업 실행자.
 *
 * <p>세션 하나를 열어 모든 라우트를 순서대로 호출합니다. 워밍업은 짧은 예산
 * ({@link RetryPolicy#local()}: 2회, 500ms, 10초 예산, 10초 타임아웃)을 사용하며,
 * 실패해도 예외 없이 다음 라우트로 진행합니다.</p>
 *
 * <p>세션을 열 수 없으면 경고를 남기고 워밍업을 건너뜁니다 (빈 리포트).
 * 세션 해제 실패도 경고만 남기고 리포트를 그대로 반환합니다.
 * 실제 검사가 같은 문제를 다시 드러냅니다.</p>
 *
 * @author Probe Team
 * @since 1.0.0
 */
public final class RouteWarmupRunner implements Warmup {

    private static final Logger log = LoggerFactory.getLogger(RouteWarmupRunner.class);

    private final ProbeSessionFactory sessionFactory;
    private final RetryPolicy warmupPolicy;

    /**
     * 기본 워밍업 정책으로 생성.
     *
     * @param sessionFactory 세션 팩토리
     * @throws IllegalArgumentException sessionFactory가 null인 경우
     */
    public RouteWarmupRunner(ProbeSessionFactory sessionFactory) {
        this(sessionFactory, RetryPolicy.local());
    }

    /**
     * 생성자.
     *
     * @param sessionFactory 세션 팩토리
     * @param warmupPolicy 워밍업 정책
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public RouteWarmupRunner(ProbeSessionFactory sessionFactory, RetryPolicy warmupPolicy) {
        if (sessionFactory == null) {
            throw new IllegalArgumentException("sessionFactory cannot be null");
        }
        if (warmupPolicy == null) {
            throw new IllegalArgumentException("warmupPolicy cannot be null");
        }
        this.sessionFactory = sessionFactory;
        this.warmupPolicy = warmupPolicy;
    }

    @Override
    public BatchReport warm(List<ProbeTarget> routes) {
        if (routes == null) {
            throw new IllegalArgumentException("routes cannot be null");
        }
        if (routes.isEmpty()) {
            return BatchReport.empty();
        }

        ProbeSession session;
        try {
            session = sessionFactory.open();
        } catch (ProbeSessionException e) {
            log.warn("Warmup skipped, could not open probe session: {}", e.getMessage(), e);
            return BatchReport.empty();
        }

        List<TargetResult> entries = new ArrayList<>(routes.size());
        try {
            RetryingProbeExecutor executor = new RetryingProbeExecutor(session.operation(), session.sleeper());
            for (ProbeTarget route : routes) {
                ProbeResult result = executor.execute(route, warmupPolicy);
                entries.add(new TargetResult(route, result));
                if (!result.succeeded()) {
                    log.info("Warmup of {} did not succeed ({}), continuing", route, result.error());
                }
            }
        } finally {
            closeQuietly(session);
        }

        BatchReport report = BatchReport.of(entries);
        log.info("Warmup completed: {}", report.summary());
        return report;
    }

    private static void closeQuietly(ProbeSession session) {
        try {
            session.close();
        } catch (ProbeSessionException e) {
            log.warn("Warmup session could not be closed: {}", e.getMessage(), e);
        }
    }

    public RetryPolicy getWarmupPolicy() {
        return warmupPolicy;
    }
}

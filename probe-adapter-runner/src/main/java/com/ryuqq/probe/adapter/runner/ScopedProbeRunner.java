package com.ryuqq.probe.adapter.runner;

import com.ryuqq.probe.application.scope.ScopedProbe;
import com.ryuqq.probe.core.backoff.LinearBackoffScheduler;
import com.ryuqq.probe.core.model.ProbeResult;
import com.ryuqq.probe.core.model.ProbeTarget;
import com.ryuqq.probe.core.model.RetryPolicy;
import com.ryuqq.probe.core.outcome.OutcomeClassifier;
import com.ryuqq.probe.core.spi.ProbeSession;
import com.ryuqq.probe.core.spi.ProbeSessionFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Scoped Invocation 구현체.
 *
 * <p>대상마다 새 세션을 열고, 세션의 Operation/Sleeper로 {@link RetryingProbeExecutor}를 실행한 뒤
 * try-with-resources로 세션을 반드시 해제합니다.</p>
 *
 * <p><strong>세션 생명주기:</strong></p>
 * <pre>
 * open() ─► execute(target, policy) ─► close()
 *   │                                     ▲
 *   └─ 실패 시 예외 전파 (해제할 세션 없음)  └─ 성공, 실패, 중단 모두 실행
 * </pre>
 *
 * <p>세션 획득/해제 실패({@link com.ryuqq.probe.core.spi.ProbeSessionException})는
 * 재시도하지 않고 그대로 전파합니다.</p>
 *
 * @author Probe Team
 * @since 1.0.0
 */
public final class ScopedProbeRunner implements ScopedProbe {

    private static final Logger log = LoggerFactory.getLogger(ScopedProbeRunner.class);

    private final OutcomeClassifier classifier;
    private final LinearBackoffScheduler scheduler;

    /**
     * 기본 분류기와 스케줄러로 생성.
     */
    public ScopedProbeRunner() {
        this(new OutcomeClassifier(), new LinearBackoffScheduler());
    }

    /**
     * 생성자.
     *
     * @param classifier Outcome 분류기
     * @param scheduler 백오프 스케줄러
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public ScopedProbeRunner(OutcomeClassifier classifier, LinearBackoffScheduler scheduler) {
        if (classifier == null) {
            throw new IllegalArgumentException("classifier cannot be null");
        }
        if (scheduler == null) {
            throw new IllegalArgumentException("scheduler cannot be null");
        }
        this.classifier = classifier;
        this.scheduler = scheduler;
    }

    @Override
    public ProbeResult checkScoped(ProbeSessionFactory sessionFactory, ProbeTarget target, RetryPolicy policy) {
        if (sessionFactory == null) {
            throw new IllegalArgumentException("sessionFactory cannot be null");
        }
        if (target == null) {
            throw new IllegalArgumentException("target cannot be null");
        }
        if (policy == null) {
            throw new IllegalArgumentException("policy cannot be null");
        }

        try (ProbeSession session = sessionFactory.open()) {
            log.debug("Opened probe session for {}", target);
            RetryingProbeExecutor executor =
                new RetryingProbeExecutor(session.operation(), session.sleeper(), classifier, scheduler);
            return executor.execute(target, policy);
        }
    }
}

package com.ryuqq.probe.testkit.contract;

import com.ryuqq.probe.application.batch.BatchProbe;
import com.ryuqq.probe.application.batch.BatchReport;
import com.ryuqq.probe.application.batch.TargetResult;
import com.ryuqq.probe.core.model.ProbeTarget;
import com.ryuqq.probe.core.spi.ProbeSessionFactory;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contract suite for {@link BatchProbe} implementations.
 *
 * <p>A batch checks every target in input order and never stops early on a failed result.</p>
 *
 * @author Probe Team
 * @since 1.0.0
 */
public abstract class BatchProbeContract extends AbstractProbeContractTest {

    protected abstract BatchProbe createBatchProbe(ProbeSessionFactory sessionFactory);

    @Test
    public void failingMiddleTarget_DoesNotStopBatch() {
        operation.respondFor("/a", 200).respondFor("/b", 404).respondFor("/c", 200);

        BatchReport report = createBatchProbe(sessionFactory)
            .runBatch(List.of(target("/a"), target("/b"), target("/c")), policy(3, 10, 100));

        assertThat(report.failedTargets()).containsExactly(target("/b"));
        assertThat(report.successes()).extracting(TargetResult::target)
            .containsExactly(target("/a"), target("/c"));
        assertThat(sessionFactory.openedCount()).isEqualTo(3);
        assertThat(sessionFactory.liveCount()).isZero();
    }

    @Test
    public void entries_FollowInputOrder() {
        operation.respond(200);
        List<ProbeTarget> targets = List.of(target("/c"), target("/a"), target("/b"));

        BatchReport report = createBatchProbe(sessionFactory).runBatch(targets, policy(1, 10, 100));

        assertThat(report.entries()).extracting(TargetResult::target).containsExactlyElementsOf(targets);
        assertThat(operation.invokedTargets()).containsExactlyElementsOf(targets);
        assertThat(report.allSucceeded()).isTrue();
    }

    @Test
    public void emptyTargets_ProducesEmptyReport() {
        BatchReport report = createBatchProbe(sessionFactory).runBatch(List.of(), policy(1, 10, 100));

        assertThat(report.size()).isZero();
        assertThat(sessionFactory.openedCount()).isZero();
    }
}

package com.ryuqq.probe.adapter.runner;

import com.ryuqq.probe.application.batch.BatchReport;
import com.ryuqq.probe.application.scope.ScopedProbe;
import com.ryuqq.probe.core.model.ProbeResult;
import com.ryuqq.probe.core.model.ProbeTarget;
import com.ryuqq.probe.core.model.RetryPolicy;
import com.ryuqq.probe.core.spi.ProbeSessionException;
import com.ryuqq.probe.core.spi.ProbeSessionFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * SequentialBatchRunner 유닛 테스트.
 *
 * @author Probe Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class SequentialBatchRunnerTest {

    private static final ProbeTarget A = ProbeTarget.of("/a");
    private static final ProbeTarget B = ProbeTarget.of("/b");
    private static final ProbeTarget C = ProbeTarget.of("/c");

    @Mock
    private ProbeSessionFactory sessionFactory;

    @Mock
    private ScopedProbe scopedProbe;

    private SequentialBatchRunner runner;

    @BeforeEach
    void setUp() {
        runner = new SequentialBatchRunner(sessionFactory, scopedProbe);
    }

    @Test
    void runBatch_시나리오C_B만_실패해도_세_대상_모두_실행() {
        // given
        RetryPolicy policy = RetryPolicy.defaults();
        when(scopedProbe.checkScoped(sessionFactory, A, policy)).thenReturn(ProbeResult.success(200, 1));
        when(scopedProbe.checkScoped(sessionFactory, B, policy))
            .thenReturn(ProbeResult.failure(503, 3, "Navigation failed after all attempts"));
        when(scopedProbe.checkScoped(sessionFactory, C, policy)).thenReturn(ProbeResult.success(200, 2));

        // when
        BatchReport report = runner.runBatch(List.of(A, B, C), policy);

        // then
        assertThat(report.failedTargets()).containsExactly(B);
        assertThat(report.successes()).hasSize(2);
        assertThat(report.summary()).isEqualTo("3 checked, 2 succeeded, 1 failed [/b]");

        InOrder inOrder = inOrder(scopedProbe);
        inOrder.verify(scopedProbe).checkScoped(sessionFactory, A, policy);
        inOrder.verify(scopedProbe).checkScoped(sessionFactory, B, policy);
        inOrder.verify(scopedProbe).checkScoped(sessionFactory, C, policy);
    }

    @Test
    void runBatch_정책_생략_시_기본_정책_사용() {
        // given
        when(scopedProbe.checkScoped(eq(sessionFactory), eq(A), eq(RetryPolicy.defaults())))
            .thenReturn(ProbeResult.success(200, 1));

        // when
        BatchReport report = runner.runBatch(List.of(A));

        // then
        assertThat(report.allSucceeded()).isTrue();
    }

    @Test
    void runBatch_하네스_오류는_전파되고_이후_대상_미실행() {
        // given
        when(scopedProbe.checkScoped(any(), eq(A), any())).thenThrow(new ProbeSessionException("cannot launch"));

        // when & then
        assertThatThrownBy(() -> runner.runBatch(List.of(A, B), RetryPolicy.defaults()))
            .isInstanceOf(ProbeSessionException.class);
        verify(scopedProbe, never()).checkScoped(any(), eq(B), any());
    }

    @Test
    void runBatch_입력_유효성_검증() {
        assertThatThrownBy(() -> runner.runBatch(null, RetryPolicy.defaults()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("targets cannot be null");
        assertThatThrownBy(() -> runner.runBatch(List.of(A), null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("policy cannot be null");
        assertThatThrownBy(() -> runner.runBatch(Arrays.asList(A, null), RetryPolicy.defaults()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("targets cannot contain null");
        verifyNoInteractions(scopedProbe);
    }

    @Test
    void constructor_null_의존성_IllegalArgumentException() {
        assertThatThrownBy(() -> new SequentialBatchRunner(null, scopedProbe))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("sessionFactory cannot be null");
        assertThatThrownBy(() -> new SequentialBatchRunner(sessionFactory, null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("scopedProbe cannot be null");
    }
}

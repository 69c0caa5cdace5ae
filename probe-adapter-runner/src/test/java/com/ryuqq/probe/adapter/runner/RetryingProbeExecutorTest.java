package com.ryuqq.probe.adapter.runner;

import com.ryuqq.probe.core.model.ProbeResponse;
import com.ryuqq.probe.core.model.ProbeResult;
import com.ryuqq.probe.core.model.ProbeTarget;
import com.ryuqq.probe.core.model.RetryPolicy;
import com.ryuqq.probe.core.spi.ProbeOperation;
import com.ryuqq.probe.core.spi.Sleeper;
import com.ryuqq.probe.core.spi.WaitAbortedException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.net.ConnectException;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * RetryingProbeExecutor 유닛 테스트.
 *
 * <p>재시도 루프의 핵심 동작을 검증합니다:</p>
 * <ul>
 *   <li>Outcome 분류에 따른 종료/재시도 분기</li>
 *   <li>선형 백오프와 대기 예산</li>
 *   <li>대기 중단 시 즉시 종료</li>
 *   <li>입력 유효성 검증</li>
 * </ul>
 *
 * @author Probe Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class RetryingProbeExecutorTest {

    private static final ProbeTarget TARGET = ProbeTarget.of("/about");

    @Mock
    private ProbeOperation operation;

    @Mock
    private Sleeper sleeper;

    private RetryingProbeExecutor executor;

    @BeforeEach
    void setUp() {
        executor = new RetryingProbeExecutor(operation, sleeper);
    }

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    // ============================================================
    // 1. 종료 분기
    // ============================================================

    @Test
    void execute_첫_시도_200이면_성공_1회() throws Exception {
        // given
        when(operation.invoke(TARGET, 15000L)).thenReturn(ProbeResponse.of(200));

        // when
        ProbeResult result = executor.execute(TARGET);

        // then
        assertThat(result).isEqualTo(new ProbeResult(true, 200, 1, null));
        verifyNoInteractions(sleeper);
    }

    @Test
    void execute_시나리오A_예외_500_200_순서로_3회차_성공() throws Exception {
        // given
        when(operation.invoke(eq(TARGET), anyLong()))
            .thenThrow(new ConnectException("NetworkError"))
            .thenReturn(ProbeResponse.of(500))
            .thenReturn(ProbeResponse.of(200));
        RetryPolicy policy = new RetryPolicy(3, 100, 1000, 0);

        // when
        ProbeResult result = executor.execute(TARGET, policy);

        // then
        assertThat(result.succeeded()).isTrue();
        assertThat(result.status()).isEqualTo(200);
        assertThat(result.attempts()).isEqualTo(3);

        InOrder inOrder = inOrder(operation, sleeper);
        inOrder.verify(operation).invoke(TARGET, 0L);
        inOrder.verify(sleeper).pause(100L);
        inOrder.verify(operation).invoke(TARGET, 0L);
        inOrder.verify(sleeper).pause(200L);
        inOrder.verify(operation).invoke(TARGET, 0L);
    }

    @Test
    void execute_시나리오B_404는_재시도_없이_종료() throws Exception {
        // given
        when(operation.invoke(any(), anyLong())).thenReturn(ProbeResponse.of(404));

        // when
        ProbeResult result = executor.execute(TARGET, RetryPolicy.defaults().withMaxAttempts(5));

        // then
        assertThat(result.succeeded()).isFalse();
        assertThat(result.status()).isEqualTo(404);
        assertThat(result.attempts()).isEqualTo(1);
        assertThat(result.error()).isEqualTo("Received status 404");
        verify(operation, times(1)).invoke(any(), anyLong());
        verifyNoInteractions(sleeper);
    }

    @Test
    void execute_301_리다이렉트도_Terminal() throws Exception {
        when(operation.invoke(any(), anyLong())).thenReturn(ProbeResponse.of(301));

        ProbeResult result = executor.execute(TARGET);

        assertThat(result.attempts()).isEqualTo(1);
        assertThat(result.error()).isEqualTo("Received status 301");
    }

    @Test
    void execute_항상_503이면_3회_시도_후_소진_메시지() throws Exception {
        // given
        when(operation.invoke(any(), anyLong())).thenReturn(ProbeResponse.of(503));

        // when
        ProbeResult result = executor.execute(TARGET, new RetryPolicy(3, 1000, 30000, 15000));

        // then
        assertThat(result).isEqualTo(
            new ProbeResult(false, 503, 3, RetryingProbeExecutor.EXHAUSTED_MESSAGE));
        verify(sleeper).pause(1000L);
        verify(sleeper).pause(2000L);
        verifyNoMoreInteractions(sleeper);
    }

    @Test
    void execute_예외_후_503이면_마지막_예외_메시지와_마지막_상태_보고() throws Exception {
        // given
        when(operation.invoke(any(), anyLong()))
            .thenThrow(new TimeoutException("Timeout 15000ms exceeded"))
            .thenReturn(ProbeResponse.of(503));

        // when
        ProbeResult result = executor.execute(TARGET, new RetryPolicy(2, 10, 1000, 0));

        // then
        assertThat(result.succeeded()).isFalse();
        assertThat(result.status()).isEqualTo(503);
        assertThat(result.attempts()).isEqualTo(2);
        assertThat(result.error()).isEqualTo("Timeout 15000ms exceeded");
    }

    @Test
    void execute_메시지_없는_예외는_클래스명으로_보고() throws Exception {
        when(operation.invoke(any(), anyLong())).thenThrow(new IllegalStateException());

        ProbeResult result = executor.execute(TARGET, new RetryPolicy(1, 10, 1000, 0));

        assertThat(result.error()).isEqualTo("IllegalStateException");
        assertThat(result.status()).isNull();
    }

    @Test
    void execute_null_응답은_예외로_취급() throws Exception {
        when(operation.invoke(any(), anyLong())).thenReturn(null);

        ProbeResult result = executor.execute(TARGET, new RetryPolicy(1, 10, 1000, 0));

        assertThat(result.succeeded()).isFalse();
        assertThat(result.error()).isEqualTo("Operation returned no response");
    }

    // ============================================================
    // 2. 대기 예산
    // ============================================================

    @Test
    void execute_대기_합계가_maxTotalWaitMs를_넘지_않음() throws Exception {
        // given
        when(operation.invoke(any(), anyLong())).thenReturn(ProbeResponse.of(500));
        ArgumentCaptor<Long> delays = ArgumentCaptor.forClass(Long.class);

        // when
        ProbeResult result = executor.execute(TARGET, new RetryPolicy(10, 1000, 2500, 0));

        // then
        verify(sleeper, atLeastOnce()).pause(delays.capture());
        assertThat(delays.getAllValues()).containsExactly(1000L, 1500L);
        assertThat(delays.getAllValues().stream().mapToLong(Long::longValue).sum()).isLessThanOrEqualTo(2500L);
        assertThat(result.attempts()).isLessThanOrEqualTo(10);
    }

    @Test
    void execute_예산_0이어도_첫_시도는_실행() throws Exception {
        // given
        when(operation.invoke(any(), anyLong())).thenReturn(ProbeResponse.of(502));

        // when
        ProbeResult result = executor.execute(TARGET, new RetryPolicy(3, 1000, 0, 0));

        // then
        assertThat(result.attempts()).isEqualTo(1);
        assertThat(result.status()).isEqualTo(502);
        verifyNoInteractions(sleeper);
    }

    @Test
    void execute_초기_지연_0이면_대기_없이_소진() throws Exception {
        when(operation.invoke(any(), anyLong())).thenReturn(ProbeResponse.of(500));

        ProbeResult result = executor.execute(TARGET, new RetryPolicy(3, 0, 1000, 0));

        assertThat(result.attempts()).isEqualTo(1);
        verifyNoInteractions(sleeper);
    }

    // ============================================================
    // 3. 대기 중단
    // ============================================================

    @Test
    void execute_대기_중단_시_추가_시도_없이_종료() throws Exception {
        // given
        when(operation.invoke(any(), anyLong())).thenReturn(ProbeResponse.of(503));
        doThrow(new WaitAbortedException("Target page, context or browser has been closed"))
            .when(sleeper).pause(anyLong());

        // when
        ProbeResult result = executor.execute(TARGET, RetryPolicy.defaults());

        // then
        assertThat(result.succeeded()).isFalse();
        assertThat(result.attempts()).isEqualTo(1);
        assertThat(result.status()).isEqualTo(503);
        assertThat(result.error()).isEqualTo("Retry wait aborted: Target page, context or browser has been closed");
        verify(operation, times(1)).invoke(any(), anyLong());
    }

    @Test
    void execute_InterruptedException은_재시도_대상이며_인터럽트_플래그_복원() throws Exception {
        // given
        when(operation.invoke(any(), anyLong())).thenThrow(new InterruptedException("interrupted"));

        // when
        ProbeResult result = executor.execute(TARGET, new RetryPolicy(1, 10, 100, 0));

        // then
        assertThat(result.error()).isEqualTo("interrupted");
        assertThat(Thread.currentThread().isInterrupted()).isTrue();
    }

    // ============================================================
    // 4. 입력 유효성 검증
    // ============================================================

    @Test
    void execute_null_target_IllegalArgumentException() {
        assertThatThrownBy(() -> executor.execute(null, RetryPolicy.defaults()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("target cannot be null");
    }

    @Test
    void execute_null_policy_IllegalArgumentException() {
        assertThatThrownBy(() -> executor.execute(TARGET, null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("policy cannot be null");
    }

    @Test
    void constructor_null_의존성_IllegalArgumentException() {
        assertThatThrownBy(() -> new RetryingProbeExecutor(null, sleeper))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("operation cannot be null");
        assertThatThrownBy(() -> new RetryingProbeExecutor(operation, null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("sleeper cannot be null");
    }
}

package com.ryuqq.probe.testkit.contract;

import com.ryuqq.probe.core.executor.ProbeExecutor;
import com.ryuqq.probe.core.model.ProbeResult;
import com.ryuqq.probe.core.spi.ProbeOperation;
import com.ryuqq.probe.core.spi.Sleeper;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ConnectException;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contract suite for {@link ProbeExecutor} implementations.
 *
 * <p>Validates the retry contract every executor must honour:</p>
 * <ul>
 *   <li>Success on the first 200 response</li>
 *   <li>Transient failures (5xx, thrown errors) are retried with linear backoff</li>
 *   <li>Terminal statuses stop after a single attempt</li>
 *   <li>Attempt and wait budgets are never exceeded</li>
 *   <li>An aborted wait stops the loop without another attempt</li>
 * </ul>
 *
 * @author Probe Team
 * @since 1.0.0
 */
public abstract class RetryExecutorContract extends AbstractProbeContractTest {

    /**
     * Creates the executor under test.
     *
     * @param operation operation to invoke
     * @param sleeper wait primitive
     * @return executor instance
     */
    protected abstract ProbeExecutor createExecutor(ProbeOperation operation, Sleeper sleeper);

    @Test
    public void firstAttempt200_SucceedsWithoutWaiting() {
        operation.respond(200);

        ProbeResult result = createExecutor(operation, sleeper).execute(target("/"), policy(3, 1000, 30000));

        assertSucceeded(result, 200, 1);
        assertThat(sleeper.waits()).isEmpty();
    }

    @Test
    public void thrownError_Then500_Then200_SucceedsOnThirdAttempt() {
        operation.fail(new ConnectException("net::ERR_CONNECTION_REFUSED")).respond(500, 200);

        ProbeResult result = createExecutor(operation, sleeper).execute(target("/about"), policy(3, 100, 1000));

        assertSucceeded(result, 200, 3);
        assertThat(sleeper.waits()).containsExactly(100L, 200L);
    }

    @Test
    public void always404_FailsAfterSingleAttempt() {
        operation.respond(404);

        ProbeResult result = createExecutor(operation, sleeper).execute(target("/missing"), policy(5, 100, 10000));

        assertFailed(result, 404, 1);
        assertThat(result.error()).contains("404");
        assertThat(operation.invocationCount()).isEqualTo(1);
        assertThat(sleeper.waits()).isEmpty();
    }

    @Test
    public void always503_ExhaustsAllAttempts() {
        operation.respond(503);

        ProbeResult result = createExecutor(operation, sleeper).execute(target("/domains"), policy(3, 1000, 30000));

        assertFailed(result, 503, 3);
        assertThat(operation.invocationCount()).isEqualTo(3);
        assertThat(sleeper.waits()).containsExactly(1000L, 2000L);
    }

    @Test
    public void waitBudget_IsNeverExceeded() {
        operation.respond(502);

        ProbeResult result = createExecutor(operation, sleeper).execute(target("/"), policy(10, 400, 1000));

        assertThat(result.succeeded()).isFalse();
        assertThat(sleeper.totalWaitedMs()).isLessThanOrEqualTo(1000L);
        assertThat(sleeper.waits()).containsExactly(400L, 600L);
        // no retry once the wait budget is spent
        assertThat(result.attempts()).isEqualTo(2);
    }

    @Test
    public void abortedWait_StopsWithoutAnotherAttempt() {
        operation.respond(503);
        sleeper.abortAt(2);

        ProbeResult result = createExecutor(operation, sleeper).execute(target("/auth"), policy(5, 100, 10000));

        assertFailed(result, 503, 2);
        assertThat(operation.invocationCount()).isEqualTo(2);
        assertThat(result.error()).startsWith("Retry wait aborted");
    }

    @Test
    public void thrownErrorOnEveryAttempt_ReportsLastErrorMessage() {
        operation.fail(new IOException("Timeout 15000ms exceeded"));

        ProbeResult result = createExecutor(operation, sleeper).execute(target("/"), policy(2, 10, 1000));

        assertFailed(result, null, 2);
        assertThat(result.error()).isEqualTo("Timeout 15000ms exceeded");
    }

    @Test
    public void singleAttemptPolicy_NeverWaits() {
        operation.respond(500);

        ProbeResult result = createExecutor(operation, sleeper).execute(target("/"), policy(1, 1000, 30000));

        assertFailed(result, 500, 1);
        assertThat(sleeper.waits()).isEmpty();
    }
}

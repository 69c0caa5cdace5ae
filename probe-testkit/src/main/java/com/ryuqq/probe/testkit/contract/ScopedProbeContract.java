package com.ryuqq.probe.testkit.contract;

import com.ryuqq.probe.application.scope.ScopedProbe;
import com.ryuqq.probe.core.model.ProbeResult;
import com.ryuqq.probe.core.spi.ProbeSessionException;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contract suite for {@link ScopedProbe} implementations.
 *
 * <p>Every check must run in a session of its own, and that session must be
 * released whatever the result was.</p>
 *
 * @author Probe Team
 * @since 1.0.0
 */
public abstract class ScopedProbeContract extends AbstractProbeContractTest {

    protected abstract ScopedProbe createScopedProbe();

    @Test
    public void success_ReleasesSession() {
        operation.respond(200);

        ProbeResult result = createScopedProbe().checkScoped(sessionFactory, target("/"), policy(3, 10, 100));

        assertSucceeded(result, 200, 1);
        assertThat(sessionFactory.openedCount()).isEqualTo(1);
        assertThat(sessionFactory.liveCount()).isZero();
    }

    @Test
    public void exhaustedFailure_ReleasesSession() {
        operation.fail(new IOException("connection reset"));

        ProbeResult result = createScopedProbe().checkScoped(sessionFactory, target("/"), policy(3, 10, 100));

        assertFailed(result, null, 3);
        assertThat(sessionFactory.liveCount()).isZero();
    }

    @Test
    public void abortedWait_ReleasesSession() {
        operation.respond(503);
        sleeper.abortAt(1);

        ProbeResult result = createScopedProbe().checkScoped(sessionFactory, target("/"), policy(3, 10, 100));

        assertFailed(result, 503, 1);
        assertThat(sessionFactory.liveCount()).isZero();
    }

    @Test
    public void eachCheck_UsesFreshSession() {
        operation.respond(200);
        ScopedProbe scopedProbe = createScopedProbe();

        scopedProbe.checkScoped(sessionFactory, target("/"), policy(1, 10, 100));
        scopedProbe.checkScoped(sessionFactory, target("/about"), policy(1, 10, 100));

        assertThat(sessionFactory.openedCount()).isEqualTo(2);
        assertThat(sessionFactory.sessions()).allMatch(session -> session.closeCalls() == 1);
    }

    @Test
    public void openFailure_PropagatesWithoutInvokingOperation() {
        sessionFactory.failOnOpen();

        assertThatThrownBy(() -> createScopedProbe().checkScoped(sessionFactory, target("/"), policy(3, 10, 100)))
            .isInstanceOf(ProbeSessionException.class);
        assertThat(operation.invocationCount()).isZero();
    }

    @Test
    public void closeFailure_Propagates() {
        operation.respond(200);
        sessionFactory.failOnClose();

        assertThatThrownBy(() -> createScopedProbe().checkScoped(sessionFactory, target("/"), policy(3, 10, 100)))
            .isInstanceOf(ProbeSessionException.class);
        assertThat(operation.invocationCount()).isEqualTo(1);
    }
}

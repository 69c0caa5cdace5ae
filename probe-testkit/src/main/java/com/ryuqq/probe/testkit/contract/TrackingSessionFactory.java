package com.ryuqq.probe.testkit.contract;

import com.ryuqq.probe.core.spi.ProbeOperation;
import com.ryuqq.probe.core.spi.ProbeSession;
import com.ryuqq.probe.core.spi.ProbeSessionException;
import com.ryuqq.probe.core.spi.ProbeSessionFactory;
import com.ryuqq.probe.core.spi.Sleeper;
import com.ryuqq.probe.core.spi.WaitAbortedException;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Session factory that tracks every session it opens.
 *
 * <p>All sessions share the given operation and sleeper; the sleeper of a closed
 * session refuses to wait. Opening or closing can be made to fail to exercise
 * harness-fault propagation.</p>
 *
 * @author Probe Team
 * @since 1.0.0
 */
public class TrackingSessionFactory implements ProbeSessionFactory {

    private final ProbeOperation operation;
    private final Sleeper sleeper;
    private final List<TrackingSession> sessions = new CopyOnWriteArrayList<>();
    private final AtomicInteger openAttempts = new AtomicInteger();
    private volatile boolean failOnOpen;
    private volatile boolean failOnClose;

    public TrackingSessionFactory(ProbeOperation operation, Sleeper sleeper) {
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        if (sleeper == null) {
            throw new IllegalArgumentException("sleeper cannot be null");
        }
        this.operation = operation;
        this.sleeper = sleeper;
    }

    public TrackingSessionFactory failOnOpen() {
        this.failOnOpen = true;
        return this;
    }

    public TrackingSessionFactory failOnClose() {
        this.failOnClose = true;
        return this;
    }

    @Override
    public ProbeSession open() {
        int number = openAttempts.incrementAndGet();
        if (failOnOpen) {
            throw new ProbeSessionException("Failed to open session #" + number);
        }
        TrackingSession session = new TrackingSession(number);
        sessions.add(session);
        return session;
    }

    public int openedCount() {
        return sessions.size();
    }

    public int closedCount() {
        return (int) sessions.stream().filter(TrackingSession::isClosed).count();
    }

    /**
     * @return sessions opened but not yet closed
     */
    public int liveCount() {
        return openedCount() - closedCount();
    }

    public int openAttempts() {
        return openAttempts.get();
    }

    public List<TrackingSession> sessions() {
        return List.copyOf(sessions);
    }

    /**
     * Session handed out by {@link TrackingSessionFactory}.
     */
    public final class TrackingSession implements ProbeSession {

        private final int number;
        private final AtomicInteger closeCalls = new AtomicInteger();
        private volatile boolean closed;

        private TrackingSession(int number) {
            this.number = number;
        }

        @Override
        public ProbeOperation operation() {
            return operation;
        }

        @Override
        public Sleeper sleeper() {
            return millis -> {
                if (closed) {
                    throw new WaitAbortedException("Session #" + number + " is closed");
                }
                sleeper.pause(millis);
            };
        }

        @Override
        public void close() {
            closeCalls.incrementAndGet();
            closed = true;
            if (failOnClose) {
                throw new ProbeSessionException("Failed to close session #" + number);
            }
        }

        public int number() {
            return number;
        }

        public boolean isClosed() {
            return closed;
        }

        public int closeCalls() {
            return closeCalls.get();
        }
    }
}

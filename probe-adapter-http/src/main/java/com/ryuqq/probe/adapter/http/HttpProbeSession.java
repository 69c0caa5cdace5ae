package com.ryuqq.probe.adapter.http;

import com.ryuqq.probe.core.model.ProbeResponse;
import com.ryuqq.probe.core.model.ProbeTarget;
import com.ryuqq.probe.core.spi.ProbeOperation;
import com.ryuqq.probe.core.spi.ProbeSession;
import com.ryuqq.probe.core.spi.Sleeper;
import com.ryuqq.probe.core.spi.WaitAbortedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * HTTP 프로브 세션.
 *
 * <p>Sleeper는 세션 종료 래치를 기다립니다. 대기 중에 세션이 닫히면 대기가 즉시 끝나고
 * {@link WaitAbortedException}이 발생해 재시도 루프가 중단됩니다.</p>
 *
 * @author Probe Team
 * @since 1.0.0
 */
final class HttpProbeSession implements ProbeSession {

    private static final Logger log = LoggerFactory.getLogger(HttpProbeSession.class);

    private final long sessionId;
    private final HttpClient client;
    private final ExecutorService executor;
    private final HttpProbeConfig config;
    private final CountDownLatch closeLatch = new CountDownLatch(1);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final ProbeOperation operation = this::send;
    private final Sleeper sleeper = this::awaitClose;

    HttpProbeSession(long sessionId, HttpClient client, ExecutorService executor, HttpProbeConfig config) {
        this.sessionId = sessionId;
        this.client = client;
        this.executor = executor;
        this.config = config;
    }

    @Override
    public ProbeOperation operation() {
        return operation;
    }

    @Override
    public Sleeper sleeper() {
        return sleeper;
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        closeLatch.countDown();
        executor.shutdownNow();
        log.debug("Closed HTTP probe session #{}", sessionId);
    }

    boolean isClosed() {
        return closed.get();
    }

    URI resolve(ProbeTarget target) {
        return target.isAbsolute() ? URI.create(target.getValue()) : config.baseUri().resolve(target.getValue());
    }

    private ProbeResponse send(ProbeTarget target, long perAttemptTimeoutMs) throws IOException, InterruptedException {
        if (closed.get()) {
            throw new IllegalStateException("HTTP probe session #" + sessionId + " is closed");
        }
        HttpRequest.Builder builder = HttpRequest.newBuilder(resolve(target))
            .header("User-Agent", config.userAgent());
        if (config.method() == HttpProbeConfig.Method.HEAD) {
            builder.method("HEAD", HttpRequest.BodyPublishers.noBody());
        } else {
            builder.GET();
        }
        if (perAttemptTimeoutMs > 0) {
            builder.timeout(Duration.ofMillis(perAttemptTimeoutMs));
        }

        HttpResponse<Void> response = client.send(builder.build(), HttpResponse.BodyHandlers.discarding());
        log.debug("Session #{} {} {} → {}", sessionId, config.method(), response.uri(), response.statusCode());
        return ProbeResponse.of(response.statusCode());
    }

    private void awaitClose(long millis) throws WaitAbortedException {
        try {
            if (closeLatch.await(millis, TimeUnit.MILLISECONDS)) {
                throw new WaitAbortedException("HTTP probe session #" + sessionId + " closed during wait");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new WaitAbortedException("Wait interrupted", e);
        }
    }
}

package com.ryuqq.probe.adapter.http;

import com.ryuqq.probe.core.spi.ProbeSession;
import com.ryuqq.probe.core.spi.ProbeSessionException;
import com.ryuqq.probe.core.spi.ProbeSessionFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.CookieManager;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link HttpClient} 기반 세션 팩토리.
 *
 * <p>세션마다 전용 HttpClient를 만듭니다. 쿠키 저장소와 실행 스레드를 세션끼리 공유하지 않으므로
 * 한 대상의 검사가 다른 대상의 검사에 영향을 주지 않습니다.</p>
 *
 * <p>리다이렉트는 따라가지 않습니다. 3xx는 그대로 Terminal 상태로 보고됩니다.</p>
 *
 * @author Probe Team
 * @since 1.0.0
 */
public final class HttpProbeSessionFactory implements ProbeSessionFactory {

    private static final Logger log = LoggerFactory.getLogger(HttpProbeSessionFactory.class);

    private final HttpProbeConfig config;
    private final AtomicLong sessionSequence = new AtomicLong();

    public HttpProbeSessionFactory(HttpProbeConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
    }

    @Override
    public ProbeSession open() {
        long sessionId = sessionSequence.incrementAndGet();
        ExecutorService executor = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "probe-http-session-" + sessionId);
            thread.setDaemon(true);
            return thread;
        });
        try {
            HttpClient client = HttpClient.newBuilder()
                .executor(executor)
                .cookieHandler(new CookieManager())
                .followRedirects(HttpClient.Redirect.NEVER)
                .connectTimeout(Duration.ofMillis(config.connectTimeoutMs()))
                .build();
            log.debug("Opened HTTP probe session #{} against {}", sessionId, config.baseUri());
            return new HttpProbeSession(sessionId, client, executor, config);
        } catch (RuntimeException e) {
            executor.shutdownNow();
            throw new ProbeSessionException("Failed to open HTTP probe session #" + sessionId, e);
        }
    }

    public HttpProbeConfig getConfig() {
        return config;
    }
}

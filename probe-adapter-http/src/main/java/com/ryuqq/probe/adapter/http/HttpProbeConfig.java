package com.ryuqq.probe.adapter.http;

import java.net.URI;

/**
 * HTTP 프로브 설정.
 *
 * <p>상대 경로 대상은 {@code baseUri}를 기준으로 해석됩니다.</p>
 *
 * <p><strong>기본값:</strong></p>
 * <ul>
 *   <li>connectTimeoutMs: 10000 (10초)</li>
 *   <li>method: GET</li>
 *   <li>userAgent: "probe/1.0"</li>
 * </ul>
 *
 * @param baseUri 상대 대상의 기준 URI (절대 URI, http 또는 https)
 * @param connectTimeoutMs 연결 타임아웃 (밀리초, 양수)
 * @param method 요청 메서드
 * @param userAgent User-Agent 헤더 값
 * @author Probe Team
 * @since 1.0.0
 */
public record HttpProbeConfig(
    URI baseUri,
    long connectTimeoutMs,
    Method method,
    String userAgent
) {

    public static final long DEFAULT_CONNECT_TIMEOUT_MS = 10_000L;
    public static final String DEFAULT_USER_AGENT = "probe/1.0";

    /**
     * 프로브 요청 메서드.
     */
    public enum Method {
        GET,
        HEAD
    }

    public HttpProbeConfig {
        if (baseUri == null) {
            throw new IllegalArgumentException("baseUri cannot be null");
        }
        if (!baseUri.isAbsolute()) {
            throw new IllegalArgumentException("baseUri must be absolute (current: " + baseUri + ")");
        }
        String scheme = baseUri.getScheme().toLowerCase();
        if (!scheme.equals("http") && !scheme.equals("https")) {
            throw new IllegalArgumentException("baseUri scheme must be http or https (current: " + scheme + ")");
        }
        if (connectTimeoutMs <= 0) {
            throw new IllegalArgumentException("connectTimeoutMs must be positive (current: " + connectTimeoutMs + ")");
        }
        if (method == null) {
            throw new IllegalArgumentException("method cannot be null");
        }
        if (userAgent == null || userAgent.isBlank()) {
            throw new IllegalArgumentException("userAgent cannot be null or blank");
        }
    }

    /**
     * 기본값으로 설정 생성.
     *
     * @param baseUri 기준 URI 문자열 (예: "http://localhost:3000")
     * @return 설정
     */
    public static HttpProbeConfig of(String baseUri) {
        if (baseUri == null || baseUri.isBlank()) {
            throw new IllegalArgumentException("baseUri cannot be null or blank");
        }
        return new HttpProbeConfig(URI.create(baseUri), DEFAULT_CONNECT_TIMEOUT_MS, Method.GET, DEFAULT_USER_AGENT);
    }

    public HttpProbeConfig withConnectTimeoutMs(long connectTimeoutMs) {
        return new HttpProbeConfig(baseUri, connectTimeoutMs, method, userAgent);
    }

    public HttpProbeConfig withMethod(Method method) {
        return new HttpProbeConfig(baseUri, connectTimeoutMs, method, userAgent);
    }

    public HttpProbeConfig withUserAgent(String userAgent) {
        return new HttpProbeConfig(baseUri, connectTimeoutMs, method, userAgent);
    }
}

package com.ryuqq.probe.adapter.http;

import org.junit.jupiter.api.Test;

import java.net.URI;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * HttpProbeConfig 유닛 테스트.
 *
 * @author Probe Team
 * @since 1.0.0
 */
class HttpProbeConfigTest {

    @Test
    void of_기본값_적용() {
        HttpProbeConfig config = HttpProbeConfig.of("http://localhost:3000");

        assertThat(config.baseUri()).isEqualTo(URI.create("http://localhost:3000"));
        assertThat(config.connectTimeoutMs()).isEqualTo(10_000L);
        assertThat(config.method()).isEqualTo(HttpProbeConfig.Method.GET);
        assertThat(config.userAgent()).isEqualTo("probe/1.0");
    }

    @Test
    void with_메서드는_해당_필드만_변경한_새_인스턴스_반환() {
        HttpProbeConfig base = HttpProbeConfig.of("https://example.com");

        HttpProbeConfig modified = base
            .withMethod(HttpProbeConfig.Method.HEAD)
            .withConnectTimeoutMs(500)
            .withUserAgent("warmup-bot");

        assertThat(modified.baseUri()).isEqualTo(base.baseUri());
        assertThat(modified.method()).isEqualTo(HttpProbeConfig.Method.HEAD);
        assertThat(modified.connectTimeoutMs()).isEqualTo(500L);
        assertThat(modified.userAgent()).isEqualTo("warmup-bot");
        assertThat(base.method()).isEqualTo(HttpProbeConfig.Method.GET);
    }

    @Test
    void 상대_baseUri_거부() {
        assertThatThrownBy(() -> HttpProbeConfig.of("/relative"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("must be absolute");
    }

    @Test
    void http_이외_스킴_거부() {
        assertThatThrownBy(() -> HttpProbeConfig.of("ftp://example.com"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("http or https");
    }

    @Test
    void 연결_타임아웃_0_이하_거부() {
        assertThatThrownBy(() -> HttpProbeConfig.of("http://localhost").withConnectTimeoutMs(0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("connectTimeoutMs must be positive (current: 0)");
    }

    @Test
    void 빈_userAgent_거부() {
        assertThatThrownBy(() -> HttpProbeConfig.of("http://localhost").withUserAgent(" "))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> HttpProbeConfig.of(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("baseUri cannot be null or blank");
    }
}

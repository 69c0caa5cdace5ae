package com.ryuqq.probe.core.model;

/**
 * 한 번의 시도에서 받은 응답.
 *
 * @author Probe Team
 * @since 1.0.0
 * @param statusCode HTTP 상태 코드 (세 자리, 100~999). 비표준 6xx 이상도 그대로 받아 분류기에 맡김
 */
public record ProbeResponse(int statusCode) {

    public ProbeResponse {
        if (statusCode < 100 || statusCode > 999) {
            throw new IllegalArgumentException(
                "statusCode must be between 100 and 999 (current: " + statusCode + ")"
            );
        }
    }

    public static ProbeResponse of(int statusCode) {
        return new ProbeResponse(statusCode);
    }
}

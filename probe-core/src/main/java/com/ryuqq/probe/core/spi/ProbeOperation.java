package com.ryuqq.probe.core.spi;

import com.ryuqq.probe.core.model.ProbeResponse;
import com.ryuqq.probe.core.model.ProbeTarget;

/**
 * 한 번의 프로브 시도를 수행하는 Operation SPI.
 *
 * <p>구현체는 반복 호출해도 안전해야 합니다 (읽기 전용 도달성 확인 등).
 * 응답을 받지 못하면 예외를 던지며, 실행자는 이를 재시도 가능한 실패로 처리합니다.</p>
 *
 * @author Probe Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ProbeOperation {

    /**
     * 대상에 대해 한 번 시도.
     *
     * @param target 프로브 대상
     * @param perAttemptTimeoutMs 이번 시도의 타임아웃 (밀리초), 0은 타임아웃 없음
     * @return 수신한 응답 (non-null)
     * @throws Exception 응답 없이 실패한 경우 (연결 거부, 타임아웃 등)
     */
    ProbeResponse invoke(ProbeTarget target, long perAttemptTimeoutMs) throws Exception;
}

package com.ryuqq.probe.core.spi;

/**
 * 재시도 사이의 대기 프리미티브.
 *
 * <p>구현체는 요청된 시간만큼 대기하거나, 대기를 완료할 수 없으면
 * {@link WaitAbortedException}을 던집니다 (예: 실행 컨텍스트가 해제됨).</p>
 *
 * @author Probe Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Sleeper {

    /**
     * 지정된 시간만큼 대기.
     *
     * @param millis 대기 시간 (밀리초, 양수)
     * @throws WaitAbortedException 대기를 완료할 수 없는 경우
     */
    void pause(long millis) throws WaitAbortedException;
}

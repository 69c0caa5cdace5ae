package com.ryuqq.probe.adapter.runner;

import com.ryuqq.probe.core.spi.Sleeper;
import com.ryuqq.probe.core.spi.WaitAbortedException;

/**
 * {@link Thread#sleep(long)} 기반 Sleeper.
 *
 * <p>InterruptedException 발생 시 현재 스레드의 인터럽트 플래그를 복원하고
 * {@link WaitAbortedException}으로 변환합니다. 실행 전체를 종료하려는 호출자가
 * 스레드를 인터럽트하면 재시도 루프가 중단됩니다.</p>
 *
 * <p><strong>성능 고려사항:</strong> 호출 스레드를 블로킹합니다.</p>
 *
 * @author Probe Team
 * @since 1.0.0
 */
public final class ThreadSleeper implements Sleeper {

    @Override
    public void pause(long millis) throws WaitAbortedException {
        if (millis <= 0) {
            throw new IllegalArgumentException("millis must be positive (current: " + millis + ")");
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new WaitAbortedException("Wait interrupted", e);
        }
    }
}

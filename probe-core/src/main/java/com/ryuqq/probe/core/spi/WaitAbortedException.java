package com.ryuqq.probe.core.spi;

/**
 * 재시도 대기를 완료할 수 없음.
 *
 * <p>실행 컨텍스트가 외부에서 해제되었거나 스레드가 인터럽트된 경우 발생합니다.
 * 실행자는 이 예외를 받으면 더 이상 시도하지 않고 중단 결과를 반환합니다.</p>
 *
 * @author Probe Team
 * @since 1.0.0
 */
public class WaitAbortedException extends Exception {

    public WaitAbortedException(String message) {
        super(message);
    }

    public WaitAbortedException(String message, Throwable cause) {
        super(message, cause);
    }
}

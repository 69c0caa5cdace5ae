package com.ryuqq.probe.core.spi;

/**
 * 세션 획득 또는 해제 실패.
 *
 * <p>Operation 수준의 실패와 달리 하네스 설정 오류로 간주하며, 재시도하지 않고 호출자에게 전파됩니다.</p>
 *
 * @author Probe Team
 * @since 1.0.0
 */
public class ProbeSessionException extends RuntimeException {

    public ProbeSessionException(String message) {
        super(message);
    }

    public ProbeSessionException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.ryuqq.probe.core.spi;

/**
 * 프로브 세션 팩토리 SPI.
 *
 * <p>호출마다 새롭고 격리된 세션을 생성해야 합니다.
 * 한 대상의 프로브가 호출자의 컨텍스트나 다른 프로브의 상태를 오염시키지 않도록 합니다.</p>
 *
 * @author Probe Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ProbeSessionFactory {

    /**
     * 새 세션 획득.
     *
     * @return 새 세션 (non-null)
     * @throws ProbeSessionException 세션을 만들 수 없는 경우
     */
    ProbeSession open();
}

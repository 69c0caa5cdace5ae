package com.ryuqq.probe.core.spi;

/**
 * 프로브 하나를 위한 격리된 실행 컨텍스트.
 *
 * <p>세션은 자신만의 Operation과 Sleeper를 제공합니다.
 * 세션이 닫히면 진행 중인 대기는 {@link WaitAbortedException}으로 끝나야 합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * try (ProbeSession session = factory.open()) {
 *     ProbeResponse response = session.operation().invoke(target, 10_000);
 * }
 * }</pre>
 *
 * @author Probe Team
 * @since 1.0.0
 */
public interface ProbeSession extends AutoCloseable {

    /**
     * 이 세션에 묶인 Operation.
     *
     * @return Operation (non-null)
     */
    ProbeOperation operation();

    /**
     * 이 세션에 묶인 대기 프리미티브.
     *
     * @return Sleeper (non-null)
     */
    Sleeper sleeper();

    /**
     * 세션 해제.
     *
     * <p>여러 번 호출해도 안전해야 합니다.</p>
     *
     * @throws ProbeSessionException 해제에 실패한 경우
     */
    @Override
    void close();
}

package com.ryuqq.probe.core.model;

/**
 * 프로브 대상.
 *
 * <p>상대 경로(예: {@code /about}) 또는 절대 URL을 값으로 가집니다.
 * 해석은 {@link com.ryuqq.probe.core.spi.ProbeOperation} 구현체가 담당합니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 *
 * @author Probe Team
 * @since 1.0.0
 */
public final class ProbeTarget {

    private final String value;

    private ProbeTarget(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("ProbeTarget cannot be null or blank");
        }
        this.value = value;
    }

    /**
     * ProbeTarget 생성.
     *
     * @param value 경로 또는 URL
     * @return ProbeTarget 인스턴스
     * @throws IllegalArgumentException 값이 null이거나 빈 문자열인 경우
     */
    public static ProbeTarget of(String value) {
        return new ProbeTarget(value);
    }

    /**
     * 대상 값 조회.
     *
     * @return 경로 또는 URL
     */
    public String getValue() {
        return value;
    }

    /**
     * 절대 URL인지 확인.
     *
     * @return 스킴(http:// 또는 https://)으로 시작하면 true
     */
    public boolean isAbsolute() {
        return value.startsWith("http://") || value.startsWith("https://");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ProbeTarget that = (ProbeTarget) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}

package com.ryuqq.probe.core.outcome;

/**
 * 성공 결과.
 *
 * @author Probe Team
 * @since 1.0.0
 * @param status 상태 코드
 */
public record Success(int status) implements ProbeOutcome {
}

package com.ryuqq.probe.testkit.assertion;

import com.ryuqq.probe.application.batch.BatchReport;
import com.ryuqq.probe.core.model.ProbeResult;
import com.ryuqq.probe.core.model.ProbeTarget;

import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.fail;

/**
 * 도달 가능성 검증 헬퍼.
 *
 * <p>실행자는 검증하지 않으므로, 호출자가 결과를 받은 뒤 이 헬퍼로 단언합니다.</p>
 *
 * @author Probe Team
 * @since 1.0.0
 */
public final class ProbeAssertions {

    private ProbeAssertions() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 단일 결과가 성공인지 검증.
     *
     * @param result 프로브 결과
     * @param target 대상 (메시지용)
     * @throws AssertionError 실패한 결과인 경우
     */
    public static void assertReachable(ProbeResult result, ProbeTarget target) {
        if (result == null) {
            throw new IllegalArgumentException("result cannot be null");
        }
        if (!result.succeeded()) {
            fail(describe(target, result));
        }
    }

    /**
     * 배치의 모든 대상이 성공인지 검증. 실패한 대상을 한 메시지에 모두 나열합니다.
     *
     * @param report 배치 리포트
     * @throws AssertionError 실패한 대상이 하나라도 있는 경우
     */
    public static void assertAllReachable(BatchReport report) {
        if (report == null) {
            throw new IllegalArgumentException("report cannot be null");
        }
        if (report.allSucceeded()) {
            return;
        }
        String failures = report.failures().stream()
            .map(entry -> describe(entry.target(), entry.result()))
            .collect(Collectors.joining("\n  ", "\n  ", ""));
        fail(report.summary() + failures);
    }

    private static String describe(ProbeTarget target, ProbeResult result) {
        return String.format("Navigation to %s should succeed (status: %s, attempts: %d)",
            target, result.status(), result.attempts());
    }
}

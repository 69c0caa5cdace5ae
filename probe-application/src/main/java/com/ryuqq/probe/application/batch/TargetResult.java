package com.ryuqq.probe.application.batch;

import com.ryuqq.probe.core.model.ProbeResult;
import com.ryuqq.probe.core.model.ProbeTarget;

/**
 * 배치 실행의 한 항목.
 *
 * @author Probe Team
 * @since 1.0.0
 * @param target 프로브 대상
 * @param result 실행 결과
 */
public record TargetResult(ProbeTarget target, ProbeResult result) {

    public TargetResult {
        if (target == null) {
            throw new IllegalArgumentException("target cannot be null");
        }
        if (result == null) {
            throw new IllegalArgumentException("result cannot be null");
        }
    }

    public boolean succeeded() {
        return result.succeeded();
    }
}

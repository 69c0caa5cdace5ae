package com.ryuqq.probe.application.batch;

import com.ryuqq.probe.core.model.ProbeTarget;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 배치 실행 결과 (불변).
 *
 * <p>입력 순서대로 {@link TargetResult}를 담습니다. 검증(assert)은 하지 않으며,
 * 실패 항목을 테스트 실패로 바꾸는 것은 호출자의 몫입니다.</p>
 *
 * @author Probe Team
 * @since 1.0.0
 */
public final class BatchReport {

    private static final BatchReport EMPTY = new BatchReport(List.of());

    private final List<TargetResult> entries;

    private BatchReport(List<TargetResult> entries) {
        this.entries = entries;
    }

    /**
     * 항목 목록으로 생성.
     *
     * @param entries 항목 (입력 순서)
     * @return BatchReport
     * @throws IllegalArgumentException entries가 null이거나 null 항목을 포함한 경우
     */
    public static BatchReport of(List<TargetResult> entries) {
        if (entries == null) {
            throw new IllegalArgumentException("entries cannot be null");
        }
        if (entries.stream().anyMatch(entry -> entry == null)) {
            throw new IllegalArgumentException("entries cannot contain null");
        }
        return new BatchReport(List.copyOf(entries));
    }

    public static BatchReport empty() {
        return EMPTY;
    }

    /**
     * 전체 항목 (입력 순서).
     *
     * @return 불변 리스트
     */
    public List<TargetResult> entries() {
        return entries;
    }

    /**
     * 실패한 항목.
     *
     * @return 불변 리스트 (입력 순서 유지)
     */
    public List<TargetResult> failures() {
        return entries.stream().filter(entry -> !entry.succeeded()).collect(Collectors.toUnmodifiableList());
    }

    /**
     * 성공한 항목.
     *
     * @return 불변 리스트 (입력 순서 유지)
     */
    public List<TargetResult> successes() {
        return entries.stream().filter(TargetResult::succeeded).collect(Collectors.toUnmodifiableList());
    }

    /**
     * 실패한 대상 목록.
     *
     * @return 불변 리스트
     */
    public List<ProbeTarget> failedTargets() {
        return entries.stream()
            .filter(entry -> !entry.succeeded())
            .map(TargetResult::target)
            .collect(Collectors.toUnmodifiableList());
    }

    public boolean allSucceeded() {
        return entries.stream().allMatch(TargetResult::succeeded);
    }

    public int size() {
        return entries.size();
    }

    /**
     * 한 줄 요약.
     *
     * @return 예: "3 checked, 2 succeeded, 1 failed [/broken]"
     */
    public String summary() {
        List<ProbeTarget> failed = failedTargets();
        String base = String.format("%d checked, %d succeeded, %d failed",
            entries.size(), entries.size() - failed.size(), failed.size());
        if (failed.isEmpty()) {
            return base;
        }
        return base + " " + failed;
    }

    @Override
    public String toString() {
        return "BatchReport{" + summary() + '}';
    }
}

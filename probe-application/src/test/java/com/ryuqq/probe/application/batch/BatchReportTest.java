package com.ryuqq.probe.application.batch;

import com.ryuqq.probe.core.model.ProbeResult;
import com.ryuqq.probe.core.model.ProbeTarget;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * BatchReport 유닛 테스트.
 *
 * @author Probe Team
 * @since 1.0.0
 */
class BatchReportTest {

    private static TargetResult ok(String target) {
        return new TargetResult(ProbeTarget.of(target), ProbeResult.success(200, 1));
    }

    private static TargetResult failed(String target) {
        return new TargetResult(ProbeTarget.of(target), ProbeResult.failure(404, 1, "Received status 404"));
    }

    @Test
    void 실패_항목만_입력_순서대로_반환() {
        // given
        BatchReport report = BatchReport.of(List.of(ok("/"), failed("/b"), ok("/c"), failed("/d")));

        // when & then
        assertThat(report.size()).isEqualTo(4);
        assertThat(report.failedTargets()).containsExactly(ProbeTarget.of("/b"), ProbeTarget.of("/d"));
        assertThat(report.successes()).extracting(TargetResult::target)
            .containsExactly(ProbeTarget.of("/"), ProbeTarget.of("/c"));
        assertThat(report.allSucceeded()).isFalse();
    }

    @Test
    void 모두_성공하면_allSucceeded_true() {
        BatchReport report = BatchReport.of(List.of(ok("/a"), ok("/b")));

        assertThat(report.allSucceeded()).isTrue();
        assertThat(report.failures()).isEmpty();
        assertThat(report.summary()).isEqualTo("2 checked, 2 succeeded, 0 failed");
    }

    @Test
    void summary에_실패_대상이_포함됨() {
        BatchReport report = BatchReport.of(List.of(ok("/a"), failed("/broken")));

        assertThat(report.summary()).isEqualTo("2 checked, 1 succeeded, 1 failed [/broken]");
    }

    @Test
    void 입력_리스트를_복사하여_불변_보장() {
        // given
        List<TargetResult> source = new ArrayList<>(List.of(ok("/a")));
        BatchReport report = BatchReport.of(source);

        // when
        source.add(failed("/b"));

        // then
        assertThat(report.size()).isEqualTo(1);
        assertThatThrownBy(() -> report.entries().add(ok("/c")))
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void empty_리포트() {
        assertThat(BatchReport.empty().entries()).isEmpty();
        assertThat(BatchReport.empty().allSucceeded()).isTrue();
    }

    @Test
    void null_입력은_예외() {
        assertThatThrownBy(() -> BatchReport.of(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("entries cannot be null");
        assertThatThrownBy(() -> BatchReport.of(Arrays.asList(ok("/a"), null)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("entries cannot contain null");
        assertThatThrownBy(() -> new TargetResult(null, ProbeResult.success(200, 1)))
            .isInstanceOf(IllegalArgumentException.class);
    }
}

package com.phillippitts.sitedetect.domain;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DetectionStatusTest {

    private static final EngineResult OK =
            EngineResult.success(Capability.DAMAGE, "v1", 0.9, null, 10, false);
    private static final EngineResult FAILED =
            EngineResult.failure(Capability.MATERIAL, null, 10, "EngineTimeout: Deadline of 5000 ms exceeded");

    @Test
    void shouldDeriveTerminalStatusFromResults() {
        assertThat(DetectionStatus.fromResults(List.of(OK))).isEqualTo(DetectionStatus.COMPLETED);
        assertThat(DetectionStatus.fromResults(List.of(OK, FAILED))).isEqualTo(DetectionStatus.PARTIAL);
        assertThat(DetectionStatus.fromResults(List.of(FAILED))).isEqualTo(DetectionStatus.FAILED);
        assertThat(DetectionStatus.fromResults(List.of())).isEqualTo(DetectionStatus.FAILED);
    }

    @Test
    void shouldMarkOnlyFinalStatesTerminal() {
        assertThat(DetectionStatus.QUEUED.isTerminal()).isFalse();
        assertThat(DetectionStatus.PROCESSING.isTerminal()).isFalse();
        assertThat(DetectionStatus.PARTIAL.isTerminal()).isTrue();
    }

    @Test
    void shouldNormalizeFailureResults() {
        assertThat(FAILED.modelVersion()).isEqualTo(EngineResult.UNAVAILABLE);
        assertThat(FAILED.confidence()).isZero();
        assertThat(FAILED.payload()).isEmpty();
        assertThat(FAILED.isSuccess()).isFalse();
    }

    @Test
    void shouldRejectConfidenceOutsideUnitRange() {
        assertThatThrownBy(() -> EngineResult.success(Capability.DAMAGE, "v1", 1.2, null, 1, false))
                .isInstanceOf(IllegalArgumentException.class);
    }
}

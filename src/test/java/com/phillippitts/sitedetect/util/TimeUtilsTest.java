package com.phillippitts.sitedetect.util;

import com.phillippitts.sitedetect.testutil.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class TimeUtilsTest {

    @Test
    void shouldTruncateNanosToMillis() {
        assertThat(TimeUtils.nanosToMillis(1_500_000L)).isEqualTo(1L);
        assertThat(TimeUtils.nanosToMillis(0L)).isZero();
    }

    @Test
    void shouldCalculateElapsedMillisFromPastTimestamp() {
        long startNanos = System.nanoTime() - (1_000L * TimeUtils.NANOS_PER_MILLI);

        long elapsedMs = TimeUtils.elapsedMillis(startNanos);

        assertThat(elapsedMs).isGreaterThanOrEqualTo(1_000L);
        assertThat(elapsedMs).isLessThan(1_100L);
    }

    @Test
    void shouldNeverReportNegativeElapsed() {
        assertThat(TimeUtils.elapsedMillis(System.nanoTime() + 5_000 * TimeUtils.NANOS_PER_MILLI)).isZero();
    }

    @Test
    void shouldDetectElapsedTimeoutInclusively() {
        MutableClock clock = new MutableClock();
        Instant since = clock.instant();

        clock.advance(Duration.ofSeconds(59));
        assertThat(TimeUtils.hasElapsed(clock, since, Duration.ofSeconds(60))).isFalse();

        clock.advance(Duration.ofSeconds(1));
        assertThat(TimeUtils.hasElapsed(clock, since, Duration.ofSeconds(60))).isTrue();
    }

    @Test
    void shouldTreatMissingStartAsElapsed() {
        assertThat(TimeUtils.hasElapsed(new MutableClock(), null, Duration.ofHours(1))).isTrue();
    }
}

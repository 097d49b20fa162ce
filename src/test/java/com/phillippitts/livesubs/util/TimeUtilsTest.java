package com.phillippitts.livesubs.util;

import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link TimeUtils}.
 */
class TimeUtilsTest {

    @Test
    void shouldConvertNanosToMillis() {
        assertThat(TimeUtils.nanosToMillis(5_000_000L)).isEqualTo(5L);
        // 2.999 ms truncates
        assertThat(TimeUtils.nanosToMillis(2_999_999L)).isEqualTo(2L);
        assertThat(TimeUtils.nanosToMillis(0L)).isZero();
    }

    @Test
    void shouldCalculateElapsedMillis() throws InterruptedException {
        long startNanos = System.nanoTime();

        Thread.sleep(10);

        assertThat(TimeUtils.elapsedMillis(startNanos)).isGreaterThanOrEqualTo(10L).isLessThan(5_000L);
    }

    @Test
    void shouldReturnMillisUntilFutureDeadline() {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(2);

        assertThat(TimeUtils.millisUntil(deadline, 1L)).isBetween(1_000L, 2_000L);
    }

    @Test
    void shouldReturnFloorForPassedDeadline() {
        long deadline = System.nanoTime() - TimeUnit.SECONDS.toNanos(1);

        assertThat(TimeUtils.millisUntil(deadline, 1L)).isEqualTo(1L);
        assertThat(TimeUtils.millisUntil(deadline, 0L)).isZero();
    }
}

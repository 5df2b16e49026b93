package com.metrion.service.core.statistics;

import static org.assertj.core.api.Assertions.assertThat;

import com.metrion.query.model.ComparisonOperator;
import com.metrion.service.core.query.TimeWindow;
import com.metrion.service.core.query.TimestampKeys;
import java.time.LocalDateTime;
import java.util.Map;
import org.junit.jupiter.api.Test;

class StatisticsDurationClampTest {

    private static final LocalDateTime REQUESTED_START = LocalDateTime.of(2013, 1, 4, 16, 0);
    private static final LocalDateTime REQUESTED_END = LocalDateTime.of(2013, 1, 4, 18, 0);

    private static TimeWindow window() {
        return new TimeWindow(
                REQUESTED_START.minusMinutes(30),
                REQUESTED_END.plusMinutes(30),
                REQUESTED_START,
                REQUESTED_END,
                ComparisonOperator.GT,
                ComparisonOperator.LT,
                30,
                TimestampKeys.START_END);
    }

    private static StatisticsRow row(LocalDateTime durationStart, LocalDateTime durationEnd) {
        return new StatisticsRow(
                Map.of(), "GiB", 1.0, 9.0, 4.5, 45.0, 10L, 7200, null, null, durationStart, durationEnd, null);
    }

    @Test
    void boundsInsideWindowAreKept() {
        StatisticsRow clamped = StatisticsDurationClamp.clamp(
                row(LocalDateTime.of(2013, 1, 4, 16, 42), LocalDateTime.of(2013, 1, 4, 16, 47)), window());

        assertThat(clamped.durationStart()).isEqualTo(LocalDateTime.of(2013, 1, 4, 16, 42));
        assertThat(clamped.durationEnd()).isEqualTo(LocalDateTime.of(2013, 1, 4, 16, 47));
        assertThat(clamped.duration()).isEqualTo(300.0d);
    }

    @Test
    void boundsInSearchOffsetAreClampedToRequest() {
        StatisticsRow clamped = StatisticsDurationClamp.clamp(
                row(LocalDateTime.of(2013, 1, 4, 15, 40), LocalDateTime.of(2013, 1, 4, 18, 20)), window());

        assertThat(clamped.durationStart()).isEqualTo(REQUESTED_START);
        assertThat(clamped.durationEnd()).isEqualTo(REQUESTED_END);
        assertThat(clamped.duration()).isEqualTo(7200.0d);
    }

    @Test
    void samplesEntirelyOutsideRequestInvalidateDuration() {
        StatisticsRow clamped = StatisticsDurationClamp.clamp(
                row(LocalDateTime.of(2013, 1, 4, 18, 10), LocalDateTime.of(2013, 1, 4, 18, 20)), window());

        assertThat(clamped.durationStart()).isNull();
        assertThat(clamped.durationEnd()).isNull();
        assertThat(clamped.duration()).isNull();
        assertThat(clamped.sum()).isEqualTo(45.0d);
    }

    @Test
    void withoutWindowOnlyDurationIsComputed() {
        StatisticsRow clamped = StatisticsDurationClamp.clamp(
                row(LocalDateTime.of(2013, 1, 4, 16, 0), LocalDateTime.of(2013, 1, 4, 16, 0, 30)), null);

        assertThat(clamped.duration()).isEqualTo(30.0d);
    }
}

package com.metrion.service.core.statistics;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * One computed aggregate. {@code durationStart}/{@code durationEnd} are the timestamps of the first
 * and last sample seen; {@code duration} is in seconds and null when the bounds are unusable.
 */
public record StatisticsRow(
        Map<String, String> groupBy,
        String unit,
        Double min,
        Double max,
        Double avg,
        Double sum,
        Long count,
        Integer period,
        LocalDateTime periodStart,
        LocalDateTime periodEnd,
        LocalDateTime durationStart,
        LocalDateTime durationEnd,
        Double duration) {

    public StatisticsRow {
        groupBy = groupBy == null ? Map.of() : Map.copyOf(groupBy);
    }

    public StatisticsRow withDuration(LocalDateTime start, LocalDateTime end, Double seconds) {
        return new StatisticsRow(
                groupBy, unit, min, max, avg, sum, count, period, periodStart, periodEnd, start, end, seconds);
    }
}

package com.metrion.service.core.statistics;

import com.metrion.service.core.query.TimeWindow;
import java.time.Duration;
import java.time.LocalDateTime;
import lombok.extern.slf4j.Slf4j;

/**
 * Clamps the duration bounds of computed statistics back to the window the caller asked for. The
 * storage query ran over the window widened by the search offset, so samples may fall outside it.
 */
@Slf4j
public final class StatisticsDurationClamp {

    private StatisticsDurationClamp() {}

    public static StatisticsRow clamp(StatisticsRow row, TimeWindow window) {
        LocalDateTime requestedStart = window == null ? null : window.startRaw();
        LocalDateTime requestedEnd = window == null ? null : window.endRaw();
        LocalDateTime start = row.durationStart();
        LocalDateTime end = row.durationEnd();

        if (requestedStart != null && start != null && start.isBefore(requestedStart)) {
            start = requestedStart;
            log.debug("clamping min timestamp to range");
        }
        if (requestedEnd != null && end != null && end.isAfter(requestedEnd)) {
            end = requestedEnd;
            log.debug("clamping max timestamp to range");
        }

        // min after max once clamped: every sample lay outside the requested range
        if (start != null && end != null && !start.isAfter(end)) {
            Duration d = Duration.between(start, end);
            return row.withDuration(start, end, d.toNanos() / 1_000_000_000.0d);
        }
        return row.withDuration(null, null, null);
    }
}

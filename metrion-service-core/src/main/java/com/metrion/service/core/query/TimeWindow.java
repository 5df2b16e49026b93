package com.metrion.service.core.query;

import com.metrion.query.model.ComparisonOperator;
import java.time.LocalDateTime;

/**
 * Query time window. {@code start}/{@code end} are widened by the search offset and go to the
 * backend; {@code startRaw}/{@code endRaw} are the bounds as requested, kept for clamping results.
 * Every bound is optional and timezone-naive UTC.
 */
public record TimeWindow(
        LocalDateTime start,
        LocalDateTime end,
        LocalDateTime startRaw,
        LocalDateTime endRaw,
        ComparisonOperator startOp,
        ComparisonOperator endOp,
        int searchOffset,
        TimestampKeys keys) {

    public boolean hasStart() {
        return start != null;
    }

    public boolean hasEnd() {
        return end != null;
    }
}

package com.metrion.service.core.query;

import com.metrion.query.model.ComparisonOperator;
import com.metrion.query.model.FilterExpression;
import com.metrion.service.core.catalog.AcceptedFields;
import com.metrion.service.core.error.InvalidValueException;
import com.metrion.service.core.error.UnimplementedOperatorException;
import com.metrion.service.core.error.UnknownArgumentException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Turns {@code timestamp} filters and the optional {@code search_offset} into a {@link TimeWindow}.
 *
 * <pre>
 * [query start ... requested start ... requested end ... query end]
 * </pre>
 *
 * The search offset, in minutes, pushes both ends outwards.
 */
@Component
public class TimestampWindowResolver {

    public TimeWindow resolve(List<FilterExpression> timestampFilters, String searchOffset, AcceptedFields accepted) {
        String rawStart = null;
        String rawEnd = null;
        ComparisonOperator startOp = null;
        ComparisonOperator endOp = null;
        for (FilterExpression expr : timestampFilters) {
            if (expr.op().isUpperBound()) {
                rawEnd = expr.value();
                endOp = expr.op();
            } else if (expr.op().isLowerBound()) {
                rawStart = expr.value();
                startOp = expr.op();
            } else {
                throw new UnimplementedOperatorException(expr.field(), expr.op());
            }
        }

        int offset = parseSearchOffset(searchOffset);
        LocalDateTime start = parseTimestamp(rawStart);
        LocalDateTime end = parseTimestamp(rawEnd);

        TimestampKeys keys = TimestampKeys.select(accepted)
                .orElseThrow(() -> new UnknownArgumentException(FieldClassifier.TIMESTAMP, "not valid for this resource"));

        return new TimeWindow(
                start == null ? null : start.minusMinutes(offset),
                end == null ? null : end.plusMinutes(offset),
                start,
                end,
                startOp,
                endOp,
                offset,
                keys);
    }

    static int parseSearchOffset(String value) {
        if (value == null || value.isBlank()) {
            return 0;
        }
        int offset;
        try {
            offset = Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new InvalidValueException(value, "non-negative integer", e);
        }
        if (offset < 0) {
            throw new InvalidValueException(value, "non-negative integer");
        }
        return offset;
    }

    /**
     * Parses extended ISO-8601 text. A trailing offset or zone is dropped and the wall-clock time
     * kept as written: {@code 16:42+02:00} reads as {@code 16:42}. Stored timestamps are naive UTC,
     * so callers are expected to send UTC. Blank input means the bound is absent.
     */
    public static LocalDateTime parseTimestamp(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String s = value.trim();
        if (s.length() > 10 && s.charAt(10) == ' ') {
            s = s.substring(0, 10) + 'T' + s.substring(11);
        }
        try {
            TemporalAccessor parsed =
                    DateTimeFormatter.ISO_DATE_TIME.parseBest(s, ZonedDateTime::from, LocalDateTime::from);
            if (parsed instanceof ZonedDateTime zoned) {
                return zoned.toLocalDateTime();
            }
            return (LocalDateTime) parsed;
        } catch (DateTimeParseException notDateTime) {
            try {
                return LocalDate.parse(s).atStartOfDay();
            } catch (DateTimeParseException e) {
                throw new InvalidValueException(value, "ISO 8601 timestamp", notDateTime);
            }
        }
    }
}

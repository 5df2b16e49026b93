package com.metrion.service.core.statistics;

import com.metrion.query.model.CallerIdentity;
import com.metrion.query.model.FilterExpression;
import com.metrion.service.core.catalog.StorageOperation;
import com.metrion.service.core.query.GroupByValidator;
import com.metrion.service.core.query.QueryCompiler;
import com.metrion.service.core.query.QueryDescriptor;
import com.metrion.service.core.spi.StatisticsExecutor;
import java.util.List;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Statistics over the samples of one meter. Rows come back with their duration bounds clamped to
 * the requested window, without the search offset.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StatisticsQueryService {

    public static final String METER_FIELD = "meter";

    private final QueryCompiler compiler;
    private final GroupByValidator groupByValidator;
    private final StatisticsExecutor statisticsExecutor;

    public List<StatisticsRow> statistics(
            String meter, List<FilterExpression> query, List<String> groupBy, Integer period, CallerIdentity caller) {
        if (meter == null || meter.isBlank()) {
            throw new IllegalArgumentException("meter is required");
        }
        if (period != null && period < 0) {
            throw new IllegalArgumentException("Period must be positive.");
        }

        QueryDescriptor descriptor = compiler
                .compile(query, StorageOperation.SAMPLES.acceptedFields(), caller)
                .withFilter(METER_FIELD, meter);
        Set<String> groups = groupByValidator.validate(groupBy);

        List<StatisticsRow> computed =
                statisticsExecutor.computeStatistics(new StatisticsQuery(descriptor, period, groups));
        if (computed == null) {
            computed = List.of();
        }
        log.debug("meter {} statistics: {} row(s), groupby={}, period={}", meter, computed.size(), groups, period);
        return computed.stream()
                .map(row -> StatisticsDurationClamp.clamp(row, descriptor.window()))
                .toList();
    }
}

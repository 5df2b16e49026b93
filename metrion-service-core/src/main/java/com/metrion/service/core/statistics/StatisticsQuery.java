package com.metrion.service.core.statistics;

import com.metrion.service.core.query.QueryDescriptor;
import java.util.Set;

/**
 * Aggregation request handed to the statistics executor.
 *
 * @param periodSeconds bucket length, null for a single bucket over the whole window
 */
public record StatisticsQuery(QueryDescriptor descriptor, Integer periodSeconds, Set<String> groupBy) {

    public StatisticsQuery {
        groupBy = groupBy == null ? Set.of() : Set.copyOf(groupBy);
    }
}

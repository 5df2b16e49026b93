package com.metrion.service.core.spi;

import com.metrion.service.core.statistics.StatisticsQuery;
import com.metrion.service.core.statistics.StatisticsRow;
import java.util.List;

public interface StatisticsExecutor {

    List<StatisticsRow> computeStatistics(StatisticsQuery query);
}

package com.metrion.service.core.spi;

import com.metrion.service.core.query.QueryDescriptor;
import java.util.List;
import java.util.Map;

/** Storage side of a filter query. Implementations run the descriptor; errors propagate as thrown. */
public interface StorageExecutor {

    /**
     * @param operationId catalog id of the storage operation the descriptor was compiled for
     * @return matching records, in whatever shape the backend produces
     */
    List<Map<String, Object>> execute(String operationId, QueryDescriptor descriptor);
}

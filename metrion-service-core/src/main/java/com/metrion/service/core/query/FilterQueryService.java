package com.metrion.service.core.query;

import com.metrion.query.model.CallerIdentity;
import com.metrion.query.model.FilterExpression;
import com.metrion.service.core.catalog.AcceptedFields;
import com.metrion.service.core.catalog.OperationCatalog;
import com.metrion.service.core.spi.StorageExecutor;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
@Slf4j
public class FilterQueryService {

    private final OperationCatalog catalog;
    private final QueryCompiler compiler;
    private final StorageExecutor storageExecutor;

    public List<Map<String, Object>> find(String operationId, List<FilterExpression> query, CallerIdentity caller) {
        AcceptedFields accepted = catalog.forOperation(operationId);
        QueryDescriptor descriptor = compiler.compile(query, accepted, caller);
        List<Map<String, Object>> records = storageExecutor.execute(operationId, descriptor);
        log.debug("{} query returned {} record(s)", operationId, records == null ? 0 : records.size());
        return records == null ? List.of() : records;
    }
}

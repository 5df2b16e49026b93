package com.metrion.service.core.catalog;

import com.metrion.service.core.config.QueryProperties;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Lookup of accepted filter fields by storage operation id. Built-in operations come from {@link
 * StorageOperation}; deployments may declare more under {@code metrion.query.operations}.
 */
@Service
@Slf4j
public class OperationCatalog {

    private final Map<String, AcceptedFields> configured;

    public OperationCatalog(QueryProperties properties) {
        Map<String, AcceptedFields> declared = new LinkedHashMap<>();
        if (properties != null && properties.getOperations() != null) {
            properties.getOperations().forEach((id, fields) -> {
                String key = id.trim().toLowerCase(Locale.ROOT);
                if (StorageOperation.fromId(key).isPresent()) {
                    throw new IllegalStateException("Operation " + id + " is built in and cannot be redeclared");
                }
                declared.put(key, AcceptedFields.of(fields.getFields(), fields.getInternalFields()));
            });
        }
        this.configured = Map.copyOf(declared);
        if (!configured.isEmpty()) {
            log.info("Operation catalog: {} configured operation(s) {}", configured.size(), configured.keySet());
        }
    }

    public AcceptedFields forOperation(String operationId) {
        return find(operationId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown storage operation: " + operationId));
    }

    public Optional<AcceptedFields> find(String operationId) {
        Optional<StorageOperation> builtIn = StorageOperation.fromId(operationId);
        if (builtIn.isPresent()) {
            return Optional.of(builtIn.get().acceptedFields());
        }
        if (operationId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(configured.get(operationId.trim().toLowerCase(Locale.ROOT)));
    }

    public Set<String> configuredOperations() {
        return configured.keySet();
    }
}

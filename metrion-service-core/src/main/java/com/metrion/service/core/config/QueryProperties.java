package com.metrion.service.core.config;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "metrion.query")
public class QueryProperties {
    private List<String> privilegedRoles = new ArrayList<>(List.of("admin"));
    private Map<String, OperationFields> operations = new LinkedHashMap<>();

    public List<String> getPrivilegedRoles() {
        return privilegedRoles;
    }

    public void setPrivilegedRoles(List<String> privilegedRoles) {
        this.privilegedRoles = privilegedRoles;
    }

    public Map<String, OperationFields> getOperations() {
        return operations;
    }

    public void setOperations(Map<String, OperationFields> operations) {
        this.operations = operations;
    }

    /** Storage operation declared in configuration in addition to the built-in ones. */
    public static class OperationFields {
        private List<String> fields = new ArrayList<>();
        private List<String> internalFields = new ArrayList<>();

        public List<String> getFields() {
            return fields;
        }

        public void setFields(List<String> fields) {
            this.fields = fields;
        }

        public List<String> getInternalFields() {
            return internalFields;
        }

        public void setInternalFields(List<String> internalFields) {
            this.internalFields = internalFields;
        }
    }
}

package com.metrion.service.core.catalog;

import java.util.Locale;
import java.util.Optional;

/** Built-in storage operations and the filter fields each of them takes. */
public enum StorageOperation {
    SAMPLES(
            "samples",
            AcceptedFields.of(
                    "user",
                    "project",
                    "resource",
                    "meter",
                    "source",
                    "message_id",
                    "start",
                    "start_timestamp_op",
                    "end",
                    "end_timestamp_op",
                    "metaquery")),
    METERS("meters", AcceptedFields.of("user", "project", "resource", "source", "metaquery")),
    RESOURCES(
            "resources",
            AcceptedFields.of(
                    "user",
                    "project",
                    "resource",
                    "source",
                    "start_timestamp",
                    "start_timestamp_op",
                    "end_timestamp",
                    "end_timestamp_op",
                    "metaquery")),
    ALARMS("alarms", AcceptedFields.of("name", "user", "project", "enabled", "alarm_id")),
    ALARM_HISTORY(
            "alarm_history",
            AcceptedFields.of(
                            "user",
                            "project",
                            "type",
                            "start_timestamp",
                            "start_timestamp_op",
                            "end_timestamp",
                            "end_timestamp_op")
                    .withInternal("alarm_id", "on_behalf_of"));

    private final String id;
    private final AcceptedFields acceptedFields;

    StorageOperation(String id, AcceptedFields acceptedFields) {
        this.id = id;
        this.acceptedFields = acceptedFields;
    }

    public String id() {
        return id;
    }

    public AcceptedFields acceptedFields() {
        return acceptedFields;
    }

    public static Optional<StorageOperation> fromId(String id) {
        if (id == null || id.isBlank()) {
            return Optional.empty();
        }
        String normalized = id.trim().toLowerCase(Locale.ROOT);
        for (StorageOperation op : values()) {
            if (op.id.equals(normalized)) {
                return Optional.of(op);
            }
        }
        return Optional.empty();
    }
}

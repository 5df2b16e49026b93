package com.metrion.service.core.query;

import com.metrion.service.core.catalog.AcceptedFields;
import java.util.Optional;

/** Naming of the window bounds, which differs between storage operations. */
public enum TimestampKeys {
    START_END("start", "end"),
    START_END_TIMESTAMP("start_timestamp", "end_timestamp");

    private final String startKey;
    private final String endKey;

    TimestampKeys(String startKey, String endKey) {
        this.startKey = startKey;
        this.endKey = endKey;
    }

    public String startKey() {
        return startKey;
    }

    public String endKey() {
        return endKey;
    }

    /** {@code start/end} wins when an operation declares both forms. */
    public static Optional<TimestampKeys> select(AcceptedFields accepted) {
        if (accepted.accepts(START_END.startKey)) {
            return Optional.of(START_END);
        }
        if (accepted.accepts(START_END_TIMESTAMP.startKey)) {
            return Optional.of(START_END_TIMESTAMP);
        }
        return Optional.empty();
    }
}

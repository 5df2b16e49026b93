package com.metrion.service.core.query;

import com.metrion.service.core.catalog.AcceptedFields;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Compiled, backend-ready form of a filter list.
 *
 * @param filters equality filters keyed by storage column
 * @param metaquery typed metadata filters keyed by dotted path; empty when none or not accepted
 * @param window time window, null when the query had no timestamp or search offset filter
 */
public record QueryDescriptor(Map<String, String> filters, Map<String, Object> metaquery, TimeWindow window) {

    public QueryDescriptor {
        filters = filters == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(filters));
        metaquery = metaquery == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metaquery));
    }

    public boolean hasMetaquery() {
        return !metaquery.isEmpty();
    }

    public boolean hasWindow() {
        return window != null;
    }

    /** Copy with one more equality filter, for callers that scope a query by path parameters. */
    public QueryDescriptor withFilter(String column, String value) {
        Map<String, String> copy = new LinkedHashMap<>(filters);
        copy.put(column, value);
        return new QueryDescriptor(copy, metaquery, window);
    }

    /**
     * Keyword arguments for the storage operation. Absent bounds and operators are left out rather
     * than passed as nulls.
     */
    public Map<String, Object> toArguments() {
        Map<String, Object> args = new LinkedHashMap<>(filters);
        if (hasMetaquery()) {
            args.put(AcceptedFields.METAQUERY, metaquery);
        }
        if (window != null) {
            if (window.start() != null) args.put(window.keys().startKey(), window.start());
            if (window.end() != null) args.put(window.keys().endKey(), window.end());
            if (window.startOp() != null) args.put(AcceptedFields.START_TIMESTAMP_OP, window.startOp().wireValue());
            if (window.endOp() != null) args.put(AcceptedFields.END_TIMESTAMP_OP, window.endOp().wireValue());
        }
        return Collections.unmodifiableMap(args);
    }
}

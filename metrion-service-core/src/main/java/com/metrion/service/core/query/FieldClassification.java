package com.metrion.service.core.query;

/**
 * Where a filter field is routed during compilation.
 *
 * @param kind routing category
 * @param key metaquery key for {@link Kind#METADATA}, resolved column for {@link Kind#PLAIN}, the
 *     field itself otherwise
 */
public record FieldClassification(Kind kind, String key) {

    public enum Kind {
        CONTROL_TIMESTAMP,
        CONTROL_SEARCH_OFFSET,
        METADATA,
        PLAIN
    }

    public static FieldClassification timestamp() {
        return new FieldClassification(Kind.CONTROL_TIMESTAMP, FieldClassifier.TIMESTAMP);
    }

    public static FieldClassification searchOffset() {
        return new FieldClassification(Kind.CONTROL_SEARCH_OFFSET, FieldClassifier.SEARCH_OFFSET);
    }

    public static FieldClassification metadata(String key) {
        return new FieldClassification(Kind.METADATA, key);
    }

    public static FieldClassification plain(String column) {
        return new FieldClassification(Kind.PLAIN, column);
    }
}

package com.metrion.service.core.catalog;

import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Keyword field names a storage operation recognises.
 *
 * <p>{@code fields} may be filtered on directly. {@code internalFields} are supplied by the caller of
 * the operation itself (positionally or from request context); they count when deciding how to scope
 * a query but are never valid filter targets.
 */
public record AcceptedFields(Set<String> fields, Set<String> internalFields) {

    public static final String METAQUERY = "metaquery";
    public static final String ON_BEHALF_OF = "on_behalf_of";
    public static final String START_TIMESTAMP_OP = "start_timestamp_op";
    public static final String END_TIMESTAMP_OP = "end_timestamp_op";

    public AcceptedFields {
        fields = fields == null ? Set.of() : Set.copyOf(fields);
        internalFields = internalFields == null ? Set.of() : Set.copyOf(internalFields);
    }

    public static AcceptedFields of(String... fields) {
        return new AcceptedFields(new LinkedHashSet<>(Arrays.asList(fields)), Set.of());
    }

    public static AcceptedFields of(Collection<String> fields, Collection<String> internalFields) {
        return new AcceptedFields(
                fields == null ? Set.of() : new LinkedHashSet<>(fields),
                internalFields == null ? Set.of() : new LinkedHashSet<>(internalFields));
    }

    public AcceptedFields withInternal(String... names) {
        return new AcceptedFields(fields, new LinkedHashSet<>(Arrays.asList(names)));
    }

    /** Whether {@code name} may be used as a direct filter. */
    public boolean accepts(String name) {
        return fields.contains(name);
    }

    /** Whether the operation knows {@code name} at all, internal fields included. */
    public boolean declares(String name) {
        return fields.contains(name) || internalFields.contains(name);
    }

    public boolean acceptsMetaquery() {
        return fields.contains(METAQUERY);
    }

    /** Operations with an explicit {@code on_behalf_of} scoping parameter do their own project scoping. */
    public boolean scopesOnBehalfOf() {
        return declares(ON_BEHALF_OF);
    }
}

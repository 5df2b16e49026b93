package com.metrion.service.core.query;

import com.metrion.service.core.error.UnknownArgumentException;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.TreeSet;
import org.springframework.stereotype.Component;

/** Validates statistics group-by fields. Grouping by metadata is not supported. */
@Component
public class GroupByValidator {

    public static final Set<String> VALID_FIELDS = Set.of("user_id", "resource_id", "project_id", "source");

    /** @return the requested fields with duplicates removed; order is not significant */
    public Set<String> validate(Collection<String> fields) {
        if (fields == null || fields.isEmpty()) {
            return Set.of();
        }
        Set<String> invalid = new TreeSet<>();
        Set<String> unique = new LinkedHashSet<>();
        for (String field : fields) {
            if (field == null || !VALID_FIELDS.contains(field)) {
                invalid.add(String.valueOf(field));
            } else {
                unique.add(field);
            }
        }
        if (!invalid.isEmpty()) {
            throw new UnknownArgumentException(String.join(", ", invalid), "Invalid groupby fields " + invalid);
        }
        return Set.copyOf(unique);
    }
}

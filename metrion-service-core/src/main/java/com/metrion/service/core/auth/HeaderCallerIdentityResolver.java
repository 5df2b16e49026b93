package com.metrion.service.core.auth;

import com.metrion.query.model.CallerIdentity;
import com.metrion.service.core.config.QueryProperties;
import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Builds a {@link CallerIdentity} from the identity headers an authenticating proxy forwards. No
 * credential is inspected here; the headers are trusted as already validated upstream.
 */
@Component
public class HeaderCallerIdentityResolver {

    public static final String USER_ID_HEADER = "X-User-Id";
    public static final String PROJECT_ID_HEADER = "X-Project-Id";
    public static final String ROLES_HEADER = "X-Roles";

    private final Set<String> privilegedRoles;

    public HeaderCallerIdentityResolver(QueryProperties properties) {
        this.privilegedRoles = properties.getPrivilegedRoles() == null
                ? Set.of()
                : properties.getPrivilegedRoles().stream()
                        .map(r -> r.trim().toLowerCase(Locale.ROOT))
                        .filter(r -> !r.isEmpty())
                        .collect(Collectors.toUnmodifiableSet());
    }

    public CallerIdentity resolve(Map<String, String> headers) {
        Map<String, String> source = headers == null ? Map.of() : headers;
        String roles = header(source, ROLES_HEADER);
        boolean privileged = roles != null
                && Arrays.stream(roles.split(","))
                        .map(r -> r.trim().toLowerCase(Locale.ROOT))
                        .anyMatch(privilegedRoles::contains);
        return new CallerIdentity(privileged, header(source, PROJECT_ID_HEADER), header(source, USER_ID_HEADER));
    }

    private static String header(Map<String, String> headers, String name) {
        for (Map.Entry<String, String> e : headers.entrySet()) {
            if (e.getKey() != null && e.getKey().equalsIgnoreCase(name)) {
                String v = e.getValue();
                return (v == null || v.isBlank()) ? null : v.trim();
            }
        }
        return null;
    }
}

package com.smartcampus.security;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Memoizes {@link LinkedEntityResolver} lookups for a single request.
 * <p>
 * Create one per request and drop it when the request ends. Links change (a child moves
 * school, a teacher is reassigned), so results must never outlive the request.
 * Not thread-safe; a request is handled on one thread.
 */
public final class RequestLinkCache {

    private final LinkedEntityResolver resolver;
    private final Map<String, Set<String>> resolved = new HashMap<>();

    public RequestLinkCache(LinkedEntityResolver resolver) {
        this.resolver = Objects.requireNonNull(resolver, "resolver");
    }

    public Set<String> linkedIdsFor(String principalId, Role role, String tenantId) {
        String key = role.value() + '|' + tenantId + '|' + principalId;
        return resolved.computeIfAbsent(key, k -> {
            Set<String> ids = resolver.resolveLinkedIds(principalId, role, tenantId);
            return ids == null ? Set.of() : Set.copyOf(ids);
        });
    }
}

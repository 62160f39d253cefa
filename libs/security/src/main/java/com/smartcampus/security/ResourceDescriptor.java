package com.smartcampus.security;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Minimal typed handle to the entity being accessed.
 * <p>
 * Derived from a storage read immediately before a decision and never cached across
 * requests. A {@code null} kind or tenant is accepted here and denied by the evaluator;
 * a {@code null} owner reference is rejected.
 *
 * @param kind      entity kind
 * @param tenantId  school code the entity belongs to
 * @param ownerRefs IDs that own the entity: the student a fee belongs to, the class a
 *                  routine is for, the user a leave request was filed by
 * @param id        entity ID
 */
public record ResourceDescriptor(
        ResourceKind kind,
        String tenantId,
        Set<String> ownerRefs,
        String id
) {

    public ResourceDescriptor {
        if (ownerRefs == null) {
            ownerRefs = Set.of();
        } else if (ownerRefs.stream().anyMatch(Objects::isNull)) {
            throw new IllegalArgumentException("ownerRefs must not contain null");
        } else {
            ownerRefs = Set.copyOf(ownerRefs);
        }
    }

    /** A resource with no owner references. */
    public static ResourceDescriptor of(ResourceKind kind, String tenantId, String id) {
        return new ResourceDescriptor(kind, tenantId, Set.of(), id);
    }

    /** A resource owned by the given IDs. */
    public static ResourceDescriptor owned(ResourceKind kind, String tenantId, String id, String... owners) {
        return new ResourceDescriptor(kind, tenantId, new HashSet<>(Arrays.asList(owners)), id);
    }
}

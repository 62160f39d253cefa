package com.smartcampus.security.scope;

import com.smartcampus.security.ResourceDescriptor;
import com.smartcampus.security.ResourceKind;
import java.util.Collections;
import java.util.Set;

/**
 * Restriction a collection read must apply before rows leave the store.
 * <p>
 * Three shapes:
 * <ul>
 *   <li>{@link #none(ResourceKind)}: matches nothing (no rule, or no linked owners);</li>
 *   <li>{@link #unrestricted(ResourceKind)}: matches every row of the kind;</li>
 *   <li>restricted: {@code tenantId = ?} when {@code tenantId} is set, and
 *       {@code ownerRefs ∩ ownerRefsAnyOf ≠ ∅} when {@code ownerRefsAnyOf} is set.</li>
 * </ul>
 *
 * @param kind           the kind this predicate was derived for
 * @param matchesNothing whether the predicate excludes every row
 * @param tenantId       required school code, or null for no school clause
 * @param ownerRefsAnyOf owner IDs of which at least one must appear, or null for no owner clause
 */
public record ScopePredicate(
        ResourceKind kind,
        boolean matchesNothing,
        String tenantId,
        Set<String> ownerRefsAnyOf
) {

    public ScopePredicate {
        ownerRefsAnyOf = ownerRefsAnyOf == null ? null : Set.copyOf(ownerRefsAnyOf);
        if (ownerRefsAnyOf != null && ownerRefsAnyOf.isEmpty()) {
            matchesNothing = true;
        }
        if (matchesNothing) {
            tenantId = null;
            ownerRefsAnyOf = null;
        }
    }

    public static ScopePredicate none(ResourceKind kind) {
        return new ScopePredicate(kind, true, null, null);
    }

    public static ScopePredicate unrestricted(ResourceKind kind) {
        return new ScopePredicate(kind, false, null, null);
    }

    public static ScopePredicate tenant(ResourceKind kind, String tenantId) {
        return new ScopePredicate(kind, false, tenantId, null);
    }

    public static ScopePredicate tenantAndOwners(ResourceKind kind, String tenantId, Set<String> owners) {
        return new ScopePredicate(kind, false, tenantId, owners);
    }

    public boolean isUnrestricted() {
        return !matchesNothing && tenantId == null && ownerRefsAnyOf == null;
    }

    public boolean hasTenantClause() {
        return tenantId != null;
    }

    public boolean hasOwnerClause() {
        return ownerRefsAnyOf != null;
    }

    /**
     * Evaluates the predicate in memory against a descriptor. Storage-backed callers render
     * the same clauses into their query instead.
     */
    public boolean matches(ResourceDescriptor resource) {
        if (matchesNothing || resource == null || resource.kind() != kind) {
            return false;
        }
        if (tenantId != null && !tenantId.equals(resource.tenantId())) {
            return false;
        }
        return ownerRefsAnyOf == null || !Collections.disjoint(ownerRefsAnyOf, resource.ownerRefs());
    }
}

package com.smartcampus.security.policy;

import com.smartcampus.security.Action;
import com.smartcampus.security.ResourceKind;
import com.smartcampus.security.Role;

/**
 * One row of the authorization table: {@code role} may perform {@code action} on
 * {@code kind}, subject to the two clauses.
 *
 * @param role               the caller's role
 * @param kind               the resource kind
 * @param action             the attempted action
 * @param requiresSameTenant the resource must belong to the caller's school
 *                           (ignored for super administrators)
 * @param requiresOwnership  the resource must be owned by one of the caller's linked IDs
 *                           (ignored for principals/admins holding the kind's manage permission)
 */
public record PolicyRule(
        Role role,
        ResourceKind kind,
        Action action,
        boolean requiresSameTenant,
        boolean requiresOwnership
) {

    public PolicyRule {
        if (role == null || kind == null || action == null) {
            throw new IllegalArgumentException("role, kind and action must not be null");
        }
    }

    public Key key() {
        return new Key(role, kind, action);
    }

    /**
     * Lookup key of a rule.
     */
    public record Key(Role role, ResourceKind kind, Action action) {}
}

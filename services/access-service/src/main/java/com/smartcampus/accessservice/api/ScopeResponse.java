package com.smartcampus.accessservice.api;

import com.smartcampus.security.scope.ScopePredicate;
import java.util.List;

/**
 * Collection scope of the caller for one kind.
 *
 * @param kind requested kind
 * @param matchesNothing whether the caller may see no rows at all
 * @param unrestricted whether the caller may see every row of the kind
 * @param tenantId school every visible row must belong to, if restricted
 * @param ownerRefsAnyOf visible rows must have one of these owners, if restricted
 */
public record ScopeResponse(
        String kind,
        boolean matchesNothing,
        boolean unrestricted,
        String tenantId,
        List<String> ownerRefsAnyOf) {

    static ScopeResponse from(String kind, ScopePredicate scope) {
        return new ScopeResponse(
                kind,
                scope.matchesNothing(),
                scope.isUnrestricted(),
                scope.tenantId(),
                scope.ownerRefsAnyOf() == null
                        ? null
                        : scope.ownerRefsAnyOf().stream().sorted().toList());
    }
}

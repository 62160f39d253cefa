package com.smartcampus.security;

import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Builds the per-request {@link Principal} from an {@link AuthenticatedIdentity}.
 * <p>
 * Roles whose rules depend on ownership (teacher, student, parent) get their linked IDs
 * resolved through the request's {@link RequestLinkCache} and are always linked to
 * themselves. Every other role carries no links.
 */
public final class PrincipalFactory {

    private static final Set<Role> LINKED_ROLES = EnumSet.of(Role.TEACHER, Role.STUDENT, Role.PARENT);

    private PrincipalFactory() {
        // utility class
    }

    /**
     * @throws MalformedPrincipalException if the role is unknown, the user ID is blank, or a
     *                                     school-bound role has no school
     */
    public static Principal create(AuthenticatedIdentity identity, RequestLinkCache links) {
        if (identity == null) {
            throw new MalformedPrincipalException(List.of("identity must not be null"));
        }
        Role role = Role.fromString(identity.role()).orElseThrow(() ->
                new MalformedPrincipalException(List.of("unknown role '" + identity.role() + "'")));
        String tenantId = role.requiresTenant() ? identity.tenantId() : blankToNull(identity.tenantId());

        Set<String> linked = Set.of();
        if (LINKED_ROLES.contains(role) && !isBlank(identity.userId()) && !isBlank(tenantId)) {
            var ids = new HashSet<>(links.linkedIdsFor(identity.userId(), role, tenantId));
            ids.add(identity.userId());
            linked = ids;
        }
        return new Principal(identity.userId(), role, tenantId, identity.permissions(), linked);
    }

    private static String blankToNull(String value) {
        return isBlank(value) ? null : value;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}

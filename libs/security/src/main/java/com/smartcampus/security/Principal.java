package com.smartcampus.security;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Set;

/**
 * The authenticated caller and its authorization attributes for one request.
 * <p>
 * Built once per request from verified session data and discarded afterwards; role,
 * permissions and links can change between calls, so a principal is never cached.
 * The compact constructor validates all fields and reports every problem at once.
 *
 * @param id              user ID
 * @param role            the caller's role
 * @param tenantId        school code; may be null only for {@link Role#SUPER_ADMIN}
 * @param permissions     granted permission names such as {@code manage_students}
 * @param linkedEntityIds IDs the caller is personally tied to: a parent's children,
 *                        a teacher's assigned classes, a student's own ID
 */
public record Principal(
        String id,
        Role role,
        String tenantId,
        Set<String> permissions,
        Set<String> linkedEntityIds
) {

    public Principal {
        var errors = new ArrayList<String>();
        if (id == null || id.isBlank()) {
            errors.add("id must not be null or blank");
        }
        if (role == null) {
            errors.add("role must not be null");
        } else if (role.requiresTenant() && (tenantId == null || tenantId.isBlank())) {
            errors.add("tenantId is required for role " + role.value());
        }
        if (!errors.isEmpty()) {
            throw new MalformedPrincipalException(errors);
        }
        permissions = permissions == null ? Set.of() : Set.copyOf(permissions);
        linkedEntityIds = linkedEntityIds == null ? Set.of() : Set.copyOf(linkedEntityIds);
    }

    public boolean hasPermission(String permission) {
        return permissions.contains(permission);
    }

    /**
     * Whether this principal's role and permissions exempt it from ownership checks on
     * {@code kind}.
     */
    public boolean managesKind(ResourceKind kind) {
        return kind != null && role.mayManageByPermission() && hasPermission(kind.managePermission());
    }

    /**
     * Whether any of the given owner references is linked to this principal.
     */
    public boolean isLinkedToAny(Set<String> ownerRefs) {
        return ownerRefs != null && !Collections.disjoint(ownerRefs, linkedEntityIds);
    }

    public boolean isSuperAdmin() {
        return role == Role.SUPER_ADMIN;
    }
}

package com.smartcampus.security;

import java.util.Set;

/**
 * Verified caller identity as delivered by the authentication layer, before it is turned
 * into a {@link Principal}. Fields are raw: the role is still a string.
 *
 * @param userId      user ID from the session or token subject
 * @param role        role name, e.g. {@code "teacher"}
 * @param tenantId    school code of the user (absent for super administrators)
 * @param permissions granted permission names
 */
public record AuthenticatedIdentity(
        String userId,
        String role,
        String tenantId,
        Set<String> permissions
) {

    public AuthenticatedIdentity {
        permissions = permissions == null ? Set.of() : Set.copyOf(permissions);
    }
}

package com.smartcampus.security;

import java.util.Locale;
import java.util.Optional;

/**
 * Smart Campus roles.
 * <p>
 * The set is closed: every authorization rule is keyed by one of these constants, and a
 * role string that maps to none of them never reaches the evaluator (see
 * {@link PrincipalFactory}).
 */
public enum Role {

    SUPER_ADMIN("super_admin"),
    ADMIN("admin"),
    PRINCIPAL("principal"),
    TEACHER("teacher"),
    STUDENT("student"),
    PARENT("parent"),
    ACCOUNTANT("accountant");

    private final String value;

    Role(String value) {
        this.value = value;
    }

    /** The wire name used in sessions, headers and policy files (e.g. "super_admin"). */
    public String value() {
        return value;
    }

    /**
     * Whether this role ignores the same-school clause of a rule. Only the platform operator
     * works across schools.
     */
    public boolean bypassesTenant() {
        return this == SUPER_ADMIN;
    }

    /**
     * Whether this role may skip the ownership clause for kinds it holds a
     * {@code manage_*} permission for.
     */
    public boolean mayManageByPermission() {
        return this == PRINCIPAL || this == ADMIN;
    }

    /**
     * Whether principals of this role must belong to a school.
     */
    public boolean requiresTenant() {
        return this != SUPER_ADMIN;
    }

    /**
     * Looks up a role by its wire name. Matching ignores case, surrounding blanks and
     * hyphen/underscore differences, so the legacy spellings {@code superadmin} and
     * {@code super-admin} resolve to {@link #SUPER_ADMIN}.
     *
     * @return the matching role, or empty if the value is not a known role
     */
    public static Optional<Role> fromString(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        if ("superadmin".equals(normalized)) {
            return Optional.of(SUPER_ADMIN);
        }
        for (Role role : values()) {
            if (role.value.equals(normalized)) {
                return Optional.of(role);
            }
        }
        return Optional.empty();
    }
}

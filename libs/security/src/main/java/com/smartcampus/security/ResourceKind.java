package com.smartcampus.security;

import java.util.Locale;
import java.util.Optional;

/**
 * The kinds of school entity an authorization decision can be about.
 * <p>
 * Each kind names the {@code manage_*} permission that lets a principal or admin act on
 * it without personal ownership.
 */
public enum ResourceKind {

    SCHOOL("school", "manage_schools"),
    USER("user", "manage_users"),
    STUDENT("student", "manage_students"),
    TEACHER("teacher", "manage_teachers"),
    CLASS("class", "manage_classes"),
    ATTENDANCE("attendance", "manage_attendance"),
    FEE("fee", "manage_fees"),
    FEE_STRUCTURE("fee_structure", "manage_fee_structures"),
    NOTICE("notice", "manage_notices"),
    RESULT("result", "manage_results"),
    EXAM("exam", "manage_exams"),
    ROUTINE("routine", "manage_routines"),
    ASSIGNMENT("assignment", "manage_assignments"),
    ADMIT_CARD("admit_card", "manage_admit_cards"),
    LEAVE_REQUEST("leave_request", "manage_leave_requests"),
    EVENT("event", "manage_events"),
    SYSTEM_SETTINGS("system_settings", "manage_system_settings");

    private final String value;
    private final String managePermission;

    ResourceKind(String value, String managePermission) {
        this.value = value;
        this.managePermission = managePermission;
    }

    /** The wire name used in policy files and request bodies (e.g. "fee_structure"). */
    public String value() {
        return value;
    }

    /** The permission that exempts principals and admins from the ownership clause. */
    public String managePermission() {
        return managePermission;
    }

    /**
     * Looks up a kind by wire name or constant name, ignoring case and hyphen/underscore
     * differences: {@code FEE_STRUCTURE} and {@code fee-structure} both match.
     */
    public static Optional<ResourceKind> fromString(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (ResourceKind kind : values()) {
            if (kind.value.equals(normalized)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}

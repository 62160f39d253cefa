package com.smartcampus.security.policy;

/**
 * Outcome of a policy evaluation.
 * <p>
 * Only {@link #allow()} produces an allowing decision; every factory for a denial names the
 * clause that failed, so callers and tests can tell a tenant mismatch from an ownership failure.
 *
 * @param outcome Allow or Deny
 * @param code    machine-readable reason
 * @param reason  human-readable reason; starts with {@link Code#message()}
 */
public record Decision(Outcome outcome, Code code, String reason) {

    public enum Outcome {
        ALLOW,
        DENY
    }

    public enum Code {
        ALLOWED("allowed by policy"),
        UNKNOWN_ROLE_OR_KIND("unknown role/kind"),
        NO_MATCHING_POLICY("no matching policy"),
        TENANT_MISMATCH("tenant mismatch"),
        OWNERSHIP_FAILURE("ownership failure"),
        RESOURCE_NOT_FOUND("resource not found");

        private final String message;

        Code(String message) {
            this.message = message;
        }

        public String message() {
            return message;
        }
    }

    private static final Decision ALLOW = new Decision(Outcome.ALLOW, Code.ALLOWED, Code.ALLOWED.message());

    public Decision {
        if (outcome == null || code == null) {
            throw new IllegalArgumentException("outcome and code must not be null");
        }
        if (outcome == Outcome.ALLOW && code != Code.ALLOWED) {
            throw new IllegalArgumentException("an allowing decision must use code ALLOWED");
        }
        if (outcome == Outcome.DENY && code == Code.ALLOWED) {
            throw new IllegalArgumentException("a denying decision needs a denial code");
        }
        if (reason == null || reason.isBlank()) {
            reason = code.message();
        }
    }

    public static Decision allow() {
        return ALLOW;
    }

    public static Decision deny(Code code) {
        return new Decision(Outcome.DENY, code, code.message());
    }

    public static Decision deny(Code code, String detail) {
        return new Decision(Outcome.DENY, code, code.message() + ": " + detail);
    }

    public boolean isAllowed() {
        return outcome == Outcome.ALLOW;
    }

    public boolean isDenied() {
        return outcome == Outcome.DENY;
    }
}

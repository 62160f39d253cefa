package com.smartcampus.security;

import com.smartcampus.security.policy.Decision;

/**
 * Thrown by {@link AccessGuard#require} when a decision denies access.
 * <p>
 * Carries the full decision for logs and development responses. Public responses must use
 * {@link #PUBLIC_MESSAGE} only: a denial and a missing resource look the same to the caller.
 */
public class AccessDeniedException extends RuntimeException {

    public static final String PUBLIC_MESSAGE = "Access denied";

    private final Decision decision;
    private final Action action;
    private final ResourceKind resourceKind;
    private final String resourceId;

    public AccessDeniedException(Decision decision, Action action, ResourceKind resourceKind, String resourceId) {
        super("%s: %s %s/%s: %s".formatted(PUBLIC_MESSAGE,
                action == null ? null : action.value(),
                resourceKind == null ? null : resourceKind.value(),
                resourceId, decision.reason()));
        this.decision = decision;
        this.action = action;
        this.resourceKind = resourceKind;
        this.resourceId = resourceId;
    }

    public Decision decision() {
        return decision;
    }

    public Action action() {
        return action;
    }

    public ResourceKind resourceKind() {
        return resourceKind;
    }

    public String resourceId() {
        return resourceId;
    }
}

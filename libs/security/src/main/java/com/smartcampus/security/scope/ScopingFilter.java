package com.smartcampus.security.scope;

import com.smartcampus.security.Action;
import com.smartcampus.security.Principal;
import com.smartcampus.security.ResourceKind;
import com.smartcampus.security.policy.PolicyEvaluator;
import com.smartcampus.security.policy.PolicyRule;
import com.smartcampus.security.policy.PolicyTableHolder;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Derives the collection-read restriction for a principal and kind.
 * <p>
 * The predicate is built from the same {@code (role, kind, READ)} rule and the same clause
 * tests as {@link PolicyEvaluator}, so for every resource {@code r} of the kind,
 * {@code scopeFor(p, k).matches(r)} equals {@code decide(p, READ, r).isAllowed()}. A missing
 * rule yields a predicate that matches nothing, never an unrestricted one.
 */
public final class ScopingFilter {

    private static final Logger log = LoggerFactory.getLogger(ScopingFilter.class);

    private final PolicyTableHolder policies;

    public ScopingFilter(PolicyTableHolder policies) {
        this.policies = Objects.requireNonNull(policies, "policies");
    }

    public ScopePredicate scopeFor(Principal principal, ResourceKind kind) {
        if (principal == null || kind == null) {
            return ScopePredicate.none(kind);
        }
        Optional<PolicyRule> match = policies.current().find(principal.role(), kind, Action.READ);
        if (match.isEmpty()) {
            log.warn("No read policy for role={} kind={}; scope matches nothing",
                    principal.role().value(), kind.value());
            return ScopePredicate.none(kind);
        }
        PolicyRule rule = match.get();

        boolean tenantBound = rule.requiresSameTenant() && !principal.role().bypassesTenant();
        String tenantId = tenantBound ? principal.tenantId() : null;
        if (PolicyEvaluator.ownershipRequired(rule, principal)) {
            return ScopePredicate.tenantAndOwners(kind, tenantId, principal.linkedEntityIds());
        }
        return tenantBound ? ScopePredicate.tenant(kind, tenantId) : ScopePredicate.unrestricted(kind);
    }
}

package com.smartcampus.security.policy;

import com.smartcampus.security.Action;
import com.smartcampus.security.Principal;
import com.smartcampus.security.ResourceDescriptor;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides whether a principal may perform an action on a single resource.
 * <p>
 * Evaluation order:
 * <ol>
 *   <li>missing role, kind or action: deny {@code unknown role/kind};</li>
 *   <li>no rule for {@code (role, kind, action)}: deny {@code no matching policy};</li>
 *   <li>rule requires the same school and the resource's school differs from the caller's
 *       (super administrators exempt): deny {@code tenant mismatch};</li>
 *   <li>rule requires ownership and none of the resource's owners is linked to the caller
 *       (principals/admins holding the kind's {@code manage_*} permission exempt):
 *       deny {@code ownership failure};</li>
 *   <li>otherwise allow.</li>
 * </ol>
 * <p>
 * The evaluator has no side effects and never throws for typed input: callers branch on the
 * returned {@link Decision} and are responsible for auditing.
 */
public final class PolicyEvaluator {

    private static final Logger log = LoggerFactory.getLogger(PolicyEvaluator.class);

    private final PolicyTableHolder policies;

    public PolicyEvaluator(PolicyTableHolder policies) {
        this.policies = Objects.requireNonNull(policies, "policies");
    }

    public PolicyEvaluator(PolicyTable table) {
        this(new PolicyTableHolder(table));
    }

    public Decision decide(Principal principal, Action action, ResourceDescriptor resource) {
        if (principal == null || resource == null || resource.kind() == null || action == null) {
            return Decision.deny(Decision.Code.UNKNOWN_ROLE_OR_KIND);
        }
        Optional<PolicyRule> match = policies.current().find(principal.role(), resource.kind(), action);
        if (match.isEmpty()) {
            log.warn("No policy for role={} kind={} action={}; denying",
                    principal.role().value(), resource.kind().value(), action.value());
            return Decision.deny(Decision.Code.NO_MATCHING_POLICY);
        }
        Decision decision = evaluate(match.get(), principal, resource);
        if (decision.isDenied()) {
            log.debug("Denied {} {} {}/{}: {}", principal.id(), action.value(),
                    resource.kind().value(), resource.id(), decision.reason());
        }
        return decision;
    }

    static Decision evaluate(PolicyRule rule, Principal principal, ResourceDescriptor resource) {
        if (!tenantClauseHolds(rule, principal, resource.tenantId())) {
            return Decision.deny(Decision.Code.TENANT_MISMATCH,
                    "principal tenant '%s', resource tenant '%s'"
                            .formatted(principal.tenantId(), resource.tenantId()));
        }
        if (!ownershipClauseHolds(rule, principal, resource)) {
            return Decision.deny(Decision.Code.OWNERSHIP_FAILURE,
                    "no linked owner of %s %s".formatted(resource.kind().value(), resource.id()));
        }
        return Decision.allow();
    }

    /**
     * Same-school clause of {@code rule}. A resource without a school never satisfies it.
     */
    public static boolean tenantClauseHolds(PolicyRule rule, Principal principal, String resourceTenantId) {
        if (!rule.requiresSameTenant() || principal.role().bypassesTenant()) {
            return true;
        }
        return resourceTenantId != null && resourceTenantId.equals(principal.tenantId());
    }

    /**
     * Whether the ownership clause applies to {@code principal} under {@code rule} at all.
     */
    public static boolean ownershipRequired(PolicyRule rule, Principal principal) {
        return rule.requiresOwnership() && !principal.managesKind(rule.kind());
    }

    private static boolean ownershipClauseHolds(PolicyRule rule, Principal principal, ResourceDescriptor resource) {
        return !ownershipRequired(rule, principal) || principal.isLinkedToAny(resource.ownerRefs());
    }
}

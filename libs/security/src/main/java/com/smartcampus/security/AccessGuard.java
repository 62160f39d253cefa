package com.smartcampus.security;

import com.smartcampus.observability.MetricFactory;
import com.smartcampus.security.audit.AuditEntry;
import com.smartcampus.security.audit.AuditSink;
import com.smartcampus.security.policy.Decision;
import com.smartcampus.security.policy.PolicyEvaluator;
import com.smartcampus.security.scope.ScopePredicate;
import com.smartcampus.security.scope.ScopingFilter;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for request handlers: one call per single-resource access and one per
 * collection read.
 * <p>
 * Audit rules:
 * <ul>
 *   <li>every attempted mutation is recorded exactly once, allowed or denied;</li>
 *   <li>every super-admin access is recorded, reads and collection scopes included, since
 *       the super-admin role bypasses school isolation.</li>
 * </ul>
 * Plain reads by school-bound roles are not audited. A resource of unrecognised kind is
 * still audited under these rules, with a {@code null} kind; an unrecognised action is not,
 * since it cannot be classed as a mutation.
 */
public final class AccessGuard {

    private static final Logger log = LoggerFactory.getLogger(AccessGuard.class);

    static final String DECISION_COUNTER = "campus.access.decisions";

    private final PolicyEvaluator evaluator;
    private final ScopingFilter scopingFilter;
    private final ResourceDescriptorLoader loader;
    private final AuditSink audit;
    private final MetricFactory metrics;

    public AccessGuard(PolicyEvaluator evaluator,
                       ScopingFilter scopingFilter,
                       ResourceDescriptorLoader loader,
                       AuditSink audit,
                       MetricFactory metrics) {
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
        this.scopingFilter = Objects.requireNonNull(scopingFilter, "scopingFilter");
        this.loader = Objects.requireNonNull(loader, "loader");
        this.audit = Objects.requireNonNull(audit, "audit");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * Decides on an already loaded resource and audits the decision when required.
     */
    public Decision authorize(Principal principal, Action action, ResourceDescriptor resource) {
        Decision decision = evaluator.decide(principal, action, resource);
        count(decision, resource == null ? null : resource.kind());
        if (principal != null && action != null && mustAudit(principal, action)) {
            if (resource == null) {
                audit.record(principal, action, (ResourceKind) null, null, decision);
            } else {
                audit.record(principal, action, resource, decision);
            }
        }
        if (decision.isAllowed() && principal != null && principal.isSuperAdmin()
                && resource != null && resource.tenantId() != null
                && !resource.tenantId().equals(principal.tenantId())) {
            log.info("Cross-tenant {} of {} {} in school {} by super_admin {}",
                    action.value(), resource.kind().value(), resource.id(), resource.tenantId(), principal.id());
        }
        return decision;
    }

    /**
     * Loads the resource and decides. A missing resource is denied with
     * {@link Decision.Code#RESOURCE_NOT_FOUND}, so callers answer it exactly like a denial.
     */
    public Decision authorize(Principal principal, Action action, ResourceKind kind, String id) {
        return load(kind, id)
                .map(resource -> authorize(principal, action, resource))
                .orElseGet(() -> notFound(principal, action, kind, id));
    }

    /**
     * As {@link #authorize(Principal, Action, ResourceDescriptor)}, throwing on denial.
     *
     * @throws AccessDeniedException if the decision denies access
     */
    public ResourceDescriptor require(Principal principal, Action action, ResourceDescriptor resource) {
        Decision decision = authorize(principal, action, resource);
        if (decision.isDenied()) {
            throw new AccessDeniedException(decision, action,
                    resource == null ? null : resource.kind(),
                    resource == null ? null : resource.id());
        }
        return resource;
    }

    /**
     * Loads, decides and returns the descriptor of an allowed resource.
     *
     * @throws AccessDeniedException if the resource is missing or access is denied
     */
    public ResourceDescriptor require(Principal principal, Action action, ResourceKind kind, String id) {
        Optional<ResourceDescriptor> resource = load(kind, id);
        if (resource.isEmpty()) {
            throw new AccessDeniedException(notFound(principal, action, kind, id), action, kind, id);
        }
        return require(principal, action, resource.get());
    }

    /**
     * Returns the restriction to merge into a collection query.
     */
    public ScopePredicate scope(Principal principal, ResourceKind kind) {
        ScopePredicate predicate = scopingFilter.scopeFor(principal, kind);
        if (principal != null && principal.isSuperAdmin()) {
            Decision decision = predicate.matchesNothing()
                    ? Decision.deny(Decision.Code.NO_MATCHING_POLICY)
                    : Decision.allow();
            audit.record(principal, Action.READ, kind, AuditEntry.COLLECTION, decision);
        }
        return predicate;
    }

    private Optional<ResourceDescriptor> load(ResourceKind kind, String id) {
        return kind == null || id == null ? Optional.empty() : loader.load(kind, id);
    }

    private Decision notFound(Principal principal, Action action, ResourceKind kind, String id) {
        Decision decision = Decision.deny(Decision.Code.RESOURCE_NOT_FOUND);
        count(decision, kind);
        if (principal != null && action != null && mustAudit(principal, action)) {
            audit.record(principal, action, kind, id, decision);
        }
        return decision;
    }

    private static boolean mustAudit(Principal principal, Action action) {
        return action.isMutation() || principal.isSuperAdmin();
    }

    private void count(Decision decision, ResourceKind kind) {
        metrics.counterForCurrentTenant(DECISION_COUNTER, "Authorization decisions",
                        "outcome", decision.outcome().name().toLowerCase(Locale.ROOT),
                        "kind", kind == null ? "unknown" : kind.value())
                .increment();
    }
}

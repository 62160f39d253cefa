package com.smartcampus.accessservice.api;

import com.smartcampus.accessservice.config.AccessServiceProperties;
import com.smartcampus.accessservice.domain.PolicyAdministrationService;
import com.smartcampus.database.resource.JdbcResourceDescriptorRepository;
import com.smartcampus.security.AccessGuard;
import com.smartcampus.security.Action;
import com.smartcampus.security.Principal;
import com.smartcampus.security.ResourceDescriptor;
import com.smartcampus.security.ResourceKind;
import com.smartcampus.security.policy.Decision;
import com.smartcampus.security.policy.PolicyTable;
import com.smartcampus.security.scope.ScopePredicate;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * HTTP surface of the authorization core.
 *
 * <ul>
 *   <li>{@code POST /api/v1/access/decisions}: decide one action on one resource
 *   <li>{@code GET /api/v1/access/scopes/{kind}}: the caller's collection scope for a kind
 *   <li>{@code GET /api/v1/access/resources/{kind}}: stored descriptors inside that scope
 *   <li>{@code POST /api/v1/access/policies/reload}: replace the live policy table
 * </ul>
 *
 * <p>Unknown kinds and actions are not rejected as bad requests: they are denied, and their scope
 * matches nothing. A mutation of an unknown kind is still audited, with no kind recorded.
 */
@RestController
@RequestMapping("/api/v1/access")
public class AccessCheckController {

    private final AccessGuard guard;
    private final JdbcResourceDescriptorRepository repository;
    private final PolicyAdministrationService policyAdministration;
    private final boolean exposeDenyReasons;

    public AccessCheckController(
            AccessGuard guard,
            JdbcResourceDescriptorRepository repository,
            PolicyAdministrationService policyAdministration,
            AccessServiceProperties properties) {
        this.guard = guard;
        this.repository = repository;
        this.policyAdministration = policyAdministration;
        this.exposeDenyReasons = properties.exposeDenyReasons();
    }

    @PostMapping("/decisions")
    public DecisionResponse decide(
            Principal principal, @Valid @RequestBody DecisionRequest request) {
        Action action = Action.fromString(request.action()).orElse(null);
        Optional<ResourceKind> kind = ResourceKind.fromString(request.kind());

        Decision decision;
        if (action == null) {
            decision = guard.authorize(principal, null, (ResourceDescriptor) null);
        } else if (kind.isEmpty() || request.resource() != null) {
            decision = guard.authorize(principal, action, supplied(kind.orElse(null), request));
        } else {
            if (request.resourceId() == null || request.resourceId().isBlank()) {
                throw new IllegalArgumentException(
                        "resourceId is required when no resource is supplied");
            }
            decision = guard.authorize(principal, action, kind.get(), request.resourceId());
        }
        return DecisionResponse.from(decision, exposeDenyReasons);
    }

    private static ResourceDescriptor supplied(ResourceKind kind, DecisionRequest request) {
        DecisionRequest.Resource resource = request.resource();
        return resource == null
                ? new ResourceDescriptor(kind, null, null, request.resourceId())
                : new ResourceDescriptor(kind, resource.tenantId(), resource.ownerRefs(), request.resourceId());
    }

    @GetMapping("/scopes/{kind}")
    public ScopeResponse scope(Principal principal, @PathVariable String kind) {
        ScopePredicate scope = guard.scope(principal, ResourceKind.fromString(kind).orElse(null));
        return ScopeResponse.from(kind, scope);
    }

    @GetMapping("/resources/{kind}")
    public List<ResourceView> visibleResources(Principal principal, @PathVariable String kind) {
        Optional<ResourceKind> resolved = ResourceKind.fromString(kind);
        if (resolved.isEmpty()) {
            return List.of();
        }
        ScopePredicate scope = guard.scope(principal, resolved.get());
        return repository.findVisible(resolved.get(), scope).stream()
                .map(ResourceView::from)
                .toList();
    }

    @PostMapping("/policies/reload")
    public Map<String, Object> reloadPolicies(Principal principal) {
        PolicyTable table = policyAdministration.reload(principal);
        return Map.of(
                "rules", table.size(),
                "location", policyAdministration.policyLocation());
    }
}

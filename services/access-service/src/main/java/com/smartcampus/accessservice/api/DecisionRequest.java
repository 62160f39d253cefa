package com.smartcampus.accessservice.api;

import jakarta.validation.constraints.NotBlank;
import java.util.Set;

/**
 * Body of {@code POST /api/v1/access/decisions}.
 *
 * <p>With {@code resource} absent the descriptor of {@code resourceId} is read from storage; with
 * it present the caller supplies the descriptor, for example for a record it has just loaded
 * itself.
 *
 * @param action action name, e.g. {@code update}
 * @param kind resource kind, e.g. {@code attendance}
 * @param resourceId ID of the resource
 * @param resource optional caller-supplied descriptor
 */
public record DecisionRequest(
        @NotBlank String action, @NotBlank String kind, String resourceId, Resource resource) {

    /**
     * @param tenantId school code the resource belongs to
     * @param ownerRefs IDs that own the resource
     */
    public record Resource(String tenantId, Set<String> ownerRefs) {}
}

package com.smartcampus.accessservice.api;

import com.smartcampus.security.ResourceDescriptor;
import java.util.List;

/** A stored resource descriptor visible to the caller. */
public record ResourceView(String kind, String id, String tenantId, List<String> ownerRefs) {

    static ResourceView from(ResourceDescriptor descriptor) {
        return new ResourceView(
                descriptor.kind().value(),
                descriptor.id(),
                descriptor.tenantId(),
                descriptor.ownerRefs().stream().sorted().toList());
    }
}

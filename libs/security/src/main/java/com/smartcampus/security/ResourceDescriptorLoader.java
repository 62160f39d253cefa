package com.smartcampus.security;

import java.util.Optional;

/**
 * Storage port loading the {@link ResourceDescriptor} of one entity right before a decision.
 */
@FunctionalInterface
public interface ResourceDescriptorLoader {

    Optional<ResourceDescriptor> load(ResourceKind kind, String id);
}

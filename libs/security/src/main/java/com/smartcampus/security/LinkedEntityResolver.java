package com.smartcampus.security;

import java.util.Set;

/**
 * Storage port resolving the IDs a user is personally tied to: a parent's children, a
 * teacher's assigned classes, a student's class.
 */
@FunctionalInterface
public interface LinkedEntityResolver {

    /**
     * @return linked IDs, never null
     */
    Set<String> resolveLinkedIds(String principalId, Role role, String tenantId);
}

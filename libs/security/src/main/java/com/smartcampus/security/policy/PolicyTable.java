package com.smartcampus.security.policy;

import com.smartcampus.security.Action;
import com.smartcampus.security.ResourceKind;
import com.smartcampus.security.Role;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable set of {@link PolicyRule}s indexed by {@code (role, kind, action)}.
 * <p>
 * Table-level constraints, checked by {@link #of(Collection)}:
 * <ul>
 *   <li>at most one rule per key;</li>
 *   <li>only {@link Role#SUPER_ADMIN} rules may drop the same-school clause, so no scope
 *       derived for any other role can ever reach into another school.</li>
 * </ul>
 */
public final class PolicyTable {

    private static final PolicyTable EMPTY = new PolicyTable(Map.of(), List.of());

    private final Map<PolicyRule.Key, PolicyRule> index;
    private final List<PolicyRule> rules;

    private PolicyTable(Map<PolicyRule.Key, PolicyRule> index, List<PolicyRule> rules) {
        this.index = index;
        this.rules = rules;
    }

    /**
     * Builds a table from the given rules.
     *
     * @throws PolicyConfigurationException if a key repeats or a non-super-admin rule is
     *                                      not tenant-bound
     */
    public static PolicyTable of(Collection<PolicyRule> rules) {
        var index = new HashMap<PolicyRule.Key, PolicyRule>();
        for (PolicyRule rule : rules) {
            if (!rule.requiresSameTenant() && !rule.role().bypassesTenant()) {
                throw new PolicyConfigurationException(
                        "Rule %s/%s/%s must require the same tenant: only super_admin may cross schools"
                                .formatted(rule.role().value(), rule.kind().value(), rule.action().value()));
            }
            PolicyRule previous = index.putIfAbsent(rule.key(), rule);
            if (previous != null) {
                throw new PolicyConfigurationException(
                        "Duplicate rule for %s/%s/%s"
                                .formatted(rule.role().value(), rule.kind().value(), rule.action().value()));
            }
        }
        return new PolicyTable(Map.copyOf(index), List.copyOf(rules));
    }

    /** A table with no rules; every decision against it is a denial. */
    public static PolicyTable empty() {
        return EMPTY;
    }

    public Optional<PolicyRule> find(Role role, ResourceKind kind, Action action) {
        return Optional.ofNullable(index.get(new PolicyRule.Key(role, kind, action)));
    }

    public List<PolicyRule> rules() {
        return rules;
    }

    public int size() {
        return rules.size();
    }
}

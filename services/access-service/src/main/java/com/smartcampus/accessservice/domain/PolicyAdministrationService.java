package com.smartcampus.accessservice.domain;

import com.smartcampus.accessservice.config.AccessServiceProperties;
import com.smartcampus.security.AccessGuard;
import com.smartcampus.security.Action;
import com.smartcampus.security.Principal;
import com.smartcampus.security.ResourceDescriptor;
import com.smartcampus.security.ResourceKind;
import com.smartcampus.security.policy.PolicyTable;
import com.smartcampus.security.policy.PolicyTableHolder;
import com.smartcampus.security.policy.PolicyTableLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Replaces the live policy table from its configured location.
 *
 * <p>A reload is an update of the {@code system_settings} resource, so it goes through the same
 * guard as any other mutation and is audited whether it is allowed or not. An invalid document
 * leaves the current table in effect.
 */
@Service
public class PolicyAdministrationService {

    private static final Logger log = LoggerFactory.getLogger(PolicyAdministrationService.class);

    /** Resource ID under which policy reloads are authorized and audited. */
    public static final String POLICY_TABLE_ID = "policy-table";

    private final AccessGuard guard;
    private final PolicyTableHolder holder;
    private final String policyLocation;

    public PolicyAdministrationService(
            AccessGuard guard, PolicyTableHolder holder, AccessServiceProperties properties) {
        this.guard = guard;
        this.holder = holder;
        this.policyLocation = properties.policyLocation();
    }

    /**
     * @return the newly published table
     * @throws com.smartcampus.security.AccessDeniedException if the caller may not update system
     *     settings
     * @throws com.smartcampus.security.policy.PolicyConfigurationException if the document at the
     *     configured location is invalid
     */
    public PolicyTable reload(Principal principal) {
        guard.require(
                principal,
                Action.UPDATE,
                ResourceDescriptor.of(ResourceKind.SYSTEM_SETTINGS, principal.tenantId(), POLICY_TABLE_ID));
        PolicyTable table = holder.reload(() -> PolicyTableLoader.loadLocation(policyLocation));
        log.info("Policy table reloaded from {} by {}: {} rules", policyLocation, principal.id(), table.size());
        return table;
    }

    public int currentRuleCount() {
        return holder.current().size();
    }

    public String policyLocation() {
        return policyLocation;
    }
}

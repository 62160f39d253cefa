package com.smartcampus.accessservice.api;

import com.smartcampus.accessservice.config.AccessServiceProperties;
import com.smartcampus.accessservice.domain.PolicyAdministrationService;
import com.smartcampus.database.migration.MigrationStatusService;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Service info endpoint: configuration, live policy size and schema state.
 *
 * <p>Actuator provides {@code /actuator/info} for build metadata; this endpoint adds runtime
 * information operators need after a policy reload or a deployment.
 */
@RestController
@RequestMapping("/api/v1")
public class ServiceInfoController {

    private final AccessServiceProperties properties;
    private final PolicyAdministrationService policyAdministration;
    private final MigrationStatusService migrationStatus;

    public ServiceInfoController(
            AccessServiceProperties properties,
            PolicyAdministrationService policyAdministration,
            MigrationStatusService migrationStatus) {
        this.properties = properties;
        this.policyAdministration = policyAdministration;
        this.migrationStatus = migrationStatus;
    }

    @GetMapping("/info")
    public Map<String, Object> serviceInfo() {
        return Map.of(
                "name", properties.name(),
                "environment", properties.environment(),
                "description", properties.description() != null ? properties.description() : "",
                "status", "running",
                "policyRules", policyAdministration.currentRuleCount(),
                "auditMode", properties.audit().mode().name().toLowerCase(Locale.ROOT),
                "schema", migrationStatus.status(),
                "timestamp", Instant.now().toString());
    }
}

package com.smartcampus.accessservice.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Type-safe configuration for the access service, bound from {@code campus.access.*}.
 *
 * <pre>
 * campus:
 *   access:
 *     name: access-service
 *     environment: production
 *     policy-location: file:/etc/campus/policy.yml
 *     expose-deny-reasons: false
 *     audit:
 *       mode: async
 *       store: jdbc
 *       queue-capacity: 10000
 * </pre>
 *
 * @param name service name used in logs and metric tags. Required.
 * @param environment deployment environment (development, staging, production).
 * @param description human-readable description for the info endpoint.
 * @param policyLocation {@code classpath:} resource, {@code file:} URL or plain path of the policy
 *     table.
 * @param exposeDenyReasons whether denial reasons are returned to callers. Defaults to {@code true}
 *     everywhere except production.
 * @param audit audit sink settings.
 */
@ConfigurationProperties(prefix = "campus.access")
@Validated
public record AccessServiceProperties(
        @NotBlank String name,
        String environment,
        String description,
        String policyLocation,
        Boolean exposeDenyReasons,
        @Valid Audit audit) {

    public static final String DEFAULT_POLICY_LOCATION = "classpath:policy/default-policy.yml";

    /** Compact constructor. Applies defaults before Bean Validation runs. */
    public AccessServiceProperties {
        if (environment == null || environment.isBlank()) {
            environment = "development";
        }
        if (policyLocation == null || policyLocation.isBlank()) {
            policyLocation = DEFAULT_POLICY_LOCATION;
        }
        if (exposeDenyReasons == null) {
            exposeDenyReasons = !"production".equalsIgnoreCase(environment);
        }
        if (audit == null) {
            audit = new Audit(null, null, 0);
        }
    }

    /**
     * @param mode {@code async} hands entries to a background writer, {@code sync} writes on the
     *     request thread.
     * @param store where entries go: the {@code audit_log} table, the {@code campus.audit} logger,
     *     or memory for local runs.
     * @param queueCapacity bound of the async queue (default 10000).
     */
    public record Audit(Mode mode, Store store, int queueCapacity) {

        public Audit {
            if (mode == null) {
                mode = Mode.ASYNC;
            }
            if (store == null) {
                store = Store.JDBC;
            }
            if (queueCapacity <= 0) {
                queueCapacity = 10_000;
            }
        }
    }

    public enum Mode {
        ASYNC,
        SYNC
    }

    public enum Store {
        JDBC,
        LOG,
        MEMORY
    }
}

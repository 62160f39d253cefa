package com.smartcampus.accessservice;

import com.smartcampus.accessservice.config.AccessServiceProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Smart Campus access service.
 *
 * <p>Hosts the authorization core behind a small HTTP surface so that other campus services and
 * operators can ask for decisions, collection scopes and visible resources, and reload the policy
 * table without a restart.
 *
 * <p>Configured by default:
 *
 * <ul>
 *   <li>Graceful shutdown, which also drains the asynchronous audit queue
 *   <li>Flyway migrations for the audit log, resource descriptors and linked entities
 *   <li>Actuator health, metrics and Prometheus endpoints
 *   <li>Correlation ID propagation and RFC 7807 error responses
 * </ul>
 */
@SpringBootApplication
@EnableConfigurationProperties(AccessServiceProperties.class)
public class AccessServiceApplication {

    private static final Logger log = LoggerFactory.getLogger(AccessServiceApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(AccessServiceApplication.class, args);
        log.info("Smart Campus access service started");
    }
}

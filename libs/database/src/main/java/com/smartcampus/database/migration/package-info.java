/**
 * Flyway migration status.
 *
 * <p>Migrations live under {@code db/migration/campus} and are run by Spring Boot's Flyway
 * auto-configuration in the service.
 */
package com.smartcampus.database.migration;

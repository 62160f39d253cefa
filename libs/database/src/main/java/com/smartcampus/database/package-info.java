/**
 * JDBC collaborators of the Smart Campus access core.
 *
 * <p>Everything here plugs into a seam defined in {@code campus-security}:
 *
 * <ul>
 *   <li>{@link com.smartcampus.database.audit.JdbcAuditStore} is an {@code AuditStore} over the
 *       {@code audit_log} table
 *   <li>{@link com.smartcampus.database.link.JdbcLinkedEntityResolver} reads guardian links and
 *       teacher class assignments
 *   <li>{@link com.smartcampus.database.resource.JdbcResourceDescriptorRepository} loads
 *       descriptors one at a time and lists them under a scope
 *   <li>{@link com.smartcampus.database.scope.ScopeSqlRenderer} turns a {@code ScopePredicate} into
 *       a parameterised {@code WHERE} fragment
 * </ul>
 *
 * <p>The schema lives in Flyway migrations under {@code db/migration/campus}. The SQL sticks to
 * what PostgreSQL and H2 both accept, so tests run against an in-memory H2 database.
 */
package com.smartcampus.database;

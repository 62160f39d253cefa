package com.smartcampus.database.migration;

import java.util.Arrays;
import java.util.List;
import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.MigrationInfo;
import org.flywaydb.core.api.MigrationInfoService;

/**
 * Reports the state of the access-core schema from Flyway's history table.
 *
 * <p>This is a POJO (no Spring annotations) so it can be used in unit tests without a Spring
 * context; the service wires it next to the {@link Flyway} bean.
 */
public class MigrationStatusService {

    /**
     * One migration known to Flyway.
     *
     * @param version     migration version (e.g. "1")
     * @param description migration description (e.g. "audit log")
     * @param state       Flyway state (e.g. "SUCCESS", "PENDING")
     */
    public record Migration(String version, String description, String state) {}

    /**
     * Summary of the schema.
     *
     * @param appliedMigrations number of successfully applied migrations
     * @param pendingMigrations number of migrations waiting to be applied
     * @param currentVersion    current schema version (null if nothing applied)
     */
    public record SchemaStatus(int appliedMigrations, int pendingMigrations, String currentVersion) {}

    private final Flyway flyway;

    public MigrationStatusService(Flyway flyway) {
        this.flyway = flyway;
    }

    public SchemaStatus status() {
        MigrationInfoService info = flyway.info();
        MigrationInfo current = info.current();
        return new SchemaStatus(
                info.applied().length,
                info.pending().length,
                current == null || current.getVersion() == null ? null : current.getVersion().getVersion());
    }

    public List<Migration> migrations() {
        return Arrays.stream(flyway.info().all())
                .map(m -> new Migration(
                        m.getVersion() == null ? null : m.getVersion().getVersion(),
                        m.getDescription(),
                        m.getState().name()))
                .toList();
    }
}

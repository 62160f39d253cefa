package com.smartcampus.database.audit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.smartcampus.database.TestDatabases;
import com.smartcampus.security.Action;
import com.smartcampus.security.ResourceKind;
import com.smartcampus.security.Role;
import com.smartcampus.security.audit.AuditEntry;
import com.smartcampus.security.audit.AuditWriteException;
import com.smartcampus.security.audit.DirectAuditSink;
import com.smartcampus.security.policy.Decision;
import com.smartcampus.security.testing.TestPrincipals;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;

@DisplayName("JdbcAuditStore")
class JdbcAuditStoreTest {

    private JdbcTemplate jdbc;
    private JdbcAuditStore store;

    @BeforeEach
    void setUp() {
        jdbc = new JdbcTemplate(TestDatabases.migrated());
        store = new JdbcAuditStore(jdbc);
    }

    @Test
    @DisplayName("inserts every column of the entry")
    void insertsEntry() {
        store.append(new AuditEntry(7L, Instant.parse("2024-09-01T08:30:00Z"), "super-1", Role.SUPER_ADMIN,
                null, Action.DELETE, ResourceKind.SCHOOL, "SCH2", "SCH2", Decision.Outcome.ALLOW,
                "allowed by policy", "corr-1", "203.0.113.9", "CampusApp/2.1"));

        Map<String, Object> row = jdbc.queryForMap("SELECT * FROM audit_log WHERE seq_no = 7");
        assertThat(row)
                .containsEntry("PRINCIPAL_ID", "super-1")
                .containsEntry("ROLE", "super_admin")
                .containsEntry("ACTION", "delete")
                .containsEntry("RESOURCE_KIND", "school")
                .containsEntry("RESOURCE_TENANT_ID", "SCH2")
                .containsEntry("OUTCOME", "ALLOW")
                .containsEntry("CORRELATION_ID", "corr-1")
                .containsEntry("CLIENT_ADDRESS", "203.0.113.9")
                .containsEntry("USER_AGENT", "CampusApp/2.1");
        assertThat(row.get("TENANT_ID")).isNull();
    }

    @Test
    @DisplayName("stores a denied attempt on an unrecognised kind with no kind")
    void unrecognisedKind() {
        var failures = new ArrayList<Exception>();
        new DirectAuditSink(store, (entry, cause) -> failures.add(cause))
                .record(TestPrincipals.teacher("SCH1", "5"), Action.UPDATE, (ResourceKind) null, "x-1",
                        Decision.deny(Decision.Code.UNKNOWN_ROLE_OR_KIND));

        Map<String, Object> row = jdbc.queryForMap("SELECT * FROM audit_log");
        assertThat(row)
                .containsEntry("ACTION", "update")
                .containsEntry("RESOURCE_ID", "x-1")
                .containsEntry("OUTCOME", "DENY");
        assertThat(row.get("RESOURCE_KIND")).isNull();
        assertThat(failures).isEmpty();
    }

    @Test
    @DisplayName("reports the highest stored sequence")
    void lastSequence() {
        assertThat(store.lastSequence()).isZero();

        store.append(entry(3L));
        store.append(entry(9L));

        assertThat(store.lastSequence()).isEqualTo(9L);
    }

    @Test
    @DisplayName("refuses to store the same sequence twice")
    void duplicateSequence() {
        store.append(entry(1L));

        assertThatThrownBy(() -> store.append(entry(1L)))
                .isInstanceOf(AuditWriteException.class)
                .hasMessageContaining("audit entry 1");
    }

    @Test
    @DisplayName("lets a restarted sink continue numbering from the table")
    void restartedSink() {
        var failures = new ArrayList<Exception>();
        new DirectAuditSink(store, (entry, cause) -> failures.add(cause))
                .record(TestPrincipals.admin("SCH1"), Action.CREATE, ResourceKind.NOTICE, "n-1", Decision.allow());

        new DirectAuditSink(store, (entry, cause) -> failures.add(cause))
                .record(TestPrincipals.admin("SCH1"), Action.DELETE, ResourceKind.NOTICE, "n-1", Decision.allow());

        List<Long> sequences = jdbc.queryForList("SELECT seq_no FROM audit_log ORDER BY seq_no", Long.class);
        assertThat(sequences).containsExactly(1L, 2L);
        assertThat(failures).isEmpty();
    }

    private static AuditEntry entry(long sequence) {
        return new AuditEntry(sequence, Instant.now(), "teacher-1", Role.TEACHER, "SCH1", Action.UPDATE,
                ResourceKind.ATTENDANCE, "att-1", "SCH1", Decision.Outcome.DENY, "ownership failure", null,
                null, null);
    }
}

package com.smartcampus.accessservice.config;

import com.smartcampus.database.audit.JdbcAuditStore;
import com.smartcampus.database.link.JdbcLinkedEntityResolver;
import com.smartcampus.database.migration.MigrationStatusService;
import com.smartcampus.database.resource.JdbcResourceDescriptorRepository;
import com.smartcampus.observability.MetricFactory;
import com.smartcampus.security.AccessGuard;
import com.smartcampus.security.LinkedEntityResolver;
import com.smartcampus.security.audit.AsyncAuditSink;
import com.smartcampus.security.audit.AuditAlertChannel;
import com.smartcampus.security.audit.AuditSink;
import com.smartcampus.security.audit.AuditStore;
import com.smartcampus.security.audit.DirectAuditSink;
import com.smartcampus.security.audit.InMemoryAuditStore;
import com.smartcampus.security.audit.LoggingAuditAlertChannel;
import com.smartcampus.security.audit.Slf4jAuditStore;
import com.smartcampus.security.policy.PolicyEvaluator;
import com.smartcampus.security.policy.PolicyTable;
import com.smartcampus.security.policy.PolicyTableHolder;
import com.smartcampus.security.policy.PolicyTableLoader;
import com.smartcampus.security.scope.ScopingFilter;
import io.micrometer.core.instrument.MeterRegistry;
import org.flywaydb.core.Flyway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * Wires the authorization core from {@code campus-security} to the JDBC adapters from {@code
 * campus-database}.
 *
 * <p>The policy table is loaded once at startup from {@link AccessServiceProperties#policyLocation()}.
 * An invalid table fails the startup; there is no fallback table.
 */
@Configuration
public class AccessConfiguration {

    private static final Logger log = LoggerFactory.getLogger(AccessConfiguration.class);

    @Bean
    public MetricFactory metricFactory(MeterRegistry registry, AccessServiceProperties properties) {
        return new MetricFactory(registry, properties.name());
    }

    @Bean
    public PolicyTableHolder policyTableHolder(AccessServiceProperties properties) {
        PolicyTable table = PolicyTableLoader.loadLocation(properties.policyLocation());
        log.info("Loaded {} policy rules from {}", table.size(), properties.policyLocation());
        return new PolicyTableHolder(table);
    }

    @Bean
    public PolicyEvaluator policyEvaluator(PolicyTableHolder holder) {
        return new PolicyEvaluator(holder);
    }

    @Bean
    public ScopingFilter scopingFilter(PolicyTableHolder holder) {
        return new ScopingFilter(holder);
    }

    @Bean
    public AuditStore auditStore(AccessServiceProperties properties, JdbcTemplate jdbcTemplate) {
        return switch (properties.audit().store()) {
            case JDBC -> new JdbcAuditStore(jdbcTemplate);
            case LOG -> new Slf4jAuditStore();
            case MEMORY -> new InMemoryAuditStore();
        };
    }

    @Bean
    public AuditAlertChannel auditAlertChannel(MetricFactory metrics) {
        return new LoggingAuditAlertChannel(metrics);
    }

    /** The async sink is closed on shutdown, which drains its queue. */
    @Bean
    public AuditSink auditSink(
            AccessServiceProperties properties, AuditStore store, AuditAlertChannel alerts) {
        AccessServiceProperties.Audit audit = properties.audit();
        log.info("Audit sink: mode={}, store={}", audit.mode(), audit.store());
        if (audit.mode() == AccessServiceProperties.Mode.SYNC) {
            return new DirectAuditSink(store, alerts);
        }
        return new AsyncAuditSink(store, alerts, audit.queueCapacity());
    }

    @Bean
    public LinkedEntityResolver linkedEntityResolver(JdbcTemplate jdbcTemplate) {
        return new JdbcLinkedEntityResolver(jdbcTemplate);
    }

    @Bean
    public JdbcResourceDescriptorRepository resourceDescriptorRepository(JdbcTemplate jdbcTemplate) {
        return new JdbcResourceDescriptorRepository(jdbcTemplate);
    }

    @Bean
    public AccessGuard accessGuard(
            PolicyEvaluator evaluator,
            ScopingFilter scopingFilter,
            JdbcResourceDescriptorRepository repository,
            AuditSink auditSink,
            MetricFactory metrics) {
        return new AccessGuard(evaluator, scopingFilter, repository, auditSink, metrics);
    }

    @Bean
    public MigrationStatusService migrationStatusService(Flyway flyway) {
        return new MigrationStatusService(flyway);
    }
}

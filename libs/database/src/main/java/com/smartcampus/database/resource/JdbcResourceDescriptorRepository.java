package com.smartcampus.database.resource;

import com.smartcampus.database.scope.ScopeSqlRenderer;
import com.smartcampus.database.scope.SqlFragment;
import com.smartcampus.security.ResourceDescriptor;
import com.smartcampus.security.ResourceDescriptorLoader;
import com.smartcampus.security.ResourceKind;
import com.smartcampus.security.scope.ScopePredicate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.annotation.Transactional;

/**
 * Descriptors of school entities in {@code resource_descriptors} and {@code resource_owners}.
 *
 * <p>Single loads feed {@code AccessGuard}; {@link #findVisible} renders a scope into the query
 * so that rows outside it are never read.
 */
public class JdbcResourceDescriptorRepository implements ResourceDescriptorLoader {

    private static final ScopeSqlRenderer RENDERER = ScopeSqlRenderer.withOwnerTemplate(
            "d.tenant_id",
            "EXISTS (SELECT 1 FROM resource_owners o WHERE o.kind = d.kind AND o.id = d.id AND o.owner_ref IN (%s))");

    private static final String SELECT = """
            SELECT d.kind, d.id, d.tenant_id, o.owner_ref
            FROM resource_descriptors d
            LEFT JOIN resource_owners o ON o.kind = d.kind AND o.id = d.id
            """;

    private final JdbcTemplate jdbc;

    public JdbcResourceDescriptorRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public Optional<ResourceDescriptor> load(ResourceKind kind, String id) {
        List<ResourceDescriptor> found = query(
                SELECT + " WHERE d.kind = ? AND d.id = ?", List.of(kind.value(), id));
        return found.stream().findFirst();
    }

    /**
     * Descriptors of {@code kind} admitted by {@code scope}, ordered by ID. A scope that matches
     * nothing returns an empty list without querying.
     */
    public List<ResourceDescriptor> findVisible(ResourceKind kind, ScopePredicate scope) {
        SqlFragment fragment = RENDERER.render(scope);
        if (fragment.matchesNothing()) {
            return List.of();
        }
        var params = new ArrayList<Object>();
        params.add(kind.value());
        params.addAll(fragment.params());
        return query(SELECT + " WHERE d.kind = ? AND " + fragment.where() + " ORDER BY d.id", params);
    }

    /**
     * Inserts or replaces a descriptor together with its owner references.
     */
    @Transactional
    public void save(ResourceDescriptor descriptor) {
        String kind = descriptor.kind().value();
        jdbc.update("DELETE FROM resource_owners WHERE kind = ? AND id = ?", kind, descriptor.id());
        jdbc.update("DELETE FROM resource_descriptors WHERE kind = ? AND id = ?", kind, descriptor.id());
        jdbc.update("INSERT INTO resource_descriptors (kind, id, tenant_id) VALUES (?, ?, ?)",
                kind, descriptor.id(), descriptor.tenantId());
        for (String owner : descriptor.ownerRefs()) {
            jdbc.update("INSERT INTO resource_owners (kind, id, owner_ref) VALUES (?, ?, ?)",
                    kind, descriptor.id(), owner);
        }
    }

    private List<ResourceDescriptor> query(String sql, List<Object> params) {
        Map<String, Row> rows = new LinkedHashMap<>();
        jdbc.query(sql, rs -> {
            String id = rs.getString("id");
            String kind = rs.getString("kind");
            String tenantId = rs.getString("tenant_id");
            Row row = rows.computeIfAbsent(id, k -> new Row(kind, k, tenantId));
            String owner = rs.getString("owner_ref");
            if (owner != null) {
                row.owners.add(owner);
            }
        }, params.toArray());
        return rows.values().stream().map(Row::toDescriptor).toList();
    }

    private static final class Row {

        private final String kind;
        private final String id;
        private final String tenantId;
        private final Set<String> owners = new HashSet<>();

        private Row(String kind, String id, String tenantId) {
            this.kind = kind;
            this.id = id;
            this.tenantId = tenantId;
        }

        private ResourceDescriptor toDescriptor() {
            ResourceKind resourceKind = ResourceKind.fromString(kind).orElseThrow(() ->
                    new IllegalStateException("Unknown resource kind in resource_descriptors: " + kind));
            return new ResourceDescriptor(resourceKind, tenantId, owners, id);
        }
    }
}

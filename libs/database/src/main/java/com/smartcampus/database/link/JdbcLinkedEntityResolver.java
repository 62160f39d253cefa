package com.smartcampus.database.link;

import com.smartcampus.security.LinkedEntityResolver;
import com.smartcampus.security.Role;
import java.util.HashSet;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * Resolves ownership links from the link tables.
 *
 * <ul>
 *   <li>parent: the students in {@code guardian_links} for the parent's school
 *   <li>teacher: the classes in {@code teacher_class_assignments} for the teacher's school
 *   <li>every other role: no links
 * </ul>
 *
 * <p>One query per call; wrap in a {@code RequestLinkCache} to read at most once per request.
 * Database errors propagate so that a request never proceeds with silently missing links.
 */
public class JdbcLinkedEntityResolver implements LinkedEntityResolver {

    private static final Logger log = LoggerFactory.getLogger(JdbcLinkedEntityResolver.class);

    private static final String CHILDREN =
            "SELECT student_id FROM guardian_links WHERE tenant_id = ? AND parent_id = ?";

    private static final String CLASSES =
            "SELECT class_id FROM teacher_class_assignments WHERE tenant_id = ? AND teacher_id = ?";

    private final JdbcTemplate jdbc;

    public JdbcLinkedEntityResolver(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public Set<String> resolveLinkedIds(String principalId, Role role, String tenantId) {
        String sql = switch (role) {
            case PARENT -> CHILDREN;
            case TEACHER -> CLASSES;
            default -> null;
        };
        if (sql == null) {
            return Set.of();
        }
        Set<String> ids = new HashSet<>(jdbc.queryForList(sql, String.class, tenantId, principalId));
        log.debug("Resolved {} linked ids for {} {} in {}", ids.size(), role.value(), principalId, tenantId);
        return ids;
    }
}

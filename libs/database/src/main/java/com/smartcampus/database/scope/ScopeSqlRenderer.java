package com.smartcampus.database.scope;

import com.smartcampus.security.scope.ScopePredicate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Renders a {@link ScopePredicate} as a {@link SqlFragment} for one table layout.
 *
 * <p>The owner clause is a template with a single {@code %s} that receives the comma-separated
 * placeholders, e.g. {@code "owner_id IN (%s)"} for a single owner column or an {@code EXISTS}
 * sub-select for a link table. Owner IDs are bound in sorted order so that equal predicates
 * render identical SQL.
 *
 * <p>Column names and templates come from code, never from request data; only values are bound.
 */
public final class ScopeSqlRenderer {

    private final String tenantColumn;
    private final String ownerTemplate;

    private ScopeSqlRenderer(String tenantColumn, String ownerTemplate) {
        if (tenantColumn == null || tenantColumn.isBlank()) {
            throw new IllegalArgumentException("tenantColumn must not be null or blank");
        }
        if (ownerTemplate == null || !ownerTemplate.contains("%s")) {
            throw new IllegalArgumentException("ownerTemplate must contain a %s placeholder list");
        }
        this.tenantColumn = tenantColumn;
        this.ownerTemplate = ownerTemplate;
    }

    /** Layout where each row has exactly one owner column. */
    public static ScopeSqlRenderer forColumns(String tenantColumn, String ownerColumn) {
        return new ScopeSqlRenderer(tenantColumn, ownerColumn + " IN (%s)");
    }

    /** Layout where owners live in another table, matched through {@code ownerTemplate}. */
    public static ScopeSqlRenderer withOwnerTemplate(String tenantColumn, String ownerTemplate) {
        return new ScopeSqlRenderer(tenantColumn, ownerTemplate);
    }

    public SqlFragment render(ScopePredicate predicate) {
        if (predicate == null || predicate.matchesNothing()) {
            return SqlFragment.NEVER;
        }
        if (predicate.isUnrestricted()) {
            return SqlFragment.ALWAYS;
        }
        var clauses = new ArrayList<String>();
        var params = new ArrayList<Object>();
        if (predicate.hasTenantClause()) {
            clauses.add(tenantColumn + " = ?");
            params.add(predicate.tenantId());
        }
        if (predicate.hasOwnerClause()) {
            List<String> owners = new ArrayList<>(predicate.ownerRefsAnyOf());
            Collections.sort(owners);
            clauses.add(ownerTemplate.formatted(String.join(", ", Collections.nCopies(owners.size(), "?"))));
            params.addAll(owners);
        }
        return new SqlFragment(String.join(" AND ", clauses), params);
    }
}

package com.smartcampus.database.scope;

import java.util.List;

/**
 * A parameterised SQL condition with its bind values in placeholder order.
 *
 * @param where  condition without the {@code WHERE} keyword
 * @param params values for the {@code ?} placeholders
 */
public record SqlFragment(String where, List<Object> params) {

    static final SqlFragment ALWAYS = new SqlFragment("1 = 1", List.of());
    static final SqlFragment NEVER = new SqlFragment("1 = 0", List.of());

    public SqlFragment {
        if (where == null || where.isBlank()) {
            throw new IllegalArgumentException("where must not be null or blank");
        }
        params = List.copyOf(params);
    }

    /** Whether the condition excludes every row, so the query can be skipped. */
    public boolean matchesNothing() {
        return this.equals(NEVER);
    }
}

package io.rowguard.sql.policy;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Named row level security rule on one table.
 *
 * <p>{@code using} and {@code withCheck} are DuckDB JSON expression trees, see
 * {@link io.rowguard.sql.commons.ExpressionFactory}. They are never mutated once the policy exists.
 *
 * @param roles roles the policy applies to; empty means every role
 * @param using filter on existing rows, required for SELECT, UPDATE, DELETE and ALL
 * @param withCheck check on proposed rows, only for INSERT, UPDATE and ALL; may be null
 */
public record Policy(String name, String table, Operation operation, Set<String> roles,
                     JsonNode using, JsonNode withCheck) {

    public static final String ALL_ROLES = "*";

    public static final String PUBLIC_ROLE = "public";

    public Policy {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Policy name cannot be null or empty");
        }
        if (table == null || table.isBlank()) {
            throw new IllegalArgumentException("Policy table cannot be null or empty");
        }
        Objects.requireNonNull(operation, "operation");
        roles = normalizeRoles(roles);
        switch (operation) {
            case SELECT, DELETE -> {
                if (using == null) {
                    throw new IllegalArgumentException("%s policy \"%s\" requires a using expression".formatted(operation, name));
                }
                if (withCheck != null) {
                    throw new IllegalArgumentException("%s policy \"%s\" cannot have a with_check expression".formatted(operation, name));
                }
            }
            case UPDATE, ALL -> {
                if (using == null) {
                    throw new IllegalArgumentException("%s policy \"%s\" requires a using expression".formatted(operation, name));
                }
            }
            case INSERT -> {
                if (using == null && withCheck == null) {
                    throw new IllegalArgumentException("INSERT policy \"%s\" requires a using or with_check expression".formatted(name));
                }
            }
        }
    }

    public static Policy of(String name, String table, Operation operation, JsonNode using) {
        return new Policy(name, table, operation, Set.of(), using, null);
    }

    public static Policy of(String name, String table, Operation operation, Collection<String> roles,
                            JsonNode using, JsonNode withCheck) {
        return new Policy(name, table, operation, roles == null ? Set.of() : Set.copyOf(roles), using, withCheck);
    }

    public boolean appliesTo(String role) {
        return roles.isEmpty() || roles.contains(role);
    }

    /**
     * Predicate a proposed row must satisfy: {@code withCheck}, falling back to {@code using}.
     */
    public JsonNode effectiveCheck() {
        return withCheck != null ? withCheck : using;
    }

    private static Set<String> normalizeRoles(Set<String> roles) {
        if (roles == null || roles.isEmpty()) {
            return Set.of();
        }
        var result = new LinkedHashSet<String>();
        for (var r : roles) {
            if (r == null || r.isBlank()) {
                throw new IllegalArgumentException("Role cannot be null or empty");
            }
            if (ALL_ROLES.equals(r) || PUBLIC_ROLE.equalsIgnoreCase(r)) {
                return Set.of();
            }
            result.add(r);
        }
        return Set.copyOf(result);
    }
}

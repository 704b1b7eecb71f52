package io.rowguard.sql.policy.claims;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Identity of the principal an operation runs for. Built once per operation by the authentication
 * layer and never modified by evaluation.
 *
 * @param role principal role, e.g. {@code anon} or {@code authenticated}
 * @param id principal id, null for anonymous callers
 * @param attributes remaining claims such as {@code email}; values may be nested maps and lists
 * @param bypass elevated capability, null for ordinary callers
 */
public record ClaimsContext(String role, String id, Map<String, Object> attributes, BypassCapability bypass) {

    public static final String ANON_ROLE = "anon";
    public static final String AUTHENTICATED_ROLE = "authenticated";
    public static final String EMAIL = "email";
    public static final String ROLE = "role";
    public static final String SUB = "sub";

    public ClaimsContext {
        if (role == null || role.isBlank()) {
            throw new IllegalArgumentException("Role cannot be null or empty");
        }
        attributes = attributes == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public static ClaimsContext anonymous() {
        return new ClaimsContext(ANON_ROLE, null, Map.of(), null);
    }

    public static ClaimsContext authenticated(String id) {
        return new ClaimsContext(AUTHENTICATED_ROLE, Objects.requireNonNull(id, "id"), Map.of(), null);
    }

    public static ClaimsContext of(String role, String id, Map<String, ?> attributes) {
        Map<String, Object> copy = new LinkedHashMap<>();
        if (attributes != null) {
            copy.putAll(attributes);
        }
        return new ClaimsContext(role, id, copy, null);
    }

    public ClaimsContext withAttribute(String key, Object value) {
        var copy = new LinkedHashMap<>(attributes);
        copy.put(key, value);
        return new ClaimsContext(role, id, copy, bypass);
    }

    /**
     * Same principal carrying a verified bypass capability.
     */
    public ClaimsContext withBypass(BypassCapability capability) {
        return new ClaimsContext(role, id, attributes, Objects.requireNonNull(capability, "capability"));
    }

    public boolean hasBypass() {
        return bypass != null;
    }

    public String email() {
        var email = attributes.get(EMAIL);
        return email == null ? null : email.toString();
    }

    /**
     * The claim set as a whole, the value of {@code auth.jwt()}.
     */
    public Map<String, Object> jwt() {
        var result = new LinkedHashMap<String, Object>(attributes);
        result.put(ROLE, role);
        if (id != null) {
            result.put(SUB, id);
        }
        return Collections.unmodifiableMap(result);
    }

    @Override
    public String toString() {
        return "ClaimsContext{role=" + role + ", id=" + id + ", bypass=" + (bypass != null) + "}";
    }
}

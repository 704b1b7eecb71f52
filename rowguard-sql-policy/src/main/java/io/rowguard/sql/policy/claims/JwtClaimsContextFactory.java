package io.rowguard.sql.policy.claims;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;

import javax.crypto.SecretKey;
import java.util.LinkedHashMap;
import java.util.Set;

/**
 * Maps verified JWT claims to a {@link ClaimsContext}: {@code role} becomes the role, {@code sub} the id
 * and every other non registered claim an attribute. A token without a role claim is
 * {@code authenticated} when it has a subject and {@code anon} otherwise.
 *
 * <p>A {@code service_role} claim gives no bypass here; that needs {@link ServiceKeyVerifier}.
 */
public class JwtClaimsContextFactory {

    private static final Set<String> REGISTERED = Set.of(Claims.ISSUER, Claims.SUBJECT, Claims.AUDIENCE,
            Claims.EXPIRATION, Claims.NOT_BEFORE, Claims.ISSUED_AT, Claims.ID, ClaimsContext.ROLE);

    private final JwtParser jwtParser;

    public JwtClaimsContextFactory(SecretKey key) {
        this.jwtParser = Jwts.parser().verifyWith(key).build();
    }

    /**
     * @throws io.jsonwebtoken.JwtException if the token is not valid for the configured key
     */
    public ClaimsContext fromToken(String token) {
        return fromClaims(jwtParser.parseSignedClaims(token).getPayload());
    }

    public static ClaimsContext fromClaims(Claims claims) {
        var subject = claims.getSubject();
        var role = claims.get(ClaimsContext.ROLE, String.class);
        if (role == null || role.isBlank()) {
            role = subject == null ? ClaimsContext.ANON_ROLE : ClaimsContext.AUTHENTICATED_ROLE;
        }
        var attributes = new LinkedHashMap<String, Object>();
        claims.forEach((k, v) -> {
            if (!REGISTERED.contains(k)) {
                attributes.put(k, v);
            }
        });
        return ClaimsContext.of(role, subject, attributes);
    }
}

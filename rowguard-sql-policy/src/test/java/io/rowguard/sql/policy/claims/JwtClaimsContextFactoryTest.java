package io.rowguard.sql.policy.claims;

import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import org.junit.jupiter.api.Test;

import javax.crypto.SecretKey;
import java.util.Date;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class JwtClaimsContextFactoryTest {

    private static final SecretKey SECRET = Jwts.SIG.HS256.key().build();

    private final JwtClaimsContextFactory factory = new JwtClaimsContextFactory(SECRET);

    @Test
    void testRoleSubjectAndAttributes() {
        var token = Jwts.builder()
                .subject("u1")
                .issuer("auth")
                .issuedAt(new Date())
                .claim("role", "editor")
                .claim("email", "u1@example.com")
                .claim("app_metadata", Map.of("teams", List.of(1, 2)))
                .signWith(SECRET)
                .compact();
        var claims = factory.fromToken(token);
        assertEquals("editor", claims.role());
        assertEquals("u1", claims.id());
        assertEquals("u1@example.com", claims.email());
        assertEquals(Map.of("teams", List.of(1, 2)), claims.attributes().get("app_metadata"));
        assertFalse(claims.attributes().containsKey("iss"));
        assertFalse(claims.attributes().containsKey("role"));
        assertFalse(claims.hasBypass());
    }

    @Test
    void testDefaultRoles() {
        var withSubject = factory.fromToken(Jwts.builder().subject("u2").signWith(SECRET).compact());
        assertEquals(ClaimsContext.AUTHENTICATED_ROLE, withSubject.role());

        var withoutSubject = factory.fromToken(Jwts.builder().claim("email", "x@example.com").signWith(SECRET).compact());
        assertEquals(ClaimsContext.ANON_ROLE, withoutSubject.role());
        assertNull(withoutSubject.id());
    }

    @Test
    void testServiceRoleClaimGivesNoBypass() {
        var token = Jwts.builder().subject("s").claim("role", "service_role").signWith(SECRET).compact();
        var claims = factory.fromToken(token);
        assertEquals("service_role", claims.role());
        assertFalse(claims.hasBypass());
    }

    @Test
    void testForeignSignatureIsRejected() {
        var token = Jwts.builder().subject("u1").signWith(Jwts.SIG.HS256.key().build()).compact();
        assertThrows(JwtException.class, () -> factory.fromToken(token));
    }
}

package io.rowguard.sql.policy.claims;

import com.typesafe.config.ConfigFactory;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.io.Encoders;
import io.rowguard.sql.policy.MutableClock;
import org.junit.jupiter.api.Test;

import javax.crypto.SecretKey;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Date;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class JwtServiceKeyVerifierTest {

    private static final SecretKey SERVICE_SECRET = Jwts.SIG.HS256.key().build();
    private static final SecretKey USER_SECRET = Jwts.SIG.HS256.key().build();

    private static String token(SecretKey key, String role, String subject) {
        var builder = Jwts.builder().subject(subject).issuedAt(new Date());
        if (role != null) {
            builder.claim("role", role);
        }
        return builder.signWith(key).compact();
    }

    @Test
    void testValidServiceKey() {
        var clock = new MutableClock(Instant.parse("2024-05-01T00:00:00Z"), ZoneOffset.UTC);
        var verifier = new JwtServiceKeyVerifier(SERVICE_SECRET);
        verifier.setClock(clock);
        var capability = verifier.verify(token(SERVICE_SECRET, JwtServiceKeyVerifier.SERVICE_ROLE, "backend"));
        assertTrue(capability.isPresent());
        assertEquals("backend", capability.get().subject());
        assertEquals(JwtServiceKeyVerifier.class.getName(), capability.get().verifier());
        assertEquals(clock.instant(), capability.get().grantedAt());
    }

    @Test
    void testRefusedKeys() {
        var verifier = new JwtServiceKeyVerifier(SERVICE_SECRET);
        assertTrue(verifier.verify(token(SERVICE_SECRET, "authenticated", "u1")).isEmpty());
        assertTrue(verifier.verify(token(USER_SECRET, JwtServiceKeyVerifier.SERVICE_ROLE, "backend")).isEmpty());
        assertTrue(verifier.verify("not-a-token").isEmpty());
        assertTrue(verifier.verify("").isEmpty());
        assertTrue(verifier.verify(null).isEmpty());
    }

    @Test
    void testWithoutSecretEverythingIsRefused() {
        var verifier = new JwtServiceKeyVerifier(ConfigFactory.empty());
        assertTrue(verifier.verify(token(SERVICE_SECRET, JwtServiceKeyVerifier.SERVICE_ROLE, "backend")).isEmpty());
    }

    @Test
    void testSecretFromConfig() {
        var config = ConfigFactory.parseMap(Map.of("secret_key", Encoders.BASE64.encode(SERVICE_SECRET.getEncoded())));
        var verifier = new JwtServiceKeyVerifier(config);
        var capability = verifier.verify(token(SERVICE_SECRET, JwtServiceKeyVerifier.SERVICE_ROLE, null));
        assertEquals(JwtServiceKeyVerifier.SERVICE_ROLE, capability.orElseThrow().subject());
    }
}

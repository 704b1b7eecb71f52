package io.rowguard.sql.policy.claims;

import com.typesafe.config.Config;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.io.Decoders;
import io.jsonwebtoken.security.Keys;
import io.rowguard.sql.policy.ConfigConstants;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.SecretKey;
import java.util.Optional;

/**
 * Service keys are HMAC signed JWTs carrying {@code role = service_role}, signed with a secret
 * distinct from the one used for user tokens. Without a configured secret every key is refused.
 *
 * <pre>
 * service_key_verifier {
 *   class = "io.rowguard.sql.policy.claims.JwtServiceKeyVerifier"
 *   secret_key = "base64 encoded, at least 256 bits"
 * }
 * </pre>
 */
public class JwtServiceKeyVerifier extends AbstractServiceKeyVerifier {

    public static final String SERVICE_ROLE = "service_role";

    private static final Logger logger = LoggerFactory.getLogger(JwtServiceKeyVerifier.class);

    private JwtParser jwtParser;

    public JwtServiceKeyVerifier() {
    }

    public JwtServiceKeyVerifier(SecretKey key) {
        this.jwtParser = Jwts.parser().verifyWith(key).build();
    }

    public JwtServiceKeyVerifier(Config config) {
        setConfig(config);
    }

    @Override
    public void setConfig(Config config) {
        if (config.hasPath(ConfigConstants.SECRET_KEY_KEY)) {
            SecretKey key = Keys.hmacShaKeyFor(Decoders.BASE64.decode(config.getString(ConfigConstants.SECRET_KEY_KEY)));
            this.jwtParser = Jwts.parser().verifyWith(key).build();
        } else {
            logger.atWarn().log("No service key secret configured, service keys will be refused");
        }
    }

    @Override
    public Optional<BypassCapability> verify(String serviceKey) {
        if (jwtParser == null || serviceKey == null || serviceKey.isEmpty()) {
            return Optional.empty();
        }
        try {
            var payload = jwtParser.parseSignedClaims(serviceKey).getPayload();
            var role = payload.get(ClaimsContext.ROLE, String.class);
            if (!SERVICE_ROLE.equals(role)) {
                logger.atWarn().log("Service key refused, role claim is {}", role);
                return Optional.empty();
            }
            var subject = payload.getSubject() == null ? SERVICE_ROLE : payload.getSubject();
            return Optional.of(grant(subject));
        } catch (JwtException | IllegalArgumentException e) {
            logger.atWarn().log("Service key refused: {}", e.getMessage());
            return Optional.empty();
        }
    }
}

package com.blogsmith.publish;

import com.blogsmith.config.BlogsmithProperties;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import io.jsonwebtoken.security.WeakKeyException;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.HexFormat;

/**
 * Mints short-lived Ghost Admin API tokens.
 * <p>
 * The admin key has the form {@code <id>:<hex secret>}. Tokens are HS256-signed with the decoded
 * secret, carry the id as {@code kid}, target the {@code /admin/} audience and expire after
 * five minutes. The key is parsed on first use so the application starts without Ghost settings.
 */
@Component
public class GhostTokenFactory {

    static final Duration TOKEN_TTL = Duration.ofMinutes(5);
    static final String AUDIENCE = "/admin/";

    private final BlogsmithProperties.Ghost settings;
    private final Clock clock;

    @Autowired
    public GhostTokenFactory(BlogsmithProperties properties) {
        this(properties, Clock.systemUTC());
    }

    GhostTokenFactory(BlogsmithProperties properties, Clock clock) {
        this.settings = properties.getGhost();
        this.clock = clock;
    }

    public String createToken() {
        String adminKey = settings.getAdminApiKey();
        int colon = adminKey == null ? -1 : adminKey.indexOf(':');
        if (colon <= 0 || colon == adminKey.length() - 1) {
            throw new GhostPublishException("Ghost admin API key must have the form <id>:<hex secret>");
        }
        String keyId = adminKey.substring(0, colon);
        SecretKey key;
        try {
            key = Keys.hmacShaKeyFor(HexFormat.of().parseHex(adminKey.substring(colon + 1)));
        } catch (IllegalArgumentException | WeakKeyException e) {
            throw new GhostPublishException("Ghost admin API key secret is not a valid HMAC key: " + e.getMessage(), e);
        }

        Instant now = clock.instant();
        return Jwts.builder()
                .header().keyId(keyId).type("JWT").and()
                .issuedAt(Date.from(now))
                .expiration(Date.from(now.plus(TOKEN_TTL)))
                .audience().add(AUDIENCE).and()
                .signWith(key, Jwts.SIG.HS256)
                .compact();
    }
}

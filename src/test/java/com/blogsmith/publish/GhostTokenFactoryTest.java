package com.blogsmith.publish;

import com.blogsmith.config.BlogsmithProperties;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.Jws;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Date;
import java.util.HexFormat;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class GhostTokenFactoryTest {

    static final String SECRET = "0123456789abcdef".repeat(4);
    static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @Test
    @DisplayName("token is signed with the decoded secret and carries the key id")
    void signedToken() {
        var factory = new GhostTokenFactory(properties("key123:" + SECRET), Clock.fixed(NOW, ZoneOffset.UTC));

        Jws<Claims> jws = Jwts.parser()
                .verifyWith(Keys.hmacShaKeyFor(HexFormat.of().parseHex(SECRET)))
                .clock(() -> Date.from(NOW.plusSeconds(60)))
                .build()
                .parseSignedClaims(factory.createToken());

        assertEquals("key123", jws.getHeader().getKeyId());
        assertEquals("HS256", jws.getHeader().getAlgorithm());
        assertEquals(Set.of(GhostTokenFactory.AUDIENCE), jws.getPayload().getAudience());
        assertEquals(Date.from(NOW), jws.getPayload().getIssuedAt());
        assertEquals(Date.from(NOW.plus(GhostTokenFactory.TOKEN_TTL)), jws.getPayload().getExpiration());
    }

    @Test
    @DisplayName("a key without an id fails")
    void missingId() {
        var factory = new GhostTokenFactory(properties(":" + SECRET), Clock.systemUTC());

        assertThrows(GhostPublishException.class, factory::createToken);
    }

    @Test
    @DisplayName("a non-hex secret fails")
    void badSecret() {
        var factory = new GhostTokenFactory(properties("key123:not-hex"), Clock.systemUTC());

        assertThrows(GhostPublishException.class, factory::createToken);
    }

    @Test
    @DisplayName("a secret shorter than 256 bits fails")
    void shortSecret() {
        var factory = new GhostTokenFactory(properties("key123:abcd"), Clock.systemUTC());

        assertThrows(GhostPublishException.class, factory::createToken);
    }

    static BlogsmithProperties properties(String adminKey) {
        var properties = new BlogsmithProperties();
        properties.getGhost().setApiUrl("https://blog.example.com/");
        properties.getGhost().setAdminApiKey(adminKey);
        return properties;
    }
}

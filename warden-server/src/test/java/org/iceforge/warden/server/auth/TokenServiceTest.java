package org.iceforge.warden.server.auth;

import org.jose4j.jwa.AlgorithmConstraints;
import org.jose4j.jws.AlgorithmIdentifiers;
import org.jose4j.jws.JsonWebSignature;
import org.jose4j.jwt.JwtClaims;
import org.jose4j.jwt.NumericDate;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Base64;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.*;

class TokenServiceTest {

    private static final String SECRET = "0123456789abcdef0123456789abcdef";
    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    private static TokenService at(Instant now, String secret, String issuer) {
        return TokenService.withSecret(secret, issuer, "warden-api", Duration.ofMinutes(30), Duration.ofSeconds(30),
                Clock.fixed(now, ZoneOffset.UTC));
    }

    private static TokenService at(Instant now) {
        return at(now, SECRET, "warden");
    }

    private static JwtClaims adminClaims() {
        JwtClaims claims = new JwtClaims();
        claims.setIssuer("warden");
        claims.setAudience("warden-api");
        claims.setSubject("admin");
        claims.setClaim(TokenService.ROLE_CLAIM, "ADMIN");
        claims.setExpirationTime(NumericDate.fromMilliseconds(NOW.plusSeconds(600).toEpochMilli()));
        return claims;
    }

    @Test
    void issuedTokenVerifiesToTheSameUserAndRole() {
        TokenService tokens = at(NOW);

        IssuedToken issued = tokens.issue("analyst", "ANALYST");
        AuthenticatedUser user = tokens.verify(issued.token());

        assertEquals("analyst", user.userId());
        assertEquals("ANALYST", user.role());
        assertEquals(1800, issued.expiresInSeconds());
        assertEquals(NOW.plus(Duration.ofMinutes(30)), issued.expiresAt());
    }

    @Test
    void tokenIsValidUntilExpiryPlusSkew() {
        String token = at(NOW).issue("analyst", "ANALYST").token();

        assertEquals("analyst", at(NOW.plus(Duration.ofMinutes(30)).plusSeconds(20)).verify(token).userId());
        assertThrows(InvalidTokenException.class, () -> at(NOW.plus(Duration.ofMinutes(31))).verify(token));
    }

    @Test
    void tamperedOrForeignTokensAreRejected() {
        String token = at(NOW).issue("viewer", "VIEWER").token();
        String[] parts = token.split("\\.");
        String forgedPayload = adminClaims().toJson();
        String swapped = parts[0] + "." + Base64.getUrlEncoder().withoutPadding()
                .encodeToString(forgedPayload.getBytes(StandardCharsets.UTF_8)) + "." + parts[2];

        TokenService verifier = at(NOW);
        assertThrows(InvalidTokenException.class, () -> verifier.verify(swapped));
        assertThrows(InvalidTokenException.class,
                () -> verifier.verify(at(NOW, "ffffffffffffffffffffffffffffffff", "warden").issue("admin", "ADMIN").token()));
        assertThrows(InvalidTokenException.class,
                () -> verifier.verify(at(NOW, SECRET, "someone-else").issue("admin", "ADMIN").token()));
        assertThrows(InvalidTokenException.class, () -> verifier.verify("not-a-token"));
    }

    @Test
    void unsignedTokenIsRejected() throws Exception {
        JsonWebSignature jws = new JsonWebSignature();
        jws.setPayload(adminClaims().toJson());
        jws.setAlgorithmHeaderValue(AlgorithmIdentifiers.NONE);
        jws.setAlgorithmConstraints(AlgorithmConstraints.NO_CONSTRAINTS);
        String unsigned = jws.getCompactSerialization();

        assertThrows(InvalidTokenException.class, () -> at(NOW).verify(unsigned));
    }

    @Test
    void shortSecretIsRefused() {
        assertThatThrownBy(() -> at(NOW, "too-short", "warden"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("32 bytes");
    }
}

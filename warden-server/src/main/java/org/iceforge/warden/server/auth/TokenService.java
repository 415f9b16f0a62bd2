package org.iceforge.warden.server.auth;

import org.jose4j.jws.AlgorithmIdentifiers;
import org.jose4j.jws.JsonWebSignature;
import org.jose4j.jwa.AlgorithmConstraints;
import org.jose4j.jwt.JwtClaims;
import org.jose4j.jwt.MalformedClaimException;
import org.jose4j.jwt.NumericDate;
import org.jose4j.jwt.consumer.InvalidJwtException;
import org.jose4j.jwt.consumer.JwtConsumer;
import org.jose4j.jwt.consumer.JwtConsumerBuilder;
import org.jose4j.keys.HmacKey;
import org.jose4j.lang.JoseException;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Issues and verifies HS256 access tokens. Claims: iss, aud, sub (user id), iat, exp and {@value #ROLE_CLAIM}.
 * Only HS256 is accepted on the way in, so unsigned ("none") and RSA-confused tokens fail verification.
 */
public class TokenService {

    public static final String ROLE_CLAIM = "role";

    /** HS256 keys shorter than the hash output are rejected. */
    public static final int MIN_SECRET_BYTES = 32;

    private final HmacKey key;
    private final String issuer;
    private final String audience;
    private final Duration ttl;
    private final Duration clockSkew;
    private final Clock clock;

    public TokenService(byte[] secret, String issuer, String audience, Duration ttl, Duration clockSkew, Clock clock) {
        Objects.requireNonNull(secret, "secret");
        if (secret.length < MIN_SECRET_BYTES) {
            throw new IllegalArgumentException("token secret must be at least " + MIN_SECRET_BYTES + " bytes");
        }
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("token ttl must be positive");
        }
        this.key = new HmacKey(secret.clone());
        this.issuer = Objects.requireNonNull(issuer, "issuer");
        this.audience = Objects.requireNonNull(audience, "audience");
        this.ttl = ttl;
        this.clockSkew = clockSkew == null ? Duration.ZERO : clockSkew;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public static TokenService withSecret(String secret, String issuer, String audience, Duration ttl,
                                          Duration clockSkew, Clock clock) {
        return new TokenService(secret.getBytes(StandardCharsets.UTF_8), issuer, audience, ttl, clockSkew, clock);
    }

    public IssuedToken issue(String userId, String role) {
        Objects.requireNonNull(userId, "userId");
        Instant now = clock.instant();
        Instant expiresAt = now.plus(ttl);

        JwtClaims claims = new JwtClaims();
        claims.setIssuer(issuer);
        claims.setAudience(audience);
        claims.setSubject(userId);
        claims.setIssuedAt(NumericDate.fromMilliseconds(now.toEpochMilli()));
        claims.setExpirationTime(NumericDate.fromMilliseconds(expiresAt.toEpochMilli()));
        if (role != null) claims.setClaim(ROLE_CLAIM, role);

        JsonWebSignature jws = new JsonWebSignature();
        jws.setPayload(claims.toJson());
        jws.setKey(key);
        jws.setAlgorithmHeaderValue(AlgorithmIdentifiers.HMAC_SHA256);
        try {
            return new IssuedToken(jws.getCompactSerialization(), expiresAt, ttl.toSeconds());
        } catch (JoseException e) {
            throw new IllegalStateException("Cannot sign access token", e);
        }
    }

    /** @throws InvalidTokenException on a bad signature, a wrong issuer or audience, or an expired token */
    public AuthenticatedUser verify(String token) {
        JwtConsumer consumer = new JwtConsumerBuilder()
                .setRequireExpirationTime()
                .setRequireSubject()
                .setExpectedIssuer(issuer)
                .setExpectedAudience(audience)
                .setVerificationKey(key)
                .setJwsAlgorithmConstraints(AlgorithmConstraints.ConstraintType.PERMIT, AlgorithmIdentifiers.HMAC_SHA256)
                .setEvaluationTime(NumericDate.fromMilliseconds(clock.millis()))
                .setAllowedClockSkewInSeconds((int) clockSkew.toSeconds())
                .build();
        try {
            JwtClaims claims = consumer.processToClaims(token);
            return new AuthenticatedUser(claims.getSubject(), claims.getStringClaimValue(ROLE_CLAIM));
        } catch (InvalidJwtException | MalformedClaimException e) {
            throw new InvalidTokenException("Invalid access token", e);
        }
    }
}

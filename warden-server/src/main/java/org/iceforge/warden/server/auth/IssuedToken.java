package org.iceforge.warden.server.auth;

import java.time.Instant;

public record IssuedToken(String token, Instant expiresAt, long expiresInSeconds) {}

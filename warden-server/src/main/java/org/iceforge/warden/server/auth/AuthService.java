package org.iceforge.warden.server.auth;

import org.iceforge.warden.permission.AuthorizationStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.web.server.ResponseStatusException;

import java.util.Objects;
import java.util.Optional;

/**
 * Username and password login, plus resolution of bearer tokens back to an active account.
 * <p>
 * Failures never say whether the user exists. Unknown users still pay for one hash comparison.
 */
public class AuthService {
    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    public static final String BEARER_PREFIX = "Bearer ";

    private final UserAccountStore accounts;
    private final PasswordEncoder passwords;
    private final TokenService tokens;
    private final String dummyHash;

    public AuthService(UserAccountStore accounts, PasswordEncoder passwords, TokenService tokens) {
        this.accounts = Objects.requireNonNull(accounts, "accounts");
        this.passwords = Objects.requireNonNull(passwords, "passwords");
        this.tokens = Objects.requireNonNull(tokens, "tokens");
        this.dummyHash = passwords.encode("warden-unknown-user");
    }

    public LoginResult login(String username, String password) {
        if (username == null || username.isBlank() || password == null || password.isEmpty()) {
            throw new UnauthorizedException("username and password are required");
        }
        String userId = username.trim();
        Optional<UserAccount> found = account(userId);
        if (found.isEmpty() || found.get().passwordHash() == null) {
            passwords.matches(password, dummyHash);
            log.info("Login failed for user={}: unknown or without password", userId);
            throw new UnauthorizedException("Incorrect username or password");
        }
        UserAccount account = found.get();
        if (!passwords.matches(password, account.passwordHash())) {
            log.info("Login failed for user={}: wrong password", userId);
            throw new UnauthorizedException("Incorrect username or password");
        }
        if (!account.active()) {
            log.info("Login refused for inactive user={}", userId);
            throw new UnauthorizedException("Incorrect username or password");
        }
        IssuedToken token = tokens.issue(account.userId(), account.role());
        log.info("User {} logged in; token valid until {}", account.userId(), token.expiresAt());
        return new LoginResult(new AuthenticatedUser(account.userId(), account.role()), token);
    }

    /**
     * Resolves an {@code Authorization} header value to the caller. The account is re-read so deactivation and role
     * changes apply before the token expires.
     */
    public AuthenticatedUser authenticate(String authorization) {
        if (authorization == null
                || !authorization.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            throw new UnauthorizedException("missing bearer token");
        }
        String token = authorization.substring(BEARER_PREFIX.length()).trim();
        if (token.isEmpty()) {
            throw new UnauthorizedException("missing bearer token");
        }
        AuthenticatedUser claimed;
        try {
            claimed = tokens.verify(token);
        } catch (InvalidTokenException e) {
            log.debug("Rejected bearer token: {}", e.getCause() == null ? e.getMessage() : e.getCause().getMessage());
            throw new UnauthorizedException("Could not validate credentials");
        }
        UserAccount account = account(claimed.userId()).orElse(null);
        if (account == null || !account.active()) {
            log.info("Token of unknown or inactive user={} rejected", claimed.userId());
            throw new UnauthorizedException("Could not validate credentials");
        }
        return new AuthenticatedUser(account.userId(), account.role());
    }

    private Optional<UserAccount> account(String userId) {
        try {
            return accounts.find(userId);
        } catch (AuthorizationStoreException e) {
            log.warn("User store unavailable while authenticating user={}: {}", userId, e.getMessage());
            throw new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE, "user store unavailable", e);
        }
    }

    public record LoginResult(AuthenticatedUser user, IssuedToken token) {}
}

package org.iceforge.warden.server.api;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/** Guards operator endpoints: token when configured, otherwise localhost only. */
final class AdminAccess {
    static final String TOKEN_HEADER = "X-Warden-Admin-Token";

    private AdminAccess() {}

    static void check(HttpServletRequest req, String configuredToken, String presentedToken) {
        if (configuredToken != null && !configuredToken.isBlank()) {
            if (presentedToken == null || !tokensMatch(configuredToken, presentedToken)) {
                throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, "missing/invalid admin token");
            }
            return;
        }
        String addr = req.getRemoteAddr();
        boolean local = "127.0.0.1".equals(addr) || "0:0:0:0:0:0:0:1".equals(addr) || "::1".equals(addr);
        if (!local) {
            throw new ResponseStatusException(HttpStatus.FORBIDDEN, "cache administration is localhost-only");
        }
    }

    /** Constant-time, so response timing does not reveal how much of the token matched. */
    static boolean tokensMatch(String configured, String presented) {
        return MessageDigest.isEqual(configured.getBytes(StandardCharsets.UTF_8),
                presented.getBytes(StandardCharsets.UTF_8));
    }
}

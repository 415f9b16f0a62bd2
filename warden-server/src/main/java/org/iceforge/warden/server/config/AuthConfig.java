package org.iceforge.warden.server.config;

import org.iceforge.warden.server.auth.AuthService;
import org.iceforge.warden.server.auth.JdbcUserAccountStore;
import org.iceforge.warden.server.auth.TokenService;
import org.iceforge.warden.server.auth.UserAccountStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

import javax.sql.DataSource;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.time.Clock;

@Configuration
public class AuthConfig {
    private static final Logger log = LoggerFactory.getLogger(AuthConfig.class);

    @Bean
    public PasswordEncoder passwordEncoder() {
        return new BCryptPasswordEncoder();
    }

    @Bean
    public TokenService tokenService(WardenProperties props) {
        WardenProperties.Auth auth = props.getAuth();
        return new TokenService(signingSecret(auth), auth.getIssuer(), auth.getAudience(), auth.getTokenTtl(),
                auth.getClockSkew(), Clock.systemUTC());
    }

    @Bean
    public UserAccountStore userAccountStore(@Qualifier("wardenAdminDataSource") DataSource admin) {
        return new JdbcUserAccountStore(admin);
    }

    @Bean
    public AuthService authService(UserAccountStore accounts, PasswordEncoder passwordEncoder, TokenService tokens) {
        return new AuthService(accounts, passwordEncoder, tokens);
    }

    static byte[] signingSecret(WardenProperties.Auth auth) {
        String secret = auth.getSecret();
        if (secret == null || secret.isBlank()) {
            log.warn("warden.auth.secret is not set; using a random signing secret. Tokens will not survive a restart "
                    + "and are not shared between instances");
            byte[] random = new byte[TokenService.MIN_SECRET_BYTES];
            new SecureRandom().nextBytes(random);
            return random;
        }
        byte[] bytes = secret.getBytes(StandardCharsets.UTF_8);
        if (bytes.length < TokenService.MIN_SECRET_BYTES) {
            throw new IllegalStateException("warden.auth.secret must be at least " + TokenService.MIN_SECRET_BYTES
                    + " bytes");
        }
        return bytes;
    }
}

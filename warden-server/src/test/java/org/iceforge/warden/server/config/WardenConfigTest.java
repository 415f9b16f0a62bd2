package org.iceforge.warden.server.config;

import org.iceforge.warden.cache.CacheSettings;
import org.iceforge.warden.cache.CacheTier;
import org.iceforge.warden.exec.ExecutorSettings;
import org.iceforge.warden.pipeline.PipelineSettings;
import org.iceforge.warden.ratelimit.RateLimitSettings;
import org.iceforge.warden.server.auth.TokenService;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.*;

class WardenConfigTest {

    @Test
    void defaultPropertiesMatchCoreDefaults() {
        WardenProperties props = new WardenProperties();

        assertEquals(ExecutorSettings.defaults(), WardenConfig.executorSettings(props));
        assertEquals(CacheSettings.defaults(), WardenConfig.cacheSettings(props));
        assertEquals(RateLimitSettings.defaults(), WardenConfig.rateLimitSettings(props));
        assertEquals(PipelineSettings.defaults(), WardenConfig.pipelineSettings(props));
    }

    @Test
    void overridesFlowIntoCoreSettings() {
        WardenProperties props = new WardenProperties();
        props.getDatasource().setPoolSize(5);
        props.getDatasource().setMaxOverflow(0);
        props.getCache().setKeyPrefix("tenant-a:");
        props.getCache().setPermissionTtl(Duration.ofMinutes(1));
        props.getRateLimit().setRequestsPerWindow(10);
        props.getRateLimit().setWindow(Duration.ofMinutes(1));
        props.getExecution().setMaxRows(50);

        assertEquals(5, WardenConfig.executorSettings(props).maximumPoolSize());
        CacheSettings cache = WardenConfig.cacheSettings(props);
        assertEquals("tenant-a:", cache.keyPrefix());
        assertEquals(Duration.ofMinutes(1), cache.ttl(CacheTier.PERMISSION));
        RateLimitSettings rl = WardenConfig.rateLimitSettings(props);
        assertEquals(10, rl.requestsPerWindow());
        assertEquals("tenant-a:", rl.keyPrefix());
        assertEquals(50, WardenConfig.pipelineSettings(props).effectiveRowLimit(500));
    }

    @Test
    void missingJdbcUrlFailsFast() {
        assertThatThrownBy(() -> new WardenConfig().wardenQueryDataSource(new WardenProperties()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("warden.datasource.jdbc-url");
    }

    @Test
    void blankAuthSecretIsReplacedByARandomOne() {
        WardenProperties.Auth auth = new WardenProperties.Auth();

        byte[] first = AuthConfig.signingSecret(auth);
        byte[] second = AuthConfig.signingSecret(auth);

        assertEquals(TokenService.MIN_SECRET_BYTES, first.length);
        assertFalse(Arrays.equals(first, second));
    }

    @Test
    void shortAuthSecretFailsFast() {
        WardenProperties.Auth auth = new WardenProperties.Auth();
        auth.setSecret("short");

        assertThatThrownBy(() -> AuthConfig.signingSecret(auth))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("warden.auth.secret");
    }
}

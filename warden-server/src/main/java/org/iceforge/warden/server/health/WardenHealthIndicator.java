package org.iceforge.warden.server.health;

import org.iceforge.warden.cache.CacheManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;

/**
 * DOWN when the target database does not answer. An unreachable cache store only degrades the service, so it is
 * reported as a detail and leaves the status UP.
 */
@Component("warden")
public class WardenHealthIndicator implements HealthIndicator {
    private static final Logger log = LoggerFactory.getLogger(WardenHealthIndicator.class);

    static final int VALIDATION_TIMEOUT_SECONDS = 2;

    private final DataSource queryDataSource;
    private final CacheManager cache;

    public WardenHealthIndicator(@Qualifier("wardenQueryDataSource") DataSource queryDataSource, CacheManager cache) {
        this.queryDataSource = Objects.requireNonNull(queryDataSource);
        this.cache = Objects.requireNonNull(cache);
    }

    @Override
    public Health health() {
        boolean cacheUp = cache.storeReachable();
        try (Connection c = queryDataSource.getConnection()) {
            boolean valid = c.isValid(VALIDATION_TIMEOUT_SECONDS);
            Health.Builder b = valid ? Health.up() : Health.down();
            return b.withDetail("database", valid ? "up" : "down")
                    .withDetail("cache", cacheUp ? "up" : "degraded")
                    .build();
        } catch (SQLException e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return Health.down(e)
                    .withDetail("database", "down")
                    .withDetail("cache", cacheUp ? "up" : "degraded")
                    .build();
        }
    }
}

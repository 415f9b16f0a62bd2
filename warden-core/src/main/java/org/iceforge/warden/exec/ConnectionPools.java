package org.iceforge.warden.exec;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

import java.util.Objects;

/** HikariCP pool sized from {@link ExecutorSettings}. Connections are marked read-only. */
public final class ConnectionPools {
    private ConnectionPools() {
    }

    public static HikariDataSource create(String jdbcUrl, String username, String password, ExecutorSettings settings) {
        Objects.requireNonNull(jdbcUrl, "jdbcUrl");
        ExecutorSettings s = settings == null ? ExecutorSettings.defaults() : settings;

        HikariConfig cfg = new HikariConfig();
        cfg.setPoolName("warden-pool");
        cfg.setJdbcUrl(jdbcUrl);
        if (username != null) cfg.setUsername(username);
        if (password != null) cfg.setPassword(password);
        cfg.setMinimumIdle(s.poolSize());
        cfg.setMaximumPoolSize(s.maximumPoolSize());
        cfg.setConnectionTimeout(Math.max(250, s.poolTimeout().toMillis()));
        cfg.setReadOnly(true);
        cfg.setAutoCommit(true);
        return new HikariDataSource(cfg);
    }
}

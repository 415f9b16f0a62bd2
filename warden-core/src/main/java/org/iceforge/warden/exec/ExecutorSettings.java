package org.iceforge.warden.exec;

import java.time.Duration;

/**
 * @param poolSize     connections kept open
 * @param maxOverflow  extra connections opened under load
 * @param poolTimeout  how long a caller waits for a connection before failing
 * @param cancelGrace  how long to wait for a cancelled statement to stop before giving up on it
 */
public record ExecutorSettings(int poolSize, int maxOverflow, Duration poolTimeout, Duration cancelGrace) {

    public ExecutorSettings {
        if (poolSize <= 0) poolSize = 20;
        if (maxOverflow < 0) maxOverflow = 40;
        poolTimeout = positiveOr(poolTimeout, Duration.ofSeconds(30));
        cancelGrace = positiveOr(cancelGrace, Duration.ofSeconds(5));
    }

    public static ExecutorSettings defaults() {
        return new ExecutorSettings(20, 40, Duration.ofSeconds(30), Duration.ofSeconds(5));
    }

    public int maximumPoolSize() {
        return poolSize + maxOverflow;
    }

    private static Duration positiveOr(Duration d, Duration fallback) {
        return (d == null || d.isZero() || d.isNegative()) ? fallback : d;
    }
}

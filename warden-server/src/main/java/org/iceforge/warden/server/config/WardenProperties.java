package org.iceforge.warden.server.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Server configuration under {@code warden.*}.
 * <p>
 * Defaults match the core settings records, so an empty configuration behaves like the library defaults.
 */
@ConfigurationProperties(prefix = "warden")
public class WardenProperties {

    private Datasource datasource = new Datasource();
    private Execution execution = new Execution();
    private Cache cache = new Cache();
    private RateLimit rateLimit = new RateLimit();
    private Audit audit = new Audit();
    private Auth auth = new Auth();

    /**
     * Token required in header X-Warden-Admin-Token for the cache administration endpoints.
     * If blank, those endpoints are only reachable from localhost.
     */
    private String adminToken;

    public Datasource getDatasource() { return datasource; }
    public void setDatasource(Datasource datasource) { this.datasource = datasource; }

    public Execution getExecution() { return execution; }
    public void setExecution(Execution execution) { this.execution = execution; }

    public Cache getCache() { return cache; }
    public void setCache(Cache cache) { this.cache = cache; }

    public RateLimit getRateLimit() { return rateLimit; }
    public void setRateLimit(RateLimit rateLimit) { this.rateLimit = rateLimit; }

    public Audit getAudit() { return audit; }
    public void setAudit(Audit audit) { this.audit = audit; }

    public Auth getAuth() { return auth; }
    public void setAuth(Auth auth) { this.auth = auth; }

    public String getAdminToken() { return adminToken; }
    public void setAdminToken(String adminToken) { this.adminToken = adminToken; }

    /** Target database. Queries run on a read-only pool; grants, schema lookups and history use a small admin pool. */
    public static class Datasource {
        private String jdbcUrl;
        private String username;
        private String password;
        private int poolSize = 20;
        private int maxOverflow = 40;
        private Duration poolTimeout = Duration.ofSeconds(30);
        private int adminPoolSize = 4;

        public String getJdbcUrl() { return jdbcUrl; }
        public void setJdbcUrl(String jdbcUrl) { this.jdbcUrl = jdbcUrl; }

        public String getUsername() { return username; }
        public void setUsername(String username) { this.username = username; }

        public String getPassword() { return password; }
        public void setPassword(String password) { this.password = password; }

        public int getPoolSize() { return poolSize; }
        public void setPoolSize(int poolSize) { this.poolSize = poolSize; }

        public int getMaxOverflow() { return maxOverflow; }
        public void setMaxOverflow(int maxOverflow) { this.maxOverflow = maxOverflow; }

        public Duration getPoolTimeout() { return poolTimeout; }
        public void setPoolTimeout(Duration poolTimeout) { this.poolTimeout = poolTimeout; }

        public int getAdminPoolSize() { return adminPoolSize; }
        public void setAdminPoolSize(int adminPoolSize) { this.adminPoolSize = adminPoolSize; }
    }

    public static class Execution {
        private Duration timeout = Duration.ofSeconds(30);
        private int maxRows = 1000;
        private Duration requestDeadline = Duration.ofSeconds(35);
        private Duration cancelGrace = Duration.ofSeconds(5);
        private String defaultSchema = "public";

        /** Waiting requests beyond the worker threads; more are answered with server_error. */
        private int queueCapacity = 200;

        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }

        public int getMaxRows() { return maxRows; }
        public void setMaxRows(int maxRows) { this.maxRows = maxRows; }

        public Duration getRequestDeadline() { return requestDeadline; }
        public void setRequestDeadline(Duration requestDeadline) { this.requestDeadline = requestDeadline; }

        public Duration getCancelGrace() { return cancelGrace; }
        public void setCancelGrace(Duration cancelGrace) { this.cancelGrace = cancelGrace; }

        public String getDefaultSchema() { return defaultSchema; }
        public void setDefaultSchema(String defaultSchema) { this.defaultSchema = defaultSchema; }

        public int getQueueCapacity() { return queueCapacity; }
        public void setQueueCapacity(int queueCapacity) { this.queueCapacity = queueCapacity; }
    }

    public static class Cache {
        /**
         * Backing store for every cache tier and the rate-limit counters.
         * <p>
         * - "memory" (default): process-local map, fine for a single instance
         * - "redis": shared store configured through spring.data.redis.*
         */
        private String store = "memory";
        private String keyPrefix = "warden:";
        private Duration queryTtl = Duration.ofMinutes(5);
        private Duration permissionTtl = Duration.ofMinutes(15);
        private Duration schemaTtl = Duration.ofHours(1);

        /** Entry ceiling of the in-memory store. */
        private int maxEntries = 10_000;

        /** How often the in-memory store drops expired entries. */
        private Duration sweepInterval = Duration.ofMinutes(1);

        public String getStore() { return store; }
        public void setStore(String store) { this.store = store; }

        public String getKeyPrefix() { return keyPrefix; }
        public void setKeyPrefix(String keyPrefix) { this.keyPrefix = keyPrefix; }

        public Duration getQueryTtl() { return queryTtl; }
        public void setQueryTtl(Duration queryTtl) { this.queryTtl = queryTtl; }

        public Duration getPermissionTtl() { return permissionTtl; }
        public void setPermissionTtl(Duration permissionTtl) { this.permissionTtl = permissionTtl; }

        public Duration getSchemaTtl() { return schemaTtl; }
        public void setSchemaTtl(Duration schemaTtl) { this.schemaTtl = schemaTtl; }

        public int getMaxEntries() { return maxEntries; }
        public void setMaxEntries(int maxEntries) { this.maxEntries = maxEntries; }

        public Duration getSweepInterval() { return sweepInterval; }
        public void setSweepInterval(Duration sweepInterval) { this.sweepInterval = sweepInterval; }
    }

    public static class RateLimit {
        private boolean enabled = true;
        private int requestsPerWindow = 100;
        private Duration window = Duration.ofHours(1);

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public int getRequestsPerWindow() { return requestsPerWindow; }
        public void setRequestsPerWindow(int requestsPerWindow) { this.requestsPerWindow = requestsPerWindow; }

        public Duration getWindow() { return window; }
        public void setWindow(Duration window) { this.window = window; }
    }

    public static class Audit {
        /** Persist one row per request into query_history. */
        private boolean historyEnabled = true;

        /** Create query_history on startup when missing. */
        private boolean createTable = true;

        /** Records waiting to be written; further records are dropped with a warning. */
        private int queueCapacity = 1000;

        public boolean isHistoryEnabled() { return historyEnabled; }
        public void setHistoryEnabled(boolean historyEnabled) { this.historyEnabled = historyEnabled; }

        public boolean isCreateTable() { return createTable; }
        public void setCreateTable(boolean createTable) { this.createTable = createTable; }

        public int getQueueCapacity() { return queueCapacity; }
        public void setQueueCapacity(int queueCapacity) { this.queueCapacity = queueCapacity; }
    }

    /** Bearer tokens issued by POST /api/auth/login and required by every query endpoint. */
    public static class Auth {
        /**
         * HMAC-SHA256 signing secret, at least 32 bytes. If blank, a random secret is generated at startup and
         * tokens do not survive a restart.
         */
        private String secret;
        private String issuer = "warden";
        private String audience = "warden-api";
        private Duration tokenTtl = Duration.ofMinutes(30);
        private Duration clockSkew = Duration.ofSeconds(30);

        public String getSecret() { return secret; }
        public void setSecret(String secret) { this.secret = secret; }

        public String getIssuer() { return issuer; }
        public void setIssuer(String issuer) { this.issuer = issuer; }

        public String getAudience() { return audience; }
        public void setAudience(String audience) { this.audience = audience; }

        public Duration getTokenTtl() { return tokenTtl; }
        public void setTokenTtl(Duration tokenTtl) { this.tokenTtl = tokenTtl; }

        public Duration getClockSkew() { return clockSkew; }
        public void setClockSkew(Duration clockSkew) { this.clockSkew = clockSkew; }
    }
}

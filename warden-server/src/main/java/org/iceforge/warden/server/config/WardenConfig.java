package org.iceforge.warden.server.config;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.iceforge.warden.audit.AuditSink;
import org.iceforge.warden.audit.LoggingAuditSink;
import org.iceforge.warden.cache.CacheManager;
import org.iceforge.warden.cache.CacheSettings;
import org.iceforge.warden.cache.CacheStore;
import org.iceforge.warden.cache.InMemoryCacheStore;
import org.iceforge.warden.exec.ConnectionPools;
import org.iceforge.warden.exec.ExecutorSettings;
import org.iceforge.warden.exec.JdbcSqlExecutor;
import org.iceforge.warden.permission.AuthorizationStore;
import org.iceforge.warden.permission.JdbcAuthorizationStore;
import org.iceforge.warden.permission.PermissionEngine;
import org.iceforge.warden.pipeline.PipelineSettings;
import org.iceforge.warden.pipeline.QueryPipeline;
import org.iceforge.warden.ratelimit.RateLimitSettings;
import org.iceforge.warden.ratelimit.RateLimiter;
import org.iceforge.warden.schema.JdbcSchemaMetadataSource;
import org.iceforge.warden.schema.SchemaCatalog;
import org.iceforge.warden.validation.SqlValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import javax.sql.DataSource;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class WardenConfig {
    private static final Logger log = LoggerFactory.getLogger(WardenConfig.class);

    @Bean(destroyMethod = "close")
    @Primary
    public HikariDataSource wardenQueryDataSource(WardenProperties props) {
        WardenProperties.Datasource ds = props.getDatasource();
        ExecutorSettings settings = executorSettings(props);
        log.info("Query pool: {} connections + {} overflow, wait timeout {}", settings.poolSize(),
                settings.maxOverflow(), settings.poolTimeout());
        return ConnectionPools.create(requireUrl(ds), ds.getUsername(), ds.getPassword(), settings);
    }

    @Bean(destroyMethod = "close")
    public HikariDataSource wardenAdminDataSource(WardenProperties props) {
        WardenProperties.Datasource ds = props.getDatasource();
        HikariConfig cfg = new HikariConfig();
        cfg.setPoolName("warden-admin");
        cfg.setJdbcUrl(requireUrl(ds));
        if (ds.getUsername() != null) cfg.setUsername(ds.getUsername());
        if (ds.getPassword() != null) cfg.setPassword(ds.getPassword());
        cfg.setMaximumPoolSize(Math.max(1, ds.getAdminPoolSize()));
        cfg.setMinimumIdle(1);
        cfg.setConnectionTimeout(Math.max(250, ds.getPoolTimeout().toMillis()));
        return new HikariDataSource(cfg);
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnProperty(prefix = "warden.cache", name = "store", havingValue = "memory", matchIfMissing = true)
    public InMemoryCacheStore inMemoryCacheStore(WardenProperties props) {
        WardenProperties.Cache c = props.getCache();
        InMemoryCacheStore store = new InMemoryCacheStore(Clock.systemUTC(), c.getMaxEntries());
        store.startSweeper(c.getSweepInterval());
        log.info("Using in-memory cache store (max {} entries)", c.getMaxEntries());
        return store;
    }

    @Bean
    public CacheManager wardenCacheManager(CacheStore store, WardenProperties props) {
        return new CacheManager(store, cacheSettings(props));
    }

    @Bean
    public RateLimiter rateLimiter(CacheStore store, WardenProperties props) {
        return new RateLimiter(store, rateLimitSettings(props));
    }

    @Bean
    public SqlValidator sqlValidator() {
        return new SqlValidator();
    }

    @Bean
    public AuthorizationStore authorizationStore(@Qualifier("wardenAdminDataSource") DataSource admin) {
        return new JdbcAuthorizationStore(admin);
    }

    @Bean
    public SchemaCatalog schemaCatalog(@Qualifier("wardenAdminDataSource") DataSource admin, CacheManager cache) {
        return new SchemaCatalog(new JdbcSchemaMetadataSource(admin), cache);
    }

    @Bean
    public PermissionEngine permissionEngine(AuthorizationStore store, CacheManager cache, SchemaCatalog schemas,
                                             WardenProperties props) {
        return new PermissionEngine(store, cache, schemas, props.getExecution().getDefaultSchema());
    }

    @Bean(destroyMethod = "close")
    public JdbcSqlExecutor sqlExecutor(@Qualifier("wardenQueryDataSource") DataSource pool, WardenProperties props) {
        return new JdbcSqlExecutor(pool, props.getExecution().getCancelGrace());
    }

    @Bean
    public LoggingAuditSink loggingAuditSink() {
        return new LoggingAuditSink();
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService wardenRequestExecutor(WardenProperties props) {
        // one worker per connection the pool can hand out
        int threads = Math.max(1, executorSettings(props).maximumPoolSize());
        AtomicInteger n = new AtomicInteger();
        return new ThreadPoolExecutor(threads, threads, 60, TimeUnit.SECONDS,
                new ArrayBlockingQueue<>(Math.max(1, props.getExecution().getQueueCapacity())),
                r -> {
                    Thread t = new Thread(r, "warden-request-" + n.incrementAndGet());
                    t.setDaemon(true);
                    return t;
                },
                new ThreadPoolExecutor.AbortPolicy());
    }

    @Bean
    public QueryPipeline queryPipeline(RateLimiter rateLimiter,
                                       SqlValidator validator,
                                       PermissionEngine permissions,
                                       CacheManager cache,
                                       JdbcSqlExecutor executor,
                                       List<AuditSink> auditSinks,
                                       @Qualifier("wardenRequestExecutor") ExecutorService requestExecutor,
                                       WardenProperties props) {
        log.info("Query pipeline ready: {} audit sink(s), max {} rows, timeout {}", auditSinks.size(),
                props.getExecution().getMaxRows(), props.getExecution().getTimeout());
        return new QueryPipeline(rateLimiter, validator, permissions, cache, executor, AuditSink.fanOut(auditSinks),
                pipelineSettings(props), Clock.systemUTC(), requestExecutor);
    }

    static ExecutorSettings executorSettings(WardenProperties props) {
        WardenProperties.Datasource ds = props.getDatasource();
        return new ExecutorSettings(ds.getPoolSize(), ds.getMaxOverflow(), ds.getPoolTimeout(),
                props.getExecution().getCancelGrace());
    }

    static CacheSettings cacheSettings(WardenProperties props) {
        WardenProperties.Cache c = props.getCache();
        return new CacheSettings(c.getKeyPrefix(), c.getQueryTtl(), c.getPermissionTtl(), c.getSchemaTtl());
    }

    static RateLimitSettings rateLimitSettings(WardenProperties props) {
        WardenProperties.RateLimit r = props.getRateLimit();
        return new RateLimitSettings(r.isEnabled(), r.getRequestsPerWindow(), r.getWindow(),
                props.getCache().getKeyPrefix());
    }

    static PipelineSettings pipelineSettings(WardenProperties props) {
        WardenProperties.Execution e = props.getExecution();
        return new PipelineSettings(e.getMaxRows(), e.getTimeout(), e.getRequestDeadline());
    }

    private static String requireUrl(WardenProperties.Datasource ds) {
        if (ds.getJdbcUrl() == null || ds.getJdbcUrl().isBlank()) {
            throw new IllegalStateException("warden.datasource.jdbc-url must be set");
        }
        return ds.getJdbcUrl();
    }
}

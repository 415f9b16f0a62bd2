package org.iceforge.warden.pipeline;

import org.iceforge.warden.audit.AuditRecord;
import org.iceforge.warden.audit.AuditSink;
import org.iceforge.warden.cache.CacheKeys;
import org.iceforge.warden.cache.CacheManager;
import org.iceforge.warden.cache.CacheTier;
import org.iceforge.warden.error.ErrorKind;
import org.iceforge.warden.error.ErrorRecord;
import org.iceforge.warden.error.QueryExecutionException;
import org.iceforge.warden.error.QueryPipelineException;
import org.iceforge.warden.exec.ExecutionRequest;
import org.iceforge.warden.exec.ExecutionResult;
import org.iceforge.warden.exec.SqlExecutor;
import org.iceforge.warden.permission.AuthorizedQuery;
import org.iceforge.warden.permission.PermissionEngine;
import org.iceforge.warden.ratelimit.RateLimiter;
import org.iceforge.warden.sql.ComplexityScore;
import org.iceforge.warden.validation.SqlValidator;
import org.iceforge.warden.validation.ValidatedQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs one request through rate limit, validation, authorization, query cache and execution, strictly in that order.
 *
 * <p>{@link #handle} never throws: every stage failure short-circuits to a terminal state and comes back as a failed
 * {@link QueryResponse}. One audit record is emitted per request whatever the outcome.
 *
 * <p>The pipeline keeps no per-request state in fields, so one instance serves any number of concurrent callers.
 */
public class QueryPipeline {
    private static final Logger log = LoggerFactory.getLogger(QueryPipeline.class);

    private final RateLimiter rateLimiter;
    private final SqlValidator validator;
    private final PermissionEngine permissions;
    private final CacheManager cache;
    private final SqlExecutor executor;
    private final AuditSink audit;
    private final PipelineSettings settings;
    private final Clock clock;
    private final ExecutorService requestExecutor;

    public QueryPipeline(RateLimiter rateLimiter,
                         SqlValidator validator,
                         PermissionEngine permissions,
                         CacheManager cache,
                         SqlExecutor executor,
                         AuditSink audit,
                         PipelineSettings settings,
                         Clock clock,
                         ExecutorService requestExecutor) {
        this.rateLimiter = Objects.requireNonNull(rateLimiter, "rateLimiter");
        this.validator = Objects.requireNonNull(validator, "validator");
        this.permissions = Objects.requireNonNull(permissions, "permissions");
        this.cache = Objects.requireNonNull(cache, "cache");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.audit = audit == null ? r -> { } : audit;
        this.settings = settings == null ? PipelineSettings.defaults() : settings;
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.requestExecutor = requestExecutor;
    }

    /**
     * Handles the request on a worker of the request pool. The future always completes normally; a full pool yields
     * a {@code server_error} response.
     */
    public CompletableFuture<QueryResponse> submit(QueryRequest request) {
        if (requestExecutor == null) {
            return CompletableFuture.completedFuture(handle(request));
        }
        try {
            return CompletableFuture.supplyAsync(() -> handle(request), requestExecutor);
        } catch (RejectedExecutionException e) {
            log.warn("Request pool saturated; rejecting request of user={}", request.userId());
            QueryPipelineException busy = QueryExecutionException.serverError("Server is busy, try again later", e);
            Run run = new Run(request, clock.instant());
            return CompletableFuture.completedFuture(finish(run, PipelineState.FAILED, busy));
        }
    }

    public QueryResponse handle(QueryRequest request) {
        Objects.requireNonNull(request, "request");
        Run run = new Run(request, clock.instant());
        try {
            return proceed(run);
        } catch (QueryPipelineException e) {
            PipelineState terminal = switch (e.kind()) {
                case RATE_LIMIT, VALIDATION_ERROR, PERMISSION_DENIED -> PipelineState.REJECTED;
                case TIMEOUT, SQL_ERROR, SERVER_ERROR -> PipelineState.FAILED;
            };
            return finish(run, terminal, e);
        } catch (RuntimeException e) {
            log.error("Unexpected failure in state {} for user={}", run.state, request.userId(), e);
            return finish(run, PipelineState.FAILED,
                    QueryExecutionException.serverError("Internal error while processing the query", e));
        }
    }

    public PipelineSettings settings() {
        return settings;
    }

    private QueryResponse proceed(Run run) {
        QueryRequest request = run.request;
        String user = request.userId();

        rateLimiter.check(user);

        ValidatedQuery validated = validator.validate(request.rawSql());
        run.advance(PipelineState.VALIDATED);
        run.sql = validated.normalizedSql();

        AuthorizedQuery authorized = permissions.authorize(validated.normalizedSql(), user);
        run.advance(PipelineState.AUTHORIZED);
        run.sql = authorized.rewrittenSql();

        int rowLimit = settings.effectiveRowLimit(request.requestedRowLimit());
        String cacheKey = CacheKeys.query(authorized.rewrittenSql(), request.bindParameters(), user, rowLimit);
        Optional<ExecutionResult> hit = cache.get(CacheTier.QUERY, cacheKey, ExecutionResult.class);
        run.advance(PipelineState.CACHE_CHECKED);
        if (hit.isPresent()) {
            run.advance(PipelineState.CACHE_HIT);
            ExecutionResult result = hit.get().asCached(run.elapsedMs(clock));
            return complete(run, result, validated.complexity(), validated.warnings());
        }

        Duration remaining = run.remaining(clock, settings.requestDeadline());
        if (remaining.isZero() || remaining.isNegative()) {
            throw QueryExecutionException.timeout("Request deadline of " + settings.requestDeadline().toSeconds()
                    + "s elapsed before execution");
        }
        Duration timeout = remaining.compareTo(settings.executionTimeout()) < 0 ? remaining : settings.executionTimeout();

        run.advance(PipelineState.EXECUTING);
        ExecutionResult result = executor.execute(
                new ExecutionRequest(authorized.rewrittenSql(), request.bindParameters(), rowLimit, timeout));
        cache.put(CacheTier.QUERY, cacheKey, result);
        return complete(run, result, validated.complexity(), validated.warnings());
    }

    private QueryResponse complete(Run run, ExecutionResult result, ComplexityScore complexity, List<String> warnings) {
        run.advance(PipelineState.COMPLETED);
        QueryResponse response = QueryResponse.success(result, run.sql, complexity, warnings);
        emit(new AuditRecord(run.request.userId(), run.request.question(), run.sql, QueryStatus.SUCCESS,
                PipelineState.COMPLETED, null, null, result.rowCount(), result.executionTimeMs(), result.cached(),
                clock.instant()));
        log.debug("Completed user={} rows={} cached={} truncated={}", run.request.userId(), result.rowCount(),
                result.cached(), result.truncated());
        return response;
    }

    private QueryResponse finish(Run run, PipelineState terminal, QueryPipelineException e) {
        PipelineState failedIn = run.state;
        run.state = terminal;
        long elapsed = run.elapsedMs(clock);
        ErrorRecord error = ErrorRecord.from(e);
        if (e.kind() == ErrorKind.SERVER_ERROR) {
            log.warn("Request of user={} failed after {}: {}", run.request.userId(), failedIn, e.getMessage());
        } else {
            log.debug("Request of user={} ended {} after {}: {}", run.request.userId(), terminal, failedIn,
                    e.getMessage());
        }
        String sql = run.sql != null ? run.sql : run.request.rawSql();
        emit(new AuditRecord(run.request.userId(), run.request.question(), sql, QueryStatus.of(e.kind()), terminal,
                e.kind(), e.getMessage(), 0, elapsed, false, clock.instant()));
        return QueryResponse.failure(error, sql, elapsed);
    }

    private void emit(AuditRecord record) {
        try {
            audit.record(record);
        } catch (RuntimeException e) {
            log.warn("Audit sink failed for user={}: {}", record.userId(), e.toString());
        }
    }

    private static final class Run {
        final QueryRequest request;
        final Instant startedAt;
        PipelineState state = PipelineState.RECEIVED;
        String sql;

        Run(QueryRequest request, Instant startedAt) {
            this.request = request;
            this.startedAt = startedAt;
        }

        void advance(PipelineState next) {
            if (next.ordinal() <= state.ordinal() || state.terminal()) {
                throw new IllegalStateException("Illegal transition " + state + " -> " + next);
            }
            state = next;
        }

        long elapsedMs(Clock clock) {
            return Math.max(0, Duration.between(startedAt, clock.instant()).toMillis());
        }

        Duration remaining(Clock clock, Duration deadline) {
            return deadline.minus(Duration.between(startedAt, clock.instant()));
        }
    }
}

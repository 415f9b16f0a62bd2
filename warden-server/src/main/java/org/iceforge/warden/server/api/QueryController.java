package org.iceforge.warden.server.api;

import org.iceforge.warden.pipeline.QueryPipeline;
import org.iceforge.warden.pipeline.QueryRequest;
import org.iceforge.warden.pipeline.QueryResponse;
import org.iceforge.warden.ratelimit.RateLimitSettings;
import org.iceforge.warden.ratelimit.RateLimiter;
import org.iceforge.warden.server.auth.AuthService;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.Objects;

/**
 * Query submission. The caller is the subject of the bearer token issued by {@code POST /api/auth/login}.
 */
@RestController
@RequestMapping("/api/v1/queries")
public class QueryController {

    private final QueryPipeline pipeline;
    private final RateLimiter rateLimiter;
    private final AuthService auth;

    public QueryController(QueryPipeline pipeline, RateLimiter rateLimiter, AuthService auth) {
        this.pipeline = Objects.requireNonNull(pipeline);
        this.rateLimiter = Objects.requireNonNull(rateLimiter);
        this.auth = Objects.requireNonNull(auth);
    }

    @PostMapping
    public ResponseEntity<QueryResponse> submit(
            @RequestBody QueryApiModels.SubmitQueryRequest req,
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        String user = auth.authenticate(authorization).userId();
        if (req == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "request body is required");
        }
        QueryRequest request = new QueryRequest(req.sql(), user, req.parameters(), req.rowLimit(), req.question(),
                req.confidence());

        QueryResponse resp = pipeline.submit(request).join();

        ResponseEntity.BodyBuilder builder = ResponseEntity.status(httpStatus(resp));
        if (resp.error() != null && resp.error().retryAfterSeconds() != null) {
            builder.header(HttpHeaders.RETRY_AFTER, String.valueOf(resp.error().retryAfterSeconds()));
        }
        return builder.body(resp);
    }

    @GetMapping("/rate-limit")
    public QueryApiModels.RateLimitStatus rateLimit(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        String user = auth.authenticate(authorization).userId();
        RateLimitSettings s = rateLimiter.settings();
        return new QueryApiModels.RateLimitStatus(user, s.enabled(), s.requestsPerWindow(),
                rateLimiter.remaining(user), s.window().toSeconds());
    }

    static HttpStatus httpStatus(QueryResponse resp) {
        return switch (resp.status()) {
            case SUCCESS -> HttpStatus.OK;
            case VALIDATION_ERROR -> HttpStatus.BAD_REQUEST;
            case PERMISSION_DENIED -> HttpStatus.FORBIDDEN;
            case RATE_LIMIT -> HttpStatus.TOO_MANY_REQUESTS;
            case TIMEOUT -> HttpStatus.GATEWAY_TIMEOUT;
            case FAILED -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}

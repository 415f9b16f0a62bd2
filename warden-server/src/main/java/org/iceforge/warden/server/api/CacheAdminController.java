package org.iceforge.warden.server.api;

import jakarta.servlet.http.HttpServletRequest;
import org.iceforge.warden.cache.CacheManager;
import org.iceforge.warden.cache.CacheMetrics;
import org.iceforge.warden.cache.CacheTier;
import org.iceforge.warden.permission.PermissionEngine;
import org.iceforge.warden.schema.SchemaCatalog;
import org.iceforge.warden.server.config.WardenProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

@RestController
@RequestMapping("/api/cache")
public class CacheAdminController {
    private static final Logger log = LoggerFactory.getLogger(CacheAdminController.class);

    private final CacheManager cache;
    private final PermissionEngine permissions;
    private final SchemaCatalog schemas;
    private final WardenProperties props;

    public CacheAdminController(CacheManager cache, PermissionEngine permissions, SchemaCatalog schemas,
                                WardenProperties props) {
        this.cache = Objects.requireNonNull(cache);
        this.permissions = Objects.requireNonNull(permissions);
        this.schemas = Objects.requireNonNull(schemas);
        this.props = Objects.requireNonNull(props);
    }

    @GetMapping("/stats")
    public Map<String, Object> stats() {
        Map<String, Object> out = new LinkedHashMap<>();
        for (Map.Entry<CacheTier, CacheMetrics> e : cache.stats().entrySet()) {
            CacheMetrics m = e.getValue();
            out.put(e.getKey().name().toLowerCase(Locale.ROOT),
                    new QueryApiModels.TierStats(m.hits(), m.misses(), m.errors(), m.hitRatio()));
        }
        out.put("store", props.getCache().getStore());
        out.put("storeReachable", cache.storeReachable());
        return out;
    }

    @PostMapping("/invalidate/permissions/{userId}")
    public QueryApiModels.InvalidationResult invalidatePermissions(
            @PathVariable String userId,
            HttpServletRequest req,
            @RequestHeader(value = AdminAccess.TOKEN_HEADER, required = false) String token) {
        AdminAccess.check(req, props.getAdminToken(), token);
        long removed = requireReachable(permissions.invalidateUser(userId));
        log.info("Invalidated {} permission entries of user={}", removed, userId);
        return new QueryApiModels.InvalidationResult("permission", userId, removed);
    }

    @PostMapping("/invalidate/schema/{table}")
    public QueryApiModels.InvalidationResult invalidateSchema(
            @PathVariable String table,
            @RequestParam(value = "schema", required = false) String schema,
            HttpServletRequest req,
            @RequestHeader(value = AdminAccess.TOKEN_HEADER, required = false) String token) {
        AdminAccess.check(req, props.getAdminToken(), token);
        String s = (schema == null || schema.isBlank()) ? props.getExecution().getDefaultSchema() : schema;
        schemas.invalidate(s, table);
        log.info("Invalidated schema entry {}.{}", s, table);
        return new QueryApiModels.InvalidationResult("schema", s + "." + table, null);
    }

    @PostMapping("/invalidate/queries")
    public QueryApiModels.InvalidationResult invalidateQueries(
            HttpServletRequest req,
            @RequestHeader(value = AdminAccess.TOKEN_HEADER, required = false) String token) {
        AdminAccess.check(req, props.getAdminToken(), token);
        long removed = requireReachable(cache.invalidatePrefix(CacheTier.QUERY, ""));
        return new QueryApiModels.InvalidationResult("query", "*", removed);
    }

    private static long requireReachable(long removed) {
        if (removed < 0) {
            throw new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE, "cache store unreachable");
        }
        return removed;
    }
}

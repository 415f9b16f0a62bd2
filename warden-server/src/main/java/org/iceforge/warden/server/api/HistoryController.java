package org.iceforge.warden.server.api;

import org.iceforge.warden.server.audit.QueryHistoryEntry;
import org.iceforge.warden.server.audit.QueryHistoryRepository;
import org.iceforge.warden.server.auth.AuthService;
import org.iceforge.warden.server.auth.AuthenticatedUser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * The caller's own query history. Admins may read another user's through {@code ?userId=}.
 * Answers 404 when history recording is switched off.
 */
@RestController
@RequestMapping("/api/history")
public class HistoryController {
    private static final Logger log = LoggerFactory.getLogger(HistoryController.class);

    private final Optional<QueryHistoryRepository> history;
    private final AuthService auth;

    public HistoryController(Optional<QueryHistoryRepository> history, AuthService auth) {
        this.history = Objects.requireNonNull(history);
        this.auth = Objects.requireNonNull(auth);
    }

    @GetMapping
    public QueryApiModels.HistoryPage recent(
            @RequestParam(value = "limit", required = false) Integer limit,
            @RequestParam(value = "userId", required = false) String userId,
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        AuthenticatedUser caller = auth.authenticate(authorization);
        String target = (userId == null || userId.isBlank()) ? caller.userId() : userId.trim();
        if (!target.equals(caller.userId()) && !caller.admin()) {
            throw new ResponseStatusException(HttpStatus.FORBIDDEN, "only admins may read another user's history");
        }
        QueryHistoryRepository repo = history.orElseThrow(
                () -> new ResponseStatusException(HttpStatus.NOT_FOUND, "query history is disabled"));
        int n = Math.max(1, Math.min(limit == null ? QueryHistoryRepository.DEFAULT_LIMIT : limit,
                QueryHistoryRepository.MAX_LIMIT));
        List<QueryHistoryEntry> entries;
        try {
            entries = repo.recent(target, n);
        } catch (IllegalStateException e) {
            log.warn("History read for user={} failed: {}", target, e.getMessage());
            throw new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE, "query history unavailable", e);
        }
        return new QueryApiModels.HistoryPage(target, n, entries);
    }
}

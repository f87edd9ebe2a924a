package com.querylab.search.api;

import com.querylab.search.analytics.SearchAnalyticsService;
import com.querylab.search.api.dto.ExportRequest;
import com.querylab.search.cache.SearchCacheService;
import com.querylab.search.resilience.CircuitBreakerRegistry;
import com.querylab.search.resilience.CircuitBreakerStats;
import com.querylab.search.synonym.SynonymReloadResult;
import com.querylab.search.synonym.SynonymService;
import java.io.UncheckedIOException;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/admin")
public class AdminController {
    private static final Logger log = LoggerFactory.getLogger(AdminController.class);

    private final SynonymService synonymService;
    private final CircuitBreakerRegistry breakerRegistry;
    private final SearchCacheService cacheService;
    private final SearchAnalyticsService analyticsService;

    public AdminController(
        SynonymService synonymService,
        CircuitBreakerRegistry breakerRegistry,
        SearchCacheService cacheService,
        SearchAnalyticsService analyticsService
    ) {
        this.synonymService = synonymService;
        this.breakerRegistry = breakerRegistry;
        this.cacheService = cacheService;
        this.analyticsService = analyticsService;
    }

    @PostMapping("/synonyms/reload")
    public ResponseEntity<SynonymReloadResult> reloadSynonyms() {
        SynonymReloadResult result = synonymService.reload();
        if (result.isReloaded()) {
            cacheService.invalidateResults();
        }
        HttpStatus status = result.isReloaded() ? HttpStatus.OK : HttpStatus.UNPROCESSABLE_ENTITY;
        return ResponseEntity.status(status).body(result);
    }

    @PostMapping("/synonyms/export")
    public ResponseEntity<?> exportSynonyms(
        @RequestBody(required = false) ExportRequest request,
        @RequestHeader(value = RequestIds.TRACE_HEADER, required = false) String traceIdHeader,
        @RequestHeader(value = RequestIds.REQUEST_HEADER, required = false) String requestIdHeader
    ) {
        try {
            return ResponseEntity.ok(synonymService.exportThesaurus(request == null ? null : request.getPath()));
        } catch (UncheckedIOException e) {
            log.warn("thesaurus export failed: {}", e.getMessage());
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(RequestIds.error(
                "export_failed",
                e.getMessage(),
                traceIdHeader,
                requestIdHeader
            ));
        }
    }

    @GetMapping("/circuit-breakers")
    public Map<String, CircuitBreakerStats> circuitBreakers() {
        return breakerRegistry.getAllStats();
    }

    @PostMapping("/circuit-breakers/{name}/reset")
    public ResponseEntity<?> resetCircuitBreaker(
        @PathVariable("name") String name,
        @RequestHeader(value = RequestIds.TRACE_HEADER, required = false) String traceIdHeader,
        @RequestHeader(value = RequestIds.REQUEST_HEADER, required = false) String requestIdHeader
    ) {
        if (!breakerRegistry.reset(name)) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(RequestIds.error(
                "not_found",
                "Circuit breaker '" + name + "' not found",
                traceIdHeader,
                requestIdHeader
            ));
        }
        return ResponseEntity.ok(breakerRegistry.get(name).getStats());
    }

    @PostMapping("/cache/invalidate")
    public Map<String, Object> invalidateCache(@RequestParam(value = "scope", defaultValue = "results") String scope) {
        long removed = "all".equalsIgnoreCase(scope) ? cacheService.invalidateAll() : cacheService.invalidateResults();
        return Map.of("scope", scope.toLowerCase(Locale.ROOT), "removed", removed);
    }

    @PostMapping("/analytics/cleanup")
    public Map<String, Object> cleanupHistory(@RequestParam(value = "days", required = false) Integer days) {
        return Map.of("deleted", analyticsService.cleanupHistory(days));
    }
}

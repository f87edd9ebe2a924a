package com.querylab.search.api;

import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.querylab.search.analytics.SearchAnalyticsService;
import com.querylab.search.cache.SearchCacheService;
import com.querylab.search.resilience.CircuitBreaker;
import com.querylab.search.resilience.CircuitBreakerRegistry;
import com.querylab.search.resilience.CircuitBreakerStats;
import com.querylab.search.resilience.CircuitState;
import com.querylab.search.synonym.InvalidExportPathException;
import com.querylab.search.synonym.SynonymReloadResult;
import com.querylab.search.synonym.SynonymService;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(AdminController.class)
class AdminControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private SynonymService synonymService;

    @MockBean
    private CircuitBreakerRegistry breakerRegistry;

    @MockBean
    private SearchCacheService cacheService;

    @MockBean
    private SearchAnalyticsService analyticsService;

    @Test
    void reloadInvalidatesCachedResults() throws Exception {
        when(synonymService.reload()).thenReturn(new SynonymReloadResult(true, "programming", 12, null));

        mockMvc.perform(post("/admin/synonyms/reload"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.reloaded").value(true))
            .andExpect(jsonPath("$.groups").value(12));
        verify(cacheService).invalidateResults();
    }

    @Test
    void failedReloadKeepsCache() throws Exception {
        when(synonymService.reload()).thenReturn(new SynonymReloadResult(false, "programming", 12, "bad json"));

        mockMvc.perform(post("/admin/synonyms/reload"))
            .andExpect(status().isUnprocessableEntity())
            .andExpect(jsonPath("$.error").value("bad json"));
        verify(cacheService, never()).invalidateResults();
    }

    @Test
    void exportReportsWrittenFile() throws Exception {
        when(synonymService.exportThesaurus("nightly.ths"))
            .thenReturn(new SynonymService.ThesaurusExport("/srv/thesaurus/nightly.ths", "programming", 40));

        mockMvc.perform(post("/admin/synonyms/export")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"path\":\"nightly.ths\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.path").value("/srv/thesaurus/nightly.ths"))
            .andExpect(jsonPath("$.lines").value(40));
    }

    @Test
    void exportOutsideDirectoryIsBadRequest() throws Exception {
        when(synonymService.exportThesaurus("../../etc/cron.d/job"))
            .thenThrow(new InvalidExportPathException("export path must stay inside the export directory"));

        mockMvc.perform(post("/admin/synonyms/export")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"path\":\"../../etc/cron.d/job\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error.code").value("bad_request"))
            .andExpect(jsonPath("$.error.message").value("export path must stay inside the export directory"));
    }

    @Test
    void exportFailureIsServerError() throws Exception {
        when(synonymService.exportThesaurus(null))
            .thenThrow(new UncheckedIOException("cannot write", new IOException("read-only")));

        mockMvc.perform(post("/admin/synonyms/export"))
            .andExpect(status().isInternalServerError())
            .andExpect(jsonPath("$.error.code").value("export_failed"));
    }

    @Test
    void circuitBreakersAreListed() throws Exception {
        when(breakerRegistry.getAllStats()).thenReturn(Map.of(
            "search_cache",
            new CircuitBreakerStats("search_cache", CircuitState.OPEN, 3, 0, 0, null, null, null, 4, 10, 1)
        ));

        mockMvc.perform(get("/admin/circuit-breakers"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.search_cache.state").value("open"))
            .andExpect(jsonPath("$.search_cache.total_blocked").value(4))
            .andExpect(jsonPath("$.search_cache.transition_count").value(1));
    }

    @Test
    void resetUnknownBreakerIsNotFound() throws Exception {
        when(breakerRegistry.reset("missing")).thenReturn(false);

        mockMvc.perform(post("/admin/circuit-breakers/missing/reset"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error.code").value("not_found"));
    }

    @Test
    void resetReturnsClosedStats() throws Exception {
        CircuitBreaker breaker = new CircuitBreaker("search_cache", 3, Duration.ofSeconds(10), 1, Clock.systemUTC());
        breaker.recordFailure();
        breaker.reset();
        when(breakerRegistry.reset("search_cache")).thenReturn(true);
        when(breakerRegistry.get("search_cache")).thenReturn(breaker);

        mockMvc.perform(post("/admin/circuit-breakers/search_cache/reset"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.state").value("closed"))
            .andExpect(jsonPath("$.failure_count").value(0));
    }

    @Test
    void invalidateAllScope() throws Exception {
        when(cacheService.invalidateAll()).thenReturn(7L);

        mockMvc.perform(post("/admin/cache/invalidate").param("scope", "ALL"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.scope").value("all"))
            .andExpect(jsonPath("$.removed").value(7));
    }

    @Test
    void cleanupReportsDeletedRows() throws Exception {
        when(analyticsService.cleanupHistory(30)).thenReturn(120);

        mockMvc.perform(post("/admin/analytics/cleanup").param("days", "30"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.deleted").value(120));
    }

    @Test
    void cleanupWithoutDaysUsesRetention() throws Exception {
        when(analyticsService.cleanupHistory(null)).thenReturn(0);

        mockMvc.perform(post("/admin/analytics/cleanup"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.deleted").value(0));
        verify(analyticsService).cleanupHistory(null);
    }
}

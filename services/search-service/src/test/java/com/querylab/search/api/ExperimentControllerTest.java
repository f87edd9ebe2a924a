package com.querylab.search.api;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.querylab.search.experiment.Experiment;
import com.querylab.search.experiment.ExperimentConflictException;
import com.querylab.search.experiment.ExperimentManager;
import com.querylab.search.experiment.ExperimentNotFoundException;
import com.querylab.search.experiment.ExperimentResults;
import com.querylab.search.experiment.ExperimentStateException;
import com.querylab.search.experiment.ExperimentStatus;
import com.querylab.search.experiment.VariantAssignment;
import com.querylab.search.experiment.VariantStats;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(ExperimentController.class)
class ExperimentControllerTest {
    private static final Instant CREATED = Instant.parse("2024-03-01T09:00:00Z");

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ExperimentManager experimentManager;

    @Test
    void createReturnsCreatedDraft() throws Exception {
        when(experimentManager.createExperiment(eq("ranking_v2"), isNull(), anyMap(), eq(50.0), isNull(), isNull(), isNull()))
            .thenReturn(experiment(ExperimentStatus.DRAFT));

        mockMvc.perform(post("/admin/experiments")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\":\"ranking_v2\",\"traffic_percentage\":50,"
                    + "\"variants\":{\"control\":{},\"treatment\":{\"click_boost_weight\":0.4}}}"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.name").value("ranking_v2"))
            .andExpect(jsonPath("$.status").value("draft"))
            .andExpect(jsonPath("$.variants.treatment.click_boost_weight").value(0.4));
    }

    @Test
    void duplicateNameIsConflict() throws Exception {
        when(experimentManager.createExperiment(any(), any(), any(), any(), any(), any(), any()))
            .thenThrow(new ExperimentConflictException("Experiment 'ranking_v2' already exists"));

        mockMvc.perform(post("/admin/experiments")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\":\"ranking_v2\",\"variants\":{\"a\":{},\"b\":{}}}"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.error.code").value("conflict"));
    }

    @Test
    void listFiltersByStatus() throws Exception {
        when(experimentManager.listExperiments(ExperimentStatus.RUNNING)).thenReturn(List.of(experiment(ExperimentStatus.RUNNING)));

        mockMvc.perform(get("/admin/experiments").param("status", "running"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].status").value("running"));
    }

    @Test
    void unknownStatusFilterIsBadRequest() throws Exception {
        mockMvc.perform(get("/admin/experiments").param("status", "archived"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error.message").value("unknown status: archived"));
    }

    @Test
    void missingExperimentIsNotFound() throws Exception {
        when(experimentManager.getExperiment("nope")).thenThrow(new ExperimentNotFoundException("Experiment 'nope' not found"));

        mockMvc.perform(get("/admin/experiments/nope"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error.code").value("not_found"));
    }

    @Test
    void illegalTransitionIsInvalidState() throws Exception {
        when(experimentManager.pauseExperiment("ranking_v2"))
            .thenThrow(new ExperimentStateException("Cannot move experiment 'ranking_v2' from draft to paused"));

        mockMvc.perform(post("/admin/experiments/ranking_v2/pause"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.error.code").value("invalid_state"));
    }

    @Test
    void startReturnsRunningExperiment() throws Exception {
        when(experimentManager.startExperiment("ranking_v2")).thenReturn(experiment(ExperimentStatus.RUNNING));

        mockMvc.perform(post("/admin/experiments/ranking_v2/start"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("running"));
    }

    @Test
    void resultsExposeSignificance() throws Exception {
        when(experimentManager.getResults("ranking_v2")).thenReturn(new ExperimentResults(
            "ranking_v2", ExperimentStatus.RUNNING, CREATED, null, 9, 2000,
            List.of(VariantStats.of("control", 1000, 100, null, 100.0), VariantStats.of("treatment", 1000, 150, null, 150.0)),
            "treatment", true, 0.0007, 0.95, "Significant result! 'treatment' variant is the winner. Consider rolling out."
        ));

        mockMvc.perform(get("/admin/experiments/ranking_v2/results"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.is_significant").value(true))
            .andExpect(jsonPath("$.winner").value("treatment"))
            .andExpect(jsonPath("$.variants[1].conversion_rate").value(0.15));
    }

    @Test
    void variantLookupWithoutAssignmentReturnsNullVariant() throws Exception {
        mockMvc.perform(get("/experiments/ranking_v2/variant").param("user_id", "u1"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.variant").isEmpty())
            .andExpect(jsonPath("$.experiment").value("ranking_v2"));
    }

    @Test
    void variantLookupReturnsConfig() throws Exception {
        when(experimentManager.getVariant("ranking_v2", "u1"))
            .thenReturn(new VariantAssignment("treatment", Map.of("click_boost_weight", 0.4), "ranking_v2"));

        mockMvc.perform(get("/experiments/ranking_v2/variant").param("user_id", "u1"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.variant").value("treatment"))
            .andExpect(jsonPath("$.config.click_boost_weight").value(0.4));
    }

    @Test
    void conversionEventUsesConversionTracking() throws Exception {
        when(experimentManager.trackConversion("ranking_v2", "u1", 2.5, null)).thenReturn(true);

        mockMvc.perform(post("/experiments/ranking_v2/events")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"user_id\":\"u1\",\"event_type\":\"conversion\",\"value\":2.5}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.tracked").value(true));
    }

    @Test
    void conversionWithMetadataStillUsesConversionTracking() throws Exception {
        when(experimentManager.trackConversion("ranking_v2", "u1", null, Map.of("order_id", "o-7"))).thenReturn(true);

        mockMvc.perform(post("/experiments/ranking_v2/events")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"user_id\":\"u1\",\"event_type\":\"conversion\",\"metadata\":{\"order_id\":\"o-7\"}}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.tracked").value(true));

        verify(experimentManager).trackConversion("ranking_v2", "u1", null, Map.of("order_id", "o-7"));
    }

    @Test
    void otherEventsCarryMetadata() throws Exception {
        mockMvc.perform(post("/experiments/ranking_v2/events")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"user_id\":\"u1\",\"event_type\":\"click\",\"metadata\":{\"position\":3}}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.tracked").value(false));

        verify(experimentManager).trackEvent(eq("ranking_v2"), eq("u1"), eq("click"), isNull(), eq(Map.of("position", 3)));
    }

    @Test
    void eventWithoutUserIsBadRequest() throws Exception {
        mockMvc.perform(post("/experiments/ranking_v2/events")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"event_type\":\"click\"}"))
            .andExpect(status().isBadRequest());
    }

    private static Experiment experiment(ExperimentStatus status) {
        Map<String, Map<String, Object>> variants = new LinkedHashMap<>();
        variants.put("control", Map.of());
        variants.put("treatment", Map.of("click_boost_weight", 0.4));
        return new Experiment(1L, "ranking_v2", null, variants, status, 50.0, null, null,
            "click_rate", null, null, CREATED);
    }
}

package com.boxofficeintel.daily.config;

import com.boxofficeintel.daily.service.CollectionOrchestrator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class CollectionControllerTest {

    private CollectionOrchestrator orchestrator;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        orchestrator = mock(CollectionOrchestrator.class);
        mvc = MockMvcBuilders.standaloneSetup(new CollectionController(orchestrator)).build();
    }

    @Test
    void triggerStartsRangeInBackground() throws Exception {
        when(orchestrator.startCollect(any(), any(), anyString())).thenReturn(true);

        mvc.perform(post("/collect/trigger").param("start", "2025-01-01").param("end", "2025-01-31"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.start").value("2025-01-01"));

        verify(orchestrator).startCollect(LocalDate.of(2025, 1, 1), LocalDate.of(2025, 1, 31), "manual");
    }

    @Test
    void triggerWithoutRangeUsesConfiguredRange() throws Exception {
        when(orchestrator.startCollect(any(), any(), anyString())).thenReturn(true);

        mvc.perform(post("/collect/trigger"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.start").value("configured"));

        verify(orchestrator).startCollect(null, null, "manual");
    }

    @Test
    void invertedRangeIsBadRequest() throws Exception {
        mvc.perform(post("/collect/trigger").param("start", "2025-02-01").param("end", "2025-01-01"))
                .andExpect(status().isBadRequest());
        mvc.perform(post("/collect/trigger").param("start", "2025-02-01"))
                .andExpect(status().isBadRequest());

        verify(orchestrator, never()).startCollect(any(), any(), anyString());
    }

    @Test
    void busyOrchestratorRejectsNewWork() throws Exception {
        // unstubbed start* methods answer false, as a busy orchestrator does
        mvc.perform(post("/collect/trigger")).andExpect(status().isConflict());
        mvc.perform(post("/collect/retry-skipped")).andExpect(status().isConflict());
        mvc.perform(post("/aggregate")).andExpect(status().isConflict());
    }

    @Test
    void cancelReportsWhetherARunWasActive() throws Exception {
        when(orchestrator.cancel()).thenReturn(true);

        mvc.perform(post("/collect/cancel"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("cancelling"));
    }

    @Test
    void statusExposesOrchestratorState() throws Exception {
        Map<String, Object> state = new LinkedHashMap<>();
        state.put("running", false);
        state.put("lastCompletedDate", "2025-01-09");
        when(orchestrator.status()).thenReturn(state);

        mvc.perform(get("/collect/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.running").value(false))
                .andExpect(jsonPath("$.lastCompletedDate").value("2025-01-09"));
    }

    @Test
    void aggregateAndRetryRunInBackground() throws Exception {
        when(orchestrator.startAggregateOnly()).thenReturn(true);
        when(orchestrator.startRetrySkipped()).thenReturn(true);

        mvc.perform(post("/aggregate"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.target").value("feature table"));
        mvc.perform(post("/collect/retry-skipped"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.target").value("skipped dates"));
    }
}

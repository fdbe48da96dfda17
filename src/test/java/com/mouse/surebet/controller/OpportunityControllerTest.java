package com.mouse.surebet.controller;

import com.mouse.surebet.aggregator.OddsAggregator;
import com.mouse.surebet.config.SurebetProperties;
import com.mouse.surebet.config.SurebetProperties.EngineSettings;
import com.mouse.surebet.detector.ArbitrageDetector;
import com.mouse.surebet.enums.EngineStatus;
import com.mouse.surebet.enums.Outcome;
import com.mouse.surebet.enums.SportType;
import com.mouse.surebet.exception.ConfigurationException;
import com.mouse.surebet.exception.EngineNotFoundException;
import com.mouse.surebet.exception.GlobalExceptionHandler;
import com.mouse.surebet.manager.CycleReport;
import com.mouse.surebet.manager.OpportunityEngine;
import com.mouse.surebet.manager.OpportunityEngineManager;
import com.mouse.surebet.model.FreebetOpportunity;
import com.mouse.surebet.model.MatchSnapshot;
import com.mouse.surebet.model.OddsRow;
import com.mouse.surebet.tracker.ChangeSet;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.mouse.surebet.OddsFixtures.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class OpportunityControllerTest {

    @Mock
    OpportunityEngineManager engineManager;

    @Mock
    OpportunityEngine engine;

    @InjectMocks
    OpportunityController controller;

    MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    private CycleReport report() {
        List<OddsRow> rows = new ArrayList<>(scenarioOneRows("M-1"));
        rows.add(basketball("B-1", "BookA", "1.80", "1.90"));
        List<MatchSnapshot> snapshots = new OddsAggregator().aggregate(rows, NOW);
        return CycleReport.builder()
                .engine("football")
                .sequence(3)
                .startedAt(NOW)
                .completedAt(NOW)
                .snapshots(snapshots)
                .arbitrages(new ArbitrageDetector(new SurebetProperties()).detectAll(snapshots))
                .freebets(List.of())
                .arbitrageChanges(ChangeSet.empty())
                .freebetChanges(ChangeSet.empty())
                .build();
    }

    @Test
    void listEngines_returnsNameStatusAndLastCycle() throws Exception {
        EngineSettings settings = new EngineSettings();
        settings.setName("football");
        settings.setSport(SportType.FOOTBALL);
        when(engine.getName()).thenReturn("football");
        when(engine.getSettings()).thenReturn(settings);
        when(engine.getStatus()).thenReturn(EngineStatus.RUNNING);
        when(engine.getLastReport()).thenReturn(Optional.of(report()));
        when(engineManager.getEngines()).thenReturn(List.of(engine));

        mockMvc.perform(get("/api/v1/engines"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(1))
                .andExpect(jsonPath("$.engines[0].name").value("football"))
                .andExpect(jsonPath("$.engines[0].status").value("RUNNING"))
                .andExpect(jsonPath("$.engines[0].lastCycleSequence").value(3));
    }

    @Test
    void getArbitrages_returnsLastCycleOpportunities() throws Exception {
        when(engineManager.getEngine("football")).thenReturn(engine);
        when(engine.getLastReport()).thenReturn(Optional.of(report()));

        mockMvc.perform(get("/api/v1/engines/football/arbitrages"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(1))
                .andExpect(jsonPath("$.arbitrages[0].matchId").value("M-1"))
                .andExpect(jsonPath("$.arbitrages[0].legs.length()").value(3))
                .andExpect(jsonPath("$.best.matchId").value("M-1"));
    }

    @Test
    void getMatches_filtersByLeague() throws Exception {
        when(engineManager.getEngine("football")).thenReturn(engine);
        when(engine.getLastReport()).thenReturn(Optional.of(report()));

        mockMvc.perform(get("/api/v1/engines/football/matches").param("league", "Serie A"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(2));

        mockMvc.perform(get("/api/v1/engines/football/matches").param("league", "Premier League"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(0));
    }

    @Test
    void getFreebets_beforeFirstCycle_isEmpty() throws Exception {
        when(engineManager.getEngine("football")).thenReturn(engine);
        when(engine.getLastReport()).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/v1/engines/football/freebets"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(0));
    }

    @Test
    void unknownEngine_is404() throws Exception {
        when(engineManager.getEngine("tennis")).thenThrow(new EngineNotFoundException("tennis"));

        mockMvc.perform(get("/api/v1/engines/tennis/arbitrages"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("ENGINE_NOT_FOUND"))
                .andExpect(jsonPath("$.path").value("/api/v1/engines/tennis/arbitrages"));
    }

    @Test
    void calculateFreebet_returnsStakes() throws Exception {
        FreebetOpportunity result = FreebetOpportunity.builder()
                .matchId("M-1")
                .freebetOutcome(Outcome.AWAY)
                .freebetValue(bd("100"))
                .extractionPercent(bd("42.86"))
                .guaranteedProfit(bd("42.86"))
                .build();
        when(engineManager.calculateFreebet(eq("football"), eq("M-1"), eq("Betbra"), eq(Outcome.AWAY), any()))
                .thenReturn(result);

        mockMvc.perform(post("/api/v1/engines/football/freebet/calculate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"matchId\":\"M-1\",\"bookmaker\":\"Betbra\",\"outcome\":\"away\",\"value\":100}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.extractionPercent").value(42.86))
                .andExpect(jsonPath("$.freebetOutcome").value("AWAY"));
    }

    @Test
    void calculateFreebet_unknownOutcome_is400() throws Exception {
        mockMvc.perform(post("/api/v1/engines/football/freebet/calculate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"matchId\":\"M-1\",\"bookmaker\":\"Betbra\",\"outcome\":\"sideways\",\"value\":100}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_REQUEST"))
                .andExpect(jsonPath("$.message").value("Unknown outcome: sideways"));

        verifyNoInteractions(engineManager);
    }

    @Test
    void calculateFreebet_detectorRejection_is400() throws Exception {
        when(engineManager.calculateFreebet(any(), any(), any(), any(), any()))
                .thenThrow(new ConfigurationException("Bookmaker 'Pinnacle' has no quote for match M-1"));

        mockMvc.perform(post("/api/v1/engines/football/freebet/calculate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"matchId\":\"M-1\",\"bookmaker\":\"Pinnacle\",\"outcome\":\"draw\",\"value\":100}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Bookmaker 'Pinnacle' has no quote for match M-1"));
    }

    @Test
    void refresh_queuesCycle() throws Exception {
        when(engineManager.getEngine("football")).thenReturn(engine);
        when(engine.requestCycle()).thenReturn(true);

        mockMvc.perform(post("/api/v1/engines/football/refresh"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.queued").value(true));
    }
}

package com.mouse.surebet.controller;

import com.mouse.surebet.dto.FreebetCalculationRequest;
import com.mouse.surebet.enums.Outcome;
import com.mouse.surebet.exception.ConfigurationException;
import com.mouse.surebet.manager.CycleReport;
import com.mouse.surebet.manager.OpportunityEngine;
import com.mouse.surebet.manager.OpportunityEngineManager;
import com.mouse.surebet.model.ArbitrageOpportunity;
import com.mouse.surebet.model.FreebetOpportunity;
import com.mouse.surebet.model.MatchSnapshot;
import com.mouse.surebet.model.OddsQuery;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/engines")
public class OpportunityController {

    private final OpportunityEngineManager engineManager;

    /**
     * Configured engines with their state and the time of the last completed cycle.
     */
    @GetMapping
    public ResponseEntity<Map<String, Object>> listEngines() {
        List<Map<String, Object>> engines = new ArrayList<>();
        for (OpportunityEngine engine : engineManager.getEngines()) {
            Map<String, Object> entry = new HashMap<>();
            entry.put("name", engine.getName());
            entry.put("sport", engine.getSettings().getSport());
            entry.put("feedId", engine.getSettings().getFeedId());
            entry.put("status", engine.getStatus());
            entry.put("freebetEnabled", engine.getSettings().getFreebet() != null && engine.getSettings().getFreebet().isEnabled());
            engine.getLastReport().ifPresent(report -> {
                entry.put("lastCycleAt", report.getCompletedAt());
                entry.put("lastCycleSequence", report.getSequence());
            });
            engine.getLastFailureAt().ifPresent(at -> entry.put("lastFailureAt", at));
            engine.getLastFailure().ifPresent(message -> entry.put("lastFailure", message));
            engines.add(entry);
        }

        Map<String, Object> response = new HashMap<>();
        response.put("engines", engines);
        response.put("count", engines.size());
        response.put("timestamp", Instant.now());
        return ResponseEntity.ok(response);
    }

    /**
     * Match snapshots of the last cycle, optionally filtered by league and kickoff range.
     */
    @GetMapping("/{engine}/matches")
    public ResponseEntity<Map<String, Object>> getMatches(
            @PathVariable String engine,
            @RequestParam(required = false) String league,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant dateFrom,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant dateTo
    ) {
        log.debug("GET /api/v1/engines/{}/matches - league={}, from={}, to={}", engine, league, dateFrom, dateTo);
        OddsQuery filter = OddsQuery.builder().leagueName(league).dateFrom(dateFrom).dateTo(dateTo).build();

        List<MatchSnapshot> matches = lastReport(engine)
                .map(report -> report.getSnapshots().stream().filter(filter::matches).toList())
                .orElse(List.of());

        Map<String, Object> response = baseResponse(engine);
        response.put("matches", matches);
        response.put("count", matches.size());
        return ResponseEntity.ok(response);
    }

    @GetMapping("/{engine}/arbitrages")
    public ResponseEntity<Map<String, Object>> getArbitrages(@PathVariable String engine) {
        List<ArbitrageOpportunity> arbitrages = lastReport(engine)
                .map(CycleReport::getArbitrages)
                .orElse(List.of());

        Map<String, Object> response = baseResponse(engine);
        response.put("arbitrages", arbitrages);
        response.put("count", arbitrages.size());
        if (!arbitrages.isEmpty()) {
            ArbitrageOpportunity best = arbitrages.get(0);
            response.put("best", Map.of(
                    "matchId", best.getMatchId(),
                    "roiPercent", best.getRoiPercent(),
                    "guaranteedProfit", best.getGuaranteedProfit()
            ));
        } else {
            response.put("message", "No arbitrage opportunities in the last cycle");
        }
        return ResponseEntity.ok(response);
    }

    @GetMapping("/{engine}/freebets")
    public ResponseEntity<Map<String, Object>> getFreebets(@PathVariable String engine) {
        List<FreebetOpportunity> freebets = lastReport(engine)
                .map(CycleReport::getFreebets)
                .orElse(List.of());

        Map<String, Object> response = baseResponse(engine);
        response.put("freebets", freebets);
        response.put("count", freebets.size());
        return ResponseEntity.ok(response);
    }

    /**
     * Hedge stakes for a free bet on one match of the last cycle.
     */
    @PostMapping("/{engine}/freebet/calculate")
    public ResponseEntity<FreebetOpportunity> calculateFreebet(
            @PathVariable String engine,
            @RequestBody FreebetCalculationRequest request
    ) {
        log.info("POST /api/v1/engines/{}/freebet/calculate - match={}, bookmaker={}, outcome={}, value={}",
                engine, request.getMatchId(), request.getBookmaker(), request.getOutcome(), request.getValue());
        if (request.getMatchId() == null || request.getMatchId().isBlank()) {
            throw new ConfigurationException("matchId is required");
        }
        if (request.getValue() == null || request.getValue().signum() < 0) {
            throw new ConfigurationException("value must be zero or positive");
        }

        FreebetOpportunity result = engineManager.calculateFreebet(engine, request.getMatchId(),
                request.getBookmaker(), Outcome.fromName(request.getOutcome()), request.getValue());
        return ResponseEntity.ok(result);
    }

    @PostMapping("/{engine}/refresh")
    public ResponseEntity<Map<String, Object>> refresh(@PathVariable String engine) {
        boolean queued = engineManager.getEngine(engine).requestCycle();
        log.info("POST /api/v1/engines/{}/refresh - queued={}", engine, queued);

        Map<String, Object> response = baseResponse(engine);
        response.put("queued", queued);
        return ResponseEntity.accepted().body(response);
    }

    private Optional<CycleReport> lastReport(String engine) {
        return engineManager.getEngine(engine).getLastReport();
    }

    private static Map<String, Object> baseResponse(String engine) {
        Map<String, Object> response = new HashMap<>();
        response.put("engine", engine);
        response.put("timestamp", Instant.now());
        return response;
    }
}

package com.mouse.surebet.logservice;

import com.mouse.surebet.enums.OpportunityKind;
import com.mouse.surebet.manager.CycleReport;
import com.mouse.surebet.model.ArbitrageOpportunity;
import com.mouse.surebet.model.FreebetOpportunity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

@Slf4j
@Service
public class OpportunityLogService {

    /**
     * Called once per completed cycle.
     */
    public void logCycle(CycleReport report) {
        log.info("CYCLE DONE | engine={} rows={} matches={} arbs={} freebets={} +arbs={} -arbs={} +freebets={} -freebets={} took={}ms",
                report.getEngine(), report.getRowCount(), report.getSnapshots().size(),
                report.getArbitrages().size(), report.getFreebets().size(),
                report.getArbitrageChanges().getAdded().size(), report.getArbitrageChanges().getRemoved().size(),
                report.getFreebetChanges().getAdded().size(), report.getFreebetChanges().getRemoved().size(),
                report.getDurationMillis());
    }

    public void logArb(String engine, ArbitrageOpportunity arb) {
        log.info("ARB DETECTED | engine={} matchId={} match={} vs {} index={} roi={}%",
                engine, arb.getMatchId(), arb.getHomeTeam(), arb.getAwayTeam(),
                arb.getArbitrageIndex(), arb.getRoiPercent());
    }

    public void logFreebet(String engine, FreebetOpportunity freebet) {
        log.info("FREEBET DETECTED | engine={} matchId={} match={} vs {} outcome={} extraction={}%",
                engine, freebet.getMatchId(), freebet.getHomeTeam(), freebet.getAwayTeam(),
                freebet.getFreebetOutcome(), freebet.getExtractionPercent());
    }

    public void logGone(String engine, OpportunityKind kind, List<String> keys) {
        if (!keys.isEmpty()) {
            log.info("GONE | engine={} kind={} keys={}", engine, kind, keys);
        }
    }

    public void logColdStart(String engine, int arbitrages, int freebets) {
        log.info("COLD START | engine={} seeded arbs={} freebets={} without notifying", engine, arbitrages, freebets);
    }

    public void logNotifyFailed(String engine, String dedupeKey, Throwable t) {
        log.error("NOTIFY FAILED | engine={} key={}", engine, dedupeKey, t);
    }

    public void logFetchFailed(String engine, Throwable t) {
        log.warn("⚠️ CYCLE SKIPPED | engine={} fetch failed: {}", engine, t.getMessage());
    }

    public void logError(String message, Throwable t) {
        log.error(message, t);
    }
}

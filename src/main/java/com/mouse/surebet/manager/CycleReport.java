package com.mouse.surebet.manager;

import com.mouse.surebet.model.ArbitrageOpportunity;
import com.mouse.surebet.model.FreebetOpportunity;
import com.mouse.surebet.model.MatchSnapshot;
import com.mouse.surebet.tracker.ChangeSet;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Outcome of one successful cycle, kept as the engine's latest view.
 */
@Value
@Builder
public class CycleReport {
    String engine;
    long sequence;
    Instant startedAt;
    Instant completedAt;
    int rowCount;
    /** True for the first cycle, whose additions are recorded but not notified. */
    boolean coldStart;

    List<MatchSnapshot> snapshots;
    List<ArbitrageOpportunity> arbitrages;
    List<FreebetOpportunity> freebets;
    ChangeSet<String> arbitrageChanges;
    ChangeSet<String> freebetChanges;

    public long getDurationMillis() {
        return Duration.between(startedAt, completedAt).toMillis();
    }
}

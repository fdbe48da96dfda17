package com.mouse.surebet.model;

import com.mouse.surebet.enums.SportType;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * A match whose best prices across houses sum to an arbitrage index below 1.
 * Recomputed every cycle from the current snapshot.
 */
@Value
@Builder(toBuilder = true)
public class ArbitrageOpportunity {
    String matchId;
    SportType sportType;
    String homeTeam;
    String awayTeam;
    String leagueName;
    Instant matchDate;

    List<OpportunityLeg> legs;
    BigDecimal arbitrageIndex;
    BigDecimal roiPercent;
    BigDecimal totalStake;
    BigDecimal guaranteedProfit;
}

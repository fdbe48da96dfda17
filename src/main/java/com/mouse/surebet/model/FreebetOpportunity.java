package com.mouse.surebet.model;

import com.mouse.surebet.enums.Outcome;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

@Value
@Builder(toBuilder = true)
public class FreebetOpportunity {
    String matchId;
    String homeTeam;
    String awayTeam;
    String leagueName;
    Instant matchDate;

    String freebetBookmaker;
    Outcome freebetOutcome;
    BigDecimal freebetValue;
    List<OpportunityLeg> legs;
    FreebetStakes stakes;
    BigDecimal totalToInvest;
    BigDecimal guaranteedProfit;
    BigDecimal extractionPercent;
}

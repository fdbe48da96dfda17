package com.mouse.surebet.model;

import com.mouse.surebet.enums.Outcome;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class FreebetResult {
    Outcome freebetOutcome;
    BigDecimal freebetValue;
    /** Profit-only payout of the free bet; its stake is not returned. */
    BigDecimal freebetReturn;
    FreebetStakes stakes;
    /** Real money staked on the hedging outcomes. */
    BigDecimal totalToInvest;
    BigDecimal guaranteedProfit;
    /** Share of the freebet face value converted to guaranteed profit; negative when hedging costs more. */
    BigDecimal extractionPercent;
}

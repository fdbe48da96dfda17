package com.mouse.surebet.model;

import com.mouse.surebet.enums.OddsType;
import com.mouse.surebet.enums.Outcome;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;

/**
 * One bookmaker's price for one match at one point in time. A fresher quote for the same
 * (matchId, bookmakerId) replaces this one; it is never mutated.
 */
@Value
@Builder(toBuilder = true)
public class BookmakerQuote {
    String matchId;
    String bookmakerId;
    String bookmakerName;
    BigDecimal homeOdd;
    BigDecimal drawOdd;     // null for two-outcome sports or when the house has no draw price
    BigDecimal awayOdd;
    BigDecimal marginPercentage;
    Instant scrapedAt;
    long ageSeconds;
    OddsType oddsType;
    @Builder.Default
    Map<String, Object> extraData = Map.of();

    public BigDecimal odd(Outcome outcome) {
        return switch (outcome) {
            case HOME -> homeOdd;
            case DRAW -> drawOdd;
            case AWAY -> awayOdd;
        };
    }

    public boolean hasOdd(Outcome outcome) {
        BigDecimal odd = odd(outcome);
        return odd != null && odd.signum() > 0;
    }
}

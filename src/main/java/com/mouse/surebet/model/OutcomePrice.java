package com.mouse.surebet.model;

import com.mouse.surebet.enums.Outcome;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Map;

/**
 * An extreme (best or worst) price for one outcome and the bookmaker credited with it.
 */
@Value
public class OutcomePrice {
    Outcome outcome;
    BigDecimal odd;
    String bookmakerId;
    String bookmakerName;
    Map<String, Object> extraData;

    public static OutcomePrice of(Outcome outcome, BookmakerQuote quote) {
        return new OutcomePrice(outcome, quote.odd(outcome), quote.getBookmakerId(),
                quote.getBookmakerName(), quote.getExtraData());
    }
}

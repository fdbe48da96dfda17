package com.mouse.surebet.model;

import com.mouse.surebet.enums.Outcome;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Map;

/**
 * One bet of an opportunity: which house to back for which outcome, and how much.
 */
@Value
@Builder(toBuilder = true)
public class OpportunityLeg {
    Outcome outcome;
    String bookmakerId;
    String bookmakerName;
    BigDecimal odd;
    BigDecimal stake;
    boolean freebet;
    Map<String, Object> extraData;
}

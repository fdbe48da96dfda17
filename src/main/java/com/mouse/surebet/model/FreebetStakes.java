package com.mouse.surebet.model;

import com.mouse.surebet.enums.Outcome;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class FreebetStakes {
    BigDecimal home;
    BigDecimal draw;
    BigDecimal away;

    public BigDecimal of(Outcome outcome) {
        return switch (outcome) {
            case HOME -> home;
            case DRAW -> draw;
            case AWAY -> away;
        };
    }
}

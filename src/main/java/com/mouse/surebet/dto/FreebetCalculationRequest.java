package com.mouse.surebet.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class FreebetCalculationRequest {
    private String matchId;
    private String bookmaker;
    /** home, draw or away */
    private String outcome;
    private BigDecimal value;
}

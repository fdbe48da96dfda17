package com.mouse.surebet.model.snapshot;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SnapshotOdds {
    private String bookmakerId;
    private String bookmakerName;
    private BigDecimal homeOdd;
    private BigDecimal drawOdd;
    private BigDecimal awayOdd;
    private String oddsType;
    private BigDecimal marginPercentage;
    private BigDecimal dataAgeSeconds;
    private String scrapedAt;
    private Map<String, Object> extraData;
}

package com.mouse.surebet.model.snapshot;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SnapshotMatch {
    private String matchId;
    private String matchDate;
    private String matchStatus;
    private String leagueName;
    private String leagueCountry;
    private String sportType;
    private String homeTeam;
    private String awayTeam;
    private List<SnapshotOdds> odds;

    // 0 marks "no price" in the published document
    private BigDecimal bestHome;
    private BigDecimal bestDraw;
    private BigDecimal bestAway;
    private BigDecimal worstHome;
    private BigDecimal worstDraw;
    private BigDecimal worstAway;
}

package com.mouse.surebet.model;

import com.mouse.surebet.enums.SportType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;

/**
 * One row of the quote feed: a bookmaker's 1X2 prices for a match, flattened with the match metadata.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class OddsRow {
    private String matchId;
    private Instant matchDate;
    private String matchStatus;
    private String leagueName;
    private String leagueCountry;
    private SportType sportType;
    private String homeTeam;
    private String awayTeam;

    private String bookmakerId;
    private String bookmakerName;
    private BigDecimal homeOdd;
    private BigDecimal drawOdd;
    private BigDecimal awayOdd;
    private BigDecimal marginPercentage;
    private Long dataAgeSeconds;
    private Instant scrapedAt;
    private Map<String, Object> extraData;
    private String oddsType;
}

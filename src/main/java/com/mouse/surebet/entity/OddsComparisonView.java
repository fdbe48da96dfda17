package com.mouse.surebet.entity;

import com.mouse.surebet.converter.ExtraDataConverter;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.Immutable;

import java.io.Serializable;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;

/**
 * Read-only mapping of the odds_comparison view: latest odds per (match, bookmaker) joined with
 * match, league, team and bookmaker names.
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@Entity
@Immutable
@Table(name = "odds_comparison")
@IdClass(OddsComparisonView.Key.class)
@ToString(exclude = "extraData")
public class OddsComparisonView {

    @Id
    @Column(name = "match_id")
    private String matchId;

    @Id
    @Column(name = "bookmaker_id")
    private String bookmakerId;

    @Column(name = "match_date")
    private Instant matchDate;

    @Column(name = "match_status")
    private String matchStatus;

    @Column(name = "league_name")
    private String leagueName;

    @Column(name = "league_country")
    private String leagueCountry;

    @Column(name = "sport_type")
    private String sportType;

    @Column(name = "home_team")
    private String homeTeam;

    @Column(name = "away_team")
    private String awayTeam;

    @Column(name = "bookmaker_name")
    private String bookmakerName;

    @Column(name = "home_odd")
    private BigDecimal homeOdd;

    @Column(name = "draw_odd")
    private BigDecimal drawOdd;

    @Column(name = "away_odd")
    private BigDecimal awayOdd;

    @Column(name = "margin_percentage")
    private BigDecimal marginPercentage;

    @Column(name = "data_age_seconds")
    private BigDecimal dataAgeSeconds;

    @Column(name = "scraped_at")
    private Instant scrapedAt;

    @Column(name = "odds_type")
    private String oddsType;

    @Convert(converter = ExtraDataConverter.class)
    @Column(name = "extra_data", columnDefinition = "jsonb")
    private Map<String, Object> extraData;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Key implements Serializable {
        private String matchId;
        private String bookmakerId;
    }
}

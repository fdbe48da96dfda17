package com.mouse.surebet;

import com.mouse.surebet.enums.SportType;
import com.mouse.surebet.model.OddsRow;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;

/**
 * Row builders shared by the tests. All times hang off {@link #NOW}.
 */
public final class OddsFixtures {

    public static final Instant NOW = Instant.parse("2025-01-10T18:00:00Z");
    public static final Instant KICKOFF = NOW.plus(2, ChronoUnit.HOURS);

    private OddsFixtures() {
    }

    public static BigDecimal bd(String value) {
        return value == null ? null : new BigDecimal(value);
    }

    public static OddsRow football(String matchId, String bookmaker, String home, String draw, String away) {
        return row(matchId, SportType.FOOTBALL, bookmaker, home, draw, away, KICKOFF, NOW.minusSeconds(30));
    }

    public static OddsRow basketball(String matchId, String bookmaker, String home, String away) {
        return row(matchId, SportType.BASKETBALL, bookmaker, home, null, away, KICKOFF, NOW.minusSeconds(30));
    }

    public static OddsRow row(String matchId, SportType sport, String bookmaker, String home, String draw, String away,
                              Instant matchDate, Instant scrapedAt) {
        return OddsRow.builder()
                .matchId(matchId)
                .matchDate(matchDate)
                .matchStatus("scheduled")
                .leagueName("Serie A")
                .leagueCountry("Brasil")
                .sportType(sport)
                .homeTeam("Flamengo")
                .awayTeam("Palmeiras")
                .bookmakerId(bookmaker.toLowerCase())
                .bookmakerName(bookmaker)
                .homeOdd(bd(home))
                .drawOdd(bd(draw))
                .awayOdd(bd(away))
                .scrapedAt(scrapedAt)
                .extraData(Map.of("event_id", matchId + "-" + bookmaker))
                .build();
    }

    /**
     * Best home 2.10 at BookA, best draw 3.40 at BookB, best away 4.50 at BookC.
     */
    public static List<OddsRow> scenarioOneRows(String matchId) {
        return List.of(
                football(matchId, "BookA", "2.10", "3.00", "4.00"),
                football(matchId, "BookB", "2.00", "3.40", "4.00"),
                football(matchId, "BookC", "2.00", "3.00", "4.50"));
    }
}

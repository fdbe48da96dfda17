package com.mouse.surebet.feed;

import com.mouse.surebet.entity.OddsComparisonView;
import com.mouse.surebet.enums.SportType;
import com.mouse.surebet.exception.TransientFetchException;
import com.mouse.surebet.model.OddsQuery;
import com.mouse.surebet.model.OddsRow;
import com.mouse.surebet.repository.OddsComparisonRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * Reads the odds_comparison view. Without a dateFrom only matches kicking off at most five minutes ago are loaded.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DatabaseOddsFeed implements OddsFeed {

    private static final Instant FAR_FUTURE = Instant.parse("9999-12-31T23:59:59Z");

    private final OddsComparisonRepository repository;
    private final Clock clock;

    @Override
    public String name() {
        return "database";
    }

    @Override
    @Transactional(readOnly = true)
    public List<OddsRow> fetch(OddsQuery query) {
        SportType sport = query.getSportType() != null ? query.getSportType() : SportType.FOOTBALL;
        Instant dateFrom = query.getDateFrom() != null
                ? query.getDateFrom()
                : clock.instant().minus(5, ChronoUnit.MINUTES);
        Instant dateTo = query.getDateTo() != null ? query.getDateTo() : FAR_FUTURE;

        List<OddsComparisonView> views;
        try {
            views = query.getLeagueName() == null
                    ? repository.findForComparison(sport.getName(), dateFrom, dateTo)
                    : repository.findForComparisonInLeague(sport.getName(), query.getLeagueName(), dateFrom, dateTo);
        } catch (DataAccessException e) {
            throw new TransientFetchException("Failed to read odds_comparison: " + e.getMostSpecificCause().getMessage(), e);
        }

        log.debug("Loaded {} rows from odds_comparison | sport={} league={}", views.size(), sport.getName(), query.getLeagueName());
        return views.stream().map(DatabaseOddsFeed::toRow).toList();
    }

    static OddsRow toRow(OddsComparisonView view) {
        return OddsRow.builder()
                .matchId(view.getMatchId())
                .matchDate(view.getMatchDate())
                .matchStatus(view.getMatchStatus())
                .leagueName(view.getLeagueName())
                .leagueCountry(view.getLeagueCountry())
                .sportType(SportType.fromName(view.getSportType()).orElse(null))
                .homeTeam(view.getHomeTeam())
                .awayTeam(view.getAwayTeam())
                .bookmakerId(view.getBookmakerId())
                .bookmakerName(view.getBookmakerName())
                .homeOdd(view.getHomeOdd())
                .drawOdd(view.getDrawOdd())
                .awayOdd(view.getAwayOdd())
                .marginPercentage(view.getMarginPercentage())
                .dataAgeSeconds(view.getDataAgeSeconds() != null ? view.getDataAgeSeconds().longValue() : null)
                .scrapedAt(view.getScrapedAt())
                .extraData(view.getExtraData())
                .oddsType(view.getOddsType())
                .build();
    }
}

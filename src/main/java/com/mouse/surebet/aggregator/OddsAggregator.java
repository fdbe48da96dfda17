package com.mouse.surebet.aggregator;

import com.mouse.surebet.enums.OddsType;
import com.mouse.surebet.enums.Outcome;
import com.mouse.surebet.enums.SportType;
import com.mouse.surebet.exception.MalformedRowException;
import com.mouse.surebet.model.BookmakerQuote;
import com.mouse.surebet.model.MatchSnapshot;
import com.mouse.surebet.model.OddsRow;
import com.mouse.surebet.model.OutcomePrice;
import com.mouse.surebet.utils.OddsCalculator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Groups raw feed rows into one {@link MatchSnapshot} per match and computes the best and worst
 * price per outcome. Matches that kicked off more than {@link #STALENESS_CUTOFF} ago are dropped.
 * <p>
 * When several houses share an extreme price the first quote in feed order keeps the credit.
 * Only the price is guaranteed; callers must not depend on which house is named.
 */
@Slf4j
@Component
public class OddsAggregator {

    public static final Duration STALENESS_CUTOFF = Duration.ofMinutes(5);

    public List<MatchSnapshot> aggregate(List<OddsRow> rows, Instant now) {
        if (rows == null || rows.isEmpty()) {
            log.debug("No rows to aggregate");
            return Collections.emptyList();
        }

        Instant cutoff = now.minus(STALENESS_CUTOFF);
        Map<String, MatchGroup> groups = new LinkedHashMap<>();
        int malformed = 0;
        int stale = 0;
        int superseded = 0;

        for (OddsRow row : rows) {
            try {
                validate(row);
            } catch (MalformedRowException e) {
                malformed++;
                log.warn("Skipping malformed row | matchId={} bookmaker={} | {}",
                        e.getMatchId(), e.getBookmakerId(), e.getMessage());
                continue;
            }

            if (row.getMatchDate().isBefore(cutoff)) {
                stale++;
                log.trace("Dropping stale row | matchId={} kickoff={} cutoff={}",
                        row.getMatchId(), row.getMatchDate(), cutoff);
                continue;
            }

            MatchGroup group = groups.computeIfAbsent(row.getMatchId(), id -> new MatchGroup(row));
            if (group.offer(toQuote(row, group.sportType, now))) {
                superseded++;
            }
        }

        List<MatchSnapshot> snapshots = new ArrayList<>(groups.size());
        for (MatchGroup group : groups.values()) {
            if (!group.quotes.isEmpty()) {
                snapshots.add(group.toSnapshot());
            }
        }
        snapshots.sort(Comparator.comparing(MatchSnapshot::getMatchDate).thenComparing(MatchSnapshot::getMatchId));

        log.debug("Aggregated {} rows into {} matches | malformed={} stale={} superseded={}",
                rows.size(), snapshots.size(), malformed, stale, superseded);
        return snapshots;
    }

    private void validate(OddsRow row) {
        if (row == null) {
            throw new MalformedRowException(null, null, "row is null");
        }
        String matchId = row.getMatchId();
        String bookmakerId = bookmakerKey(row);
        if (matchId == null || matchId.isBlank()) {
            throw new MalformedRowException(matchId, bookmakerId, "missing match id");
        }
        if (bookmakerId == null || bookmakerId.isBlank()) {
            throw new MalformedRowException(matchId, bookmakerId, "missing bookmaker");
        }
        if (row.getMatchDate() == null) {
            throw new MalformedRowException(matchId, bookmakerId, "missing match date");
        }
        if (!isPositive(row.getHomeOdd())) {
            throw new MalformedRowException(matchId, bookmakerId, "missing home odd: " + row.getHomeOdd());
        }
        if (!isPositive(row.getAwayOdd())) {
            throw new MalformedRowException(matchId, bookmakerId, "missing away odd: " + row.getAwayOdd());
        }
    }

    private BookmakerQuote toQuote(OddsRow row, SportType sportType, Instant now) {
        BigDecimal drawOdd = sportType.isTernary() && isPositive(row.getDrawOdd()) ? row.getDrawOdd() : null;
        long ageSeconds;
        if (row.getDataAgeSeconds() != null) {
            ageSeconds = row.getDataAgeSeconds();
        } else if (row.getScrapedAt() != null) {
            ageSeconds = Math.max(0, Duration.between(row.getScrapedAt(), now).getSeconds());
        } else {
            ageSeconds = 0;
        }

        return BookmakerQuote.builder()
                .matchId(row.getMatchId())
                .bookmakerId(bookmakerKey(row))
                .bookmakerName(row.getBookmakerName() != null ? row.getBookmakerName() : row.getBookmakerId())
                .homeOdd(row.getHomeOdd())
                .drawOdd(drawOdd)
                .awayOdd(row.getAwayOdd())
                .marginPercentage(row.getMarginPercentage() != null
                        ? row.getMarginPercentage()
                        : computedMargin(row.getHomeOdd(), drawOdd, row.getAwayOdd(), sportType))
                .scrapedAt(row.getScrapedAt())
                .ageSeconds(ageSeconds)
                .oddsType(OddsType.classify(row.getBookmakerName(), row.getOddsType()))
                .extraData(row.getExtraData() == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(row.getExtraData())))
                .build();
    }

    /**
     * Margin for feeds that do not publish one. A ternary quote without a draw has no full book.
     */
    private static BigDecimal computedMargin(BigDecimal home, BigDecimal draw, BigDecimal away, SportType sportType) {
        if (sportType.isTernary() && draw == null) {
            return null;
        }
        return OddsCalculator.marginPercentage(home, draw, away);
    }

    private static String bookmakerKey(OddsRow row) {
        return row.getBookmakerId() != null ? row.getBookmakerId() : row.getBookmakerName();
    }

    private static boolean isPositive(BigDecimal value) {
        return value != null && value.signum() > 0;
    }

    /**
     * Quotes of one match keyed by bookmaker, keeping only the freshest per house.
     */
    private static final class MatchGroup {
        private final OddsRow first;
        private final SportType sportType;
        private final Map<String, BookmakerQuote> quotes = new LinkedHashMap<>();

        private MatchGroup(OddsRow first) {
            this.first = first;
            this.sportType = first.getSportType() != null ? first.getSportType() : SportType.FOOTBALL;
        }

        /**
         * @return true when an older quote from the same house was replaced
         */
        private boolean offer(BookmakerQuote quote) {
            BookmakerQuote existing = quotes.get(quote.getBookmakerId());
            if (existing == null) {
                quotes.put(quote.getBookmakerId(), quote);
                return false;
            }
            if (isFresher(quote, existing)) {
                quotes.put(quote.getBookmakerId(), quote);
            }
            return true;
        }

        private static boolean isFresher(BookmakerQuote candidate, BookmakerQuote existing) {
            if (existing.getScrapedAt() == null) {
                return true;
            }
            return candidate.getScrapedAt() != null && candidate.getScrapedAt().isAfter(existing.getScrapedAt());
        }

        private MatchSnapshot toSnapshot() {
            List<BookmakerQuote> surviving = new ArrayList<>(quotes.values());
            MatchSnapshot.MatchSnapshotBuilder builder = MatchSnapshot.builder()
                    .matchId(first.getMatchId())
                    .matchDate(first.getMatchDate())
                    .matchStatus(first.getMatchStatus())
                    .sportType(sportType)
                    .homeTeam(first.getHomeTeam())
                    .awayTeam(first.getAwayTeam())
                    .leagueName(first.getLeagueName())
                    .leagueCountry(first.getLeagueCountry())
                    .quotes(surviving)
                    .bestHome(extreme(surviving, Outcome.HOME, true))
                    .worstHome(extreme(surviving, Outcome.HOME, false))
                    .bestAway(extreme(surviving, Outcome.AWAY, true))
                    .worstAway(extreme(surviving, Outcome.AWAY, false));
            if (sportType.isTernary()) {
                builder.bestDraw(extreme(surviving, Outcome.DRAW, true))
                        .worstDraw(extreme(surviving, Outcome.DRAW, false));
            }
            return builder.build();
        }

        private static OutcomePrice extreme(List<BookmakerQuote> quotes, Outcome outcome, boolean best) {
            BookmakerQuote pick = null;
            for (BookmakerQuote quote : quotes) {
                if (!quote.hasOdd(outcome)) {
                    continue;
                }
                if (pick == null) {
                    pick = quote;
                    continue;
                }
                int cmp = quote.odd(outcome).compareTo(pick.odd(outcome));
                if (best ? cmp > 0 : cmp < 0) {
                    pick = quote;
                }
            }
            return pick == null ? null : OutcomePrice.of(outcome, pick);
        }
    }
}

package com.mouse.surebet.detector;

import com.mouse.surebet.config.SurebetProperties.FreebetSettings;
import com.mouse.surebet.enums.FreebetScanMode;
import com.mouse.surebet.enums.OddsType;
import com.mouse.surebet.enums.Outcome;
import com.mouse.surebet.exception.ConfigurationException;
import com.mouse.surebet.model.BookmakerQuote;
import com.mouse.surebet.model.FreebetOpportunity;
import com.mouse.surebet.model.FreebetResult;
import com.mouse.surebet.model.MatchSnapshot;
import com.mouse.surebet.model.OpportunityLeg;
import com.mouse.surebet.model.OutcomePrice;
import com.mouse.surebet.utils.OddsCalculator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Freebet extraction: the free bet goes on one outcome and the remaining outcomes are hedged with
 * real money so that every result pays the same.
 */
@Slf4j
@Component
public class FreebetDetector {

    /**
     * Synchronous calculation for a caller-chosen freebet. Does not touch any feed.
     *
     * @throws ConfigurationException for an outcome the sport does not have, a house that does not
     *                                quote the match, or a match without hedge prices
     */
    public FreebetOpportunity calculate(MatchSnapshot snapshot, String bookmaker, Outcome outcome, BigDecimal value) {
        if (outcome == null) {
            throw new ConfigurationException("Freebet outcome is required");
        }
        if (outcome == Outcome.DRAW && !snapshot.isTernary()) {
            throw new ConfigurationException("Match " + snapshot.getMatchId() + " has no draw outcome");
        }
        BookmakerQuote quote = snapshot.quoteFrom(bookmaker)
                .orElseThrow(() -> new ConfigurationException(
                        "Bookmaker '" + bookmaker + "' has no quote for match " + snapshot.getMatchId()));

        return evaluate(snapshot, quote, outcome, value)
                .orElseThrow(() -> new ConfigurationException(
                        "Match " + snapshot.getMatchId() + " has no price to back or hedge a " + outcome.getKey() + " freebet"));
    }

    /**
     * Scanning mode. In FIXED_HOUSE an opportunity exists when the configured house quotes the match
     * with a positive profit and an extraction of at least {@code minExtraction}; ODDS_TYPE picks its own
     * legs, see {@link #detectByOddsType}.
     */
    public Optional<FreebetOpportunity> detect(MatchSnapshot snapshot, FreebetSettings settings) {
        BigDecimal minExtraction = settings.getMinExtraction() == null ? BigDecimal.ZERO : settings.getMinExtraction();
        Optional<FreebetOpportunity> opportunity = settings.getMode() == FreebetScanMode.ODDS_TYPE
                ? detectByOddsType(snapshot, settings.getValue())
                : detectAtHouse(snapshot, settings);
        return opportunity
                .filter(o -> o.getGuaranteedProfit().signum() > 0)
                .filter(o -> o.getExtractionPercent().compareTo(minExtraction) >= 0);
    }

    private Optional<FreebetOpportunity> detectAtHouse(MatchSnapshot snapshot, FreebetSettings settings) {
        if (settings.getOutcome() == Outcome.DRAW && !snapshot.isTernary()) {
            return Optional.empty();
        }
        Optional<BookmakerQuote> quote = snapshot.quoteFrom(settings.getBookmaker());
        if (quote.isEmpty()) {
            log.trace("{} does not quote match {}", settings.getBookmaker(), snapshot.getMatchId());
            return Optional.empty();
        }
        return evaluate(snapshot, quote.get(), settings.getOutcome(), settings.getValue());
    }

    /**
     * Draw from an SO house (Betbra whenever it prices the draw, otherwise the longest SO draw),
     * home and away from the longest PA prices. The freebet goes on the longer of the two PA legs,
     * away on a tie. Two-outcome sports never qualify.
     */
    Optional<FreebetOpportunity> detectByOddsType(MatchSnapshot snapshot, BigDecimal value) {
        if (!snapshot.isTernary()) {
            return Optional.empty();
        }
        BookmakerQuote draw = bestSoDraw(snapshot.getQuotes());
        BookmakerQuote home = bestPa(snapshot.getQuotes(), Outcome.HOME);
        BookmakerQuote away = bestPa(snapshot.getQuotes(), Outcome.AWAY);
        if (draw == null || home == null || away == null) {
            log.trace("Match {} lacks an SO draw or a PA side | draw={} home={} away={}",
                    snapshot.getMatchId(), draw != null, home != null, away != null);
            return Optional.empty();
        }

        Outcome position = away.getAwayOdd().compareTo(home.getHomeOdd()) >= 0 ? Outcome.AWAY : Outcome.HOME;
        Map<Outcome, OutcomePrice> prices = new EnumMap<>(Outcome.class);
        prices.put(Outcome.HOME, OutcomePrice.of(Outcome.HOME, home));
        prices.put(Outcome.DRAW, OutcomePrice.of(Outcome.DRAW, draw));
        prices.put(Outcome.AWAY, OutcomePrice.of(Outcome.AWAY, away));
        return Optional.of(build(snapshot, position == Outcome.HOME ? home : away, position, value, prices));
    }

    private static BookmakerQuote bestSoDraw(List<BookmakerQuote> quotes) {
        BookmakerQuote pick = null;
        for (BookmakerQuote quote : quotes) {
            if (quote.getOddsType() != OddsType.SO || !quote.hasOdd(Outcome.DRAW)) {
                continue;
            }
            if (pick == null) {
                pick = quote;
                continue;
            }
            boolean preferred = OddsType.isPreferredDrawHouse(quote.getBookmakerName());
            boolean pickPreferred = OddsType.isPreferredDrawHouse(pick.getBookmakerName());
            if (preferred != pickPreferred) {
                if (preferred) {
                    pick = quote;
                }
            } else if (quote.getDrawOdd().compareTo(pick.getDrawOdd()) > 0) {
                pick = quote;
            }
        }
        return pick;
    }

    private static BookmakerQuote bestPa(List<BookmakerQuote> quotes, Outcome outcome) {
        BookmakerQuote pick = null;
        for (BookmakerQuote quote : quotes) {
            if (quote.getOddsType() == OddsType.SO || !quote.hasOdd(outcome)) {
                continue;
            }
            if (pick == null || quote.odd(outcome).compareTo(pick.odd(outcome)) > 0) {
                pick = quote;
            }
        }
        return pick;
    }

    /**
     * Freebet opportunities of the cycle, best extraction first.
     */
    public List<FreebetOpportunity> detectAll(List<MatchSnapshot> snapshots, FreebetSettings settings) {
        return snapshots.stream()
                .map(s -> detect(s, settings))
                .flatMap(Optional::stream)
                .sorted(Comparator.comparing(FreebetOpportunity::getExtractionPercent).reversed()
                        .thenComparing(FreebetOpportunity::getMatchId))
                .toList();
    }

    private Optional<FreebetOpportunity> evaluate(MatchSnapshot snapshot, BookmakerQuote freebetQuote,
                                                  Outcome outcome, BigDecimal value) {
        if (!freebetQuote.hasOdd(outcome)) {
            return Optional.empty();
        }

        Map<Outcome, OutcomePrice> prices = new EnumMap<>(Outcome.class);
        for (Outcome other : Outcome.forSport(snapshot.getSportType())) {
            OutcomePrice price = other == outcome ? OutcomePrice.of(outcome, freebetQuote) : snapshot.best(other);
            if (price == null) {
                return Optional.empty();
            }
            prices.put(other, price);
        }
        return Optional.of(build(snapshot, freebetQuote, outcome, value, prices));
    }

    private FreebetOpportunity build(MatchSnapshot snapshot, BookmakerQuote freebetQuote, Outcome outcome,
                                     BigDecimal value, Map<Outcome, OutcomePrice> prices) {
        FreebetResult result = OddsCalculator.calculateFreebetExtraction(
                prices.get(Outcome.HOME).getOdd(),
                prices.containsKey(Outcome.DRAW) ? prices.get(Outcome.DRAW).getOdd() : null,
                prices.get(Outcome.AWAY).getOdd(),
                value,
                outcome);

        List<OpportunityLeg> legs = new ArrayList<>(prices.size());
        prices.forEach((o, price) -> legs.add(OpportunityLeg.builder()
                .outcome(o)
                .bookmakerId(price.getBookmakerId())
                .bookmakerName(price.getBookmakerName())
                .odd(price.getOdd())
                .stake(result.getStakes().of(o))
                .freebet(o == outcome)
                .extraData(price.getExtraData())
                .build()));

        return FreebetOpportunity.builder()
                .matchId(snapshot.getMatchId())
                .homeTeam(snapshot.getHomeTeam())
                .awayTeam(snapshot.getAwayTeam())
                .leagueName(snapshot.getLeagueName())
                .matchDate(snapshot.getMatchDate())
                .freebetBookmaker(freebetQuote.getBookmakerName())
                .freebetOutcome(outcome)
                .freebetValue(value)
                .legs(List.copyOf(legs))
                .stakes(result.getStakes())
                .totalToInvest(result.getTotalToInvest())
                .guaranteedProfit(result.getGuaranteedProfit())
                .extractionPercent(result.getExtractionPercent())
                .build();
    }
}

package com.mouse.surebet.detector;

import com.mouse.surebet.config.SurebetProperties;
import com.mouse.surebet.enums.Outcome;
import com.mouse.surebet.model.ArbitrageOpportunity;
import com.mouse.surebet.model.MatchSnapshot;
import com.mouse.surebet.model.OpportunityLeg;
import com.mouse.surebet.model.OutcomePrice;
import com.mouse.surebet.utils.OddsCalculator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Finds surebets: matches whose best prices across houses have an arbitrage index strictly below 1.
 * <p>
 * Ternary sports use home, draw and away only while the best draw price is present and non-zero;
 * otherwise the match is evaluated on home and away alone.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ArbitrageDetector {

    private final SurebetProperties properties;

    public Optional<ArbitrageOpportunity> detect(MatchSnapshot snapshot) {
        List<OutcomePrice> prices = legsFor(snapshot);
        if (prices.isEmpty()) {
            log.debug("Match {} has no home/away price, skipping arbitrage check", snapshot.getMatchId());
            return Optional.empty();
        }

        BigDecimal index = OddsCalculator.arbitrageIndex(prices.stream().map(OutcomePrice::getOdd).toList());
        if (index.compareTo(BigDecimal.ONE) >= 0) {
            log.trace("No arbitrage | matchId={} index={}", snapshot.getMatchId(), index);
            return Optional.empty();
        }

        BigDecimal totalStake = properties.getTotalStake();
        List<OpportunityLeg> legs = new ArrayList<>(prices.size());
        for (OutcomePrice price : prices) {
            legs.add(OpportunityLeg.builder()
                    .outcome(price.getOutcome())
                    .bookmakerId(price.getBookmakerId())
                    .bookmakerName(price.getBookmakerName())
                    .odd(price.getOdd())
                    .stake(OddsCalculator.arbitrageStake(totalStake, price.getOdd(), index))
                    .extraData(price.getExtraData())
                    .build());
        }

        ArbitrageOpportunity opportunity = ArbitrageOpportunity.builder()
                .matchId(snapshot.getMatchId())
                .sportType(snapshot.getSportType())
                .homeTeam(snapshot.getHomeTeam())
                .awayTeam(snapshot.getAwayTeam())
                .leagueName(snapshot.getLeagueName())
                .matchDate(snapshot.getMatchDate())
                .legs(List.copyOf(legs))
                .arbitrageIndex(index)
                .roiPercent(OddsCalculator.roiPercent(index))
                .totalStake(totalStake)
                .guaranteedProfit(OddsCalculator.arbitrageProfit(totalStake, index))
                .build();

        log.debug("Arbitrage | matchId={} index={} roi={}%", snapshot.getMatchId(), index, opportunity.getRoiPercent());
        return Optional.of(opportunity);
    }

    /**
     * All surebets of the cycle, best ROI first.
     */
    public List<ArbitrageOpportunity> detectAll(List<MatchSnapshot> snapshots) {
        return snapshots.stream()
                .map(this::detect)
                .flatMap(Optional::stream)
                .sorted(Comparator.comparing(ArbitrageOpportunity::getRoiPercent).reversed()
                        .thenComparing(ArbitrageOpportunity::getMatchId))
                .toList();
    }

    private static List<OutcomePrice> legsFor(MatchSnapshot snapshot) {
        OutcomePrice home = snapshot.best(Outcome.HOME);
        OutcomePrice away = snapshot.best(Outcome.AWAY);
        if (home == null || away == null) {
            return List.of();
        }
        OutcomePrice draw = snapshot.best(Outcome.DRAW);
        if (snapshot.isTernary() && draw != null && OddsCalculator.isPositive(draw.getOdd())) {
            return List.of(home, draw, away);
        }
        return List.of(home, away);
    }
}

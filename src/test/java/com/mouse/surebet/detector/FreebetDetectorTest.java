package com.mouse.surebet.detector;

import com.mouse.surebet.aggregator.OddsAggregator;
import com.mouse.surebet.config.SurebetProperties.FreebetSettings;
import com.mouse.surebet.enums.FreebetScanMode;
import com.mouse.surebet.enums.Outcome;
import com.mouse.surebet.exception.ConfigurationException;
import com.mouse.surebet.model.FreebetOpportunity;
import com.mouse.surebet.model.MatchSnapshot;
import com.mouse.surebet.model.OpportunityLeg;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.mouse.surebet.OddsFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class FreebetDetectorTest {

    private final OddsAggregator aggregator = new OddsAggregator();
    private final FreebetDetector detector = new FreebetDetector();

    private MatchSnapshot footballMatch() {
        return aggregator.aggregate(List.of(
                football("M-1", "Betbra", "1.90", "3.20", "3.00"),
                football("M-1", "Bet365", "2.00", "3.50", "2.80")), NOW).get(0);
    }

    private static FreebetSettings settings(String minExtraction) {
        FreebetSettings settings = new FreebetSettings();
        settings.setEnabled(true);
        settings.setBookmaker("betbra");
        settings.setOutcome(Outcome.AWAY);
        settings.setValue(bd("100"));
        settings.setMinExtraction(bd(minExtraction));
        return settings;
    }

    @Test
    void calculate_freebetAtChosenHouse_hedgesAtBestPrices() {
        FreebetOpportunity result = detector.calculate(footballMatch(), "Betbra", Outcome.AWAY, bd("100"));

        assertThat(result.getFreebetBookmaker()).isEqualTo("Betbra");
        assertThat(result.getStakes().getHome()).isEqualByComparingTo("100");
        assertThat(result.getStakes().getDraw().doubleValue()).isCloseTo(57.14, within(0.01));
        assertThat(result.getGuaranteedProfit().doubleValue()).isCloseTo(42.86, within(0.01));
        assertThat(result.getExtractionPercent().doubleValue()).isCloseTo(42.86, within(0.01));

        assertThat(result.getLegs()).extracting(OpportunityLeg::getOutcome)
                .containsExactly(Outcome.HOME, Outcome.DRAW, Outcome.AWAY);
        assertThat(result.getLegs()).extracting(OpportunityLeg::getBookmakerName)
                .containsExactly("Bet365", "Bet365", "Betbra");
        assertThat(result.getLegs()).filteredOn(OpportunityLeg::isFreebet)
                .singleElement()
                .satisfies(leg -> assertThat(leg.getOdd()).isEqualByComparingTo("3.00"));
    }

    @Test
    void calculate_unknownBookmaker_isConfigurationError() {
        assertThatThrownBy(() -> detector.calculate(footballMatch(), "Pinnacle", Outcome.AWAY, bd("100")))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("Pinnacle");
    }

    @Test
    void calculate_drawOnBasketball_isConfigurationError() {
        MatchSnapshot game = aggregator.aggregate(List.of(basketball("B-1", "Betbra", "1.80", "2.10")), NOW).get(0);

        assertThatThrownBy(() -> detector.calculate(game, "Betbra", Outcome.DRAW, bd("100")))
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void calculate_missingOutcome_isConfigurationError() {
        assertThatThrownBy(() -> detector.calculate(footballMatch(), "Betbra", null, bd("100")))
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void detect_extractionBelowMinimum_isNotAnOpportunity() {
        assertThat(detector.detect(footballMatch(), settings("40"))).isPresent();
        assertThat(detector.detect(footballMatch(), settings("50"))).isEmpty();
    }

    @Test
    void detect_houseNotQuotingMatch_isNotAnOpportunity() {
        MatchSnapshot match = aggregator.aggregate(List.of(football("M-2", "Bet365", "2.00", "3.50", "2.80")), NOW).get(0);

        assertThat(detector.detect(match, settings("0"))).isEmpty();
    }

    @Test
    void detectAll_sortsByExtractionDescending() {
        List<MatchSnapshot> snapshots = aggregator.aggregate(List.of(
                football("M-LOW", "Betbra", "1.90", "3.20", "2.50"),
                football("M-LOW", "Bet365", "2.00", "3.50", "2.40"),
                football("M-HIGH", "Betbra", "1.90", "3.20", "3.00"),
                football("M-HIGH", "Bet365", "2.00", "3.50", "2.80")), NOW);

        assertThat(detector.detectAll(snapshots, settings("0")))
                .extracting(FreebetOpportunity::getMatchId)
                .containsExactly("M-HIGH", "M-LOW");
    }

    private static FreebetSettings oddsTypeSettings() {
        FreebetSettings settings = new FreebetSettings();
        settings.setEnabled(true);
        settings.setMode(FreebetScanMode.ODDS_TYPE);
        settings.setValue(bd("100"));
        return settings;
    }

    @Test
    void detect_oddsTypeMode_soHouseWithBestHomeIsLeftOutOfHedge() {
        MatchSnapshot match = aggregator.aggregate(List.of(
                football("M-1", "Novibet", "2.60", "3.30", "2.50"),
                football("M-1", "Bet365", "2.10", "3.10", "3.00"),
                football("M-1", "Sportingbet", "2.20", "3.00", "2.90"),
                football("M-1", "Betbra", "1.90", "3.40", "2.70")), NOW).get(0);

        FreebetOpportunity result = detector.detect(match, oddsTypeSettings()).orElseThrow();

        assertThat(result.getLegs()).extracting(OpportunityLeg::getBookmakerName)
                .containsExactly("Sportingbet", "Betbra", "Bet365");
        assertThat(result.getFreebetOutcome()).isEqualTo(Outcome.AWAY);
        assertThat(result.getFreebetBookmaker()).isEqualTo("Bet365");
        assertThat(result.getStakes().getHome().doubleValue()).isCloseTo(90.91, within(0.01));
        assertThat(result.getStakes().getDraw().doubleValue()).isCloseTo(58.82, within(0.01));
        assertThat(result.getGuaranteedProfit().doubleValue()).isCloseTo(50.27, within(0.01));
    }

    @Test
    void detect_oddsTypeMode_betbraTakesDrawOverLongerSoDraw() {
        MatchSnapshot match = aggregator.aggregate(List.of(
                football("M-1", "Novibet", "1.80", "3.60", "2.90"),
                football("M-1", "Betbra", "1.85", "3.20", "2.95"),
                football("M-1", "BookA", "2.00", "3.00", "3.10"),
                football("M-1", "BookB", "1.95", "3.05", "3.20")), NOW).get(0);

        FreebetOpportunity result = detector.detect(match, oddsTypeSettings()).orElseThrow();

        OpportunityLeg draw = result.getLegs().get(1);
        assertThat(draw.getOutcome()).isEqualTo(Outcome.DRAW);
        assertThat(draw.getBookmakerName()).isEqualTo("Betbra");
        assertThat(draw.getOdd()).isEqualByComparingTo("3.20");
        assertThat(result.getGuaranteedProfit().doubleValue()).isCloseTo(41.25, within(0.01));
    }

    @Test
    void detect_oddsTypeMode_betbraTaggedPaInStoreStillCountsAsSo() {
        MatchSnapshot match = aggregator.aggregate(List.of(
                football("M-1", "Betbra", "3.90", "3.20", "3.90").toBuilder().oddsType("PA").build(),
                football("M-1", "BookA", "2.00", "3.00", "3.10")), NOW).get(0);

        FreebetOpportunity result = detector.detect(match, oddsTypeSettings()).orElseThrow();

        assertThat(result.getLegs()).extracting(OpportunityLeg::getBookmakerName)
                .containsExactly("BookA", "Betbra", "BookA");
    }

    @Test
    void detect_oddsTypeMode_freebetOnLongerPaSide() {
        MatchSnapshot match = aggregator.aggregate(List.of(
                football("M-1", "Betbra", "3.00", "3.40", "2.00"),
                football("M-1", "BookA", "3.50", "3.10", "2.10")), NOW).get(0);

        FreebetOpportunity result = detector.detect(match, oddsTypeSettings()).orElseThrow();

        assertThat(result.getFreebetOutcome()).isEqualTo(Outcome.HOME);
        assertThat(result.getFreebetBookmaker()).isEqualTo("BookA");
        assertThat(result.getLegs()).filteredOn(OpportunityLeg::isFreebet)
                .singleElement()
                .satisfies(leg -> assertThat(leg.getOdd()).isEqualByComparingTo("3.50"));
    }

    @Test
    void detect_oddsTypeMode_noProfitOrMissingLeg_isNotAnOpportunity() {
        MatchSnapshot noProfit = aggregator.aggregate(List.of(
                football("M-1", "Betbra", "1.40", "2.90", "1.50"),
                football("M-1", "BookA", "1.50", "2.80", "1.60")), NOW).get(0);
        MatchSnapshot noSoHouse = aggregator.aggregate(List.of(
                football("M-2", "BookA", "2.00", "3.50", "3.10"),
                football("M-2", "BookB", "1.95", "3.60", "3.20")), NOW).get(0);
        MatchSnapshot game = aggregator.aggregate(List.of(
                basketball("B-1", "Betbra", "1.80", "2.10"),
                basketball("B-1", "BookA", "1.90", "2.00")), NOW).get(0);

        assertThat(detector.detect(noProfit, oddsTypeSettings())).isEmpty();
        assertThat(detector.detect(noSoHouse, oddsTypeSettings())).isEmpty();
        assertThat(detector.detect(game, oddsTypeSettings())).isEmpty();
    }
}

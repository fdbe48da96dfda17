package com.mouse.surebet.utils;

import com.mouse.surebet.enums.Outcome;
import com.mouse.surebet.exception.ConfigurationException;
import com.mouse.surebet.model.FreebetResult;
import com.mouse.surebet.model.FreebetStakes;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
public final class OddsCalculator {

    // High precision for every division; results are not rounded except the index below.
    public static final MathContext MC = new MathContext(34, RoundingMode.HALF_EVEN);
    // Index is compared against 1 at this scale so that e.g. 3.00/3.00/3.00 is exactly 1.
    public static final int INDEX_SCALE = 10;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private OddsCalculator() {
    }

    /**
     * Arbitrage index: sum of implied probabilities of the given odds.
     * Formula: index = 1/oddA + 1/oddB (+ 1/oddC)
     *
     * @param odds best odd per covered outcome, all strictly positive
     * @return index rounded to {@value #INDEX_SCALE} places (< 1 means guaranteed profit)
     */
    public static BigDecimal arbitrageIndex(List<BigDecimal> odds) {
        if (odds == null || odds.size() < 2) {
            throw new IllegalArgumentException("Arbitrage needs at least two legs");
        }
        BigDecimal sum = BigDecimal.ZERO;
        for (BigDecimal odd : odds) {
            if (odd == null || odd.signum() <= 0) {
                throw new IllegalArgumentException("Invalid odd for arbitrage calculation: " + odd);
            }
            sum = sum.add(impliedProbability(odd), MC);
        }
        BigDecimal index = sum.setScale(INDEX_SCALE, RoundingMode.HALF_EVEN);
        log.trace("Arbitrage index {} from odds {}", index, odds);
        return index;
    }

    public static BigDecimal impliedProbability(BigDecimal odd) {
        return BigDecimal.ONE.divide(odd, MC);
    }

    /**
     * Formula: ROI % = (1 - index) * 100
     */
    public static BigDecimal roiPercent(BigDecimal arbitrageIndex) {
        return BigDecimal.ONE.subtract(arbitrageIndex).multiply(HUNDRED, MC);
    }

    /**
     * Stake on one leg so that every outcome pays the same.
     * Formula: stake = totalStake / (odd * index)
     */
    public static BigDecimal arbitrageStake(BigDecimal totalStake, BigDecimal odd, BigDecimal arbitrageIndex) {
        return totalStake.divide(odd.multiply(arbitrageIndex, MC), MC);
    }

    /**
     * Formula: profit = totalStake / index - totalStake
     */
    public static BigDecimal arbitrageProfit(BigDecimal totalStake, BigDecimal arbitrageIndex) {
        return totalStake.divide(arbitrageIndex, MC).subtract(totalStake, MC);
    }

    /**
     * Hedge a free bet placed on {@code outcome} with real-money bets on the other outcomes so that
     * every result pays the same.
     *
     * <pre>
     * freebetReturn   = value * (freebetOdd - 1)
     * stake(other)    = freebetReturn / otherOdd
     * profit          = freebetReturn - sum(stake(other))
     * extraction %    = profit / value * 100   (0 when value is 0)
     * </pre>
     *
     * @param drawOdd null for two-outcome sports
     * @throws ConfigurationException when the outcome is missing or has no odd to back it
     */
    public static FreebetResult calculateFreebetExtraction(BigDecimal homeOdd, BigDecimal drawOdd, BigDecimal awayOdd,
                                                           BigDecimal freebetValue, Outcome outcome) {
        if (outcome == null) {
            throw new ConfigurationException("Freebet outcome is required");
        }
        if (freebetValue == null || freebetValue.signum() < 0) {
            throw new ConfigurationException("Freebet value must be zero or positive, got " + freebetValue);
        }

        Map<Outcome, BigDecimal> odds = new EnumMap<>(Outcome.class);
        odds.put(Outcome.HOME, homeOdd);
        odds.put(Outcome.AWAY, awayOdd);
        if (drawOdd != null) {
            odds.put(Outcome.DRAW, drawOdd);
        }

        BigDecimal freebetOdd = odds.get(outcome);
        if (!isPositive(freebetOdd)) {
            throw new ConfigurationException("No " + outcome.getKey() + " odd to place the freebet on");
        }

        BigDecimal freebetReturn = freebetValue.multiply(freebetOdd.subtract(BigDecimal.ONE), MC);

        Map<Outcome, BigDecimal> stakes = new LinkedHashMap<>();
        BigDecimal totalOtherStakes = BigDecimal.ZERO;
        for (Map.Entry<Outcome, BigDecimal> entry : odds.entrySet()) {
            if (entry.getKey() == outcome) {
                continue;
            }
            if (!isPositive(entry.getValue())) {
                throw new ConfigurationException("No " + entry.getKey().getKey() + " odd to hedge the freebet with");
            }
            BigDecimal stake = freebetReturn.divide(entry.getValue(), MC);
            stakes.put(entry.getKey(), stake);
            totalOtherStakes = totalOtherStakes.add(stake, MC);
        }
        stakes.put(outcome, freebetValue);

        BigDecimal guaranteedProfit = freebetReturn.subtract(totalOtherStakes, MC);
        BigDecimal extraction = freebetValue.signum() > 0
                ? guaranteedProfit.divide(freebetValue, MC).multiply(HUNDRED, MC)
                : BigDecimal.ZERO;

        log.debug("Freebet {} @ {} value={} -> return={} hedge={} profit={} extraction={}%",
                outcome, freebetOdd, freebetValue, freebetReturn, totalOtherStakes, guaranteedProfit, extraction);

        return FreebetResult.builder()
                .freebetOutcome(outcome)
                .freebetValue(freebetValue)
                .freebetReturn(freebetReturn)
                .stakes(new FreebetStakes(
                        stakes.getOrDefault(Outcome.HOME, BigDecimal.ZERO),
                        stakes.getOrDefault(Outcome.DRAW, BigDecimal.ZERO),
                        stakes.getOrDefault(Outcome.AWAY, BigDecimal.ZERO)))
                .totalToInvest(totalOtherStakes)
                .guaranteedProfit(guaranteedProfit)
                .extractionPercent(extraction)
                .build();
    }

    /**
     * Bookmaker margin of a 1X2 price set in percent, or null when an odd is missing.
     * Formula: margin = (1/home + 1/draw + 1/away - 1) * 100
     */
    public static BigDecimal marginPercentage(BigDecimal homeOdd, BigDecimal drawOdd, BigDecimal awayOdd) {
        if (!isPositive(homeOdd) || !isPositive(awayOdd)) {
            return null;
        }
        BigDecimal sum = impliedProbability(homeOdd).add(impliedProbability(awayOdd), MC);
        if (isPositive(drawOdd)) {
            sum = sum.add(impliedProbability(drawOdd), MC);
        }
        return sum.subtract(BigDecimal.ONE).multiply(HUNDRED, MC).setScale(2, RoundingMode.HALF_UP);
    }

    public static boolean isPositive(BigDecimal value) {
        return value != null && value.signum() > 0;
    }
}

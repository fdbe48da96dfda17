package com.mouse.surebet.notification;

import com.mouse.surebet.enums.OpportunityKind;
import com.mouse.surebet.enums.SportType;
import com.mouse.surebet.model.ArbitrageOpportunity;
import com.mouse.surebet.model.FreebetOpportunity;
import com.mouse.surebet.model.OpportunityLeg;
import com.mouse.surebet.model.OpportunityNotification;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Builds the human-readable text for new opportunities. The dedupe key is the match id.
 */
@Component
public class OpportunityMessageFormatter {

    public OpportunityNotification arbitrage(String engine, ArbitrageOpportunity opportunity) {
        StringBuilder body = new StringBuilder()
                .append(opportunity.getHomeTeam()).append(" vs ").append(opportunity.getAwayTeam());
        if (opportunity.getLeagueName() != null) {
            body.append(" (").append(opportunity.getLeagueName()).append(')');
        }
        body.append("\nROI: ").append(signedPercent(opportunity.getRoiPercent()));
        for (OpportunityLeg leg : opportunity.getLegs()) {
            body.append('\n').append(leg.getOutcome().getKey()).append(" @ ")
                    .append(leg.getOdd().stripTrailingZeros().toPlainString())
                    .append(" - ").append(leg.getBookmakerName())
                    .append(" (stake ").append(money(leg.getStake())).append(')');
        }

        return OpportunityNotification.builder()
                .engine(engine)
                .kind(OpportunityKind.ARBITRAGE)
                .title(icon(opportunity.getSportType()) + " New surebet detected")
                .body(body.toString())
                .dedupeKey(opportunity.getMatchId())
                .build();
    }

    public OpportunityNotification freebet(String engine, SportType sportType, FreebetOpportunity opportunity) {
        StringBuilder body = new StringBuilder()
                .append(opportunity.getHomeTeam()).append(" vs ").append(opportunity.getAwayTeam());
        if (opportunity.getLeagueName() != null) {
            body.append(" (").append(opportunity.getLeagueName()).append(')');
        }
        body.append("\nExtraction: ").append(percent(opportunity.getExtractionPercent()))
                .append(" of ").append(money(opportunity.getFreebetValue()))
                .append(" freebet on ").append(opportunity.getFreebetOutcome().getKey())
                .append(" at ").append(opportunity.getFreebetBookmaker())
                .append("\nProfit: ").append(money(opportunity.getGuaranteedProfit()));

        return OpportunityNotification.builder()
                .engine(engine)
                .kind(OpportunityKind.FREEBET)
                .title(icon(sportType) + " New freebet extraction")
                .body(body.toString())
                .dedupeKey(opportunity.getMatchId())
                .build();
    }

    private static String icon(SportType sportType) {
        return sportType == null ? SportType.FOOTBALL.icon() : sportType.icon();
    }

    private static String signedPercent(BigDecimal value) {
        String text = percent(value);
        return value.signum() > 0 ? "+" + text : text;
    }

    private static String percent(BigDecimal value) {
        return value.setScale(2, RoundingMode.HALF_UP).toPlainString() + "%";
    }

    private static String money(BigDecimal value) {
        return value.setScale(2, RoundingMode.HALF_UP).toPlainString();
    }
}

package com.mouse.surebet.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.mouse.surebet.enums.Outcome;
import com.mouse.surebet.enums.SportType;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * All surviving quotes for one match in one aggregation cycle, with the best and worst price
 * per outcome. Rebuilt every cycle, never stored.
 */
@Value
@Builder(toBuilder = true)
public class MatchSnapshot {
    String matchId;
    Instant matchDate;
    String matchStatus;
    SportType sportType;
    String homeTeam;
    String awayTeam;
    String leagueName;
    String leagueCountry;
    @Singular
    List<BookmakerQuote> quotes;

    OutcomePrice bestHome;
    OutcomePrice bestDraw;
    OutcomePrice bestAway;
    OutcomePrice worstHome;
    OutcomePrice worstDraw;
    OutcomePrice worstAway;

    public OutcomePrice best(Outcome outcome) {
        return switch (outcome) {
            case HOME -> bestHome;
            case DRAW -> bestDraw;
            case AWAY -> bestAway;
        };
    }

    @JsonIgnore
    public boolean isTernary() {
        return sportType != null && sportType.isTernary();
    }

    public Optional<BookmakerQuote> quoteFrom(String bookmakerName) {
        if (bookmakerName == null) {
            return Optional.empty();
        }
        return quotes.stream()
                .filter(q -> bookmakerName.equalsIgnoreCase(q.getBookmakerName())
                        || bookmakerName.equalsIgnoreCase(q.getBookmakerId()))
                .findFirst();
    }
}

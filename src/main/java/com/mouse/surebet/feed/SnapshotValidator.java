package com.mouse.surebet.feed;

import com.mouse.surebet.model.snapshot.OddsSnapshotDocument;
import com.mouse.surebet.model.snapshot.SnapshotMatch;
import com.mouse.surebet.model.snapshot.SnapshotOdds;
import com.mouse.surebet.utils.FeedTimestamps;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Checks that a pre-grouped snapshot agrees with itself before it is used in place of raw rows.
 */
@Component
public class SnapshotValidator {

    /**
     * @return human-readable problems, empty when the document is consistent
     */
    public List<String> validate(OddsSnapshotDocument document) {
        List<String> problems = new ArrayList<>();
        if (document == null || document.getMatches() == null) {
            problems.add("document has no matches array");
            return problems;
        }
        if (document.getMatchesCount() != null && document.getMatchesCount() != document.getMatches().size()) {
            problems.add("matches_count " + document.getMatchesCount() + " != " + document.getMatches().size() + " matches");
        }

        for (SnapshotMatch match : document.getMatches()) {
            if (match == null) {
                problems.add("null match entry");
                continue;
            }
            String id = match.getMatchId();
            if (id == null || id.isBlank()) {
                problems.add("match without match_id");
                continue;
            }
            if (FeedTimestamps.parse(match.getMatchDate()) == null) {
                problems.add(id + ": unparsable match_date '" + match.getMatchDate() + "'");
            }
            if (match.getOdds() == null || match.getOdds().isEmpty()) {
                problems.add(id + ": no odds");
                continue;
            }
            checkExtremes(problems, id, "home", match.getOdds(), SnapshotOdds::getHomeOdd, match.getBestHome(), match.getWorstHome());
            checkExtremes(problems, id, "draw", match.getOdds(), SnapshotOdds::getDrawOdd, match.getBestDraw(), match.getWorstDraw());
            checkExtremes(problems, id, "away", match.getOdds(), SnapshotOdds::getAwayOdd, match.getBestAway(), match.getWorstAway());
        }
        return problems;
    }

    private static void checkExtremes(List<String> problems, String matchId, String outcome, List<SnapshotOdds> odds,
                                      Function<SnapshotOdds, BigDecimal> getter, BigDecimal best, BigDecimal worst) {
        BigDecimal max = BigDecimal.ZERO;
        BigDecimal min = null;
        for (SnapshotOdds entry : odds) {
            BigDecimal odd = entry == null ? null : getter.apply(entry);
            if (odd == null || odd.signum() <= 0) {
                continue;
            }
            if (odd.compareTo(max) > 0) {
                max = odd;
            }
            if (min == null || odd.compareTo(min) < 0) {
                min = odd;
            }
        }
        if (min == null) {
            min = BigDecimal.ZERO;
        }
        if (best != null && best.compareTo(max) != 0) {
            problems.add(matchId + ": best_" + outcome + " " + best + " but highest quote is " + max);
        }
        if (worst != null && worst.compareTo(min) != 0) {
            problems.add(matchId + ": worst_" + outcome + " " + worst + " but lowest quote is " + min);
        }
    }
}

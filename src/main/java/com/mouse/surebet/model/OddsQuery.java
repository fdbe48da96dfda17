package com.mouse.surebet.model;

import com.mouse.surebet.enums.SportType;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Pull filters for the quote store. Null fields do not filter.
 */
@Value
@Builder(toBuilder = true)
public class OddsQuery {
    SportType sportType;
    String leagueName;
    Instant dateFrom;
    Instant dateTo;

    public boolean matches(OddsRow row) {
        if (sportType != null && row.getSportType() != null && row.getSportType() != sportType) {
            return false;
        }
        if (leagueName != null && !leagueName.equals(row.getLeagueName())) {
            return false;
        }
        if (row.getMatchDate() != null) {
            if (dateFrom != null && row.getMatchDate().isBefore(dateFrom)) {
                return false;
            }
            if (dateTo != null && row.getMatchDate().isAfter(dateTo)) {
                return false;
            }
        }
        return true;
    }

    public boolean matches(MatchSnapshot snapshot) {
        if (leagueName != null && !leagueName.equals(snapshot.getLeagueName())) {
            return false;
        }
        if (dateFrom != null && snapshot.getMatchDate().isBefore(dateFrom)) {
            return false;
        }
        return dateTo == null || !snapshot.getMatchDate().isAfter(dateTo);
    }
}

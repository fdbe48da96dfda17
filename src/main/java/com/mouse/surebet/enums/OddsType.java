package com.mouse.surebet.enums;

import java.util.List;
import java.util.Locale;

public enum OddsType {
    SO,     // Super odds, no early payout
    PA;     // Pagamento antecipado (early payout)

    private static final List<String> KNOWN_SO_BOOKMAKERS = List.of("novibet", "betbra", "betnacional");
    private static final String PREFERRED_DRAW_HOUSE = "betbra";

    /**
     * Classify a quote: SO when tagged SO or when the house is a known SO house, PA otherwise.
     * The store defaults odds_type to PA, so a PA tag never overrides a known SO house.
     */
    public static OddsType classify(String bookmakerName, String oddsType) {
        if ("SO".equalsIgnoreCase(oddsType)) {
            return SO;
        }
        String name = normalize(bookmakerName);
        return KNOWN_SO_BOOKMAKERS.stream().anyMatch(name::contains) ? SO : PA;
    }

    /**
     * Whether the house gets first pick for the SO draw leg.
     */
    public static boolean isPreferredDrawHouse(String bookmakerName) {
        return normalize(bookmakerName).contains(PREFERRED_DRAW_HOUSE);
    }

    private static String normalize(String bookmakerName) {
        return bookmakerName == null ? "" : bookmakerName.toLowerCase(Locale.ROOT);
    }
}

package com.mouse.surebet.enums;

/**
 * How the tracked freebet kind picks its legs.
 */
public enum FreebetScanMode {
    /** Freebet on a configured outcome at a configured house, hedged at the best price anywhere. */
    FIXED_HOUSE,
    /** Draw at an SO house (Betbra first), home and away at PA houses, freebet on the longer PA side. */
    ODDS_TYPE
}

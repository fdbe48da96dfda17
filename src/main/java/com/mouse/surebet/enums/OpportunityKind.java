package com.mouse.surebet.enums;

public enum OpportunityKind {
    ARBITRAGE,
    FREEBET
}

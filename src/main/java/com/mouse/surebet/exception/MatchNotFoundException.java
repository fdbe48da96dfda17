package com.mouse.surebet.exception;

public class MatchNotFoundException extends RuntimeException {
    public MatchNotFoundException(String engineName, String matchId) {
        super("Engine '" + engineName + "' has no current snapshot for match '" + matchId + "'");
    }
}

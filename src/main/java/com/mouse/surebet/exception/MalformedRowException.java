package com.mouse.surebet.exception;

import lombok.Getter;

/**
 * A single feed row is missing a required field. Only that row is dropped.
 */
@Getter
public class MalformedRowException extends RuntimeException {

    private final String matchId;
    private final String bookmakerId;

    public MalformedRowException(String matchId, String bookmakerId, String message) {
        super(message);
        this.matchId = matchId;
        this.bookmakerId = bookmakerId;
    }
}

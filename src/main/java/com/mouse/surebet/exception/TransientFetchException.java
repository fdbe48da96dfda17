package com.mouse.surebet.exception;

/**
 * The quote feed could not be read right now. The cycle is skipped and retried on the next trigger.
 */
public class TransientFetchException extends RuntimeException {
    public TransientFetchException() {
        super();
    }

    public TransientFetchException(String message) {
        super(message);
    }

    public TransientFetchException(String message, Throwable e) {
        super(message, e);
    }
}

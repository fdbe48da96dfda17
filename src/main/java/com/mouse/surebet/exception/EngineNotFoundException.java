package com.mouse.surebet.exception;

public class EngineNotFoundException extends RuntimeException {
    public EngineNotFoundException(String engineName) {
        super("No engine named '" + engineName + "'");
    }
}

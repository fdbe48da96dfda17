package com.mouse.surebet.enums;

public enum EngineStatus {
    CREATED,
    RUNNING,
    STOPPED
}

package com.mouse.surebet.enums;

public enum TrackerState {
    UNINITIALIZED,  // no cycle observed yet
    TRACKING
}

package com.mouse.surebet.event;

import lombok.Value;

import java.time.Instant;

/**
 * Push signal: new rows are available in the named feed.
 */
@Value
public class OddsRowsChangedEvent {
    String feedId;
    Instant receivedAt;
}

package com.mouse.surebet.model;

import com.mouse.surebet.enums.OpportunityKind;
import lombok.Builder;
import lombok.Value;

/**
 * Human-readable summary of a newly appeared opportunity. {@code dedupeKey} equals the
 * opportunity key so downstream systems can drop literal duplicates.
 */
@Value
@Builder
public class OpportunityNotification {
    String engine;
    OpportunityKind kind;
    String title;
    String body;
    String dedupeKey;
}

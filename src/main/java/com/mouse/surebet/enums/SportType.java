package com.mouse.surebet.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;
import java.util.Optional;

@Getter
@RequiredArgsConstructor
public enum SportType {
    FOOTBALL("football", true),

    BASKETBALL("basketball", false);

    private final String name;
    /**
     * Whether the sport settles on home/draw/away (ternary) or home/away only.
     */
    private final boolean ternary;

    /**
     * Get SportType from the feed's sport_type column (case-insensitive).
     * Rows without a sport type are football, like the feed's default.
     */
    public static Optional<SportType> fromName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.of(FOOTBALL);
        }

        return Arrays.stream(SportType.values())
                .filter(sport -> sport.getName().equalsIgnoreCase(name.trim()))
                .findFirst();
    }

    public String icon() {
        return this == BASKETBALL ? "🏀" : "⚽";
    }
}

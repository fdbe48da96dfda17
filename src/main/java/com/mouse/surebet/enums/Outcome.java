package com.mouse.surebet.enums;

import com.mouse.surebet.exception.ConfigurationException;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;
import java.util.List;

@Getter
@RequiredArgsConstructor
public enum Outcome {
    HOME("home"),
    DRAW("draw"),
    AWAY("away");

    private final String key;

    /**
     * Resolve an outcome by name or key, e.g. "draw", "DRAW", " Away ".
     *
     * @throws ConfigurationException when the value names no outcome
     */
    public static Outcome fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new ConfigurationException("Outcome must not be blank");
        }
        String trimmed = name.trim();
        return Arrays.stream(values())
                .filter(o -> o.name().equalsIgnoreCase(trimmed) || o.key.equalsIgnoreCase(trimmed))
                .findFirst()
                .orElseThrow(() -> new ConfigurationException("Unknown outcome: " + name));
    }

    /**
     * Outcomes that settle a match of the given sport, in display order.
     */
    public static List<Outcome> forSport(SportType sportType) {
        return sportType.isTernary() ? List.of(HOME, DRAW, AWAY) : List.of(HOME, AWAY);
    }
}

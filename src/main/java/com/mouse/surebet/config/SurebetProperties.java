package com.mouse.surebet.config;

import com.mouse.surebet.enums.FreebetScanMode;
import com.mouse.surebet.enums.Outcome;
import com.mouse.surebet.enums.SportType;
import com.mouse.surebet.exception.ConfigurationException;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

@Data
@ConfigurationProperties(prefix = "surebet")
public class SurebetProperties {

    /**
     * Total real money split across the legs of an arbitrage when reporting stakes.
     */
    private BigDecimal totalStake = BigDecimal.valueOf(100);

    private Snapshot snapshot = new Snapshot();

    private List<EngineSettings> engines = new ArrayList<>();

    private Notifications notifications = new Notifications();

    /**
     * Fail fast on settings an engine cannot run with.
     */
    public void validate() {
        if (totalStake == null || totalStake.signum() <= 0) {
            throw new ConfigurationException("surebet.total-stake must be positive");
        }
        Set<String> names = new HashSet<>();
        for (EngineSettings engine : engines) {
            engine.validate();
            if (!names.add(engine.getName())) {
                throw new ConfigurationException("Duplicate engine name: " + engine.getName());
            }
        }
    }

    @Data
    public static class Snapshot {
        /** Public URL of odds.json. Empty reads the database view only. */
        private String url;
        private Duration timeout = Duration.ofSeconds(5);

        public boolean isEnabled() {
            return url != null && !url.isBlank();
        }
    }

    @Data
    public static class EngineSettings {
        private String name;
        private SportType sport;
        /** Push channel id whose change signals trigger this engine. */
        private String feedId = "odds_history";
        private String league;
        private Duration pollInterval = Duration.ofSeconds(15);
        private Duration debounceWindow = Duration.ofMillis(750);
        private FreebetSettings freebet = new FreebetSettings();

        void validate() {
            if (name == null || name.isBlank()) {
                throw new ConfigurationException("Engine name is required");
            }
            if (sport == null) {
                throw new ConfigurationException("Engine '" + name + "' has no sport");
            }
            if (pollInterval == null || pollInterval.isNegative() || pollInterval.isZero()) {
                throw new ConfigurationException("Engine '" + name + "' needs a positive poll-interval");
            }
            if (debounceWindow == null || debounceWindow.isNegative()) {
                throw new ConfigurationException("Engine '" + name + "' has a negative debounce-window");
            }
            if (freebet != null && freebet.isEnabled()) {
                freebet.validate(name, sport);
            }
        }
    }

    @Data
    public static class FreebetSettings {
        private boolean enabled;
        private FreebetScanMode mode = FreebetScanMode.FIXED_HOUSE;
        /** House holding the free bet. Only read in FIXED_HOUSE mode. */
        private String bookmaker;
        private Outcome outcome = Outcome.DRAW;
        private BigDecimal value = BigDecimal.valueOf(100);
        /** Minimum extraction percent for a match to count as an opportunity. */
        private BigDecimal minExtraction = BigDecimal.ZERO;

        void validate(String engine, SportType sport) {
            if (value == null || value.signum() <= 0) {
                throw new ConfigurationException("Engine '" + engine + "' freebet value must be positive");
            }
            if (mode == FreebetScanMode.ODDS_TYPE) {
                if (!sport.isTernary()) {
                    throw new ConfigurationException("Engine '" + engine + "': " + sport.getName()
                            + " has no draw for an SO draw leg");
                }
                return;
            }
            if (bookmaker == null || bookmaker.isBlank()) {
                throw new ConfigurationException("Engine '" + engine + "' freebet needs a bookmaker");
            }
            if (outcome == null) {
                throw new ConfigurationException("Engine '" + engine + "' freebet needs an outcome");
            }
            if (outcome == Outcome.DRAW && !sport.isTernary()) {
                throw new ConfigurationException("Engine '" + engine + "': " + sport.getName() + " has no draw");
            }
        }
    }

    @Data
    public static class Notifications {
        private Telegram telegram = new Telegram();
    }

    @Data
    public static class Telegram {
        private boolean enabled;
        private String botToken;
        private String chatId;
        private String apiUrl = "https://api.telegram.org";
    }
}

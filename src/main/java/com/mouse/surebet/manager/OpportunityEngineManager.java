package com.mouse.surebet.manager;

import com.mouse.surebet.aggregator.OddsAggregator;
import com.mouse.surebet.config.SurebetProperties;
import com.mouse.surebet.config.SurebetProperties.EngineSettings;
import com.mouse.surebet.detector.ArbitrageDetector;
import com.mouse.surebet.detector.FreebetDetector;
import com.mouse.surebet.enums.Outcome;
import com.mouse.surebet.event.OddsRowsChangedEvent;
import com.mouse.surebet.exception.EngineNotFoundException;
import com.mouse.surebet.exception.MatchNotFoundException;
import com.mouse.surebet.feed.OddsFeed;
import com.mouse.surebet.logservice.OpportunityLogService;
import com.mouse.surebet.model.FreebetOpportunity;
import com.mouse.surebet.model.MatchSnapshot;
import com.mouse.surebet.notification.NotificationSink;
import com.mouse.surebet.notification.OpportunityMessageFormatter;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Owns one {@link OpportunityEngine} per configured engine. Engines never share tracker state.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OpportunityEngineManager {

    private final SurebetProperties properties;
    private final OddsFeed feed;
    private final OddsAggregator aggregator;
    private final ArbitrageDetector arbitrageDetector;
    private final FreebetDetector freebetDetector;
    private final List<NotificationSink> sinks;
    private final OpportunityMessageFormatter formatter;
    private final OpportunityLogService logService;
    private final Clock clock;

    private final Map<String, OpportunityEngine> engines = new LinkedHashMap<>();

    @PostConstruct
    public void init() {
        properties.validate();
        for (EngineSettings settings : properties.getEngines()) {
            engines.put(settings.getName(), OpportunityEngine.builder()
                    .settings(settings)
                    .feed(feed)
                    .aggregator(aggregator)
                    .arbitrageDetector(arbitrageDetector)
                    .freebetDetector(freebetDetector)
                    .sinks(sinks)
                    .formatter(formatter)
                    .logService(logService)
                    .clock(clock)
                    .build());
        }
        log.info("Configured {} engine(s) {} reading from {} feed | sinks={}",
                engines.size(), engines.keySet(), feed.name(), sinks.size());
    }

    @EventListener(ApplicationReadyEvent.class)
    public void startAll() {
        engines.values().forEach(OpportunityEngine::start);
    }

    @PreDestroy
    public void stopAll() {
        engines.values().forEach(OpportunityEngine::stop);
    }

    /**
     * Route a push signal to every engine listening on its feed id.
     */
    @EventListener
    public void onOddsRowsChanged(OddsRowsChangedEvent event) {
        int routed = 0;
        for (OpportunityEngine engine : engines.values()) {
            if (engine.getSettings().getFeedId().equals(event.getFeedId())) {
                engine.onPushSignal();
                routed++;
            }
        }
        if (routed == 0) {
            log.debug("No engine listens on feed '{}'", event.getFeedId());
        }
    }

    public Collection<OpportunityEngine> getEngines() {
        return Collections.unmodifiableCollection(engines.values());
    }

    public OpportunityEngine getEngine(String name) {
        OpportunityEngine engine = engines.get(name);
        if (engine == null) {
            throw new EngineNotFoundException(name);
        }
        return engine;
    }

    /**
     * Freebet numbers for a match of the engine's latest cycle. No feed call is made.
     */
    public FreebetOpportunity calculateFreebet(String engineName, String matchId, String bookmaker,
                                               Outcome outcome, BigDecimal value) {
        OpportunityEngine engine = getEngine(engineName);
        MatchSnapshot snapshot = engine.getLastReport()
                .flatMap(report -> report.getSnapshots().stream()
                        .filter(s -> s.getMatchId().equals(matchId))
                        .findFirst())
                .orElseThrow(() -> new MatchNotFoundException(engineName, matchId));
        return freebetDetector.calculate(snapshot, bookmaker, outcome, value);
    }
}

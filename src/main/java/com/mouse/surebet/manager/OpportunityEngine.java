package com.mouse.surebet.manager;

import com.mouse.surebet.aggregator.OddsAggregator;
import com.mouse.surebet.config.SurebetProperties.EngineSettings;
import com.mouse.surebet.detector.ArbitrageDetector;
import com.mouse.surebet.detector.FreebetDetector;
import com.mouse.surebet.enums.EngineStatus;
import com.mouse.surebet.enums.OpportunityKind;
import com.mouse.surebet.enums.TrackerState;
import com.mouse.surebet.exception.TransientFetchException;
import com.mouse.surebet.feed.OddsFeed;
import com.mouse.surebet.logservice.OpportunityLogService;
import com.mouse.surebet.model.ArbitrageOpportunity;
import com.mouse.surebet.model.FreebetOpportunity;
import com.mouse.surebet.model.MatchSnapshot;
import com.mouse.surebet.model.OddsQuery;
import com.mouse.surebet.model.OddsRow;
import com.mouse.surebet.model.OpportunityNotification;
import com.mouse.surebet.notification.NotificationSink;
import com.mouse.surebet.notification.OpportunityMessageFormatter;
import com.mouse.surebet.tracker.ChangeSet;
import com.mouse.surebet.tracker.ChangeTracker;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * One update pipeline: fetch, aggregate, detect and diff, then notify what is new.
 * <p>
 * Cycles run on a single thread. A trigger arriving while a cycle is in flight queues exactly one
 * more run and any further triggers fold into it. Push signals are debounced; a fixed-delay timer
 * caps latency when pushes stop arriving.
 * <p>
 * Tracker state moves only when a cycle gets all the way to the diff. A failed fetch or a stop
 * before that point leaves the remembered keys as they were.
 */
@Slf4j
public class OpportunityEngine {

    private final EngineSettings settings;
    private final OddsFeed feed;
    private final OddsAggregator aggregator;
    private final ArbitrageDetector arbitrageDetector;
    private final FreebetDetector freebetDetector;
    private final List<NotificationSink> sinks;
    private final OpportunityMessageFormatter formatter;
    private final OpportunityLogService logService;
    private final Clock clock;

    private final ChangeTracker<String> arbitrageTracker;
    private final ChangeTracker<String> freebetTracker;

    private ScheduledExecutorService scheduler;
    private ExecutorService cycleExecutor;
    private ScheduledFuture<?> fallbackTimer;
    private final Object cycleLock = new Object();

    private final AtomicBoolean cycleQueued = new AtomicBoolean(false);
    private final AtomicBoolean debouncePending = new AtomicBoolean(false);
    private final AtomicLong sequence = new AtomicLong();

    private volatile EngineStatus status = EngineStatus.CREATED;
    private volatile CycleReport lastReport;
    private volatile Instant lastFailureAt;
    private volatile String lastFailure;

    @Builder
    public OpportunityEngine(EngineSettings settings, OddsFeed feed, OddsAggregator aggregator,
                             ArbitrageDetector arbitrageDetector, FreebetDetector freebetDetector,
                             List<NotificationSink> sinks, OpportunityMessageFormatter formatter,
                             OpportunityLogService logService, Clock clock) {
        this.settings = settings;
        this.feed = feed;
        this.aggregator = aggregator;
        this.arbitrageDetector = arbitrageDetector;
        this.freebetDetector = freebetDetector;
        this.sinks = sinks == null ? List.of() : List.copyOf(sinks);
        this.formatter = formatter;
        this.logService = logService;
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.arbitrageTracker = new ChangeTracker<>(settings.getName() + "/" + OpportunityKind.ARBITRAGE);
        this.freebetTracker = new ChangeTracker<>(settings.getName() + "/" + OpportunityKind.FREEBET);
    }

    public String getName() {
        return settings.getName();
    }

    public EngineSettings getSettings() {
        return settings;
    }

    public EngineStatus getStatus() {
        return status;
    }

    public Optional<CycleReport> getLastReport() {
        return Optional.ofNullable(lastReport);
    }

    public Optional<Instant> getLastFailureAt() {
        return Optional.ofNullable(lastFailureAt);
    }

    public Optional<String> getLastFailure() {
        return Optional.ofNullable(lastFailure);
    }

    public TrackerState getTrackerState(OpportunityKind kind) {
        return tracker(kind).getState();
    }

    public Set<String> getTrackedKeys(OpportunityKind kind) {
        return tracker(kind).getPrevious();
    }

    // ==================== LIFECYCLE ====================

    public synchronized void start() {
        if (status != EngineStatus.CREATED) {
            log.warn("Engine {} cannot start from {}", getName(), status);
            return;
        }
        cycleExecutor = Executors.newSingleThreadExecutor(r -> new Thread(r, "engine-" + getName() + "-cycle"));
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "engine-" + getName() + "-timer");
            thread.setDaemon(true);
            return thread;
        });
        status = EngineStatus.RUNNING;

        long pollMs = settings.getPollInterval().toMillis();
        fallbackTimer = scheduler.scheduleWithFixedDelay(this::requestCycle, pollMs, pollMs, TimeUnit.MILLISECONDS);
        requestCycle();

        log.info("✅ Engine {} started | sport={} feed={} poll={}ms debounce={}ms freebet={}",
                getName(), settings.getSport(), settings.getFeedId(), pollMs,
                settings.getDebounceWindow().toMillis(), isFreebetTracked());
    }

    /**
     * Abandons an in-flight fetch. Trackers are never advanced after this returns.
     */
    public synchronized void stop() {
        if (status != EngineStatus.RUNNING) {
            status = EngineStatus.STOPPED;
            return;
        }
        log.info("Stopping engine {}...", getName());
        status = EngineStatus.STOPPED;

        if (fallbackTimer != null) {
            fallbackTimer.cancel(false);
        }
        scheduler.shutdownNow();
        // interrupts a blocked fetch and drops the queued run
        cycleExecutor.shutdownNow();
        try {
            if (!cycleExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                cycleExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            cycleExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Engine {} stopped", getName());
    }

    // ==================== TRIGGERS ====================

    /**
     * Push signal from the feed. Signals inside the debounce window collapse into one cycle.
     */
    public void onPushSignal() {
        if (status != EngineStatus.RUNNING) {
            return;
        }
        long windowMs = settings.getDebounceWindow().toMillis();
        if (windowMs == 0) {
            requestCycle();
            return;
        }
        if (debouncePending.compareAndSet(false, true)) {
            try {
                scheduler.schedule(() -> {
                    debouncePending.set(false);
                    requestCycle();
                }, windowMs, TimeUnit.MILLISECONDS);
            } catch (RejectedExecutionException e) {
                debouncePending.set(false);
                log.debug("Engine {} is shutting down, push signal dropped", getName());
            }
        } else {
            log.trace("Engine {} push signal folded into pending debounce", getName());
        }
    }

    /**
     * Queue a cycle unless one is already queued.
     *
     * @return false when the request was folded into an already queued run or the engine is not running
     */
    public boolean requestCycle() {
        if (status != EngineStatus.RUNNING) {
            return false;
        }
        if (!cycleQueued.compareAndSet(false, true)) {
            log.trace("Engine {} cycle already queued", getName());
            return false;
        }
        try {
            cycleExecutor.execute(() -> {
                cycleQueued.set(false);
                runCycleSafely();
            });
        } catch (RejectedExecutionException e) {
            cycleQueued.set(false);
            log.debug("Engine {} is shutting down, cycle request dropped", getName());
            return false;
        }
        return true;
    }

    private void runCycleSafely() {
        try {
            runCycle();
        } catch (TransientFetchException e) {
            recordFailure(e);
            logService.logFetchFailed(getName(), e);
        } catch (Exception e) {
            recordFailure(e);
            logService.logError("Cycle failed for engine " + getName(), e);
        }
    }

    private void recordFailure(Exception e) {
        lastFailureAt = clock.instant();
        lastFailure = e.getMessage();
    }

    // ==================== CYCLE ====================

    /**
     * Run one cycle on the calling thread.
     *
     * @return the report, or empty when the engine was stopped before the trackers could advance
     * @throws TransientFetchException when the feed could not be read; trackers are left untouched
     */
    public Optional<CycleReport> runCycle() {
        synchronized (cycleLock) {
            return cycle();
        }
    }

    private Optional<CycleReport> cycle() {
        if (status == EngineStatus.STOPPED) {
            return Optional.empty();
        }
        Instant startedAt = clock.instant();

        List<OddsRow> rows = feed.fetch(query());
        if (status == EngineStatus.STOPPED || Thread.currentThread().isInterrupted()) {
            log.debug("Engine {} stopped during fetch, discarding {} rows", getName(), rows.size());
            return Optional.empty();
        }

        List<MatchSnapshot> snapshots = aggregator.aggregate(rows, clock.instant());
        List<ArbitrageOpportunity> arbitrages = arbitrageDetector.detectAll(snapshots);
        List<FreebetOpportunity> freebets = isFreebetTracked()
                ? freebetDetector.detectAll(snapshots, settings.getFreebet())
                : List.of();

        Map<String, ArbitrageOpportunity> arbsByKey = new LinkedHashMap<>();
        arbitrages.forEach(a -> arbsByKey.putIfAbsent(a.getMatchId(), a));
        Map<String, FreebetOpportunity> freebetsByKey = new LinkedHashMap<>();
        freebets.forEach(f -> freebetsByKey.putIfAbsent(f.getMatchId(), f));

        if (status == EngineStatus.STOPPED) {
            return Optional.empty();
        }

        boolean coldStart = arbitrageTracker.getState() == TrackerState.UNINITIALIZED;
        ChangeSet<String> arbChanges = arbitrageTracker.advance(new LinkedHashSet<>(arbsByKey.keySet()));
        ChangeSet<String> freebetChanges = freebetTracker.advance(new LinkedHashSet<>(freebetsByKey.keySet()));

        CycleReport report = CycleReport.builder()
                .engine(getName())
                .sequence(sequence.incrementAndGet())
                .startedAt(startedAt)
                .completedAt(clock.instant())
                .rowCount(rows.size())
                .coldStart(coldStart)
                .snapshots(snapshots)
                .arbitrages(arbitrages)
                .freebets(freebets)
                .arbitrageChanges(arbChanges)
                .freebetChanges(freebetChanges)
                .build();
        lastReport = report;

        if (coldStart) {
            logService.logColdStart(getName(), arbsByKey.size(), freebetsByKey.size());
        }
        for (String key : arbChanges.getAdded()) {
            ArbitrageOpportunity arb = arbsByKey.get(key);
            logService.logArb(getName(), arb);
            notifySinks(formatter.arbitrage(getName(), arb));
        }
        for (String key : freebetChanges.getAdded()) {
            FreebetOpportunity freebet = freebetsByKey.get(key);
            logService.logFreebet(getName(), freebet);
            notifySinks(formatter.freebet(getName(), settings.getSport(), freebet));
        }
        logService.logGone(getName(), OpportunityKind.ARBITRAGE, arbChanges.getRemoved());
        logService.logGone(getName(), OpportunityKind.FREEBET, freebetChanges.getRemoved());
        logService.logCycle(report);
        return Optional.of(report);
    }

    private void notifySinks(OpportunityNotification notification) {
        for (NotificationSink sink : sinks) {
            try {
                sink.send(notification);
            } catch (Exception e) {
                logService.logNotifyFailed(getName(), notification.getDedupeKey(), e);
            }
        }
    }

    private OddsQuery query() {
        return OddsQuery.builder()
                .sportType(settings.getSport())
                .leagueName(settings.getLeague())
                .build();
    }

    private boolean isFreebetTracked() {
        return settings.getFreebet() != null && settings.getFreebet().isEnabled();
    }

    private ChangeTracker<String> tracker(OpportunityKind kind) {
        return kind == OpportunityKind.FREEBET ? freebetTracker : arbitrageTracker;
    }
}

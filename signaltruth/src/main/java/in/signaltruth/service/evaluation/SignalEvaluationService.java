package in.signaltruth.service.evaluation;

import in.signaltruth.application.monitoring.AlertService;
import in.signaltruth.application.port.output.MarketDataProvider;
import in.signaltruth.application.service.TrackerRegistry;
import in.signaltruth.domain.common.LogResult;
import in.signaltruth.domain.market.MarketQuote;
import in.signaltruth.domain.outcome.Result;
import in.signaltruth.domain.signal.SignalTracker;
import in.signaltruth.infrastructure.metrics.TrackerMetrics;
import in.signaltruth.service.config.AutoCloseConfigService;
import in.signaltruth.service.truth.TruthLogWriteException;
import in.signaltruth.service.truth.TruthLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * One evaluation pass over every active tracker.
 *
 * FLOW PER TICK:
 * 1. Retry results whose previous write failed
 * 2. Take one quote snapshot and one auto-close reading for the whole tick
 * 3. For each active tracker (via {@link TrackerRegistry#forEachActive}): apply
 *    {@link OutcomePolicy}; on a terminal outcome resolve it in the registry first,
 *    then append it to the truth log
 *
 * Only the evaluation thread calls {@link #tick()}. The pending queue is concurrent because
 * the health endpoint reads its size.
 */
public final class SignalEvaluationService {
    private static final Logger log = LoggerFactory.getLogger(SignalEvaluationService.class);

    private final TrackerRegistry registry;
    private final MarketDataProvider marketData;
    private final AutoCloseConfigService autoCloseConfig;
    private final OutcomePolicy policy;
    private final TruthLogger truthLogger;
    private final AlertService alertService;
    private final TrackerMetrics metrics;
    private final Clock clock;
    private final Duration staleFeedThreshold;

    private final Queue<Result> pendingWrites = new ConcurrentLinkedQueue<>();
    private boolean feedStale = false;
    private volatile long totalLogged = 0;
    private volatile Instant lastTickAt;

    public SignalEvaluationService(
            TrackerRegistry registry,
            MarketDataProvider marketData,
            AutoCloseConfigService autoCloseConfig,
            OutcomePolicy policy,
            TruthLogger truthLogger,
            AlertService alertService,
            TrackerMetrics metrics,
            Clock clock,
            Duration staleFeedThreshold) {
        this.registry = registry;
        this.marketData = marketData;
        this.autoCloseConfig = autoCloseConfig;
        this.policy = policy;
        this.truthLogger = truthLogger;
        this.alertService = alertService;
        this.metrics = metrics;
        this.clock = clock;
        this.staleFeedThreshold = staleFeedThreshold;
    }

    public void tick() {
        long startNanos = System.nanoTime();
        retryPendingWrites();

        if (registry.stats().activeCount() == 0) {
            lastTickAt = clock.instant();
            metrics.updateActiveTrackers(0);
            return;
        }

        Map<String, MarketQuote> quotes = marketData.fetchQuotes();
        long autoCloseSeconds = autoCloseConfig.autoCloseSeconds();
        Instant now = clock.instant();
        checkFeedFreshness(now);

        registry.forEachActive(tracker -> {
            try {
                evaluate(tracker, quotes.get(tracker.symbol()), now, autoCloseSeconds);
            } catch (RuntimeException e) {
                log.error("[EVAL] Error evaluating {}: {}", tracker.id(), e.getMessage(), e);
            }
        });

        lastTickAt = now;
        metrics.updateActiveTrackers(registry.stats().activeCount());
        metrics.recordEvaluationTick(Duration.ofNanos(System.nanoTime() - startNanos));
    }

    private void evaluate(SignalTracker tracker, MarketQuote quote, Instant now, long autoCloseSeconds) {
        if (quote == null) {
            log.debug("[EVAL] No market data for {} ({})", tracker.symbol(), tracker.id());
        }
        Optional<Result> outcome = policy.evaluate(tracker, quote, now, autoCloseSeconds);
        if (outcome.isEmpty()) {
            return;
        }
        Result result = outcome.get();
        if (!registry.resolve(tracker.id(), result)) {
            return;
        }
        persist(result);
    }

    private void persist(Result result) {
        SignalTracker tracker = result.tracker();
        try {
            LogResult logged = truthLogger.log(result);
            if (logged.isLogged()) {
                totalLogged++;
                metrics.recordResolved(result.outcome(), tracker.unitSystem());
                return;
            }
            // Provenance changed between admission and logging; drop it
            metrics.recordResultRejected(tracker.unitSystem());
            alertService.sendCriticalAlert("TRUTH_LOG_PROVENANCE_REJECTED",
                "Result dropped, provenance failed re-validation: " + logged.reason(), tracker.id());
        } catch (TruthLogWriteException e) {
            pendingWrites.add(result);
            metrics.recordTruthLogFailure(tracker.unitSystem());
            alertService.sendCriticalAlert("TRUTH_LOG_WRITE_FAILED",
                e.getMessage() + " (pending=" + pendingWrites.size() + ")", tracker.id());
        }
    }

    private void retryPendingWrites() {
        if (pendingWrites.isEmpty()) {
            return;
        }
        List<Result> retry = new ArrayList<>();
        Result next;
        while ((next = pendingWrites.poll()) != null) {
            retry.add(next);
        }
        log.info("[EVAL] Retrying {} pending truth log writes", retry.size());
        for (Result result : retry) {
            persist(result);
        }
    }

    /**
     * Last write attempt for results still pending when the daemon stops.
     * Whatever fails again is named in one CRITICAL alert, since the queue dies with the process.
     *
     * @return ids of results that never reached the truth log
     */
    public List<String> flushPendingWrites() {
        retryPendingWrites();
        List<String> unwritten = new ArrayList<>();
        for (Result result : pendingWrites) {
            unwritten.add(result.tracker().id());
        }
        if (!unwritten.isEmpty()) {
            alertService.sendCriticalAlert("TRUTH_LOG_UNFLUSHED_AT_SHUTDOWN",
                unwritten.size() + " results lost at shutdown, ids: " + String.join(", ", unwritten), null);
        }
        return unwritten;
    }

    private void checkFeedFreshness(Instant now) {
        Instant last = marketData.lastSuccessfulFetch();
        boolean stale = last == null || Duration.between(last, now).compareTo(staleFeedThreshold) > 0;
        if (stale && !feedStale) {
            alertService.sendHighAlert("MARKET_DATA_STALE",
                "No fresh market data since " + (last == null ? "startup" : last)
                    + " with " + registry.stats().activeCount() + " active trackers");
        } else if (!stale && feedStale) {
            log.info("[EVAL] Market data recovered, last fetch {}", last);
        }
        feedStale = stale;
    }

    public int pendingWriteCount() {
        return pendingWrites.size();
    }

    public long totalLogged() {
        return totalLogged;
    }

    public Instant lastTickAt() {
        return lastTickAt;
    }
}

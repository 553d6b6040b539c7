package in.signaltruth.service;

import in.signaltruth.application.port.output.MarketDataProvider;
import in.signaltruth.application.service.TrackerRegistry;
import in.signaltruth.application.service.TrackerRegistry.RegistryStats;
import in.signaltruth.service.evaluation.SignalEvaluationService;
import in.signaltruth.service.ingestion.SignalIngestionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Truth Tracker Daemon - runs ingestion and evaluation concurrently.
 *
 * THREADS:
 * - truth-ingest: one scan immediately, then every ingest interval
 * - truth-evaluate: every eval interval
 * - truth-status: status line every 30 seconds
 *
 * All three are fixed-delay, so a slow iteration never overlaps the next one.
 * {@link #stop()} lets in-flight iterations finish, then makes one last attempt at any
 * truth log writes still pending before returning.
 */
public final class TruthTrackerDaemon {
    private static final Logger log = LoggerFactory.getLogger(TruthTrackerDaemon.class);

    static final Duration STATUS_INTERVAL = Duration.ofSeconds(30);
    private static final long TERMINATION_WAIT_SECONDS = 10;

    private final SignalIngestionService ingestion;
    private final SignalEvaluationService evaluation;
    private final TrackerRegistry registry;
    private final MarketDataProvider marketData;
    private final Duration ingestInterval;
    private final Duration evalInterval;
    private final Clock clock;

    private volatile boolean running = false;
    private volatile Instant startedAt;
    private ScheduledExecutorService ingestExecutor;
    private ScheduledExecutorService evalExecutor;
    private ScheduledExecutorService statusExecutor;

    public TruthTrackerDaemon(
            SignalIngestionService ingestion,
            SignalEvaluationService evaluation,
            TrackerRegistry registry,
            MarketDataProvider marketData,
            Duration ingestInterval,
            Duration evalInterval,
            Clock clock) {
        this.ingestion = ingestion;
        this.evaluation = evaluation;
        this.registry = registry;
        this.marketData = marketData;
        this.ingestInterval = ingestInterval;
        this.evalInterval = evalInterval;
        this.clock = clock;
    }

    public synchronized void start() {
        if (running) {
            log.warn("[DAEMON] Already running");
            return;
        }
        running = true;
        startedAt = clock.instant();

        ingestExecutor = newSingleThread("truth-ingest");
        evalExecutor = newSingleThread("truth-evaluate");
        statusExecutor = newSingleThread("truth-status");

        ingestExecutor.scheduleWithFixedDelay(this::runIngestion,
            0, ingestInterval.toMillis(), TimeUnit.MILLISECONDS);
        evalExecutor.scheduleWithFixedDelay(this::runEvaluation,
            evalInterval.toMillis(), evalInterval.toMillis(), TimeUnit.MILLISECONDS);
        statusExecutor.scheduleWithFixedDelay(this::logStatus,
            STATUS_INTERVAL.toMillis(), STATUS_INTERVAL.toMillis(), TimeUnit.MILLISECONDS);

        log.info("[DAEMON] Truth tracker started: ingest every {}ms, evaluate every {}ms",
            ingestInterval.toMillis(), evalInterval.toMillis());
    }

    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        log.info("[DAEMON] Stopping truth tracker...");
        for (ScheduledExecutorService executor : List.of(ingestExecutor, evalExecutor, statusExecutor)) {
            executor.shutdown();
        }
        for (ScheduledExecutorService executor : List.of(ingestExecutor, evalExecutor, statusExecutor)) {
            try {
                if (!executor.awaitTermination(TERMINATION_WAIT_SECONDS, TimeUnit.SECONDS)) {
                    log.warn("[DAEMON] Executor did not terminate in {}s, forcing", TERMINATION_WAIT_SECONDS);
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                executor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        List<String> unwritten = evaluation.flushPendingWrites();
        RegistryStats stats = registry.stats();
        log.info("[DAEMON] Truth tracker stopped: {} active, {} completed, {} results not written",
            stats.activeCount(), stats.processedCount(), unwritten.size());
    }

    public boolean isRunning() {
        return running;
    }

    public DaemonStatus status() {
        RegistryStats stats = registry.stats();
        Instant lastFetch = marketData.lastSuccessfulFetch();
        Long feedAgeSeconds = lastFetch == null ? null : Duration.between(lastFetch, clock.instant()).getSeconds();
        return new DaemonStatus(
            running,
            startedAt,
            stats.activeCount(),
            stats.processedCount(),
            evaluation.pendingWriteCount(),
            evaluation.totalLogged(),
            evaluation.lastTickAt(),
            feedAgeSeconds
        );
    }

    private void runIngestion() {
        if (!running) {
            return;
        }
        try {
            ingestion.scanOnce();
        } catch (Exception e) {
            log.error("[INGEST] Error in ingestion loop: {}", e.getMessage(), e);
        }
    }

    private void runEvaluation() {
        if (!running) {
            return;
        }
        try {
            evaluation.tick();
        } catch (Exception e) {
            log.error("[EVAL] Error in evaluation loop: {}", e.getMessage(), e);
        }
    }

    private void logStatus() {
        if (!running) {
            return;
        }
        DaemonStatus status = status();
        log.info("[DAEMON] Status: {} active, {} completed, {} pending writes, market data age {}",
            status.activeSignals(), status.processedSignals(), status.pendingWrites(),
            status.marketDataAgeSeconds() == null ? "n/a" : status.marketDataAgeSeconds() + "s");
    }

    private static ScheduledExecutorService newSingleThread(String name) {
        return Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, name);
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Point-in-time daemon status for the status log and the health endpoint.
     */
    public record DaemonStatus(
        boolean running,
        Instant startedAt,
        int activeSignals,
        int processedSignals,
        int pendingWrites,
        long resultsLogged,
        Instant lastEvaluationAt,
        Long marketDataAgeSeconds
    ) {}
}

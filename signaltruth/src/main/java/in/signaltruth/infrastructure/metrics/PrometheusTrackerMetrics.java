package in.signaltruth.infrastructure.metrics;

import in.signaltruth.domain.outcome.Outcome;
import in.signaltruth.domain.signal.UnitSystem;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Prometheus implementation of TrackerMetrics.
 *
 * Key Metrics:
 * - truth_signals_admitted_total{unit_system}
 * - truth_signals_rejected_total{reason}
 * - truth_results_total{outcome, unit_system}
 * - truth_results_rejected_total{unit_system}
 * - truth_active_trackers
 * - truth_market_data_failures_total{cause}
 * - truth_log_write_failures_total{unit_system}
 * - truth_evaluation_tick_seconds
 */
public class PrometheusTrackerMetrics implements TrackerMetrics {
    private static final Logger log = LoggerFactory.getLogger(PrometheusTrackerMetrics.class);

    private final CollectorRegistry registry;

    private final Counter admittedCounter;
    private final Counter rejectedCounter;
    private final Counter resultCounter;
    private final Counter resultRejectedCounter;
    private final Gauge activeTrackers;
    private final Counter marketDataFailureCounter;
    private final Counter truthLogFailureCounter;
    private final Histogram evaluationTick;

    public PrometheusTrackerMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusTrackerMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.admittedCounter = Counter.build()
            .name("truth_signals_admitted_total")
            .help("Signals admitted for tracking")
            .labelNames("unit_system")
            .register(registry);

        this.rejectedCounter = Counter.build()
            .name("truth_signals_rejected_total")
            .help("Signal declarations refused at ingestion")
            .labelNames("reason")
            .register(registry);

        this.resultCounter = Counter.build()
            .name("truth_results_total")
            .help("Resolved signals written to the truth log")
            .labelNames("outcome", "unit_system")
            .register(registry);

        this.resultRejectedCounter = Counter.build()
            .name("truth_results_rejected_total")
            .help("Resolved signals refused by the truth log provenance check")
            .labelNames("unit_system")
            .register(registry);

        this.activeTrackers = Gauge.build()
            .name("truth_active_trackers")
            .help("Signals currently being tracked")
            .register(registry);

        this.marketDataFailureCounter = Counter.build()
            .name("truth_market_data_failures_total")
            .help("Market data polls that did not produce a fresh snapshot")
            .labelNames("cause")
            .register(registry);

        this.truthLogFailureCounter = Counter.build()
            .name("truth_log_write_failures_total")
            .help("Truth log appends that failed")
            .labelNames("unit_system")
            .register(registry);

        this.evaluationTick = Histogram.build()
            .name("truth_evaluation_tick_seconds")
            .help("Duration of one evaluation pass")
            .buckets(0.005, 0.01, 0.05, 0.1, 0.5, 1.0, 5.0)
            .register(registry);

        log.info("[PrometheusTrackerMetrics] Initialized");
    }

    @Override
    public void recordAdmitted(UnitSystem unitSystem) {
        admittedCounter.labels(unitSystem.code()).inc();
    }

    @Override
    public void recordRejected(String reason) {
        rejectedCounter.labels(reason).inc();
    }

    @Override
    public void recordResolved(Outcome outcome, UnitSystem unitSystem) {
        resultCounter.labels(outcome.name(), unitSystem.code()).inc();
    }

    @Override
    public void recordResultRejected(UnitSystem unitSystem) {
        resultRejectedCounter.labels(unitSystem.code()).inc();
    }

    @Override
    public void recordMarketDataFailure(String cause) {
        marketDataFailureCounter.labels(cause).inc();
    }

    @Override
    public void recordTruthLogFailure(UnitSystem unitSystem) {
        truthLogFailureCounter.labels(unitSystem.code()).inc();
    }

    @Override
    public void recordEvaluationTick(Duration duration) {
        evaluationTick.observe(duration.toNanos() / 1_000_000_000.0);
    }

    @Override
    public void updateActiveTrackers(int count) {
        activeTrackers.set(count);
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }
}

package in.signaltruth.infrastructure.metrics;

import in.signaltruth.domain.outcome.Outcome;
import in.signaltruth.domain.signal.UnitSystem;

import java.time.Duration;

/**
 * Tracker metrics interface for monitoring and alerting.
 *
 * Key metrics:
 * - Admissions and rejections by reason
 * - Resolutions by outcome and unit system
 * - Results refused by the truth log
 * - Active tracker count
 * - Market data fetch failures
 * - Truth log write failures
 * - Evaluation tick duration
 */
public interface TrackerMetrics {

    /**
     * Record a declaration admitted into the registry.
     *
     * @param unitSystem Unit system of the signal
     */
    void recordAdmitted(UnitSystem unitSystem);

    /**
     * Record a declaration refused at ingestion.
     *
     * @param reason Rejection reason (UNAUTHORIZED, INCOMPLETE, INVALID_LEVELS, ALREADY_PROCESSED, ...)
     */
    void recordRejected(String reason);

    /**
     * Record a resolved tracker whose result reached the truth log.
     */
    void recordResolved(Outcome outcome, UnitSystem unitSystem);

    /**
     * Record a resolved result dropped because its provenance failed re-validation at write time.
     */
    void recordResultRejected(UnitSystem unitSystem);

    void recordMarketDataFailure(String cause);

    void recordTruthLogFailure(UnitSystem unitSystem);

    void recordEvaluationTick(Duration duration);

    void updateActiveTrackers(int count);

    /**
     * Metrics sink that discards everything.
     */
    TrackerMetrics NOOP = new TrackerMetrics() {
        @Override public void recordAdmitted(UnitSystem unitSystem) {}
        @Override public void recordRejected(String reason) {}
        @Override public void recordResolved(Outcome outcome, UnitSystem unitSystem) {}
        @Override public void recordResultRejected(UnitSystem unitSystem) {}
        @Override public void recordMarketDataFailure(String cause) {}
        @Override public void recordTruthLogFailure(UnitSystem unitSystem) {}
        @Override public void recordEvaluationTick(Duration duration) {}
        @Override public void updateActiveTrackers(int count) {}
    };
}

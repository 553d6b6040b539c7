package in.signaltruth.domain.outcome;

import in.signaltruth.domain.signal.SignalTracker;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

/**
 * Sealed, write-once outcome of a tracker. The only thing ever persisted.
 *
 * @param delta pips for forex, quote currency for crypto; positive means the move favored the signal
 */
public record Result(
    SignalTracker tracker,
    Outcome outcome,
    ExitReason exitReason,
    BigDecimal exitPrice,
    BigDecimal observedMarketPrice,
    long runtimeSeconds,
    BigDecimal delta,
    Instant completedAt,
    long autoCloseSeconds
) {
    public Result {
        Objects.requireNonNull(tracker, "tracker");
        Objects.requireNonNull(outcome, "outcome");
        Objects.requireNonNull(exitReason, "exitReason");
        Objects.requireNonNull(exitPrice, "exitPrice");
        Objects.requireNonNull(observedMarketPrice, "observedMarketPrice");
        Objects.requireNonNull(delta, "delta");
        Objects.requireNonNull(completedAt, "completedAt");
    }

    public String signalId() {
        return tracker.id();
    }
}

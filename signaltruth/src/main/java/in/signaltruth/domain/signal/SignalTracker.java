package in.signaltruth.domain.signal;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * A signal under observation.
 *
 * Built once at admission and never mutated; the registry owns every live instance.
 * Provenance fields (sourceTag, engineTag, citadelScore, mlFilterPassed) are opaque
 * to evaluation and only carried through to the truth log.
 */
public record SignalTracker(
    String id,
    String symbol,
    Direction direction,
    BigDecimal entryPrice,
    BigDecimal stopLoss,
    BigDecimal takeProfit,
    Double confidenceScore,
    Instant createdAt,
    Instant startedAt,
    UnitSystem unitSystem,
    String sourceTag,
    String engineTag,
    Double citadelScore,
    String mlFilterPassed
) {
    public SignalTracker {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(symbol, "symbol");
        Objects.requireNonNull(direction, "direction");
        Objects.requireNonNull(entryPrice, "entryPrice");
        Objects.requireNonNull(stopLoss, "stopLoss");
        Objects.requireNonNull(takeProfit, "takeProfit");
        Objects.requireNonNull(createdAt, "createdAt");
        Objects.requireNonNull(startedAt, "startedAt");
        Objects.requireNonNull(unitSystem, "unitSystem");
        if (startedAt.isBefore(createdAt)) {
            throw new IllegalArgumentException(
                "startedAt " + startedAt + " precedes createdAt " + createdAt + " for " + id);
        }
    }

    /**
     * Time spent under observation.
     */
    public Duration runtime(Instant now) {
        Duration runtime = Duration.between(startedAt, now);
        return runtime.isNegative() ? Duration.ZERO : runtime;
    }

    /**
     * True when the stop and the target sit on the correct side of entry for the direction
     * (BUY: stop below, target above; SELL mirrored).
     */
    public boolean hasConsistentLevels() {
        if (direction == Direction.BUY) {
            return stopLoss.compareTo(entryPrice) < 0 && takeProfit.compareTo(entryPrice) > 0;
        }
        return stopLoss.compareTo(entryPrice) > 0 && takeProfit.compareTo(entryPrice) < 0;
    }
}

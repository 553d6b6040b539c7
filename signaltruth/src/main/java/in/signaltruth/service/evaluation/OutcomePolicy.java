package in.signaltruth.service.evaluation;

import in.signaltruth.domain.market.MarketQuote;
import in.signaltruth.domain.outcome.ExitReason;
import in.signaltruth.domain.outcome.Outcome;
import in.signaltruth.domain.outcome.Result;
import in.signaltruth.domain.signal.Direction;
import in.signaltruth.domain.signal.SignalTracker;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Decides whether a tracker has reached a terminal state at a given instant.
 *
 * Pure: same tracker, quote, instant and thresholds always give the same answer.
 *
 * ORDER OF CHECKS:
 * 1. Stop and target both crossed: the level nearer to entry is taken as the one hit first;
 *    equal distances count as the stop
 * 2. Stop crossed: LOSS at the stop
 * 3. Target crossed: WIN at the target
 * 4. Auto-close dwell reached and in profit: WIN at the current price
 * 5. Tracking ceiling reached: TIMEOUT at entry, zero delta
 *
 * With no quote only the ceiling applies.
 */
public final class OutcomePolicy {

    private final Duration maxTracking;

    public OutcomePolicy(Duration maxTracking) {
        this.maxTracking = maxTracking;
    }

    /**
     * @param quote latest quote for the tracker's symbol, or null when the feed has none
     * @return the sealed result, or empty while the tracker stays active
     */
    public Optional<Result> evaluate(SignalTracker tracker, MarketQuote quote, Instant now, long autoCloseSeconds) {
        long runtimeSeconds = tracker.runtime(now).getSeconds();

        if (quote == null) {
            return timedOut(runtimeSeconds)
                ? Optional.of(timeout(tracker, tracker.entryPrice(), runtimeSeconds, now, autoCloseSeconds))
                : Optional.empty();
        }

        BigDecimal price = quote.exitSide(tracker.direction());
        boolean buy = tracker.direction() == Direction.BUY;
        boolean slHit = buy
            ? price.compareTo(tracker.stopLoss()) <= 0
            : price.compareTo(tracker.stopLoss()) >= 0;
        boolean tpHit = buy
            ? price.compareTo(tracker.takeProfit()) >= 0
            : price.compareTo(tracker.takeProfit()) <= 0;

        if (slHit && tpHit) {
            BigDecimal slDistance = tracker.stopLoss().subtract(tracker.entryPrice()).abs();
            BigDecimal tpDistance = tracker.takeProfit().subtract(tracker.entryPrice()).abs();
            if (tpDistance.compareTo(slDistance) < 0) {
                slHit = false;
            } else {
                tpHit = false;
            }
        }

        if (slHit) {
            return Optional.of(sealed(tracker, Outcome.LOSS, ExitReason.STOP_LOSS, tracker.stopLoss(),
                price, runtimeSeconds, now, autoCloseSeconds));
        }
        if (tpHit) {
            return Optional.of(sealed(tracker, Outcome.WIN, ExitReason.TAKE_PROFIT, tracker.takeProfit(),
                price, runtimeSeconds, now, autoCloseSeconds));
        }

        if (runtimeSeconds >= autoCloseSeconds && inProfit(tracker, price)) {
            return Optional.of(sealed(tracker, Outcome.WIN, ExitReason.TIME_CLOSE, price,
                price, runtimeSeconds, now, autoCloseSeconds));
        }

        if (timedOut(runtimeSeconds)) {
            return Optional.of(timeout(tracker, price, runtimeSeconds, now, autoCloseSeconds));
        }
        return Optional.empty();
    }

    public Duration maxTracking() {
        return maxTracking;
    }

    private boolean timedOut(long runtimeSeconds) {
        return runtimeSeconds >= maxTracking.getSeconds();
    }

    private static boolean inProfit(SignalTracker tracker, BigDecimal price) {
        int cmp = price.compareTo(tracker.entryPrice());
        return tracker.direction() == Direction.BUY ? cmp > 0 : cmp < 0;
    }

    private static Result timeout(SignalTracker tracker, BigDecimal observed, long runtimeSeconds,
                                  Instant now, long autoCloseSeconds) {
        BigDecimal zero = DeltaCalculator.delta(tracker.unitSystem(), tracker.symbol(), tracker.direction(),
            tracker.entryPrice(), tracker.entryPrice());
        return new Result(tracker, Outcome.TIMEOUT, ExitReason.TIMEOUT, tracker.entryPrice(), observed,
            runtimeSeconds, zero, now, autoCloseSeconds);
    }

    private static Result sealed(SignalTracker tracker, Outcome outcome, ExitReason reason, BigDecimal exit,
                                 BigDecimal observed, long runtimeSeconds, Instant now, long autoCloseSeconds) {
        BigDecimal delta = DeltaCalculator.delta(tracker.unitSystem(), tracker.symbol(), tracker.direction(),
            tracker.entryPrice(), exit);
        return new Result(tracker, outcome, reason, exit, observed, runtimeSeconds, delta, now, autoCloseSeconds);
    }
}

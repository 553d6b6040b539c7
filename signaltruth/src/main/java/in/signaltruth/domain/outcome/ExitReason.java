package in.signaltruth.domain.outcome;

/**
 * Why a tracker was resolved.
 */
public enum ExitReason {
    STOP_LOSS, // Price crossed the stop
    TAKE_PROFIT, // Price crossed the target
    TIME_CLOSE, // Auto-close dwell time reached while in profit
    TIMEOUT // Hard tracking ceiling, no real exit
}

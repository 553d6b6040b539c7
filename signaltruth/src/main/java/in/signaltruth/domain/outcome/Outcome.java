package in.signaltruth.domain.outcome;

/**
 * Terminal verdict of a tracked signal.
 */
public enum Outcome {
    WIN,
    LOSS,
    TIMEOUT
}

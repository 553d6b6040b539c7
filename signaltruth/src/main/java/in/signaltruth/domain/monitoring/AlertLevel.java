package in.signaltruth.domain.monitoring;

/**
 * Alert severity levels.
 */
public enum AlertLevel {
    /**
     * Audit trail at risk or security boundary crossed.
     * Examples: truth log not writable, result with untrusted provenance
     */
    CRITICAL,

    /**
     * Tracking degraded.
     * Examples: market feed stale while signals are open
     */
    HIGH
}

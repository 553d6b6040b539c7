package in.signaltruth.domain.monitoring;

/**
 * An operator-facing alert raised by the tracker.
 *
 * @param signalId signal the alert concerns, null for process-wide alerts
 */
public record Alert(String alertType, AlertLevel level, String message, String signalId) {

    public Alert {
        if (alertType == null || level == null || message == null) {
            throw new IllegalArgumentException("alertType, level, and message are required");
        }
    }
}

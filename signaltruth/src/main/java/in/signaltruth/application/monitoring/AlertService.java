package in.signaltruth.application.monitoring;

import in.signaltruth.domain.monitoring.Alert;
import in.signaltruth.domain.monitoring.AlertLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Alert notification service.
 *
 * Logs alerts through SLF4J by severity so that an operator's log shipping picks them up.
 */
public class AlertService {
    private static final Logger log = LoggerFactory.getLogger(AlertService.class);

    /**
     * Send alert to configured channels.
     *
     * @param alert Alert to send
     */
    public void sendAlert(Alert alert) {
        String subject = alert.signalId() == null ? "" : " [signal=" + alert.signalId() + "]";
        switch (alert.level()) {
            case CRITICAL -> log.error("[ALERT-CRITICAL] {} - {}{}", alert.alertType(), alert.message(), subject);
            case HIGH -> log.warn("[ALERT-HIGH] {} - {}{}", alert.alertType(), alert.message(), subject);
        }
    }

    /**
     * Send CRITICAL level alert.
     *
     * @param alertType Alert type identifier
     * @param message Alert message
     * @param signalId Signal the alert concerns, or null
     */
    public void sendCriticalAlert(String alertType, String message, String signalId) {
        sendAlert(new Alert(alertType, AlertLevel.CRITICAL, message, signalId));
    }

    /**
     * Send HIGH level alert.
     */
    public void sendHighAlert(String alertType, String message) {
        sendAlert(new Alert(alertType, AlertLevel.HIGH, message, null));
    }
}

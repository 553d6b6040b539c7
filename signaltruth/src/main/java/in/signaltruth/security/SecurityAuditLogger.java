package in.signaltruth.security;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.regex.Pattern;

/**
 * Audit logger for the provenance boundary.
 *
 * Every value it prints originates in an untrusted signal file, so values are
 * sanitized before logging:
 * - control characters (CR, LF, tabs, escapes) are replaced to block log forging
 * - values are truncated to a fixed length
 * - null and blank values are printed as MISSING
 *
 * Usage:
 * <pre>
 * SecurityAuditLogger audit = new SecurityAuditLogger("INGEST");
 * audit.logRejectedProvenance("mission_42", "unknown_bot", null);
 * </pre>
 */
public class SecurityAuditLogger {
    private static final Logger log = LoggerFactory.getLogger(SecurityAuditLogger.class);

    private static final int MAX_VALUE_LENGTH = 64;
    private static final Pattern CONTROL_CHARS = Pattern.compile("\\p{Cntrl}");

    private final String component;

    public SecurityAuditLogger(String component) {
        this.component = component;
    }

    /**
     * Log a signal or result refused because its provenance is not allow-listed.
     *
     * @param signalId Signal identifier as declared
     * @param sourceTag Declared source tag
     * @param engineTag Declared engine tag
     */
    public void logRejectedProvenance(String signalId, String sourceTag, String engineTag) {
        log.error("[SECURITY][{}] REJECTED untrusted provenance: signal_id={}, source={}, engine={}, timestamp={}",
            component, sanitize(signalId), sanitize(sourceTag), sanitize(engineTag), Instant.now());
    }

    /**
     * Log a security-relevant event that is not a rejection.
     *
     * @param event Event name
     * @param details Event details (will be sanitized)
     */
    public void logEvent(String event, String details) {
        log.info("[SECURITY][{}] event={}, details={}, timestamp={}",
            component, event, sanitize(details), Instant.now());
    }

    /**
     * Make an untrusted value safe to print on one log line.
     *
     * @param input Raw value
     * @return Sanitized value
     */
    public String sanitize(String input) {
        if (input == null || input.isBlank()) {
            return "MISSING";
        }
        String result = CONTROL_CHARS.matcher(input).replaceAll("?");
        if (result.length() > MAX_VALUE_LENGTH) {
            result = result.substring(0, MAX_VALUE_LENGTH) + "...";
        }
        return result;
    }
}

package in.signaltruth.service.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Supplies the auto-close dwell time.
 *
 * Reads {@code global.auto_close_seconds} from a shared JSON state file on every call so
 * that an operator can change it without restarting the daemon. A missing file, a
 * missing key or an unreadable document yields the default.
 */
public class AutoCloseConfigService {
    private static final Logger log = LoggerFactory.getLogger(AutoCloseConfigService.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static final long DEFAULT_AUTO_CLOSE_SECONDS = 7_200;

    private final Path stateFile;
    private final long defaultSeconds;
    private volatile long lastLoggedValue = -1;

    public AutoCloseConfigService(Path stateFile) {
        this(stateFile, DEFAULT_AUTO_CLOSE_SECONDS);
    }

    public AutoCloseConfigService(Path stateFile, long defaultSeconds) {
        this.stateFile = stateFile;
        this.defaultSeconds = defaultSeconds;
    }

    /**
     * Current auto-close threshold in seconds. Never throws.
     */
    public long autoCloseSeconds() {
        long value = readValue();
        if (value != lastLoggedValue) {
            log.info("[CONFIG] auto_close_seconds = {} (source: {})", value, stateFile);
            lastLoggedValue = value;
        }
        return value;
    }

    private long readValue() {
        if (stateFile == null || !Files.exists(stateFile)) {
            return defaultSeconds;
        }
        try {
            JsonNode root = MAPPER.readTree(stateFile.toFile());
            JsonNode node = root == null ? null : root.path("global").get("auto_close_seconds");
            if (node == null || node.isNull()) {
                return defaultSeconds;
            }
            long seconds = node.isNumber() ? node.asLong() : Long.parseLong(node.asText().trim());
            if (seconds <= 0) {
                log.warn("[CONFIG] Ignoring non-positive auto_close_seconds {} in {}", seconds, stateFile);
                return defaultSeconds;
            }
            return seconds;
        } catch (IOException | NumberFormatException e) {
            log.warn("[CONFIG] Failed to read {}, using default {}s: {}", stateFile, defaultSeconds, e.getMessage());
            return defaultSeconds;
        }
    }
}

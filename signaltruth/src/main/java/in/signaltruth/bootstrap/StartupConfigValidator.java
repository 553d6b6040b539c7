package in.signaltruth.bootstrap;

import in.signaltruth.config.TrackerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;

/**
 * Startup configuration validator.
 *
 * Runs before any loop starts. Throws IllegalStateException if the daemon cannot work
 * with the configuration it was given; the caller exits with code 1.
 */
public final class StartupConfigValidator {
    private static final Logger log = LoggerFactory.getLogger(StartupConfigValidator.class);

    private StartupConfigValidator() {}

    /**
     * @throws IllegalStateException if configuration is invalid
     */
    public static void validate(TrackerConfig config) {
        log.info("════════════════════════════════════════════════════════");
        log.info("Running startup config validation...");

        String violation = config.firstViolation();
        if (violation != null) {
            throw new IllegalStateException("INVALID CONFIG: " + violation + "\nSystem refuses to start.");
        }

        try {
            Files.createDirectories(config.truthLogDir());
        } catch (IOException e) {
            throw new IllegalStateException(
                "INVALID CONFIG: cannot create TRUTH_LOG_DIR " + config.truthLogDir() + ": " + e.getMessage(), e);
        }
        if (!Files.isWritable(config.truthLogDir())) {
            throw new IllegalStateException(
                "INVALID CONFIG: TRUTH_LOG_DIR is not writable: " + config.truthLogDir());
        }
        log.info("✓ Truth log directory: {}", config.truthLogDir().toAbsolutePath());

        if (!Files.isDirectory(config.signalsDir())) {
            log.warn("Signals directory {} does not exist yet; ingestion will wait for it", config.signalsDir());
        } else {
            log.info("✓ Signals directory: {}", config.signalsDir().toAbsolutePath());
        }

        if (!Files.exists(config.stateFile())) {
            log.warn("State file {} not found; auto-close uses its default", config.stateFile());
        }

        log.info("✓ Market data: {} (timeout {}ms)", config.marketDataUrl(), config.marketDataTimeout().toMillis());
        log.info("✅ Startup config validation passed");
        log.info("════════════════════════════════════════════════════════");
    }
}

package in.signaltruth.config;

import in.signaltruth.util.Env;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Static daemon configuration, read once at startup.
 *
 * The auto-close threshold is deliberately not here; it is re-read on every evaluation
 * tick by {@link in.signaltruth.service.config.AutoCloseConfigService}.
 */
public record TrackerConfig(
    Path signalsDir,                // Directory the generators drop declaration files into
    Path truthLogDir,               // Directory holding the per-unit-system partitions
    String marketDataUrl,           // Base URL of the market-data bridge (".../market-data")
    Path stateFile,                 // JSON state file carrying global.auto_close_seconds
    Duration ingestInterval,
    Duration evalInterval,
    Duration marketDataTimeout,
    Duration maxTracking,           // Hard ceiling after which a tracker times out
    Duration staleFeedThreshold,    // Feed age that raises a HIGH alert
    int metricsPort,                // 0 disables the HTTP endpoint
    boolean rebuildProcessedFromLogs
) {
    public static final long DEFAULT_MAX_TRACKING_SECONDS = 86_400;

    public static TrackerConfig fromEnv() {
        return new TrackerConfig(
            Path.of(Env.get("SIGNALS_DIR", "missions")),
            Path.of(Env.get("TRUTH_LOG_DIR", "truth-logs")),
            Env.get("MARKET_DATA_URL", "http://127.0.0.1:8001/market-data"),
            Path.of(Env.get("STATE_FILE", "citadel_state.json")),
            Duration.ofMillis(Env.getLong("INGEST_INTERVAL_MS", 2_000)),
            Duration.ofMillis(Env.getLong("EVAL_INTERVAL_MS", 1_000)),
            Duration.ofMillis(Env.getLong("MARKET_DATA_TIMEOUT_MS", 5_000)),
            Duration.ofSeconds(Env.getLong("MAX_TRACKING_SECONDS", DEFAULT_MAX_TRACKING_SECONDS)),
            Duration.ofSeconds(Env.getLong("STALE_FEED_SECONDS", 60)),
            Env.getInt("METRICS_PORT", 9108),
            Env.getBool("REBUILD_PROCESSED_FROM_LOGS", true)
        );
    }

    /**
     * Validate ranges; returns a description of the first problem or null.
     */
    public String firstViolation() {
        if (ingestInterval.isZero() || ingestInterval.isNegative()) {
            return "INGEST_INTERVAL_MS must be positive";
        }
        if (evalInterval.isZero() || evalInterval.isNegative()) {
            return "EVAL_INTERVAL_MS must be positive";
        }
        if (marketDataTimeout.isZero() || marketDataTimeout.isNegative()) {
            return "MARKET_DATA_TIMEOUT_MS must be positive";
        }
        if (maxTracking.isZero() || maxTracking.isNegative()) {
            return "MAX_TRACKING_SECONDS must be positive";
        }
        if (staleFeedThreshold.isZero() || staleFeedThreshold.isNegative()) {
            return "STALE_FEED_SECONDS must be positive";
        }
        if (metricsPort < 0 || metricsPort > 65_535) {
            return "METRICS_PORT out of range: " + metricsPort;
        }
        if (marketDataUrl == null || !(marketDataUrl.startsWith("http://") || marketDataUrl.startsWith("https://"))) {
            return "MARKET_DATA_URL must be an http(s) URL: " + marketDataUrl;
        }
        return null;
    }
}

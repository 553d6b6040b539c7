package in.signaltruth.bootstrap;

import in.signaltruth.application.monitoring.AlertService;
import in.signaltruth.application.service.TrackerRegistry;
import in.signaltruth.cli.TruthLogInspector;
import in.signaltruth.config.TrackerConfig;
import in.signaltruth.infrastructure.metrics.PrometheusMetricsHandler;
import in.signaltruth.infrastructure.metrics.PrometheusTrackerMetrics;
import in.signaltruth.security.ProvenanceGuard;
import in.signaltruth.security.SignalInputValidator;
import in.signaltruth.service.TruthTrackerDaemon;
import in.signaltruth.service.config.AutoCloseConfigService;
import in.signaltruth.service.evaluation.OutcomePolicy;
import in.signaltruth.service.evaluation.SignalEvaluationService;
import in.signaltruth.service.ingestion.DirectorySignalSource;
import in.signaltruth.service.ingestion.SignalDeclarationParser;
import in.signaltruth.service.ingestion.SignalIngestionService;
import in.signaltruth.service.market.HttpMarketDataProvider;
import in.signaltruth.service.truth.TruthLogReader;
import in.signaltruth.service.truth.TruthLogger;
import in.signaltruth.transport.http.HealthHandler;
import io.undertow.Undertow;
import io.undertow.server.handlers.PathHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.util.Arrays;
import java.util.concurrent.CountDownLatch;

/**
 * Entry point.
 *
 * <pre>
 * (no arguments)                         run the tracking daemon
 * inspect [count] [forex|crypto|both]    print the latest truth log entries
 * inspect-signal &lt;signal_id&gt;           print every entry for one signal
 * </pre>
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    private App() {}

    public static void main(String[] args) {
        TrackerConfig config = TrackerConfig.fromEnv();

        if (args.length > 0) {
            System.exit(runCli(config, args));
        }

        log.info("═══════════════════════════════════════════════════════════════");
        log.info("=== Signal Truth Tracker Starting ===");
        log.info("═══════════════════════════════════════════════════════════════");

        try {
            StartupConfigValidator.validate(config);
        } catch (IllegalStateException e) {
            log.error("❌ STARTUP VALIDATION FAILED", e);
            System.err.println("\n" + e.getMessage() + "\n");
            System.exit(1);
        }

        Clock clock = Clock.systemUTC();

        // ═══════════════════════════════════════════════════════════════
        // Metrics
        // ═══════════════════════════════════════════════════════════════
        PrometheusTrackerMetrics metrics = new PrometheusTrackerMetrics();
        log.info("✓ Prometheus metrics initialized");

        // ═══════════════════════════════════════════════════════════════
        // Registry (rebuild processed ids from the truth log)
        // ═══════════════════════════════════════════════════════════════
        TrackerRegistry registry = new TrackerRegistry();
        if (config.rebuildProcessedFromLogs()) {
            try {
                registry.seedProcessed(new TruthLogReader(config.truthLogDir()).signalIds());
            } catch (IOException e) {
                log.error("❌ Cannot read truth log to rebuild processed ids: {}", e.getMessage(), e);
                System.err.println("\nCannot read truth log in " + config.truthLogDir() + ": " + e.getMessage() + "\n");
                System.exit(1);
            }
        }

        // ═══════════════════════════════════════════════════════════════
        // Loops
        // ═══════════════════════════════════════════════════════════════
        ProvenanceGuard provenanceGuard = new ProvenanceGuard();
        SignalIngestionService ingestion = new SignalIngestionService(
            new DirectorySignalSource(config.signalsDir()),
            new SignalDeclarationParser(provenanceGuard, new SignalInputValidator()),
            registry,
            metrics,
            clock);

        HttpMarketDataProvider marketData =
            new HttpMarketDataProvider(config.marketDataUrl(), config.marketDataTimeout(), metrics);

        SignalEvaluationService evaluation = new SignalEvaluationService(
            registry,
            marketData,
            new AutoCloseConfigService(config.stateFile()),
            new OutcomePolicy(config.maxTracking()),
            new TruthLogger(config.truthLogDir(), provenanceGuard),
            new AlertService(),
            metrics,
            clock,
            config.staleFeedThreshold());

        TruthTrackerDaemon daemon = new TruthTrackerDaemon(
            ingestion, evaluation, registry, marketData,
            config.ingestInterval(), config.evalInterval(), clock);

        // ═══════════════════════════════════════════════════════════════
        // HTTP: /metrics and /health
        // ═══════════════════════════════════════════════════════════════
        Undertow server = null;
        if (config.metricsPort() > 0) {
            PathHandler routes = new PathHandler()
                .addExactPath("/metrics", new PrometheusMetricsHandler(metrics.getRegistry()))
                .addExactPath("/health", new HealthHandler(daemon));
            server = Undertow.builder()
                .addHttpListener(config.metricsPort(), "0.0.0.0")
                .setHandler(routes)
                .build();
            server.start();
            log.info("✓ Metrics and health on http://localhost:{}/metrics", config.metricsPort());
        }

        CountDownLatch stopped = new CountDownLatch(1);
        Undertow httpServer = server;
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Received shutdown signal");
            daemon.stop();
            if (httpServer != null) {
                httpServer.stop();
            }
            stopped.countDown();
        }, "truth-shutdown"));

        daemon.start();

        try {
            stopped.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    static int runCli(TrackerConfig config, String[] args) {
        TruthLogInspector inspector = new TruthLogInspector(new TruthLogReader(config.truthLogDir()), System.out);
        String command = args[0];
        String[] rest = Arrays.copyOfRange(args, 1, args.length);
        switch (command) {
            case "inspect":
                return inspector.run(rest);
            case "inspect-signal":
                if (rest.length != 1) {
                    System.out.println("Usage: inspect-signal <signal_id>");
                    return TruthLogInspector.EXIT_USAGE;
                }
                return inspector.inspectSignal(rest[0]);
            default:
                System.out.println("Unknown command: " + command);
                System.out.println("Usage: [inspect [count] [forex|crypto|both] | inspect-signal <signal_id>]");
                return TruthLogInspector.EXIT_USAGE;
        }
    }
}

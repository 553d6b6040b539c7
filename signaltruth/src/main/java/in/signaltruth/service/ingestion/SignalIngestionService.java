package in.signaltruth.service.ingestion;

import in.signaltruth.application.port.output.SignalSource;
import in.signaltruth.application.port.output.SignalSource.SignalDocument;
import in.signaltruth.application.service.TrackerRegistry;
import in.signaltruth.domain.common.AdmissionResult;
import in.signaltruth.domain.signal.SignalTracker;
import in.signaltruth.infrastructure.metrics.TrackerMetrics;
import in.signaltruth.service.ingestion.SignalDeclarationParser.ParseOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * One ingestion pass: pull new declarations, parse and authorize them, admit them.
 *
 * Scheduling is the daemon's job; {@link #scanOnce()} is a plain call so tests can drive it.
 * A failure on one declaration never aborts the rest of the scan.
 */
public final class SignalIngestionService {
    private static final Logger log = LoggerFactory.getLogger(SignalIngestionService.class);

    private final SignalSource source;
    private final SignalDeclarationParser parser;
    private final TrackerRegistry registry;
    private final TrackerMetrics metrics;
    private final Clock clock;

    private long totalAdmitted = 0;
    private long totalRejected = 0;

    public SignalIngestionService(
            SignalSource source,
            SignalDeclarationParser parser,
            TrackerRegistry registry,
            TrackerMetrics metrics,
            Clock clock) {
        this.source = source;
        this.parser = parser;
        this.registry = registry;
        this.metrics = metrics;
        this.clock = clock;
    }

    public ScanSummary scanOnce() {
        List<SignalDocument> documents = source.pollNew();
        if (documents.isEmpty()) {
            return ScanSummary.EMPTY;
        }

        int admitted = 0;
        int duplicates = 0;
        int rejected = 0;
        for (SignalDocument document : documents) {
            try {
                switch (ingest(document)) {
                    case ADMITTED -> admitted++;
                    case ALREADY_PROCESSED -> duplicates++;
                    default -> rejected++;
                }
            } catch (RuntimeException e) {
                rejected++;
                metrics.recordRejected("ERROR");
                log.error("[INGEST] Failed to ingest {}: {}", document.origin(), e.getMessage(), e);
            }
        }

        totalAdmitted += admitted;
        totalRejected += rejected;
        metrics.updateActiveTrackers(registry.stats().activeCount());

        ScanSummary summary = new ScanSummary(documents.size(), admitted, duplicates, rejected);
        log.info("[INGEST] Scan complete: seen={}, admitted={}, duplicates={}, rejected={}",
            summary.seen(), admitted, duplicates, rejected);
        return summary;
    }

    private AdmissionResult.Status ingest(SignalDocument document) {
        Instant now = clock.instant();
        ParseOutcome outcome = parser.parse(document, now);
        if (!outcome.isAccepted()) {
            metrics.recordRejected(outcome.code().name());
            if (outcome.code() == SignalDeclarationParser.RejectionCode.UNAUTHORIZED) {
                // Already audit-logged at ERROR by the parser
                log.warn("[INGEST] Rejected {} ({}): {}", document.origin(), outcome.signalId(), outcome.code());
            } else {
                log.warn("[INGEST] Rejected {} ({}): {} - {}",
                    document.origin(), outcome.signalId(), outcome.code(), outcome.reason());
            }
            return AdmissionResult.Status.REJECTED;
        }

        SignalTracker tracker = outcome.tracker();
        AdmissionResult admission = registry.admit(tracker);
        switch (admission.status()) {
            case ADMITTED -> {
                metrics.recordAdmitted(tracker.unitSystem());
                log.info("[INGEST] Tracking {} {} {} @ {} SL={} TP={} ({})",
                    tracker.id(), tracker.symbol(), tracker.direction(), tracker.entryPrice(),
                    tracker.stopLoss(), tracker.takeProfit(), tracker.unitSystem().code());
            }
            case ALREADY_PROCESSED -> {
                metrics.recordRejected("ALREADY_PROCESSED");
                log.debug("[INGEST] {} already resolved, ignoring {}", tracker.id(), document.origin());
            }
            case REJECTED -> {
                metrics.recordRejected("ALREADY_ACTIVE");
                log.debug("[INGEST] {} not admitted: {}", tracker.id(), admission.reason());
            }
        }
        return admission.status();
    }

    public long totalAdmitted() {
        return totalAdmitted;
    }

    public long totalRejected() {
        return totalRejected;
    }

    /**
     * Counts for one scan. Duplicates are declarations whose id was already resolved.
     */
    public record ScanSummary(int seen, int admitted, int duplicates, int rejected) {
        static final ScanSummary EMPTY = new ScanSummary(0, 0, 0, 0);
    }
}

package in.signaltruth.service.truth;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamWriteFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import in.signaltruth.domain.common.LogResult;
import in.signaltruth.domain.outcome.Result;
import in.signaltruth.domain.signal.SignalTracker;
import in.signaltruth.domain.signal.UnitSystem;
import in.signaltruth.security.ProvenanceGuard;
import in.signaltruth.security.SecurityAuditLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Map;
import java.util.TreeMap;

/**
 * Append-only writer of the truth log.
 *
 * LAYOUT:
 * - one file per unit system: truth_log_forex.jsonl, truth_log_crypto.jsonl
 * - one JSON object per line, keys sorted, snake_case
 * - optional metadata missing on the signal is written as "unknown", never omitted
 *
 * DURABILITY:
 * Each line is forced to disk before {@link #log} returns LOGGED. Writes are serialized
 * on this instance so lines never interleave.
 */
public class TruthLogger {
    private static final Logger log = LoggerFactory.getLogger(TruthLogger.class);

    public static final String UNKNOWN = "unknown";

    private final Path logDir;
    private final ProvenanceGuard provenanceGuard;
    private final SecurityAuditLogger audit = new SecurityAuditLogger("TRUTH");
    private final ObjectMapper mapper = JsonMapper.builder()
        .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
        .enable(StreamWriteFeature.WRITE_BIGDECIMAL_AS_PLAIN)
        .build();

    public TruthLogger(Path logDir, ProvenanceGuard provenanceGuard) {
        this.logDir = logDir;
        this.provenanceGuard = provenanceGuard;
    }

    /**
     * Persist one result.
     *
     * @return LOGGED with the partition written, or REJECTED when provenance fails the re-check
     * @throws TruthLogWriteException when the partition cannot be created or appended to
     */
    public synchronized LogResult log(Result result) {
        SignalTracker tracker = result.tracker();
        if (!provenanceGuard.isAuthorizedFor(tracker.sourceTag(), tracker.engineTag(), tracker.unitSystem())) {
            audit.logRejectedProvenance(tracker.id(), tracker.sourceTag(), tracker.engineTag());
            return LogResult.rejected("untrusted provenance");
        }

        Path partition = partitionFor(tracker.unitSystem());
        String line;
        try {
            line = mapper.writeValueAsString(toRecord(result)) + "\n";
        } catch (JsonProcessingException e) {
            throw new TruthLogWriteException(partition, e);
        }

        try {
            Files.createDirectories(logDir);
            try (FileChannel channel = FileChannel.open(partition,
                    StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND)) {
                ByteBuffer buffer = ByteBuffer.wrap(line.getBytes(StandardCharsets.UTF_8));
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }
        } catch (IOException e) {
            throw new TruthLogWriteException(partition, e);
        }

        log.info("[TRUTH] {} {}: {} - {} {} - {}min - {} {} [TCS:{} CITADEL:{} ML:{}]",
            result.outcome(), result.exitReason(), tracker.id(), tracker.symbol(), tracker.direction(),
            runtimeMinutes(result.runtimeSeconds()), result.delta().toPlainString(), tracker.unitSystem().deltaUnit(),
            orUnknown(tracker.confidenceScore()), orUnknown(tracker.citadelScore()), orUnknown(tracker.mlFilterPassed()));
        return LogResult.logged(partition);
    }

    public Path partitionFor(UnitSystem unitSystem) {
        return logDir.resolve(unitSystem.partitionFileName());
    }

    public Path logDir() {
        return logDir;
    }

    /**
     * Flat record as written to the log. Field names are stable; readers depend on them.
     */
    Map<String, Object> toRecord(Result result) {
        SignalTracker tracker = result.tracker();
        Map<String, Object> record = new TreeMap<>();
        record.put("signal_id", tracker.id());
        record.put("symbol", tracker.symbol());
        record.put("direction", tracker.direction().name());
        record.put("unit_system", tracker.unitSystem().code());
        record.put("result", result.outcome().name());
        record.put("exit_type", result.exitReason().name());
        record.put("entry_price", tracker.entryPrice());
        record.put("stop_loss", tracker.stopLoss());
        record.put("take_profit", tracker.takeProfit());
        record.put("exit_price", result.exitPrice());
        record.put("market_price", result.observedMarketPrice());
        record.put("delta", result.delta());
        record.put("delta_unit", tracker.unitSystem().deltaUnit());
        if (tracker.unitSystem() == UnitSystem.FOREX) {
            record.put("pips_result", result.delta());
        }
        record.put("created_at", tracker.createdAt().toString());
        record.put("started_at", tracker.startedAt().toString());
        record.put("completed_at", result.completedAt().toString());
        record.put("runtime_seconds", result.runtimeSeconds());
        record.put("runtime_minutes", runtimeMinutes(result.runtimeSeconds()));
        record.put("auto_close_seconds", result.autoCloseSeconds());
        record.put("tcs_score", orUnknown(tracker.confidenceScore()));
        record.put("citadel_score", orUnknown(tracker.citadelScore()));
        record.put("ml_filter_passed", orUnknown(tracker.mlFilterPassed()));
        record.put("source", orUnknown(tracker.sourceTag()));
        record.put("engine", orUnknown(tracker.engineTag()));
        return record;
    }

    static BigDecimal runtimeMinutes(long runtimeSeconds) {
        return BigDecimal.valueOf(runtimeSeconds).divide(BigDecimal.valueOf(60), 1, RoundingMode.HALF_UP);
    }

    private static Object orUnknown(Object value) {
        if (value == null) {
            return UNKNOWN;
        }
        if (value instanceof String && ((String) value).isBlank()) {
            return UNKNOWN;
        }
        return value;
    }
}

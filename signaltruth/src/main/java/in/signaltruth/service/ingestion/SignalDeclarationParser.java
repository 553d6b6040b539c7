package in.signaltruth.service.ingestion;

import com.fasterxml.jackson.databind.JsonNode;
import in.signaltruth.application.port.output.SignalSource.SignalDocument;
import in.signaltruth.domain.signal.Direction;
import in.signaltruth.domain.signal.SignalTracker;
import in.signaltruth.domain.signal.UnitSystem;
import in.signaltruth.security.ProvenanceGuard;
import in.signaltruth.security.SecurityAuditLogger;
import in.signaltruth.security.SignalInputValidator;
import in.signaltruth.service.market.MarketQuoteNormalizer;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Converts a declaration document into a tracker, or explains why it cannot be tracked.
 *
 * Two layouts are understood:
 * <pre>
 * enhanced:  {"signal_id", "pair", "direction", "confidence", "timestamp",
 *             "enhanced_signal": {"entry_price", "stop_loss", "take_profit"}, ...}
 * flat:      {"mission_id" | "signal_id", "symbol", "direction",
 *             "entry_price" | "entry", "stop_loss" | "sl", "take_profit" | "tp",
 *             "tcs_score", "created_at", ...}
 * </pre>
 * Checks run in order: identifier, provenance, completeness, shape, level consistency.
 */
public class SignalDeclarationParser {

    // Epoch values above this are taken to be milliseconds
    private static final long MILLIS_THRESHOLD = 100_000_000_000L;

    private final ProvenanceGuard provenanceGuard;
    private final SignalInputValidator validator;
    private final SecurityAuditLogger audit = new SecurityAuditLogger("INGEST");

    public SignalDeclarationParser(ProvenanceGuard provenanceGuard, SignalInputValidator validator) {
        this.provenanceGuard = provenanceGuard;
        this.validator = validator;
    }

    public ParseOutcome parse(SignalDocument document, Instant now) {
        JsonNode body = document.body();

        String signalId = firstText(body, "signal_id", "mission_id");
        if (signalId == null) {
            return ParseOutcome.rejected(null, RejectionCode.INCOMPLETE, "missing signal_id/mission_id");
        }
        if (!validator.isValidSignalId(signalId)) {
            return ParseOutcome.rejected(null, RejectionCode.INVALID_ID, "malformed signal id");
        }

        String sourceTag = text(body.get("source"));
        String engineTag = text(body.get("engine"));
        Optional<UnitSystem> unitSystem = provenanceGuard.authorize(sourceTag, engineTag);
        if (unitSystem.isEmpty()) {
            audit.logRejectedProvenance(signalId, sourceTag, engineTag);
            return ParseOutcome.rejected(signalId, RejectionCode.UNAUTHORIZED,
                "untrusted provenance source=" + audit.sanitize(sourceTag) + " engine=" + audit.sanitize(engineTag));
        }

        Fields fields = body.path("enhanced_signal").isObject() ? enhancedFields(body) : flatFields(body);

        if (fields.symbol == null || fields.direction == null
                || isMissingOrZero(fields.entry) || isMissingOrZero(fields.stopLoss) || isMissingOrZero(fields.takeProfit)) {
            return ParseOutcome.rejected(signalId, RejectionCode.INCOMPLETE, "incomplete signal data");
        }

        Optional<Direction> direction = Direction.parse(fields.direction);
        if (direction.isEmpty()) {
            return ParseOutcome.rejected(signalId, RejectionCode.INVALID_DIRECTION, "unknown direction");
        }

        String symbol = MarketQuoteNormalizer.normalizeSymbol(fields.symbol);
        if (!validator.isValidSymbol(symbol)) {
            return ParseOutcome.rejected(signalId, RejectionCode.INVALID_SYMBOL, "malformed symbol");
        }

        try {
            validator.validatePrice("entry_price", fields.entry);
            validator.validatePrice("stop_loss", fields.stopLoss);
            validator.validatePrice("take_profit", fields.takeProfit);
        } catch (IllegalArgumentException e) {
            return ParseOutcome.rejected(signalId, RejectionCode.INVALID_LEVELS, e.getMessage());
        }

        Instant createdAt = fields.createdAt != null ? fields.createdAt : document.modifiedAt();
        if (createdAt == null || createdAt.isAfter(now)) {
            createdAt = now;
        }

        SignalTracker tracker = new SignalTracker(
            signalId,
            symbol,
            direction.get(),
            fields.entry,
            fields.stopLoss,
            fields.takeProfit,
            fields.confidence,
            createdAt,
            now,
            unitSystem.get(),
            sourceTag,
            engineTag,
            fields.citadelScore,
            fields.mlFilterPassed
        );

        if (!tracker.hasConsistentLevels()) {
            return ParseOutcome.rejected(signalId, RejectionCode.INVALID_LEVELS,
                "stop/target on the wrong side of entry for " + tracker.direction());
        }
        return ParseOutcome.accepted(tracker);
    }

    private Fields enhancedFields(JsonNode body) {
        JsonNode enhanced = body.path("enhanced_signal");
        JsonNode basic = body.path("signal");
        Fields fields = new Fields();
        fields.symbol = firstNonNull(text(body.get("pair")), text(enhanced.get("symbol")), text(basic.get("symbol")));
        fields.direction = firstNonNull(text(body.get("direction")), text(enhanced.get("direction")));
        fields.entry = decimal(enhanced.get("entry_price"));
        fields.stopLoss = decimal(enhanced.get("stop_loss"));
        fields.takeProfit = decimal(enhanced.get("take_profit"));
        fields.confidence = number(body.get("confidence"));
        fields.createdAt = instant(body.get("timestamp"));
        readProvenanceMetadata(body, fields);
        return fields;
    }

    private Fields flatFields(JsonNode body) {
        Fields fields = new Fields();
        fields.symbol = text(body.get("symbol"));
        fields.direction = text(body.get("direction"));
        fields.entry = firstDecimal(body, "entry_price", "entry");
        fields.stopLoss = firstDecimal(body, "stop_loss", "sl");
        fields.takeProfit = firstDecimal(body, "take_profit", "tp");
        fields.confidence = body.has("tcs_score") ? number(body.get("tcs_score")) : number(body.get("confidence"));
        fields.createdAt = body.has("created_at") ? instant(body.get("created_at")) : instant(body.get("timestamp"));
        readProvenanceMetadata(body, fields);
        return fields;
    }

    private void readProvenanceMetadata(JsonNode body, Fields fields) {
        fields.citadelScore = body.has("citadel_score")
            ? number(body.get("citadel_score"))
            : number(body.path("citadel_shield").get("score"));

        JsonNode ml = body.has("ml_filter_passed") ? body.get("ml_filter_passed") : body.path("ml_result").get("passed");
        fields.mlFilterPassed = ml == null || ml.isNull() || ml.isContainerNode() ? null : ml.asText();
    }

    private static boolean isMissingOrZero(BigDecimal value) {
        return value == null || value.signum() == 0;
    }

    private static String firstText(JsonNode body, String... keys) {
        for (String key : keys) {
            String value = text(body.get(key));
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    private static BigDecimal firstDecimal(JsonNode body, String... keys) {
        for (String key : keys) {
            BigDecimal value = decimal(body.get(key));
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    @SafeVarargs
    private static <T> T firstNonNull(T... values) {
        for (T value : values) {
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    private static String text(JsonNode node) {
        if (node == null || node.isNull() || node.isContainerNode()) {
            return null;
        }
        String value = node.asText().trim();
        return value.isEmpty() ? null : value;
    }

    private static BigDecimal decimal(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            return node.decimalValue();
        }
        if (node.isTextual()) {
            try {
                return new BigDecimal(node.asText().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static Double number(JsonNode node) {
        BigDecimal value = decimal(node);
        return value == null ? null : value.doubleValue();
    }

    private static Instant instant(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            long value = node.asLong();
            if (value <= 0) {
                return null;
            }
            return value > MILLIS_THRESHOLD
                ? Instant.ofEpochMilli(value)
                : Instant.ofEpochMilli(Math.round(node.asDouble() * 1000));
        }
        String raw = text(node);
        if (raw == null) {
            return null;
        }
        try {
            return OffsetDateTime.parse(raw).toInstant();
        } catch (DateTimeParseException e) {
            return localInstant(raw);
        }
    }

    // Generators without an offset write UTC
    private static Instant localInstant(String raw) {
        try {
            return LocalDateTime.parse(raw).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static final class Fields {
        String symbol;
        String direction;
        BigDecimal entry;
        BigDecimal stopLoss;
        BigDecimal takeProfit;
        Double confidence;
        Instant createdAt;
        Double citadelScore;
        String mlFilterPassed;
    }

    /**
     * Why a declaration was not tracked.
     */
    public enum RejectionCode {
        UNAUTHORIZED,
        INCOMPLETE,
        INVALID_ID,
        INVALID_DIRECTION,
        INVALID_SYMBOL,
        INVALID_LEVELS
    }

    /**
     * Either a tracker or a rejection.
     */
    public record ParseOutcome(SignalTracker tracker, String signalId, RejectionCode code, String reason) {

        static ParseOutcome accepted(SignalTracker tracker) {
            return new ParseOutcome(tracker, tracker.id(), null, null);
        }

        static ParseOutcome rejected(String signalId, RejectionCode code, String reason) {
            return new ParseOutcome(null, signalId, code, reason);
        }

        public boolean isAccepted() {
            return tracker != null;
        }
    }
}

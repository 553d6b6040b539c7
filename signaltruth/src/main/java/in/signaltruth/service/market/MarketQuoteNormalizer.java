package in.signaltruth.service.market;

import com.fasterxml.jackson.databind.JsonNode;
import in.signaltruth.domain.market.MarketQuote;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Turns the market-data bridge's responses into quotes.
 *
 * Accepted shapes:
 * <pre>
 * 1. {"EURUSD": {"bid": 1.1, "ask": 1.1002, "timestamp": 1723450000}, ...}
 * 2. {"data": [{"symbol": "EURUSD", "bid": ..., "ask": ..., "timestamp": ...}, ...]}
 * 3. [{"symbol": "EURUSD", "bid": ..., "ask": ..., "timestamp": ...}, ...]
 * </pre>
 *
 * Entries without a positive bid and ask are dropped. Symbols are upper-cased.
 * Timestamps may be epoch seconds, epoch millis or ISO-8601; anything else becomes the poll time.
 */
public final class MarketQuoteNormalizer {
    private static final Logger log = LoggerFactory.getLogger(MarketQuoteNormalizer.class);

    // Epoch values above this are taken to be milliseconds
    private static final long MILLIS_THRESHOLD = 100_000_000_000L;

    /**
     * @return empty if the document matches none of the accepted shapes
     */
    public Optional<Map<String, MarketQuote>> normalize(JsonNode root, Instant polledAt) {
        if (root == null || root.isNull() || root.isMissingNode()) {
            return Optional.empty();
        }
        if (root.isArray()) {
            return Optional.of(fromArray(root, polledAt));
        }
        if (!root.isObject()) {
            return Optional.empty();
        }
        if (isSymbolKeyed(root)) {
            Map<String, MarketQuote> quotes = new HashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                toQuote(field.getValue(), polledAt)
                    .ifPresent(q -> quotes.put(normalizeSymbol(field.getKey()), q));
            }
            return Optional.of(quotes);
        }
        JsonNode data = root.get("data");
        if (data != null && data.isArray()) {
            return Optional.of(fromArray(data, polledAt));
        }
        return Optional.empty();
    }

    public static String normalizeSymbol(String symbol) {
        return symbol.trim().toUpperCase(Locale.ROOT);
    }

    private boolean isSymbolKeyed(JsonNode root) {
        Iterator<JsonNode> values = root.elements();
        while (values.hasNext()) {
            JsonNode value = values.next();
            if (!value.isObject() || !(value.has("bid") || value.has("ask"))) {
                return false;
            }
        }
        return true;
    }

    private Map<String, MarketQuote> fromArray(JsonNode array, Instant polledAt) {
        Map<String, MarketQuote> quotes = new HashMap<>();
        for (JsonNode item : array) {
            JsonNode symbol = item.get("symbol");
            if (symbol == null || !symbol.isTextual() || symbol.asText().isBlank()) {
                continue;
            }
            toQuote(item, polledAt).ifPresent(q -> quotes.put(normalizeSymbol(symbol.asText()), q));
        }
        return quotes;
    }

    private Optional<MarketQuote> toQuote(JsonNode node, Instant polledAt) {
        BigDecimal bid = decimal(node.get("bid"));
        BigDecimal ask = decimal(node.get("ask"));
        if (bid == null || ask == null || bid.signum() <= 0 || ask.signum() <= 0) {
            log.debug("Dropping quote without usable bid/ask: {}", node);
            return Optional.empty();
        }
        return Optional.of(new MarketQuote(bid, ask, timestamp(node.get("timestamp"), polledAt)));
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

    private static Instant timestamp(JsonNode node, Instant fallback) {
        if (node == null || node.isNull()) {
            return fallback;
        }
        if (node.isNumber()) {
            long value = node.asLong();
            if (value <= 0) {
                return fallback;
            }
            if (value > MILLIS_THRESHOLD) {
                return Instant.ofEpochMilli(value);
            }
            return Instant.ofEpochMilli(Math.round(node.asDouble() * 1000));
        }
        if (node.isTextual()) {
            try {
                return Instant.parse(node.asText().trim());
            } catch (DateTimeParseException e) {
                return fallback;
            }
        }
        return fallback;
    }
}

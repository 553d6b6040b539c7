package in.signaltruth.service.market;

import in.signaltruth.domain.market.MarketQuote;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Last good quote snapshot.
 *
 * The whole snapshot is replaced on every successful poll and never mutated in place, so
 * readers on other threads always see a complete, consistent map without locking.
 */
public final class QuoteCache {
    private static final Logger log = LoggerFactory.getLogger(QuoteCache.class);

    private final AtomicReference<Snapshot> current = new AtomicReference<>(new Snapshot(Map.of(), null));

    /**
     * Swap in a new snapshot.
     */
    public void replace(Map<String, MarketQuote> quotes, Instant fetchedAt) {
        current.set(new Snapshot(Map.copyOf(quotes), fetchedAt));
        log.debug("Quote cache replaced: {} symbols @ {}", quotes.size(), fetchedAt);
    }

    /**
     * Latest quotes keyed by symbol (immutable).
     */
    public Map<String, MarketQuote> quotes() {
        return current.get().quotes();
    }

    /**
     * Latest quote for a symbol, or null when the feed did not report it.
     */
    public MarketQuote quote(String symbol) {
        return current.get().quotes().get(symbol);
    }

    /**
     * When the current snapshot was fetched, or null before the first success.
     */
    public Instant fetchedAt() {
        return current.get().fetchedAt();
    }

    public int size() {
        return current.get().quotes().size();
    }

    private record Snapshot(Map<String, MarketQuote> quotes, Instant fetchedAt) {}
}

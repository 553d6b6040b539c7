package in.signaltruth.application.port.output;

import in.signaltruth.domain.market.MarketQuote;

import java.time.Instant;
import java.util.Map;

/**
 * Source of current bid/ask quotes.
 *
 * Implementations must never synthesize a quote for a symbol the feed did not report,
 * and must never throw from {@link #fetchQuotes()}: a failed poll returns the last good
 * snapshot (possibly empty).
 */
public interface MarketDataProvider {

    /**
     * Poll the feed for all current quotes.
     *
     * @return immutable map keyed by upper-case symbol
     */
    Map<String, MarketQuote> fetchQuotes();

    /**
     * Time of the last poll that produced a fresh snapshot, or null if none has yet.
     */
    Instant lastSuccessfulFetch();
}

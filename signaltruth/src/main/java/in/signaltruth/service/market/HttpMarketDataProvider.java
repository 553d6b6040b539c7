package in.signaltruth.service.market;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.signaltruth.application.port.output.MarketDataProvider;
import in.signaltruth.domain.market.MarketQuote;
import in.signaltruth.infrastructure.metrics.TrackerMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Market data provider backed by the bridge's HTTP API.
 *
 * Endpoints (relative to the configured base, e.g. http://127.0.0.1:8001/market-data):
 * - GET /all        all current quotes (primary)
 * - GET /venom-feed  data-wrapped feed, tried only when the primary is unreachable
 *
 * Any failure (transport, non-2xx, unparseable body, unknown shape) leaves the cached
 * snapshot in place and returns it.
 */
public class HttpMarketDataProvider implements MarketDataProvider {
    private static final Logger log = LoggerFactory.getLogger(HttpMarketDataProvider.class);

    static final String ALL_PATH = "/all";
    static final String FALLBACK_PATH = "/venom-feed";

    private final String baseUrl;
    private final Duration timeout;
    private final HttpClient httpClient;
    private final TrackerMetrics metrics;
    private final Clock clock;
    private final ObjectMapper mapper;
    private final MarketQuoteNormalizer normalizer = new MarketQuoteNormalizer();
    private final QuoteCache cache = new QuoteCache();

    public HttpMarketDataProvider(String baseUrl, Duration timeout, TrackerMetrics metrics) {
        this(baseUrl, timeout,
            HttpClient.newBuilder().connectTimeout(timeout).build(),
            metrics, Clock.systemUTC());
    }

    public HttpMarketDataProvider(String baseUrl, Duration timeout, HttpClient httpClient,
                                  TrackerMetrics metrics, Clock clock) {
        this.baseUrl = stripTrailingSlash(baseUrl);
        this.timeout = timeout;
        this.httpClient = httpClient;
        this.metrics = metrics;
        this.clock = clock;
        this.mapper = new ObjectMapper().enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
        log.info("[MARKET] Connected to market data source: {}", this.baseUrl);
    }

    @Override
    public Map<String, MarketQuote> fetchQuotes() {
        Instant polledAt = clock.instant();
        try {
            Optional<Map<String, MarketQuote>> fresh = poll(baseUrl + ALL_PATH, polledAt);
            if (fresh.isPresent()) {
                cache.replace(fresh.get(), polledAt);
            }
            return cache.quotes();
        } catch (IOException e) {
            log.warn("[MARKET] Market data fetch failed, trying fallback: {}", e.getMessage());
            metrics.recordMarketDataFailure("transport");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return cache.quotes();
        }

        try {
            Optional<Map<String, MarketQuote>> fallback = poll(baseUrl + FALLBACK_PATH, polledAt);
            if (fallback.isPresent()) {
                cache.replace(fallback.get(), polledAt);
            }
        } catch (IOException e) {
            log.warn("[MARKET] Fallback feed unreachable, serving cached snapshot ({} symbols): {}",
                cache.size(), e.getMessage());
            metrics.recordMarketDataFailure("transport");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return cache.quotes();
    }

    @Override
    public Instant lastSuccessfulFetch() {
        return cache.fetchedAt();
    }

    private Optional<Map<String, MarketQuote>> poll(String url, Instant polledAt)
            throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create(url))
            .timeout(timeout)
            .header("Accept", "application/json")
            .GET()
            .build();

        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            log.warn("[MARKET] {} returned HTTP {}", url, response.statusCode());
            metrics.recordMarketDataFailure("http_status");
            return Optional.empty();
        }

        JsonNode root;
        try {
            root = mapper.readTree(response.body());
        } catch (JsonProcessingException e) {
            log.warn("[MARKET] Unparseable market data from {}: {}", url, e.getOriginalMessage());
            metrics.recordMarketDataFailure("parse");
            return Optional.empty();
        }

        Optional<Map<String, MarketQuote>> quotes = normalizer.normalize(root, polledAt);
        if (quotes.isEmpty()) {
            log.warn("[MARKET] Unrecognized market data shape from {}", url);
            metrics.recordMarketDataFailure("shape");
        }
        return quotes;
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}

package in.signaltruth.service.market;

import in.signaltruth.domain.market.MarketQuote;
import in.signaltruth.infrastructure.metrics.TrackerMetrics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import javax.net.ssl.SSLSession;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("HTTP Market Data Provider")
public class HttpMarketDataProviderTest {

    private static final String BASE_URL = "http://bridge.local/market-data/";
    private static final Instant NOW = Instant.parse("2025-08-01T10:00:00Z");
    private static final String ALL_BODY = "{\"EURUSD\": {\"bid\": 1.1001, \"ask\": 1.1003}}";
    private static final String FALLBACK_BODY = "{\"data\": [{\"symbol\": \"GBPUSD\", \"bid\": 1.27, \"ask\": 1.2702}]}";

    @Mock
    private HttpClient httpClient;

    @Mock
    private TrackerMetrics metrics;

    private HttpMarketDataProvider provider;
    private final List<String> requestedPaths = new ArrayList<>();

    @BeforeEach
    public void setUp() {
        provider = new HttpMarketDataProvider(BASE_URL, Duration.ofSeconds(5), httpClient, metrics,
            Clock.fixed(NOW, ZoneOffset.UTC));
    }

    /**
     * Each element answers one request: a String body (200), an Integer status, or an IOException.
     */
    private void respond(Object... answers) throws Exception {
        List<Object> queue = new ArrayList<>(List.of(answers));
        doAnswer(invocation -> {
            HttpRequest request = invocation.getArgument(0);
            requestedPaths.add(request.uri().getPath());
            Object next = queue.remove(0);
            if (next instanceof IOException) {
                throw (IOException) next;
            }
            if (next instanceof Integer) {
                return new StubResponse(request, (Integer) next, "");
            }
            return new StubResponse(request, 200, (String) next);
        }).when(httpClient).send(any(), any());
    }

    @Test
    @DisplayName("Successful poll replaces the snapshot")
    public void testSuccessfulPoll() throws Exception {
        respond(ALL_BODY);

        Map<String, MarketQuote> quotes = provider.fetchQuotes();

        assertTrue(quotes.containsKey("EURUSD"));
        assertEquals(NOW, provider.lastSuccessfulFetch());
        assertEquals(List.of("/market-data/all"), requestedPaths);
    }

    @Test
    @DisplayName("HTTP error keeps the last good snapshot")
    public void testHttpErrorKeepsCache() throws Exception {
        respond(ALL_BODY, 503);

        provider.fetchQuotes();
        Map<String, MarketQuote> quotes = provider.fetchQuotes();

        assertTrue(quotes.containsKey("EURUSD"));
        verify(metrics).recordMarketDataFailure("http_status");
    }

    @Test
    @DisplayName("Unparseable body keeps the last good snapshot")
    public void testGarbageKeepsCache() throws Exception {
        respond(ALL_BODY, "<html>bad gateway</html>");

        provider.fetchQuotes();
        Map<String, MarketQuote> quotes = provider.fetchQuotes();

        assertEquals(1, quotes.size());
        verify(metrics).recordMarketDataFailure("parse");
    }

    @Test
    @DisplayName("Transport failure falls through to the fallback feed")
    public void testFallbackFeed() throws Exception {
        respond(new IOException("connection refused"), FALLBACK_BODY);

        Map<String, MarketQuote> quotes = provider.fetchQuotes();

        assertTrue(quotes.containsKey("GBPUSD"));
        assertEquals(List.of("/market-data/all", "/market-data/venom-feed"), requestedPaths);
        verify(metrics).recordMarketDataFailure("transport");
    }

    @Test
    @DisplayName("Both feeds down yields an empty snapshot without throwing")
    public void testBothFeedsDown() throws Exception {
        respond(new IOException("connection refused"), new IOException("connection refused"));

        Map<String, MarketQuote> quotes = assertDoesNotThrow(() -> provider.fetchQuotes());

        assertTrue(quotes.isEmpty());
        assertNull(provider.lastSuccessfulFetch());
        verify(metrics, times(2)).recordMarketDataFailure("transport");
    }

    private static final class StubResponse implements HttpResponse<String> {
        private final HttpRequest request;
        private final int status;
        private final String body;

        StubResponse(HttpRequest request, int status, String body) {
            this.request = request;
            this.status = status;
            this.body = body;
        }

        @Override public int statusCode() { return status; }
        @Override public HttpRequest request() { return request; }
        @Override public Optional<HttpResponse<String>> previousResponse() { return Optional.empty(); }
        @Override public HttpHeaders headers() { return HttpHeaders.of(Map.of(), (a, b) -> true); }
        @Override public String body() { return body; }
        @Override public Optional<SSLSession> sslSession() { return Optional.empty(); }
        @Override public URI uri() { return request.uri(); }
        @Override public HttpClient.Version version() { return HttpClient.Version.HTTP_1_1; }
    }
}

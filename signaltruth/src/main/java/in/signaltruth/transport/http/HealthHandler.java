package in.signaltruth.transport.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.signaltruth.service.TruthTrackerDaemon;
import in.signaltruth.service.TruthTrackerDaemon.DaemonStatus;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * GET /health
 *
 * 200 with {"status":"UP",...} while the loops run and no truth-log write is pending,
 * 503 with "DEGRADED" or "DOWN" otherwise.
 */
public final class HealthHandler implements HttpHandler {
    private static final Logger log = LoggerFactory.getLogger(HealthHandler.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final TruthTrackerDaemon daemon;

    public HealthHandler(TruthTrackerDaemon daemon) {
        this.daemon = daemon;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        DaemonStatus status = daemon.status();
        String state = !status.running() ? "DOWN" : status.pendingWrites() > 0 ? "DEGRADED" : "UP";

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", state);
        body.put("startedAt", status.startedAt() == null ? null : status.startedAt().toString());
        body.put("activeSignals", status.activeSignals());
        body.put("processedSignals", status.processedSignals());
        body.put("pendingWrites", status.pendingWrites());
        body.put("resultsLogged", status.resultsLogged());
        body.put("lastEvaluationAt", status.lastEvaluationAt() == null ? null : status.lastEvaluationAt().toString());
        body.put("marketDataAgeSeconds", status.marketDataAgeSeconds());

        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json; charset=utf-8");
        try {
            exchange.setStatusCode("UP".equals(state) ? StatusCodes.OK : StatusCodes.SERVICE_UNAVAILABLE);
            exchange.getResponseSender().send(MAPPER.writeValueAsString(body));
        } catch (JsonProcessingException e) {
            log.error("[HEALTH] Failed to serialize health status: {}", e.getMessage(), e);
            exchange.setStatusCode(StatusCodes.INTERNAL_SERVER_ERROR);
            exchange.getResponseSender().send("{\"status\":\"ERROR\"}");
        }
    }
}

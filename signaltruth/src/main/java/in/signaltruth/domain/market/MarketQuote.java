package in.signaltruth.domain.market;

import in.signaltruth.domain.signal.Direction;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Latest bid/ask for one symbol.
 */
public record MarketQuote(BigDecimal bid, BigDecimal ask, Instant observedAt) {
    public MarketQuote {
        if (bid == null || ask == null || observedAt == null) {
            throw new IllegalArgumentException("bid, ask and observedAt cannot be null");
        }
    }

    /**
     * Price a position would actually close at: the bid for a long, the ask for a short.
     */
    public BigDecimal exitSide(Direction direction) {
        return direction == Direction.BUY ? bid : ask;
    }
}

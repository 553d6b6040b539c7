package in.signaltruth.domain.signal;

import java.util.Locale;
import java.util.Optional;

/**
 * Side of a tracked signal.
 */
public enum Direction {
    BUY,
    SELL;

    /**
     * Parse a direction as written by the generators ("buy", "BUY", " Sell ").
     *
     * @return empty for null, blank or unknown values
     */
    public static Optional<Direction> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT);
        for (Direction direction : values()) {
            if (direction.name().equals(normalized)) {
                return Optional.of(direction);
            }
        }
        return Optional.empty();
    }

    /**
     * +1 for BUY, -1 for SELL. Multiplies a raw (exit - entry) move into a favorable-positive delta.
     */
    public int sign() {
        return this == BUY ? 1 : -1;
    }
}

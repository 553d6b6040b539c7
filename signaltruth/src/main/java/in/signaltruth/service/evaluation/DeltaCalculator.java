package in.signaltruth.service.evaluation;

import in.signaltruth.domain.signal.Direction;
import in.signaltruth.domain.signal.UnitSystem;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;

/**
 * Signed move from entry to exit, positive when it favored the signal.
 *
 * Forex: pips, rounded to a tenth. Pip size is 0.01 for JPY-quoted pairs and 0.0001 otherwise.
 * Crypto: quote-currency difference per unit, rounded to cents.
 */
public final class DeltaCalculator {

    static final BigDecimal STANDARD_PIP = new BigDecimal("0.0001");
    static final BigDecimal JPY_PIP = new BigDecimal("0.01");

    private DeltaCalculator() {}

    public static BigDecimal delta(UnitSystem unitSystem, String symbol, Direction direction,
                                   BigDecimal entry, BigDecimal exit) {
        BigDecimal move = exit.subtract(entry).multiply(BigDecimal.valueOf(direction.sign()));
        if (unitSystem == UnitSystem.CRYPTO) {
            return move.setScale(2, RoundingMode.HALF_UP);
        }
        return move.divide(pipSize(symbol), 1, RoundingMode.HALF_UP);
    }

    public static BigDecimal pipSize(String symbol) {
        return symbol != null && symbol.toUpperCase(Locale.ROOT).contains("JPY") ? JPY_PIP : STANDARD_PIP;
    }
}

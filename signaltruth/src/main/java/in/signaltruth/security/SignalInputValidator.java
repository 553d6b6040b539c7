package in.signaltruth.security;

import java.math.BigDecimal;
import java.util.regex.Pattern;

/**
 * Shape checks for values read from signal declaration files.
 *
 * Validation Rules:
 * - Signal ids: letters, digits and {@code _ - . :}, at most 128 characters
 * - Symbols: upper-case letters, digits and {@code _ - . /}, at most 20 characters
 * - Prices: strictly positive, at most 10,000,000
 */
public class SignalInputValidator {

    private static final Pattern SIGNAL_ID_PATTERN = Pattern.compile("^[A-Za-z0-9_.:-]{1,128}$");
    private static final Pattern SYMBOL_PATTERN = Pattern.compile("^[A-Z0-9_./-]{1,20}$");

    private static final BigDecimal MAX_PRICE = new BigDecimal("10000000");

    /**
     * Validate signal identifier. Ids end up in log lines and as JSON values, never in paths.
     *
     * @param signalId Signal identifier
     * @return true if valid
     */
    public boolean isValidSignalId(String signalId) {
        return signalId != null && SIGNAL_ID_PATTERN.matcher(signalId).matches();
    }

    /**
     * Validate an already normalized (upper-case) symbol.
     *
     * Valid formats:
     * - EURUSD
     * - BTC/USD
     * - XAU_USD
     *
     * @param symbol Trading symbol
     * @return true if valid
     */
    public boolean isValidSymbol(String symbol) {
        return symbol != null && SYMBOL_PATTERN.matcher(symbol).matches();
    }

    /**
     * Validate a price level.
     *
     * @param field Field name for the error message
     * @param price Price level
     * @throws IllegalArgumentException if missing, zero, negative or absurdly large
     */
    public void validatePrice(String field, BigDecimal price) {
        if (price == null) {
            throw new IllegalArgumentException(field + " is missing");
        }
        if (price.signum() <= 0) {
            throw new IllegalArgumentException(field + " must be positive: " + price.toPlainString());
        }
        if (price.compareTo(MAX_PRICE) > 0) {
            throw new IllegalArgumentException(field + " exceeds maximum (" + MAX_PRICE + "): " + price.toPlainString());
        }
    }
}

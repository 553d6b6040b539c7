package in.signaltruth.domain.signal;

import java.util.Locale;
import java.util.Optional;

/**
 * Unit system of a signal. Decides how deltas are measured and which truth-log partition
 * receives the result.
 */
public enum UnitSystem {
    FOREX("forex", "pips"),
    CRYPTO("crypto", "usd");

    private final String code;
    private final String deltaUnit;

    UnitSystem(String code, String deltaUnit) {
        this.code = code;
        this.deltaUnit = deltaUnit;
    }

    public String code() {
        return code;
    }

    public String deltaUnit() {
        return deltaUnit;
    }

    public String partitionFileName() {
        return "truth_log_" + code + ".jsonl";
    }

    public static Optional<UnitSystem> fromCode(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (UnitSystem unitSystem : values()) {
            if (unitSystem.code.equals(normalized)) {
                return Optional.of(unitSystem);
            }
        }
        return Optional.empty();
    }
}

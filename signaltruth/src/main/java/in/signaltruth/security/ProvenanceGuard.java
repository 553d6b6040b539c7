package in.signaltruth.security;

import in.signaltruth.domain.signal.UnitSystem;

import java.util.Map;
import java.util.Optional;

/**
 * Fixed allow-list of signal generators.
 *
 * Used twice: when a declaration is ingested and again right before a result is written.
 * A signal is authorized only if at least one of its {@code source}/{@code engine} tags is
 * present, every present tag is on the list, and all present tags agree on the unit system.
 * The list is compiled in and cannot be widened through configuration.
 */
public final class ProvenanceGuard {

    public static final String FOREX_GENERATOR = "venom_scalp_master";
    public static final String CRYPTO_GENERATOR = "CORE_CRYPTO_SMC";
    public static final String CRYPTO_ENGINE = "C.O.R.E";

    private static final Map<String, UnitSystem> ALLOWED = Map.of(
        FOREX_GENERATOR, UnitSystem.FOREX,
        CRYPTO_GENERATOR, UnitSystem.CRYPTO,
        CRYPTO_ENGINE, UnitSystem.CRYPTO
    );

    /**
     * Resolve the unit system implied by the provenance tags.
     *
     * @return empty when the provenance is not authorized
     */
    public Optional<UnitSystem> authorize(String sourceTag, String engineTag) {
        boolean hasSource = sourceTag != null && !sourceTag.isBlank();
        boolean hasEngine = engineTag != null && !engineTag.isBlank();
        if (!hasSource && !hasEngine) {
            return Optional.empty();
        }

        UnitSystem fromSource = hasSource ? ALLOWED.get(sourceTag) : null;
        UnitSystem fromEngine = hasEngine ? ALLOWED.get(engineTag) : null;
        if ((hasSource && fromSource == null) || (hasEngine && fromEngine == null)) {
            return Optional.empty();
        }
        if (fromSource != null && fromEngine != null && fromSource != fromEngine) {
            return Optional.empty();
        }
        return Optional.of(fromSource != null ? fromSource : fromEngine);
    }

    public boolean isAuthorized(String sourceTag, String engineTag) {
        return authorize(sourceTag, engineTag).isPresent();
    }

    /**
     * Authorized and consistent with the unit system the signal claims.
     */
    public boolean isAuthorizedFor(String sourceTag, String engineTag, UnitSystem unitSystem) {
        return authorize(sourceTag, engineTag).map(u -> u == unitSystem).orElse(false);
    }
}

package in.signaltruth.security;

import in.signaltruth.domain.signal.UnitSystem;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Provenance Guard")
public class ProvenanceGuardTest {

    private final ProvenanceGuard guard = new ProvenanceGuard();

    @Test
    @DisplayName("Known generators map to their unit system")
    public void testKnownGenerators() {
        assertEquals(Optional.of(UnitSystem.FOREX), guard.authorize("venom_scalp_master", null));
        assertEquals(Optional.of(UnitSystem.CRYPTO), guard.authorize("CORE_CRYPTO_SMC", null));
        assertEquals(Optional.of(UnitSystem.CRYPTO), guard.authorize(null, "C.O.R.E"));
        assertEquals(Optional.of(UnitSystem.CRYPTO), guard.authorize("CORE_CRYPTO_SMC", "C.O.R.E"));
    }

    @Test
    @DisplayName("Unknown, missing or conflicting tags are refused")
    public void testRefused() {
        assertFalse(guard.isAuthorized(null, null));
        assertFalse(guard.isAuthorized("  ", ""));
        assertFalse(guard.isAuthorized("venom_scalp_master_v2", null));
        assertFalse(guard.isAuthorized("VENOM_SCALP_MASTER", null));
        assertFalse(guard.isAuthorized("venom_scalp_master", "rogue_engine"));
        assertFalse(guard.isAuthorized("venom_scalp_master", "C.O.R.E"));
    }

    @Test
    @DisplayName("Authorization can be checked against a claimed unit system")
    public void testAuthorizedFor() {
        assertTrue(guard.isAuthorizedFor("venom_scalp_master", null, UnitSystem.FOREX));
        assertFalse(guard.isAuthorizedFor("venom_scalp_master", null, UnitSystem.CRYPTO));
    }
}

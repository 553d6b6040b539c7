package in.signaltruth.service.evaluation;

import in.signaltruth.domain.signal.Direction;
import in.signaltruth.domain.signal.UnitSystem;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Delta Calculator")
public class DeltaCalculatorTest {

    @Test
    @DisplayName("JPY pairs use a 0.01 pip")
    public void testPipSize() {
        assertEquals(new BigDecimal("0.01"), DeltaCalculator.pipSize("USDJPY"));
        assertEquals(new BigDecimal("0.01"), DeltaCalculator.pipSize("gbpjpy"));
        assertEquals(new BigDecimal("0.0001"), DeltaCalculator.pipSize("EURUSD"));
    }

    @Test
    @DisplayName("Forex deltas round to a tenth of a pip")
    public void testForexRounding() {
        BigDecimal delta = DeltaCalculator.delta(UnitSystem.FOREX, "EURUSD", Direction.BUY,
            new BigDecimal("1.10000"), new BigDecimal("1.10127"));

        assertEquals(new BigDecimal("12.7"), delta);
    }

    @Test
    @DisplayName("SELL deltas are positive when price falls")
    public void testSellSign() {
        BigDecimal delta = DeltaCalculator.delta(UnitSystem.CRYPTO, "ETHUSD", Direction.SELL,
            new BigDecimal("3000"), new BigDecimal("2950.555"));

        assertEquals(new BigDecimal("49.45"), delta);
    }
}

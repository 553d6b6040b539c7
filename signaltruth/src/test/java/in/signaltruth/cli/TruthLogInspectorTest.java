package in.signaltruth.cli;

import in.signaltruth.service.truth.TruthLogReader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Truth Log Inspector")
public class TruthLogInspectorTest {

    @TempDir
    Path logDir;

    private ByteArrayOutputStream buffer;
    private TruthLogInspector inspector;

    @BeforeEach
    public void setUp() {
        buffer = new ByteArrayOutputStream();
        inspector = new TruthLogInspector(new TruthLogReader(logDir),
            new PrintStream(buffer, true, StandardCharsets.UTF_8));
    }

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    private static String forexLine(String id, String result, String delta, String completedAt) {
        return "{\"completed_at\":\"" + completedAt + "\",\"delta\":" + delta + ",\"delta_unit\":\"pips\","
            + "\"direction\":\"BUY\",\"exit_type\":\"TAKE_PROFIT\",\"result\":\"" + result + "\","
            + "\"runtime_minutes\":15.0,\"signal_id\":\"" + id + "\",\"source\":\"venom_scalp_master\","
            + "\"symbol\":\"EURUSD\",\"unit_system\":\"forex\"}\n";
    }

    private static String cryptoLine(String id, String result, String delta, String completedAt) {
        return "{\"completed_at\":\"" + completedAt + "\",\"delta\":" + delta + ",\"delta_unit\":\"usd\","
            + "\"direction\":\"SELL\",\"exit_type\":\"TIME_CLOSE\",\"result\":\"" + result + "\","
            + "\"runtime_minutes\":121.5,\"signal_id\":\"" + id + "\",\"source\":\"CORE_CRYPTO_SMC\","
            + "\"symbol\":\"BTCUSD\",\"unit_system\":\"crypto\"}\n";
    }

    private void writeFixtures() throws IOException {
        Files.writeString(logDir.resolve("truth_log_forex.jsonl"),
            forexLine("FX_OLD", "LOSS", "-20.0", "2025-08-01T09:00:00Z")
                + "garbage line\n"
                + forexLine("FX_A", "WIN", "40.0", "2025-08-01T10:00:00Z")
                + forexLine("FX_B", "LOSS", "-20.0", "2025-08-01T12:00:00Z"));
        Files.writeString(logDir.resolve("truth_log_crypto.jsonl"),
            cryptoLine("CR_A", "WIN", "300.00", "2025-08-01T11:00:00Z"));
    }

    @Test
    @DisplayName("Merged view keeps the latest rows across partitions")
    public void testMergedTail() throws IOException {
        writeFixtures();

        int exit = inspector.run(new String[] {"3", "both"});

        assertEquals(TruthLogInspector.EXIT_OK, exit);
        String out = output();
        assertTrue(out.contains("FX_A"));
        assertTrue(out.contains("CR_A"));
        assertTrue(out.contains("FX_B"));
        assertFalse(out.contains("FX_OLD"));
        assertTrue(out.indexOf("FX_A") < out.indexOf("CR_A"));
        assertTrue(out.indexOf("CR_A") < out.indexOf("FX_B"));
        assertTrue(out.contains("2 wins, 1 losses, 0 timeouts, 66.7% win rate, +20.0 total pips, +300.00 total usd"),
            out);
    }

    @Test
    @DisplayName("Rows are ordered by completion instant, not by text")
    public void testOrderByInstant() throws IOException {
        Files.writeString(logDir.resolve("truth_log_forex.jsonl"),
            forexLine("FX_WHOLE", "WIN", "40.0", "2025-08-01T10:00:00Z")
                + forexLine("FX_FRACTION", "LOSS", "-20.0", "2025-08-01T10:00:00.500Z"));

        assertEquals(TruthLogInspector.EXIT_OK, inspector.run(new String[] {"5", "forex"}));

        String out = output();
        assertTrue(out.indexOf("FX_WHOLE") < out.indexOf("FX_FRACTION"), out);
    }

    @Test
    @DisplayName("Single partition filter")
    public void testCryptoOnly() throws IOException {
        writeFixtures();

        assertEquals(TruthLogInspector.EXIT_OK, inspector.run(new String[] {"5", "crypto"}));

        assertTrue(output().contains("CR_A"));
        assertFalse(output().contains("FX_A"));
    }

    @Test
    @DisplayName("Missing partitions are reported and exit cleanly")
    public void testMissingPartitions() {
        int exit = inspector.run(new String[] {});

        assertEquals(TruthLogInspector.EXIT_OK, exit);
        assertTrue(output().contains("No readable log for forex"));
        assertTrue(output().contains("No readable log for crypto"));
    }

    @Test
    @DisplayName("Unreadable partition exits with 1")
    public void testUnreadablePartition() throws IOException {
        Files.createDirectory(logDir.resolve("truth_log_forex.jsonl"));

        assertEquals(TruthLogInspector.EXIT_UNREADABLE, inspector.run(new String[] {"3", "forex"}));
    }

    @Test
    @DisplayName("Bad arguments print usage")
    public void testBadArguments() {
        assertEquals(TruthLogInspector.EXIT_USAGE, inspector.run(new String[] {"many"}));
        assertEquals(TruthLogInspector.EXIT_USAGE, inspector.run(new String[] {"3", "stocks"}));
        assertTrue(output().contains("Usage"));
    }

    @Test
    @DisplayName("Signal lookup prints every record for the id")
    public void testInspectSignal() throws IOException {
        writeFixtures();

        assertEquals(TruthLogInspector.EXIT_OK, inspector.inspectSignal("CR_A"));
        assertTrue(output().contains("\"signal_id\" : \"CR_A\""));

        assertEquals(TruthLogInspector.EXIT_OK, inspector.inspectSignal("NOPE"));
        assertTrue(output().contains("No truth log entry for NOPE"));
    }
}

package in.signaltruth.service.ingestion;

import in.signaltruth.application.service.TrackerRegistry;
import in.signaltruth.domain.outcome.ExitReason;
import in.signaltruth.domain.outcome.Outcome;
import in.signaltruth.domain.outcome.Result;
import in.signaltruth.domain.signal.SignalTracker;
import in.signaltruth.domain.signal.UnitSystem;
import in.signaltruth.infrastructure.metrics.TrackerMetrics;
import in.signaltruth.security.ProvenanceGuard;
import in.signaltruth.security.SignalInputValidator;
import in.signaltruth.service.ingestion.SignalIngestionService.ScanSummary;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("Signal Ingestion Service")
public class SignalIngestionServiceTest {

    private static final Instant NOW = Instant.parse("2025-08-01T12:00:00Z");

    @TempDir
    Path signalsDir;

    @Mock
    private TrackerMetrics metrics;

    private TrackerRegistry registry;
    private SignalIngestionService service;

    @BeforeEach
    public void setUp() {
        registry = new TrackerRegistry();
        service = new SignalIngestionService(
            new DirectorySignalSource(signalsDir),
            new SignalDeclarationParser(new ProvenanceGuard(), new SignalInputValidator()),
            registry,
            metrics,
            Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private void writeSignal(String fileName, String id, String source) throws IOException {
        Files.writeString(signalsDir.resolve(fileName), """
            {"signal_id": "%s", "symbol": "EURUSD", "direction": "BUY",
             "entry_price": 1.1000, "stop_loss": 1.0980, "take_profit": 1.1040,
             "created_at": "2025-08-01T11:59:00Z", "source": "%s"}
            """.formatted(id, source));
    }

    @Test
    @DisplayName("Valid declaration is admitted and counted")
    public void testAdmitsValidSignal() throws IOException {
        writeSignal("mission_1.json", "M1", "venom_scalp_master");

        ScanSummary summary = service.scanOnce();

        assertEquals(1, summary.admitted());
        assertTrue(registry.isActive("M1"));
        verify(metrics).recordAdmitted(UnitSystem.FOREX);
    }

    @Test
    @DisplayName("Unauthorized source never reaches the registry")
    public void testRejectsUnauthorizedSource() throws IOException {
        writeSignal("mission_2.json", "FAKE", "rogue_generator");

        ScanSummary summary = service.scanOnce();

        assertEquals(1, summary.rejected());
        assertFalse(registry.isActive("FAKE"));
        assertEquals(0, registry.stats().activeCount());
        verify(metrics).recordRejected("UNAUTHORIZED");
        verify(metrics, never()).recordAdmitted(any());
    }

    @Test
    @DisplayName("Files are read once per process")
    public void testFileReadOnce() throws IOException {
        writeSignal("mission_3.json", "M3", "venom_scalp_master");

        assertEquals(1, service.scanOnce().seen());
        assertEquals(0, service.scanOnce().seen());
    }

    @Test
    @DisplayName("User copy pattern is picked up, other files are ignored")
    public void testFilePatterns() throws IOException {
        writeSignal("5_EURUSD_USER42.json", "U42", "venom_scalp_master");
        writeSignal("notes.json", "IGNORED", "venom_scalp_master");

        service.scanOnce();

        assertTrue(registry.isActive("U42"));
        assertFalse(registry.isActive("IGNORED"));
    }

    @Test
    @DisplayName("Malformed file is skipped without aborting the scan")
    public void testMalformedFileSkipped() throws IOException {
        Files.writeString(signalsDir.resolve("mission_0_bad.json"), "{not json");
        writeSignal("mission_1_good.json", "GOOD", "venom_scalp_master");

        ScanSummary summary = service.scanOnce();

        assertEquals(1, summary.admitted());
        assertTrue(registry.isActive("GOOD"));
    }

    @Test
    @DisplayName("File caught mid-write is picked up once it is complete")
    public void testPartialFileRetried() throws IOException {
        Path file = signalsDir.resolve("mission_7.json");
        Files.writeString(file, "{\"signal_id\": \"M7\", \"symbol\": \"EURUSD\", \"dire");

        assertEquals(0, service.scanOnce().admitted());
        assertFalse(registry.isActive("M7"));

        writeSignal("mission_7.json", "M7", "venom_scalp_master");
        ScanSummary summary = service.scanOnce();

        assertEquals(1, summary.admitted());
        assertTrue(registry.isActive("M7"));
        assertEquals(0, service.scanOnce().seen());
    }

    @Test
    @DisplayName("Id already resolved is counted as a duplicate")
    public void testAlreadyProcessed() throws IOException {
        registry.seedProcessed(List.of("DONE"));
        writeSignal("mission_4.json", "DONE", "venom_scalp_master");

        ScanSummary summary = service.scanOnce();

        assertEquals(1, summary.duplicates());
        assertFalse(registry.isActive("DONE"));
        verify(metrics).recordRejected("ALREADY_PROCESSED");
    }

    @Test
    @DisplayName("Same id in a second file while active is not admitted twice")
    public void testSameIdWhileActive() throws IOException {
        writeSignal("mission_5a.json", "M5", "venom_scalp_master");
        writeSignal("mission_5b.json", "M5", "venom_scalp_master");

        ScanSummary summary = service.scanOnce();

        assertEquals(1, summary.admitted());
        assertEquals(1, summary.rejected());
        assertEquals(1, registry.stats().activeCount());
    }

    @Test
    @DisplayName("Id resolved between scans is not re-admitted from a new file")
    public void testResolvedBetweenScans() throws IOException {
        writeSignal("mission_6a.json", "M6", "venom_scalp_master");
        service.scanOnce();
        SignalTracker tracker = registry.snapshot().get(0);
        registry.resolve("M6", new Result(tracker, Outcome.WIN, ExitReason.TAKE_PROFIT, tracker.takeProfit(),
            tracker.takeProfit(), 10, new BigDecimal("40.0"), NOW, 7_200));

        writeSignal("mission_6b.json", "M6", "venom_scalp_master");
        ScanSummary summary = service.scanOnce();

        assertEquals(1, summary.duplicates());
        assertFalse(registry.isActive("M6"));
    }

    @Test
    @DisplayName("Missing signals directory yields an empty scan")
    public void testMissingDirectory() {
        SignalIngestionService missing = new SignalIngestionService(
            new DirectorySignalSource(signalsDir.resolve("not-there")),
            new SignalDeclarationParser(new ProvenanceGuard(), new SignalInputValidator()),
            registry,
            metrics,
            Clock.fixed(NOW, ZoneOffset.UTC));

        assertEquals(0, missing.scanOnce().seen());
        assertEquals(0, missing.scanOnce().seen());
    }
}

package in.signaltruth.application.service;

import in.signaltruth.domain.common.AdmissionResult;
import in.signaltruth.domain.outcome.ExitReason;
import in.signaltruth.domain.outcome.Outcome;
import in.signaltruth.domain.outcome.Result;
import in.signaltruth.domain.signal.SignalTracker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static in.signaltruth.TrackerFixtures.T0;
import static in.signaltruth.TrackerFixtures.eurUsdBuy;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Tracker Registry")
public class TrackerRegistryTest {

    private TrackerRegistry registry;

    @BeforeEach
    public void setUp() {
        registry = new TrackerRegistry();
    }

    private static Result lossFor(SignalTracker tracker) {
        return new Result(tracker, Outcome.LOSS, ExitReason.STOP_LOSS, tracker.stopLoss(), tracker.stopLoss(),
            60, new BigDecimal("-20.0"), T0.plusSeconds(60), 7_200);
    }

    @Test
    @DisplayName("Admitted tracker is active")
    public void testAdmit() {
        AdmissionResult result = registry.admit(eurUsdBuy("a"));

        assertTrue(result.isAdmitted());
        assertTrue(registry.isActive("a"));
        assertEquals(1, registry.stats().activeCount());
    }

    @Test
    @DisplayName("Second admit of an active id is rejected")
    public void testAdmitActiveTwice() {
        registry.admit(eurUsdBuy("a"));

        AdmissionResult second = registry.admit(eurUsdBuy("a"));

        assertEquals(AdmissionResult.Status.REJECTED, second.status());
        assertEquals("already active", second.reason());
        assertEquals(1, registry.stats().activeCount());
    }

    @Test
    @DisplayName("Resolved id can never be admitted again")
    public void testResolvedIsNeverReadmitted() {
        SignalTracker tracker = eurUsdBuy("a");
        registry.admit(tracker);

        assertTrue(registry.resolve("a", lossFor(tracker)));

        assertFalse(registry.isActive("a"));
        assertTrue(registry.isProcessed("a"));
        assertEquals(AdmissionResult.Status.ALREADY_PROCESSED, registry.admit(eurUsdBuy("a")).status());
    }

    @Test
    @DisplayName("Second resolve of the same id reports a duplicate")
    public void testDuplicateResolve() {
        SignalTracker tracker = eurUsdBuy("a");
        registry.admit(tracker);

        assertTrue(registry.resolve("a", lossFor(tracker)));
        assertFalse(registry.resolve("a", lossFor(tracker)));
        assertEquals(1, registry.stats().processedCount());
    }

    @Test
    @DisplayName("Seeded ids are treated as processed")
    public void testSeedProcessed() {
        int added = registry.seedProcessed(List.of("x", "y", "x"));

        assertEquals(2, added);
        assertEquals(AdmissionResult.Status.ALREADY_PROCESSED, registry.admit(eurUsdBuy("y")).status());
    }

    @Test
    @DisplayName("Callback may resolve while iterating")
    public void testResolveDuringIteration() {
        registry.admit(eurUsdBuy("a"));
        registry.admit(eurUsdBuy("b"));
        List<String> visited = new ArrayList<>();

        registry.forEachActive(tracker -> {
            visited.add(tracker.id());
            registry.resolve(tracker.id(), lossFor(tracker));
        });

        assertEquals(List.of("a", "b"), visited);
        assertEquals(0, registry.stats().activeCount());
        assertEquals(2, registry.stats().processedCount());
    }

    @Test
    @DisplayName("Concurrent admit and resolve never resolve an id twice")
    public void testConcurrentResolveExactlyOnce() throws Exception {
        int ids = 200;
        for (int i = 0; i < ids; i++) {
            registry.admit(eurUsdBuy("s" + i));
        }

        ExecutorService pool = Executors.newFixedThreadPool(4);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger wins = new AtomicInteger();
        for (int t = 0; t < 4; t++) {
            pool.submit(() -> {
                start.await();
                for (SignalTracker tracker : registry.snapshot()) {
                    if (registry.resolve(tracker.id(), lossFor(tracker))) {
                        wins.incrementAndGet();
                    }
                    registry.admit(eurUsdBuy(tracker.id()));
                }
                return null;
            });
        }
        start.countDown();
        pool.shutdown();
        assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));

        assertEquals(ids, wins.get());
        assertEquals(0, registry.stats().activeCount());
    }
}

package in.signaltruth.application.service;

import in.signaltruth.domain.common.AdmissionResult;
import in.signaltruth.domain.outcome.Result;
import in.signaltruth.domain.signal.SignalTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * TrackerRegistry - what is currently being watched.
 *
 * STRUCTURE:
 * - active: Map<signalId, SignalTracker> in admission order
 * - processed: Set<signalId> of every resolved signal, never shrinks
 *
 * THREAD-SAFETY:
 * One ReentrantLock guards both collections. The lock is held only to copy the active
 * set or to admit/resolve; callers iterate the copy outside the lock, so slow market
 * data calls during evaluation never block ingestion.
 *
 * LIFECYCLE:
 * 1. Optionally seeded at startup with ids already present in the truth log
 * 2. admit() when ingestion accepts a declaration
 * 3. resolve() when evaluation reaches a terminal outcome, before the result is logged
 */
public final class TrackerRegistry {
    private static final Logger log = LoggerFactory.getLogger(TrackerRegistry.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, SignalTracker> active = new LinkedHashMap<>();
    private final Set<String> processed = new HashSet<>();

    /**
     * Offer a tracker.
     *
     * @return ADMITTED, ALREADY_PROCESSED if the id was ever resolved, REJECTED if already active
     */
    public AdmissionResult admit(SignalTracker tracker) {
        lock.lock();
        try {
            if (processed.contains(tracker.id())) {
                return AdmissionResult.alreadyProcessed();
            }
            if (active.containsKey(tracker.id())) {
                return AdmissionResult.rejected("already active");
            }
            active.put(tracker.id(), tracker);
        } finally {
            lock.unlock();
        }
        log.debug("Tracker admitted: {} {} {}", tracker.id(), tracker.symbol(), tracker.direction());
        return AdmissionResult.admitted();
    }

    /**
     * Invoke {@code fn} for every active tracker, on a copy taken under the lock.
     * The callback runs without the lock and may call {@link #resolve}.
     */
    public void forEachActive(Consumer<SignalTracker> fn) {
        for (SignalTracker tracker : snapshot()) {
            fn.accept(tracker);
        }
    }

    /**
     * Point-in-time copy of the active trackers.
     */
    public List<SignalTracker> snapshot() {
        lock.lock();
        try {
            return new ArrayList<>(active.values());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Atomically retire a tracker: drop it from the active map and remember its id forever.
     *
     * @return false if the id was already resolved (the caller must not log the result again)
     */
    public boolean resolve(String signalId, Result result) {
        lock.lock();
        try {
            active.remove(signalId);
            if (!processed.add(signalId)) {
                log.warn("Duplicate resolve ignored: {} ({})", signalId, result.outcome());
                return false;
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Pre-populate the processed set (ids recovered from the truth log at startup).
     *
     * @return number of ids newly added
     */
    public int seedProcessed(Collection<String> signalIds) {
        lock.lock();
        try {
            int added = 0;
            for (String id : signalIds) {
                if (processed.add(id)) {
                    added++;
                }
            }
            log.info("TrackerRegistry seeded with {} processed ids", added);
            return added;
        } finally {
            lock.unlock();
        }
    }

    public boolean isProcessed(String signalId) {
        lock.lock();
        try {
            return processed.contains(signalId);
        } finally {
            lock.unlock();
        }
    }

    public boolean isActive(String signalId) {
        lock.lock();
        try {
            return active.containsKey(signalId);
        } finally {
            lock.unlock();
        }
    }

    public RegistryStats stats() {
        lock.lock();
        try {
            return new RegistryStats(active.size(), processed.size());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Registry statistics for monitoring.
     */
    public record RegistryStats(int activeCount, int processedCount) {}
}

package com.tubedigest.feed.service;

import com.tubedigest.config.DigestProperties;
import com.tubedigest.feed.model.StageBackoffState;
import com.tubedigest.feed.model.StageKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Central pacing gate for metered calls. Every call first sleeps a random jitter from
 * its stage's window; after throttling the stage also waits an exponential backoff.
 * The governor also owns the per-run quota counter.
 */
@Service
public class RateGovernor {
    private static final Logger log = LoggerFactory.getLogger(RateGovernor.class);

    @FunctionalInterface
    public interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }

    private final DigestProperties properties;
    private final Sleeper sleeper;
    private final Random random;
    private final Map<StageKind, Integer> consecutiveThrottles = new EnumMap<>(StageKind.class);
    private int quotaRemaining;

    @Autowired
    public RateGovernor(DigestProperties properties) {
        this(properties, Thread::sleep, new Random());
    }

    RateGovernor(DigestProperties properties, Sleeper sleeper, Random random) {
        this.properties = properties;
        this.sleeper = sleeper;
        this.random = random;
        for (StageKind stage : StageKind.values()) {
            consecutiveThrottles.put(stage, 0);
        }
    }

    /**
     * Blocks for jitter plus any pending backoff. Returns false when the wait was
     * interrupted; the interrupt flag is restored in that case.
     */
    public boolean acquire(StageKind stage) {
        long delay = jitterMs(stage) + nextBackoffMs(stage);
        if (delay <= 0) {
            return true;
        }
        try {
            sleeper.sleep(delay);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    public synchronized void recordThrottled(StageKind stage) {
        int k = consecutiveThrottles.get(stage) + 1;
        consecutiveThrottles.put(stage, k);
        log.info("{} throttled {} time(s) in a row; next backoff {}ms", stage, k, backoffFor(k));
    }

    public synchronized void recordSuccess(StageKind stage) {
        consecutiveThrottles.put(stage, 0);
    }

    public synchronized int consecutiveThrottles(StageKind stage) {
        return consecutiveThrottles.get(stage);
    }

    /**
     * {@code min(base * 2^k, cap)} for {@code k > 0} consecutive throttles, else 0.
     */
    public synchronized long nextBackoffMs(StageKind stage) {
        return backoffFor(consecutiveThrottles.get(stage));
    }

    public synchronized void startRun(int quota) {
        quotaRemaining = Math.max(0, quota);
    }

    /**
     * Grants up to {@code count} slots from the run quota.
     */
    public synchronized int reserve(int count) {
        int granted = Math.max(0, Math.min(count, quotaRemaining));
        quotaRemaining -= granted;
        return granted;
    }

    public synchronized int quotaRemaining() {
        return quotaRemaining;
    }

    public synchronized List<StageBackoffState> snapshot() {
        List<StageBackoffState> states = new ArrayList<>();
        for (StageKind stage : StageKind.values()) {
            int k = consecutiveThrottles.get(stage);
            states.add(new StageBackoffState(stage, k, backoffFor(k)));
        }
        return states;
    }

    private long backoffFor(int k) {
        if (k <= 0) {
            return 0L;
        }
        long base = properties.getGovernor().getBackoffBaseMs();
        long cap = properties.getGovernor().getBackoffCapMs();
        if (base <= 0) {
            return 0L;
        }
        // Shift overflow guard.
        if (k >= 62 || base > (cap >> Math.min(k, 62))) {
            return cap;
        }
        return Math.min(base << k, cap);
    }

    private long jitterMs(StageKind stage) {
        DigestProperties.Window window = windowFor(stage);
        long min = window.getMinDelayMs();
        long max = window.getMaxDelayMs();
        if (max <= min) {
            return min;
        }
        synchronized (random) {
            return min + (long) (random.nextDouble() * (max - min + 1));
        }
    }

    private DigestProperties.Window windowFor(StageKind stage) {
        DigestProperties.Governor governor = properties.getGovernor();
        return switch (stage) {
            case DISCOVERY -> governor.getDiscovery();
            case TRANSCRIPT -> governor.getTranscript();
            case SUMMARIZE -> governor.getSummarize();
        };
    }
}

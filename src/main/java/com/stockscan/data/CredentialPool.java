package com.stockscan.data;

import com.stockscan.config.Config;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded checkout/return pool of upstream credentials.
 * Each entry serves at most one in-flight request; assignment is round-robin. An entry returned
 * rate-limited {@code benchAfter} times in a row is benched for {@code cooldownMs}.
 */
public final class CredentialPool {
    private static final Logger LOG = LogManager.getLogger(CredentialPool.class);

    public enum Signal {
        OK,
        RATE_LIMITED,
        FAILED
    }

    private final List<Entry> entries;
    private final int benchAfter;
    private final long cooldownMs;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();
    private int cursor = 0;

    public CredentialPool(List<Credential> credentials, int benchAfter, long cooldownMs, Clock clock) {
        List<Credential> source = credentials == null || credentials.isEmpty()
                ? List.of(Credential.direct())
                : credentials;
        Map<String, Entry> unique = new LinkedHashMap<>();
        for (Credential credential : source) {
            if (unique.putIfAbsent(credential.id, new Entry(credential)) != null) {
                throw new IllegalArgumentException("duplicate credential id: " + credential.id);
            }
        }
        this.entries = new ArrayList<>(unique.values());
        this.benchAfter = Math.max(1, benchAfter);
        this.cooldownMs = Math.max(0L, cooldownMs);
        this.clock = clock;
    }

    public static CredentialPool fromConfig(Config config) throws IOException {
        List<Credential> credentials = new ArrayList<>();
        int index = 0;
        Path file = config.getPath("fetch.credentials.file");
        if (file != null) {
            for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
                String text = line.trim();
                if (text.isEmpty() || text.startsWith("#")) {
                    continue;
                }
                credentials.add(Credential.parse(text, ++index));
            }
        }
        for (String item : config.getList("fetch.credentials")) {
            credentials.add(Credential.parse(item, ++index));
        }
        return new CredentialPool(
                credentials,
                config.getInt("fetch.credential.bench_after", 3),
                config.getLong("fetch.credential.cooldown_ms", 60_000L),
                Clock.systemUTC()
        );
    }

    /**
     * Leases a free, non-benched credential, preferring one other than {@code avoidId}.
     * Waits at most {@code timeoutMs}; empty on timeout.
     */
    public Optional<Lease> checkout(String avoidId, long timeoutMs) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(Math.max(0L, timeoutMs));
        lock.lockInterruptibly();
        try {
            while (true) {
                long now = clock.millis();
                int idx = pick(avoidId, now);
                if (idx < 0 && avoidId != null) {
                    idx = pick(null, now);
                }
                if (idx >= 0) {
                    Entry entry = entries.get(idx);
                    entry.leased = true;
                    cursor = (idx + 1) % entries.size();
                    return Optional.of(new Lease(entry.credential));
                }
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0L) {
                    return Optional.empty();
                }
                long wait = remaining;
                long benchWaitMs = nextBenchExpiry(now);
                if (benchWaitMs > 0L) {
                    wait = Math.min(wait, TimeUnit.MILLISECONDS.toNanos(benchWaitMs));
                }
                changed.awaitNanos(wait);
            }
        } finally {
            lock.unlock();
        }
    }

    public void release(Lease lease, Signal signal) {
        lock.lock();
        try {
            if (lease.released) {
                throw new IllegalStateException("lease already returned: " + lease.credential.id);
            }
            lease.released = true;
            Entry entry = find(lease.credential.id);
            entry.leased = false;
            if (signal == Signal.RATE_LIMITED) {
                entry.rateLimitStreak++;
                if (entry.rateLimitStreak >= benchAfter) {
                    entry.benchedUntilMs = clock.millis() + cooldownMs;
                    entry.rateLimitStreak = 0;
                    LOG.warn("credential benched id={} cooldown_ms={}", entry.credential.id, cooldownMs);
                }
            } else if (signal == Signal.OK) {
                entry.rateLimitStreak = 0;
            }
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        return entries.size();
    }

    public boolean isBenched(String id) {
        lock.lock();
        try {
            return find(id).benchedUntilMs > clock.millis();
        } finally {
            lock.unlock();
        }
    }

    public int leasedCount() {
        lock.lock();
        try {
            int n = 0;
            for (Entry entry : entries) {
                if (entry.leased) {
                    n++;
                }
            }
            return n;
        } finally {
            lock.unlock();
        }
    }

    private int pick(String avoidId, long now) {
        int size = entries.size();
        for (int i = 0; i < size; i++) {
            int idx = (cursor + i) % size;
            Entry entry = entries.get(idx);
            if (entry.leased || entry.benchedUntilMs > now) {
                continue;
            }
            if (avoidId != null && avoidId.equals(entry.credential.id)) {
                continue;
            }
            return idx;
        }
        return -1;
    }

    private long nextBenchExpiry(long now) {
        long min = Long.MAX_VALUE;
        for (Entry entry : entries) {
            if (!entry.leased && entry.benchedUntilMs > now) {
                min = Math.min(min, entry.benchedUntilMs - now);
            }
        }
        return min == Long.MAX_VALUE ? 0L : min;
    }

    private Entry find(String id) {
        for (Entry entry : entries) {
            if (entry.credential.id.equals(id)) {
                return entry;
            }
        }
        throw new IllegalArgumentException("unknown credential: " + id);
    }

    private static final class Entry {
        final Credential credential;
        boolean leased;
        int rateLimitStreak;
        long benchedUntilMs;

        Entry(Credential credential) {
            this.credential = credential;
        }
    }

    public static final class Lease {
        private final Credential credential;
        private boolean released;

        private Lease(Credential credential) {
            this.credential = credential;
        }

        public Credential credential() {
            return credential;
        }
    }
}

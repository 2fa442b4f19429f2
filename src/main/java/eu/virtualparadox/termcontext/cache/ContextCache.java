package eu.virtualparadox.termcontext.cache;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Thread-safe, capacity- and time-bounded map from query term to resolved context.
 * <p>
 * Entries expire {@code ttl} after insertion. Expiry is checked lazily on {@link #get(String)};
 * there is no background sweep. Inserting past capacity evicts the least recently used entry.
 * All access goes through one lock whose critical sections only touch the map, so callers
 * never hold it across a fetch or a scoring step.
 */
@Slf4j
public class ContextCache {

    private final int capacity;
    private final Duration ttl;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private final LinkedHashMap<String, ContextEntry> entries;

    private long hits;
    private long misses;
    private long evictions;
    private long expirations;

    public ContextCache(final int capacity, final Duration ttl, final Clock clock) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive, was " + capacity);
        }
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive, was " + ttl);
        }
        this.capacity = capacity;
        this.ttl = ttl;
        this.clock = Objects.requireNonNull(clock, "clock");
        // access order gives LRU iteration, eldest first
        this.entries = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(final Map.Entry<String, ContextEntry> eldest) {
                if (size() > ContextCache.this.capacity) {
                    evictions++;
                    log.debug("Evicting least recently used context for '{}'", eldest.getKey());
                    return true;
                }
                return false;
            }
        };
    }

    /**
     * @param key query term, case-sensitive
     * @return the cached context, or empty when absent or expired
     */
    public Optional<String> get(final String key) {
        final Instant now = clock.instant();
        lock.lock();
        try {
            final ContextEntry entry = entries.get(key);
            if (entry == null) {
                misses++;
                return Optional.empty();
            }
            if (entry.isExpired(now)) {
                entries.remove(key);
                expirations++;
                misses++;
                return Optional.empty();
            }
            hits++;
            return Optional.of(entry.value());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stores {@code value} under {@code key}, replacing any previous entry and restarting its TTL.
     */
    public void put(final String key, final String value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        final ContextEntry entry = new ContextEntry(value, clock.instant(), ttl);
        lock.lock();
        try {
            entries.put(key, entry);
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return number of physically stored entries, expired ones not yet accessed included
     */
    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    public void invalidateAll() {
        lock.lock();
        try {
            entries.clear();
        } finally {
            lock.unlock();
        }
    }

    public CacheStats stats() {
        lock.lock();
        try {
            return new CacheStats(hits, misses, evictions, expirations, entries.size());
        } finally {
            lock.unlock();
        }
    }

    public int getCapacity() {
        return capacity;
    }

    public Duration getTtl() {
        return ttl;
    }
}

package com.largomodo.palletquote.engine;

import com.largomodo.palletquote.core.domain.Container;
import com.largomodo.palletquote.core.domain.Dimensions;
import com.largomodo.palletquote.core.domain.LengthUnit;
import com.largomodo.palletquote.core.domain.OptimizationResult;
import com.largomodo.palletquote.core.domain.PalletTemplate;
import com.largomodo.palletquote.core.domain.ProductRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.LongSupplier;

/**
 * Bounded memo of optimization results, least recently used entries evicted first.
 * <p>
 * Thread-safe. Entries older than the configured time-to-live are dropped on lookup.
 * A capacity of zero disables memoization entirely.
 */
public class OptimizationCache {

    private static final Logger log = LoggerFactory.getLogger(OptimizationCache.class);

    private final int maxEntries;
    private final long ttlNanos;
    private final LongSupplier ticker;
    private final Map<CacheKey, Entry> entries;

    private long hits;
    private long misses;

    public OptimizationCache(int maxEntries, Duration ttl) {
        this(maxEntries, ttl, System::nanoTime);
    }

    /**
     * @param ticker monotonic nanosecond clock, replaceable in tests
     */
    OptimizationCache(int maxEntries, Duration ttl, LongSupplier ticker) {
        if (maxEntries < 0) {
            throw new IllegalArgumentException("maxEntries cannot be negative: " + maxEntries);
        }
        if (ttl == null || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be zero or positive");
        }
        this.maxEntries = maxEntries;
        this.ttlNanos = ttl.toNanos();
        this.ticker = ticker;
        this.entries = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<CacheKey, Entry> eldest) {
                return size() > OptimizationCache.this.maxEntries;
            }
        };
    }

    public boolean isEnabled() {
        return maxEntries > 0;
    }

    public synchronized Optional<OptimizationResult> get(CacheKey key) {
        Entry entry = entries.get(key);
        if (entry != null && isExpired(entry)) {
            entries.remove(key);
            entry = null;
        }
        if (entry == null) {
            misses++;
            return Optional.empty();
        }
        hits++;
        return Optional.of(entry.result());
    }

    public synchronized void put(CacheKey key, OptimizationResult result) {
        if (!isEnabled()) {
            return;
        }
        entries.put(key, new Entry(result, ticker.getAsLong()));
        log.debug("Memoized result ({} of {} entries)", entries.size(), maxEntries);
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized long hitCount() {
        return hits;
    }

    public synchronized long missCount() {
        return misses;
    }

    public synchronized void clear() {
        entries.clear();
    }

    private boolean isExpired(Entry entry) {
        return ttlNanos > 0 && ticker.getAsLong() - entry.storedAt() >= ttlNanos;
    }

    private record Entry(OptimizationResult result, long storedAt) {
    }

    /**
     * Structural cache key over normalized inputs.
     * <p>
     * Requests are normalized to centimeters and sorted, so the same demand in a
     * different list order or unit maps to the same key. Record equality provides
     * the structural hash.
     */
    public record CacheKey(List<ProductRequest> requests, Container container, PalletTemplate pallet) {

        private static final Comparator<Dimensions> DIMENSIONS_ORDER = Comparator
                .comparingDouble(Dimensions::length)
                .thenComparingDouble(Dimensions::width)
                .thenComparingDouble(Dimensions::height)
                .thenComparing(Dimensions::unit, Comparator.nullsFirst(Comparator.<LengthUnit>naturalOrder()));

        private static final Comparator<ProductRequest> CANONICAL_ORDER = Comparator
                .comparing((ProductRequest r) -> r.product().id(), Comparator.nullsFirst(Comparator.<String>naturalOrder()))
                .thenComparing(r -> r.product().name(), Comparator.nullsFirst(Comparator.<String>naturalOrder()))
                .thenComparing(r -> r.product().sku(), Comparator.nullsFirst(Comparator.<String>naturalOrder()))
                .thenComparingInt(ProductRequest::quantity)
                .thenComparing(r -> r.product().weight(), Comparator.nullsFirst(Comparator.<Double>naturalOrder()))
                .thenComparing(r -> r.product().dimensions(), Comparator.nullsFirst(DIMENSIONS_ORDER));

        public CacheKey {
            requests = List.copyOf(requests);
        }

        public static CacheKey of(List<ProductRequest> requests, Container container, PalletTemplate pallet,
                                  UnitNormalizer normalizer) {
            List<ProductRequest> canonical = requests.stream()
                    .map(normalizer::normalize)
                    .sorted(CANONICAL_ORDER)
                    .toList();
            return new CacheKey(canonical, normalizer.normalize(container), normalizer.normalize(pallet));
        }
    }
}

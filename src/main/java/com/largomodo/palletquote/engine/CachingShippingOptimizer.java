package com.largomodo.palletquote.engine;

import com.largomodo.palletquote.core.domain.Container;
import com.largomodo.palletquote.core.domain.OptimizationResult;
import com.largomodo.palletquote.core.domain.PalletTemplate;
import com.largomodo.palletquote.core.domain.ProductRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Memoizing decorator around another {@link ShippingOptimizer}.
 * <p>
 * Results are immutable records, so a cached instance is handed out as is.
 * Concurrent misses for the same key may each compute; the last one stored wins.
 */
public class CachingShippingOptimizer implements ShippingOptimizer {

    private static final Logger log = LoggerFactory.getLogger(CachingShippingOptimizer.class);

    private final ShippingOptimizer delegate;
    private final OptimizationCache cache;
    private final UnitNormalizer normalizer;

    public CachingShippingOptimizer(ShippingOptimizer delegate, OptimizationCache cache, UnitNormalizer normalizer) {
        this.delegate = delegate;
        this.cache = cache;
        this.normalizer = normalizer;
    }

    @Override
    public OptimizationResult optimize(List<ProductRequest> requests, Container container, PalletTemplate pallet) {
        OptimizationPipeline.requireInputs(requests, container, pallet);
        if (!cache.isEnabled()) {
            return delegate.optimize(requests, container, pallet);
        }

        OptimizationCache.CacheKey key = OptimizationCache.CacheKey.of(requests, container, pallet, normalizer);
        Optional<OptimizationResult> cached = cache.get(key);
        if (cached.isPresent()) {
            log.debug("Cache hit for {} request(s)", requests.size());
            return cached.get();
        }

        OptimizationResult result = delegate.optimize(requests, container, pallet);
        cache.put(key, result);
        return result;
    }
}

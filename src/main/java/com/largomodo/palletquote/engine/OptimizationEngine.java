package com.largomodo.palletquote.engine;

import com.largomodo.palletquote.core.StandardPallet;
import com.largomodo.palletquote.core.domain.Container;
import com.largomodo.palletquote.core.domain.OptimizationResult;
import com.largomodo.palletquote.core.domain.OptimizationSummary;
import com.largomodo.palletquote.core.domain.PalletTemplate;
import com.largomodo.palletquote.core.domain.ProductRequest;
import com.largomodo.palletquote.core.domain.ShelfPalletPacker;
import com.largomodo.palletquote.core.domain.ValidationResult;

import java.util.List;

/**
 * Entry point exposing the three engine operations: validation, optimization and
 * summary projection.
 * <p>
 * Instances are safe to share between threads. Use {@link #create(OptimizerSettings)}
 * for the standard wiring (shelf packer behind a memoizing decorator).
 */
public class OptimizationEngine {

    private final ProductValidator validator;
    private final ShippingOptimizer optimizer;
    private final ResultAssembler assembler;
    private final OptimizationCache cache;

    public OptimizationEngine(ProductValidator validator, ShippingOptimizer optimizer,
                              ResultAssembler assembler, OptimizationCache cache) {
        this.validator = validator;
        this.optimizer = optimizer;
        this.assembler = assembler;
        this.cache = cache;
    }

    public static OptimizationEngine create() {
        return create(OptimizerSettings.defaults());
    }

    public static OptimizationEngine create(OptimizerSettings settings) {
        if (settings == null) {
            throw new IllegalArgumentException("settings must not be null");
        }
        ProductValidator validator = new ProductValidator();
        UnitNormalizer normalizer = new UnitNormalizer();
        ResultAssembler assembler = new ResultAssembler(settings.successMessage());
        ShippingOptimizer pipeline = new OptimizationPipeline(validator, normalizer,
                new ShelfPalletPacker(settings.epsilon(), settings.allowRotation()),
                new UtilizationCalculator(), assembler);
        OptimizationCache cache = new OptimizationCache(settings.cacheMaxEntries(), settings.cacheTtl());
        return new OptimizationEngine(validator, new CachingShippingOptimizer(pipeline, cache, normalizer),
                assembler, cache);
    }

    public ValidationResult validateProducts(List<ProductRequest> requests) {
        return validator.validateProducts(requests);
    }

    public OptimizationResult optimize(List<ProductRequest> requests, Container container, PalletTemplate pallet) {
        return optimizer.optimize(requests, container, pallet);
    }

    /**
     * Optimizes onto {@link StandardPallet#DEFAULT} pallets.
     */
    public OptimizationResult optimize(List<ProductRequest> requests, Container container) {
        return optimizer.optimize(requests, container, StandardPallet.DEFAULT.toTemplate());
    }

    public OptimizationSummary prepareSummary(OptimizationResult result) {
        return assembler.prepareOptimizationSummary(result);
    }

    public OptimizationCache getCache() {
        return cache;
    }
}

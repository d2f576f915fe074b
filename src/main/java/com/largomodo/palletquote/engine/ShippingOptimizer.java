package com.largomodo.palletquote.engine;

import com.largomodo.palletquote.core.domain.Container;
import com.largomodo.palletquote.core.domain.OptimizationResult;
import com.largomodo.palletquote.core.domain.PalletTemplate;
import com.largomodo.palletquote.core.domain.ProductRequest;

import java.util.List;

/**
 * Computes a shipment loading plan from caller-owned inputs.
 * <p>
 * Implementations are synchronous and deterministic, never mutate their inputs, and
 * report user input errors through {@code success=false} rather than exceptions.
 */
public interface ShippingOptimizer {

    /**
     * @param requests  product demand, must not be null nor contain null entries
     * @param container container envelope, must not be null
     * @param pallet    pallet template, must not be null
     * @return loading plan with utilization and unplaced remainder
     * @throws IllegalArgumentException on null arguments (programming errors)
     */
    OptimizationResult optimize(List<ProductRequest> requests, Container container, PalletTemplate pallet);
}

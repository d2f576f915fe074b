package com.largomodo.palletquote.core.domain;

import java.util.List;

/**
 * Outcome of one optimization call.
 * <p>
 * Input errors are reported with {@code success=false} and a message. A partial
 * placement is still a success: callers detect it through a non-empty
 * {@link #remainingProducts()}.
 *
 * @param success            false for empty, invalid or oversized input
 * @param message            human-readable outcome, may be null
 * @param utilization        placed goods volume as a percentage of the container volume
 * @param weightUtilization  gross weight as a percentage of container capacity, null when the
 *                           container has no weight limit or the call failed
 * @param palletArrangements loaded pallets in loading order (unmodifiable)
 * @param remainingProducts  requested units that could not be placed (unmodifiable)
 */
public record OptimizationResult(boolean success, String message, double utilization, Double weightUtilization,
                                 List<PalletArrangement> palletArrangements,
                                 List<ProductRequest> remainingProducts) {

    public OptimizationResult {
        palletArrangements = List.copyOf(palletArrangements);
        remainingProducts = List.copyOf(remainingProducts);
    }

    public static OptimizationResult failure(String message, List<ProductRequest> remainingProducts) {
        return new OptimizationResult(false, message, 0.0, null, List.of(), remainingProducts);
    }

    public boolean hasRemainingProducts() {
        return !remainingProducts.isEmpty();
    }
}

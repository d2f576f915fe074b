package com.largomodo.palletquote.core.domain;

/**
 * Condensed, display-oriented projection of an {@link OptimizationResult}.
 * Always recomputed from a result, never mutated on its own.
 *
 * @param success           copied from the result
 * @param utilization       volume utilization rounded to two decimals
 * @param totalPallets      number of loaded pallets
 * @param totalProducts     number of units placed across all pallets
 * @param remainingProducts number of units left unplaced
 * @param weightUtilization weight utilization rounded to two decimals, null when absent
 * @param message           copied from the result
 */
public record OptimizationSummary(boolean success, double utilization, int totalPallets, long totalProducts,
                                  long remainingProducts, Double weightUtilization, String message) {
}

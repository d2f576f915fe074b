package com.largomodo.palletquote.core.domain;

/**
 * Pallet model the optimizer instantiates as many times as needed.
 *
 * @param dimensions  deck footprint (length x width) and deck height (must not be null)
 * @param tareWeight  weight of the empty pallet in kilograms
 * @param maxWeight   goods capacity in kilograms, tare excluded; null when unlimited
 */
public record PalletTemplate(Dimensions dimensions, double tareWeight, Double maxWeight) {

    public PalletTemplate {
        if (dimensions == null) {
            throw new IllegalArgumentException("Pallet dimensions must not be null");
        }
    }

    public PalletTemplate withDimensions(Dimensions newDimensions) {
        return new PalletTemplate(newDimensions, tareWeight, maxWeight);
    }
}

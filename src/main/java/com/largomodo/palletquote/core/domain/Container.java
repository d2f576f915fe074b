package com.largomodo.palletquote.core.domain;

/**
 * Shipping container interior envelope and total weight capacity.
 *
 * @param dimensions interior dimensions (must not be null)
 * @param maxWeight  total weight capacity in kilograms (pallet tare included), null when unlimited
 */
public record Container(Dimensions dimensions, Double maxWeight) {

    public Container {
        if (dimensions == null) {
            throw new IllegalArgumentException("Container dimensions must not be null");
        }
    }

    public Container withDimensions(Dimensions newDimensions) {
        return new Container(newDimensions, maxWeight);
    }
}

package com.largomodo.palletquote.core.domain;

/**
 * A run of identical units placed side by side on a pallet.
 * <p>
 * The position is the near corner of the first unit; the remaining units of the
 * run follow it along the x axis, each advanced by the unit's rotated length.
 *
 * @param productId product identifier of every unit in the run, or its display name when the product has no id
 * @param quantity  number of units in the run (positive)
 * @param position  near corner of the first unit relative to the pallet deck
 * @param rotation  orientation of every unit in the run
 */
public record Placement(String productId, int quantity, Position position, Rotation rotation) {

    public Placement {
        if (quantity <= 0) {
            throw new IllegalArgumentException("quantity must be positive, got: " + quantity);
        }
        if (position == null) {
            throw new IllegalArgumentException("position must not be null");
        }
        if (rotation == null) {
            rotation = Rotation.NONE;
        }
    }
}

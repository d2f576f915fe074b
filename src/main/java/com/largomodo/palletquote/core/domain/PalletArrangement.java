package com.largomodo.palletquote.core.domain;

import java.util.List;

/**
 * Immutable description of one loaded pallet inside the container.
 * <p>
 * Captures where the pallet stands, which product runs sit on it, its gross weight
 * and how much of its loadable volume the goods consume. Produced by the result
 * assembler from the packer's output and the utilization figures.
 *
 * @param pallet      pallet template this instance was made from (canonical units)
 * @param position    near corner of the pallet on the container floor
 * @param rotated     true when the pallet footprint is turned 90 degrees in the container
 * @param placements  product runs on this pallet, in placement order (unmodifiable)
 * @param weight      tare plus goods, in kilograms
 * @param utilization percentage of footprint x usable stack height consumed by goods
 */
public record PalletArrangement(PalletTemplate pallet, Position position, boolean rotated,
                                List<Placement> placements, double weight, double utilization) {
    /**
     * Compact constructor that ensures placements is an unmodifiable copy.
     */
    public PalletArrangement {
        placements = List.copyOf(placements);
    }

    public long unitCount() {
        return placements.stream().mapToLong(Placement::quantity).sum();
    }
}

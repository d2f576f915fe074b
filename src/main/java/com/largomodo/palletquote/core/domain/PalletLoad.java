package com.largomodo.palletquote.core.domain;

import java.util.List;

/**
 * Raw packer output for one pallet, before utilization figures are attached.
 *
 * @param origin      near corner of the pallet on the container floor
 * @param rotated     true when the pallet footprint is turned 90 degrees in the container
 * @param placements  product runs in placement order (unmodifiable)
 * @param goodsWeight summed weight of placed units in kilograms, tare excluded
 * @param goodsVolume summed volume of placed units in cubic centimeters
 */
public record PalletLoad(Position origin, boolean rotated, List<Placement> placements,
                         double goodsWeight, double goodsVolume) {

    public PalletLoad {
        placements = List.copyOf(placements);
    }

    public long unitCount() {
        return placements.stream().mapToLong(Placement::quantity).sum();
    }
}

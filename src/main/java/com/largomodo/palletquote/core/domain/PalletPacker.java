package com.largomodo.palletquote.core.domain;

import java.util.List;

/**
 * Strategy interface for loading product units onto pallets inside a container.
 * <p>
 * Implementations decide how many pallets the container holds, which units go on
 * which pallet and where, while respecting footprint, stack height and weight limits.
 * Inputs must already be validated and expressed in canonical units.
 */
public interface PalletPacker {
    /**
     * Packs product units onto pallet instances using implementation-specific strategy.
     * <p>
     * Placed plus remaining quantities always add up to the requested quantities.
     *
     * @param requests  product requests with positive quantities, canonical units, must not be null
     * @param container container envelope in canonical units, must not be null
     * @param pallet    pallet template in canonical units, must not be null
     * @return loaded pallets and unplaced remainder
     * @throws OversizedProductException if a unit or the pallet itself cannot fit in any allowed orientation
     * @throws IllegalArgumentException  if any argument is null
     */
    PackingPlan pack(List<ProductRequest> requests, Container container, PalletTemplate pallet);
}

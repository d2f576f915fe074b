package com.largomodo.palletquote.core.domain;

import java.util.List;

/**
 * Everything a {@link PalletPacker} decided for one call.
 *
 * @param loads       loaded pallets in loading order (unmodifiable)
 * @param remaining   requests carrying the unplaced quantity of each product (unmodifiable)
 * @param palletSlots number of pallet positions the container offers
 */
public record PackingPlan(List<PalletLoad> loads, List<ProductRequest> remaining, int palletSlots) {

    public PackingPlan {
        loads = List.copyOf(loads);
        remaining = List.copyOf(remaining);
    }
}

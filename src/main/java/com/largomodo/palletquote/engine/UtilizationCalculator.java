package com.largomodo.palletquote.engine;

import com.largomodo.palletquote.core.domain.Container;
import com.largomodo.palletquote.core.domain.Dimensions;
import com.largomodo.palletquote.core.domain.PackingPlan;
import com.largomodo.palletquote.core.domain.PalletLoad;
import com.largomodo.palletquote.core.domain.PalletTemplate;

import java.util.ArrayList;
import java.util.List;

/**
 * Derives volume and weight utilization from a completed packing plan.
 * All figures are percentages clamped to [0, 100].
 */
public class UtilizationCalculator {

    /**
     * @param plan      packer output
     * @param container container in canonical units
     * @param pallet    pallet template in canonical units
     * @return utilization figures at full precision
     */
    public UtilizationReport calculate(PackingPlan plan, Container container, PalletTemplate pallet) {
        Dimensions containerDims = container.dimensions();
        Dimensions deck = pallet.dimensions();
        double loadableVolume = deck.footprintArea() * (containerDims.height() - deck.height());

        double placedVolume = 0;
        double grossWeight = 0;
        List<Double> perPallet = new ArrayList<>();
        for (PalletLoad load : plan.loads()) {
            placedVolume += load.goodsVolume();
            grossWeight += pallet.tareWeight() + load.goodsWeight();
            perPallet.add(percentage(load.goodsVolume(), loadableVolume));
        }

        Double weightUtilization = container.maxWeight() == null
                ? null
                : percentage(grossWeight, container.maxWeight());

        return new UtilizationReport(percentage(placedVolume, containerDims.volume()),
                perPallet, weightUtilization, grossWeight);
    }

    static double percentage(double part, double whole) {
        if (whole <= 0 || !Double.isFinite(whole)) {
            return 0.0;
        }
        double ratio = part / whole * 100.0;
        return Math.max(0.0, Math.min(100.0, ratio));
    }
}

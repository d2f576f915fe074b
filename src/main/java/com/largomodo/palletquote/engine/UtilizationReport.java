package com.largomodo.palletquote.engine;

import java.util.List;

/**
 * Utilization percentages derived from a packing plan, at full precision.
 *
 * @param volumeUtilization placed volume over container volume
 * @param palletUtilization per-pallet placed volume over loadable volume, in loading order
 * @param weightUtilization gross weight over container capacity, null when capacity is not set
 * @param grossWeight       tare of every pallet plus all placed goods, in kilograms
 */
public record UtilizationReport(double volumeUtilization, List<Double> palletUtilization,
                                Double weightUtilization, double grossWeight) {

    public UtilizationReport {
        palletUtilization = List.copyOf(palletUtilization);
    }
}

package com.largomodo.palletquote.core;

import com.largomodo.palletquote.core.domain.Dimensions;
import com.largomodo.palletquote.core.domain.PalletTemplate;

/**
 * Pallet presets with deck geometry and weight ratings.
 * <p>
 * Max weight is the goods capacity; tare is added on top when the container
 * weight limit is checked. {@link #DEFAULT} is used when a caller supplies no template.
 */
public enum StandardPallet {
    // 1200 x 800 mm EPAL
    EURO("Euro Pallet", 120, 80, 14.4, 25, 1500),
    STANDARD("Standard Pallet", 120, 100, 14.4, 30, 1500),
    INDUSTRIAL("Industrial Pallet", 120, 120, 14.4, 35, 2000),
    DEFAULT("Default Pallet", 120, 100, 15, 20, 1000);

    private final String label;
    private final double length;
    private final double width;
    private final double height;
    private final double tareWeight;
    private final double maxWeight;

    StandardPallet(String label, double length, double width, double height, double tareWeight, double maxWeight) {
        this.label = label;
        this.length = length;
        this.width = width;
        this.height = height;
        this.tareWeight = tareWeight;
        this.maxWeight = maxWeight;
    }

    public PalletTemplate toTemplate() {
        return new PalletTemplate(Dimensions.centimeters(length, width, height), tareWeight, maxWeight);
    }

    public String getLabel() {
        return label;
    }

    public double getTareWeight() {
        return tareWeight;
    }

    public double getMaxWeight() {
        return maxWeight;
    }
}

package com.largomodo.palletquote.core;

import com.largomodo.palletquote.core.domain.Container;
import com.largomodo.palletquote.core.domain.Dimensions;

/**
 * ISO shipping container presets with interior dimensions and payload limits.
 * <p>
 * Interior figures are the usable envelope, not the external box size, so the
 * packer can use them directly. Payload limits follow the typical ratings published
 * by carriers for dry-van units.
 */
public enum StandardContainer {
    TWENTY_FOOT("20ft Standard", 590, 235, 239, 28_000),
    FORTY_FOOT("40ft Standard", 1203, 235, 239, 26_500),
    FORTY_FOOT_HIGH_CUBE("40ft High Cube", 1203, 235, 270, 26_500);

    private final String label;
    private final double length;
    private final double width;
    private final double height;
    private final double maxWeight;

    StandardContainer(String label, double length, double width, double height, double maxWeight) {
        this.label = label;
        this.length = length;
        this.width = width;
        this.height = height;
        this.maxWeight = maxWeight;
    }

    public Container toContainer() {
        return new Container(Dimensions.centimeters(length, width, height), maxWeight);
    }

    public String getLabel() {
        return label;
    }

    public double getMaxWeight() {
        return maxWeight;
    }
}

package com.largomodo.palletquote.core.domain;

import java.util.List;

/**
 * Shelf-packing cursor over one pallet deck.
 * <p>
 * Units are laid along x until the deck length is used, then a new row starts
 * behind the deepest unit of the current row, then a new layer starts on top of
 * the tallest unit of the current layer. Rows never overlap because each row
 * begins past the deepest unit of the previous one; layers likewise.
 * <p>
 * Not thread-safe: one cursor per pallet being loaded.
 */
final class ShelfCursor {

    /**
     * Unit extents in one orientation.
     *
     * @param length extent along the deck's x axis
     * @param width  extent along the deck's y axis
     * @param height vertical extent
     * @param turned true when length and width are swapped relative to the product
     */
    record Footprint(double length, double width, double height, boolean turned) {
    }

    record Slot(Position position, Footprint footprint) {
    }

    private final double deckLength;
    private final double deckWidth;
    private final double stackHeight;
    private final double epsilon;

    private double x;
    private double y;
    private double z;
    private double rowDepth;
    private double layerHeight;

    ShelfCursor(double deckLength, double deckWidth, double stackHeight, double epsilon) {
        this.deckLength = deckLength;
        this.deckWidth = deckWidth;
        this.stackHeight = stackHeight;
        this.epsilon = epsilon;
    }

    /**
     * Finds the next free slot for a unit, trying each orientation at the current row
     * first, then at a new row, then at a new layer.
     *
     * @param options allowed orientations in order of preference
     * @return the committed slot, or null when the deck is full for this unit
     */
    Slot place(List<Footprint> options) {
        for (Footprint option : options) {
            if (fitsCurrentRow(option)) {
                return commit(option);
            }
        }
        if (rowDepth > 0) {
            for (Footprint option : options) {
                if (fitsNewRow(option)) {
                    y += rowDepth;
                    x = 0;
                    rowDepth = 0;
                    return commit(option);
                }
            }
        }
        if (layerHeight > 0) {
            for (Footprint option : options) {
                if (fitsNewLayer(option)) {
                    z += layerHeight;
                    x = 0;
                    y = 0;
                    rowDepth = 0;
                    layerHeight = 0;
                    return commit(option);
                }
            }
        }
        return null;
    }

    private boolean fitsCurrentRow(Footprint f) {
        return x + f.length() <= deckLength + epsilon
                && y + f.width() <= deckWidth + epsilon
                && z + f.height() <= stackHeight + epsilon;
    }

    private boolean fitsNewRow(Footprint f) {
        return f.length() <= deckLength + epsilon
                && y + rowDepth + f.width() <= deckWidth + epsilon
                && z + f.height() <= stackHeight + epsilon;
    }

    private boolean fitsNewLayer(Footprint f) {
        return f.length() <= deckLength + epsilon
                && f.width() <= deckWidth + epsilon
                && z + layerHeight + f.height() <= stackHeight + epsilon;
    }

    private Slot commit(Footprint f) {
        Position position = new Position(x, y, z);
        x += f.length();
        rowDepth = Math.max(rowDepth, f.width());
        layerHeight = Math.max(layerHeight, f.height());
        return new Slot(position, f);
    }
}

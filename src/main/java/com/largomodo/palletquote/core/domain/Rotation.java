package com.largomodo.palletquote.core.domain;

/**
 * Rotation about the x, y and z axes in degrees.
 */
public record Rotation(double x, double y, double z) {

    /** Axis-aligned as given. */
    public static final Rotation NONE = new Rotation(0, 0, 0);

    /** Turned 90 degrees about the vertical axis: length and width swapped. */
    public static final Rotation QUARTER_TURN = new Rotation(0, 0, 90);
}

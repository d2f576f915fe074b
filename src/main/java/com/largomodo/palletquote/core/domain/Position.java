package com.largomodo.palletquote.core.domain;

/**
 * Offset from a near corner, in centimeters.
 */
public record Position(double x, double y, double z) {

    public static final Position ORIGIN = new Position(0, 0, 0);
}

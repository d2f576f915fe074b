package com.largomodo.palletquote.core.domain;

/**
 * Length, width and height of a box-shaped item, tagged with the unit they are expressed in.
 * <p>
 * Deliberately not validated on construction: products arrive from user-maintained
 * catalogs and a zero or negative component must surface as an "invalid product"
 * verdict from {@code ProductValidator}, not as an exception. The unit may be null
 * when the source named a unit that is not recognised.
 *
 * @param length extent along the x axis
 * @param width  extent along the y axis
 * @param height extent along the z axis (vertical)
 * @param unit   unit of all three components, null if unrecognised
 */
public record Dimensions(double length, double width, double height, LengthUnit unit) {

    public static Dimensions centimeters(double length, double width, double height) {
        return new Dimensions(length, width, height, LengthUnit.CENTIMETERS);
    }

    public double volume() {
        return length * width * height;
    }

    public double footprintArea() {
        return length * width;
    }
}

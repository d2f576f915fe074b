package com.largomodo.palletquote.core.domain;

import java.util.Locale;
import java.util.Optional;

/**
 * Linear units accepted for product, container and pallet dimensions.
 * <p>
 * Centimeters are the canonical unit: every dimension is converted to centimeters
 * before any comparison or placement math happens.
 */
public enum LengthUnit {
    CENTIMETERS("cm", 1.0),
    MILLIMETERS("mm", 0.1),
    INCHES("in", 2.54);

    private final String symbol;
    private final double centimetersPerUnit;

    LengthUnit(String symbol, double centimetersPerUnit) {
        this.symbol = symbol;
        this.centimetersPerUnit = centimetersPerUnit;
    }

    /**
     * Resolves a unit from its short symbol ("cm", "mm", "in"), ignoring case and
     * surrounding whitespace.
     *
     * @param symbol unit symbol as typed by a user, may be null
     * @return the matching unit, or empty when the symbol is not recognised
     */
    public static Optional<LengthUnit> fromSymbol(String symbol) {
        if (symbol == null) {
            return Optional.empty();
        }
        String normalized = symbol.trim().toLowerCase(Locale.ROOT);
        for (LengthUnit unit : values()) {
            if (unit.symbol.equals(normalized)) {
                return Optional.of(unit);
            }
        }
        return Optional.empty();
    }

    public double toCentimeters(double value) {
        return value * centimetersPerUnit;
    }

    public String getSymbol() {
        return symbol;
    }

    public double getCentimetersPerUnit() {
        return centimetersPerUnit;
    }
}

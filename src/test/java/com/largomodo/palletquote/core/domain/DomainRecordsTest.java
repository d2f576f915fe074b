package com.largomodo.palletquote.core.domain;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DomainRecordsTest {

    private static final PalletTemplate PALLET = new PalletTemplate(Dimensions.centimeters(120, 100, 15), 20, 1000.0);

    @Test
    void testDisplayNameFallbackChain() {
        assertEquals("Name", new Product("id", "Name", "sku", null, null).displayName());
        assertEquals("sku", new Product("id", " ", "sku", null, null).displayName());
        assertEquals("id", new Product("id", null, null, null, null).displayName());
        assertEquals("Unknown product", new Product(null, null, null, null, null).displayName());
    }

    @Test
    void testDimensionsVolumeAndFootprint() {
        Dimensions dimensions = Dimensions.centimeters(2, 3, 4);

        assertEquals(24.0, dimensions.volume());
        assertEquals(6.0, dimensions.footprintArea());
    }

    @Test
    void testPlacementDefaultsRotation() {
        Placement placement = new Placement("a", 2, Position.ORIGIN, null);

        assertEquals(Rotation.NONE, placement.rotation());
    }

    @Test
    void testPlacementRejectsNonPositiveQuantity() {
        assertThrows(IllegalArgumentException.class, () -> new Placement("a", 0, Position.ORIGIN, Rotation.NONE));
        assertThrows(IllegalArgumentException.class, () -> new Placement("a", 1, null, Rotation.NONE));
    }

    @Test
    void testArrangementDefensiveCopy() {
        List<Placement> placements = new ArrayList<>();
        placements.add(new Placement("a", 2, Position.ORIGIN, Rotation.NONE));
        PalletArrangement arrangement = new PalletArrangement(PALLET, Position.ORIGIN, false, placements, 30, 10);

        placements.add(new Placement("b", 5, Position.ORIGIN, Rotation.NONE));

        assertEquals(1, arrangement.placements().size(), "Later changes to the source list must not leak in");
        assertEquals(2, arrangement.unitCount());
        assertThrows(UnsupportedOperationException.class,
                () -> arrangement.placements().add(new Placement("c", 1, Position.ORIGIN, Rotation.NONE)));
    }

    @Test
    void testRequiredEnvelopeDimensions() {
        assertThrows(IllegalArgumentException.class, () -> new Container(null, 100.0));
        assertThrows(IllegalArgumentException.class, () -> new PalletTemplate(null, 10, 100.0));
    }

    @Test
    void testFailureResultShape() {
        OptimizationResult failure = OptimizationResult.failure("No products to optimize", List.of());

        assertFalse(failure.success());
        assertEquals(0.0, failure.utilization());
        assertNull(failure.weightUtilization());
        assertTrue(failure.palletArrangements().isEmpty());
        assertFalse(failure.hasRemainingProducts());
    }

    @Test
    void testValidationResultOf() {
        assertTrue(ValidationResult.of(List.of()).valid());
        assertFalse(ValidationResult.of(List.of("X")).valid());
    }
}

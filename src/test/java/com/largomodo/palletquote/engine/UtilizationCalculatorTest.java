package com.largomodo.palletquote.engine;

import com.largomodo.palletquote.core.domain.Container;
import com.largomodo.palletquote.core.domain.Dimensions;
import com.largomodo.palletquote.core.domain.PackingPlan;
import com.largomodo.palletquote.core.domain.PalletLoad;
import com.largomodo.palletquote.core.domain.PalletTemplate;
import com.largomodo.palletquote.core.domain.Placement;
import com.largomodo.palletquote.core.domain.Position;
import com.largomodo.palletquote.core.domain.Rotation;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class UtilizationCalculatorTest {

    private static final PalletTemplate PALLET = new PalletTemplate(Dimensions.centimeters(120, 100, 15), 20.0, 1000.0);

    private final UtilizationCalculator calculator = new UtilizationCalculator();

    private static PalletLoad load(double goodsWeight, double goodsVolume) {
        return new PalletLoad(Position.ORIGIN, false,
                List.of(new Placement("a", 1, Position.ORIGIN, Rotation.NONE)), goodsWeight, goodsVolume);
    }

    @Test
    void testVolumeAndWeightUtilization() {
        Container container = new Container(Dimensions.centimeters(120, 100, 115), 1000.0);
        PackingPlan plan = new PackingPlan(List.of(load(80, 1_200_000)), List.of(), 1);

        UtilizationReport report = calculator.calculate(plan, container, PALLET);

        assertEquals(1_200_000.0 / 1_380_000.0 * 100, report.volumeUtilization(), 1e-9);
        assertEquals(List.of(100.0), report.palletUtilization(), "Goods fill footprint x stack height");
        assertEquals(10.0, report.weightUtilization(), 1e-9);
        assertEquals(100.0, report.grossWeight(), 1e-9);
    }

    @Test
    void testEmptyPlanIsZero() {
        Container container = new Container(Dimensions.centimeters(120, 100, 115), 1000.0);

        UtilizationReport report = calculator.calculate(new PackingPlan(List.of(), List.of(), 1), container, PALLET);

        assertEquals(0.0, report.volumeUtilization());
        assertEquals(0.0, report.weightUtilization());
        assertTrue(report.palletUtilization().isEmpty());
    }

    @Test
    void testNoWeightLimitGivesAbsentWeightUtilization() {
        Container container = new Container(Dimensions.centimeters(120, 100, 115), null);
        PackingPlan plan = new PackingPlan(List.of(load(80, 1000)), List.of(), 1);

        assertNull(calculator.calculate(plan, container, PALLET).weightUtilization());
    }

    @ParameterizedTest
    @CsvSource({
            "50, 200, 25",
            "300, 200, 100",
            "-1, 200, 0",
            "5, 0, 0"
    })
    void testPercentageIsClamped(double part, double whole, double expected) {
        assertEquals(expected, UtilizationCalculator.percentage(part, whole), 1e-9);
    }
}

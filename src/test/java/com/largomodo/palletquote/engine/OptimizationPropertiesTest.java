package com.largomodo.palletquote.engine;

import com.largomodo.palletquote.core.domain.Container;
import com.largomodo.palletquote.core.domain.Dimensions;
import com.largomodo.palletquote.core.domain.LengthUnit;
import com.largomodo.palletquote.core.domain.OptimizationResult;
import com.largomodo.palletquote.core.domain.PalletArrangement;
import com.largomodo.palletquote.core.domain.PalletTemplate;
import com.largomodo.palletquote.core.domain.Placement;
import com.largomodo.palletquote.core.domain.Product;
import com.largomodo.palletquote.core.domain.ProductRequest;
import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.Combinators;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.Provide;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Property-based checks of the engine contracts over random product mixes.
 * Memoization is disabled so every call runs the full pipeline.
 */
class OptimizationPropertiesTest {

    private static final Container CONTAINER = new Container(Dimensions.centimeters(240, 240, 150), 3000.0);
    private static final PalletTemplate PALLET = new PalletTemplate(Dimensions.centimeters(80, 80, 15), 10, 500.0);

    private final OptimizationEngine engine =
            OptimizationEngine.create(OptimizerSettings.defaults().withCacheMaxEntries(0));

    private record UnitSpec(int length, int width, int height, int weight, int quantity) {
    }

    @Provide
    Arbitrary<List<UnitSpec>> productMixes() {
        Arbitrary<Integer> side = Arbitraries.integers().between(1, 24);
        Arbitrary<Integer> weight = Arbitraries.integers().between(0, 80);
        Arbitrary<Integer> quantity = Arbitraries.integers().between(0, 25);
        return Combinators.combine(side, side, side, weight, quantity)
                .as(UnitSpec::new)
                .list().ofMinSize(1).ofMaxSize(6);
    }

    private static List<ProductRequest> toRequests(List<UnitSpec> specs, LengthUnit unit) {
        List<ProductRequest> requests = new ArrayList<>();
        for (int i = 0; i < specs.size(); i++) {
            UnitSpec s = specs.get(i);
            Dimensions dimensions = unit == LengthUnit.INCHES
                    ? new Dimensions(s.length(), s.width(), s.height(), LengthUnit.INCHES)
                    : Dimensions.centimeters(LengthUnit.INCHES.toCentimeters(s.length()),
                    LengthUnit.INCHES.toCentimeters(s.width()), LengthUnit.INCHES.toCentimeters(s.height()));
            requests.add(new ProductRequest(new Product("p" + i, "Product " + i, null, dimensions,
                    (double) s.weight()), s.quantity()));
        }
        return requests;
    }

    private static Map<String, Integer> placedById(OptimizationResult result) {
        Map<String, Integer> placed = new HashMap<>();
        for (PalletArrangement arrangement : result.palletArrangements()) {
            for (Placement placement : arrangement.placements()) {
                placed.merge(placement.productId(), placement.quantity(), Integer::sum);
            }
        }
        return placed;
    }

    @Property(tries = 200)
    void testPlacedPlusRemainingEqualsRequested(@ForAll("productMixes") List<UnitSpec> mix) {
        List<ProductRequest> requests = toRequests(mix, LengthUnit.CENTIMETERS);

        OptimizationResult result = engine.optimize(requests, CONTAINER, PALLET);

        Map<String, Integer> placed = placedById(result);
        Map<String, Integer> remaining = new HashMap<>();
        result.remainingProducts().forEach(r -> remaining.merge(r.product().id(), r.quantity(), Integer::sum));
        for (ProductRequest request : requests) {
            if (!result.success() || request.quantity() == 0) {
                continue;
            }
            int total = placed.getOrDefault(request.product().id(), 0)
                    + remaining.getOrDefault(request.product().id(), 0);
            assertEquals(request.quantity(), total, "Conservation violated for " + request.product().id());
        }
        result.remainingProducts().forEach(r -> assertTrue(r.quantity() > 0));
    }

    @Property(tries = 100)
    void testSameInputSameResult(@ForAll("productMixes") List<UnitSpec> mix) {
        OptimizationResult first = engine.optimize(toRequests(mix, LengthUnit.CENTIMETERS), CONTAINER, PALLET);
        OptimizationResult second = engine.optimize(toRequests(mix, LengthUnit.CENTIMETERS), CONTAINER, PALLET);

        assertEquals(first, second);
    }

    @Property(tries = 100)
    void testValidationIsIdempotent(@ForAll("productMixes") List<UnitSpec> mix) {
        List<ProductRequest> requests = toRequests(mix, LengthUnit.INCHES);

        assertEquals(engine.validateProducts(requests), engine.validateProducts(requests));
    }

    @Property(tries = 100)
    void testInchesEquivalentToCentimeters(@ForAll("productMixes") List<UnitSpec> mix) {
        OptimizationResult inches = engine.optimize(toRequests(mix, LengthUnit.INCHES), CONTAINER, PALLET);
        OptimizationResult centimeters = engine.optimize(toRequests(mix, LengthUnit.CENTIMETERS), CONTAINER, PALLET);

        assertEquals(centimeters.success(), inches.success());
        assertEquals(placedById(centimeters), placedById(inches));
        assertEquals(centimeters.palletArrangements().size(), inches.palletArrangements().size());
        assertEquals(centimeters.utilization(), inches.utilization(), 1e-9);
    }

    @Property(tries = 200)
    void testUtilizationAndWeightWithinBounds(@ForAll("productMixes") List<UnitSpec> mix) {
        OptimizationResult result = engine.optimize(toRequests(mix, LengthUnit.CENTIMETERS), CONTAINER, PALLET);

        assertTrue(result.utilization() >= 0 && result.utilization() <= 100);
        if (result.weightUtilization() != null) {
            assertTrue(result.weightUtilization() >= 0 && result.weightUtilization() <= 100);
        }
        double gross = result.palletArrangements().stream().mapToDouble(PalletArrangement::weight).sum();
        assertTrue(gross <= CONTAINER.maxWeight() + 1e-6, "Gross weight " + gross + " exceeds container limit");
        for (PalletArrangement arrangement : result.palletArrangements()) {
            assertTrue(arrangement.weight() - PALLET.tareWeight() <= PALLET.maxWeight() + 1e-6);
            assertTrue(arrangement.utilization() >= 0 && arrangement.utilization() <= 100);
        }
    }
}

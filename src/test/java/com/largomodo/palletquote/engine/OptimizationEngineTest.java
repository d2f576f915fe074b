package com.largomodo.palletquote.engine;

import com.largomodo.palletquote.core.StandardContainer;
import com.largomodo.palletquote.core.domain.Container;
import com.largomodo.palletquote.core.domain.Dimensions;
import com.largomodo.palletquote.core.domain.LengthUnit;
import com.largomodo.palletquote.core.domain.OptimizationResult;
import com.largomodo.palletquote.core.domain.OptimizationSummary;
import com.largomodo.palletquote.core.domain.PalletArrangement;
import com.largomodo.palletquote.core.domain.PalletTemplate;
import com.largomodo.palletquote.core.domain.Product;
import com.largomodo.palletquote.core.domain.ProductRequest;
import com.largomodo.palletquote.core.domain.ValidationResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end behaviour of the engine facade: boundary inputs, weight limits,
 * unit handling and memoization.
 */
class OptimizationEngineTest {

    private static final Product CUBE = new Product("product-1", "Test Product", "TP-001",
            Dimensions.centimeters(10, 10, 10), 1.0);
    private static final Container CONTAINER = new Container(Dimensions.centimeters(100, 100, 100), 1000.0);
    private static final PalletTemplate PALLET = new PalletTemplate(Dimensions.centimeters(80, 80, 15), 10, 500.0);

    private OptimizationEngine engine;

    @BeforeEach
    void setUp() {
        engine = OptimizationEngine.create();
    }

    private static Product withWeight(double weight) {
        return new Product(CUBE.id(), CUBE.name(), CUBE.sku(), CUBE.dimensions(), weight);
    }

    @Test
    void testValidInputProducesArrangements() {
        OptimizationResult result = engine.optimize(List.of(new ProductRequest(CUBE, 10)), CONTAINER, PALLET);

        assertTrue(result.success());
        assertEquals(OptimizerSettings.DEFAULT_SUCCESS_MESSAGE, result.message());
        assertEquals(1, result.palletArrangements().size());
        assertEquals(10, result.palletArrangements().get(0).unitCount());
        assertEquals(1.0, result.utilization(), 1e-9);
        assertTrue(result.remainingProducts().isEmpty());
    }

    @Test
    void testEmptyInput() {
        OptimizationResult result = engine.optimize(List.of(), CONTAINER, PALLET);

        assertFalse(result.success());
        assertTrue(result.message().contains("No products to optimize"));
        assertTrue(result.palletArrangements().isEmpty());
    }

    @Test
    void testOnlyZeroQuantitiesCountAsEmpty() {
        OptimizationResult result = engine.optimize(List.of(new ProductRequest(CUBE, 0)), CONTAINER, PALLET);

        assertFalse(result.success());
        assertEquals("No products to optimize", result.message());
    }

    @Test
    void testZeroQuantityInvalidProductIgnored() {
        Product broken = new Product("broken", "Broken", null, null, null);

        OptimizationResult result = engine.optimize(
                List.of(new ProductRequest(CUBE, 2), new ProductRequest(broken, 0)), CONTAINER, PALLET);

        assertTrue(result.success());
    }

    @Test
    void testInvalidDimensions() {
        Product invalid = CUBE.withDimensions(Dimensions.centimeters(-10, 10, 10));

        OptimizationResult result = engine.optimize(List.of(new ProductRequest(invalid, 10)), CONTAINER, PALLET);

        assertFalse(result.success());
        assertEquals("Invalid products: Test Product", result.message());
        assertEquals(10, result.remainingProducts().get(0).quantity());
    }

    @Test
    void testMixedValidAndInvalidReportsInvalidName() {
        Product invalid = new Product("invalid-id", "Invalid Product Name", null,
                Dimensions.centimeters(0, 10, 10), 1.0);
        List<ProductRequest> requests = List.of(new ProductRequest(CUBE, 1), new ProductRequest(invalid, 1));

        ValidationResult validation = engine.validateProducts(requests);
        OptimizationResult result = engine.optimize(requests, CONTAINER, PALLET);

        assertFalse(validation.valid());
        assertEquals(List.of("Invalid Product Name"), validation.invalidProducts());
        assertTrue(result.message().contains("Invalid Product Name"));
    }

    @Test
    void testProductLargerThanContainer() {
        Product large = CUBE.withDimensions(Dimensions.centimeters(200, 200, 200));

        OptimizationResult result = engine.optimize(List.of(new ProductRequest(large, 1)), CONTAINER, PALLET);

        assertFalse(result.success());
        assertTrue(result.message().contains("too large"));
        assertTrue(result.palletArrangements().isEmpty());
    }

    @Test
    void testTinyContainer() {
        Container tiny = new Container(Dimensions.centimeters(5, 5, 5), 1000.0);

        OptimizationResult result = engine.optimize(List.of(new ProductRequest(CUBE, 5)), tiny, PALLET);

        assertFalse(result.success());
        assertEquals("Product Test Product is too large for the container", result.message());
    }

    @Test
    void testPalletWiderThanContainerFloor() {
        PalletTemplate wide = new PalletTemplate(Dimensions.centimeters(120, 100, 15), 20, 1000.0);

        OptimizationResult result = engine.optimize(List.of(new ProductRequest(CUBE, 1)), CONTAINER, wide);

        assertFalse(result.success());
        assertEquals("Pallet template is too large for the container", result.message());
    }

    @Test
    void testInvalidEnvelope() {
        Container negativeCapacity = new Container(Dimensions.centimeters(100, 100, 100), -1.0);

        OptimizationResult result = engine.optimize(List.of(new ProductRequest(CUBE, 1)), negativeCapacity, PALLET);

        assertFalse(result.success());
        assertTrue(result.message().startsWith("Invalid container or pallet"));
    }

    @Test
    void testContainerWeightLimitLeavesRemainder() {
        Product heavy = withWeight(300);

        OptimizationResult result = engine.optimize(List.of(new ProductRequest(heavy, 5)), CONTAINER, PALLET);

        assertTrue(result.success(), "Partial placement is not a failure");
        assertFalse(result.remainingProducts().isEmpty());
        double gross = result.palletArrangements().stream().mapToDouble(PalletArrangement::weight).sum();
        assertTrue(gross <= CONTAINER.maxWeight());
    }

    @Test
    void testExtremeWeightConstraint() {
        Container light = new Container(Dimensions.centimeters(100, 100, 100), 600.0);

        OptimizationResult result = engine.optimize(List.of(new ProductRequest(withWeight(500), 5)), light, PALLET);

        assertEquals(1, result.palletArrangements().size());
        assertEquals(1, result.palletArrangements().get(0).unitCount());
        assertEquals(4, result.remainingProducts().get(0).quantity());
        assertEquals(510.0 / 600.0 * 100, result.weightUtilization(), 1e-9);
    }

    @Test
    void testInchesProduct() {
        Product inches = new Product("inches-product", "Inches", null, new Dimensions(10, 10, 10, LengthUnit.INCHES), 1.0);

        OptimizationResult result = engine.optimize(List.of(new ProductRequest(inches, 3)), CONTAINER, PALLET);

        assertTrue(result.success());
        assertEquals(3, result.palletArrangements().get(0).unitCount());
        assertEquals(3 * Math.pow(25.4, 3) / 1_000_000 * 100, result.utilization(), 1e-6);
    }

    @Test
    void testRemainingProductsCarryCallerRecords() {
        Product inches = new Product("big", "Big", null, new Dimensions(30, 30, 30, LengthUnit.INCHES), 1.0);

        OptimizationResult result = engine.optimize(List.of(new ProductRequest(inches, 5)), CONTAINER, PALLET);

        assertTrue(result.success());
        ProductRequest remaining = result.remainingProducts().get(0);
        assertSame(inches, remaining.product(), "Remainder must reference the caller's product, not a normalized copy");
        assertEquals(4, remaining.quantity());
    }

    @Test
    void testDefaultPalletOverload() {
        Container container = StandardContainer.TWENTY_FOOT.toContainer();

        OptimizationResult result = engine.optimize(List.of(new ProductRequest(CUBE, 50)), container);

        assertTrue(result.success());
        assertEquals(120, result.palletArrangements().get(0).pallet().dimensions().length());
        assertEquals(70.0, result.palletArrangements().get(0).weight(), 1e-9);
    }

    @Test
    void testRepeatedCallServedFromCache() {
        List<ProductRequest> requests = List.of(new ProductRequest(CUBE, 10));

        OptimizationResult first = engine.optimize(requests, CONTAINER, PALLET);
        OptimizationResult second = engine.optimize(List.of(new ProductRequest(CUBE, 10)), CONTAINER, PALLET);

        assertSame(first, second);
        assertEquals(1, engine.getCache().hitCount());
    }

    @Test
    void testSummary() {
        OptimizationResult result = engine.optimize(
                List.of(new ProductRequest(withWeight(300), 5)), CONTAINER, PALLET);

        OptimizationSummary summary = engine.prepareSummary(result);

        assertTrue(summary.success());
        assertEquals(1, summary.totalPallets());
        assertEquals(1, summary.totalProducts());
        assertEquals(4, summary.remainingProducts());
        assertEquals(31.0, summary.weightUtilization());
        assertEquals(0.1, summary.utilization());
    }

    @Test
    void testRemainingCountBeyondIntRange() {
        Product anvil = new Product("anvil", "Anvil", null, Dimensions.centimeters(10, 10, 10), 600.0);
        Product boulder = new Product("boulder", "Boulder", null, Dimensions.centimeters(10, 10, 10), 700.0);
        List<ProductRequest> requests = List.of(
                new ProductRequest(anvil, Integer.MAX_VALUE),
                new ProductRequest(boulder, Integer.MAX_VALUE));

        OptimizationResult result = engine.optimize(requests, CONTAINER, PALLET);
        OptimizationSummary summary = engine.prepareSummary(result);

        long expected = 2L * Integer.MAX_VALUE;
        assertTrue(result.success());
        assertTrue(result.palletArrangements().isEmpty());
        assertEquals(0, summary.totalProducts());
        assertEquals(expected, summary.remainingProducts());
        assertTrue(result.message().endsWith(expected + " unit(s) could not be placed"), result.message());
    }

    @Test
    void testNullArgumentsAreProgrammingErrors() {
        assertThrows(IllegalArgumentException.class, () -> engine.optimize(null, CONTAINER, PALLET));
        assertThrows(IllegalArgumentException.class,
                () -> engine.optimize(List.of(new ProductRequest(CUBE, 1)), null, PALLET));
        assertThrows(IllegalArgumentException.class,
                () -> engine.optimize(List.of(new ProductRequest(CUBE, 1)), CONTAINER, null));
        assertThrows(IllegalArgumentException.class,
                () -> engine.optimize(Arrays.asList(new ProductRequest(CUBE, 1), null), CONTAINER, PALLET));
        assertThrows(IllegalArgumentException.class, () -> new ProductRequest(null, 1));
    }
}

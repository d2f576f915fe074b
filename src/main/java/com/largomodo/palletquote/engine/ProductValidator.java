package com.largomodo.palletquote.engine;

import com.largomodo.palletquote.core.domain.Container;
import com.largomodo.palletquote.core.domain.Dimensions;
import com.largomodo.palletquote.core.domain.PalletTemplate;
import com.largomodo.palletquote.core.domain.Product;
import com.largomodo.palletquote.core.domain.ProductRequest;
import com.largomodo.palletquote.core.domain.ValidationResult;

import java.util.ArrayList;
import java.util.List;

/**
 * Rejects physically impossible product, container and pallet specifications before packing.
 * <p>
 * Validation never throws for bad data: every failing request is reported by its
 * display identifier so the caller can render a single message listing all of them.
 * Stateless, so repeated validation of the same input yields the same verdict.
 */
public class ProductValidator {

    /**
     * Checks every request: dimensions present with a recognised unit and finite,
     * strictly positive components; weight present, finite and non-negative;
     * quantity non-negative.
     *
     * @param requests requests to check, must not be null
     * @return verdict listing invalid products in input order
     */
    public ValidationResult validateProducts(List<ProductRequest> requests) {
        if (requests == null) {
            throw new IllegalArgumentException("Requests list cannot be null");
        }
        List<String> invalid = new ArrayList<>();
        for (ProductRequest request : requests) {
            if (request == null) {
                throw new IllegalArgumentException("Requests list cannot contain null entries");
            }
            if (!isValid(request)) {
                invalid.add(request.product().displayName());
            }
        }
        return ValidationResult.of(invalid);
    }

    /**
     * Checks the container and pallet template envelopes.
     *
     * @return human-readable problems, empty when both are usable
     */
    public List<String> validateEnvelope(Container container, PalletTemplate pallet) {
        List<String> problems = new ArrayList<>();
        if (!hasUsableDimensions(container.dimensions())) {
            problems.add("container dimensions must be positive with a known unit");
        }
        if (!isPositiveOrAbsent(container.maxWeight())) {
            problems.add("container max weight must be positive");
        }
        if (!hasUsableDimensions(pallet.dimensions())) {
            problems.add("pallet dimensions must be positive with a known unit");
        }
        if (!Double.isFinite(pallet.tareWeight()) || pallet.tareWeight() < 0) {
            problems.add("pallet tare weight cannot be negative");
        }
        if (!isPositiveOrAbsent(pallet.maxWeight())) {
            problems.add("pallet max weight must be positive");
        }
        return problems;
    }

    private boolean isValid(ProductRequest request) {
        Product product = request.product();
        if (!hasUsableDimensions(product.dimensions())) {
            return false;
        }
        Double weight = product.weight();
        if (weight == null || !Double.isFinite(weight) || weight < 0) {
            return false;
        }
        return request.quantity() >= 0;
    }

    private boolean hasUsableDimensions(Dimensions dimensions) {
        return dimensions != null
                && dimensions.unit() != null
                && isPositive(dimensions.length())
                && isPositive(dimensions.width())
                && isPositive(dimensions.height());
    }

    private boolean isPositive(double value) {
        return Double.isFinite(value) && value > 0;
    }

    private boolean isPositiveOrAbsent(Double value) {
        return value == null || isPositive(value);
    }
}

package com.largomodo.palletquote.engine;

import com.largomodo.palletquote.core.domain.Container;
import com.largomodo.palletquote.core.domain.Dimensions;
import com.largomodo.palletquote.core.domain.LengthUnit;
import com.largomodo.palletquote.core.domain.PalletTemplate;
import com.largomodo.palletquote.core.domain.Product;
import com.largomodo.palletquote.core.domain.ProductRequest;

/**
 * Converts dimensions to the canonical unit (centimeters).
 * <p>
 * Stateless and idempotent: normalizing an already normalized value returns an
 * equal value. Missing dimensions and unrecognised units pass through untouched;
 * rejecting them is the validator's job. Weights are kilograms throughout and are
 * never converted.
 */
public class UnitNormalizer {

    public double toCentimeters(double value, LengthUnit unit) {
        return unit == null ? value : unit.toCentimeters(value);
    }

    public Dimensions normalize(Dimensions dimensions) {
        if (dimensions == null || dimensions.unit() == null || dimensions.unit() == LengthUnit.CENTIMETERS) {
            return dimensions;
        }
        LengthUnit unit = dimensions.unit();
        return new Dimensions(
                unit.toCentimeters(dimensions.length()),
                unit.toCentimeters(dimensions.width()),
                unit.toCentimeters(dimensions.height()),
                LengthUnit.CENTIMETERS);
    }

    public Product normalize(Product product) {
        return product.withDimensions(normalize(product.dimensions()));
    }

    public ProductRequest normalize(ProductRequest request) {
        return new ProductRequest(normalize(request.product()), request.quantity());
    }

    public Container normalize(Container container) {
        return container.withDimensions(normalize(container.dimensions()));
    }

    public PalletTemplate normalize(PalletTemplate pallet) {
        return pallet.withDimensions(normalize(pallet.dimensions()));
    }
}

package com.largomodo.palletquote.core.domain;

/**
 * Demand for a number of units of one product.
 * <p>
 * Negative quantities are representable so that the validator can report them
 * alongside other invalid products; zero-quantity requests are ignored by the optimizer.
 *
 * @param product  requested product (must not be null)
 * @param quantity number of units requested
 */
public record ProductRequest(Product product, int quantity) {

    public ProductRequest {
        if (product == null) {
            throw new IllegalArgumentException("product must not be null");
        }
    }

    public ProductRequest withQuantity(int newQuantity) {
        return new ProductRequest(product, newQuantity);
    }
}

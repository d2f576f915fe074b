package com.largomodo.palletquote.core.domain;

import java.time.Instant;

/**
 * Catalog product as borrowed by the optimizer for the duration of one call.
 * <p>
 * Dimensions and weight are nullable because catalog records can be incomplete;
 * completeness is judged by {@code ProductValidator}. Weight is in kilograms.
 *
 * @param id         catalog identifier
 * @param name       display name
 * @param sku        stock keeping unit
 * @param dimensions unit dimensions, null when the catalog has none
 * @param weight     unit weight in kilograms, null when unknown
 * @param createdAt  catalog creation timestamp, may be null
 * @param updatedAt  catalog update timestamp, may be null
 */
public record Product(String id, String name, String sku, Dimensions dimensions, Double weight,
                      Instant createdAt, Instant updatedAt) {

    public Product(String id, String name, String sku, Dimensions dimensions, Double weight) {
        this(id, name, sku, dimensions, weight, null, null);
    }

    /**
     * Human-readable identifier: name, falling back to sku, then id.
     *
     * @return first non-blank of name, sku, id, or "Unknown product"
     */
    public String displayName() {
        if (name != null && !name.isBlank()) {
            return name;
        }
        if (sku != null && !sku.isBlank()) {
            return sku;
        }
        if (id != null && !id.isBlank()) {
            return id;
        }
        return "Unknown product";
    }

    public Product withDimensions(Dimensions newDimensions) {
        return new Product(id, name, sku, newDimensions, weight, createdAt, updatedAt);
    }
}

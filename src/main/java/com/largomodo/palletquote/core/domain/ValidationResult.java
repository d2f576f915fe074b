package com.largomodo.palletquote.core.domain;

import java.util.List;

/**
 * Verdict of product validation.
 *
 * @param valid           true when no request failed a check
 * @param invalidProducts display identifiers of failing requests, in input order (unmodifiable)
 */
public record ValidationResult(boolean valid, List<String> invalidProducts) {

    public ValidationResult {
        invalidProducts = List.copyOf(invalidProducts);
    }

    public static ValidationResult of(List<String> invalidProducts) {
        return new ValidationResult(invalidProducts.isEmpty(), invalidProducts);
    }
}

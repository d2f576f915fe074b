package com.largomodo.palletquote.engine;

/**
 * Reasons an optimization call ends with {@code success=false}.
 * Partial placement is not a failure and has no entry here.
 */
public enum FailureMode {
    /** No request with a positive quantity. */
    EMPTY_INPUT("No products to optimize"),
    /** One or more requests failed validation; detail lists their identifiers. */
    INVALID_PRODUCT("Invalid products: %s"),
    /** Container or pallet template failed validation; detail lists the problems. */
    INVALID_ENVELOPE("Invalid container or pallet: %s"),
    /** A product or the pallet itself cannot physically fit; detail is the full reason. */
    OVERSIZED("%s");

    private final String template;

    FailureMode(String template) {
        this.template = template;
    }

    public String describe(String detail) {
        return template.contains("%s") ? String.format(template, detail) : template;
    }
}

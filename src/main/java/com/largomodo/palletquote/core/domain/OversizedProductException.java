package com.largomodo.palletquote.core.domain;

/**
 * Thrown by a {@link PalletPacker} when an item cannot physically fit its target
 * (container or pallet) in any allowed orientation.
 * <p>
 * RuntimeException enables fail-fast rejection before any placement starts; the
 * optimization pipeline converts it into an unsuccessful result.
 */
public class OversizedProductException extends RuntimeException {

    private final String subject;
    private final String target;

    /**
     * @param subject what does not fit, e.g. "Product Widget" or "Pallet template"
     * @param target  what it does not fit into, e.g. "container" or "pallet"
     */
    public OversizedProductException(String subject, String target) {
        super(subject + " is too large for the " + target);
        this.subject = subject;
        this.target = target;
    }

    public String getSubject() {
        return subject;
    }

    public String getTarget() {
        return target;
    }
}

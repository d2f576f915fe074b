package com.largomodo.palletquote.core;

import com.largomodo.palletquote.core.domain.OptimizationSummary;

import java.nio.file.Path;

/**
 * Observer interface for quote processing lifecycle events.
 * <p>
 * All methods have default no-op implementations, allowing consumers to override
 * only the events they care about. Batch mode calls these from worker threads, so
 * implementations must be thread-safe.
 *
 * @see QuoteProcessor
 */
public interface QuoteObserver {

    /**
     * Called when processing of a product file begins.
     *
     * @param input the product file being processed
     */
    default void onStart(Path input) {}

    /**
     * Called when a quote was written and its optimization succeeded, possibly
     * with units left over.
     *
     * @param input   the product file that was processed
     * @param summary summary of the written quote
     */
    default void onSuccess(Path input, OptimizationSummary summary) {}

    /**
     * Called when a quote was written but its optimization reported {@code success=false}.
     * The written report explains why.
     *
     * @param input   the product file that was processed
     * @param summary summary of the written quote, carrying the failure message
     */
    default void onRejected(Path input, OptimizationSummary summary) {}

    /**
     * Called when a product file could not be turned into a quote.
     *
     * @param input the product file that failed to process
     * @param e     the exception that caused the failure
     */
    default void onFailure(Path input, Exception e) {}
}

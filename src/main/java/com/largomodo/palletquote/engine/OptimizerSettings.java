package com.largomodo.palletquote.engine;

import com.largomodo.palletquote.core.domain.ShelfPalletPacker;

import java.time.Duration;

/**
 * Tunables of the optimization engine.
 *
 * @param epsilon         tolerance for dimension and weight comparisons (centimeters / kilograms)
 * @param cacheMaxEntries maximum memoized results kept; 0 disables memoization
 * @param cacheTtl        age after which a memoized result is dropped; zero means no expiry
 * @param allowRotation   whether units may be turned 90 degrees about the vertical axis
 * @param successMessage  message attached to successful results
 */
public record OptimizerSettings(double epsilon, int cacheMaxEntries, Duration cacheTtl,
                                boolean allowRotation, String successMessage) {

    public static final int DEFAULT_CACHE_MAX_ENTRIES = 100;
    public static final Duration DEFAULT_CACHE_TTL = Duration.ofMinutes(30);
    public static final String DEFAULT_SUCCESS_MESSAGE = "Optimization completed successfully";

    public OptimizerSettings {
        if (epsilon < 0 || Double.isNaN(epsilon)) {
            throw new IllegalArgumentException("epsilon must be a non-negative number, got: " + epsilon);
        }
        if (cacheMaxEntries < 0) {
            throw new IllegalArgumentException("cacheMaxEntries cannot be negative: " + cacheMaxEntries);
        }
        if (cacheTtl == null || cacheTtl.isNegative()) {
            throw new IllegalArgumentException("cacheTtl must be zero or positive");
        }
        if (successMessage == null || successMessage.isBlank()) {
            throw new IllegalArgumentException("successMessage must not be null or blank");
        }
    }

    public static OptimizerSettings defaults() {
        return new OptimizerSettings(ShelfPalletPacker.DEFAULT_EPSILON, DEFAULT_CACHE_MAX_ENTRIES,
                DEFAULT_CACHE_TTL, true, DEFAULT_SUCCESS_MESSAGE);
    }

    public OptimizerSettings withCacheMaxEntries(int entries) {
        return new OptimizerSettings(epsilon, entries, cacheTtl, allowRotation, successMessage);
    }

    public OptimizerSettings withCacheTtl(Duration ttl) {
        return new OptimizerSettings(epsilon, cacheMaxEntries, ttl, allowRotation, successMessage);
    }

    public OptimizerSettings withAllowRotation(boolean rotation) {
        return new OptimizerSettings(epsilon, cacheMaxEntries, cacheTtl, rotation, successMessage);
    }

    public OptimizerSettings withSuccessMessage(String message) {
        return new OptimizerSettings(epsilon, cacheMaxEntries, cacheTtl, allowRotation, message);
    }
}

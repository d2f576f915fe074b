package com.largomodo.palletquote.engine;

import com.largomodo.palletquote.core.domain.Container;
import com.largomodo.palletquote.core.domain.OptimizationResult;
import com.largomodo.palletquote.core.domain.OversizedProductException;
import com.largomodo.palletquote.core.domain.PackingPlan;
import com.largomodo.palletquote.core.domain.PalletPacker;
import com.largomodo.palletquote.core.domain.PalletTemplate;
import com.largomodo.palletquote.core.domain.Product;
import com.largomodo.palletquote.core.domain.ProductRequest;
import com.largomodo.palletquote.core.domain.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Shipment optimization pipeline orchestrator.
 * <p>
 * Coordinates the workflow for one call:
 * 1. Short-circuit when no request has a positive quantity
 * 2. Validate products, then the container and pallet envelopes
 * 3. Normalize everything to centimeters
 * 4. Pack units onto pallets (oversized items are rejected here)
 * 5. Compute utilization and assemble the result
 * <p>
 * Zero-quantity requests are ignored throughout. Unplaced remainders are reported
 * with the caller's original product records, not the normalized copies.
 */
public class OptimizationPipeline implements ShippingOptimizer {

    private static final Logger log = LoggerFactory.getLogger(OptimizationPipeline.class);

    private final ProductValidator validator;
    private final UnitNormalizer normalizer;
    private final PalletPacker packer;
    private final UtilizationCalculator calculator;
    private final ResultAssembler assembler;

    public OptimizationPipeline(ProductValidator validator, UnitNormalizer normalizer, PalletPacker packer,
                                UtilizationCalculator calculator, ResultAssembler assembler) {
        this.validator = validator;
        this.normalizer = normalizer;
        this.packer = packer;
        this.calculator = calculator;
        this.assembler = assembler;
    }

    @Override
    public OptimizationResult optimize(List<ProductRequest> requests, Container container, PalletTemplate pallet) {
        requireInputs(requests, container, pallet);

        List<ProductRequest> positive = requests.stream().filter(r -> r.quantity() > 0).toList();
        if (positive.isEmpty()) {
            return assembler.failure(FailureMode.EMPTY_INPUT, null, List.of());
        }

        List<ProductRequest> active = requests.stream().filter(r -> r.quantity() != 0).toList();
        ValidationResult validation = validator.validateProducts(active);
        if (!validation.valid()) {
            log.debug("Rejected {} invalid product(s)", validation.invalidProducts().size());
            return assembler.failure(FailureMode.INVALID_PRODUCT,
                    String.join(", ", validation.invalidProducts()), positive);
        }

        List<String> envelopeProblems = validator.validateEnvelope(container, pallet);
        if (!envelopeProblems.isEmpty()) {
            return assembler.failure(FailureMode.INVALID_ENVELOPE, String.join("; ", envelopeProblems), positive);
        }

        Container canonicalContainer = normalizer.normalize(container);
        PalletTemplate canonicalPallet = normalizer.normalize(pallet);

        // Normalized copies are fresh instances, so identity maps them back to the caller's records
        Map<Product, Product> originals = new IdentityHashMap<>();
        List<ProductRequest> canonicalRequests = new ArrayList<>(positive.size());
        for (ProductRequest request : positive) {
            ProductRequest canonical = normalizer.normalize(request);
            originals.put(canonical.product(), request.product());
            canonicalRequests.add(canonical);
        }

        PackingPlan plan;
        try {
            plan = packer.pack(canonicalRequests, canonicalContainer, canonicalPallet);
        } catch (OversizedProductException e) {
            log.debug("Rejected oversized input: {}", e.getMessage());
            return assembler.failure(FailureMode.OVERSIZED, e.getMessage(), positive);
        }

        UtilizationReport utilization = calculator.calculate(plan, canonicalContainer, canonicalPallet);
        List<ProductRequest> remaining = plan.remaining().stream()
                .map(r -> new ProductRequest(originals.getOrDefault(r.product(), r.product()), r.quantity()))
                .toList();

        log.debug("Packed {} pallet(s) of {} available, {} request(s) with remainder",
                plan.loads().size(), plan.palletSlots(), remaining.size());
        return assembler.success(plan, utilization, canonicalPallet, remaining);
    }

    static void requireInputs(List<ProductRequest> requests, Container container, PalletTemplate pallet) {
        if (requests == null) {
            throw new IllegalArgumentException("Requests list cannot be null");
        }
        if (container == null) {
            throw new IllegalArgumentException("Container cannot be null");
        }
        if (pallet == null) {
            throw new IllegalArgumentException("Pallet template cannot be null");
        }
        for (ProductRequest request : requests) {
            if (request == null) {
                throw new IllegalArgumentException("Requests list cannot contain null entries");
            }
        }
    }
}

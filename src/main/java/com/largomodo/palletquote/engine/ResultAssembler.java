package com.largomodo.palletquote.engine;

import com.largomodo.palletquote.core.domain.OptimizationResult;
import com.largomodo.palletquote.core.domain.OptimizationSummary;
import com.largomodo.palletquote.core.domain.PackingPlan;
import com.largomodo.palletquote.core.domain.PalletArrangement;
import com.largomodo.palletquote.core.domain.PalletLoad;
import com.largomodo.palletquote.core.domain.PalletTemplate;
import com.largomodo.palletquote.core.domain.ProductRequest;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

/**
 * Packages packer and calculator output into the result handed back to callers,
 * and projects results into display summaries.
 */
public class ResultAssembler {

    private final String successMessage;

    public ResultAssembler() {
        this(OptimizerSettings.DEFAULT_SUCCESS_MESSAGE);
    }

    public ResultAssembler(String successMessage) {
        this.successMessage = successMessage;
    }

    /**
     * Builds a successful result. Partial placement still counts as success; the
     * message then also states how many units were left over.
     *
     * @param plan        packer output
     * @param utilization calculator output for the same plan
     * @param pallet      pallet template the plan was computed for
     * @param remaining   unplaced requests expressed with the caller's own product records
     */
    public OptimizationResult success(PackingPlan plan, UtilizationReport utilization,
                                      PalletTemplate pallet, List<ProductRequest> remaining) {
        List<PalletArrangement> arrangements = new ArrayList<>();
        for (int i = 0; i < plan.loads().size(); i++) {
            PalletLoad load = plan.loads().get(i);
            arrangements.add(new PalletArrangement(pallet, load.origin(), load.rotated(), load.placements(),
                    pallet.tareWeight() + load.goodsWeight(), utilization.palletUtilization().get(i)));
        }

        String message = successMessage;
        long unplaced = remaining.stream().mapToLong(ProductRequest::quantity).sum();
        if (unplaced > 0) {
            message = successMessage + "; " + unplaced + " unit(s) could not be placed";
        }
        return new OptimizationResult(true, message, utilization.volumeUtilization(),
                utilization.weightUtilization(), arrangements, remaining);
    }

    public OptimizationResult failure(FailureMode mode, String detail, List<ProductRequest> remaining) {
        return OptimizationResult.failure(mode.describe(detail), remaining);
    }

    /**
     * Pure projection of a result into display figures. On an unsuccessful result
     * the pallet and weight figures are zero or absent, so callers should check
     * {@code success} first.
     */
    public OptimizationSummary prepareOptimizationSummary(OptimizationResult result) {
        if (result == null) {
            throw new IllegalArgumentException("result must not be null");
        }
        long placed = result.palletArrangements().stream().mapToLong(PalletArrangement::unitCount).sum();
        long remaining = result.remainingProducts().stream().mapToLong(ProductRequest::quantity).sum();
        Double weight = result.weightUtilization() == null ? null : round(result.weightUtilization());
        return new OptimizationSummary(result.success(), round(result.utilization()),
                result.palletArrangements().size(), placed, remaining, weight, result.message());
    }

    static double round(double percentage) {
        if (!Double.isFinite(percentage)) {
            return percentage;
        }
        return BigDecimal.valueOf(percentage).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }
}

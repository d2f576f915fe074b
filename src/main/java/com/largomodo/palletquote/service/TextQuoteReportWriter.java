package com.largomodo.palletquote.service;

import com.largomodo.palletquote.core.domain.OptimizationResult;
import com.largomodo.palletquote.core.domain.OptimizationSummary;
import com.largomodo.palletquote.core.domain.PalletArrangement;
import com.largomodo.palletquote.core.domain.Placement;
import com.largomodo.palletquote.core.domain.ProductRequest;
import com.largomodo.palletquote.core.domain.Rotation;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Plain-text quote: summary block, one section per pallet, then the unplaced remainder.
 * Numbers are formatted with {@link Locale#ROOT} so reports do not depend on the host locale.
 */
public class TextQuoteReportWriter implements QuoteReportWriter {

    @Override
    public void write(Path target, Path source, OptimizationResult result, OptimizationSummary summary)
            throws IOException {
        try (BufferedWriter out = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
            line(out, "Loading quote for " + source.getFileName());
            line(out, "Status: " + (summary.success() ? "OK" : "FAILED") + " - " + summary.message());
            line(out, String.format(Locale.ROOT, "Volume utilization: %.2f%%", summary.utilization()));
            line(out, summary.weightUtilization() == null
                    ? "Weight utilization: n/a"
                    : String.format(Locale.ROOT, "Weight utilization: %.2f%%", summary.weightUtilization()));
            line(out, "Pallets: " + summary.totalPallets());
            line(out, "Units placed: " + summary.totalProducts());
            line(out, "Units remaining: " + summary.remainingProducts());

            int index = 1;
            for (PalletArrangement arrangement : result.palletArrangements()) {
                line(out, "");
                line(out, String.format(Locale.ROOT, "Pallet %d at (%.1f, %.1f)%s: %.2f kg, %.2f%% full",
                        index++, arrangement.position().x(), arrangement.position().y(),
                        arrangement.rotated() ? " turned" : "", arrangement.weight(), arrangement.utilization()));
                for (Placement placement : arrangement.placements()) {
                    line(out, String.format(Locale.ROOT, "  %d x %s at (%.1f, %.1f, %.1f)%s",
                            placement.quantity(), placement.productId(), placement.position().x(),
                            placement.position().y(), placement.position().z(),
                            placement.rotation().equals(Rotation.NONE) ? "" : " rotated"));
                }
            }

            if (result.hasRemainingProducts()) {
                line(out, "");
                line(out, "Not placed:");
                for (ProductRequest request : result.remainingProducts()) {
                    line(out, "  " + request.quantity() + " x " + request.product().displayName());
                }
            }
        }
    }

    private static void line(BufferedWriter out, String text) throws IOException {
        out.write(text);
        out.newLine();
    }
}

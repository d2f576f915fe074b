package com.largomodo.palletquote.core;

import com.largomodo.palletquote.core.domain.Container;
import com.largomodo.palletquote.core.domain.OptimizationResult;
import com.largomodo.palletquote.core.domain.OptimizationSummary;
import com.largomodo.palletquote.core.domain.PalletTemplate;
import com.largomodo.palletquote.core.domain.ProductRequest;
import com.largomodo.palletquote.engine.OptimizationEngine;
import com.largomodo.palletquote.service.ProductCsvReader;
import com.largomodo.palletquote.service.QuoteReportWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Product file to loading quote pipeline orchestrator.
 * <p>
 * Coordinates the workflow for one file:
 * 1. Read product requests from CSV
 * 2. Optimize them into the configured container and pallet
 * 3. Write {@code <basename>.quote.txt} into the output directory
 * <p>
 * Safe to share between batch workers: the engine is thread-safe and every call
 * writes to its own target file.
 */
public class QuoteProcessor {

    static final String REPORT_SUFFIX = ".quote.txt";

    private static final Logger log = LoggerFactory.getLogger(QuoteProcessor.class);

    private final ProductCsvReader reader;
    private final OptimizationEngine engine;
    private final QuoteReportWriter writer;
    private final Container container;
    private final PalletTemplate pallet;

    public QuoteProcessor(ProductCsvReader reader, OptimizationEngine engine, QuoteReportWriter writer,
                          Container container, PalletTemplate pallet) {
        this.reader = reader;
        this.engine = engine;
        this.writer = writer;
        this.container = container;
        this.pallet = pallet;
    }

    /**
     * Process one product file.
     *
     * @param input     product CSV file
     * @param outputDir existing directory receiving the quote
     * @return summary of the written quote
     * @throws IOException if the file cannot be read or parsed, or the quote cannot be written
     */
    public OptimizationSummary process(Path input, Path outputDir) throws IOException {
        String baseName = input.getFileName().toString().replaceFirst("\\.[^.]+$", "");
        if (baseName.isEmpty()) {
            throw new IOException("Cannot extract base name from product file: " + input.getFileName());
        }

        log.info("Processing: {}", input.getFileName());
        List<ProductRequest> requests = reader.read(input);
        OptimizationResult result = engine.optimize(requests, container, pallet);
        OptimizationSummary summary = engine.prepareSummary(result);

        Files.createDirectories(outputDir);
        Path target = outputDir.resolve(baseName + REPORT_SUFFIX);
        writer.write(target, input, result, summary);

        log.info("{}: {} pallet(s), {} unit(s) placed, {} remaining, {}% volume - {}",
                input.getFileName(), summary.totalPallets(), summary.totalProducts(),
                summary.remainingProducts(), summary.utilization(), summary.message());
        return summary;
    }
}

package com.largomodo.palletquote.service;

import com.largomodo.palletquote.core.domain.OptimizationResult;
import com.largomodo.palletquote.core.domain.OptimizationSummary;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Service interface for persisting a loading quote.
 * <p>
 * Abstracts the output format so the processor can be tested with a mock and
 * alternative renderings can be added without touching the pipeline.
 */
public interface QuoteReportWriter {

    /**
     * Write the quote for one input file.
     *
     * @param target  destination file, created or replaced
     * @param source  product file the quote was computed from (for the report header)
     * @param result  full optimization result
     * @param summary summary projected from {@code result}
     * @throws IOException if the file cannot be written
     */
    void write(Path target, Path source, OptimizationResult result, OptimizationSummary summary) throws IOException;
}

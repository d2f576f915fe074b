package com.largomodo.palletquote;

import com.largomodo.palletquote.core.QuoteObserver;
import com.largomodo.palletquote.core.QuoteProcessor;
import com.largomodo.palletquote.core.StandardContainer;
import com.largomodo.palletquote.core.StandardPallet;
import com.largomodo.palletquote.core.domain.OptimizationSummary;
import com.largomodo.palletquote.engine.OptimizationEngine;
import com.largomodo.palletquote.engine.OptimizerSettings;
import com.largomodo.palletquote.service.ProductCsvReader;
import com.largomodo.palletquote.service.TextQuoteReportWriter;
import com.largomodo.palletquote.util.QuoteFileMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;
import picocli.CommandLine.Model.CommandSpec;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

/**
 * CLI entry point for pallet loading quotes.
 * <p>
 * Accepts a single positional input path (file or directory) and determines
 * processing mode via runtime inspection.
 * <p>
 * Smart defaults:
 * - File input without -o: outputs to current working directory
 * - Directory input without -o: outputs to <input>/output subdirectory
 * - Explicit -o flag: overrides all defaults
 */
@Command(
        name = "palletquote",
        mixinStandardHelpOptions = true,
        resourceBundle = "palletquote.palletquote",
        version = "${bundle:application.version}",
        header = "Computes pallet and container loading quotes from product lists.",
        description = {
                "Reads product CSV files (id,name,sku,length,width,height,unit,weight,quantity),",
                "packs the requested units onto pallets inside a shipping container and writes",
                "a <name>.quote.txt report with utilization figures and unplaced products.",
                "",
                "Directories are scanned recursively for .csv files and processed in batch mode."
        },
        exitCodeListHeading = "%nExit Codes:%n",
        exitCodeList = {
                "0:Successful completion",
                "1:Execution error (unreadable file, malformed CSV, failed optimization)",
                "2:Invalid command line arguments"
        },
        footerHeading = "%nSee Also:%n",
        footer = {
                "Project home: ${bundle:application.url}"
        }
)
public class PalletQuote implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(PalletQuote.class);

    @Parameters(index = "0", paramLabel = "INPUT",
            description = {
                    "Product CSV file to quote, or a directory to process.",
                    "If a directory is provided, the tool scans it recursively for .csv files and " +
                            "quotes them in batch mode, preserving the directory structure."
            })
    File inputPath;

    @Option(names = {"-o", "--output-dir"},
            description = {
                    "The destination directory for quote reports.",
                    "If omitted, defaults apply:",
                    "  - Single file input: Defaults to the current directory ('.').",
                    "  - Directory input: Defaults to a folder named 'output' inside the input directory."
            })
    File outputDir;

    @Option(names = "--container", defaultValue = "FORTY_FOOT",
            description = {
                    "Container preset.",
                    "Valid values: ${COMPLETION-CANDIDATES}",
                    "Default: ${DEFAULT-VALUE}"
            })
    StandardContainer container;

    @Option(names = "--pallet", defaultValue = "DEFAULT",
            description = {
                    "Pallet preset.",
                    "Valid values: ${COMPLETION-CANDIDATES}",
                    "Default: ${DEFAULT-VALUE}"
            })
    StandardPallet pallet;

    @Option(names = "--no-rotation", description = "Never turn products about the vertical axis")
    boolean noRotation;

    @Option(names = "--cache-size", defaultValue = "100",
            description = "Memoized results kept in batch mode, 0 disables the cache. Default: ${DEFAULT-VALUE}")
    int cacheSize;

    @Spec
    CommandSpec spec;

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output")
    private boolean verbose;

    public static void main(String[] args) {
        System.exit(newCommandLine().execute(args));
    }

    static CommandLine newCommandLine() {
        CommandLine cmd = new CommandLine(new PalletQuote());
        cmd.setCaseInsensitiveEnumValuesAllowed(true);
        return cmd;
    }

    private static QuoteProcessor createProcessor(Config config) {
        OptimizerSettings settings = OptimizerSettings.defaults()
                .withCacheMaxEntries(config.cacheSize)
                .withAllowRotation(config.allowRotation);
        return new QuoteProcessor(new ProductCsvReader(), OptimizationEngine.create(settings),
                new TextQuoteReportWriter(), config.container.toContainer(), config.pallet.toTemplate());
    }

    /**
     * Execute batch processing with concurrent execution and fail-soft error handling.
     * <p>
     * Fixed thread pool sized to CPU cores with a bounded queue (2 * cores);
     * CallerRunsPolicy throttles submission when the queue is full. All workers
     * share one engine, so identical product lists are optimized once.
     *
     * @return number of files that failed
     */
    private static int runBatch(Config config) {
        Path inputRoot = config.input;
        Path outputRoot = config.outputDir;
        QuoteProcessor processor = createProcessor(config);

        int coreCount = Runtime.getRuntime().availableProcessors();
        ExecutorService executor = new ThreadPoolExecutor(
                coreCount,
                coreCount,
                0L,
                TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(2 * coreCount),
                new ThreadPoolExecutor.CallerRunsPolicy()
        );

        final AtomicInteger successCount = new AtomicInteger(0);
        final AtomicInteger failCount = new AtomicInteger(0);

        QuoteObserver observer = new QuoteObserver() {
            @Override
            public void onSuccess(Path input, OptimizationSummary summary) {
                successCount.incrementAndGet();
            }

            @Override
            public void onRejected(Path input, OptimizationSummary summary) {
                failCount.incrementAndGet();
                log.error("FAILED: {} - {}", inputRoot.relativize(input), summary.message());
            }

            @Override
            public void onFailure(Path input, Exception e) {
                failCount.incrementAndGet();
                log.error("FAILED: {} - {}", inputRoot.relativize(input), e.getMessage());
            }
        };

        Thread shutdownHook = new Thread(() -> {
            if (!executor.isShutdown()) {
                log.info("Interrupt received, shutting down gracefully...");
                executor.shutdown();
                try {
                    if (!executor.awaitTermination(5, TimeUnit.MINUTES)) {
                        executor.shutdownNow();
                    }
                } catch (InterruptedException e) {
                    executor.shutdownNow();
                }
            }
        });
        Runtime.getRuntime().addShutdownHook(shutdownHook);

        try (Stream<Path> stream = Files.walk(inputRoot)) {
            stream.filter(path -> !path.startsWith(outputRoot))
                    .filter(QuoteFileMatcher::isQuoteFile)
                    .forEach(file -> executor.submit(() -> {
                        try {
                            MDC.put("quote", file.getFileName().toString());
                            Path targetDir = outputRoot.resolve(inputRoot.relativize(file.getParent()));
                            observer.onStart(file);
                            OptimizationSummary summary = processor.process(file, targetDir);
                            if (summary.success()) {
                                observer.onSuccess(file, summary);
                            } else {
                                observer.onRejected(file, summary);
                            }
                        } catch (Exception e) {
                            // Catch all exceptions to prevent worker thread death (batch continues)
                            observer.onFailure(file, e);
                        } finally {
                            MDC.clear();
                        }
                        return null;
                    }));
        } catch (UncheckedIOException e) {
            log.error("WARNING: Directory traversal interrupted - {}", e.getCause().getMessage());
            failCount.incrementAndGet();
        } catch (IOException e) {
            log.error("ERROR: Cannot traverse input directory: {}", e.getMessage());
            failCount.incrementAndGet();
        } finally {
            executor.shutdown();
            try {
                if (!executor.awaitTermination(5, TimeUnit.MINUTES)) {
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                executor.shutdownNow();
                Thread.currentThread().interrupt();
            }
            try {
                Runtime.getRuntime().removeShutdownHook(shutdownHook);
            } catch (IllegalStateException e) {
                log.debug("JVM already shutting down, hook stays registered");
            }
        }

        log.info("Batch complete: {} successful, {} failed", successCount.get(), failCount.get());
        return failCount.get();
    }

    /**
     * Execute single-file processing with fail-fast error handling.
     * Exceptions propagate to picocli, which maps them to exit code 1.
     *
     * @return the written quote's summary
     */
    private static OptimizationSummary runSingleFile(Config config) throws IOException {
        if (!QuoteFileMatcher.isQuoteFile(config.input)) {
            throw new IOException("Input file is not a .csv product file: " + config.input);
        }
        OptimizationSummary summary = createProcessor(config).process(config.input, config.outputDir);
        log.info("Quote complete: {}", config.input.getFileName());
        return summary;
    }

    @Override
    public Integer call() throws Exception {
        if (verbose) {
            ch.qos.logback.classic.Logger root =
                    (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
            root.setLevel(ch.qos.logback.classic.Level.DEBUG);
        }

        if (!inputPath.exists()) {
            throw new ParameterException(spec.commandLine(),
                    "Input path does not exist: " + inputPath.getAbsolutePath());
        }
        if (!inputPath.canRead()) {
            throw new ParameterException(spec.commandLine(),
                    "Input path is not readable (check permissions): " + inputPath.getAbsolutePath());
        }
        if (cacheSize < 0) {
            throw new ParameterException(spec.commandLine(), "--cache-size cannot be negative: " + cacheSize);
        }

        if (outputDir == null) {
            outputDir = inputPath.isFile() ? new File(".") : new File(inputPath, "output");
        }
        if (outputDir.exists() && !outputDir.isDirectory()) {
            throw new ParameterException(spec.commandLine(),
                    "Output path must be a directory, not a file: " + outputDir.getAbsolutePath());
        }
        if (outputDir.exists() && !outputDir.canWrite()) {
            throw new ParameterException(spec.commandLine(),
                    "Output directory is not writable (check permissions): " + outputDir.getAbsolutePath());
        }
        Files.createDirectories(outputDir.toPath());

        Config config = new Config(inputPath.toPath().toAbsolutePath().normalize(),
                outputDir.toPath().toAbsolutePath().normalize(), container, pallet, !noRotation, cacheSize);

        if (inputPath.isFile()) {
            return runSingleFile(config).success() ? 0 : 1;
        }
        return runBatch(config) == 0 ? 0 : 1;
    }

    /**
     * Bridges Picocli field-based arguments to the run methods.
     */
    private record Config(Path input, Path outputDir, StandardContainer container, StandardPallet pallet,
                          boolean allowRotation, int cacheSize) {
    }
}

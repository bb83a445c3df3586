package ai.gamedata.translator.pipeline;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Runs the processor over every file of a run. A failing file is logged and counted; it never
 * stops the remaining files.
 */
public class BatchRunner {

    private static final Logger LOGGER = LoggerFactory.getLogger(BatchRunner.class);
    static final String MDC_FILE = "file";

    private final DataFileProcessor processor;
    private final int parallelism;

    public BatchRunner(DataFileProcessor processor, int parallelism) {
        this.processor = Objects.requireNonNull(processor, "processor");
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be at least 1");
        }
        this.parallelism = parallelism;
    }

    public RunSummary run(List<Path> files) {
        if (files == null || files.isEmpty()) {
            LOGGER.info("No data files to process");
            return new RunSummary(List.of());
        }
        List<FileOutcome> outcomes = parallelism == 1 || files.size() == 1
                ? runSequential(files)
                : runParallel(files);
        RunSummary summary = new RunSummary(outcomes);
        LOGGER.info("Done. {} file(s) processed, {} unique string(s) translated, {} error(s).",
                summary.processedFiles(), summary.uniqueStrings(), summary.errors());
        if (summary.untranslatedStrings() > 0) {
            LOGGER.warn("{} string(s) were left in the source language", summary.untranslatedStrings());
        }
        return summary;
    }

    private List<FileOutcome> runSequential(List<Path> files) {
        List<FileOutcome> outcomes = new ArrayList<>(files.size());
        for (Path file : files) {
            outcomes.add(processSafely(file));
        }
        return outcomes;
    }

    private List<FileOutcome> runParallel(List<Path> files) {
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(parallelism, files.size()));
        try {
            List<Future<FileOutcome>> futures = new ArrayList<>(files.size());
            for (Path file : files) {
                futures.add(executor.submit(() -> processSafely(file)));
            }
            List<FileOutcome> outcomes = new ArrayList<>(files.size());
            for (int i = 0; i < futures.size(); i++) {
                outcomes.add(await(futures.get(i), files.get(i)));
            }
            return outcomes;
        } finally {
            executor.shutdownNow();
        }
    }

    private FileOutcome await(Future<FileOutcome> future, Path file) {
        try {
            return future.get();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while processing " + file, ex);
        } catch (ExecutionException ex) {
            LOGGER.error("Processing failed for {}: {}", file, ex.getCause().getMessage(), ex.getCause());
            return FileOutcome.failed(processor.relativize(file), String.valueOf(ex.getCause().getMessage()));
        }
    }

    private FileOutcome processSafely(Path file) {
        String relativePath = processor.relativize(file);
        MDC.put(MDC_FILE, relativePath);
        try {
            LOGGER.info("Processing: {}", relativePath);
            return processor.process(file);
        } catch (RuntimeException ex) {
            LOGGER.error("Processing failed for {}: {}", relativePath, ex.getMessage(), ex);
            return FileOutcome.failed(relativePath, String.valueOf(ex.getMessage()));
        } finally {
            MDC.remove(MDC_FILE);
        }
    }
}

package ai.bigo.estimate;

import ai.bigo.analyzer.FunctionUnit;
import ai.bigo.analyzer.PythonFunctionExtractor;
import ai.bigo.analyzer.PythonParseException;
import ai.bigo.analyzer.signals.SignalCollector;
import ai.bigo.classify.ClassificationResult;
import ai.bigo.classify.ComplexityClassifier;
import ai.bigo.classify.HeuristicClassifier;
import ai.bigo.config.AnalyzerSettings;
import ai.bigo.llm.RemoteClassifier;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Runs the whole pipeline for one source text: extract functions, collect their signals and classify each one,
 * remote first when configured and the structural heuristic otherwise.
 *
 * <p>A parse failure stops the request before any per-function work. A remote failure only affects the function
 * it happened on, which then gets the heuristic verdict. Estimates always come back in extraction order, also
 * when functions are classified concurrently.
 */
public final class EstimationOrchestrator implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(EstimationOrchestrator.class);

    private final PythonFunctionExtractor extractor;
    private final SignalCollector collector;
    private final ComplexityClassifier classifier;
    private final HeuristicClassifier heuristic;
    private final int parallelism;
    private final @Nullable AutoCloseable remoteResources;

    EstimationOrchestrator(
            PythonFunctionExtractor extractor,
            SignalCollector collector,
            @Nullable ComplexityClassifier remote,
            int parallelism,
            @Nullable AutoCloseable remoteResources) {
        this.extractor = extractor;
        this.collector = collector;
        this.heuristic = new HeuristicClassifier();
        this.classifier = remote == null ? heuristic : remote.orElse(heuristic);
        this.parallelism = Math.max(1, parallelism);
        this.remoteResources = remoteResources;
    }

    /** Heuristic-only orchestrator, classifying sequentially. */
    public static EstimationOrchestrator heuristicOnly() {
        return new EstimationOrchestrator(new PythonFunctionExtractor(), new SignalCollector(), null, 1, null);
    }

    /** Orchestrator using an arbitrary primary classifier, with the heuristic as fallback. */
    public static EstimationOrchestrator withPrimary(ComplexityClassifier primary, int parallelism) {
        var resources = primary instanceof AutoCloseable closeable ? closeable : null;
        return new EstimationOrchestrator(
                new PythonFunctionExtractor(), new SignalCollector(), primary, parallelism, resources);
    }

    public static EstimationOrchestrator create(AnalyzerSettings settings) {
        if (!settings.remoteConfigured()) {
            logger.debug("No remote credential configured; using the structural heuristic only");
            return new EstimationOrchestrator(
                    new PythonFunctionExtractor(), new SignalCollector(), null, settings.parallelism(), null);
        }
        logger.debug("Remote classification enabled with model {}", settings.model());
        return withPrimary(RemoteClassifier.fromSettings(settings), settings.parallelism());
    }

    public AnalysisReport analyze(String sourceText) {
        List<FunctionUnit> units;
        try {
            units = extractor.extract(sourceText);
        } catch (PythonParseException e) {
            logger.debug("Parse failed: {}", e.getMessage());
            return AnalysisReport.failed(
                    new AnalysisError(AnalysisError.Kind.PARSE_ERROR, e.getMessage(), e.line(), e.column()));
        }

        try {
            var estimates = parallelism > 1 && units.size() > 1 ? estimateConcurrently(units) : estimate(units);
            return AnalysisReport.of(estimates);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.debug("Analysis interrupted with {} function(s) pending", units.size());
            return AnalysisReport.failed(AnalysisError.cancelled());
        }
    }

    private List<FunctionEstimate> estimate(List<FunctionUnit> units) throws InterruptedException {
        var estimates = new ArrayList<FunctionEstimate>(units.size());
        for (var unit : units) {
            if (Thread.currentThread().isInterrupted()) {
                throw new InterruptedException();
            }
            estimates.add(estimate(unit));
        }
        return estimates;
    }

    private List<FunctionEstimate> estimateConcurrently(List<FunctionUnit> units) throws InterruptedException {
        var threadCount = new AtomicInteger();
        var pool = Executors.newFixedThreadPool(Math.min(parallelism, units.size()), r -> {
            var t = new Thread(r, "bigo-estimate-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        try {
            var futures = new ArrayList<Future<FunctionEstimate>>(units.size());
            for (var unit : units) {
                futures.add(pool.submit(() -> estimate(unit)));
            }
            var estimates = new ArrayList<FunctionEstimate>(units.size());
            for (var future : futures) {
                estimates.add(await(future));
            }
            return estimates;
        } finally {
            pool.shutdownNow();
        }
    }

    private static FunctionEstimate await(Future<FunctionEstimate> future) throws InterruptedException {
        try {
            return future.get();
        } catch (CancellationException e) {
            throw new InterruptedException("Estimate cancelled");
        } catch (ExecutionException e) {
            // classifiers report failures as values, so anything thrown here is a bug
            throw new IllegalStateException("Estimation failed", e.getCause());
        }
    }

    private FunctionEstimate estimate(FunctionUnit unit) {
        var signals = collector.collect(unit);
        var result = classifier.classify(unit, signals);
        var verdict = result instanceof ClassificationResult.Success success
                ? success.verdict()
                : heuristic.classify(signals);
        return new FunctionEstimate(unit.qualifiedName(), unit.span().startLine(), verdict, signals);
    }

    /** Releases remote resources; in-flight remote calls are abandoned. */
    @Override
    public void close() {
        if (remoteResources == null) {
            return;
        }
        try {
            remoteResources.close();
        } catch (Exception e) {
            logger.warn("Error releasing remote classifier", e);
        }
    }
}

package ai.bigo.classify;

import ai.bigo.analyzer.FunctionUnit;
import ai.bigo.analyzer.signals.SignalProfile;

/**
 * Capability to classify one function. Implementations report failure as a {@link ClassificationResult.Failure}
 * value and do not throw, so callers can compose them without exception handling.
 */
@FunctionalInterface
public interface ComplexityClassifier {

    /**
     * @param unit the function being classified
     * @param signals its structural signals, already collected
     */
    ClassificationResult classify(FunctionUnit unit, SignalProfile signals);

    /** Uses {@code fallback} for every function this classifier fails on. */
    default ComplexityClassifier orElse(ComplexityClassifier fallback) {
        return new FallbackClassifier(this, fallback);
    }
}

package ai.bigo.classify;

import ai.bigo.analyzer.FunctionUnit;
import ai.bigo.analyzer.signals.SignalProfile;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Tries {@code primary} and, when it yields a {@link ClassificationResult.Failure}, answers with {@code fallback}
 * for that function only. Nothing from the failed attempt is passed on.
 */
public final class FallbackClassifier implements ComplexityClassifier {
    private static final Logger logger = LogManager.getLogger(FallbackClassifier.class);

    private final ComplexityClassifier primary;
    private final ComplexityClassifier fallback;

    public FallbackClassifier(ComplexityClassifier primary, ComplexityClassifier fallback) {
        this.primary = primary;
        this.fallback = fallback;
    }

    @Override
    public ClassificationResult classify(FunctionUnit unit, SignalProfile signals) {
        var result = primary.classify(unit, signals);
        if (result instanceof ClassificationResult.Failure failure) {
            logger.debug(
                    "Falling back for {} after {}: {}", unit.qualifiedName(), failure.kind(), failure.message());
            return fallback.classify(unit, signals);
        }
        return result;
    }
}

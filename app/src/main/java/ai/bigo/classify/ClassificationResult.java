package ai.bigo.classify;

import ai.bigo.analyzer.ComplexityVerdict;
import java.util.Objects;

/** Outcome of one classification attempt. */
public sealed interface ClassificationResult permits ClassificationResult.Success, ClassificationResult.Failure {

    static ClassificationResult success(ComplexityVerdict verdict) {
        return new Success(verdict);
    }

    static ClassificationResult failure(FailureKind kind, String message) {
        return new Failure(kind, message);
    }

    record Success(ComplexityVerdict verdict) implements ClassificationResult {
        public Success {
            Objects.requireNonNull(verdict, "verdict");
        }
    }

    record Failure(FailureKind kind, String message) implements ClassificationResult {
        public Failure {
            Objects.requireNonNull(kind, "kind");
            Objects.requireNonNull(message, "message");
        }
    }
}

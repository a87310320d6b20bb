package ai.bigo.estimate;

import java.util.List;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;

/**
 * Result of analyzing one source text: either one estimate per extracted function, in extraction order, or a single
 * error and no estimates.
 */
public record AnalysisReport(List<FunctionEstimate> estimates, @Nullable AnalysisError error) {

    public AnalysisReport {
        estimates = List.copyOf(estimates);
        if (error != null && !estimates.isEmpty()) {
            throw new IllegalArgumentException("A failed report carries no estimates");
        }
    }

    public static AnalysisReport of(List<FunctionEstimate> estimates) {
        return new AnalysisReport(estimates, null);
    }

    public static AnalysisReport failed(AnalysisError error) {
        return new AnalysisReport(List.of(), error);
    }

    public boolean succeeded() {
        return error == null;
    }

    public Optional<AnalysisError> errorOptional() {
        return Optional.ofNullable(error);
    }
}

package ai.bigo.analyzer;

import java.util.List;
import java.util.Objects;

/**
 * Terminal, externally visible classification of one function.
 *
 * <p>{@code loopCount} and {@code recursionCount} echo the structural signals for display regardless of which
 * classifier decided the classes. {@code notes} are free text for humans and never carry a class label that
 * contradicts {@code timeClass} or {@code spaceClass}.
 */
public record ComplexityVerdict(
        ComplexityClass timeClass,
        ComplexityClass spaceClass,
        VerdictSource source,
        int loopCount,
        int recursionCount,
        List<String> notes) {

    public ComplexityVerdict {
        Objects.requireNonNull(timeClass, "timeClass");
        Objects.requireNonNull(spaceClass, "spaceClass");
        Objects.requireNonNull(source, "source");
        if (!spaceClass.isSpaceClass()) {
            throw new IllegalArgumentException("Not a space class: " + spaceClass.label());
        }
        if (loopCount < 0 || recursionCount < 0) {
            throw new IllegalArgumentException(
                    "Counts must be non-negative: loops=" + loopCount + ", recursion=" + recursionCount);
        }
        notes = List.copyOf(notes);
    }

    public ComplexityVerdict(
            ComplexityClass timeClass,
            ComplexityClass spaceClass,
            VerdictSource source,
            int loopCount,
            int recursionCount) {
        this(timeClass, spaceClass, source, loopCount, recursionCount, List.of());
    }
}

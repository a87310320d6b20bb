package ai.bigo.classify;

import static ai.bigo.analyzer.ComplexityClass.CONSTANT;
import static ai.bigo.analyzer.ComplexityClass.EXPONENTIAL;
import static ai.bigo.analyzer.ComplexityClass.LINEAR;
import static ai.bigo.analyzer.ComplexityClass.QUADRATIC;
import static ai.bigo.analyzer.ComplexityClass.UNKNOWN;

import ai.bigo.analyzer.ComplexityClass;
import ai.bigo.analyzer.ComplexityVerdict;
import ai.bigo.analyzer.FunctionUnit;
import ai.bigo.analyzer.VerdictSource;
import ai.bigo.analyzer.signals.SignalProfile;
import com.google.common.base.Joiner;
import java.util.ArrayList;
import java.util.List;

/**
 * Maps structural signals to Big-O classes with a fixed rule table.
 *
 * <p>Time, first match wins:
 *
 * <ul>
 *   <li>two or more self-calls: O(2^n)
 *   <li>one self-call: O(n) when the call sits outside every loop; inside a loop, n raised to 1 + loop depth,
 *       so O(n^2) for one loop level
 *   <li>no self-calls: n raised to the loop depth, O(1) through O(n^3)
 * </ul>
 *
 * Degrees above 3 have no class in the table and come out as {@code unknown} with a note, never as a smaller
 * class. Space starts at O(1), rises to O(n) for a growing container or any recursion (the call stack is taken
 * as linear) and to O(n^2) when a container grows two or more loop levels deep.
 *
 * <p>When in doubt the coarser class wins. The classifier never fails.
 */
public final class HeuristicClassifier implements ComplexityClassifier {

    private static final int HIGHEST_TABLE_DEGREE = 3;

    @Override
    public ClassificationResult classify(FunctionUnit unit, SignalProfile signals) {
        return ClassificationResult.success(classify(signals));
    }

    public ComplexityVerdict classify(SignalProfile signals) {
        int loops = Math.max(0, signals.maxLoopDepth());
        int recursion = Math.max(0, signals.recursiveCallCount());
        if (!signals.isWellFormed()) {
            return new ComplexityVerdict(
                    UNKNOWN,
                    UNKNOWN,
                    VerdictSource.HEURISTIC,
                    loops,
                    recursion,
                    List.of("Contradictory structural signals; no class assigned"));
        }

        var notes = new ArrayList<String>();
        var time = timeClass(signals, notes);
        var space = spaceClass(signals, notes);
        addInformationalNotes(signals, notes);
        return new ComplexityVerdict(time, space, VerdictSource.HEURISTIC, loops, recursion, notes);
    }

    private static ComplexityClass timeClass(SignalProfile signals, List<String> notes) {
        int depth = signals.maxLoopDepth();
        int calls = signals.recursiveCallCount();

        if (calls >= 2) {
            notes.add("%d self-calls per invocation (branching recursion)".formatted(calls));
            return EXPONENTIAL;
        }
        if (calls == 1) {
            if (signals.recursiveCallLoopDepth() == 0) {
                notes.add("Single self-call outside any loop (linear recursion)");
                return LINEAR;
            }
            notes.add("Self-call inside %d loop level(s), compounded with loop depth %d"
                    .formatted(signals.recursiveCallLoopDepth(), depth));
            return boundedPolynomial(1 + depth, notes);
        }
        return boundedPolynomial(depth, notes);
    }

    private static ComplexityClass boundedPolynomial(int degree, List<String> notes) {
        if (degree > HIGHEST_TABLE_DEGREE) {
            notes.add("Growth of degree %d exceeds the classified range; at least %s"
                    .formatted(degree, ComplexityClass.CUBIC.label()));
            return UNKNOWN;
        }
        return ComplexityClass.polynomial(degree);
    }

    private static ComplexityClass spaceClass(SignalProfile signals, List<String> notes) {
        var space = CONSTANT;
        if (signals.allocatesGrowingContainer()) {
            space = LINEAR;
            notes.add("Container grows inside a loop");
        }
        if (signals.recursiveCallCount() >= 1) {
            space = space.max(LINEAR);
            notes.add("Recursion stack assumed linear in input size");
        }
        if (signals.allocationLoopDepth() >= 2) {
            space = QUADRATIC;
        }
        return space;
    }

    private static void addInformationalNotes(SignalProfile signals, List<String> notes) {
        if (signals.hasEarlyTermination()) {
            notes.add("Loop exits early on a condition; worst case reported");
        }
        if (signals.halvingLoop()) {
            notes.add("Loop halves its range; the halving pattern is not used to tighten the bound");
        }
        if (!signals.builtinOperations().isEmpty()) {
            notes.add("Calls " + Joiner.on(", ").join(signals.builtinOperations()));
        }
    }
}

package ai.bigo.analyzer.signals;

import java.util.List;

/**
 * Structural signals of one function, computed by a single traversal of its body.
 *
 * @param maxLoopDepth deepest loop nesting observed anywhere in the body
 * @param recursiveCallCount number of call sites naming the function itself
 * @param allocatesGrowingContainer a container is built up inside a loop
 * @param hasEarlyTermination a loop contains a conditional {@code break} or {@code return}
 * @param allocationLoopDepth deepest loop level at which a container grows, 0 when none does
 * @param recursiveCallLoopDepth deepest loop level enclosing a self-call, 0 when none is inside a loop
 * @param builtinOperations notable library calls in first-seen order, e.g. {@code sorted} or {@code .sort}
 * @param halvingLoop a loop shrinks its range geometrically (binary search or {@code n //= 2})
 */
public record SignalProfile(
        int maxLoopDepth,
        int recursiveCallCount,
        boolean allocatesGrowingContainer,
        boolean hasEarlyTermination,
        int allocationLoopDepth,
        int recursiveCallLoopDepth,
        List<String> builtinOperations,
        boolean halvingLoop) {

    public SignalProfile {
        builtinOperations = List.copyOf(builtinOperations);
    }

    /** Profile with only the core counters set; no allocation, no built-ins. */
    public static SignalProfile of(int maxLoopDepth, int recursiveCallCount) {
        return new SignalProfile(maxLoopDepth, recursiveCallCount, false, false, 0, 0, List.of(), false);
    }

    /**
     * False when the counters contradict each other, which a collector never produces but a hand-built profile
     * can.
     */
    public boolean isWellFormed() {
        return maxLoopDepth >= 0
                && recursiveCallCount >= 0
                && allocationLoopDepth >= 0
                && recursiveCallLoopDepth >= 0
                && allocationLoopDepth <= maxLoopDepth
                && recursiveCallLoopDepth <= maxLoopDepth
                && (recursiveCallCount > 0 || recursiveCallLoopDepth == 0)
                && allocatesGrowingContainer == (allocationLoopDepth > 0);
    }
}

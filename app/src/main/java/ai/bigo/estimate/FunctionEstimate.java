package ai.bigo.estimate;

import ai.bigo.analyzer.ComplexityVerdict;
import ai.bigo.analyzer.signals.SignalProfile;

/**
 * A verdict paired with the identity of the function it describes.
 *
 * @param function qualified function name, e.g. {@code Graph.bfs}
 * @param line 1-based line on which the definition starts
 * @param signals the structural signals the verdict was derived from
 */
public record FunctionEstimate(String function, int line, ComplexityVerdict verdict, SignalProfile signals) {}

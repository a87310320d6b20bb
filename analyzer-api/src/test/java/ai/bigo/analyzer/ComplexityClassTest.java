package ai.bigo.analyzer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("ComplexityClass Tests")
class ComplexityClassTest {

    @Test
    @DisplayName("Every class parses back from its own label")
    void testLabelsParseToThemselves() {
        for (var c : ComplexityClass.values()) {
            assertEquals(Optional.of(c), ComplexityClass.parse(c.label()), c.label());
            assertEquals(Optional.of(c), ComplexityClass.fromLabel(c.label()), c.label());
        }
    }

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource(
            delimiter = '|',
            value = {
                "o(N) | O(n)",
                "  O( n )  | O(n)",
                "O(n²) | O(n^2)",
                "O(N^2) | O(n^2)",
                "O(n**2) | O(n^2)",
                "O(n*n) | O(n^2)",
                "O(n³) | O(n^3)",
                "O(nlogn) | O(n log n)",
                "O(n*log n) | O(n log n)",
                "O(n log(n)) | O(n log n)",
                "O(log(n)) | O(log n)",
                "O(logn) | O(log n)",
                "O(√n) | O(sqrt n)",
                "O(sqrt(n)) | O(sqrt n)",
                "O(2ⁿ) | O(2^n)",
                "O(2**n) | O(2^n)",
                "O(n^1) | O(n)",
                "Θ(n) | O(n)",
                "O(N!) | O(n!)",
                "Unknown | unknown"
            })
    @DisplayName("Common spellings normalize into the closed set")
    void testNormalization(String raw, String expectedLabel) {
        assertEquals(ComplexityClass.fromLabel(expectedLabel), ComplexityClass.parse(raw));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "   ", "linear", "O(n) because of the loop", "O(n^4)", "O(m+n)", "fast"})
    @DisplayName("Free-form or out-of-set labels are rejected")
    void testRejectsUnknownSpellings(String raw) {
        assertTrue(ComplexityClass.parse(raw).isEmpty(), raw);
    }

    @Test
    @DisplayName("fromLabel is strict")
    void testFromLabelIsStrict() {
        assertTrue(ComplexityClass.fromLabel("o(n)").isEmpty());
        assertTrue(ComplexityClass.parse(null).isEmpty());
    }

    @Test
    @DisplayName("Space classes stop at O(n^2)")
    void testSpaceClasses() {
        var space = List.of(
                ComplexityClass.CONSTANT,
                ComplexityClass.LOGARITHMIC,
                ComplexityClass.SQUARE_ROOT,
                ComplexityClass.LINEAR,
                ComplexityClass.LINEARITHMIC,
                ComplexityClass.QUADRATIC,
                ComplexityClass.UNKNOWN);
        for (var c : ComplexityClass.values()) {
            assertEquals(space.contains(c), c.isSpaceClass(), c.label());
        }
    }

    @Test
    @DisplayName("Polynomial degrees map to the table, others to unknown")
    void testPolynomial() {
        assertEquals(ComplexityClass.CONSTANT, ComplexityClass.polynomial(0));
        assertEquals(ComplexityClass.LINEAR, ComplexityClass.polynomial(1));
        assertEquals(ComplexityClass.QUADRATIC, ComplexityClass.polynomial(2));
        assertEquals(ComplexityClass.CUBIC, ComplexityClass.polynomial(3));
        assertEquals(ComplexityClass.UNKNOWN, ComplexityClass.polynomial(4));
        assertEquals(ComplexityClass.UNKNOWN, ComplexityClass.polynomial(-1));
    }

    @Test
    @DisplayName("max picks the coarser class and unknown dominates")
    void testMax() {
        assertEquals(ComplexityClass.QUADRATIC, ComplexityClass.LINEAR.max(ComplexityClass.QUADRATIC));
        assertEquals(ComplexityClass.QUADRATIC, ComplexityClass.QUADRATIC.max(ComplexityClass.CONSTANT));
        assertEquals(ComplexityClass.UNKNOWN, ComplexityClass.FACTORIAL.max(ComplexityClass.UNKNOWN));
    }

    @Test
    @DisplayName("Verdicts reject a time-only class as space")
    void testVerdictRejectsLargeSpace() {
        assertThrows(
                IllegalArgumentException.class,
                () -> new ComplexityVerdict(
                        ComplexityClass.LINEAR, ComplexityClass.EXPONENTIAL, VerdictSource.HEURISTIC, 1, 0));
        assertThrows(
                IllegalArgumentException.class,
                () -> new ComplexityVerdict(
                        ComplexityClass.LINEAR, ComplexityClass.CONSTANT, VerdictSource.HEURISTIC, -1, 0));
    }

    @Test
    @DisplayName("Verdict source wire names are lower case")
    void testWireNames() {
        assertEquals("heuristic", VerdictSource.HEURISTIC.wireName());
        assertEquals("remote", VerdictSource.REMOTE.wireName());
    }
}

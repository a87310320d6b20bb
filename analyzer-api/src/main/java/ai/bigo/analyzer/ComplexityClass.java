package ai.bigo.analyzer;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.jetbrains.annotations.Nullable;

/**
 * The closed, ordered set of Big-O classes a verdict may carry.
 *
 * <p>Declaration order is growth order, with {@link #UNKNOWN} last. Labels are the only strings that ever
 * leave a classifier; anything a remote model produces must pass through {@link #parse(String)} first.
 */
public enum ComplexityClass {
    CONSTANT("O(1)"),
    LOGARITHMIC("O(log n)"),
    SQUARE_ROOT("O(sqrt n)"),
    LINEAR("O(n)"),
    LINEARITHMIC("O(n log n)"),
    QUADRATIC("O(n^2)"),
    CUBIC("O(n^3)"),
    EXPONENTIAL("O(2^n)"),
    FACTORIAL("O(n!)"),
    UNKNOWN("unknown");

    private static final Map<String, ComplexityClass> BY_CANONICAL_KEY = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(c -> canonicalKey(c.label), Function.identity()));

    /** Spellings models commonly return, keyed by their canonical form. */
    private static final Map<String, ComplexityClass> ALIASES = Map.ofEntries(
            Map.entry("o(c)", CONSTANT),
            Map.entry("o(logn)", LOGARITHMIC),
            Map.entry("o(log(n))", LOGARITHMIC),
            Map.entry("o(lgn)", LOGARITHMIC),
            Map.entry("o(n^0.5)", SQUARE_ROOT),
            Map.entry("o(n^(1/2))", SQUARE_ROOT),
            Map.entry("o(n^1)", LINEAR),
            Map.entry("o(nlog(n))", LINEARITHMIC),
            Map.entry("o(n*logn)", LINEARITHMIC),
            Map.entry("o(n*log(n))", LINEARITHMIC),
            Map.entry("o(n·logn)", LINEARITHMIC),
            Map.entry("o(n*n)", QUADRATIC),
            Map.entry("o(n**2)", QUADRATIC),
            Map.entry("o(n**3)", CUBIC),
            Map.entry("o(2**n)", EXPONENTIAL),
            Map.entry("o(n!)", FACTORIAL),
            Map.entry("o(factorial(n))", FACTORIAL));

    private static final List<ComplexityClass> SPACE_CLASSES =
            List.of(CONSTANT, LOGARITHMIC, SQUARE_ROOT, LINEAR, LINEARITHMIC, QUADRATIC, UNKNOWN);

    private final String label;

    ComplexityClass(String label) {
        this.label = label;
    }

    /** The external label, e.g. {@code O(n^2)}. */
    public String label() {
        return label;
    }

    /** Space verdicts are restricted to O(n^2) and below, plus {@link #UNKNOWN}. */
    public boolean isSpaceClass() {
        return SPACE_CLASSES.contains(this);
    }

    /** Returns the coarser of the two classes; {@link #UNKNOWN} dominates everything. */
    public ComplexityClass max(ComplexityClass other) {
        return compareTo(other) >= 0 ? this : other;
    }

    /** Polynomial class for {@code n^degree}, or {@link #UNKNOWN} when the degree is outside 0..3. */
    public static ComplexityClass polynomial(int degree) {
        return switch (degree) {
            case 0 -> CONSTANT;
            case 1 -> LINEAR;
            case 2 -> QUADRATIC;
            case 3 -> CUBIC;
            default -> UNKNOWN;
        };
    }

    /**
     * Normalizes a free-form label into the closed set.
     *
     * <p>Case, whitespace, unicode superscripts and the usual alternative spellings ({@code O(N²)}, {@code
     * O(n*log n)}, {@code O(√n)}) are accepted. Anything else yields empty; callers must treat that as a
     * malformed label rather than inventing a class.
     */
    public static Optional<ComplexityClass> parse(@Nullable String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        var key = canonicalKey(raw);
        var direct = BY_CANONICAL_KEY.get(key);
        if (direct != null) {
            return Optional.of(direct);
        }
        return Optional.ofNullable(ALIASES.get(key));
    }

    /** Strict lookup by exact external label. */
    public static Optional<ComplexityClass> fromLabel(String label) {
        return Arrays.stream(values()).filter(c -> c.label.equals(label)).findFirst();
    }

    private static String canonicalKey(String raw) {
        var s = raw.strip().toLowerCase(Locale.ROOT);
        s = s.replace("²", "^2")
                .replace("³", "^3")
                .replace("ⁿ", "^n")
                .replace("√", "sqrt")
                .replace('×', '*');
        s = s.replaceAll("\\s+", "");
        if (s.startsWith("θ(")) {
            s = "o(" + s.substring(2);
        }
        s = s.replace("sqrt(n)", "sqrtn");
        return s;
    }

    @Override
    public String toString() {
        return label;
    }
}

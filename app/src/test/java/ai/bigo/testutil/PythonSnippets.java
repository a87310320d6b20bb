package ai.bigo.testutil;

import ai.bigo.analyzer.FunctionUnit;
import ai.bigo.analyzer.PythonFunctionExtractor;
import ai.bigo.analyzer.PythonParseException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;

/** Parsing shortcuts for tests working on small Python snippets and the {@code testcode-py} fixtures. */
public final class PythonSnippets {
    private static final PythonFunctionExtractor EXTRACTOR = new PythonFunctionExtractor();

    private PythonSnippets() {}

    public static List<FunctionUnit> units(String source) {
        try {
            return EXTRACTOR.extract(source);
        } catch (PythonParseException e) {
            throw new AssertionError("Snippet does not parse: " + e.getMessage(), e);
        }
    }

    /** The unit with the given qualified name; fails the test when there is none. */
    public static FunctionUnit unit(String source, String qualifiedName) {
        return units(source).stream()
                .filter(u -> u.qualifiedName().equals(qualifiedName))
                .findFirst()
                .orElseThrow(() -> new AssertionError("No function " + qualifiedName + " in snippet"));
    }

    /** The first unit of a snippet holding a single top-level function. */
    public static FunctionUnit only(String source) {
        var units = units(source);
        if (units.isEmpty()) {
            throw new AssertionError("Snippet defines no function");
        }
        return units.get(0);
    }

    public static String fixture(String fileName) {
        var path = "/testcode-py/" + fileName;
        try (var in = Objects.requireNonNull(PythonSnippets.class.getResourceAsStream(path), path)) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}

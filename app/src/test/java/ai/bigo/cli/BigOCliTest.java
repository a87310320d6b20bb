package ai.bigo.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

@DisplayName("BigOCli Tests")
class BigOCliTest {

    private static final String NESTED_LOOPS =
            """
            def foo(n):
                for i in range(n):
                    for j in range(n):
                        print(i, j)
            """;

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    private int run(String stdin, Map<String, String> env, String... args) {
        var cli = new BigOCli(
                new ByteArrayInputStream(stdin.getBytes(StandardCharsets.UTF_8)),
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8),
                env);
        return BigOCli.commandLine(cli).execute(args);
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String stderr() {
        return err.toString(StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("Reads stdin and prints the JSON report")
    void testStdinJson() {
        int exit = run(NESTED_LOOPS, Map.of());

        assertEquals(BigOCli.EXIT_OK, exit);
        assertEquals(
                "[{\"function\":\"foo\",\"big_o\":\"O(n^2)\",\"space_complexity\":\"O(1)\",\"loops\":2,\"recursion\":0}]",
                stdout().strip());
    }

    @Test
    @DisplayName("Reads a file argument")
    void testFileArgument() throws Exception {
        var file = tempDir.resolve("sample.py");
        Files.writeString(file, "def fib(n):\n    return n if n < 2 else fib(n - 1) + fib(n - 2)\n");

        int exit = run("", Map.of(), file.toString());

        assertEquals(BigOCli.EXIT_OK, exit);
        var node = new ObjectMapper().readTree(stdout()).get(0);
        assertEquals("fib", node.get("function").asText());
        assertEquals("O(2^n)", node.get("big_o").asText());
        assertEquals("O(n)", node.get("space_complexity").asText());
        assertEquals(2, node.get("recursion").asInt());
    }

    @Test
    @DisplayName("A missing file is an input error")
    void testMissingFile() {
        int exit = run("", Map.of(), tempDir.resolve("absent.py").toString());

        assertEquals(BigOCli.EXIT_INPUT, exit);
        assertTrue(stderr().contains("cannot read"), stderr());
        assertEquals("", stdout());
    }

    @Test
    @DisplayName("Invalid source prints a ParseError object and exits with 2")
    void testParseError() throws Exception {
        int exit = run("def foo(n):\n    for i in range(n):\n        total = [i,\n", Map.of());

        assertEquals(BigOCli.EXIT_PARSE, exit);
        var node = new ObjectMapper().readTree(stdout());
        assertEquals("ParseError", node.get("error").asText());
        assertTrue(node.get("line").asInt() >= 1);
        assertTrue(stderr().startsWith("ParseError at line"), stderr());
    }

    @Test
    @DisplayName("Text format and verbose output")
    void testTextVerbose() {
        int exit = run(NESTED_LOOPS, Map.of(), "--format", "text", "--verbose");

        assertEquals(BigOCli.EXIT_OK, exit);
        assertTrue(stdout().startsWith("Function: foo\n  Time Complexity:  O(n^2)"), stdout());
        assertTrue(stdout().contains("Source: heuristic"), stdout());
    }

    @Test
    @DisplayName("Format names are case-insensitive")
    void testFormatCase() {
        int exit = run(NESTED_LOOPS, Map.of(), "--format", "Text");

        assertEquals(BigOCli.EXIT_OK, exit);
        assertTrue(stdout().startsWith("Function: foo"), stdout());
    }

    @Test
    @DisplayName("--no-remote ignores a configured credential")
    void testNoRemote() {
        var env = Map.of("BIGO_API_KEY", "sk-test", "BIGO_BASE_URL", "http://127.0.0.1:1/v1");

        int exit = run(NESTED_LOOPS, env, "--no-remote", "--verbose");

        assertEquals(BigOCli.EXIT_OK, exit);
        assertTrue(stdout().contains("\"source\":\"heuristic\""), stdout());
    }

    @Test
    @DisplayName("Invalid option values are usage errors")
    void testInvalidParallelism() {
        int exit = run(NESTED_LOOPS, Map.of(), "--parallel", "0");

        assertEquals(CommandLine.ExitCode.USAGE, exit);
        assertTrue(stderr().contains("Parallelism"), stderr());
    }
}

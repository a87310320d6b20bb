package ai.bigo.llm;

import static ai.bigo.testutil.PythonSnippets.only;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.bigo.analyzer.ComplexityClass;
import ai.bigo.analyzer.FunctionUnit;
import ai.bigo.analyzer.VerdictSource;
import ai.bigo.analyzer.signals.SignalProfile;
import ai.bigo.classify.ClassificationResult;
import ai.bigo.classify.FailureKind;
import ai.bigo.config.AnalyzerSettings;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.HttpException;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("RemoteClassifier Tests")
class RemoteClassifierTest {

    private static final Duration TIMEOUT = Duration.ofMillis(300);

    private final FunctionUnit unit = only(
            """
            def search(xs, t):
                lo, hi = 0, len(xs) - 1
                while lo <= hi:
                    mid = (lo + hi) // 2
                    if xs[mid] < t:
                        lo = mid + 1
                    else:
                        hi = mid - 1
                return lo
            """);
    private final SignalProfile signals = SignalProfile.of(1, 0);

    private static ClassificationResult classify(FakeChatModel model, FunctionUnit unit, SignalProfile signals) {
        try (var classifier = new RemoteClassifier(model, "fake-model", TIMEOUT)) {
            return classifier.classify(unit, signals);
        }
    }

    private static FailureKind failureKind(ClassificationResult result) {
        return assertInstanceOf(ClassificationResult.Failure.class, result).kind();
    }

    @Test
    @DisplayName("A valid reply becomes a remote verdict echoing the structural counts")
    void testValidReply() {
        var model = FakeChatModel.replying(
                "{\"time_complexity\": \"O(log n)\", \"space_complexity\": \"O(1)\", \"rationale\": \"halves\"}");

        var result = classify(model, unit, signals);

        var verdict = assertInstanceOf(ClassificationResult.Success.class, result).verdict();
        assertEquals(ComplexityClass.LOGARITHMIC, verdict.timeClass());
        assertEquals(ComplexityClass.CONSTANT, verdict.spaceClass());
        assertEquals(VerdictSource.REMOTE, verdict.source());
        assertEquals(1, verdict.loopCount());
        assertEquals(0, verdict.recursionCount());
        assertEquals(List.of("halves"), verdict.notes());
    }

    @Test
    @DisplayName("The request carries the function source")
    void testRequestCarriesSource() {
        var model = FakeChatModel.replying("{\"time_complexity\": \"O(n)\", \"space_complexity\": \"O(1)\"}");

        classify(model, unit, signals);

        assertEquals(1, model.requests.size());
        var userText = model.requests.get(0).messages().stream()
                .filter(UserMessage.class::isInstance)
                .map(m -> ((UserMessage) m).singleText())
                .findFirst()
                .orElseThrow();
        assertTrue(userText.contains("mid = (lo + hi) // 2"), userText);
        assertTrue(userText.contains("`search`"), userText);
    }

    @Test
    @DisplayName("Labels are normalized and fenced replies accepted")
    void testNormalizedLabels() {
        var model = FakeChatModel.replying(
                """
                ```json
                {"time_complexity": "O(N²)", "space_complexity": "o(n)"}
                ```
                """);

        var verdict = assertInstanceOf(ClassificationResult.Success.class, classify(model, unit, signals))
                .verdict();

        assertEquals(ComplexityClass.QUADRATIC, verdict.timeClass());
        assertEquals(ComplexityClass.LINEAR, verdict.spaceClass());
        assertTrue(verdict.notes().isEmpty());
    }

    @Test
    @DisplayName("unknown is an accepted remote label")
    void testUnknownAccepted() {
        var model = FakeChatModel.replying("{\"time_complexity\": \"unknown\", \"space_complexity\": \"unknown\"}");

        var verdict = assertInstanceOf(ClassificationResult.Success.class, classify(model, unit, signals))
                .verdict();

        assertEquals(ComplexityClass.UNKNOWN, verdict.timeClass());
    }

    @ParameterizedTest
    @ValueSource(
            strings = {
                "not json at all",
                "[\"O(n)\"]",
                "{\"time_complexity\": \"O(n)\"}",
                "{\"space_complexity\": \"O(1)\"}",
                "{\"time_complexity\": \"linear-ish\", \"space_complexity\": \"O(1)\"}",
                "{\"time_complexity\": \"O(n)\", \"space_complexity\": \"O(2^n)\"}",
                "{\"time_complexity\": 3, \"space_complexity\": \"O(1)\"}",
                "   "
            })
    @DisplayName("Malformed replies are typed failures")
    void testMalformedReplies(String reply) {
        var result = classify(FakeChatModel.replying(reply), unit, signals);

        assertEquals(FailureKind.REMOTE_MALFORMED, failureKind(result));
    }

    @Test
    @DisplayName("A model error is reported as unavailable")
    void testModelError() {
        var result = classify(FakeChatModel.failing(new HttpException(503, "overloaded")), unit, signals);

        assertEquals(FailureKind.REMOTE_UNAVAILABLE, failureKind(result));
    }

    @Test
    @DisplayName("A gateway timeout from the service is reported as a timeout")
    void testGatewayTimeout() {
        var result = classify(FakeChatModel.failing(new HttpException(504, "gateway timeout")), unit, signals);

        assertEquals(FailureKind.REMOTE_TIMEOUT, failureKind(result));
    }

    @Test
    @DisplayName("A slow model times out within the bound")
    void testSlowModelTimesOut() {
        var model = FakeChatModel.slow(
                "{\"time_complexity\": \"O(n)\", \"space_complexity\": \"O(1)\"}", Duration.ofSeconds(5));

        long start = System.nanoTime();
        var result = classify(model, unit, signals);
        var elapsed = Duration.ofNanos(System.nanoTime() - start);

        assertEquals(FailureKind.REMOTE_TIMEOUT, failureKind(result));
        assertTrue(elapsed.compareTo(Duration.ofSeconds(3)) < 0, "took " + elapsed);
    }

    @Test
    @DisplayName("Without a credential every call is unavailable and nothing is sent")
    void testNoCredential() {
        try (var classifier = RemoteClassifier.fromSettings(AnalyzerSettings.defaults())) {
            var result = classifier.classify(unit, signals);

            assertEquals(FailureKind.REMOTE_UNAVAILABLE, failureKind(result));
        }
    }

    @Test
    @DisplayName("A closed classifier reports unavailable")
    void testClosed() {
        var classifier = new RemoteClassifier(
                FakeChatModel.replying("{\"time_complexity\": \"O(n)\", \"space_complexity\": \"O(1)\"}"),
                "fake-model",
                TIMEOUT);
        classifier.close();

        assertEquals(FailureKind.REMOTE_UNAVAILABLE, failureKind(classifier.classify(unit, signals)));
    }
}

package ai.bigo.llm;

import static ai.bigo.classify.FailureKind.REMOTE_MALFORMED;
import static ai.bigo.classify.FailureKind.REMOTE_TIMEOUT;
import static ai.bigo.classify.FailureKind.REMOTE_UNAVAILABLE;

import ai.bigo.analyzer.ComplexityClass;
import ai.bigo.analyzer.ComplexityVerdict;
import ai.bigo.analyzer.FunctionUnit;
import ai.bigo.analyzer.VerdictSource;
import ai.bigo.analyzer.signals.SignalProfile;
import ai.bigo.classify.ClassificationResult;
import ai.bigo.classify.ComplexityClassifier;
import ai.bigo.config.AnalyzerSettings;
import ai.bigo.prompts.ComplexityPrompts;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.ResponseFormat;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.openai.OpenAiChatModel;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Asks an inference service for a function's complexity.
 *
 * <p>Each call is one round trip, run on a daemon thread and awaited for at most the configured timeout; a call
 * that overruns is cancelled and abandoned. Replies are accepted only when both labels normalize into the closed
 * {@link ComplexityClass} set. Every problem comes back as a {@link ClassificationResult.Failure} so the caller can
 * fall back; nothing is retried.
 */
public final class RemoteClassifier implements ComplexityClassifier, AutoCloseable {
    private static final Logger logger = LogManager.getLogger(RemoteClassifier.class);

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private final @Nullable ChatModel chatModel;
    private final String modelName;
    private final Duration timeout;
    private final ExecutorService executor;

    public RemoteClassifier(@Nullable ChatModel chatModel, String modelName, Duration timeout) {
        this.chatModel = chatModel;
        this.modelName = modelName;
        this.timeout = timeout;
        var threadCount = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(r -> {
            var t = new Thread(r, "bigo-remote-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /** Builds an OpenAI-compatible classifier; without a credential every call fails as unavailable. */
    public static RemoteClassifier fromSettings(AnalyzerSettings settings) {
        if (!settings.remoteConfigured()) {
            return new RemoteClassifier(null, settings.model(), settings.remoteTimeout());
        }
        var builder = OpenAiChatModel.builder()
                .apiKey(settings.apiKey())
                .modelName(settings.model())
                .temperature(0.0)
                .timeout(settings.remoteTimeout())
                .maxRetries(0);
        if (settings.baseUrl() != null) {
            builder.baseUrl(settings.baseUrl());
        }
        return new RemoteClassifier(builder.build(), settings.model(), settings.remoteTimeout());
    }

    @Override
    public ClassificationResult classify(FunctionUnit unit, SignalProfile signals) {
        if (chatModel == null) {
            return ClassificationResult.failure(REMOTE_UNAVAILABLE, "No credential configured for " + modelName);
        }

        var request = ChatRequest.builder()
                .messages(ComplexityPrompts.classificationMessages(unit))
                .responseFormat(ResponseFormat.JSON)
                .build();

        Future<ChatResponse> future;
        try {
            future = executor.submit(() -> chatModel.chat(request));
        } catch (RejectedExecutionException e) {
            return ClassificationResult.failure(REMOTE_UNAVAILABLE, "Remote classifier is closed");
        }

        ChatResponse response;
        try {
            response = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            return ClassificationResult.failure(
                    REMOTE_TIMEOUT, "No reply from %s within %d ms".formatted(modelName, timeout.toMillis()));
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return ClassificationResult.failure(REMOTE_UNAVAILABLE, "Interrupted while waiting for " + modelName);
        } catch (ExecutionException e) {
            var cause = e.getCause() != null ? e.getCause() : e;
            if (LlmTimeouts.isTimeout(cause)) {
                return ClassificationResult.failure(REMOTE_TIMEOUT, describe(cause));
            }
            logger.debug("Remote classification of {} failed", unit.qualifiedName(), cause);
            return ClassificationResult.failure(REMOTE_UNAVAILABLE, describe(cause));
        }

        var text = response == null || response.aiMessage() == null ? null : response.aiMessage().text();
        return parseReply(text, signals);
    }

    /** Validates a raw model reply against the closed label set. */
    static ClassificationResult parseReply(@Nullable String text, SignalProfile signals) {
        if (text == null || text.isBlank()) {
            return ClassificationResult.failure(REMOTE_MALFORMED, "Empty reply");
        }

        JsonNode root;
        try {
            root = OBJECT_MAPPER.readTree(stripCodeFence(text));
        } catch (JsonProcessingException e) {
            return ClassificationResult.failure(REMOTE_MALFORMED, "Reply is not JSON: " + e.getOriginalMessage());
        }
        if (root == null || !root.isObject()) {
            return ClassificationResult.failure(REMOTE_MALFORMED, "Reply is not a JSON object");
        }

        var time = label(root, ComplexityPrompts.TIME_FIELD);
        if (time.isEmpty()) {
            return ClassificationResult.failure(
                    REMOTE_MALFORMED, "Unrecognized time label: " + root.path(ComplexityPrompts.TIME_FIELD));
        }
        var space = label(root, ComplexityPrompts.SPACE_FIELD);
        if (space.isEmpty() || !space.get().isSpaceClass()) {
            return ClassificationResult.failure(
                    REMOTE_MALFORMED, "Unrecognized space label: " + root.path(ComplexityPrompts.SPACE_FIELD));
        }

        var rationale = root.path(ComplexityPrompts.RATIONALE_FIELD);
        List<String> notes = rationale.isTextual() && !rationale.asText().isBlank()
                ? List.of(rationale.asText().strip())
                : List.of();
        return ClassificationResult.success(new ComplexityVerdict(
                time.get(),
                space.get(),
                VerdictSource.REMOTE,
                Math.max(0, signals.maxLoopDepth()),
                Math.max(0, signals.recursiveCallCount()),
                notes));
    }

    private static Optional<ComplexityClass> label(JsonNode root, String field) {
        var node = root.get(field);
        if (node == null || !node.isTextual()) {
            return Optional.empty();
        }
        return ComplexityClass.parse(node.asText());
    }

    private static String stripCodeFence(String text) {
        var trimmed = text.strip();
        if (!trimmed.startsWith("```")) {
            return trimmed;
        }
        int firstNewline = trimmed.indexOf('\n');
        int closing = trimmed.lastIndexOf("```");
        if (firstNewline < 0 || closing <= firstNewline) {
            return trimmed;
        }
        return trimmed.substring(firstNewline + 1, closing).strip();
    }

    private static String describe(Throwable t) {
        var message = t.getMessage();
        return t.getClass().getSimpleName() + (message == null || message.isBlank() ? "" : ": " + message);
    }

    /** Abandons in-flight calls without waiting for them. */
    @Override
    public void close() {
        executor.shutdownNow();
    }
}

package ai.bigo.prompts;

import ai.bigo.analyzer.ComplexityClass;
import ai.bigo.analyzer.FunctionUnit;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/** Builds the messages sent to the inference service when classifying one function. */
public final class ComplexityPrompts {

    public static final String TIME_FIELD = "time_complexity";
    public static final String SPACE_FIELD = "space_complexity";
    public static final String RATIONALE_FIELD = "rationale";

    private static final String SYSTEM_PROMPT =
            """
            You are an expert in algorithm analysis. Given one Python function, determine its worst-case
            asymptotic time complexity and auxiliary space complexity in terms of the input size n.

            Reply with a single JSON object and nothing else:
            {"%s": "<label>", "%s": "<label>", "%s": "<one short sentence>"}

            Time labels must be exactly one of: %s
            Space labels must be exactly one of: %s
            Use "unknown" only when the complexity cannot be determined from the code shown.
            Count the recursion stack as space. Do not count the input itself.
            """;

    private ComplexityPrompts() {}

    public static List<ChatMessage> classificationMessages(FunctionUnit unit) {
        return List.of(SystemMessage.from(systemPrompt()), UserMessage.from(userPrompt(unit)));
    }

    static String systemPrompt() {
        var timeLabels = Arrays.stream(ComplexityClass.values()).map(ComplexityClass::label);
        var spaceLabels =
                Arrays.stream(ComplexityClass.values()).filter(ComplexityClass::isSpaceClass).map(ComplexityClass::label);
        return SYSTEM_PROMPT.formatted(
                TIME_FIELD,
                SPACE_FIELD,
                RATIONALE_FIELD,
                timeLabels.collect(Collectors.joining(", ")),
                spaceLabels.collect(Collectors.joining(", ")));
    }

    static String userPrompt(FunctionUnit unit) {
        return """
                Function `%s`:

                ```python
                %s
                ```
                """
                .formatted(unit.qualifiedName(), unit.sourceText());
    }
}

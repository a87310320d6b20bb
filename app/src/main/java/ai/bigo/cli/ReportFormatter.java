package ai.bigo.cli;

import ai.bigo.estimate.AnalysisError;
import ai.bigo.estimate.AnalysisReport;
import ai.bigo.estimate.FunctionEstimate;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * Renders an {@link AnalysisReport} for stdout.
 *
 * <p>JSON output is an array with one object per function, in extraction order. Verbose mode adds the verdict
 * source, the definition line, the early-termination flag and the classifier's notes to each object. A failed
 * report renders as a single error object.
 */
public final class ReportFormatter {

    private final ObjectMapper objectMapper;
    private final boolean verbose;

    public ReportFormatter(boolean verbose, boolean pretty) {
        this.objectMapper = new ObjectMapper();
        if (pretty) {
            objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        }
        this.verbose = verbose;
    }

    public ReportFormatter(boolean verbose) {
        this(verbose, false);
    }

    public String format(AnalysisReport report, OutputFormat format) throws JsonProcessingException {
        return switch (format) {
            case JSON -> toJson(report);
            case TEXT -> toText(report);
        };
    }

    public String toJson(AnalysisReport report) throws JsonProcessingException {
        var error = report.error();
        if (error != null) {
            return objectMapper.writeValueAsString(ErrorView.of(error));
        }
        var views = report.estimates().stream().map(this::view).toList();
        return objectMapper.writeValueAsString(views);
    }

    public String toText(AnalysisReport report) {
        var error = report.error();
        if (error != null) {
            return "%s: %s".formatted(error.kind().wireName(), error.message());
        }
        if (report.estimates().isEmpty()) {
            return "No functions found";
        }
        var sb = new StringBuilder();
        for (var estimate : report.estimates()) {
            if (sb.length() > 0) {
                sb.append("\n\n");
            }
            appendBlock(sb, estimate);
        }
        return sb.toString();
    }

    private void appendBlock(StringBuilder sb, FunctionEstimate estimate) {
        var verdict = estimate.verdict();
        sb.append("Function: ").append(estimate.function()).append('\n');
        sb.append("  Time Complexity:  ").append(verdict.timeClass().label()).append('\n');
        sb.append("  Space Complexity: ").append(verdict.spaceClass().label()).append('\n');
        sb.append("  Loops: ").append(verdict.loopCount()).append('\n');
        sb.append("  Recursion: ").append(verdict.recursionCount());
        if (verbose) {
            sb.append('\n').append("  Source: ").append(verdict.source().wireName());
            sb.append('\n').append("  Line: ").append(estimate.line());
            sb.append('\n').append("  Early Termination: ").append(estimate.signals().hasEarlyTermination());
            for (var note : verdict.notes()) {
                sb.append('\n').append("  - ").append(note);
            }
        }
    }

    private EstimateView view(FunctionEstimate estimate) {
        var verdict = estimate.verdict();
        if (!verbose) {
            return new EstimateView(
                    estimate.function(),
                    verdict.timeClass().label(),
                    verdict.spaceClass().label(),
                    verdict.loopCount(),
                    verdict.recursionCount(),
                    null,
                    null,
                    null,
                    null);
        }
        return new EstimateView(
                estimate.function(),
                verdict.timeClass().label(),
                verdict.spaceClass().label(),
                verdict.loopCount(),
                verdict.recursionCount(),
                verdict.source().wireName(),
                estimate.line(),
                estimate.signals().hasEarlyTermination(),
                verdict.notes());
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonPropertyOrder({
        "function",
        "big_o",
        "space_complexity",
        "loops",
        "recursion",
        "source",
        "line",
        "early_termination",
        "notes"
    })
    record EstimateView(
            @JsonProperty("function") String function,
            @JsonProperty("big_o") String bigO,
            @JsonProperty("space_complexity") String spaceComplexity,
            @JsonProperty("loops") int loops,
            @JsonProperty("recursion") int recursion,
            @JsonProperty("source") @Nullable String source,
            @JsonProperty("line") @Nullable Integer line,
            @JsonProperty("early_termination") @Nullable Boolean earlyTermination,
            @JsonProperty("notes") @Nullable List<String> notes) {}

    @JsonPropertyOrder({"error", "message", "line", "column"})
    record ErrorView(
            @JsonProperty("error") String error,
            @JsonProperty("message") String message,
            @JsonProperty("line") int line,
            @JsonProperty("column") int column) {

        static ErrorView of(AnalysisError error) {
            return new ErrorView(error.kind().wireName(), error.message(), error.line(), error.column());
        }
    }
}

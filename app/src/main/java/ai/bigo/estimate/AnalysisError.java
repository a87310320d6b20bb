package ai.bigo.estimate;

/** A request-level failure; when present the report carries no estimates. */
public record AnalysisError(Kind kind, String message, int line, int column) {

    public enum Kind {
        /** The input is not valid Python. */
        PARSE_ERROR("ParseError"),
        /** The analysis was interrupted before every function was classified. */
        CANCELLED("Cancelled");

        private final String wireName;

        Kind(String wireName) {
            this.wireName = wireName;
        }

        public String wireName() {
            return wireName;
        }
    }

    public static AnalysisError cancelled() {
        return new AnalysisError(Kind.CANCELLED, "Analysis was cancelled", 0, 0);
    }
}

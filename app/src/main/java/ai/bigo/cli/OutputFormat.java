package ai.bigo.cli;

/** Rendering of an analysis report on stdout. */
public enum OutputFormat {
    /** Array of per-function objects, or a single error object. */
    JSON,
    /** One human-readable block per function. */
    TEXT
}

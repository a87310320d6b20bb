package ai.bigo.analyzer;

import java.util.Locale;

/** Which classifier produced a verdict. */
public enum VerdictSource {
    HEURISTIC,
    REMOTE;

    /** Lower-case wire name, as written into reports. */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}

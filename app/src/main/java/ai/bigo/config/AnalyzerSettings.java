package ai.bigo.config;

import java.time.Duration;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Settings for one analysis run, read from the environment and optionally overridden on the command line.
 *
 * @param apiKey credential for the inference service; null or blank means heuristic-only
 * @param model model identifier sent to the service
 * @param baseUrl OpenAI-compatible endpoint, or null for the provider default
 * @param remoteTimeout upper bound on one remote round trip
 * @param parallelism number of functions classified concurrently, at least 1
 */
public record AnalyzerSettings(
        @Nullable String apiKey, String model, @Nullable String baseUrl, Duration remoteTimeout, int parallelism) {
    private static final Logger logger = LogManager.getLogger(AnalyzerSettings.class);

    public static final String ENV_API_KEY = "BIGO_API_KEY";
    public static final String ENV_OPENAI_API_KEY = "OPENAI_API_KEY";
    public static final String ENV_MODEL = "BIGO_MODEL";
    public static final String ENV_BASE_URL = "BIGO_BASE_URL";
    public static final String ENV_TIMEOUT_SECONDS = "BIGO_TIMEOUT_SECONDS";

    public static final String DEFAULT_MODEL = "gpt-4o-mini";
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);

    public AnalyzerSettings {
        if (model.isBlank()) {
            model = DEFAULT_MODEL;
        }
        if (remoteTimeout.isNegative() || remoteTimeout.isZero()) {
            throw new IllegalArgumentException("Remote timeout must be positive: " + remoteTimeout);
        }
        if (parallelism < 1) {
            throw new IllegalArgumentException("Parallelism must be at least 1: " + parallelism);
        }
    }

    /** Heuristic-only settings with defaults everywhere. */
    public static AnalyzerSettings defaults() {
        return new AnalyzerSettings(null, DEFAULT_MODEL, null, DEFAULT_TIMEOUT, 1);
    }

    public static AnalyzerSettings fromEnvironment(Map<String, String> env) {
        var apiKey = firstNonBlank(env.get(ENV_API_KEY), env.get(ENV_OPENAI_API_KEY));
        var model = firstNonBlank(env.get(ENV_MODEL), DEFAULT_MODEL);
        var baseUrl = firstNonBlank(env.get(ENV_BASE_URL));
        return new AnalyzerSettings(apiKey, model == null ? DEFAULT_MODEL : model, baseUrl, timeoutFrom(env), 1);
    }

    /** True when a credential is present and the remote classifier should be attempted. */
    public boolean remoteConfigured() {
        return apiKey != null && !apiKey.isBlank();
    }

    public AnalyzerSettings withModel(String newModel) {
        return new AnalyzerSettings(apiKey, newModel, baseUrl, remoteTimeout, parallelism);
    }

    public AnalyzerSettings withBaseUrl(@Nullable String newBaseUrl) {
        return new AnalyzerSettings(apiKey, model, newBaseUrl, remoteTimeout, parallelism);
    }

    public AnalyzerSettings withRemoteTimeout(Duration newTimeout) {
        return new AnalyzerSettings(apiKey, model, baseUrl, newTimeout, parallelism);
    }

    public AnalyzerSettings withParallelism(int newParallelism) {
        return new AnalyzerSettings(apiKey, model, baseUrl, remoteTimeout, newParallelism);
    }

    /** Drops the credential, forcing heuristic-only mode. */
    public AnalyzerSettings withoutRemote() {
        return new AnalyzerSettings(null, model, baseUrl, remoteTimeout, parallelism);
    }

    private static Duration timeoutFrom(Map<String, String> env) {
        var raw = env.get(ENV_TIMEOUT_SECONDS);
        if (raw == null || raw.isBlank()) {
            return DEFAULT_TIMEOUT;
        }
        try {
            var seconds = Double.parseDouble(raw.strip());
            long millis = Math.round(seconds * 1000);
            if (millis > 0) {
                return Duration.ofMillis(millis);
            }
            logger.warn("Ignoring {}={}, below one millisecond", ENV_TIMEOUT_SECONDS, raw);
        } catch (NumberFormatException e) {
            logger.warn("Ignoring unparseable {}={}", ENV_TIMEOUT_SECONDS, raw);
        }
        return DEFAULT_TIMEOUT;
    }

    private static @Nullable String firstNonBlank(@Nullable String... candidates) {
        for (var candidate : candidates) {
            if (candidate != null && !candidate.isBlank()) {
                return candidate.strip();
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return "AnalyzerSettings[remote=%s, model=%s, baseUrl=%s, remoteTimeout=%s, parallelism=%d]"
                .formatted(remoteConfigured(), model, baseUrl, remoteTimeout, parallelism);
    }
}

package ai.bigo.llm;

import dev.langchain4j.exception.HttpException;
import java.io.InterruptedIOException;
import java.net.http.HttpTimeoutException;
import java.util.concurrent.TimeoutException;
import org.jetbrains.annotations.Nullable;

/**
 * Helpers for detecting LLM timeout conditions.
 *
 * <p>Timeouts are recognized by type, never by message text: an {@link HttpException} with status 504 from the
 * upstream service, or a transport-level timeout anywhere in the cause chain.
 */
public final class LlmTimeouts {

    private static final int MAX_CAUSE_DEPTH = 10;

    private LlmTimeouts() {
        // utility
    }

    /**
     * Returns true when the provided throwable, or one of its causes, represents a timeout.
     *
     * @param t throwable to inspect
     * @return true for HTTP 504, {@link TimeoutException}, {@link HttpTimeoutException} or a socket read timeout
     */
    public static boolean isTimeout(@Nullable Throwable t) {
        var current = t;
        for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
            if (current instanceof HttpException he && he.statusCode() == 504) {
                return true;
            }
            if (current instanceof TimeoutException
                    || current instanceof HttpTimeoutException
                    || current instanceof InterruptedIOException) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }
}

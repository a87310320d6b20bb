package ai.bigo.classify;

/** Why a remote classification produced no verdict. None of these are retried. */
public enum FailureKind {
    /** No credential is configured, or the service could not be reached or answered with an error. */
    REMOTE_UNAVAILABLE,
    /** The call did not complete within the configured bound. */
    REMOTE_TIMEOUT,
    /** The reply could not be parsed into labels from the closed set. */
    REMOTE_MALFORMED
}

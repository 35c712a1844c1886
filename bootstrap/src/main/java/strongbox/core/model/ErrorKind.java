package strongbox.core.model;

/**
 * Dispatch policy attached to every bootstrap failure.
 */
public enum ErrorKind {
    /** Retried on the fixed health interval. */
    TRANSIENT,
    /** Stops the bootstrap without failing the process (standby node, shutdown requested). */
    TERMINAL,
    /** Logged, then the process exits with a failure status. */
    FATAL,
    /** Logged as a warning and never escalated. */
    BEST_EFFORT
}

package taskweave.engine.retry;

import java.util.List;

/**
 * Coarse class of an attempt failure, derived from its message.
 */
public enum ErrorCategory {
    /** Connection refused, timeouts, unreachable hosts */
    NETWORK(true, List.of("connection", "timeout", "timed out", "network", "unreachable")),
    /** Access denied; retrying will not help */
    PERMISSION(false, List.of("permission", "access denied", "forbidden", "unauthorized")),
    /** Missing input; retrying will not help */
    NOT_FOUND(false, List.of("not found", "does not exist", "missing", "no such")),
    /** Out of memory, disk or quota */
    RESOURCE(true, List.of("resource", "memory", "disk space", "quota")),
    /** Busy or locked, usually clears by itself */
    TEMPORARY(true, List.of("busy", "locked", "in use", "try again", "unavailable")),
    UNKNOWN(true, List.of());

    private final boolean retryable;
    private final List<String> patterns;

    ErrorCategory(boolean retryable, List<String> patterns) {
        this.retryable = retryable;
        this.patterns = patterns;
    }

    public boolean isRetryable() {
        return retryable;
    }

    List<String> patterns() {
        return patterns;
    }
}

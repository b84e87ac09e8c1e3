package taskweave.engine.retry;

import taskweave.engine.model.ErrorKind;

import java.time.Duration;
import java.time.Instant;

/**
 * What to do with a failed attempt.
 *
 * @param retry    schedule another attempt
 * @param delay    backoff before the next attempt, zero when not retrying
 * @param wakeAt   when the task becomes eligible again, null when not retrying
 * @param kind     error kind recorded on the task
 * @param category classifier verdict for the message
 * @param message  error message recorded on the task
 */
public record RetryDecision(
        boolean retry,
        Duration delay,
        Instant wakeAt,
        ErrorKind kind,
        ErrorCategory category,
        String message) {

    static RetryDecision retry(Duration delay, Instant now, ErrorKind kind, ErrorCategory category, String message) {
        return new RetryDecision(true, delay, now.plus(delay), kind, category, message);
    }

    static RetryDecision fail(ErrorKind kind, ErrorCategory category, String message) {
        return new RetryDecision(false, Duration.ZERO, null, kind, category, message);
    }
}

package taskweave.engine.queue;

import java.time.Duration;

/**
 * Queue-level settings applied to every task submitted without its own values.
 *
 * @param defaultMaxAttempts attempt budget for tasks that do not set one
 * @param defaultTimeout     per-attempt deadline for tasks that do not set one, null for none
 * @param continueOnFailure  treat any terminal dependency as satisfied
 */
public record QueueOptions(int defaultMaxAttempts, Duration defaultTimeout, boolean continueOnFailure) {

    public QueueOptions {
        if (defaultMaxAttempts < 1) {
            throw new IllegalArgumentException("defaultMaxAttempts must be >= 1");
        }
        if (defaultTimeout != null && (defaultTimeout.isNegative() || defaultTimeout.isZero())) {
            throw new IllegalArgumentException("defaultTimeout must be positive");
        }
    }

    public static QueueOptions defaults() {
        return new QueueOptions(3, null, false);
    }

    public QueueOptions withContinueOnFailure(boolean value) {
        return new QueueOptions(defaultMaxAttempts, defaultTimeout, value);
    }

    public QueueOptions withDefaultMaxAttempts(int value) {
        return new QueueOptions(value, defaultTimeout, continueOnFailure);
    }

    public QueueOptions withDefaultTimeout(Duration value) {
        return new QueueOptions(defaultMaxAttempts, value, continueOnFailure);
    }
}

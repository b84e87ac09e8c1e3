package taskweave.engine.retry;

import java.time.Duration;

/**
 * Exponential backoff: the delay after failed attempt {@code n} is
 * {@code min(backoffBase * backoffMultiplier^(n-1), maxBackoff)}.
 *
 * @param classifyErrors when true, errors classified as permanent are not retried
 */
public record RetryPolicy(
        Duration backoffBase,
        double backoffMultiplier,
        Duration maxBackoff,
        boolean classifyErrors) {

    public RetryPolicy {
        if (backoffBase == null || backoffBase.isNegative()) {
            throw new IllegalArgumentException("backoffBase must be >= 0");
        }
        if (backoffMultiplier < 1.0) {
            throw new IllegalArgumentException("backoffMultiplier must be >= 1");
        }
        if (maxBackoff == null || maxBackoff.compareTo(backoffBase) < 0) {
            throw new IllegalArgumentException("maxBackoff must be >= backoffBase");
        }
    }

    /** 1s base, doubling, capped at 60s */
    public static RetryPolicy defaults() {
        return new RetryPolicy(Duration.ofSeconds(1), 2.0, Duration.ofSeconds(60), false);
    }

    /**
     * Delay before the attempt following failed attempt {@code attempt} (1-based).
     */
    public Duration delayFor(int attempt) {
        if (attempt < 1) {
            return Duration.ZERO;
        }
        double millis = backoffBase.toMillis() * Math.pow(backoffMultiplier, attempt - 1);
        if (millis >= maxBackoff.toMillis()) {
            return maxBackoff;
        }
        return Duration.ofMillis(Math.round(millis));
    }

    public RetryPolicy withClassifyErrors(boolean value) {
        return new RetryPolicy(backoffBase, backoffMultiplier, maxBackoff, value);
    }
}

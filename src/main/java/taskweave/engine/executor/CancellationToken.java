package taskweave.engine.executor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import taskweave.engine.error.TaskCancelledException;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Cooperative cancellation signal handed to the executor with every attempt.
 * A token is set once and never reset.
 */
public final class CancellationToken {

    private static final Logger log = LoggerFactory.getLogger(CancellationToken.class);

    private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();
    private volatile String reason;

    public boolean isCancelled() {
        return reason != null;
    }

    /** Why the token was cancelled, null while still active */
    public String reason() {
        return reason;
    }

    /**
     * Throw {@link TaskCancelledException} if the token has been cancelled.
     * Convenient for executors that poll between steps.
     */
    public void throwIfCancelled() {
        String r = reason;
        if (r != null) {
            throw new TaskCancelledException(r);
        }
    }

    /**
     * Register a callback run once on cancellation (immediately if already cancelled).
     */
    public void onCancel(Runnable callback) {
        callbacks.add(callback);
        if (isCancelled() && callbacks.remove(callback)) {
            runSafely(callback);
        }
    }

    /**
     * Set the signal. Only the first call has an effect.
     *
     * @return true if this call cancelled the token
     */
    public boolean cancel(String reason) {
        synchronized (this) {
            if (this.reason != null) {
                return false;
            }
            this.reason = reason == null ? "cancelled" : reason;
        }
        for (Runnable callback : callbacks) {
            if (callbacks.remove(callback)) {
                runSafely(callback);
            }
        }
        return true;
    }

    private void runSafely(Runnable callback) {
        try {
            callback.run();
        } catch (Exception e) {
            log.warn("Cancellation callback failed: {}", e.getMessage(), e);
        }
    }
}

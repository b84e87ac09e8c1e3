package taskweave.engine.error;

/**
 * Saving or loading a queue snapshot failed.
 */
public class SnapshotException extends TaskQueueException {

    public SnapshotException(String message, Throwable cause) {
        super(message, cause);
    }

    public SnapshotException(String message) {
        super(message);
    }
}

package taskweave.engine.retry;

import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

class ErrorClassifierTest {

    private final ErrorClassifier classifier = new ErrorClassifier();

    @Test
    void classifiesByMessage() {
        assertEquals(ErrorCategory.NETWORK, classifier.classify("Connection refused by upstream"));
        assertEquals(ErrorCategory.PERMISSION, classifier.classify("Access denied for user deploy"));
        assertEquals(ErrorCategory.NOT_FOUND, classifier.classify("input.csv: No such file"));
        assertEquals(ErrorCategory.RESOURCE, classifier.classify("Out of memory"));
        assertEquals(ErrorCategory.TEMPORARY, classifier.classify("Database is locked"));
        assertEquals(ErrorCategory.UNKNOWN, classifier.classify("something odd happened"));
        assertEquals(ErrorCategory.UNKNOWN, classifier.classify((String) null));
    }

    @Test
    void classifiesThrowable() {
        assertEquals(ErrorCategory.NETWORK, classifier.classify(new IOException("read timed out")));
        assertEquals(ErrorCategory.UNKNOWN, classifier.classify(new IllegalStateException()));
    }

    @Test
    void onlyPermissionAndNotFoundArePermanent() {
        assertFalse(ErrorCategory.PERMISSION.isRetryable());
        assertFalse(ErrorCategory.NOT_FOUND.isRetryable());
        assertTrue(ErrorCategory.NETWORK.isRetryable());
        assertTrue(ErrorCategory.UNKNOWN.isRetryable());
    }
}

package taskweave.engine.retry;

import org.junit.jupiter.api.Test;
import taskweave.engine.error.TaskExecutionException;
import taskweave.engine.error.TaskTimeoutException;
import taskweave.engine.model.ErrorKind;
import taskweave.engine.model.Task;
import taskweave.engine.model.TaskPayload;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class RetryControllerTest {

    private static final Instant NOW = Instant.parse("2026-01-01T10:00:00Z");

    private static Task afterAttempt(int attempt, int maxAttempts) {
        return Task.builder().id("t").payload(TaskPayload.of("x")).attempts(attempt).maxAttempts(maxAttempts).build();
    }

    @Test
    void retriesWithBackoffUntilBudgetSpent() {
        RetryController controller = new RetryController(RetryPolicy.defaults());

        RetryDecision first = controller.onFailure(afterAttempt(1, 3), new RuntimeException("boom"), NOW);
        assertTrue(first.retry());
        assertEquals(Duration.ofSeconds(1), first.delay());
        assertEquals(NOW.plusSeconds(1), first.wakeAt());
        assertEquals(ErrorKind.EXECUTION, first.kind());
        assertEquals("boom", first.message());

        RetryDecision second = controller.onFailure(afterAttempt(2, 3), new RuntimeException("boom"), NOW);
        assertEquals(Duration.ofSeconds(2), second.delay());

        RetryDecision last = controller.onFailure(afterAttempt(3, 3), new RuntimeException("boom"), NOW);
        assertFalse(last.retry());
        assertNull(last.wakeAt());
    }

    @Test
    void permanentFailureIsNotRetried() {
        RetryController controller = new RetryController(RetryPolicy.defaults());

        RetryDecision decision = controller.onFailure(afterAttempt(1, 5),
                new TaskExecutionException("bad input", false), NOW);

        assertFalse(decision.retry());
    }

    @Test
    void timeoutIsRecordedAsTimeout() {
        RetryController controller = new RetryController(RetryPolicy.defaults());

        RetryDecision decision = controller.onFailure(afterAttempt(1, 2),
                new TaskTimeoutException("t", Duration.ofMillis(50)), NOW);

        assertTrue(decision.retry());
        assertEquals(ErrorKind.TIMEOUT, decision.kind());
    }

    @Test
    void classificationStopsPermanentCategories() {
        RetryController plain = new RetryController(RetryPolicy.defaults());
        RetryController classifying = new RetryController(RetryPolicy.defaults().withClassifyErrors(true));
        RuntimeException denied = new RuntimeException("permission denied");

        assertTrue(plain.onFailure(afterAttempt(1, 3), denied, NOW).retry());

        RetryDecision decision = classifying.onFailure(afterAttempt(1, 3), denied, NOW);
        assertFalse(decision.retry());
        assertEquals(ErrorCategory.PERMISSION, decision.category());

        assertTrue(classifying.onFailure(afterAttempt(1, 3), new RuntimeException("host unreachable"), NOW).retry());
    }

    @Test
    void blankMessageFallsBackToClassName() {
        assertEquals("IllegalStateException", RetryController.describe(new IllegalStateException()));
    }
}

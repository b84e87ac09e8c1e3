package taskweave.engine.retry;

import java.util.Locale;

/**
 * Maps an error message to an {@link ErrorCategory} by case-insensitive
 * substring match. Categories are tried in declaration order.
 */
public final class ErrorClassifier {

    public ErrorCategory classify(String message) {
        if (message == null || message.isBlank()) {
            return ErrorCategory.UNKNOWN;
        }
        String text = message.toLowerCase(Locale.ROOT);
        for (ErrorCategory category : ErrorCategory.values()) {
            for (String pattern : category.patterns()) {
                if (text.contains(pattern)) {
                    return category;
                }
            }
        }
        return ErrorCategory.UNKNOWN;
    }

    public ErrorCategory classify(Throwable error) {
        return classify(RetryController.describe(error));
    }
}

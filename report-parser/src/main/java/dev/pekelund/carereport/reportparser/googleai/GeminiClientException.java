package dev.pekelund.carereport.reportparser.googleai;

/**
 * A Gemini call failed. {@link #isTransientFailure()} tells whether the same request may succeed later.
 */
public class GeminiClientException extends RuntimeException {

    private final boolean transientFailure;

    public GeminiClientException(String message, boolean transientFailure) {
        super(message);
        this.transientFailure = transientFailure;
    }

    public GeminiClientException(String message, Throwable cause, boolean transientFailure) {
        super(message, cause);
        this.transientFailure = transientFailure;
    }

    public boolean isTransientFailure() {
        return transientFailure;
    }
}

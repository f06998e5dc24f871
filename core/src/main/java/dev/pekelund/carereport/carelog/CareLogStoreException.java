package dev.pekelund.carereport.carelog;

/**
 * Raised by a domain store when a query or append fails.
 */
public class CareLogStoreException extends RuntimeException {

    private final boolean transientFailure;

    public CareLogStoreException(String message, boolean transientFailure) {
        super(message);
        this.transientFailure = transientFailure;
    }

    public CareLogStoreException(String message, Throwable cause, boolean transientFailure) {
        super(message, cause);
        this.transientFailure = transientFailure;
    }

    /**
     * Whether the failure is attributable to connectivity or a temporarily unavailable backend.
     */
    public boolean isTransientFailure() {
        return transientFailure;
    }
}

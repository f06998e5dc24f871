package dev.pekelund.carereport.storage;

/**
 * A durable storage operation failed. The message names the operation that failed.
 */
public class ReportStorageException extends RuntimeException {

    public ReportStorageException(String message) {
        super(message);
    }

    public ReportStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}

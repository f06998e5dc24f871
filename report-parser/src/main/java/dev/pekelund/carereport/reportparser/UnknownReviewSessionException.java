package dev.pekelund.carereport.reportparser;

public class UnknownReviewSessionException extends RuntimeException {

    private final String sessionId;

    public UnknownReviewSessionException(String sessionId) {
        super("No open review session with id " + sessionId);
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}

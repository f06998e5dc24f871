package dev.pekelund.carereport.events;

/**
 * Signals a review action that the current state of a candidate does not permit.
 */
public class ReviewTransitionException extends RuntimeException {

    private final ReviewState from;
    private final ReviewAction action;

    public ReviewTransitionException(ReviewState from, ReviewAction action, String message) {
        super(message);
        this.from = from;
        this.action = action;
    }

    public ReviewState getFrom() {
        return from;
    }

    public ReviewAction getAction() {
        return action;
    }
}

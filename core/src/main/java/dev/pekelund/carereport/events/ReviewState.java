package dev.pekelund.carereport.events;

import java.util.Locale;

/**
 * Review state of a candidate event.
 *
 * <pre>
 * DETECTED --edit--> EDITED --edit--> EDITED
 * DETECTED | EDITED --confirm--> CONFIRMED
 * DETECTED | EDITED --reject--> REJECTED
 * CONFIRMED <--> REJECTED
 * </pre>
 */
public enum ReviewState {

    DETECTED,
    EDITED,
    CONFIRMED,
    REJECTED;

    /**
     * Returns the state reached by applying {@code action}.
     *
     * @throws ReviewTransitionException when the action is not allowed from this state
     */
    public ReviewState next(ReviewAction action) {
        if (action == null) {
            throw new IllegalArgumentException("Review action is required");
        }
        if (action == ReviewAction.CONFIRM) {
            return CONFIRMED;
        }
        if (action == ReviewAction.REJECT) {
            return REJECTED;
        }
        if (this == DETECTED || this == EDITED) {
            return EDITED;
        }
        throw new ReviewTransitionException(this, action,
            "Cannot edit an event that is already " + name().toLowerCase(Locale.ROOT));
    }

    public boolean isResolved() {
        return this == CONFIRMED || this == REJECTED;
    }
}

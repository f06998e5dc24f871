package dev.pekelund.carereport.review;

import java.util.List;

/**
 * Raised by {@link ReviewSession#confirmAll()} when at least one unrejected candidate cannot be
 * confirmed. No candidate changes state when this is thrown.
 */
public class BulkConfirmationException extends RuntimeException {

    private final List<Integer> positions;

    public BulkConfirmationException(List<Integer> positions) {
        super("Cannot confirm all events; incomplete candidate(s) at position(s) " + positions);
        this.positions = List.copyOf(positions);
    }

    public List<Integer> getPositions() {
        return positions;
    }
}

package dev.pekelund.carereport.review;

public class UnknownCandidateException extends RuntimeException {

    private final int index;

    public UnknownCandidateException(int index, int size) {
        super("No candidate at position " + index + " (session holds " + size + ")");
        this.index = index;
    }

    public int getIndex() {
        return index;
    }
}

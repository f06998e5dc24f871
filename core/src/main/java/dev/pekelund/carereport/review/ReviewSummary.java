package dev.pekelund.carereport.review;

public record ReviewSummary(int total, int detected, int edited, int confirmed, int rejected, int duplicates) {

    public int unresolved() {
        return detected + edited;
    }
}

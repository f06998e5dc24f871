package dev.pekelund.carereport.commit;

public enum CommitFailureType {
    NOT_CONFIRMED,
    VALIDATION,
    STORAGE
}

package dev.pekelund.carereport.carelog;

/**
 * Identifies a committed record: the store collection and the record id within it.
 */
public record RecordReference(String collection, String id) {

    @Override
    public String toString() {
        return collection + "/" + id;
    }
}

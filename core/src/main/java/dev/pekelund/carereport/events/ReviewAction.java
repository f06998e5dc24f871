package dev.pekelund.carereport.events;

/**
 * User actions that move a candidate through review.
 */
public enum ReviewAction {
    EDIT,
    CONFIRM,
    REJECT
}

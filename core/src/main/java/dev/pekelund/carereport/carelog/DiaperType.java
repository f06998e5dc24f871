package dev.pekelund.carereport.carelog;

public enum DiaperType {
    WET,
    DIRTY,
    BOTH
}

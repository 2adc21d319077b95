package com.mouse.betinfo.enums;

public enum FieldChange {
    UNCHANGED,  // present in both with equal values
    ADDED,      // only in the newer snapshot
    REMOVED,    // only in the older snapshot
    CHANGED     // present in both, values differ
}

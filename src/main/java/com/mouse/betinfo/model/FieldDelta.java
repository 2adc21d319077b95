package com.mouse.betinfo.model;

import com.mouse.betinfo.enums.FieldChange;

public record FieldDelta(String field, FieldChange change, Object oldValue, Object newValue) {

    public static FieldDelta unchanged(String field, Object value) {
        return new FieldDelta(field, FieldChange.UNCHANGED, value, value);
    }

    public static FieldDelta added(String field, Object value) {
        return new FieldDelta(field, FieldChange.ADDED, null, value);
    }

    public static FieldDelta removed(String field, Object value) {
        return new FieldDelta(field, FieldChange.REMOVED, value, null);
    }

    public static FieldDelta changed(String field, Object oldValue, Object newValue) {
        return new FieldDelta(field, FieldChange.CHANGED, oldValue, newValue);
    }

    public boolean isChange() {
        return change != FieldChange.UNCHANGED;
    }
}

package com.example.pharmacyrota.reassignment;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

public enum ReassignmentScope {
    SLOT,
    DAY,
    WEEK;

    @JsonCreator
    public static ReassignmentScope from(String value) {
        if (value == null) {
            return null;
        }
        return ReassignmentScope.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}

package com.example.pharmacyrota.constraint;

public enum IneligibilityReason {
    NOT_WORKING_DAY,
    UNAVAILABLE,
    MISSING_TRAINING,
    EXCLUSIVE_COMMITMENT
}

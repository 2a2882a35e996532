package com.example.pharmacyrota.rota;

public enum ConflictType {
    UNDERSTAFFED,
    BELOW_IDEAL,
    DOUBLE_BOOKED,
    // a do-not-split holder also works somewhere else that day
    SPLIT_DUTY,
    TRAINING_MISMATCH
}

package com.example.pharmacyrota.rota;

public enum ConflictSeverity {
    WARNING,
    ERROR
}

package com.example.pharmacyrota.rota;

public enum RotaStatus {
    DRAFT,
    PUBLISHED,
    ARCHIVED
}

package com.example.pharmacyrota.rota;

public record ConflictDto(
        ConflictType type,
        ConflictSeverity severity,
        String description,
        String location,
        Long staffId) {

    public static ConflictDto from(Conflict conflict) {
        return new ConflictDto(conflict.getType(), conflict.getSeverity(), conflict.getDescription(),
                conflict.getLocation(), conflict.getStaffId());
    }
}

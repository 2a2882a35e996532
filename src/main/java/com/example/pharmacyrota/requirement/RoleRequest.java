package com.example.pharmacyrota.requirement;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.time.LocalTime;

/**
 * Ad hoc role an operator adds to one weekday of a single rota (e.g. "Audit", "Teaching").
 */
public record RoleRequest(
        @NotBlank(message = "Role name is required") String name,
        @NotNull(message = "Role start time is required") LocalTime startTime,
        @NotNull(message = "Role end time is required") LocalTime endTime,
        @Min(value = 1, message = "Role staff count must be at least 1") Integer staffCount,
        String requiredTraining,
        Long preferredStaffId) {

    public int staffCountOrDefault() {
        return staffCount == null ? 1 : staffCount;
    }
}

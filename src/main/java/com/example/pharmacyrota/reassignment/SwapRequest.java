package com.example.pharmacyrota.reassignment;

import com.example.pharmacyrota.rota.AssignmentType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.Map;

/**
 * Exchange the source slot's occupant with the target slot's occupant on one date.
 * A null {@code targetStaffId} addresses an open target slot: the source moves there
 * and leaves an open slot behind.
 */
public record SwapRequest(
        Map<LocalDate, Long> rotaIdsByDate,
        @NotNull(message = "date is required") LocalDate date,
        @NotNull(message = "sourceStaffId is required") Long sourceStaffId,
        @NotBlank(message = "sourceLocation is required") String sourceLocation,
        @NotNull(message = "sourceStartTime is required") LocalTime sourceStartTime,
        LocalTime sourceEndTime,
        Long targetStaffId,
        @NotBlank(message = "targetLocation is required") String targetLocation,
        @NotNull(message = "targetStartTime is required") LocalTime targetStartTime,
        LocalTime targetEndTime,
        AssignmentType targetType) {

    public SwapRequest {
        rotaIdsByDate = rotaIdsByDate == null ? Map.of() : Map.copyOf(rotaIdsByDate);
    }
}

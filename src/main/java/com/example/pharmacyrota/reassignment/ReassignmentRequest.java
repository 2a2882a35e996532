package com.example.pharmacyrota.reassignment;

import com.example.pharmacyrota.rota.AssignmentType;
import jakarta.validation.constraints.NotNull;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.Map;

/**
 * Replace {@code originalStaffId} with {@code newStaffId}.
 * <ul>
 *     <li>slot: {@code location} and {@code startTime} are required, {@code endTime} is optional.
 *     A null {@code originalStaffId} fills the open slot there.</li>
 *     <li>day / week: {@code location} and the time window are optional filters.</li>
 * </ul>
 * {@code rotaIdsByDate} pins the documents to edit; without it the current document
 * for each date is used. {@code type} is only read when a slot has to be created.
 */
public record ReassignmentRequest(
        Map<LocalDate, Long> rotaIdsByDate,
        @NotNull(message = "date is required") LocalDate date,
        String location,
        LocalTime startTime,
        LocalTime endTime,
        Long originalStaffId,
        @NotNull(message = "newStaffId is required") Long newStaffId,
        @NotNull(message = "scope is required") ReassignmentScope scope,
        boolean respectSpecialContinuity,
        AssignmentType type) {

    public ReassignmentRequest {
        rotaIdsByDate = rotaIdsByDate == null ? Map.of() : Map.copyOf(rotaIdsByDate);
        location = location == null || location.isBlank() ? null : location;
    }
}

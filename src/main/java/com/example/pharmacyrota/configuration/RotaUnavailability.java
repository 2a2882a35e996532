package com.example.pharmacyrota.configuration;

import com.example.pharmacyrota.common.TimeWindow;
import com.example.pharmacyrota.staff.StaffSnapshot;
import jakarta.validation.constraints.NotNull;

import java.time.DayOfWeek;
import java.time.LocalTime;

/**
 * Unavailability that applies to one week's rota only, on top of the staff member's
 * recurring rules.
 */
public record RotaUnavailability(
        @NotNull(message = "dayOfWeek is required") DayOfWeek dayOfWeek,
        @NotNull(message = "startTime is required") LocalTime startTime,
        @NotNull(message = "endTime is required") LocalTime endTime) {

    public StaffSnapshot.Rule toRule() {
        return new StaffSnapshot.Rule(dayOfWeek, TimeWindow.of(startTime, endTime));
    }
}

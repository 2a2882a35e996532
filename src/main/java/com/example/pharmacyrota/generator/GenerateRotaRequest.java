package com.example.pharmacyrota.generator;

import com.example.pharmacyrota.configuration.RotaConfigurationRequest;
import com.example.pharmacyrota.configuration.RotaUnavailability;
import com.example.pharmacyrota.requirement.RoleRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Set;

public record GenerateRotaRequest(
        @NotNull(message = "weekStart is required") LocalDate weekStart,
        List<Long> staffIds,
        Set<DayOfWeek> selectedWeekdays,
        List<Long> selectedClinicIds,
        Map<Long, Set<DayOfWeek>> workingDaysOverride,
        Map<Long, Set<Integer>> ignoredUnavailability,
        Map<DayOfWeek, List<@Valid RoleRequest>> extraRoleRequestsByWeekday,
        Set<DayOfWeek> singlePharmacistDispensaryDays,
        Map<Long, List<@Valid RotaUnavailability>> rotaUnavailability,
        String generatedBy) {

    public RotaConfigurationRequest toConfiguration() {
        return new RotaConfigurationRequest(staffIds, selectedWeekdays, selectedClinicIds,
                workingDaysOverride, ignoredUnavailability, extraRoleRequestsByWeekday,
                singlePharmacistDispensaryDays, rotaUnavailability, generatedBy);
    }
}

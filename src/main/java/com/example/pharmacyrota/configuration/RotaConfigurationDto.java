package com.example.pharmacyrota.configuration;

import com.example.pharmacyrota.requirement.RoleRequest;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Set;

public record RotaConfigurationDto(
        LocalDate weekStart,
        List<Long> staffIds,
        Set<DayOfWeek> selectedWeekdays,
        List<Long> selectedClinicIds,
        Map<Long, Set<DayOfWeek>> workingDaysOverride,
        Map<Long, Set<Integer>> ignoredUnavailability,
        Map<DayOfWeek, List<RoleRequest>> extraRoleRequestsByWeekday,
        Set<DayOfWeek> singlePharmacistDispensaryDays,
        Map<Long, List<RotaUnavailability>> rotaUnavailability,
        LocalDateTime lastModified,
        String lastModifiedBy,
        boolean generated,
        LocalDateTime rotaGeneratedAt) {
}

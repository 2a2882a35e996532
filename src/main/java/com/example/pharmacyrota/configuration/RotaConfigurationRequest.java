package com.example.pharmacyrota.configuration;

import com.example.pharmacyrota.requirement.RoleRequest;
import jakarta.validation.Valid;

import java.time.DayOfWeek;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Generation parameters for a week. Also the body of a generate request, which adds
 * the week start and the operator.
 */
public record RotaConfigurationRequest(
        List<Long> staffIds,
        Set<DayOfWeek> selectedWeekdays,
        List<Long> selectedClinicIds,
        Map<Long, Set<DayOfWeek>> workingDaysOverride,
        Map<Long, Set<Integer>> ignoredUnavailability,
        Map<DayOfWeek, List<@Valid RoleRequest>> extraRoleRequestsByWeekday,
        Set<DayOfWeek> singlePharmacistDispensaryDays,
        Map<Long, List<@Valid RotaUnavailability>> rotaUnavailability,
        String modifiedBy) {

    public RotaConfigurationRequest {
        staffIds = staffIds == null ? List.of() : List.copyOf(staffIds);
        selectedWeekdays = selectedWeekdays == null ? Set.of() : Set.copyOf(selectedWeekdays);
        selectedClinicIds = selectedClinicIds == null ? List.of() : List.copyOf(selectedClinicIds);
        workingDaysOverride = workingDaysOverride == null ? Map.of() : Map.copyOf(workingDaysOverride);
        ignoredUnavailability = ignoredUnavailability == null ? Map.of() : Map.copyOf(ignoredUnavailability);
        extraRoleRequestsByWeekday = extraRoleRequestsByWeekday == null ? Map.of() : Map.copyOf(extraRoleRequestsByWeekday);
        singlePharmacistDispensaryDays = singlePharmacistDispensaryDays == null
                ? Set.of() : Set.copyOf(singlePharmacistDispensaryDays);
        rotaUnavailability = rotaUnavailability == null ? Map.of() : Map.copyOf(rotaUnavailability);
    }
}

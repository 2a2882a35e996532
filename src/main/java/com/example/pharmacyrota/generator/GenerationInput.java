package com.example.pharmacyrota.generator;

import com.example.pharmacyrota.requirement.RoleRequest;
import com.example.pharmacyrota.requirement.WorkItem;
import com.example.pharmacyrota.staff.StaffSnapshot;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Everything one generation run reads, copied up front so the generator never
 * touches the reference store.
 *
 * @param ignoredRules                   per staff id, the stored unavailability rule indices to ignore for this rota
 * @param singlePharmacistDispensaryDays weekdays on which one pharmacist runs the dispensary all day
 * @param rotaUnavailability             per staff id, extra unavailability that applies to this rota only
 */
public record GenerationInput(
        LocalDate weekStart,
        List<StaffSnapshot> staff,
        List<WorkItem> requirements,
        List<WorkItem> clinics,
        Set<DayOfWeek> selectedWeekdays,
        Map<DayOfWeek, List<RoleRequest>> roleRequests,
        Map<Long, Set<Integer>> ignoredRules,
        Set<DayOfWeek> singlePharmacistDispensaryDays,
        Map<Long, List<StaffSnapshot.Rule>> rotaUnavailability,
        String generatedBy,
        LocalDateTime generatedAt) {

    public GenerationInput {
        staff = staff == null ? List.of() : List.copyOf(staff);
        requirements = requirements == null ? List.of() : List.copyOf(requirements);
        clinics = clinics == null ? List.of() : List.copyOf(clinics);
        selectedWeekdays = selectedWeekdays == null ? Set.of() : Set.copyOf(selectedWeekdays);
        roleRequests = roleRequests == null ? Map.of() : Map.copyOf(roleRequests);
        ignoredRules = ignoredRules == null ? Map.of() : Map.copyOf(ignoredRules);
        singlePharmacistDispensaryDays = singlePharmacistDispensaryDays == null
                ? Set.of() : Set.copyOf(singlePharmacistDispensaryDays);
        rotaUnavailability = rotaUnavailability == null ? Map.of() : Map.copyOf(rotaUnavailability);
    }

    public GenerationInput(LocalDate weekStart, List<StaffSnapshot> staff, List<WorkItem> requirements,
                           List<WorkItem> clinics, Set<DayOfWeek> selectedWeekdays,
                           Map<DayOfWeek, List<RoleRequest>> roleRequests, Map<Long, Set<Integer>> ignoredRules,
                           String generatedBy, LocalDateTime generatedAt) {
        this(weekStart, staff, requirements, clinics, selectedWeekdays, roleRequests, ignoredRules,
                Set.of(), Map.of(), generatedBy, generatedAt);
    }

    public Set<Integer> ignoredRulesFor(Long staffId) {
        return ignoredRules.getOrDefault(staffId, Set.of());
    }

    public List<StaffSnapshot.Rule> rotaUnavailabilityFor(Long staffId) {
        return rotaUnavailability.getOrDefault(staffId, List.of());
    }

    public boolean isSinglePharmacistDispensaryDay(DayOfWeek day) {
        return singlePharmacistDispensaryDays.contains(day);
    }
}

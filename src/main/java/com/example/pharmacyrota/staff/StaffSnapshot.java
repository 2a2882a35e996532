package com.example.pharmacyrota.staff;

import com.example.pharmacyrota.common.TimeWindow;

import java.time.DayOfWeek;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Immutable copy of a {@link StaffMember} taken once per engine call, with any
 * per-rota working-day override already applied.
 */
public record StaffSnapshot(
        Long id,
        String name,
        StaffType staffType,
        String band,
        Set<String> trainedLocations,
        Set<String> specialistTraining,
        boolean warfarinTrained,
        Set<DayOfWeek> workingDays,
        List<Rule> unavailabilityRules,
        boolean defaultRoster,
        Set<String> primaryWards,
        String primaryDirectorate,
        boolean dispensaryPharmacist) {

    public StaffSnapshot {
        trainedLocations = trainedLocations == null ? Set.of() : Set.copyOf(trainedLocations);
        specialistTraining = specialistTraining == null ? Set.of() : Set.copyOf(specialistTraining);
        workingDays = workingDays == null ? Set.of() : Set.copyOf(workingDays);
        unavailabilityRules = unavailabilityRules == null ? List.of() : List.copyOf(unavailabilityRules);
        primaryWards = primaryWards == null ? Set.of() : Set.copyOf(primaryWards);
    }

    public static StaffSnapshot of(StaffMember staff) {
        return of(staff, null);
    }

    public static StaffSnapshot of(StaffMember staff, Set<DayOfWeek> workingDaysOverride) {
        List<Rule> rules = staff.getUnavailabilityRules().stream()
                .map(r -> new Rule(r.getDayOfWeek(), TimeWindow.of(r.getStartTime(), r.getEndTime())))
                .toList();
        return new StaffSnapshot(
                staff.getId(),
                staff.getName(),
                staff.getStaffType(),
                staff.getBand(),
                staff.getTrainedLocations(),
                staff.getSpecialistTraining(),
                Boolean.TRUE.equals(staff.getWarfarinTrained()),
                workingDaysOverride != null ? workingDaysOverride : staff.getWorkingDays(),
                rules,
                Boolean.TRUE.equals(staff.getDefaultRoster()),
                staff.getPrimaryWards(),
                staff.getPrimaryDirectorate(),
                Boolean.TRUE.equals(staff.getDispensaryPharmacist()));
    }

    /**
     * The same snapshot with rota-only unavailability appended after the stored rules,
     * so stored rule indices keep their meaning.
     */
    public StaffSnapshot withExtraRules(List<Rule> extraRules) {
        if (extraRules == null || extraRules.isEmpty()) {
            return this;
        }
        List<Rule> combined = new ArrayList<>(unavailabilityRules);
        combined.addAll(extraRules);
        return new StaffSnapshot(id, name, staffType, band, trainedLocations, specialistTraining, warfarinTrained,
                workingDays, combined, defaultRoster, primaryWards, primaryDirectorate, dispensaryPharmacist);
    }

    public boolean hasPrimaryWard(String ward) {
        return primaryWards.contains(ward);
    }

    public boolean isTrainedFor(String location) {
        return trainedLocations.isEmpty() || trainedLocations.contains(location);
    }

    public record Rule(DayOfWeek dayOfWeek, TimeWindow window) {
        public boolean blocks(DayOfWeek day, TimeWindow other) {
            return dayOfWeek == day && window.overlaps(other);
        }
    }
}

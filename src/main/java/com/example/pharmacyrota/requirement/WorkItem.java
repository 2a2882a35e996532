package com.example.pharmacyrota.requirement;

import com.example.pharmacyrota.common.TimeWindow;
import com.example.pharmacyrota.rota.AssignmentType;

import java.time.DayOfWeek;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

/**
 * Immutable unit of work the generator tries to staff on one date: a duty
 * requirement, a selected clinic or an ad hoc role request.
 *
 * @param directorate   clinical directorate of a ward, matched against a pharmacist's primary directorate
 * @param blockedWindow the time the item takes out of a staff member's day, travel included;
 *                      the same as {@code window} unless the item needs travel
 */
public record WorkItem(
        String key,
        String name,
        AssignmentType type,
        String category,
        TimeWindow window,
        int minStaff,
        int idealStaff,
        int difficulty,
        String requiredTraining,
        boolean requiresWarfarinTraining,
        boolean doNotSplit,
        boolean splitShareable,
        boolean continuitySensitive,
        List<Long> preferredStaffIds,
        Set<DayOfWeek> daysOfWeek,
        String directorate,
        TimeWindow blockedWindow) {

    /** Difficulty first, then category priority; name and start keep the order stable. */
    public static final Comparator<WorkItem> PRIORITY_ORDER = Comparator
            .comparingInt(WorkItem::difficulty).reversed()
            .thenComparingInt(w -> w.type().priority())
            .thenComparing(WorkItem::name)
            .thenComparing(w -> w.window().start())
            .thenComparing(WorkItem::key);

    public WorkItem {
        preferredStaffIds = preferredStaffIds == null ? List.of() : List.copyOf(preferredStaffIds);
        daysOfWeek = daysOfWeek == null ? Set.of() : Set.copyOf(daysOfWeek);
        blockedWindow = blockedWindow == null ? window : blockedWindow;
        if (idealStaff < minStaff) {
            idealStaff = minStaff;
        }
    }

    public static WorkItem of(DutyRequirement requirement, TimeWindow defaultWindow) {
        TimeWindow window = requirement.getStartTime() != null && requirement.getEndTime() != null
                ? TimeWindow.of(requirement.getStartTime(), requirement.getEndTime())
                : defaultWindow;
        String category = requirement.getCategory() != null ? requirement.getCategory() : requirement.getType().name();
        return new WorkItem(
                "REQ-" + requirement.getId(),
                requirement.getName(),
                requirement.getType(),
                category,
                window,
                valueOrZero(requirement.getMinStaff()),
                valueOrZero(requirement.getIdealStaff()),
                requirement.getDifficulty() == null ? 5 : requirement.getDifficulty(),
                blankToNull(requirement.getRequiredTraining()),
                false,
                Boolean.TRUE.equals(requirement.getDoNotSplit()),
                Boolean.TRUE.equals(requirement.getSplitShareable()),
                Boolean.TRUE.equals(requirement.getContinuitySensitive()),
                List.of(),
                requirement.getDaysOfWeek(),
                blankToNull(requirement.getDirectorate()),
                null);
    }

    public static WorkItem of(ClinicSlot clinic) {
        TimeWindow window = TimeWindow.of(clinic.getStartTime(), clinic.getEndTime());
        return new WorkItem(
                "CLINIC-" + clinic.getId(),
                clinic.getName(),
                AssignmentType.CLINIC,
                "Clinic",
                window,
                1,
                1,
                clinic.getDifficulty() == null ? 5 : clinic.getDifficulty(),
                null,
                Boolean.TRUE.equals(clinic.getRequiresWarfarinTraining()),
                false,
                false,
                false,
                clinic.getPreferredStaffIds(),
                Set.of(clinic.getDayOfWeek()),
                null,
                window.widen(minutes(clinic.getTravelTimeBefore()), minutes(clinic.getTravelTimeAfter())));
    }

    public static WorkItem of(RoleRequest role, DayOfWeek day, int index) {
        int count = role.staffCountOrDefault();
        return new WorkItem(
                "ROLE-" + day + "-" + index,
                role.name(),
                AssignmentType.ROLE,
                "Role",
                TimeWindow.of(role.startTime(), role.endTime()),
                count,
                count,
                5,
                blankToNull(role.requiredTraining()),
                false,
                false,
                false,
                false,
                role.preferredStaffId() == null ? List.of() : List.of(role.preferredStaffId()),
                Set.of(day),
                null,
                null);
    }

    public boolean runsOn(DayOfWeek day) {
        return daysOfWeek.isEmpty() || daysOfWeek.contains(day);
    }

    /** The same item with its staffing targets replaced. */
    public WorkItem withStaffing(int min, int ideal) {
        return new WorkItem(key, name, type, category, window, min, ideal, difficulty, requiredTraining,
                requiresWarfarinTraining, doNotSplit, splitShareable, continuitySensitive, preferredStaffIds,
                daysOfWeek, directorate, blockedWindow);
    }

    private static Duration minutes(Integer value) {
        return Duration.ofMinutes(value == null ? 0 : Math.max(0, value));
    }

    private static int valueOrZero(Integer v) {
        return v == null ? 0 : Math.max(0, v);
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s.trim();
    }
}

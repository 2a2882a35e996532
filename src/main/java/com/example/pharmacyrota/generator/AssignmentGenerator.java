package com.example.pharmacyrota.generator;

import com.example.pharmacyrota.common.TimeWindow;
import com.example.pharmacyrota.constraint.Commitment;
import com.example.pharmacyrota.constraint.ConstraintEvaluator;
import com.example.pharmacyrota.constraint.Eligibility;
import com.example.pharmacyrota.exception.RotaPreconditionException;
import com.example.pharmacyrota.requirement.RoleRequest;
import com.example.pharmacyrota.requirement.WorkItem;
import com.example.pharmacyrota.rota.Assignment;
import com.example.pharmacyrota.rota.AssignmentType;
import com.example.pharmacyrota.rota.CoverageTarget;
import com.example.pharmacyrota.rota.RotaDocument;
import com.example.pharmacyrota.staff.StaffSnapshot;
import com.example.pharmacyrota.staff.StaffType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Builds the seven draft documents of a week.
 * <p>
 * Work items are staffed in priority order, first up to their minimum and then, in a
 * second pass, up to their ideal count. Two steps run ahead of those passes:
 * <ul>
 *     <li>on a dispensary day with a dedicated dispensary pharmacist, or on a day marked
 *     single-pharmacist, one pharmacist is given the whole dispensary and somebody else
 *     covers their lunch;</li>
 *     <li>pharmacists with primary wards are placed on them while they are still free.</li>
 * </ul>
 * Anything that cannot be staffed is left as a visible gap for the conflict detector;
 * the generator never invents coverage. Output depends only on the input, so
 * identical input gives identical rows.
 */
@Component
public class AssignmentGenerator {

    private static final Logger logger = LoggerFactory.getLogger(AssignmentGenerator.class);

    static final String LUNCH_COVER_LOCATION = "Dispensary (Lunch Cover)";
    static final TimeWindow LUNCH_COVER_WINDOW = TimeWindow.of(LocalTime.of(13, 30), LocalTime.of(14, 0));

    // most junior first
    private static final List<String> SINGLE_PHARMACIST_BANDS = List.of("6", "7", "8a");

    private final ConstraintEvaluator constraintEvaluator;

    public AssignmentGenerator(ConstraintEvaluator constraintEvaluator) {
        this.constraintEvaluator = constraintEvaluator;
    }

    public List<RotaDocument> generate(GenerationInput input) {
        validate(input);

        List<StaffSnapshot> roster = new ArrayList<>(input.staff().size());
        Map<Long, Set<Integer>> ignoredRules = new HashMap<>();
        for (StaffSnapshot member : input.staff()) {
            int storedRules = member.unavailabilityRules().size();
            ignoredRules.put(member.id(), input.ignoredRulesFor(member.id()).stream()
                    .filter(i -> i < storedRules)
                    .collect(Collectors.toSet()));
            roster.add(member.withExtraRules(input.rotaUnavailabilityFor(member.id())));
        }
        roster.sort(Comparator.comparing(StaffSnapshot::name).thenComparing(StaffSnapshot::id));
        WeekState week = new WeekState(roster, ignoredRules);

        List<RotaDocument> documents = new ArrayList<>(7);
        for (int offset = 0; offset < 7; offset++) {
            LocalDate date = input.weekStart().plusDays(offset);
            RotaDocument document = new RotaDocument(date, input.weekStart());
            document.getIncludedWeekdays().addAll(input.selectedWeekdays());
            roster.forEach(s -> document.getStaffIds().add(s.id()));
            document.setGeneratedBy(input.generatedBy());
            document.setGeneratedAt(input.generatedAt());

            DayOfWeek day = date.getDayOfWeek();
            if (input.selectedWeekdays().contains(day)) {
                fillDate(document, workListFor(input, day), week, input.isSinglePharmacistDispensaryDay(day));
            }
            documents.add(document);
        }
        return documents;
    }

    List<WorkItem> workListFor(GenerationInput input, DayOfWeek day) {
        boolean singlePharmacist = input.isSinglePharmacistDispensaryDay(day);
        List<WorkItem> items = new ArrayList<>();
        for (WorkItem requirement : input.requirements()) {
            if (!requirement.runsOn(day)) {
                continue;
            }
            if (singlePharmacist && requirement.type() == AssignmentType.DISPENSARY) {
                items.add(requirement.withStaffing(Math.min(requirement.minStaff(), 1), 1));
            } else {
                items.add(requirement);
            }
        }
        for (WorkItem clinic : input.clinics()) {
            if (clinic.runsOn(day)) {
                items.add(clinic);
            }
        }
        List<RoleRequest> roles = input.roleRequests().getOrDefault(day, List.of());
        for (int i = 0; i < roles.size(); i++) {
            items.add(WorkItem.of(roles.get(i), day, i));
        }
        items.sort(WorkItem.PRIORITY_ORDER);
        return items;
    }

    private void fillDate(RotaDocument document, List<WorkItem> workList, WeekState week, boolean singlePharmacist) {
        LocalDate date = document.getDate();
        DayState state = new DayState();
        List<WorkItem> emitted = new ArrayList<>(workList);

        List<WorkItem> dispensary = workList.stream()
                .filter(i -> i.type() == AssignmentType.DISPENSARY)
                .sorted(Comparator.comparing(WorkItem::window))
                .toList();
        boolean dedicatedPharmacist = week.roster().stream().anyMatch(StaffSnapshot::dispensaryPharmacist);
        if (!dispensary.isEmpty() && (singlePharmacist || dedicatedPharmacist)) {
            // clinics are fixed sessions; book them before taking a pharmacist out for the day
            for (WorkItem item : workList) {
                if (item.type() == AssignmentType.CLINIC) {
                    fillUpTo(item, item.minStaff(), date, week, state, s -> true);
                }
            }
            StaffSnapshot lead = chooseDispensaryLead(dispensary, date, week, state, singlePharmacist);
            if (lead != null) {
                for (WorkItem item : dispensary) {
                    if (!clashes(state.commitments(lead.id()), item)) {
                        state.place(item, lead.id(), false);
                    }
                }
                state.reserve(lead.id());
                WorkItem lunchCover = lunchCoverItem(date.getDayOfWeek());
                coverLunch(lunchCover, date, week, state);
                emitted.add(lunchCover);
            } else if (singlePharmacist) {
                logger.warn("No pharmacist available to run the dispensary alone on {}", date);
            }
        }

        for (WorkItem item : workList) {
            if (item.type() == AssignmentType.WARD) {
                fillUpTo(item, item.minStaff(), date, week, state, s -> s.hasPrimaryWard(item.name()));
            }
        }
        for (WorkItem item : workList) {
            fillUpTo(item, item.minStaff(), date, week, state, s -> true);
        }
        for (WorkItem item : workList) {
            fillUpTo(item, item.idealStaff(), date, week, state, s -> true);
        }

        int gaps = 0;
        for (WorkItem item : emitted) {
            List<Long> staffIds = state.placed(item);
            if (staffIds.isEmpty()) {
                document.getAssignments().add(toAssignment(item, null, date));
                gaps++;
            }
            for (Long staffId : staffIds) {
                document.getAssignments().add(toAssignment(item, staffId, date));
            }
            document.getCoverageTargets().add(new CoverageTarget(
                    item.key(), item.name(), item.type(), item.window(), item.minStaff(), item.idealStaff()));
        }
        logger.debug("Generated {}: {} work items, {} rows, {} unfilled",
                date, emitted.size(), document.getAssignments().size(), gaps);
    }

    /**
     * A dedicated dispensary pharmacist when one is free for every dispensary shift;
     * on a single-pharmacist day, otherwise the most junior free pharmacist.
     */
    private StaffSnapshot chooseDispensaryLead(List<WorkItem> dispensary, LocalDate date, WeekState week,
                                               DayState state, boolean singlePharmacist) {
        List<StaffSnapshot> candidates = new ArrayList<>();
        week.roster().stream().filter(StaffSnapshot::dispensaryPharmacist).forEach(candidates::add);
        if (singlePharmacist) {
            week.roster().stream()
                    .filter(s -> s.staffType() == StaffType.PHARMACIST && !s.dispensaryPharmacist())
                    .filter(s -> SINGLE_PHARMACIST_BANDS.contains(s.band()))
                    .sorted(Comparator.comparingInt(s -> SINGLE_PHARMACIST_BANDS.indexOf(s.band())))
                    .forEach(candidates::add);
        }
        for (StaffSnapshot candidate : candidates) {
            boolean free = dispensary.stream().allMatch(item -> isAvailable(candidate, item, date, week, state));
            if (free) {
                return candidate;
            }
            logger.trace("{} cannot run the dispensary on {}", candidate.name(), date);
        }
        return null;
    }

    private void coverLunch(WorkItem lunchCover, LocalDate date, WeekState week, DayState state) {
        List<StaffSnapshot> candidates = new ArrayList<>(week.roster());
        candidates.sort(Comparator
                .comparingInt((StaffSnapshot s) -> week.lunchCovers(s.id()))
                .thenComparing(StaffSnapshot::name)
                .thenComparing(StaffSnapshot::id));
        for (StaffSnapshot candidate : candidates) {
            if (candidate.staffType() != StaffType.PHARMACIST || candidate.dispensaryPharmacist()
                    || state.isReserved(candidate.id())) {
                continue;
            }
            if (isAvailable(candidate, lunchCover, date, week, state)) {
                state.place(lunchCover, candidate.id(), true);
                week.countLunchCover(candidate.id());
                return;
            }
        }
        logger.warn("No pharmacist available for dispensary lunch cover on {}", date);
    }

    private static WorkItem lunchCoverItem(DayOfWeek day) {
        return new WorkItem("LUNCH-" + day, LUNCH_COVER_LOCATION, AssignmentType.DISPENSARY, "Dispensary",
                LUNCH_COVER_WINDOW, 1, 1, 0, null, false, false, true, false, List.of(), Set.of(day),
                null, null);
    }

    private void fillUpTo(WorkItem item, int target, LocalDate date, WeekState week, DayState state,
                          Predicate<StaffSnapshot> filter) {
        while (state.placed(item).size() < target) {
            StaffSnapshot next = nextCandidate(item, date, week, state, filter);
            if (next == null) {
                return;
            }
            state.place(item, next.id(), false);
        }
    }

    private StaffSnapshot nextCandidate(WorkItem item, LocalDate date, WeekState week, DayState state,
                                        Predicate<StaffSnapshot> filter) {
        for (StaffSnapshot candidate : candidateOrder(item, week.roster(), state)) {
            if (state.placed(item).contains(candidate.id()) || state.isReserved(candidate.id())
                    || !filter.test(candidate)) {
                continue;
            }
            if (isAvailable(candidate, item, date, week, state)) {
                return candidate;
            }
        }
        return null;
    }

    private boolean isAvailable(StaffSnapshot candidate, WorkItem item, LocalDate date, WeekState week,
                                DayState state) {
        List<Commitment> commitments = state.commitments(candidate.id());
        if (clashes(commitments, item)) {
            return false;
        }
        Eligibility eligibility = constraintEvaluator.isEligible(candidate, item, date, commitments,
                week.ignoredRulesFor(candidate.id()));
        if (!eligibility.eligible()) {
            logger.trace("{} skipped for {} on {}: {}", candidate.name(), item.name(), date, eligibility.detail());
        }
        return eligibility.eligible();
    }

    // a full-day ward runs across a short cover stint; nothing else does
    private static boolean clashes(List<Commitment> commitments, WorkItem item) {
        for (Commitment c : commitments) {
            if (c.coverStint() && item.type() == AssignmentType.WARD) {
                continue;
            }
            if (c.window().overlaps(item.blockedWindow())) {
                return true;
            }
        }
        return false;
    }

    private List<StaffSnapshot> candidateOrder(WorkItem item, List<StaffSnapshot> roster, DayState state) {
        Map<Long, StaffSnapshot> byId = new HashMap<>();
        roster.forEach(s -> byId.put(s.id(), s));

        Set<StaffSnapshot> ordered = new LinkedHashSet<>();
        for (Long preferred : item.preferredStaffIds()) {
            StaffSnapshot s = byId.get(preferred);
            if (s != null) {
                ordered.add(s);
            }
        }
        List<StaffSnapshot> rest = new ArrayList<>(roster);
        rest.sort(Comparator
                .comparingInt((StaffSnapshot s) -> locationAffinity(s, item))
                .thenComparing(s -> !s.defaultRoster())
                .thenComparingInt(s -> state.commitments(s.id()).size())
                .thenComparing(StaffSnapshot::name)
                .thenComparing(StaffSnapshot::id));
        ordered.addAll(rest);
        return new ArrayList<>(ordered);
    }

    /**
     * Lower is a better fit. Wards rank primary ward, then primary directorate, then
     * training; roles rank on training only; other items do not care.
     */
    static int locationAffinity(StaffSnapshot staff, WorkItem item) {
        if (item.type() != AssignmentType.WARD && item.type() != AssignmentType.ROLE) {
            return 0;
        }
        if (item.type() == AssignmentType.WARD) {
            if (staff.hasPrimaryWard(item.name())) {
                return 0;
            }
            if (item.directorate() != null && item.directorate().equals(staff.primaryDirectorate())) {
                return 1;
            }
        }
        return staff.isTrainedFor(item.name()) ? 2 : 3;
    }

    private Assignment toAssignment(WorkItem item, Long staffId, LocalDate date) {
        Assignment assignment = new Assignment(staffId, item.type(), item.name(), date,
                item.window().start(), item.window().end(), item.category());
        assignment.setSplitShareable(item.splitShareable());
        assignment.setContinuitySensitive(item.continuitySensitive());
        assignment.setDoNotSplit(item.doNotSplit());
        assignment.setItemKey(item.key());
        return assignment;
    }

    private void validate(GenerationInput input) {
        if (input.weekStart() == null) {
            throw new RotaPreconditionException("Week start is required");
        }
        if (input.weekStart().getDayOfWeek() != DayOfWeek.MONDAY) {
            throw new RotaPreconditionException("Week start must be a Monday: " + input.weekStart());
        }
        if (input.staff().isEmpty()) {
            throw new RotaPreconditionException("At least one staff member must be selected");
        }
        if (input.selectedWeekdays().isEmpty()) {
            throw new RotaPreconditionException("At least one weekday must be selected");
        }
    }

    /** Roster and counters that carry across the dates of one run. */
    private record WeekState(List<StaffSnapshot> roster, Map<Long, Set<Integer>> ignoredRules,
                             Map<Long, Integer> lunchCoverCounts) {

        WeekState(List<StaffSnapshot> roster, Map<Long, Set<Integer>> ignoredRules) {
            this(roster, ignoredRules, new HashMap<>());
        }

        Set<Integer> ignoredRulesFor(Long staffId) {
            return ignoredRules.getOrDefault(staffId, Set.of());
        }

        int lunchCovers(Long staffId) {
            return lunchCoverCounts.getOrDefault(staffId, 0);
        }

        void countLunchCover(Long staffId) {
            lunchCoverCounts.merge(staffId, 1, Integer::sum);
        }
    }

    /** Who has been placed where on the date being filled. */
    private static final class DayState {
        private final Map<String, List<Long>> placedByItem = new LinkedHashMap<>();
        private final Map<Long, List<Commitment>> commitmentsByStaff = new HashMap<>();
        private final Set<Long> reserved = new HashSet<>();

        List<Long> placed(WorkItem item) {
            return placedByItem.getOrDefault(item.key(), List.of());
        }

        List<Commitment> commitments(Long staffId) {
            return commitmentsByStaff.getOrDefault(staffId, List.of());
        }

        void place(WorkItem item, Long staffId, boolean coverStint) {
            placedByItem.computeIfAbsent(item.key(), k -> new ArrayList<>()).add(staffId);
            commitmentsByStaff.computeIfAbsent(staffId, k -> new ArrayList<>())
                    .add(new Commitment(item.name(), item.blockedWindow(), item.doNotSplit(), coverStint));
        }

        // taken out of the general passes for the rest of the day
        void reserve(Long staffId) {
            reserved.add(staffId);
        }

        boolean isReserved(Long staffId) {
            return reserved.contains(staffId);
        }
    }
}

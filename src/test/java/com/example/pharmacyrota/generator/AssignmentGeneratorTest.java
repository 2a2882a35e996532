package com.example.pharmacyrota.generator;

import com.example.pharmacyrota.conflict.ConflictDetector;
import com.example.pharmacyrota.constraint.ConstraintEvaluator;
import com.example.pharmacyrota.exception.RotaPreconditionException;
import com.example.pharmacyrota.requirement.ClinicSlot;
import com.example.pharmacyrota.requirement.RoleRequest;
import com.example.pharmacyrota.requirement.WorkItem;
import com.example.pharmacyrota.rota.Assignment;
import com.example.pharmacyrota.rota.AssignmentType;
import com.example.pharmacyrota.rota.Conflict;
import com.example.pharmacyrota.rota.ConflictSeverity;
import com.example.pharmacyrota.rota.ConflictType;
import com.example.pharmacyrota.rota.RotaDocument;
import com.example.pharmacyrota.rota.RotaStatus;
import com.example.pharmacyrota.staff.StaffSnapshot;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

import static com.example.pharmacyrota.RotaTestData.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AssignmentGeneratorTest {

    private final AssignmentGenerator generator = new AssignmentGenerator(new ConstraintEvaluator());
    private final ConflictDetector detector = new ConflictDetector();

    @Test
    void producesSevenDraftsFromMonday_andLeavesUnselectedDaysEmpty() {
        List<RotaDocument> documents = generator.generate(input(
                List.of(staff(1L, "Alice")), List.of(ward("Ward 7", 1, 1, 5)), List.of(), Set.of(DayOfWeek.MONDAY)));

        assertThat(documents).hasSize(7);
        for (int i = 0; i < 7; i++) {
            assertThat(documents.get(i).getDate()).isEqualTo(MONDAY.plusDays(i));
            assertThat(documents.get(i).getWeekStart()).isEqualTo(MONDAY);
            assertThat(documents.get(i).getStatus()).isEqualTo(RotaStatus.DRAFT);
        }
        assertThat(documents.get(0).getAssignments()).hasSize(1);
        assertThat(documents.get(1).getAssignments()).isEmpty();
        assertThat(documents.get(1).getCoverageTargets()).isEmpty();
        assertThat(documents.get(0).getGeneratedBy()).isEqualTo("tester");
    }

    @Test
    void singleEligibleStaff_onMinOneIdealTwo_givesOneRowAndOneWarning() {
        List<RotaDocument> documents = generator.generate(input(
                List.of(staff(1L, "Alice")), List.of(ward("EAU", 1, 2, 9)), List.of(), Set.of(DayOfWeek.MONDAY)));
        RotaDocument monday = documents.get(0);

        assertThat(monday.getAssignments()).hasSize(1);
        assertThat(monday.getAssignments().get(0).getStaffId()).isEqualTo(1L);

        List<Conflict> conflicts = detector.detect(monday, Map.of(1L, staff(1L, "Alice")));
        assertThat(conflicts).hasSize(1);
        assertThat(conflicts.get(0).getType()).isEqualTo(ConflictType.BELOW_IDEAL);
        assertThat(conflicts.get(0).getSeverity()).isEqualTo(ConflictSeverity.WARNING);
    }

    @Test
    void unfillableItem_leavesPlaceholderGap_andDetectorReportsError() {
        StaffSnapshot tuesdaysOnly = staff(1L, "Alice", Set.of(DayOfWeek.TUESDAY));

        RotaDocument monday = generator.generate(input(
                List.of(tuesdaysOnly), List.of(ward("Ward 7", 1, 1, 5)), List.of(), Set.of(DayOfWeek.MONDAY))).get(0);

        assertThat(monday.getAssignments()).singleElement().satisfies(a -> {
            assertThat(a.isGap()).isTrue();
            assertThat(a.getLocation()).isEqualTo("Ward 7");
        });
        assertThat(detector.detect(monday, Map.of()))
                .extracting(Conflict::getType, Conflict::getSeverity)
                .containsExactly(org.assertj.core.groups.Tuple.tuple(ConflictType.UNDERSTAFFED, ConflictSeverity.ERROR));
    }

    @Test
    void higherDifficulty_getsScarceStaffFirst() {
        RotaDocument monday = generator.generate(input(
                List.of(staff(1L, "Alice")),
                List.of(ward("Ward 12", 1, 1, 5), ward("EAU", 1, 1, 9)),
                List.of(), Set.of(DayOfWeek.MONDAY))).get(0);

        Map<String, Assignment> byLocation = byLocation(monday);
        assertThat(byLocation.get("EAU").getStaffId()).isEqualTo(1L);
        assertThat(byLocation.get("Ward 12").isGap()).isTrue();
        assertThat(monday.getAssignments().get(0).getLocation()).isEqualTo("EAU");
    }

    @Test
    void wardBeatsDispensary_atEqualDifficulty() {
        WorkItem dispensary = item("REQ-D", "Dispensary", AssignmentType.DISPENSARY, window(9, 17), 1, 1, 5, null, false, false);

        RotaDocument monday = generator.generate(input(
                List.of(staff(1L, "Alice")), List.of(dispensary, ward("Ward 7", 1, 1, 5)),
                List.of(), Set.of(DayOfWeek.MONDAY))).get(0);

        assertThat(byLocation(monday).get("Ward 7").getStaffId()).isEqualTo(1L);
        assertThat(byLocation(monday).get("Dispensary").isGap()).isTrue();
    }

    @Test
    void minimumsAreFilledEverywhereBeforeTopUps() {
        RotaDocument monday = generator.generate(input(
                List.of(staff(1L, "Alice"), staff(2L, "Ben")),
                List.of(ward("EAU", 1, 2, 9), ward("Ward 12", 1, 1, 5)),
                List.of(), Set.of(DayOfWeek.MONDAY))).get(0);

        Map<String, Assignment> byLocation = byLocation(monday);
        assertThat(byLocation.get("EAU").getStaffId()).isEqualTo(1L);
        assertThat(byLocation.get("Ward 12").getStaffId()).isEqualTo(2L);
        assertThat(monday.getAssignments()).hasSize(2);
    }

    @Test
    void defaultRosterStaff_arePreferred() {
        RotaDocument monday = generator.generate(input(
                List.of(staff(1L, "Alice"), rosterStaff(2L, "Zed")),
                List.of(ward("Ward 7", 1, 1, 5)), List.of(), Set.of(DayOfWeek.MONDAY))).get(0);

        assertThat(monday.getAssignments().get(0).getStaffId()).isEqualTo(2L);
    }

    @Test
    void staffWithFewerAssignmentsThatDay_comeFirst() {
        WorkItem dispensaryAm = item("REQ-AM", "Dispensary", AssignmentType.DISPENSARY, window(9, 13), 1, 1, 6, null, false, true);
        WorkItem clinicPm = item("REQ-PM", "Respiratory", AssignmentType.CLINIC, window(13, 17), 1, 1, 5, null, false, false);

        RotaDocument monday = generator.generate(input(
                List.of(staff(1L, "Alice"), staff(2L, "Ben")), List.of(dispensaryAm, clinicPm),
                List.of(), Set.of(DayOfWeek.MONDAY))).get(0);

        assertThat(byLocation(monday).get("Dispensary").getStaffId()).isEqualTo(1L);
        assertThat(byLocation(monday).get("Respiratory").getStaffId()).isEqualTo(2L);
    }

    @Test
    void halfDayItems_onlyBlockTheirOwnHalf() {
        WorkItem am = item("REQ-AM", "Dispensary AM", AssignmentType.DISPENSARY, window(9, 13), 1, 1, 4, null, false, true);
        WorkItem pm = item("REQ-PM", "Dispensary PM", AssignmentType.DISPENSARY, window(13, 17), 1, 1, 4, null, false, true);

        RotaDocument monday = generator.generate(input(
                List.of(staff(1L, "Alice")), List.of(am, pm), List.of(), Set.of(DayOfWeek.MONDAY))).get(0);

        assertThat(monday.getAssignments()).extracting(Assignment::getStaffId).containsExactly(1L, 1L);
    }

    @Test
    void fullDayItem_blocksTheWholeDay() {
        WorkItem clinicAm = clinic("CLINIC-1", "Respiratory", window(9, 12), false, List.of(), DayOfWeek.MONDAY);

        RotaDocument monday = generator.generate(input(
                List.of(staff(1L, "Alice")), List.of(ward("EAU", 1, 1, 9)), List.of(clinicAm),
                Set.of(DayOfWeek.MONDAY))).get(0);

        assertThat(byLocation(monday).get("EAU").getStaffId()).isEqualTo(1L);
        assertThat(byLocation(monday).get("Respiratory").isGap()).isTrue();
    }

    @Test
    void clinicPreferredStaff_areTriedFirst() {
        WorkItem clinic = clinic("CLINIC-1", "Respiratory", window(9, 12), false, List.of(2L), DayOfWeek.MONDAY);

        RotaDocument monday = generator.generate(input(
                List.of(rosterStaff(1L, "Alice"), staff(2L, "Ben")), List.of(), List.of(clinic),
                Set.of(DayOfWeek.MONDAY))).get(0);

        assertThat(monday.getAssignments().get(0).getStaffId()).isEqualTo(2L);
    }

    @Test
    void clinicsOnlyRunOnTheirWeekday() {
        WorkItem tuesdayClinic = clinic("CLINIC-1", "Warfarin", window(9, 12), false, List.of(), DayOfWeek.TUESDAY);

        List<RotaDocument> documents = generator.generate(input(
                List.of(staff(1L, "Alice")), List.of(), List.of(tuesdayClinic),
                Set.of(DayOfWeek.MONDAY, DayOfWeek.TUESDAY)));

        assertThat(documents.get(0).getAssignments()).isEmpty();
        assertThat(documents.get(1).getAssignments()).extracting(Assignment::getLocation).containsExactly("Warfarin");
    }

    @Test
    void roleRequests_areStaffedOnTheirWeekday() {
        RoleRequest audit = new RoleRequest("Audit", LocalTime.of(14, 0), LocalTime.of(16, 0), 1, null, null);
        GenerationInput input = new GenerationInput(MONDAY, List.of(staff(1L, "Alice")), List.of(), List.of(),
                Set.of(DayOfWeek.MONDAY, DayOfWeek.TUESDAY), Map.of(DayOfWeek.TUESDAY, List.of(audit)), Map.of(),
                "tester", LocalDateTime.of(2024, 5, 1, 10, 0));

        List<RotaDocument> documents = generator.generate(input);

        assertThat(documents.get(0).getAssignments()).isEmpty();
        assertThat(documents.get(1).getAssignments()).singleElement().satisfies(a -> {
            assertThat(a.getType()).isEqualTo(AssignmentType.ROLE);
            assertThat(a.getLocation()).isEqualTo("Audit");
            assertThat(a.getStaffId()).isEqualTo(1L);
        });
    }

    @Test
    void ignoredUnavailabilityRule_makesStaffEligible() {
        StaffSnapshot finn = unavailableStaff(5L, "Finn", List.of(new StaffSnapshot.Rule(DayOfWeek.MONDAY, window(9, 13))));
        List<WorkItem> wards = List.of(ward("Ward 7", 1, 1, 5));

        RotaDocument strict = generator.generate(input(List.of(finn), wards, List.of(), Set.of(DayOfWeek.MONDAY))).get(0);
        RotaDocument relaxed = generator.generate(new GenerationInput(MONDAY, List.of(finn), wards, List.of(),
                Set.of(DayOfWeek.MONDAY), Map.of(), Map.of(5L, Set.of(0)), "tester", null)).get(0);

        assertThat(strict.getAssignments().get(0).isGap()).isTrue();
        assertThat(relaxed.getAssignments().get(0).getStaffId()).isEqualTo(5L);
    }

    @Test
    void trainedStaff_arePreferredForAWard() {
        StaffSnapshot alice = trainedStaff(1L, "Alice", Set.of("Ward 9"), Set.of(), false);
        StaffSnapshot ben = trainedStaff(2L, "Ben", Set.of("Ward 7"), Set.of(), false);

        RotaDocument monday = generator.generate(input(List.of(alice, ben), List.of(ward("Ward 7", 1, 1, 5)),
                List.of(), Set.of(DayOfWeek.MONDAY))).get(0);

        assertThat(monday.getAssignments()).singleElement().satisfies(a -> assertThat(a.getStaffId()).isEqualTo(2L));
        assertThat(detector.detect(monday, Map.of(1L, alice, 2L, ben))).isEmpty();
    }

    @Test
    void primaryWard_isStaffedBeforeHigherPriorityWards() {
        RotaDocument monday = generator.generate(input(
                List.of(primaryWardStaff(1L, "Alice", "Ward 7"), staff(2L, "Ben")),
                List.of(ward("EAU", 1, 1, 9), ward("Ward 7", 1, 1, 5)),
                List.of(), Set.of(DayOfWeek.MONDAY))).get(0);

        assertThat(byLocation(monday).get("Ward 7").getStaffId()).isEqualTo(1L);
        assertThat(byLocation(monday).get("EAU").getStaffId()).isEqualTo(2L);
    }

    @Test
    void primaryDirectorate_breaksTheTieForAWard() {
        RotaDocument monday = generator.generate(input(
                List.of(staff(1L, "Alice"), directorateStaff(3L, "Chloe", "Surgery")),
                List.of(wardIn("Ward 12", "Surgery", 5)),
                List.of(), Set.of(DayOfWeek.MONDAY))).get(0);

        assertThat(byLocation(monday).get("Ward 12").getStaffId()).isEqualTo(3L);
    }

    @Test
    void dedicatedDispensaryPharmacist_runsTheDispensary_andLunchCoverRotates() {
        List<StaffSnapshot> roster = List.of(staff(1L, "Alice"), staff(2L, "Ben"), dispensaryPharmacist(8L, "Hana"));
        List<WorkItem> requirements = List.of(dispensaryAm(), dispensaryPm(), ward("Ward 7", 1, 1, 5));

        List<RotaDocument> documents = generator.generate(input(roster, requirements, List.of(),
                Set.of(DayOfWeek.MONDAY, DayOfWeek.TUESDAY)));
        Map<String, Assignment> monday = byLocation(documents.get(0));
        Map<String, Assignment> tuesday = byLocation(documents.get(1));

        assertThat(monday.get("Dispensary AM").getStaffId()).isEqualTo(8L);
        assertThat(monday.get("Dispensary PM").getStaffId()).isEqualTo(8L);
        assertThat(monday.get(AssignmentGenerator.LUNCH_COVER_LOCATION).getStaffId()).isEqualTo(1L);
        assertThat(monday.get(AssignmentGenerator.LUNCH_COVER_LOCATION).getStartTime()).isEqualTo(LocalTime.of(13, 30));
        assertThat(monday.get("Ward 7").getStaffId()).isEqualTo(2L);
        assertThat(tuesday.get(AssignmentGenerator.LUNCH_COVER_LOCATION).getStaffId()).isEqualTo(2L);
        assertThat(tuesday.get("Ward 7").getStaffId()).isEqualTo(1L);
        assertThat(detector.detect(documents.get(0), Map.of())).isEmpty();
        assertThat(detector.detect(documents.get(1), Map.of())).isEmpty();
    }

    @Test
    void singlePharmacistDay_givesTheDispensaryToTheMostJuniorPharmacist() {
        List<StaffSnapshot> roster = List.of(pharmacist(1L, "Alice", "8a"), pharmacist(2L, "Ben", "6"),
                pharmacist(3L, "Chloe", "7"));
        List<WorkItem> requirements = List.of(dispensaryAm(), dispensaryPm().withStaffing(2, 3),
                ward("Ward 7", 1, 1, 5));
        GenerationInput input = new GenerationInput(MONDAY, roster, requirements, List.of(),
                Set.of(DayOfWeek.MONDAY), Map.of(), Map.of(), Set.of(DayOfWeek.MONDAY), Map.of(),
                "tester", null);

        RotaDocument monday = generator.generate(input).get(0);
        Map<String, Assignment> byLocation = byLocation(monday);

        assertThat(byLocation.get("Dispensary AM").getStaffId()).isEqualTo(2L);
        assertThat(byLocation.get("Dispensary PM").getStaffId()).isEqualTo(2L);
        assertThat(byLocation.get(AssignmentGenerator.LUNCH_COVER_LOCATION).getStaffId()).isEqualTo(1L);
        assertThat(byLocation.get("Ward 7").getStaffId()).isEqualTo(3L);
        assertThat(monday.getCoverageTargets())
                .filteredOn(t -> t.getLocation().equals("Dispensary PM"))
                .singleElement()
                .satisfies(t -> {
                    assertThat(t.getMinStaff()).isEqualTo(1);
                    assertThat(t.getIdealStaff()).isEqualTo(1);
                });
        assertThat(detector.detect(monday, Map.of())).isEmpty();
    }

    @Test
    void lunchCoverWithNobodyFree_isLeftAsAGap() {
        RotaDocument monday = generator.generate(input(
                List.of(dispensaryPharmacist(8L, "Hana"), technician(4L, "Tom")),
                List.of(dispensaryAm(), dispensaryPm()), List.of(), Set.of(DayOfWeek.MONDAY))).get(0);

        assertThat(byLocation(monday).get(AssignmentGenerator.LUNCH_COVER_LOCATION).isGap()).isTrue();
        assertThat(detector.detect(monday, Map.of())).singleElement().satisfies(c -> {
            assertThat(c.getType()).isEqualTo(ConflictType.UNDERSTAFFED);
            assertThat(c.getLocation()).isEqualTo(AssignmentGenerator.LUNCH_COVER_LOCATION);
        });
    }

    @Test
    void rotaOnlyUnavailability_cannotBeIgnoredByIndex() {
        Map<Long, List<StaffSnapshot.Rule>> awayMonday =
                Map.of(1L, List.of(new StaffSnapshot.Rule(DayOfWeek.MONDAY, window(9, 13))));
        GenerationInput input = new GenerationInput(MONDAY, List.of(staff(1L, "Alice")),
                List.of(ward("Ward 7", 1, 1, 5)), List.of(), Set.of(DayOfWeek.MONDAY), Map.of(),
                Map.of(1L, Set.of(0)), Set.of(), awayMonday, "tester", null);

        List<RotaDocument> documents = generator.generate(input);

        assertThat(documents.get(0).getAssignments()).singleElement().satisfies(a -> assertThat(a.isGap()).isTrue());
    }

    @Test
    void clinicTravelTime_blocksTheFollowingSession() {
        ClinicSlot anticoag = new ClinicSlot("Anticoag", DayOfWeek.MONDAY, t(9), t(12), false);
        anticoag.setTravelTimeAfter(30);
        WorkItem respiratory = clinic("CLINIC-2", "Respiratory", window(12, 14), false, List.of(), DayOfWeek.MONDAY);

        RotaDocument withTravel = generator.generate(input(List.of(staff(1L, "Alice")), List.of(),
                List.of(WorkItem.of(anticoag), respiratory), Set.of(DayOfWeek.MONDAY))).get(0);
        anticoag.setTravelTimeAfter(0);
        RotaDocument withoutTravel = generator.generate(input(List.of(staff(1L, "Alice")), List.of(),
                List.of(WorkItem.of(anticoag), respiratory), Set.of(DayOfWeek.MONDAY))).get(0);

        assertThat(byLocation(withTravel).get("Anticoag").getStaffId()).isEqualTo(1L);
        assertThat(byLocation(withTravel).get("Anticoag").getEndTime()).isEqualTo(t(12));
        assertThat(byLocation(withTravel).get("Respiratory").isGap()).isTrue();
        assertThat(byLocation(withoutTravel).get("Respiratory").getStaffId()).isEqualTo(1L);
    }

    @Test
    void identicalInput_givesIdenticalRows() {
        List<StaffSnapshot> roster = List.of(staff(3L, "Chloe"), rosterStaff(1L, "Alice"), staff(2L, "Ben"));
        List<WorkItem> requirements = List.of(ward("EAU", 1, 2, 9), ward("Ward 7", 1, 1, 6),
                item("REQ-AM", "Dispensary", AssignmentType.DISPENSARY, window(9, 13), 1, 2, 4, null, false, true));
        Set<DayOfWeek> days = Set.of(DayOfWeek.MONDAY, DayOfWeek.WEDNESDAY);

        List<RotaDocument> first = generator.generate(input(roster, requirements, List.of(), days));
        List<RotaDocument> second = generator.generate(input(List.of(roster.get(2), roster.get(0), roster.get(1)),
                requirements, List.of(), days));

        for (int i = 0; i < 7; i++) {
            assertThat(second.get(i).getAssignments()).isEqualTo(first.get(i).getAssignments());
        }
    }

    @Test
    void nobodyIsGivenOverlappingRows() {
        List<StaffSnapshot> roster = List.of(staff(1L, "Alice"), staff(2L, "Ben"));
        List<WorkItem> requirements = List.of(ward("EAU", 2, 3, 9), ward("Ward 7", 1, 2, 6),
                item("REQ-AM", "Dispensary", AssignmentType.DISPENSARY, window(9, 13), 1, 2, 4, null, false, false),
                item("REQ-PM", "Dispensary", AssignmentType.DISPENSARY, window(13, 17), 1, 2, 4, null, false, false));

        RotaDocument monday = generator.generate(input(roster, requirements, List.of(), Set.of(DayOfWeek.MONDAY))).get(0);

        assertThat(detector.detect(monday, Map.of()))
                .extracting(Conflict::getType)
                .doesNotContain(ConflictType.DOUBLE_BOOKED);
    }

    @Test
    void everyWorkItem_getsACoverageTarget() {
        RotaDocument monday = generator.generate(input(
                List.of(staff(1L, "Alice")), List.of(ward("EAU", 1, 2, 9), ward("Ward 7", 1, 1, 5)),
                List.of(), Set.of(DayOfWeek.MONDAY))).get(0);

        assertThat(monday.getCoverageTargets()).hasSize(2);
    }

    @Test
    void malformedInput_isRejected() {
        List<StaffSnapshot> roster = List.of(staff(1L, "Alice"));
        List<WorkItem> wards = List.of(ward("Ward 7", 1, 1, 5));

        assertThatThrownBy(() -> generator.generate(new GenerationInput(MONDAY.plusDays(1), roster, wards, List.of(),
                Set.of(DayOfWeek.MONDAY), Map.of(), Map.of(), "tester", null)))
                .isInstanceOf(RotaPreconditionException.class)
                .hasMessageContaining("Monday");
        assertThatThrownBy(() -> generator.generate(input(List.of(), wards, List.of(), Set.of(DayOfWeek.MONDAY))))
                .isInstanceOf(RotaPreconditionException.class);
        assertThatThrownBy(() -> generator.generate(input(roster, wards, List.of(), Set.of())))
                .isInstanceOf(RotaPreconditionException.class);
    }

    private GenerationInput input(List<StaffSnapshot> staff, List<WorkItem> requirements, List<WorkItem> clinics,
                                  Set<DayOfWeek> days) {
        return new GenerationInput(MONDAY, staff, requirements, clinics, days, Map.of(), Map.of(),
                "tester", LocalDateTime.of(2024, 5, 1, 10, 0));
    }

    private static WorkItem dispensaryAm() {
        return item("REQ-DAM", "Dispensary AM", AssignmentType.DISPENSARY, window(9, 13), 1, 1, 4, null, false, false);
    }

    private static WorkItem dispensaryPm() {
        return item("REQ-DPM", "Dispensary PM", AssignmentType.DISPENSARY, window(13, 17), 1, 1, 4, null, false, false);
    }

    private Map<String, Assignment> byLocation(RotaDocument document) {
        return document.getAssignments().stream()
                .collect(Collectors.toMap(Assignment::getLocation, Function.identity()));
    }
}

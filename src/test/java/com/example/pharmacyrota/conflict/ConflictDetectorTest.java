package com.example.pharmacyrota.conflict;

import com.example.pharmacyrota.rota.Assignment;
import com.example.pharmacyrota.rota.AssignmentType;
import com.example.pharmacyrota.rota.Conflict;
import com.example.pharmacyrota.rota.ConflictSeverity;
import com.example.pharmacyrota.rota.ConflictType;
import com.example.pharmacyrota.rota.CoverageTarget;
import com.example.pharmacyrota.rota.RotaDocument;
import com.example.pharmacyrota.staff.StaffSnapshot;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.example.pharmacyrota.RotaTestData.*;
import static org.assertj.core.api.Assertions.assertThat;

class ConflictDetectorTest {

    private final ConflictDetector detector = new ConflictDetector();

    @Test
    void splitHalvesHeldByDifferentStaff_countAsOnePlace() {
        RotaDocument document = document(new CoverageTarget("EAU", AssignmentType.WARD, window(9, 17), 1, 2),
                row(1L, AssignmentType.WARD, "EAU", MONDAY, 9, 13),
                row(2L, AssignmentType.WARD, "EAU", MONDAY, 13, 17));

        List<Conflict> conflicts = detector.detect(document, Map.of());

        assertThat(conflicts).singleElement().satisfies(c -> {
            assertThat(c.getType()).isEqualTo(ConflictType.BELOW_IDEAL);
            assertThat(c.getSeverity()).isEqualTo(ConflictSeverity.WARNING);
            assertThat(c.getLocation()).isEqualTo("EAU");
        });
    }

    @Test
    void uncoveredHalf_isUnderstaffed() {
        RotaDocument document = document(new CoverageTarget("Ward 7", AssignmentType.WARD, window(9, 17), 1, 1),
                row(1L, AssignmentType.WARD, "Ward 7", MONDAY, 9, 13),
                row(null, AssignmentType.WARD, "Ward 7", MONDAY, 13, 17));

        assertThat(detector.detect(document, Map.of()))
                .extracting(Conflict::getType, Conflict::getSeverity)
                .containsExactly(org.assertj.core.groups.Tuple.tuple(ConflictType.UNDERSTAFFED, ConflictSeverity.ERROR));
    }

    @Test
    void fullyStaffedTarget_hasNoCoverageConflict() {
        RotaDocument document = document(new CoverageTarget("Ward 7", AssignmentType.WARD, window(9, 17), 1, 2),
                row(1L, AssignmentType.WARD, "Ward 7", MONDAY, 9, 17),
                row(2L, AssignmentType.WARD, "Ward 7", MONDAY, 9, 17));

        assertThat(detector.detect(document, Map.of())).isEmpty();
    }

    @Test
    void overlappingRowsForOneStaff_areReportedOncePerPair() {
        RotaDocument document = document(null,
                row(1L, AssignmentType.WARD, "Ward 7", MONDAY, 9, 17),
                row(1L, AssignmentType.CLINIC, "Respiratory", MONDAY, 10, 12),
                row(1L, AssignmentType.MANAGEMENT, "Management", MONDAY, 17, 18));

        List<Conflict> conflicts = detector.detect(document, Map.of(1L, staff(1L, "Alice")));

        assertThat(conflicts).singleElement().satisfies(c -> {
            assertThat(c.getType()).isEqualTo(ConflictType.DOUBLE_BOOKED);
            assertThat(c.getSeverity()).isEqualTo(ConflictSeverity.ERROR);
            assertThat(c.getStaffId()).isEqualTo(1L);
            assertThat(c.getDescription()).contains("Alice");
        });
    }

    @Test
    void splitShareableRows_mayOverlap() {
        Assignment dispensary = row(1L, AssignmentType.DISPENSARY, "Dispensary", MONDAY, 9, 13);
        dispensary.setSplitShareable(true);
        RotaDocument document = document(null, dispensary, row(1L, AssignmentType.CLINIC, "Respiratory", MONDAY, 11, 12));

        assertThat(detector.detect(document, Map.of())).isEmpty();
    }

    @Test
    void wardOutsideTrainedSet_isATrainingWarning_butDispensaryIsNot() {
        StaffSnapshot ben = trainedStaff(2L, "Ben", Set.of("Ward 12"), Set.of(), false);
        RotaDocument document = document(null,
                row(2L, AssignmentType.WARD, "Ward 7", MONDAY, 9, 13),
                row(2L, AssignmentType.DISPENSARY, "Dispensary", MONDAY, 13, 17));

        assertThat(detector.detect(document, Map.of(2L, ben))).singleElement().satisfies(c -> {
            assertThat(c.getType()).isEqualTo(ConflictType.TRAINING_MISMATCH);
            assertThat(c.getSeverity()).isEqualTo(ConflictSeverity.WARNING);
            assertThat(c.getLocation()).isEqualTo("Ward 7");
        });
    }

    @Test
    void sameNamedItems_areCoveredByTheirOwnRowsOnly() {
        CoverageTarget morning = new CoverageTarget("REQ-1", "Dispensary", AssignmentType.DISPENSARY, window(9, 13), 1, 1);
        CoverageTarget extra = new CoverageTarget("REQ-2", "Dispensary", AssignmentType.DISPENSARY, window(9, 13), 1, 1);
        Assignment staffed = row(1L, AssignmentType.DISPENSARY, "Dispensary", MONDAY, 9, 13);
        staffed.setItemKey("REQ-1");
        Assignment gap = row(null, AssignmentType.DISPENSARY, "Dispensary", MONDAY, 9, 13);
        gap.setItemKey("REQ-2");
        RotaDocument document = document(morning, staffed, gap);
        document.getCoverageTargets().add(extra);

        assertThat(detector.detect(document, Map.of())).singleElement().satisfies(c -> {
            assertThat(c.getType()).isEqualTo(ConflictType.UNDERSTAFFED);
            assertThat(c.getDescription()).contains("has 0 staff");
        });
    }

    @Test
    void doNotSplitHolderWorkingElsewhere_isASplitDutyError() {
        Assignment accuracyCheck = row(1L, AssignmentType.ROLE, "Accuracy Check", MONDAY, 9, 13);
        accuracyCheck.setDoNotSplit(true);
        RotaDocument document = document(null, accuracyCheck,
                row(1L, AssignmentType.CLINIC, "Warf", MONDAY, 14, 16));

        assertThat(detector.detect(document, Map.of(1L, staff(1L, "Alice")))).singleElement().satisfies(c -> {
            assertThat(c.getType()).isEqualTo(ConflictType.SPLIT_DUTY);
            assertThat(c.getSeverity()).isEqualTo(ConflictSeverity.ERROR);
            assertThat(c.getStaffId()).isEqualTo(1L);
            assertThat(c.getLocation()).isEqualTo("Accuracy Check");
            assertThat(c.getDescription()).contains("Alice", "Warf");
        });
    }

    @Test
    void doNotSplitHolderWithBothHalvesOfOneLocation_isFine() {
        Assignment morning = row(1L, AssignmentType.WARD, "EAU", MONDAY, 9, 13);
        morning.setDoNotSplit(true);
        Assignment afternoon = row(1L, AssignmentType.WARD, "EAU", MONDAY, 13, 17);
        afternoon.setDoNotSplit(true);

        assertThat(detector.detect(document(null, morning, afternoon), Map.of())).isEmpty();
    }

    @Test
    void detectionIsRepeatable() {
        RotaDocument document = document(new CoverageTarget("EAU", AssignmentType.WARD, window(9, 17), 2, 2),
                row(1L, AssignmentType.WARD, "EAU", MONDAY, 9, 17),
                row(1L, AssignmentType.CLINIC, "Respiratory", MONDAY, 9, 12));

        List<Conflict> first = detector.detect(document, Map.of());
        List<Conflict> second = detector.detect(document, Map.of());

        assertThat(second).isEqualTo(first);
        assertThat(first).extracting(Conflict::getType)
                .containsExactly(ConflictType.UNDERSTAFFED, ConflictType.DOUBLE_BOOKED);
        assertThat(document.getConflicts()).isEmpty();
    }

    private RotaDocument document(CoverageTarget target, Assignment... rows) {
        RotaDocument document = new RotaDocument(MONDAY, MONDAY);
        if (target != null) {
            document.getCoverageTargets().add(target);
        }
        document.getAssignments().addAll(List.of(rows));
        return document;
    }
}

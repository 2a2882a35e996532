package com.example.pharmacyrota.conflict;

import com.example.pharmacyrota.common.TimeWindow;
import com.example.pharmacyrota.rota.Assignment;
import com.example.pharmacyrota.rota.AssignmentType;
import com.example.pharmacyrota.rota.Conflict;
import com.example.pharmacyrota.rota.ConflictSeverity;
import com.example.pharmacyrota.rota.ConflictType;
import com.example.pharmacyrota.rota.CoverageTarget;
import com.example.pharmacyrota.rota.RotaDocument;
import com.example.pharmacyrota.staff.StaffSnapshot;
import org.springframework.stereotype.Component;

import java.time.LocalTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Audits one rota document. Reads only the document and the staff snapshots, writes
 * nothing, and returns the same list for the same input.
 * <p>
 * Conflicts come out grouped by rule and, within a rule, in document order. The rules
 * run as coverage, double booking, split duty and then training.
 */
@Component
public class ConflictDetector {

    public List<Conflict> detect(RotaDocument document, Map<Long, StaffSnapshot> staff) {
        List<Conflict> conflicts = new ArrayList<>();
        checkCoverage(document, conflicts);
        checkDoubleBooking(document, staff, conflicts);
        checkSplitDuty(document, staff, conflicts);
        checkTraining(document, staff, conflicts);
        return conflicts;
    }

    private void checkCoverage(RotaDocument document, List<Conflict> conflicts) {
        for (CoverageTarget target : document.getCoverageTargets()) {
            int covered = minimumConcurrentCover(document.getAssignments(), target);
            String where = target.getLocation() + " on " + document.getDate() + " " + target.window();
            if (covered < target.getMinStaff()) {
                conflicts.add(new Conflict(ConflictType.UNDERSTAFFED,
                        where + " has " + covered + " staff, minimum " + target.getMinStaff(),
                        ConflictSeverity.ERROR, target.getLocation(), null));
            } else if (covered < target.getIdealStaff()) {
                conflicts.add(new Conflict(ConflictType.BELOW_IDEAL,
                        where + " has " + covered + " staff, below ideal " + target.getIdealStaff(),
                        ConflictSeverity.WARNING, target.getLocation(), null));
            }
        }
    }

    /**
     * Lowest number of staffed rows for the target over any instant of the target
     * window. Two half-day rows held by different people count as one.
     */
    static int minimumConcurrentCover(List<Assignment> rows, CoverageTarget target) {
        TimeWindow window = target.window();
        List<Assignment> relevant = new ArrayList<>();
        TreeSet<LocalTime> cuts = new TreeSet<>();
        cuts.add(window.start());
        cuts.add(window.end());
        for (Assignment row : rows) {
            if (row.isGap() || !target.covers(row) || !row.window().overlaps(window)) {
                continue;
            }
            relevant.add(row);
            if (row.getStartTime().isAfter(window.start())) {
                cuts.add(row.getStartTime());
            }
            if (row.getEndTime().isBefore(window.end())) {
                cuts.add(row.getEndTime());
            }
        }
        int min = Integer.MAX_VALUE;
        LocalTime previous = null;
        for (LocalTime cut : cuts) {
            if (previous != null) {
                TimeWindow segment = TimeWindow.of(previous, cut);
                int count = 0;
                for (Assignment row : relevant) {
                    if (row.window().contains(segment)) {
                        count++;
                    }
                }
                min = Math.min(min, count);
            }
            previous = cut;
        }
        return min == Integer.MAX_VALUE ? 0 : min;
    }

    private void checkDoubleBooking(RotaDocument document, Map<Long, StaffSnapshot> staff,
                                    List<Conflict> conflicts) {
        byStaff(document).forEach((staffId, rows) -> {
            for (int i = 0; i < rows.size(); i++) {
                for (int j = i + 1; j < rows.size(); j++) {
                    Assignment a = rows.get(i);
                    Assignment b = rows.get(j);
                    if (a.isSplitShareable() || b.isSplitShareable() || !a.window().overlaps(b.window())) {
                        continue;
                    }
                    conflicts.add(new Conflict(ConflictType.DOUBLE_BOOKED,
                            nameOf(staffId, staff) + " is booked on " + a.getLocation() + " " + a.window()
                                    + " and " + b.getLocation() + " " + b.window() + " on " + document.getDate(),
                            ConflictSeverity.ERROR, a.getLocation(), staffId));
                }
            }
        });
    }

    private void checkSplitDuty(RotaDocument document, Map<Long, StaffSnapshot> staff, List<Conflict> conflicts) {
        byStaff(document).forEach((staffId, rows) -> {
            Set<String> reported = new HashSet<>();
            for (Assignment anchored : rows) {
                if (!anchored.isDoNotSplit()) {
                    continue;
                }
                for (Assignment other : rows) {
                    if (other.getLocation().equals(anchored.getLocation())
                            || !reported.add(anchored.getLocation() + "|" + other.getLocation())) {
                        continue;
                    }
                    conflicts.add(new Conflict(ConflictType.SPLIT_DUTY,
                            nameOf(staffId, staff) + " holds " + anchored.getLocation()
                                    + ", which cannot be split, and also " + other.getLocation() + " "
                                    + other.window() + " on " + document.getDate(),
                            ConflictSeverity.ERROR, anchored.getLocation(), staffId));
                }
            }
        });
    }

    private void checkTraining(RotaDocument document, Map<Long, StaffSnapshot> staff, List<Conflict> conflicts) {
        for (Assignment row : document.getAssignments()) {
            if (row.isGap() || (row.getType() != AssignmentType.WARD && row.getType() != AssignmentType.ROLE)) {
                continue;
            }
            StaffSnapshot member = staff.get(row.getStaffId());
            if (member != null && !member.isTrainedFor(row.getLocation())) {
                conflicts.add(new Conflict(ConflictType.TRAINING_MISMATCH,
                        member.name() + " is not trained for " + row.getLocation() + " on " + document.getDate(),
                        ConflictSeverity.WARNING, row.getLocation(), row.getStaffId()));
            }
        }
    }

    private static Map<Long, List<Assignment>> byStaff(RotaDocument document) {
        Map<Long, List<Assignment>> byStaff = new TreeMap<>();
        for (Assignment row : document.getAssignments()) {
            if (!row.isGap()) {
                byStaff.computeIfAbsent(row.getStaffId(), k -> new ArrayList<>()).add(row);
            }
        }
        return byStaff;
    }

    private String nameOf(Long staffId, Map<Long, StaffSnapshot> staff) {
        StaffSnapshot s = staff.get(staffId);
        return s != null ? s.name() : "Staff #" + staffId;
    }
}

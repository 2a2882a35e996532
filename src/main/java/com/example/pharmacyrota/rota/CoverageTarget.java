package com.example.pharmacyrota.rota;

import com.example.pharmacyrota.common.TimeWindow;
import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;

import java.time.LocalTime;

/**
 * Staffing target recorded on a rota document when it is generated, so the
 * document can be audited without the reference catalog.
 */
@Embeddable
public class CoverageTarget {

    @Column(nullable = false)
    private String location;

    @Enumerated(EnumType.STRING)
    @Column(name = "assignment_type", nullable = false)
    private AssignmentType type;

    @Column(name = "start_time", nullable = false)
    private LocalTime startTime;

    @Column(name = "end_time", nullable = false)
    private LocalTime endTime;

    @Column(name = "min_staff", nullable = false)
    private int minStaff;

    @Column(name = "ideal_staff", nullable = false)
    private int idealStaff;

    // null on targets recorded before rows carried their work item
    @Column(name = "item_key")
    private String itemKey;

    protected CoverageTarget() {
    }

    public CoverageTarget(String location, AssignmentType type, TimeWindow window, int minStaff, int idealStaff) {
        this.location = location;
        this.type = type;
        this.startTime = window.start();
        this.endTime = window.end();
        this.minStaff = minStaff;
        this.idealStaff = idealStaff;
    }

    public CoverageTarget(String itemKey, String location, AssignmentType type, TimeWindow window,
                          int minStaff, int idealStaff) {
        this(location, type, window, minStaff, idealStaff);
        this.itemKey = itemKey;
    }

    /**
     * Whether a row counts towards this target. Rows and targets that both carry a
     * work item key match on the key; otherwise location and type decide.
     */
    public boolean covers(Assignment row) {
        if (itemKey != null && row.getItemKey() != null) {
            return itemKey.equals(row.getItemKey());
        }
        return row.getType() == type && row.getLocation().equals(location);
    }

    public TimeWindow window() {
        return TimeWindow.of(startTime, endTime);
    }

    public String getLocation() { return location; }
    public AssignmentType getType() { return type; }
    public LocalTime getStartTime() { return startTime; }
    public LocalTime getEndTime() { return endTime; }
    public int getMinStaff() { return minStaff; }
    public int getIdealStaff() { return idealStaff; }
    public String getItemKey() { return itemKey; }
}

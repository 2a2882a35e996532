package com.example.pharmacyrota.rota;

import com.example.pharmacyrota.common.TimeWindow;
import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.Objects;

/**
 * One row of a rota document. A row with no staff is a gap that stays visible on
 * the rota rather than being dropped.
 */
@Embeddable
public class Assignment {

    @Column(name = "staff_id")
    private Long staffId;

    @Enumerated(EnumType.STRING)
    @Column(name = "assignment_type", nullable = false)
    private AssignmentType type;

    @Column(nullable = false)
    private String location;

    @Column(name = "work_date", nullable = false)
    private LocalDate date;

    @Column(name = "start_time", nullable = false)
    private LocalTime startTime;

    @Column(name = "end_time", nullable = false)
    private LocalTime endTime;

    @Column
    private String category;

    @Column(name = "split_shareable")
    private boolean splitShareable;

    @Column(name = "continuity_sensitive")
    private boolean continuitySensitive;

    // the holder may not work at any other location that day
    @Column(name = "do_not_split")
    private boolean doNotSplit;

    // work item the row was generated for; ties it to its coverage target
    @Column(name = "item_key")
    private String itemKey;

    protected Assignment() {
    }

    public Assignment(Long staffId, AssignmentType type, String location, LocalDate date,
                      LocalTime startTime, LocalTime endTime, String category) {
        this.staffId = staffId;
        this.type = type;
        this.location = location;
        this.date = date;
        this.startTime = startTime;
        this.endTime = endTime;
        this.category = category;
    }

    public Assignment copy() {
        Assignment a = new Assignment(staffId, type, location, date, startTime, endTime, category);
        a.splitShareable = splitShareable;
        a.continuitySensitive = continuitySensitive;
        a.doNotSplit = doNotSplit;
        a.itemKey = itemKey;
        return a;
    }

    public Assignment withStaff(Long newStaffId) {
        Assignment a = copy();
        a.staffId = newStaffId;
        return a;
    }

    public Assignment withWindow(TimeWindow window) {
        Assignment a = copy();
        a.startTime = window.start();
        a.endTime = window.end();
        return a;
    }

    public TimeWindow window() {
        return TimeWindow.of(startTime, endTime);
    }

    public boolean isGap() {
        return staffId == null;
    }

    public boolean isHeldBy(Long id) {
        return Objects.equals(staffId, id);
    }

    public Long getStaffId() { return staffId; }
    public void setStaffId(Long staffId) { this.staffId = staffId; }
    public AssignmentType getType() { return type; }
    public String getLocation() { return location; }
    public LocalDate getDate() { return date; }
    public LocalTime getStartTime() { return startTime; }
    public LocalTime getEndTime() { return endTime; }
    public String getCategory() { return category; }
    public boolean isSplitShareable() { return splitShareable; }
    public void setSplitShareable(boolean splitShareable) { this.splitShareable = splitShareable; }
    public boolean isContinuitySensitive() { return continuitySensitive; }
    public void setContinuitySensitive(boolean continuitySensitive) { this.continuitySensitive = continuitySensitive; }
    public boolean isDoNotSplit() { return doNotSplit; }
    public void setDoNotSplit(boolean doNotSplit) { this.doNotSplit = doNotSplit; }
    public String getItemKey() { return itemKey; }
    public void setItemKey(String itemKey) { this.itemKey = itemKey; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Assignment that)) return false;
        return splitShareable == that.splitShareable
                && continuitySensitive == that.continuitySensitive
                && doNotSplit == that.doNotSplit
                && Objects.equals(staffId, that.staffId)
                && type == that.type
                && Objects.equals(location, that.location)
                && Objects.equals(date, that.date)
                && Objects.equals(startTime, that.startTime)
                && Objects.equals(endTime, that.endTime)
                && Objects.equals(category, that.category)
                && Objects.equals(itemKey, that.itemKey);
    }

    @Override
    public int hashCode() {
        return Objects.hash(staffId, type, location, date, startTime, endTime, category, splitShareable,
                continuitySensitive, doNotSplit, itemKey);
    }

    @Override
    public String toString() {
        return type + " " + location + " " + date + " " + startTime + "-" + endTime + " staff=" + staffId;
    }
}

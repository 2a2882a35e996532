package com.example.pharmacyrota.requirement;

import jakarta.persistence.*;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Recurring, time-boxed clinic session (e.g. an anticoagulation clinic) staffed
 * like a requirement with a single place.
 */
@Entity
@Table(name = "clinic_slots")
public class ClinicSlot {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @NotBlank(message = "Clinic name is required")
    @Column(nullable = false)
    private String name;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(name = "day_of_week", nullable = false)
    private DayOfWeek dayOfWeek;

    @NotNull
    @Column(name = "start_time", nullable = false)
    private LocalTime startTime;

    @NotNull
    @Column(name = "end_time", nullable = false)
    private LocalTime endTime;

    @Column(name = "requires_warfarin_training")
    private Boolean requiresWarfarinTraining = false;

    @Min(1)
    @Max(10)
    @Column(nullable = false)
    private Integer difficulty = 5;

    // minutes the clinic pharmacist is away from other duties either side of the session
    @Min(0)
    @Column(name = "travel_time_before")
    private Integer travelTimeBefore = 0;

    @Min(0)
    @Column(name = "travel_time_after")
    private Integer travelTimeAfter = 0;

    @Column(name = "is_active")
    private Boolean active = true;

    // soft preference, highest priority first
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "clinic_preferred_staff", joinColumns = @JoinColumn(name = "clinic_id"))
    @OrderColumn(name = "preference_rank")
    @Column(name = "staff_id")
    private List<Long> preferredStaffIds = new ArrayList<>();

    protected ClinicSlot() {
    }

    public ClinicSlot(String name, DayOfWeek dayOfWeek, LocalTime startTime, LocalTime endTime, boolean requiresWarfarinTraining) {
        this.name = name;
        this.dayOfWeek = dayOfWeek;
        this.startTime = startTime;
        this.endTime = endTime;
        this.requiresWarfarinTraining = requiresWarfarinTraining;
    }

    public Long getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public DayOfWeek getDayOfWeek() { return dayOfWeek; }
    public void setDayOfWeek(DayOfWeek dayOfWeek) { this.dayOfWeek = dayOfWeek; }
    public LocalTime getStartTime() { return startTime; }
    public void setStartTime(LocalTime startTime) { this.startTime = startTime; }
    public LocalTime getEndTime() { return endTime; }
    public void setEndTime(LocalTime endTime) { this.endTime = endTime; }
    public Boolean getRequiresWarfarinTraining() { return requiresWarfarinTraining; }
    public void setRequiresWarfarinTraining(Boolean requiresWarfarinTraining) { this.requiresWarfarinTraining = requiresWarfarinTraining; }
    public Integer getDifficulty() { return difficulty; }
    public void setDifficulty(Integer difficulty) { this.difficulty = difficulty; }
    public Integer getTravelTimeBefore() { return travelTimeBefore; }
    public void setTravelTimeBefore(Integer travelTimeBefore) { this.travelTimeBefore = travelTimeBefore; }
    public Integer getTravelTimeAfter() { return travelTimeAfter; }
    public void setTravelTimeAfter(Integer travelTimeAfter) { this.travelTimeAfter = travelTimeAfter; }
    public Boolean getActive() { return active; }
    public void setActive(Boolean active) { this.active = active; }
    public List<Long> getPreferredStaffIds() { return preferredStaffIds; }
    public void setPreferredStaffIds(List<Long> preferredStaffIds) { this.preferredStaffIds = preferredStaffIds; }
}

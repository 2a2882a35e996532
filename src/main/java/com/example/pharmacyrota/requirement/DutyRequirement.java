package com.example.pharmacyrota.requirement;

import com.example.pharmacyrota.rota.AssignmentType;
import jakarta.persistence.*;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.util.HashSet;
import java.util.Set;

/**
 * A named duty slot (ward, dispensary shift, management block) with staffing
 * targets and training constraints. The name doubles as the rota location.
 */
@Entity
@Table(name = "duty_requirements")
public class DutyRequirement {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @NotBlank(message = "Requirement name is required")
    @Column(nullable = false)
    private String name;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(name = "assignment_type", nullable = false)
    private AssignmentType type = AssignmentType.WARD;

    @Column
    private String category;

    @Min(value = 0, message = "Minimum staff cannot be negative")
    @Column(name = "min_staff", nullable = false)
    private Integer minStaff = 1;

    @Min(value = 0, message = "Ideal staff cannot be negative")
    @Column(name = "ideal_staff", nullable = false)
    private Integer idealStaff = 1;

    @Min(1)
    @Max(10)
    @Column(nullable = false)
    private Integer difficulty = 5;

    @Column
    private String directorate;

    @Column(name = "required_training")
    private String requiredTraining;

    // staff placed here may not be placed anywhere else that day
    @Column(name = "do_not_split")
    private Boolean doNotSplit = false;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "duty_requirement_days", joinColumns = @JoinColumn(name = "requirement_id"))
    @Enumerated(EnumType.STRING)
    @Column(name = "day_of_week")
    private Set<DayOfWeek> daysOfWeek = new HashSet<>();

    @Column(name = "start_time")
    private LocalTime startTime;

    @Column(name = "end_time")
    private LocalTime endTime;

    @Column(name = "split_shareable")
    private Boolean splitShareable = false;

    @Column(name = "continuity_sensitive")
    private Boolean continuitySensitive = false;

    @Column(name = "is_active")
    private Boolean active = true;

    protected DutyRequirement() {
    }

    public DutyRequirement(String name, AssignmentType type, String category, int minStaff, int idealStaff, int difficulty) {
        this.name = name;
        this.type = type;
        this.category = category;
        this.minStaff = minStaff;
        this.idealStaff = idealStaff;
        this.difficulty = difficulty;
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

    public AssignmentType getType() {
        return type;
    }

    public void setType(AssignmentType type) {
        this.type = type;
    }

    public String getCategory() {
        return category;
    }

    public void setCategory(String category) {
        this.category = category;
    }

    public String getDirectorate() { return directorate; }
    public void setDirectorate(String directorate) { this.directorate = directorate; }
    public Integer getMinStaff() { return minStaff; }
    public void setMinStaff(Integer minStaff) { this.minStaff = minStaff; }
    public Integer getIdealStaff() { return idealStaff; }
    public void setIdealStaff(Integer idealStaff) { this.idealStaff = idealStaff; }
    public Integer getDifficulty() { return difficulty; }
    public void setDifficulty(Integer difficulty) { this.difficulty = difficulty; }
    public String getRequiredTraining() { return requiredTraining; }
    public void setRequiredTraining(String requiredTraining) { this.requiredTraining = requiredTraining; }
    public Boolean getDoNotSplit() { return doNotSplit; }
    public void setDoNotSplit(Boolean doNotSplit) { this.doNotSplit = doNotSplit; }
    public Set<DayOfWeek> getDaysOfWeek() { return daysOfWeek; }
    public void setDaysOfWeek(Set<DayOfWeek> daysOfWeek) { this.daysOfWeek = daysOfWeek; }
    public LocalTime getStartTime() { return startTime; }
    public void setStartTime(LocalTime startTime) { this.startTime = startTime; }
    public LocalTime getEndTime() { return endTime; }
    public void setEndTime(LocalTime endTime) { this.endTime = endTime; }
    public Boolean getSplitShareable() { return splitShareable; }
    public void setSplitShareable(Boolean splitShareable) { this.splitShareable = splitShareable; }
    public Boolean getContinuitySensitive() { return continuitySensitive; }
    public void setContinuitySensitive(Boolean continuitySensitive) { this.continuitySensitive = continuitySensitive; }
    public Boolean getActive() { return active; }
    public void setActive(Boolean active) { this.active = active; }
}

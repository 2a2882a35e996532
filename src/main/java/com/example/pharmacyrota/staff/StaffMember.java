package com.example.pharmacyrota.staff;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

import java.time.DayOfWeek;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

@Entity
@Table(name = "staff_members")
public class StaffMember {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    @NotBlank(message = "Name is required")
    @Size(max = 80, message = "Name must be at most 80 characters")
    private String name;

    // how the name appears on the rota grid
    @Column(name = "display_name")
    private String displayName;

    @Enumerated(EnumType.STRING)
    @Column(name = "staff_type", nullable = false)
    private StaffType staffType = StaffType.PHARMACIST;

    @Column
    @Size(max = 40)
    private String band;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "staff_trained_locations", joinColumns = @JoinColumn(name = "staff_id"))
    @Column(name = "location_name")
    private Set<String> trainedLocations = new HashSet<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "staff_specialist_training", joinColumns = @JoinColumn(name = "staff_id"))
    @Column(name = "training_tag")
    private Set<String> specialistTraining = new HashSet<>();

    // wards this pharmacist is placed on first when they are free
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "staff_primary_wards", joinColumns = @JoinColumn(name = "staff_id"))
    @Column(name = "ward_name")
    private Set<String> primaryWards = new HashSet<>();

    @Column(name = "primary_directorate")
    private String primaryDirectorate;

    // runs the dispensary all day whenever they are in
    @Column(name = "dispensary_pharmacist")
    private Boolean dispensaryPharmacist = false;

    @Column(name = "warfarin_trained")
    private Boolean warfarinTrained = false;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "staff_working_days", joinColumns = @JoinColumn(name = "staff_id"))
    @Enumerated(EnumType.STRING)
    @Column(name = "day_of_week")
    private Set<DayOfWeek> workingDays = new HashSet<>();

    // list position is the rule index referenced by per-rota ignore overrides
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "staff_unavailability_rules", joinColumns = @JoinColumn(name = "staff_id"))
    @OrderColumn(name = "rule_index")
    private List<UnavailabilityRule> unavailabilityRules = new ArrayList<>();

    @Column(name = "default_roster")
    private Boolean defaultRoster = false;

    @Column(name = "is_active")
    private Boolean active = true;

    @Column(name = "created_at")
    private LocalDateTime createdAt;

    protected StaffMember() {
    }

    public StaffMember(String name, StaffType staffType, String band) {
        this.name = name;
        this.staffType = staffType;
        this.band = band;
        this.createdAt = LocalDateTime.now();
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
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

    public String getDisplayName() {
        return displayName;
    }

    public void setDisplayName(String displayName) {
        this.displayName = displayName;
    }

    public StaffType getStaffType() {
        return staffType;
    }

    public void setStaffType(StaffType staffType) {
        this.staffType = staffType;
    }

    public String getBand() {
        return band;
    }

    public void setBand(String band) {
        this.band = band;
    }

    public Set<String> getTrainedLocations() { return trainedLocations; }
    public void setTrainedLocations(Set<String> trainedLocations) { this.trainedLocations = trainedLocations; }
    public Set<String> getSpecialistTraining() { return specialistTraining; }
    public void setSpecialistTraining(Set<String> specialistTraining) { this.specialistTraining = specialistTraining; }
    public Set<String> getPrimaryWards() { return primaryWards; }
    public void setPrimaryWards(Set<String> primaryWards) { this.primaryWards = primaryWards; }
    public String getPrimaryDirectorate() { return primaryDirectorate; }
    public void setPrimaryDirectorate(String primaryDirectorate) { this.primaryDirectorate = primaryDirectorate; }
    public Boolean getDispensaryPharmacist() { return dispensaryPharmacist; }
    public void setDispensaryPharmacist(Boolean dispensaryPharmacist) { this.dispensaryPharmacist = dispensaryPharmacist; }
    public Boolean getWarfarinTrained() { return warfarinTrained; }
    public void setWarfarinTrained(Boolean warfarinTrained) { this.warfarinTrained = warfarinTrained; }
    public Set<DayOfWeek> getWorkingDays() { return workingDays; }
    public void setWorkingDays(Set<DayOfWeek> workingDays) { this.workingDays = workingDays; }
    public List<UnavailabilityRule> getUnavailabilityRules() { return unavailabilityRules; }
    public void setUnavailabilityRules(List<UnavailabilityRule> unavailabilityRules) { this.unavailabilityRules = unavailabilityRules; }
    public Boolean getDefaultRoster() { return defaultRoster; }
    public void setDefaultRoster(Boolean defaultRoster) { this.defaultRoster = defaultRoster; }
    public Boolean getActive() { return active; }
    public void setActive(Boolean active) { this.active = active; }

    public LocalDateTime getCreatedAt() {
        return createdAt;
    }
}

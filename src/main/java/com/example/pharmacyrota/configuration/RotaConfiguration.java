package com.example.pharmacyrota.configuration;

import jakarta.persistence.*;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.HashSet;
import java.util.Set;

/**
 * Generation parameters for one week, kept so an operator can resume configuring and
 * so a regeneration can reuse them. Updated in place; never deleted.
 */
@Entity
@Table(name = "rota_configurations")
public class RotaConfiguration {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "week_start", nullable = false, unique = true)
    private LocalDate weekStart;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "rota_configuration_staff", joinColumns = @JoinColumn(name = "configuration_id"))
    @Column(name = "staff_id")
    private Set<Long> selectedStaffIds = new HashSet<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "rota_configuration_clinics", joinColumns = @JoinColumn(name = "configuration_id"))
    @Column(name = "clinic_id")
    private Set<Long> selectedClinicIds = new HashSet<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "rota_configuration_weekdays", joinColumns = @JoinColumn(name = "configuration_id"))
    @Enumerated(EnumType.STRING)
    @Column(name = "day_of_week")
    private Set<DayOfWeek> selectedWeekdays = new HashSet<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "rota_configuration_single_pharmacist_days",
            joinColumns = @JoinColumn(name = "configuration_id"))
    @Enumerated(EnumType.STRING)
    @Column(name = "day_of_week")
    private Set<DayOfWeek> singlePharmacistDispensaryDays = new HashSet<>();

    // JSON: {"<staffId>": ["MONDAY", ...]}
    @Lob
    @Column(name = "working_days_override")
    private String workingDaysOverride;

    // JSON: {"<staffId>": [ruleIndex, ...]}
    @Lob
    @Column(name = "ignored_unavailability")
    private String ignoredUnavailability;

    // JSON: {"MONDAY": [{"name": ..., "startTime": ..., ...}]}
    @Lob
    @Column(name = "role_requests")
    private String roleRequests;

    // JSON: {"<staffId>": [{"dayOfWeek": "MONDAY", "startTime": "09:00", "endTime": "13:00"}]}
    @Lob
    @Column(name = "rota_unavailability")
    private String rotaUnavailability;

    @Column(name = "last_modified")
    private LocalDateTime lastModified;

    @Column(name = "last_modified_by")
    private String lastModifiedBy;

    @Column(name = "is_generated")
    private Boolean generated = Boolean.FALSE;

    @Column(name = "rota_generated_at")
    private LocalDateTime rotaGeneratedAt;

    protected RotaConfiguration() {
    }

    public RotaConfiguration(LocalDate weekStart) {
        this.weekStart = weekStart;
    }

    public Long getId() { return id; }
    public LocalDate getWeekStart() { return weekStart; }
    public Set<Long> getSelectedStaffIds() { return selectedStaffIds; }
    public Set<Long> getSelectedClinicIds() { return selectedClinicIds; }
    public Set<DayOfWeek> getSelectedWeekdays() { return selectedWeekdays; }
    public Set<DayOfWeek> getSinglePharmacistDispensaryDays() { return singlePharmacistDispensaryDays; }
    public String getWorkingDaysOverride() { return workingDaysOverride; }
    public void setWorkingDaysOverride(String workingDaysOverride) { this.workingDaysOverride = workingDaysOverride; }
    public String getIgnoredUnavailability() { return ignoredUnavailability; }
    public void setIgnoredUnavailability(String ignoredUnavailability) { this.ignoredUnavailability = ignoredUnavailability; }
    public String getRoleRequests() { return roleRequests; }
    public void setRoleRequests(String roleRequests) { this.roleRequests = roleRequests; }
    public String getRotaUnavailability() { return rotaUnavailability; }
    public void setRotaUnavailability(String rotaUnavailability) { this.rotaUnavailability = rotaUnavailability; }
    public LocalDateTime getLastModified() { return lastModified; }
    public void setLastModified(LocalDateTime lastModified) { this.lastModified = lastModified; }
    public String getLastModifiedBy() { return lastModifiedBy; }
    public void setLastModifiedBy(String lastModifiedBy) { this.lastModifiedBy = lastModifiedBy; }
    public Boolean getGenerated() { return generated; }
    public void setGenerated(Boolean generated) { this.generated = generated; }
    public LocalDateTime getRotaGeneratedAt() { return rotaGeneratedAt; }
    public void setRotaGeneratedAt(LocalDateTime rotaGeneratedAt) { this.rotaGeneratedAt = rotaGeneratedAt; }
}

package com.example.pharmacyrota.rota;

import jakarta.persistence.*;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The rota for one calendar date. Seven documents sharing a Monday week start
 * make up a week's rota.
 */
@Entity
@Table(name = "rota_documents", indexes = {
        @Index(name = "idx_rota_documents_week", columnList = "week_start"),
        @Index(name = "idx_rota_documents_date", columnList = "rota_date")
})
public class RotaDocument {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "rota_date", nullable = false)
    private LocalDate date;

    @Column(name = "week_start", nullable = false)
    private LocalDate weekStart;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private RotaStatus status = RotaStatus.DRAFT;

    @ElementCollection
    @CollectionTable(name = "rota_assignments", joinColumns = @JoinColumn(name = "rota_id"))
    @OrderColumn(name = "row_index")
    private List<Assignment> assignments = new ArrayList<>();

    @ElementCollection
    @CollectionTable(name = "rota_coverage_targets", joinColumns = @JoinColumn(name = "rota_id"))
    @OrderColumn(name = "row_index")
    private List<CoverageTarget> coverageTargets = new ArrayList<>();

    @ElementCollection
    @CollectionTable(name = "rota_conflicts", joinColumns = @JoinColumn(name = "rota_id"))
    @OrderColumn(name = "row_index")
    private List<Conflict> conflicts = new ArrayList<>();

    @ElementCollection
    @CollectionTable(name = "rota_cell_overrides", joinColumns = @JoinColumn(name = "rota_id"))
    @OrderColumn(name = "row_index")
    private List<CellOverride> cellOverrides = new ArrayList<>();

    @ElementCollection
    @CollectionTable(name = "rota_included_weekdays", joinColumns = @JoinColumn(name = "rota_id"))
    @Enumerated(EnumType.STRING)
    @Column(name = "day_of_week")
    private Set<DayOfWeek> includedWeekdays = new HashSet<>();

    @ElementCollection
    @CollectionTable(name = "rota_staff_ids", joinColumns = @JoinColumn(name = "rota_id"))
    @Column(name = "staff_id")
    private Set<Long> staffIds = new HashSet<>();

    @Column(name = "generated_by")
    private String generatedBy;

    @Column(name = "generated_at")
    private LocalDateTime generatedAt;

    @Column(name = "published_by")
    private String publishedBy;

    @Column(name = "published_at")
    private LocalDateTime publishedAt;

    // display copies of publishedAt
    @Column(name = "publish_date")
    private String publishDate;

    @Column(name = "publish_time")
    private String publishTime;

    @Column(name = "published_set_id")
    private String publishedSetId;

    @Column(name = "last_edited")
    private LocalDateTime lastEdited;

    protected RotaDocument() {
    }

    public RotaDocument(LocalDate date, LocalDate weekStart) {
        this.date = date;
        this.weekStart = weekStart;
    }

    public boolean isEditable() {
        return status != RotaStatus.ARCHIVED;
    }

    public Map<String, String> cellOverrideMap() {
        Map<String, String> map = new LinkedHashMap<>();
        for (CellOverride o : cellOverrides) {
            map.put(o.key().format(), o.getText());
        }
        return map;
    }

    public Long getId() {
        return id;
    }

    public LocalDate getDate() {
        return date;
    }

    public LocalDate getWeekStart() {
        return weekStart;
    }

    public RotaStatus getStatus() {
        return status;
    }

    public void setStatus(RotaStatus status) {
        this.status = status;
    }

    public List<Assignment> getAssignments() {
        return assignments;
    }

    public void replaceAssignments(List<Assignment> rows) {
        assignments.clear();
        assignments.addAll(rows);
    }

    public List<CoverageTarget> getCoverageTargets() {
        return coverageTargets;
    }

    public List<Conflict> getConflicts() {
        return conflicts;
    }

    public void replaceConflicts(List<Conflict> detected) {
        conflicts.clear();
        conflicts.addAll(detected);
    }

    public List<CellOverride> getCellOverrides() {
        return cellOverrides;
    }

    public void replaceCellOverrides(List<CellOverride> overrides) {
        cellOverrides.clear();
        cellOverrides.addAll(overrides);
    }

    public Set<DayOfWeek> getIncludedWeekdays() { return includedWeekdays; }
    public Set<Long> getStaffIds() { return staffIds; }
    public String getGeneratedBy() { return generatedBy; }
    public void setGeneratedBy(String generatedBy) { this.generatedBy = generatedBy; }
    public LocalDateTime getGeneratedAt() { return generatedAt; }
    public void setGeneratedAt(LocalDateTime generatedAt) { this.generatedAt = generatedAt; }
    public String getPublishedBy() { return publishedBy; }
    public void setPublishedBy(String publishedBy) { this.publishedBy = publishedBy; }
    public LocalDateTime getPublishedAt() { return publishedAt; }
    public void setPublishedAt(LocalDateTime publishedAt) { this.publishedAt = publishedAt; }
    public String getPublishDate() { return publishDate; }
    public void setPublishDate(String publishDate) { this.publishDate = publishDate; }
    public String getPublishTime() { return publishTime; }
    public void setPublishTime(String publishTime) { this.publishTime = publishTime; }
    public String getPublishedSetId() { return publishedSetId; }
    public void setPublishedSetId(String publishedSetId) { this.publishedSetId = publishedSetId; }
    public LocalDateTime getLastEdited() { return lastEdited; }
    public void setLastEdited(LocalDateTime lastEdited) { this.lastEdited = lastEdited; }
}

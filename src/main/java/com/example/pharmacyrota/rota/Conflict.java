package com.example.pharmacyrota.rota;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;

import java.util.Objects;

@Embeddable
public class Conflict {

    @Enumerated(EnumType.STRING)
    @Column(name = "conflict_type", nullable = false)
    private ConflictType type;

    @Column(nullable = false, length = 500)
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ConflictSeverity severity;

    @Column
    private String location;

    @Column(name = "staff_id")
    private Long staffId;

    protected Conflict() {
    }

    public Conflict(ConflictType type, String description, ConflictSeverity severity, String location, Long staffId) {
        this.type = type;
        this.description = description;
        this.severity = severity;
        this.location = location;
        this.staffId = staffId;
    }

    public ConflictType getType() { return type; }
    public String getDescription() { return description; }
    public ConflictSeverity getSeverity() { return severity; }
    public String getLocation() { return location; }
    public Long getStaffId() { return staffId; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Conflict that)) return false;
        return type == that.type && severity == that.severity
                && Objects.equals(description, that.description)
                && Objects.equals(location, that.location)
                && Objects.equals(staffId, that.staffId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, description, severity, location, staffId);
    }

    @Override
    public String toString() {
        return severity + " " + type + ": " + description;
    }
}

package com.example.pharmacyrota.rota;

import java.time.LocalDate;
import java.time.LocalTime;

public record AssignmentDto(
        Long rotaId,
        Long staffId,
        AssignmentType type,
        String location,
        LocalDate date,
        LocalTime startTime,
        LocalTime endTime,
        String category,
        boolean splitShareable,
        boolean continuitySensitive,
        String cellKey) {

    public static AssignmentDto from(Long rotaId, Assignment assignment) {
        return new AssignmentDto(
                rotaId,
                assignment.getStaffId(),
                assignment.getType(),
                assignment.getLocation(),
                assignment.getDate(),
                assignment.getStartTime(),
                assignment.getEndTime(),
                assignment.getCategory(),
                assignment.isSplitShareable(),
                assignment.isContinuitySensitive(),
                CellKey.forAssignment(assignment).format()
        );
    }

    public boolean isGap() { return staffId == null; }
}

package com.example.pharmacyrota.rota;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

public record RotaDocumentDto(
        Long id,
        LocalDate date,
        LocalDate weekStart,
        RotaStatus status,
        List<AssignmentDto> assignments,
        List<ConflictDto> conflicts,
        Map<String, String> cellOverrides,
        String generatedBy,
        LocalDateTime generatedAt,
        String publishedBy,
        LocalDateTime publishedAt,
        String publishDate,
        String publishTime,
        String publishedSetId,
        LocalDateTime lastEdited) {

    public static RotaDocumentDto from(RotaDocument document) {
        return new RotaDocumentDto(
                document.getId(),
                document.getDate(),
                document.getWeekStart(),
                document.getStatus(),
                document.getAssignments().stream().map(a -> AssignmentDto.from(document.getId(), a)).toList(),
                document.getConflicts().stream().map(ConflictDto::from).toList(),
                document.cellOverrideMap(),
                document.getGeneratedBy(),
                document.getGeneratedAt(),
                document.getPublishedBy(),
                document.getPublishedAt(),
                document.getPublishDate(),
                document.getPublishTime(),
                document.getPublishedSetId(),
                document.getLastEdited()
        );
    }
}

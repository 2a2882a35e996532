package com.example.pharmacyrota.generator;

import com.example.pharmacyrota.rota.AssignmentDto;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

public record GenerationResult(
        LocalDate weekStart,
        Map<LocalDate, Long> rotaIdsByDate,
        List<AssignmentDto> assignments,
        int errorCount,
        int warningCount) {
}

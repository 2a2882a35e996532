package com.example.pharmacyrota.lifecycle;

import com.example.pharmacyrota.rota.RotaDocumentDto;

import java.time.LocalDate;
import java.util.List;

public record WeekRotaDto(LocalDate weekStart, WeekState state, List<RotaDocumentDto> documents) {
}

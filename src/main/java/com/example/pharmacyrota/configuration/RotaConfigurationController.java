package com.example.pharmacyrota.configuration;

import com.example.pharmacyrota.common.ApiResponse;
import com.example.pharmacyrota.exception.RotaNotFoundException;
import jakarta.validation.Valid;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;

@RestController
@RequestMapping("/api/rota-configurations")
public class RotaConfigurationController {

    private final RotaConfigurationService configurationService;

    public RotaConfigurationController(RotaConfigurationService configurationService) {
        this.configurationService = configurationService;
    }

    @GetMapping("/{weekStart}")
    public ResponseEntity<ApiResponse<RotaConfigurationDto>> get(
            @PathVariable @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate weekStart) {
        RotaConfigurationDto configuration = configurationService.find(weekStart)
                .orElseThrow(() -> new RotaNotFoundException("Rota configuration", weekStart));
        return ResponseEntity.ok(ApiResponse.success(configuration));
    }

    @PutMapping("/{weekStart}")
    public ResponseEntity<ApiResponse<RotaConfigurationDto>> save(
            @PathVariable @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate weekStart,
            @Valid @RequestBody RotaConfigurationRequest request) {
        RotaConfigurationDto saved = configurationService.save(weekStart, request, request.modifiedBy());
        return ResponseEntity.ok(ApiResponse.success("Rota configuration saved", saved));
    }
}

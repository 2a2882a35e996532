package com.example.pharmacyrota.rota;

import com.example.pharmacyrota.common.ApiResponse;
import com.example.pharmacyrota.generator.GenerateRotaRequest;
import com.example.pharmacyrota.generator.GenerationResult;
import com.example.pharmacyrota.generator.RotaGenerationService;
import com.example.pharmacyrota.lifecycle.RotaLifecycleService;
import com.example.pharmacyrota.lifecycle.SweepResult;
import com.example.pharmacyrota.lifecycle.WeekRotaDto;
import com.example.pharmacyrota.reassignment.ReassignmentRequest;
import com.example.pharmacyrota.reassignment.ReassignmentResult;
import com.example.pharmacyrota.reassignment.ReassignmentService;
import com.example.pharmacyrota.reassignment.SwapRequest;
import jakarta.validation.Valid;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/rotas")
public class RotaController {

    private final RotaGenerationService generationService;
    private final RotaDocumentService documentService;
    private final ReassignmentService reassignmentService;
    private final RotaLifecycleService lifecycleService;

    public RotaController(RotaGenerationService generationService,
                          RotaDocumentService documentService,
                          ReassignmentService reassignmentService,
                          RotaLifecycleService lifecycleService) {
        this.generationService = generationService;
        this.documentService = documentService;
        this.reassignmentService = reassignmentService;
        this.lifecycleService = lifecycleService;
    }

    @PostMapping("/generate")
    public ResponseEntity<ApiResponse<GenerationResult>> generate(@Valid @RequestBody GenerateRotaRequest request) {
        GenerationResult result = generationService.generate(request);
        Map<String, Object> meta = new HashMap<>();
        meta.put("documents", result.rotaIdsByDate().size());
        meta.put("assignments", result.assignments().size());
        meta.put("errors", result.errorCount());
        meta.put("warnings", result.warningCount());
        return ResponseEntity.ok(ApiResponse.success("Rota generated", result, meta));
    }

    @GetMapping("/{rotaId}")
    public ResponseEntity<ApiResponse<RotaDocumentDto>> get(@PathVariable Long rotaId) {
        return ResponseEntity.ok(ApiResponse.success(documentService.get(rotaId)));
    }

    @GetMapping("/{rotaId}/assignments")
    public ResponseEntity<ApiResponse<List<AssignmentDto>>> assignments(@PathVariable Long rotaId) {
        return ResponseEntity.ok(ApiResponse.success(documentService.assignments(rotaId)));
    }

    @GetMapping("/{rotaId}/conflicts")
    public ResponseEntity<ApiResponse<List<ConflictDto>>> conflicts(@PathVariable Long rotaId) {
        return ResponseEntity.ok(ApiResponse.success(documentService.detectConflicts(rotaId)));
    }

    @GetMapping("/week/{weekStart}")
    public ResponseEntity<ApiResponse<WeekRotaDto>> week(
            @PathVariable @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate weekStart) {
        return ResponseEntity.ok(ApiResponse.success(lifecycleService.week(weekStart)));
    }

    @PostMapping("/reassign")
    public ResponseEntity<ApiResponse<ReassignmentResult>> reassign(@Valid @RequestBody ReassignmentRequest request) {
        ReassignmentResult result = reassignmentService.reassign(request);
        String message = result.success() ? "Reassignment applied" : "Reassignment partly applied";
        return ResponseEntity.ok(new ApiResponse<>(result.success(), message, result, Map.of()));
    }

    @PostMapping("/swap")
    public ResponseEntity<ApiResponse<ReassignmentResult>> swap(@Valid @RequestBody SwapRequest request) {
        return ResponseEntity.ok(ApiResponse.success("Swap applied", reassignmentService.swap(request)));
    }

    @PostMapping("/week/{weekStart}/publish")
    public ResponseEntity<ApiResponse<List<RotaDocumentDto>>> publish(
            @PathVariable @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate weekStart,
            @Valid @RequestBody PublishRequest request) {
        return ResponseEntity.ok(ApiResponse.success("Rota published",
                lifecycleService.publish(weekStart, request.publishedBy())));
    }

    @PostMapping("/week/{weekStart}/archive")
    public ResponseEntity<ApiResponse<List<RotaDocumentDto>>> archiveWeek(
            @PathVariable @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate weekStart) {
        return ResponseEntity.ok(ApiResponse.success("Rota archived", lifecycleService.archiveWeek(weekStart)));
    }

    @PostMapping("/{rotaId}/archive")
    public ResponseEntity<ApiResponse<RotaDocumentDto>> archive(@PathVariable Long rotaId) {
        return ResponseEntity.ok(ApiResponse.success("Rota archived", lifecycleService.archiveDocument(rotaId)));
    }

    @DeleteMapping("/week/{weekStart}/drafts")
    public ResponseEntity<ApiResponse<Map<String, Object>>> clearDrafts(
            @PathVariable @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate weekStart) {
        int deleted = lifecycleService.clearDrafts(weekStart);
        return ResponseEntity.ok(ApiResponse.success("Drafts cleared", Map.of("deleted", deleted)));
    }

    @PostMapping("/cleanup/stale-drafts")
    public ResponseEntity<ApiResponse<SweepResult>> sweepStaleDrafts(
            @RequestParam(name = "cutoff", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate cutoff) {
        return ResponseEntity.ok(ApiResponse.success("Stale drafts swept", lifecycleService.sweepStaleDrafts(cutoff)));
    }

    @DeleteMapping("/archived")
    public ResponseEntity<ApiResponse<Map<String, Object>>> deleteArchived(
            @RequestParam(name = "weekStart", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate weekStart,
            @RequestParam(name = "beforeDate", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate beforeDate,
            @RequestParam(name = "confirmation", required = false) String confirmation) {
        int deleted = lifecycleService.deleteArchived(weekStart, beforeDate, confirmation);
        return ResponseEntity.ok(ApiResponse.success("Archived rotas deleted", Map.of("deleted", deleted)));
    }

    @GetMapping("/{rotaId}/cell-overrides")
    public ResponseEntity<ApiResponse<Map<String, String>>> cellOverrides(@PathVariable Long rotaId) {
        return ResponseEntity.ok(ApiResponse.success(documentService.cellOverrides(rotaId)));
    }

    @PutMapping("/{rotaId}/cell-overrides")
    public ResponseEntity<ApiResponse<Map<String, String>>> saveCellOverrides(@PathVariable Long rotaId,
                                                                             @RequestBody Map<String, String> overrides) {
        return ResponseEntity.ok(ApiResponse.success("Cell overrides saved",
                documentService.saveCellOverrides(rotaId, overrides)));
    }
}

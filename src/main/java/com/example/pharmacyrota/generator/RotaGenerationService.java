package com.example.pharmacyrota.generator;

import com.example.pharmacyrota.common.TimeWindow;
import com.example.pharmacyrota.configuration.RotaConfigurationRequest;
import com.example.pharmacyrota.configuration.RotaConfigurationService;
import com.example.pharmacyrota.configuration.RotaUnavailability;
import com.example.pharmacyrota.conflict.ConflictDetector;
import com.example.pharmacyrota.exception.RotaNotFoundException;
import com.example.pharmacyrota.exception.RotaPreconditionException;
import com.example.pharmacyrota.lifecycle.RotaLifecycleService;
import com.example.pharmacyrota.requirement.ClinicSlot;
import com.example.pharmacyrota.requirement.ClinicSlotRepository;
import com.example.pharmacyrota.requirement.DutyRequirementRepository;
import com.example.pharmacyrota.requirement.WorkItem;
import com.example.pharmacyrota.rota.AssignmentDto;
import com.example.pharmacyrota.rota.Conflict;
import com.example.pharmacyrota.rota.ConflictSeverity;
import com.example.pharmacyrota.rota.RotaDocument;
import com.example.pharmacyrota.rota.RotaDocumentRepository;
import com.example.pharmacyrota.staff.StaffDirectory;
import com.example.pharmacyrota.staff.StaffSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Loads the reference data for a week, runs the generator over snapshots of it and
 * replaces the week's drafts with the result.
 */
@Service
public class RotaGenerationService {

    private static final Logger logger = LoggerFactory.getLogger(RotaGenerationService.class);

    private final AssignmentGenerator generator;
    private final ConflictDetector conflictDetector;
    private final StaffDirectory staffDirectory;
    private final DutyRequirementRepository requirementRepository;
    private final ClinicSlotRepository clinicRepository;
    private final RotaDocumentRepository documentRepository;
    private final RotaLifecycleService lifecycleService;
    private final RotaConfigurationService configurationService;
    private final Clock clock;
    private final TimeWindow defaultWindow;

    public RotaGenerationService(AssignmentGenerator generator,
                                 ConflictDetector conflictDetector,
                                 StaffDirectory staffDirectory,
                                 DutyRequirementRepository requirementRepository,
                                 ClinicSlotRepository clinicRepository,
                                 RotaDocumentRepository documentRepository,
                                 RotaLifecycleService lifecycleService,
                                 RotaConfigurationService configurationService,
                                 Clock clock,
                                 @Value("${rota.default.start:09:00}") String defaultStart,
                                 @Value("${rota.default.end:17:00}") String defaultEnd) {
        this.generator = generator;
        this.conflictDetector = conflictDetector;
        this.staffDirectory = staffDirectory;
        this.requirementRepository = requirementRepository;
        this.clinicRepository = clinicRepository;
        this.documentRepository = documentRepository;
        this.lifecycleService = lifecycleService;
        this.configurationService = configurationService;
        this.clock = clock;
        this.defaultWindow = TimeWindow.of(LocalTime.parse(defaultStart), LocalTime.parse(defaultEnd));
    }

    /**
     * Generates the week described by {@code request}. Existing drafts of the week are
     * replaced; a published week is refused.
     */
    @Transactional
    public GenerationResult generate(GenerateRotaRequest request) {
        RotaConfigurationRequest parameters = request.toConfiguration();
        LocalDate weekStart = request.weekStart();
        checkPreconditions(weekStart, parameters);
        lifecycleService.ensureRegenerable(weekStart);

        List<StaffSnapshot> roster = staffDirectory.roster(parameters.staffIds(), parameters.workingDaysOverride());
        List<WorkItem> requirements = requirementRepository.findByActiveTrue().stream()
                .map(r -> WorkItem.of(r, defaultWindow))
                .toList();
        List<WorkItem> clinics = loadClinics(parameters.selectedClinicIds());

        String generatedBy = request.generatedBy() == null || request.generatedBy().isBlank()
                ? "system" : request.generatedBy();
        LocalDateTime now = LocalDateTime.now(clock);
        Map<Long, List<StaffSnapshot.Rule>> rotaUnavailability = new HashMap<>();
        parameters.rotaUnavailability().forEach((staffId, windows) ->
                rotaUnavailability.put(staffId, windows.stream().map(RotaUnavailability::toRule).toList()));
        GenerationInput input = new GenerationInput(weekStart, roster, requirements, clinics,
                parameters.selectedWeekdays(), parameters.extraRoleRequestsByWeekday(),
                parameters.ignoredUnavailability(), parameters.singlePharmacistDispensaryDays(),
                rotaUnavailability, generatedBy, now);

        List<RotaDocument> documents = generator.generate(input);

        lifecycleService.clearDrafts(weekStart);
        configurationService.recordGeneration(weekStart, parameters, generatedBy, now);

        Map<Long, StaffSnapshot> staffById = new HashMap<>();
        roster.forEach(s -> staffById.put(s.id(), s));
        int errors = 0;
        int warnings = 0;
        for (RotaDocument document : documents) {
            List<Conflict> conflicts = conflictDetector.detect(document, staffById);
            document.replaceConflicts(conflicts);
            for (Conflict c : conflicts) {
                if (c.getSeverity() == ConflictSeverity.ERROR) errors++;
                else warnings++;
            }
        }
        List<RotaDocument> saved = documentRepository.saveAll(documents);

        Map<LocalDate, Long> rotaIdsByDate = new TreeMap<>();
        List<AssignmentDto> assignments = new ArrayList<>();
        for (RotaDocument document : saved) {
            rotaIdsByDate.put(document.getDate(), document.getId());
            document.getAssignments().forEach(a -> assignments.add(AssignmentDto.from(document.getId(), a)));
        }
        logger.info("Generated week {} for {} staff over {}: {} assignments, {} errors, {} warnings",
                weekStart, roster.size(), parameters.selectedWeekdays(), assignments.size(), errors, warnings);
        return new GenerationResult(weekStart, rotaIdsByDate, assignments, errors, warnings);
    }

    private void checkPreconditions(LocalDate weekStart, RotaConfigurationRequest parameters) {
        if (weekStart == null || weekStart.getDayOfWeek() != DayOfWeek.MONDAY) {
            throw new RotaPreconditionException("Week start must be a Monday: " + weekStart);
        }
        if (parameters.staffIds().isEmpty()) {
            throw new RotaPreconditionException("At least one staff member must be selected");
        }
        if (parameters.selectedWeekdays().isEmpty()) {
            throw new RotaPreconditionException("At least one weekday must be selected");
        }
    }

    private List<WorkItem> loadClinics(List<Long> clinicIds) {
        List<WorkItem> clinics = new ArrayList<>();
        for (Long id : clinicIds) {
            ClinicSlot clinic = clinicRepository.findById(id)
                    .orElseThrow(() -> new RotaNotFoundException("Clinic", id));
            if (Boolean.TRUE.equals(clinic.getActive())) {
                clinics.add(WorkItem.of(clinic));
            } else {
                logger.debug("Skipping inactive clinic {} ({})", clinic.getName(), id);
            }
        }
        return clinics;
    }
}

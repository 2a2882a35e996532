package com.example.pharmacyrota.rota;

import com.example.pharmacyrota.conflict.ConflictDetector;
import com.example.pharmacyrota.exception.RotaNotFoundException;
import com.example.pharmacyrota.exception.RotaStateException;
import com.example.pharmacyrota.staff.StaffDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Reads single rota documents and maintains their free-text cell overrides.
 */
@Service
@Transactional
public class RotaDocumentService {

    private static final Logger logger = LoggerFactory.getLogger(RotaDocumentService.class);

    private final RotaDocumentRepository documentRepository;
    private final ConflictDetector conflictDetector;
    private final StaffDirectory staffDirectory;
    private final Clock clock;

    public RotaDocumentService(RotaDocumentRepository documentRepository,
                               ConflictDetector conflictDetector,
                               StaffDirectory staffDirectory,
                               Clock clock) {
        this.documentRepository = documentRepository;
        this.conflictDetector = conflictDetector;
        this.staffDirectory = staffDirectory;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public RotaDocumentDto get(Long rotaId) {
        return RotaDocumentDto.from(load(rotaId));
    }

    @Transactional(readOnly = true)
    public List<AssignmentDto> assignments(Long rotaId) {
        RotaDocument document = load(rotaId);
        return document.getAssignments().stream().map(a -> AssignmentDto.from(rotaId, a)).toList();
    }

    /**
     * Runs the detector over the stored rows without saving the result.
     */
    @Transactional(readOnly = true)
    public List<ConflictDto> detectConflicts(Long rotaId) {
        RotaDocument document = load(rotaId);
        var staffIds = document.getAssignments().stream()
                .map(Assignment::getStaffId)
                .filter(Objects::nonNull)
                .collect(Collectors.toSet());
        return conflictDetector.detect(document, staffDirectory.snapshots(staffIds)).stream()
                .map(ConflictDto::from)
                .toList();
    }

    @Transactional(readOnly = true)
    public Map<String, String> cellOverrides(Long rotaId) {
        return load(rotaId).cellOverrideMap();
    }

    /**
     * Replaces all overrides of a document. Blank texts drop the cell.
     *
     * @throws IllegalArgumentException for a key that does not parse
     */
    public Map<String, String> saveCellOverrides(Long rotaId, Map<String, String> overrides) {
        RotaDocument document = load(rotaId);
        if (!document.isEditable()) {
            throw new RotaStateException("Rota " + rotaId + " is archived and cannot be changed");
        }
        List<CellOverride> parsed = new ArrayList<>();
        overrides.forEach((key, text) -> {
            CellKey cellKey = CellKey.parse(key);
            if (text != null && !text.isBlank()) {
                parsed.add(new CellOverride(cellKey, text));
            }
        });
        document.replaceCellOverrides(parsed);
        document.setLastEdited(LocalDateTime.now(clock));
        logger.info("Saved {} cell overrides on rota {}", parsed.size(), rotaId);
        return document.cellOverrideMap();
    }

    private RotaDocument load(Long rotaId) {
        return documentRepository.findById(rotaId)
                .orElseThrow(() -> new RotaNotFoundException("Rota", rotaId));
    }
}

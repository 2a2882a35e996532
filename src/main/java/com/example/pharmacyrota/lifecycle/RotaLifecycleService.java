package com.example.pharmacyrota.lifecycle;

import com.example.pharmacyrota.common.error.ErrorLogBuffer;
import com.example.pharmacyrota.configuration.RotaConfigurationService;
import com.example.pharmacyrota.exception.RotaNotFoundException;
import com.example.pharmacyrota.exception.RotaPreconditionException;
import com.example.pharmacyrota.exception.RotaStateException;
import com.example.pharmacyrota.rota.RotaDocument;
import com.example.pharmacyrota.rota.RotaDocumentDto;
import com.example.pharmacyrota.rota.RotaDocumentRepository;
import com.example.pharmacyrota.rota.RotaStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Moves a week's documents through draft, published and archived, and retires stale
 * drafts. There is no way back from published to draft; a published week is
 * corrected through reassignment.
 */
@Service
public class RotaLifecycleService {

    private static final Logger logger = LoggerFactory.getLogger(RotaLifecycleService.class);

    public static final String DELETE_ARCHIVED_CONFIRMATION = "CONFIRM_DELETE_ARCHIVED_ROTAS";

    private static final DateTimeFormatter PUBLISH_DATE = DateTimeFormatter.ofPattern("dd/MM/yyyy");
    private static final DateTimeFormatter PUBLISH_TIME = DateTimeFormatter.ofPattern("HH:mm");

    private final RotaDocumentRepository documentRepository;
    private final RotaConfigurationService configurationService;
    private final ErrorLogBuffer errorLogBuffer;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;
    private final int retentionMonths;

    public RotaLifecycleService(RotaDocumentRepository documentRepository,
                                RotaConfigurationService configurationService,
                                ErrorLogBuffer errorLogBuffer,
                                PlatformTransactionManager transactionManager,
                                Clock clock,
                                @Value("${rota.retention.months:2}") int retentionMonths) {
        this.documentRepository = documentRepository;
        this.configurationService = configurationService;
        this.errorLogBuffer = errorLogBuffer;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.clock = clock;
        this.retentionMonths = retentionMonths;
    }

    @Transactional(readOnly = true)
    public WeekState stateOf(LocalDate weekStart) {
        return stateOf(weekStart, documentRepository.findByWeekStartOrderByDateAsc(weekStart));
    }

    @Transactional(readOnly = true)
    public WeekRotaDto week(LocalDate weekStart) {
        List<RotaDocument> documents = documentRepository.findByWeekStartOrderByDateAsc(weekStart);
        return new WeekRotaDto(weekStart, stateOf(weekStart, documents),
                documents.stream().map(RotaDocumentDto::from).toList());
    }

    private WeekState stateOf(LocalDate weekStart, List<RotaDocument> documents) {
        if (documents.isEmpty()) {
            return configurationService.exists(weekStart) ? WeekState.CONFIGURING : WeekState.NONE;
        }
        if (documents.stream().anyMatch(d -> d.getStatus() == RotaStatus.PUBLISHED)) {
            return WeekState.PUBLISHED;
        }
        if (documents.stream().anyMatch(d -> d.getStatus() == RotaStatus.DRAFT)) {
            return WeekState.DRAFT;
        }
        return WeekState.ARCHIVED;
    }

    /**
     * A published week is corrected through reassignment, never regenerated.
     */
    @Transactional(readOnly = true)
    public void ensureRegenerable(LocalDate weekStart) {
        if (documentRepository.existsByWeekStartAndStatus(weekStart, RotaStatus.PUBLISHED)) {
            throw new RotaStateException("Week " + weekStart + " is published and cannot be regenerated");
        }
    }

    @Transactional
    public int clearDrafts(LocalDate weekStart) {
        List<RotaDocument> drafts = documentRepository.findByWeekStartAndStatusOrderByDateAsc(weekStart, RotaStatus.DRAFT);
        documentRepository.deleteAll(drafts);
        documentRepository.flush();
        configurationService.markCleared(weekStart);
        logger.info("Cleared {} draft documents for week {}", drafts.size(), weekStart);
        return drafts.size();
    }

    /**
     * Publishes every draft of the week under one shared set id.
     */
    @Transactional
    public List<RotaDocumentDto> publish(LocalDate weekStart, String publishedBy) {
        if (publishedBy == null || publishedBy.isBlank()) {
            throw new RotaPreconditionException("Publisher is required");
        }
        List<RotaDocument> drafts = documentRepository.findByWeekStartAndStatusOrderByDateAsc(weekStart, RotaStatus.DRAFT);
        if (drafts.isEmpty()) {
            throw new RotaStateException("Week " + weekStart + " has no draft to publish");
        }
        LocalDateTime now = LocalDateTime.now(clock);
        String setId = weekStart + "-" + clock.instant().toEpochMilli();
        for (RotaDocument document : drafts) {
            document.setStatus(RotaStatus.PUBLISHED);
            document.setPublishedBy(publishedBy);
            document.setPublishedAt(now);
            document.setPublishDate(PUBLISH_DATE.format(now));
            document.setPublishTime(PUBLISH_TIME.format(now));
            document.setPublishedSetId(setId);
        }
        logger.info("Published week {} as {} ({} documents) by {}", weekStart, setId, drafts.size(), publishedBy);
        return drafts.stream().map(RotaDocumentDto::from).toList();
    }

    @Transactional
    public RotaDocumentDto archiveDocument(Long rotaId) {
        RotaDocument document = documentRepository.findById(rotaId)
                .orElseThrow(() -> new RotaNotFoundException("Rota", rotaId));
        if (document.getStatus() != RotaStatus.PUBLISHED) {
            throw new RotaStateException("Only a published rota can be archived; rota " + rotaId
                    + " is " + document.getStatus());
        }
        document.setStatus(RotaStatus.ARCHIVED);
        logger.info("Archived rota {} ({})", rotaId, document.getDate());
        return RotaDocumentDto.from(document);
    }

    @Transactional
    public List<RotaDocumentDto> archiveWeek(LocalDate weekStart) {
        List<RotaDocument> published = documentRepository.findByWeekStartAndStatusOrderByDateAsc(weekStart, RotaStatus.PUBLISHED);
        if (published.isEmpty()) {
            throw new RotaStateException("Week " + weekStart + " has no published rota to archive");
        }
        published.forEach(d -> d.setStatus(RotaStatus.ARCHIVED));
        logger.info("Archived week {} ({} documents)", weekStart, published.size());
        return published.stream().map(RotaDocumentDto::from).toList();
    }

    public LocalDate defaultCutoff() {
        return LocalDate.now(clock).minusMonths(retentionMonths);
    }

    /**
     * Deletes draft documents dated before {@code cutoff}. Published and archived
     * documents are never touched. Each document is deleted in its own transaction so
     * one failure does not stop the sweep.
     */
    public SweepResult sweepStaleDrafts(LocalDate cutoff) {
        LocalDate effective = cutoff != null ? cutoff : defaultCutoff();
        List<Long> staleIds = transactionTemplate.execute(status ->
                documentRepository.findByStatusAndDateBefore(RotaStatus.DRAFT, effective).stream()
                        .map(RotaDocument::getId)
                        .toList());
        int deleted = 0;
        int failed = 0;
        for (Long id : staleIds == null ? List.<Long>of() : staleIds) {
            try {
                transactionTemplate.executeWithoutResult(status ->
                        documentRepository.findById(id)
                                .filter(d -> d.getStatus() == RotaStatus.DRAFT)
                                .ifPresent(documentRepository::delete));
                deleted++;
            } catch (RuntimeException e) {
                failed++;
                logger.warn("Failed to delete stale draft {}", id, e);
                errorLogBuffer.addError("Stale draft sweep failed for rota " + id, e);
            }
        }
        logger.info("Stale draft sweep before {}: {} deleted, {} failed", effective, deleted, failed);
        return new SweepResult(effective, deleted, failed);
    }

    /**
     * Permanently removes archived documents, optionally limited to one week and / or to
     * dates before {@code beforeDate}. Requires {@link #DELETE_ARCHIVED_CONFIRMATION}.
     */
    @Transactional
    public int deleteArchived(LocalDate weekStart, LocalDate beforeDate, String confirmation) {
        if (!DELETE_ARCHIVED_CONFIRMATION.equals(confirmation)) {
            throw new RotaPreconditionException("Deleting archived rotas requires the confirmation token");
        }
        if (weekStart != null && weekStart.getDayOfWeek() != DayOfWeek.MONDAY) {
            throw new RotaPreconditionException("Week start must be a Monday: " + weekStart);
        }
        List<RotaDocument> archived = documentRepository.findArchived(weekStart, beforeDate);
        documentRepository.deleteAll(archived);
        logger.info("Deleted {} archived documents (week={}, before={})", archived.size(), weekStart, beforeDate);
        return archived.size();
    }
}

package com.example.pharmacyrota.lifecycle;

import com.example.pharmacyrota.configuration.RotaConfigurationRepository;
import com.example.pharmacyrota.configuration.RotaConfigurationRequest;
import com.example.pharmacyrota.configuration.RotaConfigurationService;
import com.example.pharmacyrota.exception.RotaNotFoundException;
import com.example.pharmacyrota.exception.RotaPreconditionException;
import com.example.pharmacyrota.exception.RotaStateException;
import com.example.pharmacyrota.rota.RotaDocument;
import com.example.pharmacyrota.rota.RotaDocumentDto;
import com.example.pharmacyrota.rota.RotaDocumentRepository;
import com.example.pharmacyrota.rota.RotaStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.transaction.annotation.Transactional;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.List;
import java.util.Set;

import static com.example.pharmacyrota.RotaTestData.MONDAY;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@Transactional
class RotaLifecycleServiceTest {

    @Autowired
    private RotaLifecycleService lifecycleService;

    @Autowired
    private RotaConfigurationService configurationService;

    @Autowired
    private RotaDocumentRepository documentRepository;

    @Autowired
    private RotaConfigurationRepository configurationRepository;

    @BeforeEach
    void setUp() {
        documentRepository.deleteAll();
        configurationRepository.deleteAll();
    }

    @Test
    void weekState_followsTheDocuments() {
        assertThat(lifecycleService.stateOf(MONDAY)).isEqualTo(WeekState.NONE);

        configurationService.save(MONDAY, configuration(), "planner");
        assertThat(lifecycleService.stateOf(MONDAY)).isEqualTo(WeekState.CONFIGURING);

        draftWeek(MONDAY);
        assertThat(lifecycleService.stateOf(MONDAY)).isEqualTo(WeekState.DRAFT);

        lifecycleService.publish(MONDAY, "lead.pharmacist");
        assertThat(lifecycleService.stateOf(MONDAY)).isEqualTo(WeekState.PUBLISHED);

        lifecycleService.archiveWeek(MONDAY);
        assertThat(lifecycleService.stateOf(MONDAY)).isEqualTo(WeekState.ARCHIVED);
    }

    @Test
    void publish_stampsEveryDraftWithOneSetId() {
        draftWeek(MONDAY);

        List<RotaDocumentDto> published = lifecycleService.publish(MONDAY, "lead.pharmacist");

        assertThat(published).hasSize(7);
        assertThat(published).extracting(RotaDocumentDto::publishedSetId).containsOnly(published.get(0).publishedSetId());
        assertThat(published.get(0).publishedSetId()).startsWith(MONDAY + "-");
        assertThat(published).allSatisfy(d -> {
            assertThat(d.status()).isEqualTo(RotaStatus.PUBLISHED);
            assertThat(d.publishedBy()).isEqualTo("lead.pharmacist");
            assertThat(d.publishedAt()).isNotNull();
            assertThat(d.publishDate()).matches("\\d{2}/\\d{2}/\\d{4}");
            assertThat(d.publishTime()).matches("\\d{2}:\\d{2}");
        });
    }

    @Test
    void publish_withoutDrafts_isRejected() {
        assertThatThrownBy(() -> lifecycleService.publish(MONDAY, "lead.pharmacist"))
                .isInstanceOf(RotaStateException.class);
    }

    @Test
    void publish_needsAPublisher() {
        draftWeek(MONDAY);

        assertThatThrownBy(() -> lifecycleService.publish(MONDAY, " "))
                .isInstanceOf(RotaPreconditionException.class);
    }

    @Test
    void archiveDocument_touchesOnlyThatDate() {
        List<RotaDocument> week = draftWeek(MONDAY);
        lifecycleService.publish(MONDAY, "lead.pharmacist");

        RotaDocumentDto archived = lifecycleService.archiveDocument(week.get(2).getId());

        assertThat(archived.status()).isEqualTo(RotaStatus.ARCHIVED);
        assertThat(documentRepository.findByWeekStartOrderByDateAsc(MONDAY))
                .filteredOn(d -> d.getStatus() == RotaStatus.PUBLISHED)
                .hasSize(6);
        assertThat(lifecycleService.stateOf(MONDAY)).isEqualTo(WeekState.PUBLISHED);
    }

    @Test
    void archiveDocument_ofADraft_isRejected() {
        List<RotaDocument> week = draftWeek(MONDAY);

        assertThatThrownBy(() -> lifecycleService.archiveDocument(week.get(0).getId()))
                .isInstanceOf(RotaStateException.class);
        assertThatThrownBy(() -> lifecycleService.archiveDocument(123_456L))
                .isInstanceOf(RotaNotFoundException.class);
    }

    @Test
    void archiveWeek_withNothingPublished_isRejected() {
        draftWeek(MONDAY);

        assertThatThrownBy(() -> lifecycleService.archiveWeek(MONDAY))
                .isInstanceOf(RotaStateException.class);
    }

    @Test
    void publishedWeek_cannotBeRegenerated() {
        draftWeek(MONDAY);
        lifecycleService.ensureRegenerable(MONDAY);
        lifecycleService.publish(MONDAY, "lead.pharmacist");

        assertThatThrownBy(() -> lifecycleService.ensureRegenerable(MONDAY))
                .isInstanceOf(RotaStateException.class);
    }

    @Test
    void sweep_deletesOnlyDraftsOlderThanTheCutoff() {
        LocalDate february = LocalDate.of(2024, 2, 5);
        RotaDocument oldDraft = save(february, february, RotaStatus.DRAFT);
        RotaDocument oldPublished = save(february.plusDays(1), february, RotaStatus.PUBLISHED);
        RotaDocument oldArchived = save(february.plusDays(2), february, RotaStatus.ARCHIVED);
        RotaDocument recentDraft = save(MONDAY, MONDAY, RotaStatus.DRAFT);

        SweepResult result = lifecycleService.sweepStaleDrafts(LocalDate.of(2024, 3, 1));

        assertThat(result.deleted()).isEqualTo(1);
        assertThat(result.failed()).isZero();
        assertThat(documentRepository.findById(oldDraft.getId())).isEmpty();
        assertThat(documentRepository.findAllById(List.of(oldPublished.getId(), oldArchived.getId(), recentDraft.getId())))
                .hasSize(3);
    }

    @Test
    void sweep_withoutCutoff_usesTheRetentionPeriod() {
        SweepResult result = lifecycleService.sweepStaleDrafts(null);

        assertThat(result.cutoff()).isEqualTo(lifecycleService.defaultCutoff());
        assertThat(result.deleted()).isZero();
    }

    @Test
    void deleteArchived_requiresTheConfirmationToken() {
        save(MONDAY, MONDAY, RotaStatus.ARCHIVED);
        save(MONDAY.plusDays(1), MONDAY, RotaStatus.PUBLISHED);

        assertThatThrownBy(() -> lifecycleService.deleteArchived(MONDAY, null, "yes"))
                .isInstanceOf(RotaPreconditionException.class);
        assertThat(documentRepository.count()).isEqualTo(2);

        int deleted = lifecycleService.deleteArchived(MONDAY, null, RotaLifecycleService.DELETE_ARCHIVED_CONFIRMATION);

        assertThat(deleted).isEqualTo(1);
        assertThat(documentRepository.findAll()).extracting(RotaDocument::getStatus).containsExactly(RotaStatus.PUBLISHED);
    }

    @Test
    void deleteArchived_beforeDate_keepsLaterWeeks() {
        LocalDate april = LocalDate.of(2024, 4, 1);
        save(april, april, RotaStatus.ARCHIVED);
        save(MONDAY, MONDAY, RotaStatus.ARCHIVED);

        int deleted = lifecycleService.deleteArchived(null, LocalDate.of(2024, 5, 1),
                RotaLifecycleService.DELETE_ARCHIVED_CONFIRMATION);

        assertThat(deleted).isEqualTo(1);
        assertThat(documentRepository.findAll()).extracting(RotaDocument::getDate).containsExactly(MONDAY);
    }

    @Test
    void clearDrafts_returnsTheWeekToConfiguring() {
        configurationService.save(MONDAY, configuration(), "planner");
        draftWeek(MONDAY);

        int cleared = lifecycleService.clearDrafts(MONDAY);

        assertThat(cleared).isEqualTo(7);
        assertThat(lifecycleService.week(MONDAY).state()).isEqualTo(WeekState.CONFIGURING);
        assertThat(configurationService.find(MONDAY).orElseThrow().generated()).isFalse();
    }

    private RotaConfigurationRequest configuration() {
        return new RotaConfigurationRequest(List.of(1L, 2L), Set.of(DayOfWeek.MONDAY), List.of(),
                null, null, null, null, null, "planner");
    }

    private List<RotaDocument> draftWeek(LocalDate weekStart) {
        for (int i = 0; i < 7; i++) {
            save(weekStart.plusDays(i), weekStart, RotaStatus.DRAFT);
        }
        return documentRepository.findByWeekStartOrderByDateAsc(weekStart);
    }

    private RotaDocument save(LocalDate date, LocalDate weekStart, RotaStatus status) {
        RotaDocument document = new RotaDocument(date, weekStart);
        document.setStatus(status);
        return documentRepository.save(document);
    }
}

package com.example.pharmacyrota.rota;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;

@Repository
public interface RotaDocumentRepository extends JpaRepository<RotaDocument, Long> {

    List<RotaDocument> findByWeekStartOrderByDateAsc(LocalDate weekStart);

    List<RotaDocument> findByWeekStartAndStatusOrderByDateAsc(LocalDate weekStart, RotaStatus status);

    List<RotaDocument> findByWeekStartAndStatusInOrderByDateAsc(LocalDate weekStart, Collection<RotaStatus> statuses);

    List<RotaDocument> findByStatusAndDateBefore(RotaStatus status, LocalDate cutoff);

    boolean existsByWeekStartAndStatus(LocalDate weekStart, RotaStatus status);

    /**
     * Archived documents, optionally limited to one week and / or to dates before a cutoff.
     */
    @Query("SELECT r FROM RotaDocument r WHERE r.status = com.example.pharmacyrota.rota.RotaStatus.ARCHIVED " +
           "AND (:weekStart IS NULL OR r.weekStart = :weekStart) " +
           "AND (:beforeDate IS NULL OR r.date < :beforeDate) " +
           "ORDER BY r.date ASC")
    List<RotaDocument> findArchived(@Param("weekStart") LocalDate weekStart,
                                    @Param("beforeDate") LocalDate beforeDate);
}

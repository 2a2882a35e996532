package com.example.pharmacyrota.reassignment;

import com.example.pharmacyrota.common.TimeWindow;
import com.example.pharmacyrota.common.error.ErrorLogBuffer;
import com.example.pharmacyrota.conflict.ConflictDetector;
import com.example.pharmacyrota.exception.BusinessException;
import com.example.pharmacyrota.exception.RotaNotFoundException;
import com.example.pharmacyrota.exception.RotaPreconditionException;
import com.example.pharmacyrota.exception.RotaStateException;
import com.example.pharmacyrota.exception.StaleReferenceException;
import com.example.pharmacyrota.rota.Assignment;
import com.example.pharmacyrota.rota.AssignmentDto;
import com.example.pharmacyrota.rota.AssignmentType;
import com.example.pharmacyrota.rota.CoverageTarget;
import com.example.pharmacyrota.rota.RotaDocument;
import com.example.pharmacyrota.rota.RotaDocumentRepository;
import com.example.pharmacyrota.rota.RotaStatus;
import com.example.pharmacyrota.staff.StaffDirectory;
import com.example.pharmacyrota.staff.StaffSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Replaces staff on existing rota documents.
 * <p>
 * Every date is edited on a working copy of its rows, validated, and only then written
 * back, in its own transaction. Week-scope requests therefore apply date by date and
 * report an outcome per date; nothing is rolled back across dates. The conflict
 * detector runs again on each document that changed.
 */
@Service
public class ReassignmentService {

    private static final Logger logger = LoggerFactory.getLogger(ReassignmentService.class);

    private final RotaDocumentRepository documentRepository;
    private final GranularityNormalizer normalizer;
    private final ConflictDetector conflictDetector;
    private final StaffDirectory staffDirectory;
    private final ErrorLogBuffer errorLogBuffer;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;
    private final Set<String> continuityLocations;

    public ReassignmentService(RotaDocumentRepository documentRepository,
                               GranularityNormalizer normalizer,
                               ConflictDetector conflictDetector,
                               StaffDirectory staffDirectory,
                               ErrorLogBuffer errorLogBuffer,
                               PlatformTransactionManager transactionManager,
                               Clock clock,
                               @Value("${rota.continuity.locations:EAU}") String continuityLocations) {
        this.documentRepository = documentRepository;
        this.normalizer = normalizer;
        this.conflictDetector = conflictDetector;
        this.staffDirectory = staffDirectory;
        this.errorLogBuffer = errorLogBuffer;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.clock = clock;
        this.continuityLocations = Arrays.stream(continuityLocations.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .map(s -> s.toUpperCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    public ReassignmentResult reassign(ReassignmentRequest request) {
        validate(request);
        return switch (request.scope()) {
            case SLOT -> single(request.date(), () -> applySlot(request));
            case DAY -> single(request.date(), () -> applyDay(request, request.date(), true));
            case WEEK -> applyWeek(request);
        };
    }

    /**
     * Both directions are worked out from the rows as they were before the swap and
     * written together.
     */
    public ReassignmentResult swap(SwapRequest request) {
        if (Objects.equals(request.sourceStaffId(), request.targetStaffId())) {
            throw new RotaPreconditionException("Source and target staff must differ");
        }
        staffDirectory.require(request.sourceStaffId());
        if (request.targetStaffId() != null) {
            staffDirectory.require(request.targetStaffId());
        }
        return single(request.date(), () -> applySwap(request));
    }

    private void validate(ReassignmentRequest request) {
        if (Objects.equals(request.originalStaffId(), request.newStaffId())) {
            throw new RotaPreconditionException("New staff member is already the original staff member");
        }
        if (request.scope() == ReassignmentScope.SLOT) {
            if (request.location() == null || request.startTime() == null) {
                throw new RotaPreconditionException("Slot reassignment needs a location and a start time");
            }
        } else if (request.originalStaffId() == null) {
            throw new RotaPreconditionException("Day and week reassignment need the original staff member");
        }
        staffDirectory.require(request.newStaffId());
    }

    private ReassignmentResult single(LocalDate date, DateWork work) {
        DateResult result = transactionTemplate.execute(status -> work.apply());
        if (result == null) {
            throw new IllegalStateException("No result for " + date);
        }
        return new ReassignmentResult(result.outcome().isApplied(), List.of(result.outcome()), result.rows());
    }

    private ReassignmentResult applyWeek(ReassignmentRequest request) {
        LocalDate weekStart = request.date().with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
        List<DateOutcome> outcomes = new ArrayList<>();
        List<AssignmentDto> rows = new ArrayList<>();
        for (int i = 0; i < 7; i++) {
            LocalDate date = weekStart.plusDays(i);
            DateResult result;
            try {
                result = transactionTemplate.execute(status -> {
                    try {
                        return applyDay(request, date, false);
                    } catch (BusinessException e) {
                        logger.warn("Week reassignment rejected on {}: {}", date, e.getMessage());
                        errorLogBuffer.addFailure("Week reassignment rejected on " + date, e.getMessage());
                        return new DateResult(DateOutcome.rejected(date, null, e.getMessage()), List.of());
                    }
                });
            } catch (RuntimeException e) {
                logger.warn("Week reassignment failed on {}", date, e);
                errorLogBuffer.addError("Week reassignment failed on " + date, e);
                result = new DateResult(DateOutcome.failed(date, null, e.getMessage()), List.of());
            }
            if (result != null) {
                outcomes.add(result.outcome());
                rows.addAll(result.rows());
            }
        }
        boolean anyApplied = outcomes.stream().anyMatch(DateOutcome::isApplied);
        boolean anyFailed = outcomes.stream().anyMatch(o -> o.status() == DateOutcome.Status.REJECTED
                || o.status() == DateOutcome.Status.FAILED);
        logger.info("Week reassignment {} -> {} from {}: {}", request.originalStaffId(), request.newStaffId(),
                weekStart, outcomes.stream().map(o -> o.date() + "=" + o.status()).toList());
        return new ReassignmentResult(anyApplied && !anyFailed, outcomes, rows);
    }

    private DateResult applySlot(ReassignmentRequest request) {
        LocalDate date = request.date();
        RotaDocument document = resolveDocument(request.rotaIdsByDate(), date)
                .orElseThrow(() -> new RotaNotFoundException("No rota for " + date));
        ensureEditable(document);

        List<Assignment> working = copyRows(document);
        Assignment slot = locateSlot(working, request.location(), request.originalStaffId(),
                request.startTime(), request.endTime());
        if (slot == null) {
            if (request.originalStaffId() != null) {
                throw missingSlot(working, request.location(), request.originalStaffId(), date, request.startTime());
            }
            slot = createSlot(document, request.location(), request.startTime(), request.endTime(), request.type());
            working.add(slot);
        }
        slot.setStaffId(request.newStaffId());
        Set<Assignment> changed = identitySet();
        changed.add(slot);
        checkNoDoubleBooking(working, request.newStaffId(), changed, date);
        checkNoSplitDuty(working, request.newStaffId(), changed, date);

        write(document, working);
        logger.info("Slot reassignment on rota {} ({} {} {}): {} -> {}", document.getId(), date,
                request.location(), slot.window(), request.originalStaffId(), request.newStaffId());
        return new DateResult(DateOutcome.applied(date, document.getId(), 1), rowsOf(document));
    }

    /**
     * @param strict when the date has nothing to change, throw instead of reporting it
     */
    private DateResult applyDay(ReassignmentRequest request, LocalDate date, boolean strict) {
        Optional<RotaDocument> found = resolveDocument(request.rotaIdsByDate(), date);
        if (found.isEmpty()) {
            if (strict) {
                throw new RotaNotFoundException("No rota for " + date);
            }
            return new DateResult(DateOutcome.noMatch(date, null, "No rota for " + date), List.of());
        }
        RotaDocument document = found.get();
        TimeWindow window = filterWindow(request);

        List<Assignment> working = copyRows(document);
        Set<Assignment> changed = selectDayRows(working, request.originalStaffId(), request.location(),
                window, request.respectSpecialContinuity());
        if (changed.isEmpty()) {
            String message = "No assignment for staff " + request.originalStaffId()
                    + (request.location() != null ? " at " + request.location() : "") + " on " + date;
            if (strict) {
                throw new RotaNotFoundException(message);
            }
            return new DateResult(DateOutcome.noMatch(date, document.getId(), message), List.of());
        }
        ensureEditable(document);
        changed.forEach(a -> a.setStaffId(request.newStaffId()));
        checkNoDoubleBooking(working, request.newStaffId(), changed, date);
        checkNoSplitDuty(working, request.newStaffId(), changed, date);

        write(document, working);
        logger.info("Day reassignment on rota {} ({}): {} -> {}, {} rows", document.getId(), date,
                request.originalStaffId(), request.newStaffId(), changed.size());
        return new DateResult(DateOutcome.applied(date, document.getId(), changed.size()), rowsOf(document));
    }

    private DateResult applySwap(SwapRequest request) {
        LocalDate date = request.date();
        RotaDocument document = resolveDocument(request.rotaIdsByDate(), date)
                .orElseThrow(() -> new RotaNotFoundException("No rota for " + date));
        ensureEditable(document);

        List<Assignment> working = copyRows(document);
        Assignment source = locateSlot(working, request.sourceLocation(), request.sourceStaffId(),
                request.sourceStartTime(), request.sourceEndTime());
        if (source == null) {
            throw missingSlot(working, request.sourceLocation(), request.sourceStaffId(), date, request.sourceStartTime());
        }
        Assignment target = locateSlot(working, request.targetLocation(), request.targetStaffId(),
                request.targetStartTime(), request.targetEndTime());
        if (target == null) {
            if (request.targetStaffId() != null) {
                throw missingSlot(working, request.targetLocation(), request.targetStaffId(), date, request.targetStartTime());
            }
            target = createSlot(document, request.targetLocation(), request.targetStartTime(),
                    request.targetEndTime(), request.targetType());
            working.add(target);
        }
        if (source == target) {
            throw new RotaPreconditionException("Source and target address the same slot");
        }

        source.setStaffId(request.targetStaffId());
        target.setStaffId(request.sourceStaffId());

        Set<Assignment> intoTarget = identitySet();
        intoTarget.add(target);
        checkNoDoubleBooking(working, request.sourceStaffId(), intoTarget, date);
        checkNoSplitDuty(working, request.sourceStaffId(), intoTarget, date);
        if (request.targetStaffId() != null) {
            Set<Assignment> intoSource = identitySet();
            intoSource.add(source);
            checkNoDoubleBooking(working, request.targetStaffId(), intoSource, date);
            checkNoSplitDuty(working, request.targetStaffId(), intoSource, date);
        }

        write(document, working);
        logger.info("Swap on rota {} ({}): {} at {} {} <-> {} at {} {}", document.getId(), date,
                request.sourceStaffId(), source.getLocation(), source.window(),
                request.targetStaffId(), target.getLocation(), target.window());
        return new DateResult(DateOutcome.applied(date, document.getId(), 2), rowsOf(document));
    }

    /**
     * The row at {@code location} held by {@code staffId} (null for an open slot) that
     * starts at {@code start}. When only a longer row covers {@code start}, that row is
     * split in {@code working} and the matching piece is returned.
     */
    Assignment locateSlot(List<Assignment> working, String location, Long staffId,
                          LocalTime start, LocalTime end) {
        for (Assignment row : working) {
            if (row.getLocation().equals(location) && row.isHeldBy(staffId)
                    && row.getStartTime().equals(start)
                    && (end == null || row.getEndTime().equals(end))) {
                return row;
            }
        }
        for (Assignment row : working) {
            if (!row.getLocation().equals(location) || !row.isHeldBy(staffId)) {
                continue;
            }
            if (start.isBefore(row.getStartTime()) || !start.isBefore(row.getEndTime())) {
                continue;
            }
            TimeWindow requested = normalizer.requestedWindow(row, start, end);
            List<Assignment> pieces = normalizer.normalizeGranularity(row, requested);
            replaceRow(working, row, pieces);
            for (Assignment piece : pieces) {
                if (piece.window().equals(requested)) {
                    return piece;
                }
            }
        }
        return null;
    }

    private Set<Assignment> selectDayRows(List<Assignment> working, Long staffId, String location,
                                          TimeWindow window, boolean respectContinuity) {
        List<Assignment> matched = new ArrayList<>();
        for (Assignment row : working) {
            if (row.isHeldBy(staffId)
                    && (location == null || row.getLocation().equals(location))
                    && (window == null || row.window().overlaps(window))) {
                matched.add(row);
            }
        }
        Set<Assignment> selected = identitySet();
        for (Assignment row : matched) {
            if (respectContinuity && isContinuitySensitive(row)) {
                selected.addAll(contiguousBlock(working, row));
            } else if (window != null && !window.contains(row.window())) {
                TimeWindow part = TimeWindow.of(
                        later(row.getStartTime(), window.start()),
                        earlier(row.getEndTime(), window.end()));
                List<Assignment> pieces = normalizer.normalizeGranularity(row, part);
                replaceRow(working, row, pieces);
                pieces.stream().filter(p -> p.window().equals(part)).forEach(selected::add);
            } else {
                selected.add(row);
            }
        }
        return selected;
    }

    /** Rows of the same holder at the same location that touch {@code seed}, directly or through each other. */
    private Set<Assignment> contiguousBlock(List<Assignment> working, Assignment seed) {
        Set<Assignment> block = identitySet();
        block.add(seed);
        boolean grew = true;
        while (grew) {
            grew = false;
            for (Assignment row : working) {
                if (block.contains(row) || !row.isHeldBy(seed.getStaffId())
                        || !row.getLocation().equals(seed.getLocation())) {
                    continue;
                }
                if (block.stream().anyMatch(b -> b.window().adjoins(row.window()))) {
                    block.add(row);
                    grew = true;
                }
            }
        }
        return block;
    }

    boolean isContinuitySensitive(Assignment row) {
        return row.isContinuitySensitive()
                || continuityLocations.contains(row.getLocation().toUpperCase(Locale.ROOT));
    }

    private Assignment createSlot(RotaDocument document, String location, LocalTime start, LocalTime end,
                                  AssignmentType requestedType) {
        Optional<CoverageTarget> target = document.getCoverageTargets().stream()
                .filter(t -> t.getLocation().equals(location))
                .filter(t -> !start.isBefore(t.getStartTime()) && start.isBefore(t.getEndTime()))
                .findFirst();
        Optional<Assignment> sibling = document.getAssignments().stream()
                .filter(a -> a.getLocation().equals(location))
                .findFirst();
        AssignmentType type = target.map(CoverageTarget::getType)
                .or(() -> sibling.map(Assignment::getType))
                .orElse(requestedType);
        if (type == null) {
            throw new RotaPreconditionException("Unknown location " + location + "; an assignment type is required");
        }
        LocalTime slotEnd = end != null ? end : target.map(CoverageTarget::getEndTime).orElse(null);
        if (slotEnd == null) {
            throw new RotaPreconditionException("An end time is required to open a new slot at " + location);
        }
        String category = sibling.map(Assignment::getCategory).orElse(type.name());
        Assignment created = new Assignment(null, type, location, document.getDate(), start, slotEnd, category);
        sibling.ifPresent(s -> {
            created.setSplitShareable(s.isSplitShareable());
            created.setContinuitySensitive(s.isContinuitySensitive());
            created.setDoNotSplit(s.isDoNotSplit());
            created.setItemKey(s.getItemKey());
        });
        target.map(CoverageTarget::getItemKey).ifPresent(created::setItemKey);
        return created;
    }

    private BusinessException missingSlot(List<Assignment> working, String location, Long staffId,
                                          LocalDate date, LocalTime start) {
        boolean heldThere = working.stream()
                .anyMatch(a -> a.getLocation().equals(location) && a.isHeldBy(staffId));
        if (heldThere) {
            return new StaleReferenceException("No stored row for staff " + staffId + " at " + location
                    + " on " + date + " covers " + start, location);
        }
        return new RotaNotFoundException("No assignment for staff " + staffId + " at " + location + " on " + date);
    }

    private void checkNoDoubleBooking(List<Assignment> working, Long staffId, Set<Assignment> changed, LocalDate date) {
        if (staffId == null) {
            return;
        }
        List<Assignment> held = working.stream().filter(a -> a.isHeldBy(staffId)).toList();
        for (Assignment moved : changed) {
            for (Assignment other : held) {
                if (other == moved || moved.isSplitShareable() || other.isSplitShareable()) {
                    continue;
                }
                if (moved.window().overlaps(other.window())) {
                    throw new RotaStateException("Staff " + staffId + " would be double booked on " + date + ": "
                            + moved.getLocation() + " " + moved.window() + " and "
                            + other.getLocation() + " " + other.window());
                }
            }
        }
    }

    private void checkNoSplitDuty(List<Assignment> working, Long staffId, Set<Assignment> changed, LocalDate date) {
        if (staffId == null) {
            return;
        }
        List<Assignment> held = working.stream().filter(a -> a.isHeldBy(staffId)).toList();
        for (Assignment moved : changed) {
            for (Assignment other : held) {
                if (other == moved || other.getLocation().equals(moved.getLocation())) {
                    continue;
                }
                if (moved.isDoNotSplit() || other.isDoNotSplit()) {
                    Assignment anchored = moved.isDoNotSplit() ? moved : other;
                    Assignment extra = anchored == moved ? other : moved;
                    throw new RotaStateException("Staff " + staffId + " holds " + anchored.getLocation()
                            + " on " + date + ", which cannot be split, and would also work "
                            + extra.getLocation() + " " + extra.window());
                }
            }
        }
    }

    private Optional<RotaDocument> resolveDocument(Map<LocalDate, Long> rotaIdsByDate, LocalDate date) {
        Long rotaId = rotaIdsByDate.get(date);
        if (rotaId != null) {
            RotaDocument document = documentRepository.findById(rotaId)
                    .orElseThrow(() -> new RotaNotFoundException("Rota", rotaId));
            if (!document.getDate().equals(date)) {
                throw new RotaPreconditionException("Rota " + rotaId + " is for " + document.getDate() + ", not " + date);
            }
            return Optional.of(document);
        }
        LocalDate weekStart = date.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
        return documentRepository.findByWeekStartOrderByDateAsc(weekStart).stream()
                .filter(d -> d.getDate().equals(date))
                .min(Comparator.comparing((RotaDocument d) -> d.getStatus() == RotaStatus.ARCHIVED)
                        .thenComparing(RotaDocument::getId));
    }

    private void ensureEditable(RotaDocument document) {
        if (!document.isEditable()) {
            throw new RotaStateException("Rota " + document.getId() + " for " + document.getDate()
                    + " is archived and cannot be changed");
        }
    }

    private void write(RotaDocument document, List<Assignment> working) {
        document.replaceAssignments(working);
        Set<Long> staffIds = working.stream()
                .map(Assignment::getStaffId)
                .filter(Objects::nonNull)
                .collect(Collectors.toSet());
        Map<Long, StaffSnapshot> staff = staffDirectory.snapshots(staffIds);
        document.replaceConflicts(conflictDetector.detect(document, staff));
        document.setLastEdited(LocalDateTime.now(clock));
        documentRepository.save(document);
    }

    private static TimeWindow filterWindow(ReassignmentRequest request) {
        if (request.startTime() == null && request.endTime() == null) {
            return null;
        }
        LocalTime start = request.startTime() != null ? request.startTime() : LocalTime.MIN;
        LocalTime end = request.endTime() != null ? request.endTime() : LocalTime.MAX;
        return TimeWindow.of(start, end);
    }

    private static List<Assignment> copyRows(RotaDocument document) {
        List<Assignment> copy = new ArrayList<>(document.getAssignments().size());
        document.getAssignments().forEach(a -> copy.add(a.copy()));
        return copy;
    }

    private static List<AssignmentDto> rowsOf(RotaDocument document) {
        return document.getAssignments().stream().map(a -> AssignmentDto.from(document.getId(), a)).toList();
    }

    private static void replaceRow(List<Assignment> working, Assignment row, List<Assignment> pieces) {
        for (int i = 0; i < working.size(); i++) {
            if (working.get(i) == row) {
                working.remove(i);
                working.addAll(i, pieces);
                return;
            }
        }
    }

    private static Set<Assignment> identitySet() {
        return Collections.newSetFromMap(new IdentityHashMap<>());
    }

    private static LocalTime later(LocalTime a, LocalTime b) {
        return a.isAfter(b) ? a : b;
    }

    private static LocalTime earlier(LocalTime a, LocalTime b) {
        return a.isBefore(b) ? a : b;
    }

    @FunctionalInterface
    private interface DateWork {
        DateResult apply();
    }

    private record DateResult(DateOutcome outcome, List<AssignmentDto> rows) {
    }
}

package com.example.pharmacyrota.reassignment;

import com.example.pharmacyrota.common.TimeWindow;
import com.example.pharmacyrota.exception.StaleReferenceException;
import com.example.pharmacyrota.rota.Assignment;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Reconciles an edit aimed at part of a day with a stored row that covers more of it.
 * The stored row is cut into at most three pieces around the requested window; the
 * pieces outside the window keep the stored staff and bounds.
 */
@Component
public class GranularityNormalizer {

    private final LocalTime halfDayBoundary;

    @Autowired
    public GranularityNormalizer(@Value("${rota.halfday.boundary:13:00}") String halfDayBoundary) {
        this(LocalTime.parse(halfDayBoundary));
    }

    public GranularityNormalizer(LocalTime halfDayBoundary) {
        this.halfDayBoundary = halfDayBoundary;
    }

    public LocalTime getHalfDayBoundary() {
        return halfDayBoundary;
    }

    /**
     * The window an edit refers to. Without an end time the edit covers the half of the
     * stored row that the start falls in.
     */
    public TimeWindow requestedWindow(Assignment stored, LocalTime start, LocalTime end) {
        if (end != null) {
            return TimeWindow.of(start, end);
        }
        if (!start.isBefore(stored.getEndTime())) {
            throw new StaleReferenceException(
                    "Stored row " + stored.getLocation() + " " + stored.window() + " ends before " + start,
                    stored.getLocation());
        }
        if (start.isBefore(halfDayBoundary) && stored.getEndTime().isAfter(halfDayBoundary)) {
            return TimeWindow.of(start, halfDayBoundary);
        }
        return TimeWindow.of(start, stored.getEndTime());
    }

    /**
     * Splits {@code stored} so that one piece matches {@code requested} exactly.
     *
     * @return the pieces in time order; a single element when the row already matches
     * @throws StaleReferenceException when the stored row does not cover the requested window
     */
    public List<Assignment> normalizeGranularity(Assignment stored, TimeWindow requested) {
        TimeWindow window = stored.window();
        if (!window.contains(requested)) {
            throw new StaleReferenceException(
                    "Stored row " + stored.getLocation() + " " + window + " does not cover " + requested,
                    stored.getLocation());
        }
        List<Assignment> pieces = new ArrayList<>(3);
        if (requested.start().isAfter(window.start())) {
            pieces.add(stored.withWindow(TimeWindow.of(window.start(), requested.start())));
        }
        pieces.add(stored.withWindow(requested));
        if (requested.end().isBefore(window.end())) {
            pieces.add(stored.withWindow(TimeWindow.of(requested.end(), window.end())));
        }
        return pieces;
    }
}

package com.example.pharmacyrota.rota;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.Objects;

/**
 * Identifier of a rota grid cell carrying free text.
 * <p>
 * The presentation layer keys cells as {@code type-location-YYYY-MM-DD-HH:mm-HH:mm}, or
 * {@code unavailable-YYYY-MM-DD-HH:mm-HH:mm} for whole-day notes. Location names may
 * contain hyphens, so keys are parsed from both ends: the first token is the kind, the
 * last five are the date and times, everything in between is the location.
 */
public record CellKey(String kind, String location, LocalDate date, LocalTime start, LocalTime end) {

    public static final String UNAVAILABLE = "unavailable";

    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HH:mm");
    private static final int TRAILING_TOKENS = 5;

    public CellKey {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(date, "date");
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        if (kind.isBlank() || kind.contains("-")) {
            throw new IllegalArgumentException("Invalid cell kind: " + kind);
        }
    }

    public static CellKey forAssignment(Assignment assignment) {
        return new CellKey(assignment.getType().name().toLowerCase(), assignment.getLocation(),
                assignment.getDate(), assignment.getStartTime(), assignment.getEndTime());
    }

    public static CellKey parse(String key) {
        if (key == null) {
            throw new IllegalArgumentException("Cell key is required");
        }
        String[] tokens = key.split("-", -1);
        if (tokens.length < TRAILING_TOKENS + 1) {
            throw new IllegalArgumentException("Malformed cell key: " + key);
        }
        int n = tokens.length;
        String kind = tokens[0];
        String location = n > TRAILING_TOKENS + 1
                ? String.join("-", Arrays.copyOfRange(tokens, 1, n - TRAILING_TOKENS))
                : null;
        try {
            LocalDate date = LocalDate.parse(tokens[n - 5] + "-" + tokens[n - 4] + "-" + tokens[n - 3]);
            LocalTime start = LocalTime.parse(tokens[n - 2], TIME);
            LocalTime end = LocalTime.parse(tokens[n - 1], TIME);
            return new CellKey(kind, location, date, start, end);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Malformed cell key: " + key, e);
        }
    }

    public String format() {
        StringBuilder sb = new StringBuilder(kind).append('-');
        if (location != null) {
            sb.append(location).append('-');
        }
        return sb.append(date).append('-')
                .append(TIME.format(start)).append('-')
                .append(TIME.format(end))
                .toString();
    }

    @Override
    public String toString() {
        return format();
    }
}

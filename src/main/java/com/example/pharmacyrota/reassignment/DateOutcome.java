package com.example.pharmacyrota.reassignment;

import java.time.LocalDate;

/**
 * What happened on one date of a reassignment. Dates are independent: an applied
 * date stays applied when a later one is rejected.
 */
public record DateOutcome(LocalDate date, Long rotaId, Status status, int changedRows, String message) {

    public enum Status {
        APPLIED,
        NO_MATCH,
        REJECTED,
        FAILED
    }

    public static DateOutcome applied(LocalDate date, Long rotaId, int changedRows) {
        return new DateOutcome(date, rotaId, Status.APPLIED, changedRows, null);
    }

    public static DateOutcome noMatch(LocalDate date, Long rotaId, String message) {
        return new DateOutcome(date, rotaId, Status.NO_MATCH, 0, message);
    }

    public static DateOutcome rejected(LocalDate date, Long rotaId, String message) {
        return new DateOutcome(date, rotaId, Status.REJECTED, 0, message);
    }

    public static DateOutcome failed(LocalDate date, Long rotaId, String message) {
        return new DateOutcome(date, rotaId, Status.FAILED, 0, message);
    }

    public boolean isApplied() {
        return status == Status.APPLIED;
    }
}

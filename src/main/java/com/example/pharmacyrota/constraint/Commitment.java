package com.example.pharmacyrota.constraint;

import com.example.pharmacyrota.common.TimeWindow;

/**
 * Something a staff member is already booked for on the date being evaluated.
 *
 * @param window     the time taken out of the day, travel included
 * @param coverStint a short cover stint (dispensary lunch cover) that a full-day
 *                   ward booking may run across
 */
public record Commitment(String location, TimeWindow window, boolean doNotSplit, boolean coverStint) {

    public Commitment(String location, TimeWindow window, boolean doNotSplit) {
        this(location, window, doNotSplit, false);
    }
}

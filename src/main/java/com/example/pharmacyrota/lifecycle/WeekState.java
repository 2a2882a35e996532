package com.example.pharmacyrota.lifecycle;

/**
 * Where a week sits in its lifecycle, derived from its configuration and documents.
 */
public enum WeekState {
    /** Nothing stored for the week. */
    NONE,
    CONFIGURING,
    DRAFT,
    PUBLISHED,
    ARCHIVED
}

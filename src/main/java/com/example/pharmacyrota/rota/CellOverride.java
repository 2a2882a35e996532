package com.example.pharmacyrota.rota;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * Free text typed into a rota cell, stored by the components of its {@link CellKey}.
 */
@Embeddable
public class CellOverride {

    @Column(name = "cell_kind", nullable = false)
    private String kind;

    @Column
    private String location;

    @Column(name = "cell_date", nullable = false)
    private LocalDate date;

    @Column(name = "start_time", nullable = false)
    private LocalTime startTime;

    @Column(name = "end_time", nullable = false)
    private LocalTime endTime;

    @Column(name = "cell_text", length = 2000)
    private String text;

    protected CellOverride() {
    }

    public CellOverride(CellKey key, String text) {
        this.kind = key.kind();
        this.location = key.location();
        this.date = key.date();
        this.startTime = key.start();
        this.endTime = key.end();
        this.text = text;
    }

    public CellKey key() {
        return new CellKey(kind, location, date, startTime, endTime);
    }

    public String getText() {
        return text;
    }
}

package com.example.pharmacyrota.lifecycle;

import java.time.LocalDate;

public record SweepResult(LocalDate cutoff, int deleted, int failed) {
}

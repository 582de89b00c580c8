package com.pharmanio.duty.ingestion.model;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Inclusive date range a roster applies to.
 */
public record ValidityPeriod(LocalDate start, LocalDate end) {

    public ValidityPeriod {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
    }

    @Override
    public String toString() {
        return start + " to " + end;
    }
}

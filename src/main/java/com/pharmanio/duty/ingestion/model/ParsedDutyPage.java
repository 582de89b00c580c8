package com.pharmanio.duty.ingestion.model;

import java.util.List;
import java.util.Optional;

public record ParsedDutyPage(Optional<ValidityPeriod> period, List<RawListing> listings) {

    public ParsedDutyPage {
        period = period == null ? Optional.empty() : period;
        listings = listings == null ? List.of() : List.copyOf(listings);
    }

    public static ParsedDutyPage empty() {
        return new ParsedDutyPage(Optional.empty(), List.of());
    }
}

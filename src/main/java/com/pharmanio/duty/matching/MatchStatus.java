package com.pharmanio.duty.matching;

public enum MatchStatus {
    MATCHED,
    // blank name or city token on the listing
    SKIPPED_INCOMPLETE,
    NO_CITY_COVERAGE,
    NO_CONFIDENT_MATCH
}

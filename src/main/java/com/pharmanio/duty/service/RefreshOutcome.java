package com.pharmanio.duty.service;

public enum RefreshOutcome {
    // roster still valid
    NOT_NEEDED,
    INGESTED,
    // another run was in flight
    SKIPPED_IN_FLIGHT,
    FAILED
}

package com.pharmanio.duty.service;

public enum ReconcileOutcome {
    CREATED,
    UPDATED,
    SKIPPED_NO_PERIOD
}

package com.pharmanio.duty.service;

public enum RosterState {
    NO_ROSTER,
    ROSTER_VALID,
    ROSTER_EXPIRED;

    public boolean needsIngest() {
        return this != ROSTER_VALID;
    }
}

package com.pharmanio.duty.service;

import com.pharmanio.common.exception.IngestionFailureReason;
import com.pharmanio.duty.ingestion.model.IngestionReport;

import java.util.Optional;

/**
 * Result of one expiry check.
 *
 * @param observedState roster state seen before any ingest, {@code null} when the check was skipped
 * @param outcome       what the check did
 * @param report        ingestion summary when a run completed
 * @param failureReason why the run aborted, when it did
 */
public record RefreshResult(RosterState observedState,
                            RefreshOutcome outcome,
                            Optional<IngestionReport> report,
                            Optional<IngestionFailureReason> failureReason) {

    static RefreshResult notNeeded(RosterState state) {
        return new RefreshResult(state, RefreshOutcome.NOT_NEEDED, Optional.empty(), Optional.empty());
    }

    static RefreshResult ingested(RosterState state, IngestionReport report) {
        return new RefreshResult(state, RefreshOutcome.INGESTED, Optional.of(report), Optional.empty());
    }

    static RefreshResult skippedInFlight() {
        return new RefreshResult(null, RefreshOutcome.SKIPPED_IN_FLIGHT, Optional.empty(), Optional.empty());
    }

    static RefreshResult failed(RosterState state, IngestionFailureReason reason) {
        return new RefreshResult(state, RefreshOutcome.FAILED, Optional.empty(), Optional.ofNullable(reason));
    }
}

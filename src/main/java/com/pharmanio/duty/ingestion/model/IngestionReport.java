package com.pharmanio.duty.ingestion.model;

import com.pharmanio.duty.matching.MatchResult;
import com.pharmanio.duty.service.ReconcileOutcome;

import java.time.Instant;
import java.util.List;

/**
 * Summary of one fetch, parse, match and reconcile run.
 */
public record IngestionReport(
        ValidityPeriod period,
        int totalListings,
        List<Long> matchedPharmacyIds,
        List<MatchResult> unmatched,
        ReconcileOutcome reconcileOutcome,
        Instant completedAt
) {

    public IngestionReport {
        matchedPharmacyIds = matchedPharmacyIds == null ? List.of() : List.copyOf(matchedPharmacyIds);
        unmatched = unmatched == null ? List.of() : List.copyOf(unmatched);
    }

    public int matchedCount() {
        return matchedPharmacyIds.size();
    }

    public boolean rosterWritten() {
        return reconcileOutcome == ReconcileOutcome.CREATED || reconcileOutcome == ReconcileOutcome.UPDATED;
    }
}

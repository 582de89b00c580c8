package com.pharmanio.duty.service;

import com.pharmanio.common.exception.IngestionFailureException;
import com.pharmanio.duty.domain.roster.OnDutyRoster;
import com.pharmanio.duty.ingestion.model.ValidityPeriod;
import com.pharmanio.duty.repository.OnDutyRosterRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;

/**
 * Owns writes to the singleton on-duty roster.
 */
@Slf4j
@Service
public class RosterReconciler {

    private final OnDutyRosterRepository rosterRepository;
    private final Clock clock;

    public RosterReconciler(OnDutyRosterRepository rosterRepository, Clock clock) {
        this.rosterRepository = rosterRepository;
        this.clock = clock;
    }

    /**
     * Writes period and ids to the roster row, creating it on first use. Nothing is written
     * without a period: a stale roster is kept rather than one with an unknown window.
     *
     * @throws IngestionFailureException with reason RECONCILE_FAILED when the write fails;
     *         the transaction is rolled back and the previous roster stays visible
     */
    @Transactional
    public ReconcileOutcome reconcile(ValidityPeriod period, Collection<Long> pharmacyIds) {
        if (period == null) {
            log.warn("Could not extract valid date range, skipping roster update");
            return ReconcileOutcome.SKIPPED_NO_PERIOD;
        }

        List<Long> ids = dedupe(pharmacyIds);
        Instant now = clock.instant();

        try {
            Optional<OnDutyRoster> existing = rosterRepository.findFirstByOrderByIdAsc();
            if (existing.isPresent()) {
                OnDutyRoster roster = existing.get();
                roster.replace(period, ids, now);
                rosterRepository.saveAndFlush(roster);
                log.info("Updated existing on-duty record with {} pharmacies ({})", ids.size(), period);
                return ReconcileOutcome.UPDATED;
            }

            OnDutyRoster roster = OnDutyRoster.builder()
                    .startDate(period.start())
                    .endDate(period.end())
                    .pharmacyIds(ids)
                    .createdAt(now)
                    .updatedAt(now)
                    .build();
            rosterRepository.saveAndFlush(roster);
            log.info("Created new on-duty record with {} pharmacies ({})", ids.size(), period);
            return ReconcileOutcome.CREATED;
        } catch (DataAccessException e) {
            throw IngestionFailureException.reconcileFailed("Failed to write on-duty roster: " + e.getMostSpecificCause().getMessage(), e);
        }
    }

    @Transactional(readOnly = true)
    public Optional<OnDutyRoster> currentRoster() {
        return rosterRepository.findFirstByOrderByIdAsc();
    }

    @Transactional(readOnly = true)
    public Optional<LocalDate> currentEndDate() {
        return rosterRepository.findFirstByOrderByIdAsc().map(OnDutyRoster::getEndDate);
    }

    static List<Long> dedupe(Collection<Long> ids) {
        if (ids == null) return List.of();
        LinkedHashSet<Long> unique = new LinkedHashSet<>();
        for (Long id : ids) {
            if (id != null) unique.add(id);
        }
        return new ArrayList<>(unique);
    }
}

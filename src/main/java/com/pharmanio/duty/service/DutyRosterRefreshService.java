package com.pharmanio.duty.service;

import com.pharmanio.common.exception.IngestionFailureException;
import com.pharmanio.duty.ingestion.DutyRosterIngestionService;
import com.pharmanio.duty.ingestion.model.IngestionReport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Decides when the roster must be re-ingested and runs the ingest.
 *
 * <p>Startup, the daily schedule and manual calls all go through {@link #ensureRosterFresh()} or
 * {@link #forceRefresh()}. At most one run is in progress at a time: a call that arrives while a
 * run is in flight returns {@link RefreshOutcome#SKIPPED_IN_FLIGHT} without touching the roster.
 * A failed run leaves the roster as it was and is not retried until the next trigger.</p>
 */
@Slf4j
@Service
public class DutyRosterRefreshService {

    private final RosterReconciler reconciler;
    private final DutyRosterIngestionService ingestionService;
    private final Clock clock;

    private final AtomicBoolean refreshInProgress = new AtomicBoolean(false);

    public DutyRosterRefreshService(RosterReconciler reconciler,
                                    DutyRosterIngestionService ingestionService,
                                    Clock clock) {
        this.reconciler = reconciler;
        this.ingestionService = ingestionService;
        this.clock = clock;
    }

    public RefreshResult ensureRosterFresh() {
        return runExclusive(false);
    }

    /**
     * Re-ingests regardless of the current roster's end date.
     */
    public RefreshResult forceRefresh() {
        return runExclusive(true);
    }

    public RosterState evaluate() {
        return evaluate(reconciler.currentEndDate(), LocalDate.now(clock));
    }

    static RosterState evaluate(Optional<LocalDate> endDate, LocalDate today) {
        if (endDate.isEmpty()) return RosterState.NO_ROSTER;
        return today.isAfter(endDate.get()) ? RosterState.ROSTER_EXPIRED : RosterState.ROSTER_VALID;
    }

    public boolean isRefreshInProgress() {
        return refreshInProgress.get();
    }

    private RefreshResult runExclusive(boolean force) {
        if (!refreshInProgress.compareAndSet(false, true)) {
            log.warn("On-duty refresh already running; ignoring concurrent trigger (force={})", force);
            return RefreshResult.skippedInFlight();
        }

        try {
            return checkAndIngest(force);
        } finally {
            refreshInProgress.set(false);
        }
    }

    private RefreshResult checkAndIngest(boolean force) {
        RosterState state = null;
        try {
            Optional<LocalDate> endDate = reconciler.currentEndDate();
            state = evaluate(endDate, LocalDate.now(clock));

            if (!state.needsIngest() && !force) {
                log.info("On-duty period still valid until {}", endDate.orElse(null));
                return RefreshResult.notNeeded(state);
            }

            switch (state) {
                case ROSTER_VALID -> log.info("Forced refresh of on-duty roster valid until {}", endDate.orElse(null));
                case ROSTER_EXPIRED -> log.info("On-duty period expired on {}, running scraper...", endDate.orElse(null));
                case NO_ROSTER -> log.info("No on-duty data found, running scraper...");
            }

            IngestionReport report = ingestionService.ingest();
            log.info("Scraper completed successfully ({} of {} listings matched)", report.matchedCount(), report.totalListings());
            return RefreshResult.ingested(state, report);
        } catch (IngestionFailureException e) {
            log.error("On-duty refresh failed ({}): {} {}", e.getReason(), e.getMessage(), e.getDetails(), e);
            return RefreshResult.failed(state, e.getReason());
        } catch (RuntimeException e) {
            log.error("Error in on-duty refresh", e);
            return RefreshResult.failed(state, null);
        }
    }
}

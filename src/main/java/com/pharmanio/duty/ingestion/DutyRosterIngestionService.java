package com.pharmanio.duty.ingestion;

import com.pharmanio.common.exception.IngestionFailureException;
import com.pharmanio.duty.ingestion.model.IngestionReport;
import com.pharmanio.duty.ingestion.model.ParsedDutyPage;
import com.pharmanio.duty.ingestion.model.RawListing;
import com.pharmanio.duty.ingestion.model.ValidityPeriod;
import com.pharmanio.duty.ingestion.source.DutyPublicationClient;
import com.pharmanio.duty.ingestion.source.DutySourceClient;
import com.pharmanio.duty.matching.MatchResult;
import com.pharmanio.duty.matching.PharmacyMatcher;
import com.pharmanio.duty.parser.DutyPageParser;
import com.pharmanio.duty.service.ReconcileOutcome;
import com.pharmanio.duty.service.RosterReconciler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * One full pass over the publication: fetch, parse, match every listing, reconcile the roster.
 *
 * <p>Only fetch and reconcile failures abort a run. Missing period, missing table and unmatched
 * listings are recorded in the {@link IngestionReport} and logged.</p>
 */
@Slf4j
@Service
public class DutyRosterIngestionService {

    private final DutyPublicationClient publicationClient;
    private final DutyPageParser parser;
    private final PharmacyMatcher matcher;
    private final RosterReconciler reconciler;
    private final Clock clock;

    public DutyRosterIngestionService(
            DutyPublicationClient publicationClient,
            DutyPageParser parser,
            PharmacyMatcher matcher,
            RosterReconciler reconciler,
            Clock clock
    ) {
        this.publicationClient = publicationClient;
        this.parser = parser;
        this.matcher = matcher;
        this.reconciler = reconciler;
        this.clock = clock;
    }

    public IngestionReport ingest() {
        log.info("Fetching on-duty pharmacies from {}", publicationClient.url());
        DutySourceClient.FetchedPage page = publicationClient.fetch();

        ParsedDutyPage parsed = parser.parse(page.body());
        List<RawListing> listings = parsed.listings();
        ValidityPeriod period = parsed.period().orElse(null);

        log.info("Searching for pharmacy matches in database ({} listings)...", listings.size());
        List<Long> matchedIds = new ArrayList<>();
        List<MatchResult> unmatched = new ArrayList<>();
        for (RawListing listing : listings) {
            MatchResult result = matcher.match(listing);
            if (result.isMatched()) {
                matchedIds.add(result.pharmacyId());
            } else {
                unmatched.add(result);
            }
        }

        ReconcileOutcome outcome = reconcile(period, matchedIds);

        IngestionReport report = new IngestionReport(
                period,
                listings.size(),
                matchedIds,
                unmatched,
                outcome,
                clock.instant()
        );

        log.info("Summary - Total: {}, Matched: {}, Period: {}, Roster: {}",
                report.totalListings(),
                report.matchedCount(),
                period == null ? "unknown" : period,
                outcome);
        return report;
    }

    private ReconcileOutcome reconcile(ValidityPeriod period, List<Long> matchedIds) {
        try {
            return reconciler.reconcile(period, matchedIds);
        } catch (IngestionFailureException e) {
            throw e;
        } catch (DataAccessException | TransactionException e) {
            throw IngestionFailureException.reconcileFailed("Failed to commit on-duty roster: " + e.getMessage(), e);
        }
    }
}

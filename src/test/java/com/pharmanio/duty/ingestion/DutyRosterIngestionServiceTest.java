package com.pharmanio.duty.ingestion;

import com.pharmanio.common.exception.IngestionFailureException;
import com.pharmanio.common.exception.IngestionFailureReason;
import com.pharmanio.duty.ingestion.model.IngestionReport;
import com.pharmanio.duty.ingestion.model.ParsedDutyPage;
import com.pharmanio.duty.ingestion.model.RawListing;
import com.pharmanio.duty.ingestion.model.ValidityPeriod;
import com.pharmanio.duty.ingestion.source.DutyPublicationClient;
import com.pharmanio.duty.ingestion.source.DutySourceClient;
import com.pharmanio.duty.matching.MatchResult;
import com.pharmanio.duty.matching.MatchStatus;
import com.pharmanio.duty.matching.PharmacyMatcher;
import com.pharmanio.duty.parser.DutyPageParser;
import com.pharmanio.duty.parser.HtmlDutyPageParser;
import com.pharmanio.duty.service.ReconcileOutcome;
import com.pharmanio.duty.service.RosterReconciler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.TransactionSystemException;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class DutyRosterIngestionServiceTest {

    private static final ValidityPeriod WEEK = new ValidityPeriod(LocalDate.of(2025, 1, 5), LocalDate.of(2025, 1, 11));
    private static final String TITLE = "<h1 class=\"text-center\">Pharmacies de garde du 05/01/2025 au 11/01/2025</h1>";

    private DutyPublicationClient publicationClient;
    private DutyPageParser parser;
    private PharmacyMatcher matcher;
    private RosterReconciler reconciler;
    private DutyRosterIngestionService service;

    @BeforeEach
    void setUp() {
        publicationClient = mock(DutyPublicationClient.class);
        parser = mock(DutyPageParser.class);
        matcher = mock(PharmacyMatcher.class);
        reconciler = mock(RosterReconciler.class);
        Clock clock = Clock.fixed(Instant.parse("2025-01-12T03:00:00Z"), ZoneOffset.UTC);

        service = new DutyRosterIngestionService(publicationClient, parser, matcher, reconciler, clock);

        when(publicationClient.url()).thenReturn("https://www.opham.com/urgence/pharmacie");
        when(publicationClient.fetch()).thenReturn(page("<html></html>"));
    }

    @Test
    void ingest_reconcilesMatchedIdsInListingOrder() {
        RawListing rina = listing("Pharmacie Rina", "TANA");
        RawListing xyz = listing("X Y Z", "TANA");
        RawListing gare = listing("Pharmacie de la Gare", "TAMATAVE");
        when(parser.parse("<html></html>")).thenReturn(new ParsedDutyPage(Optional.of(WEEK), List.of(rina, xyz, gare)));
        when(matcher.match(rina)).thenReturn(MatchResult.matched("Pharmacie Rina", "Antananarivo", 7L, 0.74));
        when(matcher.match(xyz)).thenReturn(MatchResult.noConfidentMatch("X Y Z", "Antananarivo", 0.2));
        when(matcher.match(gare)).thenReturn(MatchResult.matched("Pharmacie de la Gare", "Toamasina", 12L, 0.9));
        when(reconciler.reconcile(WEEK, List.of(7L, 12L))).thenReturn(ReconcileOutcome.UPDATED);

        IngestionReport report = service.ingest();

        verify(reconciler).reconcile(WEEK, List.of(7L, 12L));
        assertThat(report.period()).isEqualTo(WEEK);
        assertThat(report.totalListings()).isEqualTo(3);
        assertThat(report.matchedPharmacyIds()).containsExactly(7L, 12L);
        assertThat(report.unmatched()).extracting(MatchResult::status).containsExactly(MatchStatus.NO_CONFIDENT_MATCH);
        assertThat(report.unmatched()).extracting(MatchResult::bestRatio).containsExactly(0.2);
        assertThat(report.reconcileOutcome()).isEqualTo(ReconcileOutcome.UPDATED);
        assertThat(report.rosterWritten()).isTrue();
        assertThat(report.completedAt()).isEqualTo(Instant.parse("2025-01-12T03:00:00Z"));
    }

    @Test
    void ingest_pageWithoutTableUpdatesPeriodWithEmptyIdSet() {
        DutyRosterIngestionService withRealParser = new DutyRosterIngestionService(
                publicationClient, new HtmlDutyPageParser(), matcher, reconciler, Clock.systemUTC());
        when(publicationClient.fetch()).thenReturn(page("<html><body>" + TITLE + "</body></html>"));
        when(reconciler.reconcile(eq(WEEK), anyList())).thenReturn(ReconcileOutcome.UPDATED);

        IngestionReport report = withRealParser.ingest();

        verify(reconciler).reconcile(WEEK, List.of());
        verifyNoInteractions(matcher);
        assertThat(report.totalListings()).isZero();
        assertThat(report.period()).isEqualTo(WEEK);
    }

    @Test
    void ingest_missingPeriodIsPassedThroughAsSkippedUpdate() {
        RawListing rina = listing("Pharmacie Rina", "TANA");
        when(parser.parse(any())).thenReturn(new ParsedDutyPage(Optional.empty(), List.of(rina)));
        when(matcher.match(rina)).thenReturn(MatchResult.matched("Pharmacie Rina", "Antananarivo", 7L, 0.74));
        when(reconciler.reconcile(null, List.of(7L))).thenReturn(ReconcileOutcome.SKIPPED_NO_PERIOD);

        IngestionReport report = service.ingest();

        assertThat(report.period()).isNull();
        assertThat(report.reconcileOutcome()).isEqualTo(ReconcileOutcome.SKIPPED_NO_PERIOD);
        assertThat(report.rosterWritten()).isFalse();
    }

    @Test
    void ingest_fetchFailureAbortsBeforeParsing() {
        when(publicationClient.fetch()).thenThrow(IngestionFailureException.fetchFailed(
                "Download failed with status=503", Map.of("statusCode", 503)));

        assertThatThrownBy(() -> service.ingest())
                .isInstanceOf(IngestionFailureException.class)
                .extracting(e -> ((IngestionFailureException) e).getReason())
                .isEqualTo(IngestionFailureReason.FETCH_FAILED);

        verifyNoInteractions(parser, matcher, reconciler);
    }

    @Test
    void ingest_storageFailureIsReportedAsReconcileFailure() {
        when(parser.parse(any())).thenReturn(new ParsedDutyPage(Optional.of(WEEK), List.of()));
        when(reconciler.reconcile(WEEK, List.of())).thenThrow(new TransactionSystemException("commit failed"));

        assertThatThrownBy(() -> service.ingest())
                .isInstanceOf(IngestionFailureException.class)
                .extracting(e -> ((IngestionFailureException) e).getReason())
                .isEqualTo(IngestionFailureReason.RECONCILE_FAILED);
    }

    @Test
    void ingest_reconcileFailureFromReconcilerPropagatesUnchanged() {
        IngestionFailureException failure = IngestionFailureException.reconcileFailed(
                "Failed to write on-duty roster", new DataIntegrityViolationException("constraint"));
        when(parser.parse(any())).thenReturn(new ParsedDutyPage(Optional.of(WEEK), List.of()));
        when(reconciler.reconcile(WEEK, List.of())).thenThrow(failure);

        assertThatThrownBy(() -> service.ingest()).isSameAs(failure);
    }

    private static DutySourceClient.FetchedPage page(String body) {
        return new DutySourceClient.FetchedPage(body, "text/html; charset=utf-8", "https://www.opham.com/urgence/pharmacie", 200);
    }

    private static RawListing listing(String name, String city) {
        return new RawListing(name, city + " - Centre", city, List.of("034 00 000 00"));
    }
}

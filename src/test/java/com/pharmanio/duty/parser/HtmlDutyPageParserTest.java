package com.pharmanio.duty.parser;

import com.pharmanio.duty.ingestion.model.ParsedDutyPage;
import com.pharmanio.duty.ingestion.model.RawListing;
import com.pharmanio.duty.ingestion.model.ValidityPeriod;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class HtmlDutyPageParserTest {

    private final HtmlDutyPageParser parser = new HtmlDutyPageParser();

    @Test
    void parse_extractsPeriodAndListingsFromPublicationPage() throws IOException {
        ParsedDutyPage page = parser.parse(fixture("fixtures/duty-page.html"));

        assertThat(page.period()).contains(new ValidityPeriod(LocalDate.of(2025, 1, 5), LocalDate.of(2025, 1, 11)));

        List<RawListing> listings = page.listings();
        assertThat(listings).hasSize(4);

        RawListing rina = listings.get(0);
        assertThat(rina.name()).isEqualTo("Pharmacie Rina");
        assertThat(rina.address()).isEqualTo("TANA - Lot IVG 12 Analakely");
        assertThat(rina.cityToken()).isEqualTo("TANA");
        assertThat(rina.contactNumbers()).containsExactly("034 11 222 33", "020 22 333 44");

        RawListing gare = listings.get(1);
        assertThat(gare.name()).isEqualTo("Pharmacie de la Gare");
        assertThat(gare.cityToken()).isEqualTo("TAMATAVE");
        assertThat(gare.contactNumbers()).containsExactly("032 05 000 01", "033 07 000 02");
    }

    @Test
    void parse_keepsRowsWithoutBoldNameOrCitySeparator() throws IOException {
        List<RawListing> listings = parser.parse(fixture("fixtures/duty-page.html")).listings();

        RawListing unnamed = listings.get(2);
        assertThat(unnamed.name()).isEmpty();
        assertThat(unnamed.cityToken()).isEqualTo("DIEGO");
        assertThat(unnamed.isMatchable()).isFalse();

        RawListing noCity = listings.get(3);
        assertThat(noCity.name()).isEqualTo("Pharmacie Sans Ville");
        assertThat(noCity.cityToken()).isEmpty();
        assertThat(noCity.contactNumbers()).isEmpty();
    }

    @Test
    void parse_withoutTableStillExtractsPeriod() {
        String html = "<html><body><h1 class=\"text-center\">Pharmacies de garde du 05/01/2025 au 11/01/2025</h1>"
                + "<p>Aucune pharmacie de garde</p></body></html>";

        ParsedDutyPage page = parser.parse(html);

        assertThat(page.period()).isPresent();
        assertThat(page.listings()).isEmpty();
    }

    @Test
    void parse_tableWithoutBodyYieldsNoListings() {
        String html = "<h1 class=\"text-center\">du 05/01/2025 au 11/01/2025</h1>"
                + "<table id=\"datatable-buttons\"><thead><tr><th>Pharmacie</th></tr></thead></table>";

        // jsoup wraps bare rows in an implicit tbody, so only a head-only table has none
        assertThat(parser.parse(html).listings()).isEmpty();
    }

    @Test
    void parse_ignoresOtherTables() {
        String html = "<table id=\"other\"><tbody><tr><td><b>A</b></td><td>TANA - x</td><td>1</td></tr></tbody></table>";

        assertThat(parser.parse(html).listings()).isEmpty();
    }

    @Test
    void parse_missingTitleOrUnrecognizedPeriodIsAbsent() {
        assertThat(parser.parse("<html><body><p>maintenance</p></body></html>").period()).isEmpty();
        assertThat(parser.parse("<h1 class=\"text-center\">Pharmacies de garde de la semaine</h1>").period()).isEmpty();
        assertThat(parser.parse("<h1>du 05/01/2025 au 11/01/2025</h1>").period()).isEmpty();
    }

    @Test
    void parse_blankMarkupIsEmptyPage() {
        assertThat(parser.parse("   ")).isEqualTo(ParsedDutyPage.empty());
        assertThat(parser.parse(null)).isEqualTo(ParsedDutyPage.empty());
    }

    @Test
    void extractPeriod_parsesDayMonthYear() {
        assertThat(HtmlDutyPageParser.extractPeriod("Pharmacies de garde du 05/01/2025 au 11/01/2025"))
                .contains(new ValidityPeriod(LocalDate.of(2025, 1, 5), LocalDate.of(2025, 1, 11)));
        assertThat(HtmlDutyPageParser.extractPeriod("du 29/12/2024   au 04/01/2025"))
                .contains(new ValidityPeriod(LocalDate.of(2024, 12, 29), LocalDate.of(2025, 1, 4)));
    }

    @Test
    void extractPeriod_rejectsImpossibleDates() {
        assertThat(HtmlDutyPageParser.extractPeriod("du 31/02/2025 au 07/03/2025")).isEmpty();
        assertThat(HtmlDutyPageParser.extractPeriod("du 05/13/2025 au 11/01/2025")).isEmpty();
        assertThat(HtmlDutyPageParser.extractPeriod("du 5/1/2025 au 11/1/2025")).isEmpty();
    }

    @Test
    void cityToken_splitsOnFirstSeparatorOnly() {
        assertThat(HtmlDutyPageParser.cityToken("TANA - Analakely - Face BNI")).isEqualTo("TANA");
        assertThat(HtmlDutyPageParser.cityToken("Antsirabe-Centre")).isEmpty();
        assertThat(HtmlDutyPageParser.cityToken("")).isEmpty();
    }

    private static String fixture(String path) throws IOException {
        try (InputStream in = HtmlDutyPageParserTest.class.getClassLoader().getResourceAsStream(path)) {
            assertThat(in).as("fixture %s", path).isNotNull();
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}

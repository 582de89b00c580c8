package com.pharmanio.duty.parser;

import com.pharmanio.duty.ingestion.model.ParsedDutyPage;
import com.pharmanio.duty.ingestion.model.RawListing;
import com.pharmanio.duty.ingestion.model.ValidityPeriod;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.Elements;
import org.jsoup.select.NodeTraversor;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parser for the opham.com on-duty page: a centered {@code h1} carrying
 * "... du dd/mm/yyyy au dd/mm/yyyy" and a {@code #datatable-buttons} table with one pharmacy per row.
 */
@Slf4j
@Component
public class HtmlDutyPageParser implements DutyPageParser {

    private static final String TITLE_SELECTOR = "h1.text-center";
    private static final String TABLE_SELECTOR = "table#datatable-buttons";
    private static final String NAME_SELECTOR = "b, strong";

    // e.g. "Pharmacies de garde du 05/01/2025 au 11/01/2025"
    private static final Pattern DATE_RANGE = Pattern.compile("(\\d{2}/\\d{2}/\\d{4})\\s+au\\s+(\\d{2}/\\d{2}/\\d{4})");
    private static final DateTimeFormatter DAY_MONTH_YEAR = DateTimeFormatter.ofPattern("dd/MM/uuuu")
            .withResolverStyle(ResolverStyle.STRICT);

    private static final String CITY_SEPARATOR = " - ";
    private static final int MIN_CELLS = 3;

    @Override
    public ParsedDutyPage parse(String html) {
        if (html == null || html.isBlank()) {
            log.warn("Duty page is empty");
            return ParsedDutyPage.empty();
        }

        Document doc = Jsoup.parse(html);

        Element titleElement = doc.selectFirst(TITLE_SELECTOR);
        String title = titleElement == null ? "" : titleElement.text().trim();
        Optional<ValidityPeriod> period = extractPeriod(title);
        if (period.isEmpty()) {
            log.warn("No validity period recognized in title '{}'", title);
        }

        return new ParsedDutyPage(period, extractListings(doc));
    }

    static Optional<ValidityPeriod> extractPeriod(String title) {
        if (title == null) return Optional.empty();

        Matcher m = DATE_RANGE.matcher(title);
        if (!m.find()) return Optional.empty();

        try {
            LocalDate start = LocalDate.parse(m.group(1), DAY_MONTH_YEAR);
            LocalDate end = LocalDate.parse(m.group(2), DAY_MONTH_YEAR);
            return Optional.of(new ValidityPeriod(start, end));
        } catch (DateTimeParseException e) {
            log.warn("Invalid date in period '{}': {}", m.group(), e.getMessage());
            return Optional.empty();
        }
    }

    private List<RawListing> extractListings(Document doc) {
        Element table = doc.selectFirst(TABLE_SELECTOR);
        if (table == null) {
            log.info("Duty table not found on page");
            return List.of();
        }

        Element tbody = table.selectFirst("tbody");
        if (tbody == null) {
            log.info("Duty table has no body");
            return List.of();
        }

        List<RawListing> out = new ArrayList<>();
        for (Element row : tbody.select("tr")) {
            RawListing listing = parseRow(row);
            if (listing != null) out.add(listing);
        }
        return out;
    }

    static RawListing parseRow(Element row) {
        Elements cells = row.select("td");
        if (cells.size() < MIN_CELLS) return null;

        Element bold = cells.get(0).selectFirst(NAME_SELECTOR);
        String name = bold == null ? "" : bold.text().trim();

        String address = cells.get(1).text().trim();

        return new RawListing(name, address, cityToken(address), contactNumbers(cells.get(2)));
    }

    static String cityToken(String address) {
        int idx = address.indexOf(CITY_SEPARATOR);
        return idx < 0 ? "" : address.substring(0, idx).trim();
    }

    // one number per text run or line, blank lines dropped
    private static List<String> contactNumbers(Element cell) {
        StringBuilder text = new StringBuilder();
        NodeTraversor.traverse((node, depth) -> {
            if (node instanceof TextNode textNode) {
                if (text.length() > 0) text.append('\n');
                text.append(textNode.getWholeText());
            }
        }, cell);

        List<String> numbers = new ArrayList<>();
        for (String line : text.toString().split("\\R")) {
            String n = line.trim();
            if (!n.isEmpty()) numbers.add(n);
        }
        return numbers;
    }
}

package com.boxofficeintel.daily.service;

import com.boxofficeintel.daily.model.DailyRecord;
import com.boxofficeintel.daily.util.SourceUrls;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Parses a date page into DailyRecord rows.
 *
 * Columns are located by header text, so reordered or dropped columns only null out the
 * affected fields. A row survives as long as it has a title and a daily gross; anything else
 * missing is kept as null.
 *
 * Typical row:
 *   1 | 2 | Wicked | $4,012,345 | -21.3% | -45.0% | 3,888 | $1,032 | $312,445,123 | 38 | Universal
 */
@Component
@Slf4j
public class DailyReportParser {

    private static final Set<String> EMPTY_MARKERS = Set.of("", "-", "–", "—", "n/a", "na");

    public ParsedReport parse(LocalDate date, String html, String pageUrl) throws ReportParseException {
        Document doc = Jsoup.parse(html, pageUrl);
        Element table = findResultTable(doc);
        if (table == null) {
            throw new ReportParseException("no result table on page for " + date);
        }

        List<Element> rows = table.select("tr");
        Map<ReportColumn, Integer> columns = null;
        List<DailyRecord> records = new ArrayList<>();
        List<ParseReject> rejects = new ArrayList<>();
        int dataRow = 0;

        for (Element row : rows) {
            List<Element> headerCells = cellsOf(row, "th");
            List<Element> cells = cellsOf(row, "td");

            if (cells.isEmpty()) {
                if (columns == null && !headerCells.isEmpty()) {
                    columns = ReportColumn.fromHeaders(headerCells.stream().map(Element::text).toList());
                    log.debug("Header layout for {}: {}", date, columns);
                }
                continue;
            }
            if (columns == null) {
                log.debug("No header row for {}, using legacy column positions", date);
                columns = ReportColumn.legacyLayout();
            }

            int index = dataRow++;
            Element titleCell = cell(cells, columns, ReportColumn.RELEASE);
            String title = titleCell == null ? "" : titleCell.text().trim();
            Long gross = parseMoney(text(cells, columns, ReportColumn.DAILY_GROSS));

            if (title.isEmpty()) {
                reject(rejects, new ParseReject(date, index, title, ParseReject.Reason.MISSING_TITLE));
                continue;
            }
            if (gross == null) {
                reject(rejects, new ParseReject(date, index, title, ParseReject.Reason.MISSING_GROSS));
                continue;
            }

            records.add(DailyRecord.builder()
                    .date(date)
                    .sourceTitle(title)
                    .sourceUrl(canonicalUrl(titleCell))
                    .dailyGross(gross)
                    .yesterdayPctChange(parsePercent(text(cells, columns, ReportColumn.YESTERDAY_CHANGE)))
                    .lastWeekPctChange(parsePercent(text(cells, columns, ReportColumn.LAST_WEEK_CHANGE)))
                    .theaterCount(parseInt(text(cells, columns, ReportColumn.THEATERS)))
                    .perTheaterAvg(parseDecimal(text(cells, columns, ReportColumn.PER_THEATER_AVG)))
                    .cumulativeGross(parseMoney(text(cells, columns, ReportColumn.TO_DATE)))
                    .daysInRelease(parseInt(text(cells, columns, ReportColumn.DAYS)))
                    .rank(parseInt(text(cells, columns, ReportColumn.RANK)))
                    .distributor(emptyToNull(text(cells, columns, ReportColumn.DISTRIBUTOR)))
                    .build());
        }

        log.info("Parsed {}: {} records, {} rows dropped", date, records.size(), rejects.size());
        return new ParsedReport(date, records, rejects);
    }

    // ── Table location ────────────────────────────────────────────────────────

    /**
     * The result table is the first one whose header mentions a release column, or failing
     * that the first table holding any data cells.
     */
    private Element findResultTable(Document doc) {
        Element fallback = null;
        for (Element table : doc.select("table")) {
            boolean hasHeader = table.select("th").stream()
                    .anyMatch(th -> ReportColumn.fromHeaders(List.of(th.text())).containsKey(ReportColumn.RELEASE));
            if (hasHeader) return table;
            if (fallback == null && !table.select("td").isEmpty()) fallback = table;
        }
        return fallback;
    }

    private List<Element> cellsOf(Element row, String tag) {
        return row.children().stream().filter(e -> e.tagName().equals(tag)).toList();
    }

    private Element cell(List<Element> cells, Map<ReportColumn, Integer> columns, ReportColumn column) {
        Integer idx = columns.get(column);
        if (idx == null || idx >= cells.size()) return null;
        return cells.get(idx);
    }

    private String text(List<Element> cells, Map<ReportColumn, Integer> columns, ReportColumn column) {
        Element cell = cell(cells, columns, column);
        return cell == null ? null : cell.text().trim();
    }

    private void reject(List<ParseReject> rejects, ParseReject reject) {
        log.warn("Dropped row {} on {}: {} (title='{}')",
                reject.rowIndex(), reject.date(), reject.reason(), reject.title());
        rejects.add(reject);
    }

    // ── Value parsing ─────────────────────────────────────────────────────────

    /**
     * Absolute release link without query string or fragment, e.g.
     * "/release/rl123/?ref_=bo_da_table_1" → "https://www.boxofficemojo.com/release/rl123/"
     */
    static String canonicalUrl(Element titleCell) {
        if (titleCell == null) return null;
        Element link = titleCell.selectFirst("a[href]");
        if (link == null) return null;
        String absolute = link.absUrl("href");
        return SourceUrls.canonical(absolute.isBlank() ? link.attr("href") : absolute, null);
    }

    static Long parseMoney(String text) {
        BigDecimal value = decimal(text);
        if (value == null) return null;
        try {
            return value.setScale(0, RoundingMode.HALF_UP).longValueExact();
        } catch (ArithmeticException e) {
            return null;
        }
    }

    static Double parseDecimal(String text) {
        BigDecimal value = decimal(text);
        return value == null ? null : value.doubleValue();
    }

    static Double parsePercent(String text) {
        BigDecimal value = decimal(text);
        return value == null ? null : value.doubleValue();
    }

    static Integer parseInt(String text) {
        BigDecimal value = decimal(text);
        if (value == null) return null;
        try {
            return value.setScale(0, RoundingMode.HALF_UP).intValueExact();
        } catch (ArithmeticException e) {
            return null;
        }
    }

    private static BigDecimal decimal(String text) {
        if (text == null) return null;
        String cleaned = text.trim()
                .replace("$", "")
                .replace(",", "")
                .replace("%", "")
                .replace("+", "")
                .replace("<", "")
                .replace('−', '-');
        if (EMPTY_MARKERS.contains(cleaned.toLowerCase())) return null;
        try {
            return new BigDecimal(cleaned);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String emptyToNull(String val) {
        return (val == null || val.isBlank()) ? null : val;
    }
}

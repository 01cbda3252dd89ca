package com.boxofficeintel.daily.service;

import com.boxofficeintel.daily.model.DailyRecord;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

class DailyReportParserTest {

    private static final LocalDate DATE = LocalDate.of(2025, 1, 5);
    private static final String PAGE_URL = "https://www.boxofficemojo.com/date/2025-01-05/";

    private final DailyReportParser parser = new DailyReportParser();

    @Test
    void parsesHeaderedTableAndKeepsMissingValuesAsNull() throws Exception {
        ParsedReport report = parser.parse(DATE, fixture("date-2025-01-05.html"), PAGE_URL);

        assertThat(report.records()).extracting(DailyRecord::getSourceTitle)
                .containsExactly("Nosferatu", "Sonic the Hedgehog 3", "Wicked");

        DailyRecord nosferatu = report.records().get(0);
        assertThat(nosferatu.getDate()).isEqualTo(DATE);
        assertThat(nosferatu.getSourceUrl()).isEqualTo("https://www.boxofficemojo.com/release/rl1111/");
        assertThat(nosferatu.getDailyGross()).isEqualTo(4_012_345L);
        assertThat(nosferatu.getYesterdayPctChange()).isEqualTo(12.5);
        assertThat(nosferatu.getLastWeekPctChange()).isNull();
        assertThat(nosferatu.getTheaterCount()).isEqualTo(3265);
        assertThat(nosferatu.getPerTheaterAvg()).isEqualTo(1228.0);
        assertThat(nosferatu.getCumulativeGross()).isEqualTo(62_345_678L);
        assertThat(nosferatu.getDaysInRelease()).isEqualTo(11);
        assertThat(nosferatu.getRank()).isEqualTo(1);
        assertThat(nosferatu.getDistributor()).isEqualTo("Focus Features");

        DailyRecord sonic = report.records().get(1);
        assertThat(sonic.getYesterdayPctChange()).isEqualTo(-21.3);
        assertThat(sonic.getLastWeekPctChange()).isEqualTo(-45.0);

        DailyRecord wicked = report.records().get(2);
        assertThat(wicked.getSourceUrl()).isNull();
        assertThat(wicked.recordKey()).isEqualTo("title:wicked");
        assertThat(wicked.getYesterdayPctChange()).isNull();
        assertThat(wicked.getTheaterCount()).isNull();
        assertThat(wicked.getPerTheaterAvg()).isNull();
        assertThat(wicked.getCumulativeGross()).isEqualTo(400_000_000L);
    }

    @Test
    void rejectsRowsWithoutTitleOrGross() throws Exception {
        ParsedReport report = parser.parse(DATE, fixture("date-2025-01-05.html"), PAGE_URL);

        assertThat(report.rejects())
                .extracting(ParseReject::rowIndex, ParseReject::title, ParseReject::reason)
                .containsExactly(
                        tuple(2, "", ParseReject.Reason.MISSING_TITLE),
                        tuple(3, "Babygirl", ParseReject.Reason.MISSING_GROSS));
    }

    @Test
    void locatesColumnsByHeaderWhenReorderedOrRenamed() throws Exception {
        ParsedReport report = parser.parse(DATE, fixture("date-reordered-columns.html"), PAGE_URL);

        assertThat(report.records()).hasSize(1);
        DailyRecord record = report.records().get(0);
        assertThat(record.getSourceTitle()).isEqualTo("Den of Thieves 2: Pantera");
        assertThat(record.getSourceUrl()).isEqualTo("https://www.boxofficemojo.com/release/rl4444/");
        assertThat(record.getTheaterCount()).isEqualTo(2400);
        assertThat(record.getDailyGross()).isEqualTo(1_800_000L);
        assertThat(record.getRank()).isEqualTo(3);
        assertThat(record.getCumulativeGross()).isEqualTo(12_500_000L);
        // columns the page no longer carries
        assertThat(record.getPerTheaterAvg()).isNull();
        assertThat(record.getDaysInRelease()).isNull();
        assertThat(record.getYesterdayPctChange()).isNull();
        assertThat(record.getDistributor()).isNull();
    }

    @Test
    void fallsBackToLegacyPositionsWithoutHeaderRow() throws Exception {
        ParsedReport report = parser.parse(DATE, fixture("date-legacy-no-header.html"), PAGE_URL);

        assertThat(report.records())
                .extracting(DailyRecord::getSourceTitle, DailyRecord::getDailyGross, DailyRecord::getTheaterCount)
                .containsExactly(
                        tuple("Mufasa: The Lion King", 2_900_000L, 4100),
                        tuple("A Complete Unknown", 1_400_000L, 2835));
        assertThat(report.rejects()).isEmpty();
    }

    @Test
    void pageWithoutResultTableIsMalformed() {
        assertThatThrownBy(() -> parser.parse(DATE, fixture("date-blocked.html"), PAGE_URL))
                .isInstanceOf(ReportParseException.class)
                .hasMessageContaining("2025-01-05");
    }

    @Test
    void valueParsingToleratesSourceFormatting() {
        assertThat(DailyReportParser.parseMoney("$1,234,567")).isEqualTo(1_234_567L);
        assertThat(DailyReportParser.parseMoney("<$1")).isEqualTo(1L);
        assertThat(DailyReportParser.parseMoney("n/a")).isNull();
        assertThat(DailyReportParser.parsePercent("+12.5%")).isEqualTo(12.5);
        assertThat(DailyReportParser.parsePercent("−7%")).isEqualTo(-7.0);
        assertThat(DailyReportParser.parsePercent("-")).isNull();
        assertThat(DailyReportParser.parseInt("3,000")).isEqualTo(3000);
        assertThat(DailyReportParser.parseInt("many")).isNull();
        assertThat(DailyReportParser.parseDecimal("$1,032.50")).isEqualTo(1032.5);
    }

    static String fixture(String name) throws IOException {
        try (InputStream in = DailyReportParserTest.class.getResourceAsStream("/fixtures/" + name)) {
            if (in == null) throw new IOException("missing fixture " + name);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}

package com.boxofficeintel.daily.output;

import com.boxofficeintel.daily.model.CollectionCheckpoint;
import com.boxofficeintel.daily.model.CollectionRun;
import com.boxofficeintel.daily.model.DailyRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only store of raw daily records, per-date status and the run log.
 *
 * Every mutation that concerns a date (records + status + checkpoint) happens in one
 * transaction, so after a crash a date is either fully stored or not present at all.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class RawRecordStore {

    public static final String STATUS_STORED = "STORED";
    public static final String STATUS_SKIPPED = "SKIPPED";

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final CheckpointRepository checkpointRepository;

    public void ensureSchema() {
        log.info("Ensuring raw record schema exists...");

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS daily_records
            (
                record_date             TEXT NOT NULL,
                record_key              TEXT NOT NULL,
                source_title            TEXT NOT NULL,
                source_url              TEXT,
                daily_gross             INTEGER NOT NULL,
                yesterday_pct_change    REAL,
                last_week_pct_change    REAL,
                theater_count           INTEGER,
                per_theater_avg         REAL,
                cumulative_gross        INTEGER,
                days_in_release         INTEGER,
                list_rank               INTEGER,
                distributor             TEXT,
                PRIMARY KEY (record_date, record_key)
            )
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS collected_dates
            (
                report_date     TEXT PRIMARY KEY,
                status          TEXT NOT NULL,
                record_count    INTEGER NOT NULL,
                rejected_rows   INTEGER NOT NULL,
                detail          TEXT,
                completed_at    TEXT NOT NULL
            )
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS collection_runs
            (
                run_id              TEXT PRIMARY KEY,
                trigger_name        TEXT,
                range_start         TEXT,
                range_end           TEXT,
                started_at          TEXT NOT NULL,
                completed_at        TEXT,
                status              TEXT NOT NULL,
                dates_stored        INTEGER NOT NULL,
                dates_skipped       INTEGER NOT NULL,
                records_stored      INTEGER NOT NULL,
                movies_aggregated   INTEGER NOT NULL,
                unmatched_records   INTEGER NOT NULL,
                error_message       TEXT
            )
        """);

        checkpointRepository.ensureSchema();
        log.info("Raw record schema ready.");
    }

    /**
     * Stores one date's records and advances the checkpoint, atomically.
     *
     * Duplicate keys inside the batch keep their first occurrence. Keys already present in the
     * table are left untouched.
     *
     * @return number of rows actually inserted
     */
    public int append(LocalDate date, List<DailyRecord> records, int rejectedRows, CollectionCheckpoint next) {
        Map<String, DailyRecord> unique = new LinkedHashMap<>();
        for (DailyRecord record : records) {
            if (!date.equals(record.getDate())) {
                throw new IllegalArgumentException("Record for " + record.getDate() + " in batch for " + date);
            }
            DailyRecord first = unique.putIfAbsent(record.recordKey(), record);
            if (first != null) {
                log.warn("Duplicate key {} on {}: keeping '{}', dropping '{}'",
                        record.recordKey(), date, first.getSourceTitle(), record.getSourceTitle());
            }
        }

        Integer inserted = transactionTemplate.execute(status -> {
            // checkpoint first: its consistency check reads collected_dates
            checkpointRepository.save(next);
            int count = insertRecords(new ArrayList<>(unique.values()));
            upsertDateStatus(date, STATUS_STORED, count, rejectedRows, null);
            return count;
        });

        int written = inserted == null ? 0 : inserted;
        if (written < unique.size()) {
            log.warn("{}: {} of {} records were already stored", date, unique.size() - written, unique.size());
        }
        log.debug("Stored {} records for {}", written, date);
        return written;
    }

    /**
     * Records a date that could not be fetched and advances the checkpoint, atomically.
     * Already stored dates are never downgraded.
     */
    public void markSkipped(LocalDate date, String reason, CollectionCheckpoint next) {
        transactionTemplate.executeWithoutResult(status -> {
            checkpointRepository.save(next);
            if (!has(date)) {
                upsertDateStatus(date, STATUS_SKIPPED, 0, 0, reason);
            }
        });
    }

    public boolean has(LocalDate date) {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM collected_dates WHERE report_date = ? AND status = ?",
                Integer.class, date.toString(), STATUS_STORED);
        return count != null && count > 0;
    }

    public boolean isSkipped(LocalDate date) {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM collected_dates WHERE report_date = ? AND status = ?",
                Integer.class, date.toString(), STATUS_SKIPPED);
        return count != null && count > 0;
    }

    public List<LocalDate> skippedDates() {
        return jdbcTemplate.queryForList(
                        "SELECT report_date FROM collected_dates WHERE status = ? ORDER BY report_date",
                        String.class, STATUS_SKIPPED)
                .stream()
                .map(LocalDate::parse)
                .toList();
    }

    /** Every stored record, ordered by date then key. */
    public List<DailyRecord> loadAll() {
        return jdbcTemplate.query(
                "SELECT * FROM daily_records ORDER BY record_date, record_key", this::mapRow);
    }

    public List<DailyRecord> loadDate(LocalDate date) {
        return jdbcTemplate.query(
                "SELECT * FROM daily_records WHERE record_date = ? ORDER BY record_key",
                this::mapRow, date.toString());
    }

    public Map<String, Object> summary() {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("records", jdbcTemplate.queryForObject("SELECT COUNT(*) FROM daily_records", Long.class));
        summary.put("datesStored", countDates(STATUS_STORED));
        summary.put("datesSkipped", countDates(STATUS_SKIPPED));
        summary.put("firstDate", jdbcTemplate.queryForObject(
                "SELECT MIN(record_date) FROM daily_records", String.class));
        summary.put("lastDate", jdbcTemplate.queryForObject(
                "SELECT MAX(record_date) FROM daily_records", String.class));
        return summary;
    }

    public void writeRun(CollectionRun run) {
        try {
            jdbcTemplate.update("""
                INSERT OR REPLACE INTO collection_runs
                (run_id, trigger_name, range_start, range_end, started_at, completed_at, status,
                 dates_stored, dates_skipped, records_stored, movies_aggregated, unmatched_records, error_message)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """,
                    run.getRunId(),
                    run.getTrigger(),
                    str(run.getRangeStart()),
                    str(run.getRangeEnd()),
                    str(run.getStartedAt()),
                    str(run.getCompletedAt()),
                    run.getStatus(),
                    run.getDatesStored(),
                    run.getDatesSkipped(),
                    run.getRecordsStored(),
                    run.getMoviesAggregated(),
                    run.getUnmatchedRecords(),
                    run.getErrorMessage());
        } catch (Exception e) {
            log.warn("Failed to write collection run {}: {}", run.getRunId(), e.getMessage());
        }
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private int insertRecords(List<DailyRecord> records) {
        if (records.isEmpty()) return 0;
        List<Object[]> rows = records.stream().map(this::toRow).toList();
        int[] results = jdbcTemplate.batchUpdate("""
            INSERT OR IGNORE INTO daily_records
            (record_date, record_key, source_title, source_url, daily_gross, yesterday_pct_change,
             last_week_pct_change, theater_count, per_theater_avg, cumulative_gross, days_in_release,
             list_rank, distributor)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """, rows);
        int inserted = 0;
        for (int result : results) {
            if (result > 0) inserted += result;
        }
        return inserted;
    }

    private void upsertDateStatus(LocalDate date, String status, int recordCount, int rejectedRows, String detail) {
        jdbcTemplate.update("""
            INSERT OR REPLACE INTO collected_dates
            (report_date, status, record_count, rejected_rows, detail, completed_at)
            VALUES (?, ?, ?, ?, ?, ?)
            """,
                date.toString(), status, recordCount, rejectedRows, detail, LocalDateTime.now().toString());
    }

    private long countDates(String status) {
        Long count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM collected_dates WHERE status = ?", Long.class, status);
        return count == null ? 0L : count;
    }

    private Object[] toRow(DailyRecord r) {
        return new Object[]{
                r.getDate().toString(),
                r.recordKey(),
                r.getSourceTitle(),
                r.getSourceUrl(),
                r.getDailyGross(),
                r.getYesterdayPctChange(),
                r.getLastWeekPctChange(),
                r.getTheaterCount(),
                r.getPerTheaterAvg(),
                r.getCumulativeGross(),
                r.getDaysInRelease(),
                r.getRank(),
                r.getDistributor()
        };
    }

    private DailyRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
        return DailyRecord.builder()
                .date(LocalDate.parse(rs.getString("record_date")))
                .sourceTitle(rs.getString("source_title"))
                .sourceUrl(rs.getString("source_url"))
                .dailyGross(nullableLong(rs, "daily_gross"))
                .yesterdayPctChange(nullableDouble(rs, "yesterday_pct_change"))
                .lastWeekPctChange(nullableDouble(rs, "last_week_pct_change"))
                .theaterCount(nullableInt(rs, "theater_count"))
                .perTheaterAvg(nullableDouble(rs, "per_theater_avg"))
                .cumulativeGross(nullableLong(rs, "cumulative_gross"))
                .daysInRelease(nullableInt(rs, "days_in_release"))
                .rank(nullableInt(rs, "list_rank"))
                .distributor(rs.getString("distributor"))
                .build();
    }

    private static Long nullableLong(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }

    private static Integer nullableInt(ResultSet rs, String column) throws SQLException {
        int value = rs.getInt(column);
        return rs.wasNull() ? null : value;
    }

    private static Double nullableDouble(ResultSet rs, String column) throws SQLException {
        double value = rs.getDouble(column);
        return rs.wasNull() ? null : value;
    }

    private static String str(Object val) {
        return val == null ? null : val.toString();
    }
}

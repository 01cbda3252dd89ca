package com.boxofficeintel.daily.output;

import com.boxofficeintel.daily.model.CollectionCheckpoint;
import com.boxofficeintel.daily.service.CheckpointCorruptionException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Map;

/**
 * Single-row persistence of the collection checkpoint.
 *
 * save() is meant to run inside the store's per-date transaction so that records, date status
 * and checkpoint move together.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CheckpointRepository {

    private final JdbcTemplate jdbcTemplate;

    public void ensureSchema() {
        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS collection_checkpoint
            (
                id                          INTEGER PRIMARY KEY CHECK (id = 1),
                last_completed_date         TEXT,
                consecutive_failure_count   INTEGER NOT NULL,
                updated_at                  TEXT NOT NULL
            )
        """);
    }

    /**
     * @throws CheckpointCorruptionException if the row is unreadable, or missing while dates
     *                                       have already been collected
     */
    public CollectionCheckpoint load() {
        List<Map<String, Object>> rows = jdbcTemplate.queryForList(
                "SELECT last_completed_date, consecutive_failure_count FROM collection_checkpoint");

        if (rows.isEmpty()) {
            String latest = jdbcTemplate.queryForObject(
                    "SELECT MAX(report_date) FROM collected_dates", String.class);
            if (latest != null) {
                throw new CheckpointCorruptionException(
                        "Checkpoint missing although dates up to " + latest + " were collected");
            }
            return CollectionCheckpoint.initial();
        }
        if (rows.size() > 1) {
            throw new CheckpointCorruptionException("Expected one checkpoint row, found " + rows.size());
        }

        Map<String, Object> row = rows.get(0);
        Object rawDate = row.get("last_completed_date");
        Object rawCount = row.get("consecutive_failure_count");

        LocalDate lastCompleted;
        try {
            lastCompleted = rawDate == null ? null : LocalDate.parse(rawDate.toString());
        } catch (DateTimeParseException e) {
            throw new CheckpointCorruptionException("Unparseable checkpoint date: " + rawDate, e);
        }
        if (!(rawCount instanceof Number count) || count.intValue() < 0) {
            throw new CheckpointCorruptionException("Invalid consecutive failure count: " + rawCount);
        }
        return new CollectionCheckpoint(lastCompleted, count.intValue());
    }

    /**
     * @throws IllegalStateException if the new checkpoint would move the completed date backwards
     */
    public void save(CollectionCheckpoint next) {
        CollectionCheckpoint current = load();
        if (current.lastCompletedDate() != null
                && (next.lastCompletedDate() == null || next.lastCompletedDate().isBefore(current.lastCompletedDate()))) {
            throw new IllegalStateException("Checkpoint cannot move backwards from "
                    + current.lastCompletedDate() + " to " + next.lastCompletedDate());
        }
        write(next);
    }

    /**
     * Operator recovery: overwrite whatever is stored, bypassing the monotonic check.
     */
    public void reset(LocalDate lastCompleted) {
        log.warn("Resetting checkpoint to last_completed_date={}", lastCompleted);
        jdbcTemplate.update("DELETE FROM collection_checkpoint");
        write(new CollectionCheckpoint(lastCompleted, 0));
    }

    private void write(CollectionCheckpoint checkpoint) {
        jdbcTemplate.update("""
            INSERT OR REPLACE INTO collection_checkpoint
            (id, last_completed_date, consecutive_failure_count, updated_at)
            VALUES (1, ?, ?, ?)
            """,
                checkpoint.lastCompletedDate() == null ? null : checkpoint.lastCompletedDate().toString(),
                checkpoint.consecutiveFailureCount(),
                LocalDateTime.now().toString());
    }
}

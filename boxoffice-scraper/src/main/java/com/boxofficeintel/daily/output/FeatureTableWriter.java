package com.boxofficeintel.daily.output;

import com.boxofficeintel.daily.model.FeatureVector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Keeps the feature_vectors table in step with the latest aggregation pass.
 * A pass replaces the whole table in one transaction; rows are never patched.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class FeatureTableWriter {

    private static final int BATCH_SIZE = 500;

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;

    public void ensureSchema() {
        dropIfOutdated();
        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS feature_vectors
            (
                movie_id                    TEXT PRIMARY KEY,
                canonical_title             TEXT,
                opening_theaters            INTEGER,
                peak_theaters               INTEGER,
                mean_theaters               REAL,
                min_theaters                INTEGER,
                theater_expansion_ratio     REAL,
                theater_std_dev             REAL,
                week1_mean_theaters         REAL,
                opening_day_gross           INTEGER,
                peak_daily_gross            INTEGER,
                mean_daily_gross            REAL,
                daily_gross_std_dev         REAL,
                opening_per_theater         REAL,
                peak_per_theater            REAL,
                mean_per_theater            REAL,
                per_theater_std_dev         REAL,
                per_theater_slope           REAL,
                mean_yesterday_change       REAL,
                yesterday_change_std_dev    REAL,
                mean_last_week_change       REAL,
                last_week_change_std_dev    REAL,
                max_daily_gain              REAL,
                max_daily_drop              REAL,
                opening_3day_gross          INTEGER,
                opening_3day_per_theater    REAL,
                week1_mean_gross            REAL,
                week2_mean_gross            REAL,
                week2_week1_ratio           REAL,
                front_loading_ratio         REAL,
                last_cumulative_gross       INTEGER,
                max_days_in_release         INTEGER,
                observed_days               INTEGER NOT NULL,
                has_week2_data              INTEGER NOT NULL
            )
        """);
    }

    /** The table is derived data, so a layout from an older release is dropped and rebuilt. */
    private void dropIfOutdated() {
        List<String> existing = jdbcTemplate.query("PRAGMA table_info(feature_vectors)",
                (rs, rowNum) -> rs.getString("name"));
        Set<String> expected = FeatureVector.builder().build().asColumnMap().keySet();
        if (!existing.isEmpty() && !existing.containsAll(expected)) {
            log.warn("feature_vectors has an outdated layout; dropping it for the next aggregation pass");
            jdbcTemplate.execute("DROP TABLE feature_vectors");
        }
    }

    public void replaceAll(List<FeatureVector> vectors) {
        log.info("Replacing feature table with {} rows", vectors.size());
        transactionTemplate.executeWithoutResult(status -> {
            jdbcTemplate.update("DELETE FROM feature_vectors");
            if (vectors.isEmpty()) return;

            List<String> columns = new ArrayList<>(vectors.get(0).asColumnMap().keySet());
            String sql = "INSERT INTO feature_vectors (" + String.join(", ", columns) + ") VALUES ("
                    + columns.stream().map(c -> "?").collect(Collectors.joining(", ")) + ")";

            for (int i = 0; i < vectors.size(); i += BATCH_SIZE) {
                List<Object[]> batch = vectors.subList(i, Math.min(i + BATCH_SIZE, vectors.size())).stream()
                        .map(this::toRow)
                        .toList();
                jdbcTemplate.batchUpdate(sql, batch);
            }
        });
    }

    public int count() {
        Integer count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM feature_vectors", Integer.class);
        return count == null ? 0 : count;
    }

    private Object[] toRow(FeatureVector vector) {
        Map<String, Object> columns = vector.asColumnMap();
        return columns.values().stream()
                .map(v -> v instanceof Boolean b ? (b ? 1 : 0) : v)
                .toArray();
    }
}

package com.boxofficeintel.daily.model;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;

class CollectionCheckpointTest {

    private static final LocalDate JAN_5 = LocalDate.of(2025, 1, 5);

    @Test
    void initialHasNoDateAndNoFailures() {
        assertThat(CollectionCheckpoint.initial()).isEqualTo(new CollectionCheckpoint(null, 0));
    }

    @Test
    void firstDateBecomesLastCompleted() {
        assertThat(CollectionCheckpoint.initial().afterSuccess(JAN_5).lastCompletedDate()).isEqualTo(JAN_5);
    }

    @Test
    void skipCountsAndSuccessResets() {
        CollectionCheckpoint checkpoint = CollectionCheckpoint.initial()
                .afterSkip(JAN_5)
                .afterSkip(JAN_5.plusDays(1));
        assertThat(checkpoint).isEqualTo(new CollectionCheckpoint(JAN_5.plusDays(1), 2));

        assertThat(checkpoint.afterSuccess(JAN_5.plusDays(2)))
                .isEqualTo(new CollectionCheckpoint(JAN_5.plusDays(2), 0));
    }

    @Test
    void earlierDateNeverMovesCheckpointBack() {
        CollectionCheckpoint checkpoint = new CollectionCheckpoint(JAN_5, 3);

        assertThat(checkpoint.afterSuccess(JAN_5.minusDays(3)).lastCompletedDate()).isEqualTo(JAN_5);
        assertThat(checkpoint.afterSkip(JAN_5.minusDays(3))).isEqualTo(new CollectionCheckpoint(JAN_5, 4));
    }
}

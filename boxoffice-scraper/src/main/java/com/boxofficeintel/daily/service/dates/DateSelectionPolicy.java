package com.boxofficeintel.daily.service.dates;

import java.time.LocalDate;
import java.util.List;

/**
 * Chooses which report dates inside a range get fetched.
 */
public interface DateSelectionPolicy {

    /**
     * @return ascending, distinct dates within [start, end]; empty when end is before start
     */
    List<LocalDate> select(LocalDate start, LocalDate end);

    String name();
}

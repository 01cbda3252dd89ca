package com.boxofficeintel.daily.service.dates;

import com.boxofficeintel.daily.config.BoxOfficeProperties;

public final class DateSelectionPolicies {

    private DateSelectionPolicies() {
    }

    public static DateSelectionPolicy fromConfig(BoxOfficeProperties.Collection collection) {
        return switch (collection.getDatePolicy()) {
            case DAILY -> new DailyDatePolicy();
            case FIXED_INTERVAL -> new FixedIntervalDatePolicy(collection.getIntervalDays());
            case CALENDAR_AWARE -> new CalendarAwareDatePolicy();
        };
    }
}

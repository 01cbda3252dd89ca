package com.boxofficeintel.daily.service;

import com.boxofficeintel.daily.model.DailyRecord;

import java.time.LocalDate;
import java.util.List;

public record ParsedReport(LocalDate date, List<DailyRecord> records, List<ParseReject> rejects) {

    public ParsedReport {
        records = List.copyOf(records);
        rejects = List.copyOf(rejects);
    }
}

package com.dcruver.attendance.reporting;

import com.dcruver.attendance.ledger.AttendanceLedger;
import com.dcruver.attendance.ledger.AttendanceRecord;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only views over the ledger across date ranges.
 */
@Slf4j
public class ReportAggregator {

    private final AttendanceLedger ledger;
    private final int topN;

    public ReportAggregator(AttendanceLedger ledger, int topN) {
        if (topN < 1) {
            throw new IllegalArgumentException("topN must be >= 1, got " + topN);
        }
        this.ledger = ledger;
        this.topN = topN;
    }

    /**
     * Every record dated within {@code [start, end]}, by date then insertion order.
     * Only dates the store lists are read.
     */
    public List<AttendanceRecord> range(LocalDate start, LocalDate end) {
        List<AttendanceRecord> records = new ArrayList<>();
        for (LocalDate date : ledger.datesWithRecords(start, end)) {
            records.addAll(ledger.recordsOn(date));
        }
        log.debug("Collected {} records between {} and {}", records.size(), start, end);
        return records;
    }

    public AttendanceStats statistics(LocalDate start, LocalDate end) {
        List<AttendanceRecord> records = range(start, end);

        Map<LocalDate, Integer> dailyCounts = new LinkedHashMap<>();
        Map<String, Integer> perIdentity = new LinkedHashMap<>();
        Map<String, Integer> weekdays = new LinkedHashMap<>();

        for (AttendanceRecord record : records) {
            dailyCounts.merge(record.getDate(), 1, Integer::sum);
            perIdentity.merge(record.getLabel(), 1, Integer::sum);
            String weekday = record.getWeekday() != null ? record.getWeekday() : "Unknown";
            weekdays.merge(weekday, 1, Integer::sum);
        }

        int numberOfDays = dailyCounts.size();
        double average = numberOfDays > 0 ? (double) records.size() / numberOfDays : 0.0;

        return AttendanceStats.builder()
            .startDate(start)
            .endDate(end)
            .totalRecords(records.size())
            .uniqueIdentities(perIdentity.size())
            .numberOfDays(numberOfDays)
            .averageDailyAttendance(average)
            .dailyCounts(dailyCounts)
            .perIdentityCounts(perIdentity)
            .topIdentities(topIdentities(perIdentity))
            .weekdayDistribution(weekdays)
            .build();
    }

    // perIdentity iterates in first-seen order and the sort is stable, so ties keep that order
    private List<AttendanceStats.IdentityCount> topIdentities(Map<String, Integer> perIdentity) {
        return perIdentity.entrySet().stream()
            .sorted(Map.Entry.<String, Integer>comparingByValue(Comparator.reverseOrder()))
            .limit(topN)
            .map(e -> new AttendanceStats.IdentityCount(e.getKey(), e.getValue()))
            .toList();
    }
}

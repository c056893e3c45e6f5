package com.dcruver.attendance.reporting;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Summary of all records in a date range. Computed on demand, never stored.
 */
@Data
@Builder
public class AttendanceStats {
    private final LocalDate startDate;
    private final LocalDate endDate;

    private final int totalRecords;
    private final int uniqueIdentities;
    private final int numberOfDays;  // dates with at least one record
    private final double averageDailyAttendance;

    private final Map<LocalDate, Integer> dailyCounts;
    private final Map<String, Integer> perIdentityCounts;
    private final List<IdentityCount> topIdentities;
    private final Map<String, Integer> weekdayDistribution;

    @Data
    public static class IdentityCount {
        private final String label;
        private final int count;
    }
}

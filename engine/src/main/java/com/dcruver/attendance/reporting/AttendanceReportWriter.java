package com.dcruver.attendance.reporting;

import com.dcruver.attendance.ledger.AttendanceRecord;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Exports an Org-format attendance report for a date range.
 */
@Slf4j
public class AttendanceReportWriter {

    private static final DateTimeFormatter CREATED_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final ReportAggregator aggregator;
    private final Path reportsDir;
    private final Clock clock;

    public AttendanceReportWriter(ReportAggregator aggregator, Path reportsDir, Clock clock) {
        this.aggregator = aggregator;
        this.reportsDir = reportsDir;
        this.clock = clock;
    }

    /**
     * Generate and save the report, returning its path
     */
    public Path writeReport(LocalDate start, LocalDate end) throws IOException {
        List<AttendanceRecord> records = aggregator.range(start, end);
        AttendanceStats stats = aggregator.statistics(start, end);

        String filename = String.format("attendance-report-%s-to-%s.org", start, end);
        Path reportPath = reportsDir.resolve(filename);

        Files.createDirectories(reportsDir);
        Files.writeString(reportPath, buildReport(stats, records));
        log.info("Generated attendance report: {}", reportPath);

        return reportPath;
    }

    String buildReport(AttendanceStats stats, List<AttendanceRecord> records) {
        StringBuilder sb = new StringBuilder();

        // Header
        sb.append(":PROPERTIES:\n");
        sb.append(":ID:       ").append(UUID.randomUUID()).append("\n");
        sb.append(":CREATED:  [").append(CREATED_FORMAT.format(LocalDateTime.now(clock))).append("]\n");
        sb.append(":TAGS:     attendance report\n");
        sb.append(":END:\n");

        sb.append("* Attendance Report ").append(stats.getStartDate())
            .append(" to ").append(stats.getEndDate()).append("\n\n");

        // Summary
        sb.append("** Summary\n\n");
        sb.append(String.format("- Total records: %d\n", stats.getTotalRecords()));
        sb.append(String.format("- Unique identities: %d\n", stats.getUniqueIdentities()));
        sb.append(String.format("- Days with attendance: %d\n", stats.getNumberOfDays()));
        sb.append(String.format("- Average daily attendance: %.2f\n\n", stats.getAverageDailyAttendance()));

        if (records.isEmpty()) {
            sb.append("No attendance records in this range.\n");
            return sb.toString();
        }

        sb.append("** Daily Counts\n\n");
        for (Map.Entry<LocalDate, Integer> entry : stats.getDailyCounts().entrySet()) {
            sb.append(String.format("- %s: %d\n", entry.getKey(), entry.getValue()));
        }
        sb.append("\n");

        sb.append("** Top Attendees\n\n");
        int rank = 1;
        for (AttendanceStats.IdentityCount top : stats.getTopIdentities()) {
            sb.append(String.format("%d. %s (%d)\n", rank++, top.getLabel(), top.getCount()));
        }
        sb.append("\n");

        sb.append("** Day of Week\n\n");
        stats.getWeekdayDistribution().forEach((weekday, count) ->
            sb.append(String.format("- %s: %d\n", weekday, count)));
        sb.append("\n");

        sb.append("** Records\n\n");
        sb.append("| Name | Date | Time | Day | Status | Entry |\n");
        sb.append("|------+------+------+-----+--------+-------|\n");
        for (AttendanceRecord record : records) {
            sb.append(String.format("| %s | %s | %s | %s | %s | %s |\n",
                record.getLabel(),
                record.getDate(),
                record.getTime(),
                record.getWeekday(),
                record.getStatus(),
                record.getEntryKind().name().toLowerCase()));
        }

        return sb.toString();
    }
}

package com.dcruver.attendance.app;

import com.dcruver.attendance.domain.Embedding;
import com.dcruver.attendance.gallery.GalleryStats;
import com.dcruver.attendance.gallery.GalleryValidationReport;
import com.dcruver.attendance.gallery.OptimizationResult;
import com.dcruver.attendance.io.EmbeddingFileReader;
import com.dcruver.attendance.ledger.AttendanceRecord;
import com.dcruver.attendance.ledger.MarkResult;
import com.dcruver.attendance.ledger.SessionStats;
import com.dcruver.attendance.matcher.MatchResult;
import com.dcruver.attendance.matcher.RecognitionStatistics;
import com.dcruver.attendance.reporting.AttendanceStats;
import com.dcruver.attendance.service.AttendanceService;
import com.dcruver.attendance.service.CheckInResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.List;

/**
 * Spring Shell commands for the attendance engine.
 * Embeddings are read from JSON files written by the external extractor.
 */
@ShellComponent
@Slf4j
@RequiredArgsConstructor
public class AttendanceShellCommands {

    private final AttendanceService service;
    private final EmbeddingFileReader embeddingFileReader;

    @ShellMethod(key = "identity add", value = "Add embeddings from a JSON file under an identity")
    public String addIdentity(
            @ShellOption(value = "--label") String label,
            @ShellOption(value = "--file") String file) {
        try {
            List<Embedding> embeddings = embeddingFileReader.read(Path.of(file));
            service.addIdentity(label, embeddings);
            return String.format("Added %d embeddings for %s", embeddings.size(), label);
        } catch (Exception e) {
            log.error("Failed to add identity {}", label, e);
            return "Add identity failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = "identity remove", value = "Remove every embedding of an identity")
    public String removeIdentity(@ShellOption(value = "--label") String label) {
        try {
            int removed = service.removeIdentity(label);
            if (removed == 0) {
                return "No embeddings registered for " + label;
            }
            return String.format("Removed %d embeddings for %s", removed, label);
        } catch (Exception e) {
            log.error("Failed to remove identity {}", label, e);
            return "Remove identity failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = "recognize", value = "Recognize the embeddings in a JSON file")
    public String recognize(
            @ShellOption(value = "--file") String file,
            @ShellOption(value = "--tolerance", defaultValue = ShellOption.NULL) Double tolerance,
            @ShellOption(value = "--mark", defaultValue = "false") boolean mark) {
        try {
            List<Embedding> embeddings = embeddingFileReader.read(Path.of(file));
            double effective = tolerance != null ? tolerance : service.defaultTolerance();

            StringBuilder sb = new StringBuilder();
            if (mark) {
                for (Embedding embedding : embeddings) {
                    CheckInResult result = service.recognizeAndMark(embedding, effective);
                    sb.append(formatMatch(result.getMatch()));
                    if (result.getMark() != null) {
                        sb.append("  -> ").append(formatMark(result.getMark()));
                    }
                    sb.append("\n");
                }
            } else {
                for (MatchResult result : service.recognizeBatch(embeddings, effective)) {
                    sb.append(formatMatch(result)).append("\n");
                }
            }
            return sb.toString();
        } catch (Exception e) {
            log.error("Recognition failed", e);
            return "Recognition failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = "mark", value = "Mark an identity present (now, or at --at yyyy-MM-ddTHH:mm:ss)")
    public String mark(
            @ShellOption(value = "--label") String label,
            @ShellOption(value = "--at", defaultValue = ShellOption.NULL) String at) {
        try {
            MarkResult result = at != null
                ? service.markAttendance(label, LocalDateTime.parse(at))
                : service.markAttendance(label);
            return formatMark(result);
        } catch (Exception e) {
            log.error("Failed to mark attendance for {}", label, e);
            return "Mark failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = "manual", value = "Record a manual attendance entry")
    public String manual(
            @ShellOption(value = "--label") String label,
            @ShellOption(value = "--date") String date,
            @ShellOption(value = "--time") String time,
            @ShellOption(value = "--status", defaultValue = AttendanceRecord.PRESENT) String status) {
        try {
            AttendanceRecord record = service.manualAttendance(
                label, LocalDate.parse(date), LocalTime.parse(time), status);
            return String.format("Manual attendance recorded for %s on %s at %s (%s)",
                record.getLabel(), record.getDate(), record.getTime(), record.getStatus());
        } catch (Exception e) {
            log.error("Manual entry failed for {}", label, e);
            return "Manual entry failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = "today", value = "Show today's attendance records")
    public String today() {
        try {
            List<AttendanceRecord> records = service.todayAttendance();
            if (records.isEmpty()) {
                return "No attendance recorded today.";
            }
            return formatRecords(records) + String.format("\nTotal: %d records\n", records.size());
        } catch (Exception e) {
            log.error("Failed to read today's attendance", e);
            return "Failed to read today's attendance: " + e.getMessage();
        }
    }

    @ShellMethod(key = "history", value = "Show attendance history of an identity")
    public String history(
            @ShellOption(value = "--label") String label,
            @ShellOption(value = "--days", defaultValue = ShellOption.NULL) Integer days) {
        try {
            List<AttendanceRecord> records = days != null
                ? service.history(label, days)
                : service.history(label);
            if (records.isEmpty()) {
                return "No attendance history for " + label;
            }
            return formatRecords(records);
        } catch (Exception e) {
            log.error("Failed to read history for {}", label, e);
            return "Failed to read history: " + e.getMessage();
        }
    }

    @ShellMethod(key = "report list", value = "List attendance records between two dates (inclusive)")
    public String report(
            @ShellOption(value = "--from") String from,
            @ShellOption(value = "--to") String to) {
        try {
            List<AttendanceRecord> records = service.getReport(LocalDate.parse(from), LocalDate.parse(to));
            if (records.isEmpty()) {
                return String.format("No attendance records between %s and %s", from, to);
            }
            return formatRecords(records) + String.format("\nTotal: %d records\n", records.size());
        } catch (Exception e) {
            log.error("Report failed", e);
            return "Report failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = "report export", value = "Write an Org-format attendance report file")
    public String reportExport(
            @ShellOption(value = "--from") String from,
            @ShellOption(value = "--to") String to) {
        try {
            Path path = service.exportReport(LocalDate.parse(from), LocalDate.parse(to));
            return "Report written to: " + path;
        } catch (Exception e) {
            log.error("Report export failed", e);
            return "Report export failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = "stats", value = "Show attendance statistics between two dates (inclusive)")
    public String stats(
            @ShellOption(value = "--from") String from,
            @ShellOption(value = "--to") String to) {
        try {
            AttendanceStats stats = service.getStatistics(LocalDate.parse(from), LocalDate.parse(to));

            StringBuilder sb = new StringBuilder();
            sb.append(String.format("Attendance Statistics %s to %s\n\n", stats.getStartDate(), stats.getEndDate()));
            sb.append(String.format("- Total records: %d\n", stats.getTotalRecords()));
            sb.append(String.format("- Unique identities: %d\n", stats.getUniqueIdentities()));
            sb.append(String.format("- Days with attendance: %d\n", stats.getNumberOfDays()));
            sb.append(String.format("- Average daily attendance: %.2f\n", stats.getAverageDailyAttendance()));

            if (!stats.getTopIdentities().isEmpty()) {
                sb.append("\nTop attendees:\n");
                for (AttendanceStats.IdentityCount top : stats.getTopIdentities()) {
                    sb.append(String.format("  %s: %d\n", top.getLabel(), top.getCount()));
                }
            }
            if (!stats.getWeekdayDistribution().isEmpty()) {
                sb.append("\nBy weekday:\n");
                stats.getWeekdayDistribution().forEach((weekday, count) ->
                    sb.append(String.format("  %s: %d\n", weekday, count)));
            }
            return sb.toString();
        } catch (Exception e) {
            log.error("Statistics failed", e);
            return "Statistics failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = "gallery optimize", value = "Keep at most N embeddings per identity")
    public String optimize(@ShellOption(value = "--max", defaultValue = ShellOption.NULL) Integer max) {
        try {
            OptimizationResult result = max != null
                ? service.optimizeGallery(max)
                : service.optimizeGallery();
            return String.format("Optimized gallery: %d -> %d embeddings (%d removed)",
                result.getEmbeddingsBefore(), result.getEmbeddingsAfter(), result.getRemoved());
        } catch (Exception e) {
            log.error("Gallery optimization failed", e);
            return "Gallery optimization failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = "gallery validate", value = "Check gallery integrity")
    public String validate() {
        try {
            GalleryValidationReport report = service.validateGallery();

            StringBuilder sb = new StringBuilder();
            sb.append(String.format("Gallery is %s\n\n", report.isValid() ? "valid" : "INVALID"));
            sb.append(String.format("- Embeddings: %d\n", report.getTotalEmbeddings()));
            sb.append(String.format("- Identities: %d\n", report.getUniqueIdentities()));
            for (String error : report.getErrors()) {
                sb.append("ERROR: ").append(error).append("\n");
            }
            for (String warning : report.getWarnings()) {
                sb.append("WARNING: ").append(warning).append("\n");
            }
            return sb.toString();
        } catch (Exception e) {
            log.error("Gallery validation failed", e);
            return "Gallery validation failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = "gallery stats", value = "Show registered identities and embedding counts")
    public String galleryStats() {
        GalleryStats stats = service.galleryStats();

        StringBuilder sb = new StringBuilder();
        sb.append(String.format("Identities: %d\n", stats.getIdentityCount()));
        sb.append(String.format("Embeddings: %d\n\n", stats.getTotalEmbeddings()));
        stats.getEmbeddingsPerIdentity().forEach((label, count) ->
            sb.append(String.format("  %s: %d\n", label, count)));
        return sb.toString();
    }

    @ShellMethod(key = "recognition stats", value = "Show recognition counters since startup")
    public String recognitionStats() {
        RecognitionStatistics.Snapshot stats = service.recognitionStats();
        return String.format("""
            Recognitions: %d
            - Successful: %d (%.1f%%)
            - Unknown: %d (%.1f%%)
            - Average confidence: %.3f
            """,
            stats.getTotalRecognitions(),
            stats.getSuccessfulRecognitions(), stats.getSuccessRate(),
            stats.getUnknownFaces(), stats.getUnknownRate(),
            stats.getAverageConfidence());
    }

    @ShellMethod(key = "session stats", value = "Show check-in counters for this session")
    public String sessionStats() {
        SessionStats stats = service.sessionStats();
        return String.format("""
            Session started: %s (%.1f minutes ago)
            - Check-ins: %d
            - Duplicate attempts: %d
            - Identities marked today: %d
            """,
            stats.getSessionStart(), stats.getSessionDurationMinutes(),
            stats.getTotalCheckIns(),
            stats.getDuplicateAttempts(),
            stats.getTodayMarkedIdentities());
    }

    @ShellMethod(key = "backup", value = "Back up every attendance partition and the gallery")
    public String backup() {
        try {
            return "Backup written to: " + service.backup();
        } catch (Exception e) {
            log.error("Backup failed", e);
            return "Backup failed: " + e.getMessage();
        }
    }

    private String formatMatch(MatchResult result) {
        return String.format("%s (confidence %.3f)", result.getLabel(), result.getConfidence());
    }

    private String formatMark(MarkResult result) {
        AttendanceRecord record = result.getRecord();
        if (result.isSuccess()) {
            return String.format("Attendance marked for %s at %s (%d marked today)",
                record.getLabel(), record.getTime(), result.getTotalMarkedToday());
        }
        return String.format("%s already marked present at %s", record.getLabel(), result.getFirstCheckInTime());
    }

    private String formatRecords(List<AttendanceRecord> records) {
        StringBuilder sb = new StringBuilder();
        for (AttendanceRecord record : records) {
            sb.append(String.format("%s  %s  %-9s  %-20s  %-8s  %s\n",
                record.getDate(),
                record.getTime(),
                record.getWeekday(),
                record.getLabel(),
                record.getStatus(),
                record.getEntryKind().name().toLowerCase()));
        }
        return sb.toString();
    }
}

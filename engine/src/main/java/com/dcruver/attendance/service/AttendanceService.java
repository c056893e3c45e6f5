package com.dcruver.attendance.service;

import com.dcruver.attendance.config.AttendanceProperties;
import com.dcruver.attendance.domain.Embedding;
import com.dcruver.attendance.gallery.EmbeddingGallery;
import com.dcruver.attendance.gallery.GalleryStats;
import com.dcruver.attendance.gallery.GalleryValidationReport;
import com.dcruver.attendance.gallery.OptimizationResult;
import com.dcruver.attendance.io.LedgerBackupWriter;
import com.dcruver.attendance.ledger.AttendanceLedger;
import com.dcruver.attendance.ledger.AttendanceRecord;
import com.dcruver.attendance.ledger.MarkResult;
import com.dcruver.attendance.ledger.SessionStats;
import com.dcruver.attendance.matcher.FaceMatcher;
import com.dcruver.attendance.matcher.MatchResult;
import com.dcruver.attendance.matcher.RecognitionStatistics;
import com.dcruver.attendance.reporting.AttendanceReportWriter;
import com.dcruver.attendance.reporting.AttendanceStats;
import com.dcruver.attendance.reporting.ReportAggregator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.List;

/**
 * Entry point for every attendance operation.
 * Holds the gallery, ledger and reporting components for one application context.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AttendanceService {

    private final EmbeddingGallery gallery;
    private final FaceMatcher matcher;
    private final RecognitionStatistics recognitionStatistics;
    private final AttendanceLedger ledger;
    private final ReportAggregator reportAggregator;
    private final AttendanceReportWriter reportWriter;
    private final LedgerBackupWriter backupWriter;
    private final AttendanceProperties properties;

    // Gallery

    public void addIdentity(String label, List<Embedding> embeddings) {
        gallery.add(label, embeddings);
    }

    /**
     * @return embeddings removed; 0 when the label was not registered
     */
    public int removeIdentity(String label) {
        return gallery.remove(label);
    }

    public OptimizationResult optimizeGallery(int maxPerIdentity) {
        return gallery.optimize(maxPerIdentity);
    }

    public OptimizationResult optimizeGallery() {
        return optimizeGallery(properties.getMaxEmbeddingsPerIdentity());
    }

    public GalleryValidationReport validateGallery() {
        GalleryValidationReport report = gallery.validate();
        if (!report.isValid()) {
            log.warn("Gallery validation found {} errors", report.getErrors().size());
        }
        return report;
    }

    public GalleryStats galleryStats() {
        return gallery.stats();
    }

    // Recognition

    public MatchResult recognize(Embedding embedding, double tolerance) {
        MatchResult result = matcher.recognize(gallery, embedding, tolerance);
        recognitionStatistics.record(result);
        return result;
    }

    public MatchResult recognize(Embedding embedding) {
        return recognize(embedding, properties.getDefaultTolerance());
    }

    public List<MatchResult> recognizeBatch(List<Embedding> embeddings, double tolerance) {
        List<MatchResult> results = matcher.recognizeBatch(gallery, embeddings, tolerance);
        results.forEach(recognitionStatistics::record);
        return results;
    }

    /**
     * Recognize a face and, when it resolves to an identity, mark that identity present now
     */
    public CheckInResult recognizeAndMark(Embedding embedding, double tolerance) {
        MatchResult match = recognize(embedding, tolerance);
        if (!match.isKnown()) {
            log.debug("Unknown face (confidence {}), nothing marked", match.getConfidence());
            return new CheckInResult(match, null);
        }
        return new CheckInResult(match, ledger.mark(match.getLabel()));
    }

    public double defaultTolerance() {
        return properties.getDefaultTolerance();
    }

    public RecognitionStatistics.Snapshot recognitionStats() {
        return recognitionStatistics.snapshot();
    }

    // Ledger

    public MarkResult markAttendance(String label, LocalDateTime timestamp) {
        return ledger.mark(label, timestamp);
    }

    public MarkResult markAttendance(String label) {
        return ledger.mark(label);
    }

    public AttendanceRecord manualAttendance(String label, LocalDate date, LocalTime time, String status) {
        return ledger.manualEntry(label, date, time, status);
    }

    public List<AttendanceRecord> todayAttendance() {
        return ledger.todayRecords();
    }

    public List<AttendanceRecord> history(String label, int daysBack) {
        return ledger.history(label, daysBack);
    }

    public List<AttendanceRecord> history(String label) {
        return history(label, properties.getHistoryDaysBack());
    }

    public SessionStats sessionStats() {
        return ledger.sessionStats();
    }

    // Reporting

    public List<AttendanceRecord> getReport(LocalDate start, LocalDate end) {
        return reportAggregator.range(start, end);
    }

    public AttendanceStats getStatistics(LocalDate start, LocalDate end) {
        return reportAggregator.statistics(start, end);
    }

    public Path exportReport(LocalDate start, LocalDate end) throws IOException {
        return reportWriter.writeReport(start, end);
    }

    public Path backup() {
        return backupWriter.backup();
    }
}

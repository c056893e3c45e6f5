package com.dcruver.attendance.io;

import com.dcruver.attendance.domain.PersistenceException;
import com.dcruver.attendance.gallery.EmbeddingGallery;
import com.dcruver.attendance.ledger.AttendanceLedger;
import com.dcruver.attendance.ledger.AttendanceRecord;
import com.dcruver.attendance.ledger.LedgerStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Copies every stored partition and the gallery into a timestamped backup directory.
 * Works against the store contracts, so both file and SQLite storage are covered.
 */
@Slf4j
public class LedgerBackupWriter {

    private static final DateTimeFormatter TIMESTAMP_FORMAT =
        DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final LedgerStore ledgerStore;
    private final AttendanceLedger ledger;
    private final EmbeddingGallery gallery;
    private final ObjectMapper objectMapper;
    private final Path backupRoot;
    private final Clock clock;

    public LedgerBackupWriter(LedgerStore ledgerStore, AttendanceLedger ledger, EmbeddingGallery gallery,
                              ObjectMapper objectMapper, Path backupRoot, Clock clock) {
        this.ledgerStore = ledgerStore;
        this.ledger = ledger;
        this.gallery = gallery;
        this.objectMapper = objectMapper;
        this.backupRoot = backupRoot;
        this.clock = clock;
    }

    /**
     * Write the backup and return its directory
     */
    public Path backup() {
        LocalDateTime now = LocalDateTime.now(clock);
        Path backupDir = backupRoot.resolve("backup_" + TIMESTAMP_FORMAT.format(now));

        try {
            Files.createDirectories(backupDir);

            int partitions = 0;
            int records = 0;
            for (var date : ledgerStore.listPartitionDates()) {
                List<AttendanceRecord> partition = ledgerStore.readPartition(date);
                objectMapper.writerWithDefaultPrettyPrinter()
                    .writeValue(backupDir.resolve("attendance_" + date + ".json").toFile(), partition);
                partitions++;
                records += partition.size();
            }

            var snapshot = gallery.snapshot();
            objectMapper.writeValue(backupDir.resolve("gallery.json").toFile(), snapshot);

            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("backupDate", now);
            metadata.put("partitionsBackedUp", partitions);
            metadata.put("recordsBackedUp", records);
            metadata.put("galleryEmbeddings", snapshot.size());
            metadata.put("sessionStats", ledger.sessionStats());
            objectMapper.writerWithDefaultPrettyPrinter()
                .writeValue(backupDir.resolve("backup_metadata.json").toFile(), metadata);

            log.info("Backed up {} partitions ({} records) and {} embeddings to {}",
                partitions, records, snapshot.size(), backupDir);
            return backupDir;
        } catch (IOException e) {
            throw new PersistenceException("Failed to write backup to " + backupDir, e);
        }
    }
}

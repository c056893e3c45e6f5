package com.dcruver.attendance.config;

import com.dcruver.attendance.gallery.EmbeddingGallery;
import com.dcruver.attendance.gallery.GalleryStore;
import com.dcruver.attendance.io.EmbeddingFileReader;
import com.dcruver.attendance.io.JsonGalleryStore;
import com.dcruver.attendance.io.JsonLinesLedgerStore;
import com.dcruver.attendance.io.JsonMapping;
import com.dcruver.attendance.io.LedgerBackupWriter;
import com.dcruver.attendance.io.SqliteGalleryStore;
import com.dcruver.attendance.io.SqliteLedgerStore;
import com.dcruver.attendance.ledger.AttendanceLedger;
import com.dcruver.attendance.ledger.LedgerStore;
import com.dcruver.attendance.reporting.AttendanceReportWriter;
import com.dcruver.attendance.reporting.ReportAggregator;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.nio.file.Path;
import java.time.Clock;

/**
 * Wires the gallery, ledger and their stores from {@link AttendanceProperties}.
 *
 * The storage type decides which store implementations back the gallery and the ledger;
 * everything above the store contracts is identical for both.
 */
@Configuration
@Slf4j
public class EngineConfiguration {

    private final ObjectMapper objectMapper = JsonMapping.newObjectMapper();

    @Bean
    public Clock clock(AttendanceProperties properties) {
        return Clock.system(properties.zoneId());
    }

    @Bean
    public GalleryStore galleryStore(AttendanceProperties properties, DataSource dataSource) {
        return switch (properties.getStorage().getType()) {
            case FILE -> {
                Path dataDir = AttendanceProperties.resolvePath(properties.getStorage().getDataDir());
                log.info("Using JSON gallery store under {}", dataDir);
                yield new JsonGalleryStore(dataDir, objectMapper);
            }
            case SQLITE -> {
                log.info("Using SQLite gallery store");
                SqliteGalleryStore store = new SqliteGalleryStore(dataSource, objectMapper);
                store.init();
                yield store;
            }
        };
    }

    @Bean
    public LedgerStore ledgerStore(AttendanceProperties properties, DataSource dataSource) {
        return switch (properties.getStorage().getType()) {
            case FILE -> {
                Path dataDir = AttendanceProperties.resolvePath(properties.getStorage().getDataDir());
                log.info("Using JSON-lines attendance store under {}", dataDir);
                yield new JsonLinesLedgerStore(dataDir, objectMapper);
            }
            case SQLITE -> {
                log.info("Using SQLite attendance store");
                SqliteLedgerStore store = new SqliteLedgerStore(dataSource);
                store.init();
                yield store;
            }
        };
    }

    @Bean
    public EmbeddingGallery embeddingGallery(AttendanceProperties properties, GalleryStore galleryStore) {
        EmbeddingGallery gallery = new EmbeddingGallery(properties.getDimension(), galleryStore);
        gallery.load();
        return gallery;
    }

    @Bean
    public AttendanceLedger attendanceLedger(LedgerStore ledgerStore, Clock clock) {
        return new AttendanceLedger(ledgerStore, clock);
    }

    @Bean
    public ReportAggregator reportAggregator(AttendanceLedger ledger, AttendanceProperties properties) {
        return new ReportAggregator(ledger, properties.getTopN());
    }

    @Bean
    public AttendanceReportWriter attendanceReportWriter(ReportAggregator aggregator,
                                                         AttendanceProperties properties,
                                                         Clock clock) {
        return new AttendanceReportWriter(aggregator,
            AttendanceProperties.resolvePath(properties.getReportsDir()), clock);
    }

    @Bean
    public LedgerBackupWriter ledgerBackupWriter(LedgerStore ledgerStore,
                                                 AttendanceLedger ledger,
                                                 EmbeddingGallery gallery,
                                                 AttendanceProperties properties,
                                                 Clock clock) {
        return new LedgerBackupWriter(ledgerStore, ledger, gallery, objectMapper,
            AttendanceProperties.resolvePath(properties.getBackupDir()), clock);
    }

    @Bean
    public EmbeddingFileReader embeddingFileReader() {
        return new EmbeddingFileReader(objectMapper);
    }
}
